package io.b2mash.credstore.crypto;

import java.util.UUID;

/** A stored blob whose DEK is wrapped by a KEK that is about to be retired. */
public record RewrapCandidate(UUID blobId, byte[] wrappedDek, KekRef kekRef) {

  @Override
  public String toString() {
    return "RewrapCandidate[blobId=" + blobId + ", kekRef=" + kekRef + "]";
  }
}
