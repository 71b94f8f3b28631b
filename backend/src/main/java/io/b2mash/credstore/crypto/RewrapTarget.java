package io.b2mash.credstore.crypto;

import java.util.List;
import java.util.UUID;

/**
 * Storage that keeps DEKs wrapped by {@link CryptoEngine}. Implemented by every locally encrypting
 * backend so the re-wrap job can move its blobs off deprecated KEKs.
 */
public interface RewrapTarget {

  /** Name used in logs. */
  String rewrapTargetName();

  /** Up to {@code limit} blobs still wrapped by {@code ref}, oldest first. */
  List<RewrapCandidate> findReferencing(KekRef ref, int limit);

  /**
   * Atomically swaps the wrapped DEK of one blob, but only while it still references {@code
   * expected}.
   *
   * @return false when the blob was rewritten or deleted concurrently
   */
  boolean replaceWrappedDek(UUID blobId, KekRef expected, WrappedDek replacement);

  long countReferencing(KekRef ref);
}
