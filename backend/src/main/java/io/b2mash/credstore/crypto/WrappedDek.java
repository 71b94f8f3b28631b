package io.b2mash.credstore.crypto;

/** A DEK wrapped by one KEK version. Produced by the re-wrap step. */
public record WrappedDek(byte[] wrappedDek, KekRef kekRef) {

  @Override
  public String toString() {
    return "WrappedDek[kekRef=" + kekRef + "]";
  }
}
