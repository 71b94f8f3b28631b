package io.b2mash.credstore.crypto;

/**
 * Output of {@link CryptoEngine#seal}: everything needed to decrypt later, none of it plaintext.
 *
 * @param algorithm cipher the payload was sealed with
 * @param ciphertext payload ciphertext with the authentication tag appended
 * @param nonce per-seal nonce
 * @param wrappedDek the DEK encrypted under {@code kekRef}
 * @param kekRef KEK version that wrapped the DEK
 */
public record SealedSecret(
    CipherAlgorithm algorithm, byte[] ciphertext, byte[] nonce, byte[] wrappedDek, KekRef kekRef) {

  @Override
  public String toString() {
    return "SealedSecret[algorithm="
        + algorithm
        + ", ciphertextLength="
        + ciphertext.length
        + ", kekRef="
        + kekRef
        + "]";
  }
}
