package io.b2mash.credstore.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;

/** Authenticated encryption primitives shared by payload sealing, DEK wrapping and KEK storage. */
final class Aead {

  private Aead() {}

  static byte[] newNonce(SecureRandom random) {
    byte[] nonce = new byte[CipherAlgorithm.NONCE_LENGTH];
    random.nextBytes(nonce);
    return nonce;
  }

  static byte[] encrypt(
      CipherAlgorithm algorithm, SecretKey key, byte[] nonce, byte[] plaintext, byte[] aad)
      throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(algorithm.transformation());
    cipher.init(Cipher.ENCRYPT_MODE, key, algorithm.parameterSpec(nonce));
    cipher.updateAAD(aad);
    return cipher.doFinal(plaintext);
  }

  static byte[] decrypt(
      CipherAlgorithm algorithm, SecretKey key, byte[] nonce, byte[] ciphertext, byte[] aad)
      throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(algorithm.transformation());
    cipher.init(Cipher.DECRYPT_MODE, key, algorithm.parameterSpec(nonce));
    cipher.updateAAD(aad);
    return cipher.doFinal(ciphertext);
  }

  /** Encrypts with a fresh nonce and returns {@code nonce || ciphertext}. */
  static byte[] box(SecretKey key, byte[] plaintext, byte[] aad, SecureRandom random)
      throws GeneralSecurityException {
    byte[] nonce = newNonce(random);
    byte[] ciphertext = encrypt(CipherAlgorithm.AES_256_GCM, key, nonce, plaintext, aad);
    byte[] boxed = new byte[nonce.length + ciphertext.length];
    System.arraycopy(nonce, 0, boxed, 0, nonce.length);
    System.arraycopy(ciphertext, 0, boxed, nonce.length, ciphertext.length);
    return boxed;
  }

  /** Reverses {@link #box}. */
  static byte[] unbox(SecretKey key, byte[] boxed, byte[] aad) throws GeneralSecurityException {
    if (boxed.length <= CipherAlgorithm.NONCE_LENGTH) {
      throw new GeneralSecurityException("Boxed value too short");
    }
    byte[] nonce = Arrays.copyOfRange(boxed, 0, CipherAlgorithm.NONCE_LENGTH);
    byte[] ciphertext = Arrays.copyOfRange(boxed, CipherAlgorithm.NONCE_LENGTH, boxed.length);
    return decrypt(CipherAlgorithm.AES_256_GCM, key, nonce, ciphertext, aad);
  }
}
