package io.b2mash.credstore.exception;

/**
 * Ciphertext could not be authenticated: corrupt data, wrong key or an AAD mismatch. Never
 * retried.
 */
public class DecryptionFailureException extends CredentialStoreException {

  public DecryptionFailureException(String detail) {
    super(ErrorKind.DECRYPTION_FAILURE, "Decryption failed", detail);
  }

  public DecryptionFailureException(String detail, Throwable cause) {
    super(ErrorKind.DECRYPTION_FAILURE, "Decryption failed", detail, cause);
  }
}
