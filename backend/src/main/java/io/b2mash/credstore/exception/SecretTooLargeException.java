package io.b2mash.credstore.exception;

public class SecretTooLargeException extends CredentialStoreException {

  public SecretTooLargeException(int size, int limit) {
    super(
        ErrorKind.SECRET_TOO_LARGE,
        "Secret too large",
        "Secret payload of " + size + " bytes exceeds the tenant limit of " + limit + " bytes");
    getBody().setProperty("limit", limit);
  }
}
