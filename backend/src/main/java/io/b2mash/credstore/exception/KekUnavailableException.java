package io.b2mash.credstore.exception;

public class KekUnavailableException extends CredentialStoreException {

  public KekUnavailableException(String detail) {
    super(ErrorKind.KEK_UNAVAILABLE, "Key encryption key unavailable", detail);
  }

  public KekUnavailableException(String detail, Throwable cause) {
    super(ErrorKind.KEK_UNAVAILABLE, "Key encryption key unavailable", detail, cause);
  }
}
