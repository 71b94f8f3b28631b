package io.b2mash.credstore.exception;

public class InvalidSecretTypeException extends CredentialStoreException {

  public InvalidSecretTypeException(String detail) {
    super(ErrorKind.INVALID_SECRET_TYPE, "Invalid secret type", detail);
  }

  public InvalidSecretTypeException(String detail, Throwable cause) {
    super(ErrorKind.INVALID_SECRET_TYPE, "Invalid secret type", detail, cause);
  }
}
