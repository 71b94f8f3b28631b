package io.b2mash.credstore.exception;

public class ValidationFailedException extends CredentialStoreException {

  public ValidationFailedException(String detail) {
    super(ErrorKind.VALIDATION_FAILED, "Validation failed", detail);
  }

  public ValidationFailedException(String detail, Throwable cause) {
    super(ErrorKind.VALIDATION_FAILED, "Validation failed", detail, cause);
  }
}
