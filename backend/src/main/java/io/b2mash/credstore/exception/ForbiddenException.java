package io.b2mash.credstore.exception;

public class ForbiddenException extends CredentialStoreException {

  public ForbiddenException(String detail) {
    super(ErrorKind.FORBIDDEN, "Access denied", detail);
  }

  public ForbiddenException(String detail, Throwable cause) {
    super(ErrorKind.FORBIDDEN, "Access denied", detail, cause);
  }
}
