package io.b2mash.credstore.exception;

import org.springframework.http.HttpStatus;

/** Stable, machine-readable error kinds surfaced to callers and recorded in the audit log. */
public enum ErrorKind {
  PLUGIN_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
  DECRYPTION_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR),
  KEK_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR),
  QUOTA_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS),
  SECRET_TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE),
  INVALID_SECRET_TYPE(HttpStatus.BAD_REQUEST),
  CONCURRENT_MODIFICATION(HttpStatus.CONFLICT),
  FORBIDDEN(HttpStatus.FORBIDDEN),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  VALIDATION_FAILED(HttpStatus.BAD_REQUEST);

  private final HttpStatus status;

  ErrorKind(HttpStatus status) {
    this.status = status;
  }

  public HttpStatus getStatus() {
    return status;
  }

  /** The code written to problem details and audit entries. */
  public String code() {
    return name();
  }
}
