package io.b2mash.credstore.exception;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base for every error the credential store reports to callers. Carries an RFC 7807 problem whose
 * {@code code} property is the stable {@link ErrorKind}. Details must never contain secret
 * plaintext, ciphertext or key material.
 */
public abstract class CredentialStoreException extends ErrorResponseException {

  private final ErrorKind kind;

  protected CredentialStoreException(ErrorKind kind, String title, String detail) {
    this(kind, title, detail, null);
  }

  protected CredentialStoreException(
      ErrorKind kind, String title, String detail, Throwable cause) {
    super(kind.getStatus(), createProblem(kind, title, detail), cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  @Override
  public String getMessage() {
    return kind.code() + ": " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(ErrorKind kind, String title, String detail) {
    var problem = ProblemDetail.forStatus(kind.getStatus());
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", kind.code());
    return problem;
  }
}
