package io.b2mash.credstore.exception;

/** Thrown when a tenant ceiling (secret count, request rate) would be crossed. */
public class QuotaExceededException extends CredentialStoreException {

  private final String quota;

  public QuotaExceededException(String quota, String detail) {
    super(ErrorKind.QUOTA_EXCEEDED, "Quota exceeded", detail);
    this.quota = quota;
    getBody().setProperty("quota", quota);
  }

  public String getQuota() {
    return quota;
  }
}
