package io.b2mash.credstore.exception;

/**
 * The caller's expected version no longer matches the record, or another writer reserved the same
 * version first. The caller should re-read and retry.
 */
public class ConcurrentSecretModificationException extends CredentialStoreException {

  public ConcurrentSecretModificationException(String secretId, Integer expected, int actual) {
    super(
        ErrorKind.CONCURRENT_MODIFICATION,
        "Concurrent modification",
        "Secret "
            + secretId
            + " is at version "
            + actual
            + (expected != null ? ", expected " + expected : "")
            + ". Please retry.");
    getBody().setProperty("currentVersion", actual);
  }

  public ConcurrentSecretModificationException(String detail) {
    super(ErrorKind.CONCURRENT_MODIFICATION, "Concurrent modification", detail);
  }
}
