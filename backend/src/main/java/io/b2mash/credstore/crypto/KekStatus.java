package io.b2mash.credstore.crypto;

/**
 * Lifecycle of a key encryption key. The read path and the re-wrap job both consult this single
 * status to decide whether a KEK may still unwrap DEKs.
 */
public enum KekStatus {
  /** Wraps new DEKs and unwraps existing ones. Exactly one per scope. */
  ACTIVE,
  /** Superseded by a rotation; still unwraps until every blob has been re-wrapped. */
  DEPRECATED,
  /** Retired. Only allowed once no blob references it; never unwraps. */
  REVOKED;

  public boolean canUnwrap() {
    return this != REVOKED;
  }
}
