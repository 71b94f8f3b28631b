package io.b2mash.credstore.versioning;

/** A version is PENDING from reservation until its blob is written, then COMMITTED. */
public enum VersionStatus {
  PENDING,
  COMMITTED
}
