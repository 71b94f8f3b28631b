package io.b2mash.credstore.quota;

/** Rate-limited request classes. */
public enum RequestKind {
  READ,
  WRITE
}
