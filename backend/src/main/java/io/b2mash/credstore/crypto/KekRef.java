package io.b2mash.credstore.crypto;

import java.util.Objects;

/**
 * Reference to one KEK version within a scope. Persisted on every blob next to the wrapped DEK.
 *
 * @param scope {@code global} or a tenant id, depending on the configured scope mode
 * @param version monotonically increasing per scope, starting at 1
 */
public record KekRef(String scope, int version) {

  public KekRef {
    Objects.requireNonNull(scope, "scope");
    if (version < 1) {
      throw new IllegalArgumentException("KEK version must be >= 1, got " + version);
    }
  }

  @Override
  public String toString() {
    return scope + ":v" + version;
  }
}
