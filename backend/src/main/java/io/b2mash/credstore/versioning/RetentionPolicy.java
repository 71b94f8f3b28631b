package io.b2mash.credstore.versioning;

/**
 * How many versions of a secret to keep, and for how long.
 *
 * @param maxVersions retained versions including the current one; 1 keeps only the current
 * @param retentionDays versions older than this are pruned; null disables age-based pruning
 */
public record RetentionPolicy(int maxVersions, Integer retentionDays) {

  public RetentionPolicy {
    if (maxVersions < 1) {
      throw new IllegalArgumentException("maxVersions must be >= 1, got " + maxVersions);
    }
  }

  /**
   * Keeps only the newest version. The version counter still advances on every write, so
   * expected-version checks behave the same as for versioned types.
   */
  public static RetentionPolicy currentOnly() {
    return new RetentionPolicy(1, null);
  }
}
