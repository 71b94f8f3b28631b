package io.b2mash.credstore.versioning;

import java.util.List;

/**
 * Result of committing a new version.
 *
 * @param pruned versions removed by retention; their blobs are still to be deleted
 */
public record VersionCommit(String secretId, int version, List<PrunedVersion> pruned) {

  /** A pruned version and the backend instance that stored its blob. */
  public record PrunedVersion(int version, String backendId) {}
}
