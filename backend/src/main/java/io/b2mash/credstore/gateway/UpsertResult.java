package io.b2mash.credstore.gateway;

import java.util.List;

/**
 * Outcome of a write or rollback.
 *
 * @param created true when the write created the secret
 * @param prunedVersions versions removed by retention as a consequence of this write
 */
public record UpsertResult(
    String secretId,
    String secretTypeId,
    int version,
    boolean created,
    String backendId,
    List<Integer> prunedVersions) {}
