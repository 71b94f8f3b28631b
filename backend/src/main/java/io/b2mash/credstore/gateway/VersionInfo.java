package io.b2mash.credstore.gateway;

import io.b2mash.credstore.versioning.SecretVersion;
import java.time.Instant;
import java.util.Map;

public record VersionInfo(
    int version,
    boolean current,
    Map<String, Object> parameters,
    String backendId,
    String createdBy,
    Instant createdAt) {

  static VersionInfo from(SecretVersion version, int currentVersion) {
    return new VersionInfo(
        version.getVersion(),
        version.getVersion() == currentVersion,
        version.getParameters(),
        version.getBackendId(),
        version.getCreatedBy(),
        version.getCreatedAt());
  }
}
