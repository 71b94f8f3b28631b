package io.b2mash.credstore.gateway;

import io.b2mash.credstore.versioning.SecretRecord;
import java.time.Instant;
import java.util.UUID;

/** Listing entry; carries no secret material. */
public record SecretSummary(
    String secretId,
    String secretTypeId,
    int currentVersion,
    UUID userId,
    Instant createdAt,
    Instant updatedAt) {

  static SecretSummary from(SecretRecord record) {
    return new SecretSummary(
        record.getSecretId(),
        record.getSecretTypeId(),
        record.getCurrentVersion(),
        record.getUserId(),
        record.getCreatedAt(),
        record.getUpdatedAt());
  }
}
