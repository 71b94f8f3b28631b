package io.b2mash.credstore.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Serialized shape of one audit entry in exports. */
public record AuditEntryView(
    UUID id,
    UUID tenantId,
    String actorId,
    AuditOperation operation,
    String secretId,
    String secretTypeId,
    AuditOutcome outcome,
    String errorCode,
    String traceId,
    Map<String, Object> details,
    Instant occurredAt) {

  public static AuditEntryView from(AuditLogEntry entry) {
    return new AuditEntryView(
        entry.getId(),
        entry.getTenantId(),
        entry.getActorId(),
        entry.getOperation(),
        entry.getSecretId(),
        entry.getSecretTypeId(),
        entry.getOutcome(),
        entry.getErrorCode(),
        entry.getTraceId(),
        entry.getDetails(),
        entry.getOccurredAt());
  }
}
