package io.b2mash.credstore.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#record}. Built by {@link AuditEntryBuilder}.
 *
 * @param tenantId tenant the access was scoped to; null for a caller without tenant
 * @param actorId identity of the caller as asserted upstream
 * @param secretId target secret, when the operation has one
 * @param errorCode stable error kind on failure, null on success
 * @param traceId correlation id of the originating request
 * @param details identifiers and counts only, never secret values
 */
public record AuditEntryRecord(
    UUID tenantId,
    String actorId,
    AuditOperation operation,
    String secretId,
    String secretTypeId,
    AuditOutcome outcome,
    String errorCode,
    String traceId,
    Map<String, Object> details) {}
