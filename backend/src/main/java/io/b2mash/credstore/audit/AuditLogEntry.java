package io.b2mash.credstore.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable audit entry persisted to {@code audit_log}. No setters and no {@code updatedAt}; the
 * only deletion path is the retention sweep.
 *
 * @see AuditEntryRecord
 */
@Entity
@Table(name = "audit_log")
public class AuditLogEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", updatable = false)
  private UUID tenantId;

  @Column(name = "actor_id", nullable = false, updatable = false, length = 200)
  private String actorId;

  @Enumerated(EnumType.STRING)
  @Column(name = "operation", nullable = false, updatable = false, length = 40)
  private AuditOperation operation;

  @Column(name = "secret_id", updatable = false, length = 200)
  private String secretId;

  @Column(name = "secret_type_id", updatable = false, length = 100)
  private String secretTypeId;

  @Enumerated(EnumType.STRING)
  @Column(name = "outcome", nullable = false, updatable = false, length = 10)
  private AuditOutcome outcome;

  @Column(name = "error_code", updatable = false, length = 40)
  private String errorCode;

  @Column(name = "trace_id", nullable = false, updatable = false, length = 100)
  private String traceId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", updatable = false, columnDefinition = "jsonb")
  private Map<String, Object> details;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected AuditLogEntry() {}

  /** Creates an entry from the record, stamped with the current instant. */
  public AuditLogEntry(AuditEntryRecord record) {
    this.tenantId = record.tenantId();
    this.actorId = record.actorId();
    this.operation = record.operation();
    this.secretId = record.secretId();
    this.secretTypeId = record.secretTypeId();
    this.outcome = record.outcome();
    this.errorCode = record.errorCode();
    this.traceId = record.traceId();
    this.details = record.details();
    this.occurredAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public String getActorId() {
    return actorId;
  }

  public AuditOperation getOperation() {
    return operation;
  }

  public String getSecretId() {
    return secretId;
  }

  public String getSecretTypeId() {
    return secretTypeId;
  }

  public AuditOutcome getOutcome() {
    return outcome;
  }

  public String getErrorCode() {
    return errorCode;
  }

  public String getTraceId() {
    return traceId;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
