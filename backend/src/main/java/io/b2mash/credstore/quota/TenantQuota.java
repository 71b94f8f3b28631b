package io.b2mash.credstore.quota;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A tenant's quota ceilings plus the live secret count, updated under a row lock. */
@Entity
@Table(name = "tenant_quotas")
public class TenantQuota {

  @Id
  @Column(name = "tenant_id")
  private UUID tenantId;

  @Column(name = "max_secrets", nullable = false)
  private int maxSecrets;

  @Column(name = "max_payload_bytes", nullable = false)
  private int maxPayloadBytes;

  @Column(name = "max_versions", nullable = false)
  private int maxVersions;

  @Column(name = "writes_per_minute", nullable = false)
  private int writesPerMinute;

  @Column(name = "reads_per_minute", nullable = false)
  private int readsPerMinute;

  @Column(name = "audit_retention_days")
  private Integer auditRetentionDays;

  @Column(name = "secret_count", nullable = false)
  private int secretCount;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TenantQuota() {}

  TenantQuota(UUID tenantId, QuotaLimits limits) {
    this.tenantId = tenantId;
    apply(limits);
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  void apply(QuotaLimits limits) {
    this.maxSecrets = limits.maxSecrets();
    this.maxPayloadBytes = limits.maxPayloadBytes();
    this.maxVersions = limits.maxVersions();
    this.writesPerMinute = limits.writesPerMinute();
    this.readsPerMinute = limits.readsPerMinute();
    this.auditRetentionDays = limits.auditRetentionDays();
  }

  boolean hasSecretCapacity() {
    return secretCount < maxSecrets;
  }

  void incrementSecretCount() {
    secretCount++;
  }

  void decrementSecretCount() {
    if (secretCount > 0) {
      secretCount--;
    }
  }

  public QuotaLimits limits() {
    return new QuotaLimits(
        maxSecrets,
        maxPayloadBytes,
        maxVersions,
        writesPerMinute,
        readsPerMinute,
        auditRetentionDays);
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public int getSecretCount() {
    return secretCount;
  }

  public Integer getAuditRetentionDays() {
    return auditRetentionDays;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
