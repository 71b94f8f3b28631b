package io.b2mash.credstore.versioning;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One content snapshot of a {@link SecretRecord}. {@code (record_id, version)} is unique; inserting
 * the PENDING row is how a writer claims the next version number.
 */
@Entity
@Table(name = "secret_versions")
public class SecretVersion {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "record_id", nullable = false, updatable = false)
  private UUID recordId;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "version", nullable = false, updatable = false)
  private int version;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private VersionStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "parameters", columnDefinition = "jsonb")
  private Map<String, Object> parameters;

  @Column(name = "backend_id", nullable = false, length = 100)
  private String backendId;

  @Column(name = "created_by", nullable = false, length = 200)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "committed_at")
  private Instant committedAt;

  protected SecretVersion() {}

  SecretVersion(
      SecretRecord record,
      int version,
      Map<String, Object> parameters,
      String backendId,
      String createdBy) {
    this.recordId = record.getId();
    this.tenantId = record.getTenantId();
    this.version = version;
    this.parameters = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
    this.backendId = backendId;
    this.createdBy = createdBy;
    this.status = VersionStatus.PENDING;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  void commit() {
    if (status != VersionStatus.PENDING) {
      throw new IllegalStateException("Version " + version + " is already " + status);
    }
    this.status = VersionStatus.COMMITTED;
    this.committedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecordId() {
    return recordId;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public int getVersion() {
    return version;
  }

  public VersionStatus getStatus() {
    return status;
  }

  public Map<String, Object> getParameters() {
    return parameters;
  }

  public String getBackendId() {
    return backendId;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getCommittedAt() {
    return committedAt;
  }
}
