package io.b2mash.credstore.secrettype;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A category of secret with its parameter schema and version policy. Changed only through {@link
 * SecretTypeService#update}.
 */
@Entity
@Table(name = "secret_types")
public class SecretType {

  @Id
  @Column(name = "id", length = 100)
  private String id;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "parameter_schema", nullable = false, columnDefinition = "jsonb")
  private ParameterSchema schema;

  @Column(name = "versioning_enabled", nullable = false)
  private boolean versioningEnabled;

  @Column(name = "max_versions", nullable = false)
  private int maxVersions;

  @Column(name = "retention_days")
  private Integer retentionDays;

  @Column(name = "encryption_required", nullable = false)
  private boolean encryptionRequired;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SecretType() {}

  SecretType(SecretTypeDefinition definition) {
    this.id = definition.id();
    apply(definition);
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

  void apply(SecretTypeDefinition definition) {
    this.schema = definition.schema();
    this.versioningEnabled = definition.versioningEnabled();
    this.maxVersions = definition.maxVersions();
    this.retentionDays = definition.retentionDays();
    this.encryptionRequired = definition.encryptionRequired();
  }

  public String getId() {
    return id;
  }

  public ParameterSchema getSchema() {
    return schema;
  }

  public boolean isVersioningEnabled() {
    return versioningEnabled;
  }

  public int getMaxVersions() {
    return maxVersions;
  }

  public Integer getRetentionDays() {
    return retentionDays;
  }

  public boolean isEncryptionRequired() {
    return encryptionRequired;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
