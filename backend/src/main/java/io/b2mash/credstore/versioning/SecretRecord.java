package io.b2mash.credstore.versioning;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * The logical secret. Tenant, owning user, secret id and secret type are fixed at creation; only
 * the current version moves, and only forward.
 */
@Entity
@Table(name = "secret_records")
public class SecretRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "user_id", updatable = false)
  private UUID userId;

  @Column(name = "secret_id", nullable = false, updatable = false, length = 200)
  private String secretId;

  @Column(name = "secret_type_id", nullable = false, updatable = false, length = 100)
  private String secretTypeId;

  @Column(name = "current_version", nullable = false)
  private int currentVersion;

  @Version
  @Column(name = "lock_version", nullable = false)
  private long lockVersion;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SecretRecord() {}

  SecretRecord(UUID tenantId, UUID userId, String secretId, String secretTypeId) {
    this.tenantId = tenantId;
    this.userId = userId;
    this.secretId = secretId;
    this.secretTypeId = secretTypeId;
    this.currentVersion = 0;
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

  void advanceTo(int version) {
    if (version <= currentVersion) {
      throw new IllegalStateException(
          "Secret " + secretId + " cannot move from version " + currentVersion + " to " + version);
    }
    this.currentVersion = version;
  }

  /** Tenant-shared records are visible to every user of the tenant, owned ones to the owner. */
  public boolean isVisibleTo(UUID callerUserId) {
    return userId == null || userId.equals(callerUserId);
  }

  /** True until the first version is committed. */
  public boolean isEmpty() {
    return currentVersion == 0;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getSecretId() {
    return secretId;
  }

  public String getSecretTypeId() {
    return secretTypeId;
  }

  public int getCurrentVersion() {
    return currentVersion;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
