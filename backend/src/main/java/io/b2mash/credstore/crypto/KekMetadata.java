package io.b2mash.credstore.crypto;

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
import java.util.UUID;

/**
 * One version of a key encryption key. The key material itself is stored encrypted under the
 * configured master key and never leaves the crypto package in clear.
 */
@Entity
@Table(name = "kek_metadata")
public class KekMetadata {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "scope", nullable = false, length = 64)
  private String scope;

  @Column(name = "version", nullable = false)
  private int version;

  @Enumerated(EnumType.STRING)
  @Column(name = "algorithm", nullable = false, length = 30)
  private CipherAlgorithm algorithm;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private KekStatus status;

  @Column(name = "encrypted_material", nullable = false, length = 200)
  private String encryptedMaterial;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "rotated_at")
  private Instant rotatedAt;

  @Column(name = "revoked_at")
  private Instant revokedAt;

  protected KekMetadata() {}

  KekMetadata(String scope, int version, CipherAlgorithm algorithm, String encryptedMaterial) {
    this.scope = scope;
    this.version = version;
    this.algorithm = algorithm;
    this.encryptedMaterial = encryptedMaterial;
    this.status = KekStatus.ACTIVE;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  void deprecate() {
    if (status != KekStatus.ACTIVE) {
      throw new IllegalStateException(
          "Only an active KEK can be deprecated, " + ref() + " is " + status);
    }
    this.status = KekStatus.DEPRECATED;
    this.rotatedAt = Instant.now();
  }

  void revoke() {
    if (status != KekStatus.DEPRECATED) {
      throw new IllegalStateException(
          "Only a deprecated KEK can be revoked, " + ref() + " is " + status);
    }
    this.status = KekStatus.REVOKED;
    this.revokedAt = Instant.now();
  }

  public KekRef ref() {
    return new KekRef(scope, version);
  }

  public UUID getId() {
    return id;
  }

  public String getScope() {
    return scope;
  }

  public int getVersion() {
    return version;
  }

  public CipherAlgorithm getAlgorithm() {
    return algorithm;
  }

  public KekStatus getStatus() {
    return status;
  }

  String getEncryptedMaterial() {
    return encryptedMaterial;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getRotatedAt() {
    return rotatedAt;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }
}
