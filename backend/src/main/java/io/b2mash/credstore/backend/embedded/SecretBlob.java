package io.b2mash.credstore.backend.embedded;

import io.b2mash.credstore.crypto.CipherAlgorithm;
import io.b2mash.credstore.crypto.KekRef;
import io.b2mash.credstore.crypto.SealedSecret;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/** Ciphertext and wrap metadata for one secret version. Never holds plaintext. */
@Entity
@Table(name = "secret_blobs")
public class SecretBlob {

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

  @Column(name = "version", nullable = false, updatable = false)
  private int version;

  @Enumerated(EnumType.STRING)
  @Column(name = "algorithm", nullable = false, length = 30)
  private CipherAlgorithm algorithm;

  @Column(name = "ciphertext", nullable = false, columnDefinition = "TEXT")
  private String ciphertext;

  @Column(name = "nonce", nullable = false, length = 24)
  private String nonce;

  @Column(name = "wrapped_dek", nullable = false, length = 200)
  private String wrappedDek;

  @Column(name = "kek_scope", nullable = false, length = 64)
  private String kekScope;

  @Column(name = "kek_version", nullable = false)
  private int kekVersion;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SecretBlob() {}

  SecretBlob(
      UUID tenantId,
      UUID userId,
      String secretId,
      String secretTypeId,
      int version,
      SealedSecret sealed) {
    this.tenantId = tenantId;
    this.userId = userId;
    this.secretId = secretId;
    this.secretTypeId = secretTypeId;
    this.version = version;
    reseal(sealed);
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

  void reseal(SealedSecret sealed) {
    var encoder = Base64.getEncoder();
    this.algorithm = sealed.algorithm();
    this.ciphertext = encoder.encodeToString(sealed.ciphertext());
    this.nonce = encoder.encodeToString(sealed.nonce());
    this.wrappedDek = encoder.encodeToString(sealed.wrappedDek());
    this.kekScope = sealed.kekRef().scope();
    this.kekVersion = sealed.kekRef().version();
  }

  SealedSecret toSealed() {
    var decoder = Base64.getDecoder();
    return new SealedSecret(
        algorithm,
        decoder.decode(ciphertext),
        decoder.decode(nonce),
        decoder.decode(wrappedDek),
        kekRef());
  }

  byte[] wrappedDekBytes() {
    return Base64.getDecoder().decode(wrappedDek);
  }

  public KekRef kekRef() {
    return new KekRef(kekScope, kekVersion);
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

  public int getVersion() {
    return version;
  }

  public CipherAlgorithm getAlgorithm() {
    return algorithm;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
