package io.b2mash.credstore.backend.embedded;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Tenant-scoped lookups take tenant and user explicitly; a null user id matches only tenant-shared
 * blobs. The KEK queries serve the re-wrap job and expose wrap metadata only.
 */
public interface SecretBlobRepository extends JpaRepository<SecretBlob, UUID> {

  Optional<SecretBlob> findByTenantIdAndUserIdAndSecretIdAndSecretTypeIdAndVersion(
      UUID tenantId, UUID userId, String secretId, String secretTypeId, int version);

  List<SecretBlob> findByTenantIdAndUserIdAndSecretIdAndSecretTypeId(
      UUID tenantId, UUID userId, String secretId, String secretTypeId);

  List<SecretBlob> findByKekScopeAndKekVersionOrderByCreatedAtAsc(
      String kekScope, int kekVersion, Pageable pageable);

  long countByKekScopeAndKekVersion(String kekScope, int kekVersion);

  @Modifying
  @Query(
      """
      UPDATE SecretBlob b
         SET b.wrappedDek = :wrappedDek, b.kekVersion = :newVersion, b.updatedAt = :now
       WHERE b.id = :id AND b.kekScope = :scope AND b.kekVersion = :oldVersion
      """)
  int swapWrappedDek(
      @Param("id") UUID id,
      @Param("scope") String scope,
      @Param("oldVersion") int oldVersion,
      @Param("newVersion") int newVersion,
      @Param("wrappedDek") String wrappedDek,
      @Param("now") Instant now);
}
