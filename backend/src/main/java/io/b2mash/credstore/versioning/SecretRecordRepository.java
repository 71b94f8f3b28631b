package io.b2mash.credstore.versioning;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SecretRecordRepository extends JpaRepository<SecretRecord, UUID> {

  Optional<SecretRecord> findByTenantIdAndSecretId(UUID tenantId, String secretId);

  Optional<SecretRecord> findByIdAndTenantId(UUID id, UUID tenantId);

  /**
   * Records with at least one committed version that the given user may see: tenant-shared ones
   * plus the user's own. A null secret type means all types.
   */
  @Query(
      """
      SELECT r FROM SecretRecord r
      WHERE r.tenantId = :tenantId
        AND r.currentVersion > 0
        AND (r.userId IS NULL OR r.userId = :userId)
        AND (CAST(:secretTypeId AS string) IS NULL OR r.secretTypeId = :secretTypeId)
      ORDER BY r.secretId ASC
      """)
  Page<SecretRecord> findVisible(
      @Param("tenantId") UUID tenantId,
      @Param("userId") UUID userId,
      @Param("secretTypeId") String secretTypeId,
      Pageable pageable);

  /** Same as {@link #findVisible} restricted to a set of secret types. */
  @Query(
      """
      SELECT r FROM SecretRecord r
      WHERE r.tenantId = :tenantId
        AND r.currentVersion > 0
        AND (r.userId IS NULL OR r.userId = :userId)
        AND r.secretTypeId IN :secretTypeIds
      ORDER BY r.secretId ASC
      """)
  Page<SecretRecord> findVisibleOfTypes(
      @Param("tenantId") UUID tenantId,
      @Param("userId") UUID userId,
      @Param("secretTypeIds") Collection<String> secretTypeIds,
      Pageable pageable);

  /** Records whose first write never committed. Used by the stale reservation sweep only. */
  List<SecretRecord> findByCurrentVersionAndCreatedAtBefore(int currentVersion, Instant cutoff);
}
