package io.b2mash.credstore.audit;

import java.time.Instant;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/** Insert and read only. Deletion lives in {@link AuditRetentionRepository}. */
public interface AuditLogRepository extends Repository<AuditLogEntry, UUID> {

  AuditLogEntry save(AuditLogEntry entry);

  /**
   * Tenant-scoped query with nullable filters, each using {@code (:param IS NULL OR e.field =
   * :param)}. Ordered by occurredAt DESC.
   */
  @Query(
      """
      SELECT e FROM AuditLogEntry e
      WHERE e.tenantId = :tenantId
        AND (:operation IS NULL OR e.operation = :operation)
        AND (:outcome IS NULL OR e.outcome = :outcome)
        AND (CAST(:secretId AS string) IS NULL OR e.secretId = :secretId)
        AND (CAST(:actorId AS string) IS NULL OR e.actorId = :actorId)
        AND (CAST(:from AS timestamp) IS NULL OR e.occurredAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.occurredAt < :to)
      ORDER BY e.occurredAt DESC, e.id ASC
      """)
  Page<AuditLogEntry> findByFilter(
      @Param("tenantId") UUID tenantId,
      @Param("operation") AuditOperation operation,
      @Param("outcome") AuditOutcome outcome,
      @Param("secretId") String secretId,
      @Param("actorId") String actorId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      Pageable pageable);

  long countByTenantId(UUID tenantId);
}
