package io.b2mash.credstore.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/** The only path that deletes audit entries. Used by {@link AuditRetentionService} alone. */
public interface AuditRetentionRepository extends Repository<AuditLogEntry, UUID> {

  @Query("SELECT DISTINCT e.tenantId FROM AuditLogEntry e WHERE e.tenantId IS NOT NULL")
  List<UUID> findTenantIds();

  @Modifying
  @Query("DELETE FROM AuditLogEntry e WHERE e.tenantId = :tenantId AND e.occurredAt < :cutoff")
  int deleteOlderThan(@Param("tenantId") UUID tenantId, @Param("cutoff") Instant cutoff);

  @Modifying
  @Query("DELETE FROM AuditLogEntry e WHERE e.tenantId IS NULL AND e.occurredAt < :cutoff")
  int deleteUnscopedOlderThan(@Param("cutoff") Instant cutoff);
}
