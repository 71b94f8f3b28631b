package io.b2mash.credstore.quota;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenantQuotaRepository extends JpaRepository<TenantQuota, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT q FROM TenantQuota q WHERE q.tenantId = :tenantId")
  Optional<TenantQuota> findForUpdate(@Param("tenantId") UUID tenantId);
}
