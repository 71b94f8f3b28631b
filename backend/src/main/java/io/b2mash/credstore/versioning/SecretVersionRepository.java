package io.b2mash.credstore.versioning;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SecretVersionRepository extends JpaRepository<SecretVersion, UUID> {

  Optional<SecretVersion> findByTenantIdAndRecordIdAndVersion(
      UUID tenantId, UUID recordId, int version);

  Optional<SecretVersion> findByTenantIdAndRecordIdAndVersionAndStatus(
      UUID tenantId, UUID recordId, int version, VersionStatus status);

  List<SecretVersion> findByTenantIdAndRecordIdAndStatusOrderByVersionDesc(
      UUID tenantId, UUID recordId, VersionStatus status);

  List<SecretVersion> findByTenantIdAndRecordId(UUID tenantId, UUID recordId);

  long countByTenantIdAndRecordId(UUID tenantId, UUID recordId);

  List<SecretVersion> findByStatusAndCreatedAtBefore(VersionStatus status, Instant cutoff);
}
