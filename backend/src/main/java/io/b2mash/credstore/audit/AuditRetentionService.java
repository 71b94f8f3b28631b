package io.b2mash.credstore.audit;

import io.b2mash.credstore.quota.QuotaService;
import io.b2mash.credstore.security.CallerContext;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Deletes audit entries older than each tenant's retention window (the tenant's quota override,
 * else {@code audit.retention.days}). Every sweep of a tenant leaves an {@code
 * AUDIT_RETENTION_SWEEP} entry behind, which is younger than any cutoff and so survives the sweep
 * that wrote it.
 */
@Service
@EnableConfigurationProperties(AuditRetentionProperties.class)
public class AuditRetentionService {

  private static final Logger log = LoggerFactory.getLogger(AuditRetentionService.class);

  private final AuditRetentionRepository retentionRepository;
  private final AuditService auditService;
  private final QuotaService quotaService;
  private final TransactionTemplate transactionTemplate;
  private final AuditRetentionProperties properties;

  public AuditRetentionService(
      AuditRetentionRepository retentionRepository,
      AuditService auditService,
      QuotaService quotaService,
      TransactionTemplate transactionTemplate,
      AuditRetentionProperties properties) {
    this.retentionRepository = retentionRepository;
    this.auditService = auditService;
    this.quotaService = quotaService;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
  }

  @Scheduled(cron = "${audit.retention.sweep-cron:0 30 3 * * *}")
  public void sweepAll() {
    if (!properties.purgeEnabled()) {
      log.debug("Audit retention purge disabled");
      return;
    }
    var tenantIds = retentionRepository.findTenantIds();
    long total = 0;
    for (UUID tenantId : tenantIds) {
      try {
        total += sweepTenant(tenantId);
      } catch (RuntimeException e) {
        log.error("Audit retention: failed to sweep tenant {}", tenantId, e);
      }
    }
    Instant unscopedCutoff = Instant.now().minus(properties.days(), ChronoUnit.DAYS);
    Integer unscoped =
        transactionTemplate.execute(
            tx -> retentionRepository.deleteUnscopedOlderThan(unscopedCutoff));
    log.info(
        "Audit retention sweep completed: {} tenants, {} entries deleted, {} unscoped deleted",
        tenantIds.size(),
        total,
        unscoped);
  }

  /**
   * Sweeps one tenant and records the sweep in that tenant's audit log.
   *
   * @return number of entries deleted
   */
  public int sweepTenant(UUID tenantId) {
    int retentionDays = retentionDaysFor(tenantId);
    Instant cutoff = Instant.now().minus(retentionDays, ChronoUnit.DAYS);
    Integer deleted =
        transactionTemplate.execute(tx -> retentionRepository.deleteOlderThan(tenantId, cutoff));
    int count = deleted == null ? 0 : deleted;
    auditService.record(
        AuditEntryBuilder.builder(CallerContext.system(tenantId))
            .operation(AuditOperation.AUDIT_RETENTION_SWEEP)
            .detail("deleted", count)
            .detail("cutoff", cutoff.toString())
            .detail("retention_days", retentionDays)
            .build());
    if (count > 0) {
      log.info(
          "Audit retention: deleted {} entries of tenant {} before {}", count, tenantId, cutoff);
    }
    return count;
  }

  int retentionDaysFor(UUID tenantId) {
    Integer override = quotaService.limitsFor(tenantId).auditRetentionDays();
    return override != null ? override : properties.days();
  }
}
