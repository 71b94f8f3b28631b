package io.b2mash.credstore.quota;

import io.b2mash.credstore.exception.QuotaExceededException;
import io.b2mash.credstore.exception.SecretTooLargeException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Tenant quotas. Tenants without a quota row run on the configured defaults; the row is created on
 * first write or by explicit provisioning. The secret count is maintained under a pessimistic row
 * lock so concurrent creates from one tenant cannot overshoot the ceiling.
 */
@Service
@EnableConfigurationProperties(QuotaProperties.class)
public class QuotaService {

  private static final Logger log = LoggerFactory.getLogger(QuotaService.class);

  private final TenantQuotaRepository repository;
  private final TenantRateLimiter rateLimiter;
  private final QuotaProperties properties;
  private final TransactionTemplate provisioningTransaction;

  public QuotaService(
      TenantQuotaRepository repository,
      TenantRateLimiter rateLimiter,
      QuotaProperties properties,
      PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.rateLimiter = rateLimiter;
    this.properties = properties;
    this.provisioningTransaction = new TransactionTemplate(transactionManager);
    provisioningTransaction.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /** Creates the tenant's quota row with default limits. Idempotent. */
  public TenantQuota provision(UUID tenantId) {
    var existing = repository.findById(tenantId);
    if (existing.isPresent()) {
      return existing.get();
    }
    try {
      var created =
          provisioningTransaction.execute(
              tx ->
                  repository.saveAndFlush(new TenantQuota(tenantId, properties.defaults())));
      log.info("Provisioned quota for tenant {}", tenantId);
      return created;
    } catch (DataIntegrityViolationException e) {
      // Provisioned concurrently
      return repository
          .findById(tenantId)
          .orElseThrow(() -> new IllegalStateException("Quota row for " + tenantId + " vanished"));
    }
  }

  /** Replaces a tenant's limits. The live secret count is kept. */
  @Transactional
  public QuotaLimits override(UUID tenantId, QuotaLimits limits) {
    provision(tenantId);
    var quota = repository.findForUpdate(tenantId).orElseThrow();
    quota.apply(limits);
    repository.save(quota);
    log.info("Quota override for tenant {}: {}", tenantId, limits);
    return quota.limits();
  }

  @Transactional(readOnly = true)
  public QuotaLimits limitsFor(UUID tenantId) {
    return repository.findById(tenantId).map(TenantQuota::limits).orElse(properties.defaults());
  }

  @Transactional(readOnly = true)
  public QuotaStatus status(UUID tenantId) {
    var quota = repository.findById(tenantId);
    return new QuotaStatus(
        tenantId,
        quota.map(TenantQuota::limits).orElse(properties.defaults()),
        quota.map(TenantQuota::getSecretCount).orElse(0),
        rateLimiter.currentCount(tenantId, RequestKind.WRITE),
        rateLimiter.currentCount(tenantId, RequestKind.READ),
        quota.isPresent());
  }

  /**
   * Admits one request against the tenant's per-minute rate.
   *
   * @throws QuotaExceededException on the request that would cross the limit
   */
  public void checkRate(UUID tenantId, RequestKind kind) {
    var limits = limitsFor(tenantId);
    int limit = kind == RequestKind.WRITE ? limits.writesPerMinute() : limits.readsPerMinute();
    if (!rateLimiter.tryAcquire(tenantId, kind, limit)) {
      String quota = kind == RequestKind.WRITE ? "write_rate" : "read_rate";
      throw new QuotaExceededException(
          quota,
          "Tenant exceeded " + limit + " " + kind.name().toLowerCase() + " requests per minute");
    }
  }

  /** @throws SecretTooLargeException when the payload exceeds the tenant limit */
  public void checkPayloadSize(UUID tenantId, int payloadBytes) {
    int limit = limitsFor(tenantId).maxPayloadBytes();
    if (payloadBytes > limit) {
      throw new SecretTooLargeException(payloadBytes, limit);
    }
  }

  /**
   * Counts one new secret against the tenant. Joins the caller's transaction so the slot is
   * released if record creation rolls back.
   *
   * @throws QuotaExceededException when the tenant is at its secret ceiling
   */
  @Transactional
  public void reserveSecretSlot(UUID tenantId) {
    provision(tenantId);
    var quota = repository.findForUpdate(tenantId).orElseThrow();
    if (!quota.hasSecretCapacity()) {
      throw new QuotaExceededException(
          "secret_count",
          "Tenant reached its limit of " + quota.limits().maxSecrets() + " secrets");
    }
    quota.incrementSecretCount();
    repository.save(quota);
  }

  @Transactional
  public void releaseSecretSlot(UUID tenantId) {
    repository
        .findForUpdate(tenantId)
        .ifPresent(
            quota -> {
              quota.decrementSecretCount();
              repository.save(quota);
            });
  }
}
