package io.b2mash.credstore.gateway;

import io.b2mash.credstore.audit.AuditOperation;
import io.b2mash.credstore.crypto.CryptoEngine;
import io.b2mash.credstore.crypto.KekRef;
import io.b2mash.credstore.crypto.KekRewrapService;
import io.b2mash.credstore.crypto.KekRewrapService.RewrapResult;
import io.b2mash.credstore.crypto.KekScopeMode;
import io.b2mash.credstore.crypto.KeyManagementService;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.quota.QuotaLimits;
import io.b2mash.credstore.quota.QuotaService;
import io.b2mash.credstore.quota.QuotaStatus;
import io.b2mash.credstore.secrettype.SecretType;
import io.b2mash.credstore.secrettype.SecretTypeDefinition;
import io.b2mash.credstore.secrettype.SecretTypeService;
import io.b2mash.credstore.security.CallerContext;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Administrative operations: KEK lifecycle, tenant quotas and secret types. Each call is audited
 * like the secret operations.
 *
 * <p>System callers may act on any scope. A tenant caller may only manage the KEKs of its own
 * scope, and only when KEKs are scoped per tenant. Quotas and secret types are system-only.
 */
@Service
public class StoreAdministrationService {

  private final CryptoEngine cryptoEngine;
  private final KeyManagementService keyManagementService;
  private final KekRewrapService rewrapService;
  private final QuotaService quotaService;
  private final SecretTypeService secretTypeService;
  private final AuditedCalls auditedCalls;

  public StoreAdministrationService(
      CryptoEngine cryptoEngine,
      KeyManagementService keyManagementService,
      KekRewrapService rewrapService,
      QuotaService quotaService,
      SecretTypeService secretTypeService,
      AuditedCalls auditedCalls) {
    this.cryptoEngine = cryptoEngine;
    this.keyManagementService = keyManagementService;
    this.rewrapService = rewrapService;
    this.quotaService = quotaService;
    this.secretTypeService = secretTypeService;
    this.auditedCalls = auditedCalls;
  }

  /** Activates a new KEK for the scope; the previous one stays readable as deprecated. */
  public CompletableFuture<KekRef> rotateKek(CallerContext ctx, String scope) {
    return auditedCalls.run(
        ctx,
        AuditOperation.KEK_ROTATE,
        null,
        null,
        (entry, ref) -> entry.detail("kek", ref.toString()),
        () ->
            supply(
                () -> {
                  requireKeyAuthority(ctx, scope);
                  return cryptoEngine.rotateKek(scope);
                }));
  }

  /** Moves every blob of the scope off its deprecated KEKs. */
  public CompletableFuture<RewrapResult> rewrap(CallerContext ctx, String scope) {
    return auditedCalls.run(
        ctx,
        AuditOperation.KEK_REWRAP,
        null,
        null,
        (entry, result) ->
            entry
                .detail("scope", result.scope())
                .detail("rewrapped", result.rewrapped())
                .detail("failed", result.failed())
                .detail("remaining", result.remaining()),
        () ->
            supply(
                () -> {
                  requireKeyAuthority(ctx, scope);
                  return rewrapService.rewrap(scope);
                }));
  }

  /** Revokes a deprecated KEK that no blob references any more. */
  public CompletableFuture<KekRef> revokeKek(CallerContext ctx, KekRef ref) {
    return auditedCalls.run(
        ctx,
        AuditOperation.KEK_REVOKE,
        null,
        null,
        (entry, revoked) -> entry.detail("kek", revoked.toString()),
        () ->
            supply(
                () -> {
                  requireKeyAuthority(ctx, ref.scope());
                  rewrapService.revoke(ref);
                  return ref;
                }));
  }

  /** KEKs of a scope, newest first, with their remaining blob references. */
  public CompletableFuture<List<KekInfo>> listKeks(CallerContext ctx, String scope) {
    return auditedCalls.run(
        ctx,
        AuditOperation.KEK_LIST,
        null,
        null,
        (entry, keks) -> entry.detail("scope", scope).detail("count", keks.size()),
        () ->
            supply(
                () -> {
                  requireKeyAuthority(ctx, scope);
                  return keyManagementService.list(scope).stream()
                      .map(kek -> KekInfo.from(kek, rewrapService.referenceCount(kek.ref())))
                      .toList();
                }));
  }

  /** Creates the tenant's quota with default limits. Idempotent. */
  public CompletableFuture<QuotaStatus> provisionTenant(CallerContext ctx, UUID tenantId) {
    return auditedCalls.run(
        ctx,
        AuditOperation.QUOTA_PROVISION,
        null,
        null,
        (entry, status) -> entry.detail("tenant", tenantId.toString()),
        () ->
            supply(
                () -> {
                  requireSystem(ctx);
                  quotaService.provision(tenantId);
                  return quotaService.status(tenantId);
                }));
  }

  public CompletableFuture<QuotaLimits> overrideQuota(
      CallerContext ctx, UUID tenantId, QuotaLimits limits) {
    return auditedCalls.run(
        ctx,
        AuditOperation.QUOTA_OVERRIDE,
        null,
        null,
        (entry, applied) -> entry.detail("tenant", tenantId.toString()),
        () ->
            supply(
                () -> {
                  requireSystem(ctx);
                  return quotaService.override(tenantId, limits);
                }));
  }

  public CompletableFuture<SecretType> registerSecretType(
      CallerContext ctx, SecretTypeDefinition definition) {
    return auditedCalls.run(
        ctx,
        AuditOperation.SECRET_TYPE_REGISTER,
        null,
        definition.id(),
        () ->
            supply(
                () -> {
                  requireSystem(ctx);
                  return secretTypeService.register(definition);
                }));
  }

  public CompletableFuture<SecretType> updateSecretType(
      CallerContext ctx, String secretTypeId, SecretTypeDefinition definition) {
    return auditedCalls.run(
        ctx,
        AuditOperation.SECRET_TYPE_UPDATE,
        null,
        secretTypeId,
        () ->
            supply(
                () -> {
                  requireSystem(ctx);
                  return secretTypeService.update(secretTypeId, definition);
                }));
  }

  private void requireKeyAuthority(CallerContext ctx, String scope) {
    if (ctx.system()) {
      return;
    }
    if (!ctx.hasTenant()
        || KekScopeMode.GLOBAL_SCOPE.equals(scope)
        || !cryptoEngine.scopeFor(ctx.tenantId()).equals(scope)) {
      throw new ForbiddenException("Caller may not manage KEKs of scope " + scope);
    }
  }

  private static void requireSystem(CallerContext ctx) {
    if (!ctx.system()) {
      throw new ForbiddenException("Operation requires a system caller");
    }
  }

  private static <T> CompletableFuture<T> supply(Supplier<T> work) {
    return CompletableFuture.completedFuture(work.get());
  }
}
