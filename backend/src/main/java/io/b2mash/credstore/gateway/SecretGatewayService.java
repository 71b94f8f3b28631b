package io.b2mash.credstore.gateway;

import io.b2mash.credstore.audit.AuditEntryView;
import io.b2mash.credstore.audit.AuditOperation;
import io.b2mash.credstore.audit.AuditQuery;
import io.b2mash.credstore.audit.AuditService;
import io.b2mash.credstore.backend.SecretLocator;
import io.b2mash.credstore.exception.ConcurrentSecretModificationException;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.exception.InvalidSecretTypeException;
import io.b2mash.credstore.exception.ResourceNotFoundException;
import io.b2mash.credstore.quota.QuotaService;
import io.b2mash.credstore.quota.QuotaStatus;
import io.b2mash.credstore.quota.RequestKind;
import io.b2mash.credstore.registry.BackendInstance;
import io.b2mash.credstore.registry.BackendRegistry;
import io.b2mash.credstore.registry.BackendSelector;
import io.b2mash.credstore.resilience.ResilientBackendInvoker;
import io.b2mash.credstore.secrettype.SecretType;
import io.b2mash.credstore.secrettype.SecretTypeService;
import io.b2mash.credstore.security.CallerContext;
import io.b2mash.credstore.versioning.RetentionPolicy;
import io.b2mash.credstore.versioning.SecretRecord;
import io.b2mash.credstore.versioning.SecretVersion;
import io.b2mash.credstore.versioning.VersionCommit;
import io.b2mash.credstore.versioning.VersioningManager;
import java.io.Writer;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

/**
 * Public surface of the credential store. Every operation runs the same pipeline:
 *
 * <ol>
 *   <li>re-validate the caller's tenant and secret-type scope,
 *   <li>admit the request against the tenant quota,
 *   <li>call the backend through the resilience layer: writes go to the selected instance, reads
 *       to the instance that wrote the version,
 *   <li>update version bookkeeping,
 *   <li>append one audit entry with the outcome.
 * </ol>
 *
 * <p>Steps 1 and 2 fail before any backend is contacted. Errors reach the caller unchanged as the
 * cause of the returned future's {@code CompletionException}.
 */
@Service
public class SecretGatewayService {

  private static final Logger log = LoggerFactory.getLogger(SecretGatewayService.class);

  private final SecretTypeService secretTypeService;
  private final QuotaService quotaService;
  private final BackendSelector backendSelector;
  private final BackendRegistry backendRegistry;
  private final ResilientBackendInvoker invoker;
  private final VersioningManager versioningManager;
  private final AuditService auditService;
  private final AuditedCalls auditedCalls;

  public SecretGatewayService(
      SecretTypeService secretTypeService,
      QuotaService quotaService,
      BackendSelector backendSelector,
      BackendRegistry backendRegistry,
      ResilientBackendInvoker invoker,
      VersioningManager versioningManager,
      AuditService auditService,
      AuditedCalls auditedCalls) {
    this.secretTypeService = secretTypeService;
    this.quotaService = quotaService;
    this.backendSelector = backendSelector;
    this.backendRegistry = backendRegistry;
    this.invoker = invoker;
    this.versioningManager = versioningManager;
    this.auditService = auditService;
    this.auditedCalls = auditedCalls;
  }

  /**
   * Writes a new version of a secret, creating the secret on first write. A new secret belongs to
   * the caller's user when the context carries one, otherwise it is shared across the tenant.
   */
  public CompletableFuture<UpsertResult> upsertSecret(
      CallerContext ctx, UpsertSecretRequest request) {
    return auditedCalls.run(
        ctx,
        AuditOperation.UPSERT_SECRET,
        request.secretId(),
        request.secretTypeId(),
        (entry, result) ->
            entry
                .detail("version", result.version())
                .detail("backend", result.backendId())
                .detail("created", result.created()),
        () -> doUpsert(ctx, request));
  }

  /** Returns the material of the current version. */
  public CompletableFuture<SecretMaterial> getSecretMaterial(
      CallerContext ctx, String secretId, String secretTypeId) {
    return auditedCalls.run(
        ctx,
        AuditOperation.GET_SECRET_MATERIAL,
        secretId,
        secretTypeId,
        (entry, material) -> entry.detail("version", material.version()),
        () -> {
          var type = validateScope(ctx, secretTypeId);
          quotaService.checkRate(ctx.tenantId(), RequestKind.READ);
          var record = requireRecord(ctx, secretId, type);
          return readVersion(ctx, record, record.getCurrentVersion());
        });
  }

  /** Returns the material of a retained version. */
  public CompletableFuture<SecretMaterial> getVersion(
      CallerContext ctx, String secretId, String secretTypeId, int version) {
    return auditedCalls.run(
        ctx,
        AuditOperation.GET_VERSION,
        secretId,
        secretTypeId,
        (entry, material) -> entry.detail("version", material.version()),
        () -> {
          var type = validateScope(ctx, secretTypeId);
          quotaService.checkRate(ctx.tenantId(), RequestKind.READ);
          var record = requireRecord(ctx, secretId, type);
          return readVersion(ctx, record, version);
        });
  }

  /** Deletes a secret with all its versions and frees its quota slot. */
  public CompletableFuture<Void> deleteSecret(
      CallerContext ctx, String secretId, String secretTypeId) {
    return auditedCalls.run(
        ctx,
        AuditOperation.DELETE_SECRET,
        secretId,
        secretTypeId,
        () -> {
          var type = validateScope(ctx, secretTypeId);
          quotaService.checkRate(ctx.tenantId(), RequestKind.WRITE);
          var record = requireRecord(ctx, secretId, type);
          var current = versioningManager.findVersion(record, record.getCurrentVersion());
          var instance = backendSelector.holder(current.getBackendId());
          var backendCtx = ctx.withUser(record.getUserId());
          var otherBackends =
              versioningManager.listVersions(record).stream()
                  .map(SecretVersion::getBackendId)
                  .filter(id -> !id.equals(instance.instanceId()))
                  .collect(Collectors.toSet());
          var locator = SecretLocator.allVersions(secretId, record.getSecretTypeId());
          return invoker
              .<Void>invoke(
                  instance.instanceId(),
                  "delete",
                  () -> {
                    instance.backend().deleteSecret(backendCtx, locator);
                    return null;
                  })
              .thenRun(
                  () -> {
                    versioningManager.deleteRecord(record);
                    deleteQuietly(backendCtx, otherBackends, locator);
                  });
        });
  }

  /**
   * Lists the secrets the caller may see, optionally restricted to one secret type. Without a
   * type, the listing is limited to the types the caller is allowed.
   */
  public CompletableFuture<Page<SecretSummary>> listSecrets(
      CallerContext ctx, String secretTypeId, Pageable pageable) {
    return auditedCalls.run(
        ctx,
        AuditOperation.LIST_SECRETS,
        null,
        secretTypeId,
        (entry, page) -> entry.detail("count", page.getNumberOfElements()),
        () -> {
          Set<String> types;
          if (secretTypeId != null) {
            types = Set.of(validateScope(ctx, secretTypeId).getId());
          } else {
            requireTenant(ctx);
            types = ctx.allowedSecretTypes();
          }
          quotaService.checkRate(ctx.tenantId(), RequestKind.READ);
          var page = versioningManager.listRecords(ctx.tenantId(), ctx.userId(), types, pageable);
          return CompletableFuture.completedFuture(page.map(SecretSummary::from));
        });
  }

  /** Retained versions of a secret, newest first. */
  public CompletableFuture<List<VersionInfo>> listVersions(
      CallerContext ctx, String secretId, String secretTypeId) {
    return auditedCalls.run(
        ctx,
        AuditOperation.LIST_VERSIONS,
        secretId,
        secretTypeId,
        (entry, versions) -> entry.detail("count", versions.size()),
        () -> {
          var type = validateScope(ctx, secretTypeId);
          quotaService.checkRate(ctx.tenantId(), RequestKind.READ);
          var record = requireRecord(ctx, secretId, type);
          var versions =
              versioningManager.listVersions(record).stream()
                  .map(v -> VersionInfo.from(v, record.getCurrentVersion()))
                  .toList();
          return CompletableFuture.completedFuture(versions);
        });
  }

  /**
   * Writes the content of {@code targetVersion} as a new version at the head of the chain. The
   * version counter never moves backwards.
   *
   * @param expectedVersion the caller's view of the current version, or null to skip the check
   */
  public CompletableFuture<UpsertResult> rollback(
      CallerContext ctx,
      String secretId,
      String secretTypeId,
      int targetVersion,
      Integer expectedVersion) {
    return auditedCalls.run(
        ctx,
        AuditOperation.ROLLBACK_SECRET,
        secretId,
        secretTypeId,
        (entry, result) ->
            entry.detail("from_version", targetVersion).detail("version", result.version()),
        () -> {
          var type = validateScope(ctx, secretTypeId);
          quotaService.checkRate(ctx.tenantId(), RequestKind.WRITE);
          var record = requireRecord(ctx, secretId, type);
          var target = versioningManager.findVersion(record, targetVersion);
          var source = backendSelector.holder(target.getBackendId());
          var instance = backendSelector.select(type.isEncryptionRequired());
          var backendCtx = ctx.withUser(record.getUserId());
          var locator = SecretLocator.of(secretId, record.getSecretTypeId(), targetVersion);
          return invoker
              .invoke(
                  source.instanceId(),
                  "get",
                  () -> source.backend().getSecretMaterial(backendCtx, locator))
              .thenCompose(
                  payload ->
                      writeAndWipe(
                          ctx,
                          record,
                          type,
                          instance,
                          payload,
                          target.getParameters(),
                          expectedVersion))
              .thenApply(commit -> toResult(commit, type, false, instance));
        });
  }

  /** Effective limits and current usage of the caller's tenant. */
  public CompletableFuture<QuotaStatus> quotaStatus(CallerContext ctx) {
    return auditedCalls.run(
        ctx,
        AuditOperation.QUOTA_STATUS,
        null,
        null,
        () -> {
          requireTenant(ctx);
          return CompletableFuture.completedFuture(quotaService.status(ctx.tenantId()));
        });
  }

  public CompletableFuture<Page<AuditEntryView>> queryAudit(
      CallerContext ctx, AuditQuery filter, Pageable pageable) {
    return auditedCalls.run(
        ctx,
        AuditOperation.AUDIT_QUERY,
        null,
        null,
        (entry, page) -> entry.detail("count", page.getNumberOfElements()),
        () ->
            CompletableFuture.completedFuture(
                auditService.query(ctx, filter, pageable).map(AuditEntryView::from)));
  }

  /**
   * Streams the caller tenant's audit entries to {@code out} as JSON lines.
   *
   * @return number of entries written
   */
  public CompletableFuture<Long> exportAudit(CallerContext ctx, AuditQuery filter, Writer out) {
    return auditedCalls.run(
        ctx,
        AuditOperation.AUDIT_EXPORT,
        null,
        null,
        (entry, count) -> entry.detail("count", count),
        () -> CompletableFuture.completedFuture(auditService.export(ctx, filter, out)));
  }

  private CompletableFuture<UpsertResult> doUpsert(
      CallerContext ctx, UpsertSecretRequest request) {
    var type = validateScope(ctx, request.secretTypeId());
    var tenantId = ctx.tenantId();
    quotaService.checkRate(tenantId, RequestKind.WRITE);
    quotaService.checkPayloadSize(tenantId, request.payload().length);
    secretTypeService.validateParameters(type, request.parameters());
    var instance = backendSelector.select(type.isEncryptionRequired());

    var existing = versioningManager.findRecord(tenantId, request.secretId());
    SecretRecord record;
    boolean created;
    if (existing.isPresent()) {
      record = existing.get();
      if (!isVisible(ctx, record)) {
        throw new ResourceNotFoundException("Secret", request.secretId());
      }
      if (!record.getSecretTypeId().equals(type.getId())) {
        throw new InvalidSecretTypeException(
            "Secret " + request.secretId() + " is stored under another secret type");
      }
      created = false;
    } else {
      if (request.expectedVersion() != null && request.expectedVersion() != 0) {
        throw new ConcurrentSecretModificationException(
            request.secretId(), request.expectedVersion(), 0);
      }
      record =
          versioningManager.createRecord(tenantId, ctx.userId(), request.secretId(), type.getId());
      created = true;
    }

    CompletableFuture<VersionCommit> write;
    try {
      write =
          writeVersion(
              ctx,
              record,
              type,
              instance,
              request.payload(),
              request.parameters(),
              request.expectedVersion());
    } catch (RuntimeException e) {
      if (created) {
        versioningManager.discardIfEmpty(record);
      }
      throw e;
    }
    if (created) {
      write =
          write.whenComplete(
              (commit, error) -> {
                if (error != null) {
                  versioningManager.discardIfEmpty(record);
                }
              });
    }
    return write.thenApply(commit -> toResult(commit, type, created, instance));
  }

  private CompletableFuture<VersionCommit> writeVersion(
      CallerContext ctx,
      SecretRecord record,
      SecretType type,
      BackendInstance instance,
      byte[] payload,
      Map<String, Object> parameters,
      Integer expectedVersion) {
    var backendCtx = ctx.withUser(record.getUserId());
    return versioningManager
        .createVersion(
            record,
            expectedVersion,
            parameters,
            instance.instanceId(),
            ctx.actorId(),
            retentionFor(type, ctx.tenantId()),
            version ->
                invoker.invoke(
                    instance.instanceId(),
                    "upsert",
                    () -> {
                      instance
                          .backend()
                          .upsertSecret(
                              backendCtx,
                              SecretLocator.of(
                                  record.getSecretId(), record.getSecretTypeId(), version),
                              payload,
                              parameters);
                      return null;
                    }))
        .thenApply(
            commit -> {
              deletePrunedBlobs(backendCtx, record, commit.pruned());
              return commit;
            });
  }

  private CompletableFuture<VersionCommit> writeAndWipe(
      CallerContext ctx,
      SecretRecord record,
      SecretType type,
      BackendInstance instance,
      byte[] payload,
      Map<String, Object> parameters,
      Integer expectedVersion) {
    try {
      return writeVersion(ctx, record, type, instance, payload, parameters, expectedVersion)
          .whenComplete((commit, error) -> Arrays.fill(payload, (byte) 0));
    } catch (RuntimeException e) {
      Arrays.fill(payload, (byte) 0);
      throw e;
    }
  }

  /** Reads from the instance that wrote the version, not from the one currently preferred. */
  private CompletableFuture<SecretMaterial> readVersion(
      CallerContext ctx, SecretRecord record, int version) {
    var stored = versioningManager.findVersion(record, version);
    var instance = backendSelector.holder(stored.getBackendId());
    var backendCtx = ctx.withUser(record.getUserId());
    var locator = SecretLocator.of(record.getSecretId(), record.getSecretTypeId(), version);
    return invoker
        .invoke(
            instance.instanceId(),
            "get",
            () -> instance.backend().getSecretMaterial(backendCtx, locator))
        .thenApply(
            payload ->
                new SecretMaterial(
                    record.getSecretId(),
                    record.getSecretTypeId(),
                    version,
                    payload,
                    stored.getParameters()));
  }

  /** Removes the blobs of pruned versions from the backend that wrote them, best-effort. */
  private void deletePrunedBlobs(
      CallerContext backendCtx, SecretRecord record, List<VersionCommit.PrunedVersion> pruned) {
    for (var version : pruned) {
      var locator =
          SecretLocator.of(record.getSecretId(), record.getSecretTypeId(), version.version());
      deleteQuietly(backendCtx, Set.of(version.backendId()), locator);
    }
  }

  private void deleteQuietly(
      CallerContext backendCtx, Set<String> backendIds, SecretLocator locator) {
    for (var backendId : backendIds) {
      var instance =
          backendRegistry.instances().stream()
              .filter(i -> i.instanceId().equals(backendId))
              .findFirst();
      if (instance.isEmpty()) {
        log.warn(
            "Backend {} holding {} v{} is no longer registered; blob left in place",
            backendId,
            locator.secretId(),
            locator.version());
        continue;
      }
      invoker
          .<Void>invoke(
              backendId,
              "delete",
              () -> {
                instance.get().backend().deleteSecret(backendCtx, locator);
                return null;
              })
          .exceptionally(
              error -> {
                log.warn(
                    "Could not delete blob of {} v{} on {}: {}",
                    locator.secretId(),
                    locator.version(),
                    backendId,
                    error.getMessage());
                return null;
              });
    }
  }

  private SecretType validateScope(CallerContext ctx, String secretTypeId) {
    requireTenant(ctx);
    if (secretTypeId != null && !ctx.allowsSecretType(secretTypeId)) {
      throw new ForbiddenException(
          "Caller is not permitted to access secret type " + secretTypeId);
    }
    return secretTypeService.require(secretTypeId);
  }

  private static void requireTenant(CallerContext ctx) {
    if (!ctx.hasTenant()) {
      throw new ForbiddenException("Caller context carries no tenant");
    }
  }

  /** Missing, foreign-owned, other-typed and not yet committed secrets all read as not found. */
  private SecretRecord requireRecord(CallerContext ctx, String secretId, SecretType type) {
    return versioningManager
        .findRecord(ctx.tenantId(), secretId)
        .filter(record -> record.getSecretTypeId().equals(type.getId()))
        .filter(record -> !record.isEmpty())
        .filter(record -> isVisible(ctx, record))
        .orElseThrow(() -> new ResourceNotFoundException("Secret", secretId));
  }

  private static boolean isVisible(CallerContext ctx, SecretRecord record) {
    return ctx.system() || record.isVisibleTo(ctx.userId());
  }

  /** Versioning disabled keeps only the version just written; its number still advances. */
  private RetentionPolicy retentionFor(SecretType type, UUID tenantId) {
    if (!type.isVersioningEnabled()) {
      return RetentionPolicy.currentOnly();
    }
    int maxVersions =
        Math.min(type.getMaxVersions(), quotaService.limitsFor(tenantId).maxVersions());
    return new RetentionPolicy(maxVersions, type.getRetentionDays());
  }

  private static UpsertResult toResult(
      VersionCommit commit, SecretType type, boolean created, BackendInstance instance) {
    return new UpsertResult(
        commit.secretId(),
        type.getId(),
        commit.version(),
        created,
        instance.instanceId(),
        commit.pruned().stream().map(VersionCommit.PrunedVersion::version).toList());
  }
}
