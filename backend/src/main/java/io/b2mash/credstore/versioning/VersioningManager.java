package io.b2mash.credstore.versioning;

import io.b2mash.credstore.exception.ConcurrentSecretModificationException;
import io.b2mash.credstore.exception.ResourceNotFoundException;
import io.b2mash.credstore.quota.QuotaService;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Append-only version chain per secret.
 *
 * <p>A write claims the next version number by inserting a PENDING row; the unique {@code
 * (record_id, version)} constraint guarantees one winner per number. The blob is written while the
 * reservation is held, then the version is committed, the record's current version advanced and
 * retention applied in one transaction. A failed blob write releases the reservation.
 */
@Service
@EnableConfigurationProperties(VersioningProperties.class)
public class VersioningManager {

  private static final Logger log = LoggerFactory.getLogger(VersioningManager.class);

  private final SecretRecordRepository recordRepository;
  private final SecretVersionRepository versionRepository;
  private final QuotaService quotaService;
  private final TransactionTemplate transactionTemplate;
  private final VersioningProperties properties;

  public VersioningManager(
      SecretRecordRepository recordRepository,
      SecretVersionRepository versionRepository,
      QuotaService quotaService,
      TransactionTemplate transactionTemplate,
      VersioningProperties properties) {
    this.recordRepository = recordRepository;
    this.versionRepository = versionRepository;
    this.quotaService = quotaService;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
  }

  public Optional<SecretRecord> findRecord(UUID tenantId, String secretId) {
    return recordRepository.findByTenantIdAndSecretId(tenantId, secretId);
  }

  /**
   * Pages through the records a user may see.
   *
   * @param secretTypeIds restricts the listing to these types; empty lists every type
   */
  public Page<SecretRecord> listRecords(
      UUID tenantId, UUID userId, Collection<String> secretTypeIds, Pageable pageable) {
    if (secretTypeIds.isEmpty()) {
      return recordRepository.findVisible(tenantId, userId, null, pageable);
    }
    if (secretTypeIds.size() == 1) {
      return recordRepository.findVisible(
          tenantId, userId, secretTypeIds.iterator().next(), pageable);
    }
    return recordRepository.findVisibleOfTypes(tenantId, userId, secretTypeIds, pageable);
  }

  /**
   * Creates an empty record and counts it against the tenant's secret quota.
   *
   * @throws ConcurrentSecretModificationException when another writer created it first
   */
  public SecretRecord createRecord(
      UUID tenantId, UUID userId, String secretId, String secretTypeId) {
    try {
      return transactionTemplate.execute(
          tx -> {
            quotaService.reserveSecretSlot(tenantId);
            return recordRepository.saveAndFlush(
                new SecretRecord(tenantId, userId, secretId, secretTypeId));
          });
    } catch (DataIntegrityViolationException e) {
      throw new ConcurrentSecretModificationException(
          "Secret " + secretId + " was created concurrently. Please retry.");
    }
  }

  /**
   * Appends the next version: reserves it, lets {@code blobWriter} store the content under the
   * reserved number, then commits and prunes.
   *
   * @param expectedVersion the caller's view of the current version, or null to skip the check
   * @param blobWriter writes the blob for the given version number
   */
  public CompletableFuture<VersionCommit> createVersion(
      SecretRecord record,
      Integer expectedVersion,
      Map<String, Object> parameters,
      String backendId,
      String actor,
      RetentionPolicy policy,
      IntFunction<CompletableFuture<Void>> blobWriter) {
    int version = reserve(record, expectedVersion, parameters, backendId, actor);
    CompletableFuture<Void> written;
    try {
      written = blobWriter.apply(version);
    } catch (RuntimeException e) {
      releaseQuietly(record, version);
      throw e;
    }
    return written.handle(
        (ignored, error) -> {
          if (error != null) {
            releaseQuietly(record, version);
            throw error instanceof CompletionException ce ? ce : new CompletionException(error);
          }
          try {
            return commit(record, version, policy);
          } catch (RuntimeException e) {
            releaseQuietly(record, version);
            throw e;
          }
        });
  }

  /** Committed versions, newest first. */
  public List<SecretVersion> listVersions(SecretRecord record) {
    return versionRepository.findByTenantIdAndRecordIdAndStatusOrderByVersionDesc(
        record.getTenantId(), record.getId(), VersionStatus.COMMITTED);
  }

  /** @throws ResourceNotFoundException when the version was never committed or has been pruned */
  public SecretVersion findVersion(SecretRecord record, int version) {
    return versionRepository
        .findByTenantIdAndRecordIdAndVersionAndStatus(
            record.getTenantId(), record.getId(), version, VersionStatus.COMMITTED)
        .orElseThrow(
            () ->
                ResourceNotFoundException.withDetail(
                    "Secret version not found",
                    "Secret " + record.getSecretId() + " has no version " + version));
  }

  /**
   * Applies a retention policy outside a write, for example after a secret type's limits were
   * tightened. Runs against the record's latest state.
   *
   * @return the pruned versions; their blobs are left for the caller to remove
   */
  public List<VersionCommit.PrunedVersion> prune(SecretRecord record, RetentionPolicy policy) {
    return transactionTemplate.execute(
        tx -> {
          var current =
              recordRepository
                  .findByIdAndTenantId(record.getId(), record.getTenantId())
                  .orElseThrow(
                      () -> new ResourceNotFoundException("Secret", record.getSecretId()));
          return pruneInTransaction(current, policy);
        });
  }

  /** Deletes the record and all its versions and gives the quota slot back. */
  public void deleteRecord(SecretRecord record) {
    transactionTemplate.executeWithoutResult(
        tx -> {
          versionRepository.deleteAll(
              versionRepository.findByTenantIdAndRecordId(record.getTenantId(), record.getId()));
          recordRepository
              .findByIdAndTenantId(record.getId(), record.getTenantId())
              .ifPresent(recordRepository::delete);
          quotaService.releaseSecretSlot(record.getTenantId());
        });
  }

  /** Deletes a record whose first write failed, unless another writer has since committed. */
  public void discardIfEmpty(SecretRecord record) {
    transactionTemplate.executeWithoutResult(
        tx -> {
          var current = recordRepository.findByIdAndTenantId(record.getId(), record.getTenantId());
          if (current.isPresent()
              && current.get().isEmpty()
              && versionRepository.countByTenantIdAndRecordId(record.getTenantId(), record.getId())
                  == 0) {
            recordRepository.delete(current.get());
            quotaService.releaseSecretSlot(record.getTenantId());
          }
        });
  }

  /**
   * Releases PENDING versions whose writer never came back, and empty records left behind by a
   * failed first write.
   */
  @Scheduled(cron = "${credstore.versioning.sweep-cron:0 */5 * * * *}")
  public void releaseStaleReservations() {
    var cutoff = Instant.now().minus(properties.staleReservationAge());
    var stale = versionRepository.findByStatusAndCreatedAtBefore(VersionStatus.PENDING, cutoff);
    for (var version : stale) {
      transactionTemplate.executeWithoutResult(tx -> versionRepository.delete(version));
      log.warn(
          "Released stale reservation of version {} on record {}",
          version.getVersion(),
          version.getRecordId());
    }
    var empty = recordRepository.findByCurrentVersionAndCreatedAtBefore(0, cutoff);
    for (var record : empty) {
      discardIfEmpty(record);
    }
    if (!stale.isEmpty() || !empty.isEmpty()) {
      log.info(
          "Stale reservation sweep: {} version(s) released, {} empty record(s) checked",
          stale.size(),
          empty.size());
    }
  }

  private int reserve(
      SecretRecord record,
      Integer expectedVersion,
      Map<String, Object> parameters,
      String backendId,
      String actor) {
    try {
      return transactionTemplate.execute(
          tx -> {
            var current =
                recordRepository
                    .findByIdAndTenantId(record.getId(), record.getTenantId())
                    .orElseThrow(
                        () -> new ResourceNotFoundException("Secret", record.getSecretId()));
            if (expectedVersion != null && expectedVersion != current.getCurrentVersion()) {
              throw new ConcurrentSecretModificationException(
                  current.getSecretId(), expectedVersion, current.getCurrentVersion());
            }
            int next = current.getCurrentVersion() + 1;
            versionRepository.saveAndFlush(
                new SecretVersion(current, next, parameters, backendId, actor));
            return next;
          });
    } catch (DataIntegrityViolationException e) {
      throw new ConcurrentSecretModificationException(
          "Another write to secret " + record.getSecretId() + " is in progress. Please retry.");
    }
  }

  private VersionCommit commit(SecretRecord record, int version, RetentionPolicy policy) {
    try {
      return transactionTemplate.execute(
          tx -> {
            var pending =
                versionRepository
                    .findByTenantIdAndRecordIdAndVersion(
                        record.getTenantId(), record.getId(), version)
                    .orElseThrow(
                        () ->
                            new ConcurrentSecretModificationException(
                                "Reservation of version "
                                    + version
                                    + " on secret "
                                    + record.getSecretId()
                                    + " was released before commit"));
            pending.commit();
            versionRepository.save(pending);
            var current =
                recordRepository
                    .findByIdAndTenantId(record.getId(), record.getTenantId())
                    .orElseThrow(
                        () -> new ResourceNotFoundException("Secret", record.getSecretId()));
            current.advanceTo(version);
            recordRepository.saveAndFlush(current);
            var pruned = pruneInTransaction(current, policy);
            log.debug("Committed {} v{}, pruned {}", current.getSecretId(), version, pruned);
            return new VersionCommit(current.getSecretId(), version, pruned);
          });
    } catch (ObjectOptimisticLockingFailureException e) {
      throw new ConcurrentSecretModificationException(
          "Secret " + record.getSecretId() + " changed while committing. Please retry.");
    }
  }

  /**
   * Removes versions beyond the policy: anything past {@code maxVersions} newest, and anything
   * older than the retention period. The current version always stays.
   */
  private List<VersionCommit.PrunedVersion> pruneInTransaction(
      SecretRecord record, RetentionPolicy policy) {
    var committed =
        versionRepository.findByTenantIdAndRecordIdAndStatusOrderByVersionDesc(
            record.getTenantId(), record.getId(), VersionStatus.COMMITTED);
    Instant ageCutoff =
        policy.retentionDays() == null
            ? null
            : Instant.now().minus(policy.retentionDays(), ChronoUnit.DAYS);
    int current = record.getCurrentVersion();
    var pruned = new ArrayList<SecretVersion>();
    for (int i = 0; i < committed.size(); i++) {
      var candidate = committed.get(i);
      if (candidate.getVersion() == current) {
        continue;
      }
      boolean overCount = i >= policy.maxVersions();
      boolean expired = ageCutoff != null && candidate.getCreatedAt().isBefore(ageCutoff);
      if (overCount || expired) {
        pruned.add(candidate);
      }
    }
    versionRepository.deleteAll(pruned);
    return pruned.stream()
        .sorted(Comparator.comparingInt(SecretVersion::getVersion))
        .map(v -> new VersionCommit.PrunedVersion(v.getVersion(), v.getBackendId()))
        .toList();
  }

  private void releaseQuietly(SecretRecord record, int version) {
    try {
      transactionTemplate.executeWithoutResult(
          tx ->
              versionRepository
                  .findByTenantIdAndRecordIdAndVersionAndStatus(
                      record.getTenantId(), record.getId(), version, VersionStatus.PENDING)
                  .ifPresent(versionRepository::delete));
    } catch (RuntimeException e) {
      log.warn(
          "Could not release reservation of {} v{}; the stale sweep will: {}",
          record.getSecretId(),
          version,
          e.getMessage());
    }
  }
}
