package io.b2mash.credstore.crypto;

import io.b2mash.credstore.exception.CredentialStoreException;
import io.b2mash.credstore.exception.KekUnavailableException;
import io.b2mash.credstore.exception.ValidationFailedException;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Moves stored DEKs off deprecated KEKs. Work is done in batches of {@code
 * credstore.crypto.rewrap-batch-size}; each blob is swapped with a compare-and-set update, so the
 * job can be interrupted at any point and simply resumes on the next run. Reads are never blocked:
 * a blob is readable under whichever KEK it references at the time.
 */
@Service
public class KekRewrapService {

  private static final Logger log = LoggerFactory.getLogger(KekRewrapService.class);

  private final CryptoEngine cryptoEngine;
  private final KeyManagementService keyManagementService;
  private final ObjectProvider<RewrapTarget> targets;
  private final int batchSize;

  public KekRewrapService(
      CryptoEngine cryptoEngine,
      KeyManagementService keyManagementService,
      ObjectProvider<RewrapTarget> targets,
      CryptoProperties properties) {
    this.cryptoEngine = cryptoEngine;
    this.keyManagementService = keyManagementService;
    this.targets = targets;
    this.batchSize = properties.rewrapBatchSize();
  }

  @Scheduled(cron = "${credstore.crypto.rewrap-cron:0 */15 * * * *}")
  public void rewrapAllDeprecated() {
    var scopes = new TreeSet<String>();
    keyManagementService.deprecated().forEach(kek -> scopes.add(kek.getScope()));
    if (scopes.isEmpty()) {
      return;
    }
    log.info("KEK re-wrap job started for {} scope(s)", scopes.size());
    for (String scope : scopes) {
      try {
        var result = rewrap(scope);
        log.info(
            "KEK re-wrap for scope {}: {} re-wrapped, {} failed, {} remaining",
            scope,
            result.rewrapped(),
            result.failed(),
            result.remaining());
      } catch (RuntimeException e) {
        log.error("KEK re-wrap failed for scope {}", scope, e);
      }
    }
  }

  /** Re-wraps every blob referencing a deprecated KEK of the scope onto the scope's active KEK. */
  public RewrapResult rewrap(String scope) {
    int rewrapped = 0;
    int failed = 0;
    for (var kek : keyManagementService.deprecated(scope)) {
      for (var target : targetList()) {
        var tally = drain(target, kek.ref());
        rewrapped += tally.rewrapped();
        failed += tally.failed();
      }
    }
    long remaining =
        keyManagementService.deprecated(scope).stream()
            .mapToLong(kek -> referenceCount(kek.ref()))
            .sum();
    return new RewrapResult(scope, rewrapped, failed, remaining);
  }

  /**
   * Marks a deprecated KEK revoked. Refused while it is still active or any blob still references
   * it, since those blobs would become undecryptable.
   */
  public void revoke(KekRef ref) {
    var kek =
        keyManagementService
            .find(ref)
            .orElseThrow(() -> new KekUnavailableException("KEK " + ref + " does not exist"));
    if (kek.getStatus() != KekStatus.DEPRECATED) {
      throw new ValidationFailedException(
          "KEK " + ref + " is " + kek.getStatus() + "; only deprecated KEKs can be revoked");
    }
    long references = referenceCount(ref);
    if (references > 0) {
      throw new ValidationFailedException(
          "KEK " + ref + " is still referenced by " + references + " blob(s)");
    }
    keyManagementService.revoke(ref);
  }

  public long referenceCount(KekRef ref) {
    return targetList().stream().mapToLong(t -> t.countReferencing(ref)).sum();
  }

  private Tally drain(RewrapTarget target, KekRef ref) {
    int rewrapped = 0;
    int failed = 0;
    while (true) {
      var batch = target.findReferencing(ref, batchSize);
      if (batch.isEmpty()) {
        break;
      }
      int progressed = 0;
      for (var candidate : batch) {
        try {
          var replacement = cryptoEngine.rewrap(candidate.wrappedDek(), candidate.kekRef());
          if (target.replaceWrappedDek(candidate.blobId(), candidate.kekRef(), replacement)) {
            rewrapped++;
          }
          // a lost compare-and-set means the blob moved on its own; either way it left the batch
          progressed++;
        } catch (CredentialStoreException e) {
          failed++;
          log.warn(
              "Could not re-wrap blob {} in {} off {}: {}",
              candidate.blobId(),
              target.rewrapTargetName(),
              ref,
              e.getKind().code());
        }
      }
      if (progressed == 0 || batch.size() < batchSize) {
        break;
      }
    }
    return new Tally(rewrapped, failed);
  }

  private record Tally(int rewrapped, int failed) {}

  private List<RewrapTarget> targetList() {
    return targets.orderedStream().toList();
  }

  /**
   * Outcome of one re-wrap pass over a scope.
   *
   * @param remaining blobs still referencing a deprecated KEK of the scope after the pass
   */
  public record RewrapResult(String scope, int rewrapped, int failed, long remaining) {}
}
