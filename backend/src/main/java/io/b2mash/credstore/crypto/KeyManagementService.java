package io.b2mash.credstore.crypto;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.credstore.exception.ConcurrentSecretModificationException;
import io.b2mash.credstore.exception.KekUnavailableException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns KEK lifecycle and material. Unwrapped KEKs are handed out only as {@link KekHandle}s inside
 * this package.
 */
@Service
public class KeyManagementService {

  private static final Logger log = LoggerFactory.getLogger(KeyManagementService.class);

  private final KekRepository kekRepository;
  private final MasterKey masterKey;
  private final TransactionTemplate transactionTemplate;
  private final SecureRandom secureRandom = new SecureRandom();

  // KekRef -> unwrapped handle. Misses are never cached.
  private final Cache<KekRef, KekHandle> handleCache;

  KeyManagementService(
      KekRepository kekRepository,
      MasterKey masterKey,
      PlatformTransactionManager transactionManager,
      CryptoProperties properties) {
    this.kekRepository = kekRepository;
    this.masterKey = masterKey;
    // KEK changes commit on their own, even when the first seal of a scope runs inside a write
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.handleCache =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.kekCacheTtl())
            .maximumSize(1_000)
            .build();
  }

  /** Returns the active KEK of a scope, creating version 1 the first time a scope is used. */
  KekHandle active(String scope) {
    var active = kekRepository.findFirstByScopeAndStatus(scope, KekStatus.ACTIVE);
    if (active.isPresent()) {
      return handleFor(active.get());
    }
    var created =
        inScopeLock(
            scope,
            () ->
                kekRepository
                    .findFirstByScopeAndStatus(scope, KekStatus.ACTIVE)
                    .orElseGet(
                        () -> {
                          var first = createNext(scope);
                          log.info("Created initial KEK {}", first.ref());
                          return first;
                        }));
    return handleFor(created);
  }

  /** Resolves a KEK for unwrapping. Revoked or missing KEKs are unavailable. */
  KekHandle resolve(KekRef ref) {
    var handle = handleCache.getIfPresent(ref);
    if (handle == null) {
      var metadata =
          kekRepository
              .findByScopeAndVersion(ref.scope(), ref.version())
              .orElseThrow(() -> new KekUnavailableException("KEK " + ref + " does not exist"));
      handle = handleFor(metadata);
    }
    if (!handle.status().canUnwrap()) {
      throw new KekUnavailableException("KEK " + ref + " is revoked");
    }
    return handle;
  }

  /**
   * Generates a new active KEK for the scope and deprecates the previous one. Existing blobs keep
   * referencing the deprecated KEK until re-wrapped.
   */
  public KekRef rotate(String scope) {
    return inScopeLock(
        scope,
        () -> {
          var previous = kekRepository.findFirstByScopeAndStatus(scope, KekStatus.ACTIVE);
          previous.ifPresent(
              kek -> {
                kek.deprecate();
                kekRepository.saveAndFlush(kek);
                handleCache.invalidate(kek.ref());
              });
          var created = createNext(scope);
          log.info(
              "Rotated KEK for scope {}: {} -> {}",
              scope,
              previous.map(k -> k.ref().toString()).orElse("none"),
              created.ref());
          return created.ref();
        });
  }

  /** Marks a deprecated KEK revoked. Callers must have verified nothing references it. */
  public void revoke(KekRef ref) {
    transactionTemplate.executeWithoutResult(
        tx -> {
          var kek =
              kekRepository
                  .findByScopeAndVersion(ref.scope(), ref.version())
                  .orElseThrow(
                      () -> new KekUnavailableException("KEK " + ref + " does not exist"));
          kek.revoke();
          kekRepository.save(kek);
        });
    handleCache.invalidate(ref);
    log.info("Revoked KEK {}", ref);
  }

  public List<KekMetadata> list(String scope) {
    return kekRepository.findByScopeOrderByVersionDesc(scope);
  }

  public Optional<KekMetadata> find(KekRef ref) {
    return kekRepository.findByScopeAndVersion(ref.scope(), ref.version());
  }

  public List<KekMetadata> deprecated() {
    return kekRepository.findByStatus(KekStatus.DEPRECATED);
  }

  public List<KekMetadata> deprecated(String scope) {
    return kekRepository.findByScopeAndStatus(scope, KekStatus.DEPRECATED);
  }

  /**
   * Runs a KEK chain change while holding the scope's lock row, so at most one KEK per scope is
   * ever active.
   *
   * @throws ConcurrentSecretModificationException when a concurrent change wins the race
   */
  private <T> T inScopeLock(String scope, Supplier<T> change) {
    try {
      return transactionTemplate.execute(
          tx -> {
            kekRepository.registerScope(scope);
            kekRepository.lockScope(scope);
            return change.get();
          });
    } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
      log.warn("Concurrent KEK change in scope {} rejected: {}", scope, e.getMessage());
      throw new ConcurrentSecretModificationException(
          "KEK scope " + scope + " is being changed concurrently. Please retry.");
    }
  }

  private KekMetadata createNext(String scope) {
    int version = kekRepository.findMaxVersion(scope) + 1;
    var ref = new KekRef(scope, version);
    byte[] material = new byte[CipherAlgorithm.KEY_LENGTH];
    secureRandom.nextBytes(material);
    try {
      byte[] wrapped = masterKey.wrapKekMaterial(ref, material);
      var kek =
          new KekMetadata(
              scope,
              version,
              CipherAlgorithm.AES_256_GCM,
              Base64.getEncoder().encodeToString(wrapped));
      return kekRepository.saveAndFlush(kek);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to protect new KEK " + ref, e);
    } finally {
      Arrays.fill(material, (byte) 0);
    }
  }

  private KekHandle handleFor(KekMetadata metadata) {
    var ref = metadata.ref();
    var cached = handleCache.getIfPresent(ref);
    if (cached != null && cached.status() == metadata.getStatus()) {
      return cached;
    }
    byte[] material = null;
    try {
      material =
          masterKey.unwrapKekMaterial(
              ref, Base64.getDecoder().decode(metadata.getEncryptedMaterial()));
      var handle =
          new KekHandle(ref, metadata.getStatus(), new SecretKeySpec(material, "AES"));
      handleCache.put(ref, handle);
      return handle;
    } catch (GeneralSecurityException e) {
      throw new KekUnavailableException("KEK " + ref + " cannot be unlocked", e);
    } finally {
      if (material != null) {
        Arrays.fill(material, (byte) 0);
      }
    }
  }

  /** Unwrapped KEK. Package-private so key material never crosses the crypto boundary. */
  record KekHandle(KekRef ref, KekStatus status, SecretKey key) {

    @Override
    public String toString() {
      return "KekHandle[ref=" + ref + ", status=" + status + "]";
    }
  }
}
