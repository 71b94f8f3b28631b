package io.b2mash.credstore.backend.embedded;

import io.b2mash.credstore.backend.SecretBackend;
import io.b2mash.credstore.backend.SecretBackendPlugin;
import io.b2mash.credstore.backend.SecretLocator;
import io.b2mash.credstore.crypto.AadContext;
import io.b2mash.credstore.crypto.CryptoEngine;
import io.b2mash.credstore.crypto.KekRef;
import io.b2mash.credstore.crypto.RewrapCandidate;
import io.b2mash.credstore.crypto.RewrapTarget;
import io.b2mash.credstore.crypto.WrappedDek;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.exception.ResourceNotFoundException;
import io.b2mash.credstore.security.CallerContext;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores envelope-encrypted blobs in the service's own database. Every payload is sealed by the
 * crypto engine with the caller's tenant, user, secret and type as AAD, so a row copied into
 * another scope fails to decrypt even if a query were to return it.
 */
@Component
@SecretBackendPlugin(
    instanceId = EmbeddedEncryptedBackend.INSTANCE_ID,
    priority = 100,
    vendor = "credstore",
    encrypting = true)
public class EmbeddedEncryptedBackend implements SecretBackend, RewrapTarget {

  public static final String INSTANCE_ID = "embedded";

  private static final Logger log = LoggerFactory.getLogger(EmbeddedEncryptedBackend.class);

  private final SecretBlobRepository repository;
  private final CryptoEngine cryptoEngine;

  public EmbeddedEncryptedBackend(SecretBlobRepository repository, CryptoEngine cryptoEngine) {
    this.repository = repository;
    this.cryptoEngine = cryptoEngine;
  }

  @Override
  @Transactional
  public void upsertSecret(
      CallerContext ctx, SecretLocator locator, byte[] payload, Map<String, Object> parameters) {
    UUID tenantId = requireTenant(ctx);
    int version = locator.requireVersion();
    var sealed = cryptoEngine.seal(payload, aad(ctx, locator));

    var existing =
        repository.findByTenantIdAndUserIdAndSecretIdAndSecretTypeIdAndVersion(
            tenantId, ctx.userId(), locator.secretId(), locator.secretTypeId(), version);
    if (existing.isPresent()) {
      existing.get().reseal(sealed);
      repository.save(existing.get());
    } else {
      repository.save(
          new SecretBlob(
              tenantId, ctx.userId(), locator.secretId(), locator.secretTypeId(), version, sealed));
    }
    log.debug("Stored blob {} v{} under {}", locator.secretId(), version, sealed.kekRef());
  }

  @Override
  @Transactional(readOnly = true)
  public byte[] getSecretMaterial(CallerContext ctx, SecretLocator locator) {
    UUID tenantId = requireTenant(ctx);
    var blob =
        repository
            .findByTenantIdAndUserIdAndSecretIdAndSecretTypeIdAndVersion(
                tenantId,
                ctx.userId(),
                locator.secretId(),
                locator.secretTypeId(),
                locator.requireVersion())
            .orElseThrow(() -> new ResourceNotFoundException("Secret", locator.secretId()));
    return cryptoEngine.unseal(blob.toSealed(), aad(ctx, locator));
  }

  @Override
  @Transactional
  public void deleteSecret(CallerContext ctx, SecretLocator locator) {
    UUID tenantId = requireTenant(ctx);
    if (locator.version() == null) {
      var blobs =
          repository.findByTenantIdAndUserIdAndSecretIdAndSecretTypeId(
              tenantId, ctx.userId(), locator.secretId(), locator.secretTypeId());
      repository.deleteAll(blobs);
      log.debug("Deleted {} blob(s) of secret {}", blobs.size(), locator.secretId());
    } else {
      repository
          .findByTenantIdAndUserIdAndSecretIdAndSecretTypeIdAndVersion(
              tenantId, ctx.userId(), locator.secretId(), locator.secretTypeId(), locator.version())
          .ifPresent(repository::delete);
    }
  }

  @Override
  public String rewrapTargetName() {
    return INSTANCE_ID;
  }

  @Override
  @Transactional(readOnly = true)
  public List<RewrapCandidate> findReferencing(KekRef ref, int limit) {
    return repository
        .findByKekScopeAndKekVersionOrderByCreatedAtAsc(
            ref.scope(), ref.version(), PageRequest.of(0, limit))
        .stream()
        .map(blob -> new RewrapCandidate(blob.getId(), blob.wrappedDekBytes(), blob.kekRef()))
        .toList();
  }

  @Override
  @Transactional
  public boolean replaceWrappedDek(UUID blobId, KekRef expected, WrappedDek replacement) {
    if (!expected.scope().equals(replacement.kekRef().scope())) {
      throw new IllegalArgumentException(
          "Re-wrap must stay within scope " + expected.scope() + ", got " + replacement.kekRef());
    }
    int updated =
        repository.swapWrappedDek(
            blobId,
            expected.scope(),
            expected.version(),
            replacement.kekRef().version(),
            Base64.getEncoder().encodeToString(replacement.wrappedDek()),
            Instant.now());
    return updated == 1;
  }

  @Override
  @Transactional(readOnly = true)
  public long countReferencing(KekRef ref) {
    return repository.countByKekScopeAndKekVersion(ref.scope(), ref.version());
  }

  private static UUID requireTenant(CallerContext ctx) {
    if (!ctx.hasTenant()) {
      throw new ForbiddenException("Backend access requires a tenant scope");
    }
    return ctx.tenantId();
  }

  private static AadContext aad(CallerContext ctx, SecretLocator locator) {
    return new AadContext(ctx.tenantId(), locator.secretId(), locator.secretTypeId(), ctx.userId());
  }
}
