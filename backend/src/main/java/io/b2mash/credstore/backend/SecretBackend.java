package io.b2mash.credstore.backend;

import io.b2mash.credstore.security.CallerContext;
import java.util.Map;

/**
 * Storage contract every backend instance implements. All calls are blocking; the gateway invokes
 * them through the resilience layer.
 *
 * <p>Implementations must constrain every storage access by the context's tenant and user, and by
 * the locator's secret type, so that a correct secret id alone never reaches another scope's data.
 * Transient failures (transport, timeouts, "unavailable" responses) are reported as {@code
 * TransientBackendException}; a missing secret as {@code ResourceNotFoundException}.
 */
public interface SecretBackend {

  /** Creates or replaces the material of one version. */
  void upsertSecret(
      CallerContext ctx, SecretLocator locator, byte[] payload, Map<String, Object> parameters);

  /** Returns the plaintext payload of one version. */
  byte[] getSecretMaterial(CallerContext ctx, SecretLocator locator);

  /** Deletes one version, or all versions when the locator carries no version. Idempotent. */
  void deleteSecret(CallerContext ctx, SecretLocator locator);
}
