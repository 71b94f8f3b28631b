package io.b2mash.credstore.registry;

import io.b2mash.credstore.exception.PluginUnavailableException;
import io.b2mash.credstore.resilience.BackendCircuitBreakers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the backend instance for a call. Evaluated on every call: the first instance in priority
 * order that passes the vendor filter, satisfies the encryption requirement and whose circuit
 * breaker is not open. A higher-priority instance takes over again as soon as its breaker lets a
 * trial call through.
 */
@Component
public class BackendSelector {

  private static final Logger log = LoggerFactory.getLogger(BackendSelector.class);

  private final BackendRegistry registry;
  private final BackendCircuitBreakers circuitBreakers;
  private final String vendor;

  public BackendSelector(
      BackendRegistry registry,
      BackendCircuitBreakers circuitBreakers,
      RegistryProperties properties) {
    this.registry = registry;
    this.circuitBreakers = circuitBreakers;
    var configuredVendor = properties.vendor();
    this.vendor = configuredVendor == null || configuredVendor.isBlank() ? null : configuredVendor;
  }

  public BackendInstance selectActive() {
    return select(false);
  }

  /**
   * @param requireEncryption only consider instances that envelope-encrypt locally
   * @throws PluginUnavailableException when no instance is eligible
   */
  public BackendInstance select(boolean requireEncryption) {
    for (var instance : registry.instances()) {
      if (vendor != null && !vendor.equals(instance.vendor())) {
        continue;
      }
      if (requireEncryption && !instance.encrypting()) {
        continue;
      }
      if (!circuitBreakers.isAvailable(instance.instanceId())) {
        log.debug("Skipping backend {}: circuit open", instance.instanceId());
        continue;
      }
      return instance;
    }
    throw new PluginUnavailableException(
        "No eligible secret backend"
            + (vendor != null ? " for vendor " + vendor : "")
            + (requireEncryption ? " with local encryption" : ""));
  }

  /**
   * The instance that wrote a version. Its blob lives nowhere else, so reads go back to it even
   * when another instance is currently preferred for writes.
   *
   * @throws PluginUnavailableException when the instance is no longer registered or its circuit is
   *     open
   */
  public BackendInstance holder(String instanceId) {
    var instance =
        registry.instances().stream()
            .filter(candidate -> candidate.instanceId().equals(instanceId))
            .findFirst()
            .orElseThrow(
                () ->
                    new PluginUnavailableException(
                        "Secret backend " + instanceId + " is no longer registered"));
    if (!circuitBreakers.isAvailable(instanceId)) {
      throw new PluginUnavailableException(
          "Secret backend " + instanceId + " is unavailable: circuit open");
    }
    return instance;
  }
}
