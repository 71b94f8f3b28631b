package io.b2mash.credstore.exception;

/**
 * A backend failure that may heal on its own: transport errors, timeouts, explicit "unavailable"
 * answers. Retried with backoff and counted by the circuit breaker. Once retries are exhausted the
 * resilience layer surfaces it as {@link PluginUnavailableException}.
 */
public class TransientBackendException extends RuntimeException {

  private final String instanceId;

  public TransientBackendException(String instanceId, String message) {
    super(message);
    this.instanceId = instanceId;
  }

  public TransientBackendException(String instanceId, String message, Throwable cause) {
    super(message, cause);
    this.instanceId = instanceId;
  }

  public String getInstanceId() {
    return instanceId;
  }
}
