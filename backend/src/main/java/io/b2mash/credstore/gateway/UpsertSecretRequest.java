package io.b2mash.credstore.gateway;

import java.util.Map;
import java.util.Objects;

/**
 * A write of secret material.
 *
 * @param payload secret value; never logged
 * @param parameters non-secret parameters validated against the secret type's schema
 * @param expectedVersion the caller's view of the current version for optimistic concurrency; 0
 *     requires the secret not to exist, null skips the check
 */
public record UpsertSecretRequest(
    String secretId,
    String secretTypeId,
    byte[] payload,
    Map<String, Object> parameters,
    Integer expectedVersion) {

  public UpsertSecretRequest {
    Objects.requireNonNull(secretId, "secretId");
    Objects.requireNonNull(secretTypeId, "secretTypeId");
    Objects.requireNonNull(payload, "payload");
    parameters = parameters == null ? Map.of() : parameters;
  }

  public UpsertSecretRequest(
      String secretId, String secretTypeId, byte[] payload, Map<String, Object> parameters) {
    this(secretId, secretTypeId, payload, parameters, null);
  }

  @Override
  public String toString() {
    return "UpsertSecretRequest[secretId="
        + secretId
        + ", secretTypeId="
        + secretTypeId
        + ", payload=<redacted "
        + payload.length
        + " bytes>, parameters="
        + parameters.keySet()
        + ", expectedVersion="
        + expectedVersion
        + "]";
  }
}
