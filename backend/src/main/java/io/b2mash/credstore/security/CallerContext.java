package io.b2mash.credstore.security;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Caller identity handed to every credential store operation. The upstream policy decision has
 * already been made by the time a context reaches the store; the store only re-validates tenant
 * and secret-type scope against it.
 *
 * @param tenantId tenant the caller acts for; null for an anonymous caller
 * @param userId optional end-user the caller acts on behalf of; secrets written with a user id are
 *     only visible to that user
 * @param actorId identity recorded in the audit log
 * @param allowedSecretTypes secret types the policy decision allows; empty means all
 * @param traceId correlation id propagated to audit entries
 * @param system true for scheduled jobs and administrative tooling
 */
public record CallerContext(
    UUID tenantId,
    UUID userId,
    String actorId,
    Set<String> allowedSecretTypes,
    String traceId,
    boolean system) {

  public CallerContext {
    allowedSecretTypes = allowedSecretTypes == null ? Set.of() : Set.copyOf(allowedSecretTypes);
    traceId = traceId == null ? UUID.randomUUID().toString() : traceId;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A context without tenant; every tenant-scoped operation rejects it. */
  public static CallerContext anonymous() {
    return new CallerContext(null, null, "anonymous", Set.of(), null, false);
  }

  /** Context used by background jobs acting on one tenant. */
  public static CallerContext system(UUID tenantId) {
    return new CallerContext(tenantId, null, "system", Set.of(), null, true);
  }

  public boolean hasTenant() {
    return tenantId != null;
  }

  /** Whether the policy decision covers the given secret type. */
  public boolean allowsSecretType(String secretTypeId) {
    return allowedSecretTypes.isEmpty() || allowedSecretTypes.contains(secretTypeId);
  }

  /** Returns a copy bound to another user, used when an operation targets a user-owned secret. */
  public CallerContext withUser(UUID userId) {
    return new CallerContext(tenantId, userId, actorId, allowedSecretTypes, traceId, system);
  }

  public static final class Builder {

    private UUID tenantId;
    private UUID userId;
    private String actorId;
    private Set<String> allowedSecretTypes = Set.of();
    private String traceId;
    private boolean system;

    private Builder() {}

    public Builder tenantId(UUID tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder userId(UUID userId) {
      this.userId = userId;
      return this;
    }

    public Builder actorId(String actorId) {
      this.actorId = actorId;
      return this;
    }

    public Builder allowedSecretTypes(Set<String> allowedSecretTypes) {
      this.allowedSecretTypes = allowedSecretTypes;
      return this;
    }

    public Builder traceId(String traceId) {
      this.traceId = traceId;
      return this;
    }

    public Builder system(boolean system) {
      this.system = system;
      return this;
    }

    /** Actor defaults to the user id, then to "service". */
    public CallerContext build() {
      String resolvedActor =
          Objects.requireNonNullElseGet(
              actorId, () -> userId != null ? userId.toString() : "service");
      return new CallerContext(
          tenantId, userId, resolvedActor, allowedSecretTypes, traceId, system);
    }
  }
}
