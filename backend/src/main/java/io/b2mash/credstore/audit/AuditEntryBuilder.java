package io.b2mash.credstore.audit;

import io.b2mash.credstore.exception.CredentialStoreException;
import io.b2mash.credstore.security.CallerContext;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletionException;

/**
 * Builder that constructs an {@link AuditEntryRecord}. Tenant, actor and trace id are taken from
 * the caller context; the error code from the failure, if any.
 *
 * <pre>{@code
 * AuditEntryRecord record = AuditEntryBuilder.builder(ctx)
 *     .operation(AuditOperation.GET_SECRET_MATERIAL)
 *     .secret("db-password", "database_password")
 *     .failure(error)
 *     .build();
 * }</pre>
 */
public class AuditEntryBuilder {

  static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  private UUID tenantId;
  private String actorId;
  private String traceId;
  private AuditOperation operation;
  private String secretId;
  private String secretTypeId;
  private AuditOutcome outcome = AuditOutcome.SUCCESS;
  private String errorCode;
  private final Map<String, Object> details = new LinkedHashMap<>();

  private AuditEntryBuilder() {}

  public static AuditEntryBuilder builder(CallerContext ctx) {
    var builder = new AuditEntryBuilder();
    builder.tenantId = ctx.tenantId();
    builder.actorId = ctx.actorId();
    builder.traceId = ctx.traceId();
    if (ctx.userId() != null) {
      builder.details.put("user_id", ctx.userId().toString());
    }
    return builder;
  }

  public AuditEntryBuilder operation(AuditOperation operation) {
    this.operation = operation;
    return this;
  }

  public AuditEntryBuilder secret(String secretId, String secretTypeId) {
    this.secretId = secretId;
    this.secretTypeId = secretTypeId;
    return this;
  }

  public AuditEntryBuilder detail(String key, Object value) {
    if (value != null) {
      details.put(key, value);
    }
    return this;
  }

  public AuditEntryBuilder success() {
    this.outcome = AuditOutcome.SUCCESS;
    this.errorCode = null;
    return this;
  }

  /** Marks the entry failed; store errors contribute their kind, anything else INTERNAL_ERROR. */
  public AuditEntryBuilder failure(Throwable error) {
    this.outcome = AuditOutcome.FAILURE;
    this.errorCode = errorCodeOf(error);
    return this;
  }

  public AuditEntryRecord build() {
    Objects.requireNonNull(operation, "operation");
    return new AuditEntryRecord(
        tenantId,
        actorId,
        operation,
        secretId,
        secretTypeId,
        outcome,
        errorCode,
        traceId,
        details.isEmpty() ? null : Map.copyOf(details));
  }

  static String errorCodeOf(Throwable error) {
    var cause = error;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause instanceof CredentialStoreException storeError
        ? storeError.getKind().code()
        : INTERNAL_ERROR;
  }
}
