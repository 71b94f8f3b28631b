package io.b2mash.credstore.gateway;

import io.b2mash.credstore.audit.AuditEntryBuilder;
import io.b2mash.credstore.audit.AuditOperation;
import io.b2mash.credstore.audit.AuditService;
import io.b2mash.credstore.exception.CredentialStoreException;
import io.b2mash.credstore.exception.ErrorKind;
import io.b2mash.credstore.security.CallerContext;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs a public operation and appends exactly one audit entry for it once it completes, whether
 * it failed in validation, in the backend or in bookkeeping. The original error reaches the
 * caller unchanged as the cause of the returned future's {@link CompletionException}.
 */
@Component
class AuditedCalls {

  private static final Logger log = LoggerFactory.getLogger(AuditedCalls.class);

  private final AuditService auditService;

  AuditedCalls(AuditService auditService) {
    this.auditService = auditService;
  }

  <T> CompletableFuture<T> run(
      CallerContext ctx,
      AuditOperation operation,
      String secretId,
      String secretTypeId,
      Supplier<CompletableFuture<T>> call) {
    return run(ctx, operation, secretId, secretTypeId, (entry, result) -> {}, call);
  }

  /**
   * @param successDetails adds result details to the entry of a successful call
   */
  <T> CompletableFuture<T> run(
      CallerContext ctx,
      AuditOperation operation,
      String secretId,
      String secretTypeId,
      BiConsumer<AuditEntryBuilder, T> successDetails,
      Supplier<CompletableFuture<T>> call) {
    CompletableFuture<T> future;
    try {
      future = call.get();
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    return future.handle(
        (result, error) -> {
          var cause = unwrap(error);
          var entry =
              AuditEntryBuilder.builder(ctx).operation(operation).secret(secretId, secretTypeId);
          if (cause == null) {
            successDetails.accept(entry, result);
            entry.success();
          } else {
            entry.failure(cause);
            logFailure(ctx, operation, secretId, cause);
          }
          try {
            auditService.record(entry.build());
          } catch (RuntimeException auditError) {
            log.error(
                "Failed to record audit entry for {} on {} (tenant {})",
                operation,
                secretId,
                ctx.tenantId(),
                auditError);
            if (cause == null) {
              throw new CompletionException(auditError);
            }
            cause.addSuppressed(auditError);
          }
          if (cause != null) {
            throw new CompletionException(cause);
          }
          return result;
        });
  }

  private static void logFailure(
      CallerContext ctx, AuditOperation operation, String secretId, Throwable cause) {
    if (cause instanceof CredentialStoreException storeError) {
      if (storeError.getKind() == ErrorKind.FORBIDDEN) {
        log.warn(
            "Denied {} on {} for actor {} (tenant {})",
            operation,
            secretId,
            ctx.actorId(),
            ctx.tenantId());
      } else {
        log.debug("{} on {} failed: {}", operation, secretId, storeError.getKind());
      }
    } else {
      log.error("{} on {} failed unexpectedly", operation, secretId, cause);
    }
  }

  private static Throwable unwrap(Throwable error) {
    var cause = error;
    while (cause instanceof CompletionException && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }
}
