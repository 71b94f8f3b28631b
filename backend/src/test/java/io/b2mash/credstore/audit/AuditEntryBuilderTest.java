package io.b2mash.credstore.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.credstore.exception.QuotaExceededException;
import io.b2mash.credstore.security.CallerContext;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;

class AuditEntryBuilderTest {

  private static final UUID TENANT = UUID.randomUUID();
  private static final UUID USER = UUID.randomUUID();

  private final CallerContext ctx =
      CallerContext.builder()
          .tenantId(TENANT)
          .userId(USER)
          .actorId("svc-billing")
          .traceId("trace-123")
          .build();

  @Test
  void shouldTakeScopeFromCallerContext() {
    var entry =
        AuditEntryBuilder.builder(ctx)
            .operation(AuditOperation.GET_SECRET_MATERIAL)
            .secret("db-password", "database_password")
            .detail("version", 3)
            .success()
            .build();

    assertThat(entry.tenantId()).isEqualTo(TENANT);
    assertThat(entry.actorId()).isEqualTo("svc-billing");
    assertThat(entry.traceId()).isEqualTo("trace-123");
    assertThat(entry.outcome()).isEqualTo(AuditOutcome.SUCCESS);
    assertThat(entry.errorCode()).isNull();
    assertThat(entry.details())
        .containsEntry("user_id", USER.toString())
        .containsEntry("version", 3);
  }

  @Test
  void shouldCarryTheErrorKindOnFailure() {
    var entry =
        AuditEntryBuilder.builder(ctx)
            .operation(AuditOperation.UPSERT_SECRET)
            .failure(new CompletionException(new QuotaExceededException("write_rate", "limit")))
            .build();

    assertThat(entry.outcome()).isEqualTo(AuditOutcome.FAILURE);
    assertThat(entry.errorCode()).isEqualTo("QUOTA_EXCEEDED");
  }

  @Test
  void shouldRecordUnexpectedErrorsAsInternal() {
    var entry =
        AuditEntryBuilder.builder(CallerContext.anonymous())
            .operation(AuditOperation.LIST_SECRETS)
            .failure(new IllegalStateException("boom"))
            .build();

    assertThat(entry.errorCode()).isEqualTo("INTERNAL_ERROR");
    assertThat(entry.tenantId()).isNull();
    assertThat(entry.details()).isNull();
  }

  @Test
  void shouldSkipNullDetails() {
    var entry =
        AuditEntryBuilder.builder(CallerContext.system(TENANT))
            .operation(AuditOperation.KEK_LIST)
            .detail("scope", null)
            .build();

    assertThat(entry.details()).isNull();
    assertThat(entry.actorId()).isEqualTo("system");
  }

  @Test
  void shouldRequireAnOperation() {
    assertThatThrownBy(() -> AuditEntryBuilder.builder(ctx).build())
        .isInstanceOf(NullPointerException.class);
  }
}
