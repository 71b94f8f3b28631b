package io.b2mash.credstore.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.credstore.TestcontainersConfiguration;
import io.b2mash.credstore.audit.AuditLogEntry;
import io.b2mash.credstore.audit.AuditLogRepository;
import io.b2mash.credstore.audit.AuditOperation;
import io.b2mash.credstore.audit.AuditOutcome;
import io.b2mash.credstore.audit.AuditQuery;
import io.b2mash.credstore.backend.embedded.EmbeddedEncryptedBackend;
import io.b2mash.credstore.backend.embedded.SecretBlobRepository;
import io.b2mash.credstore.exception.ConcurrentSecretModificationException;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.exception.InvalidSecretTypeException;
import io.b2mash.credstore.exception.PluginUnavailableException;
import io.b2mash.credstore.exception.QuotaExceededException;
import io.b2mash.credstore.exception.ResourceNotFoundException;
import io.b2mash.credstore.exception.SecretTooLargeException;
import io.b2mash.credstore.exception.ValidationFailedException;
import io.b2mash.credstore.quota.QuotaLimits;
import io.b2mash.credstore.resilience.BackendCircuitBreakers;
import io.b2mash.credstore.security.CallerContext;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SecretGatewayServiceIntegrationTest {

  private static final String API_KEY = "api_key";
  private static final String DB_PASSWORD = "database_password";
  private static final String OAUTH_TOKEN = "oauth_token";
  private static final Map<String, Object> DB_PARAMS = Map.of("host", "db.internal", "port", 5432);

  @Autowired private SecretGatewayService gateway;
  @Autowired private StoreAdministrationService administration;
  @Autowired private AuditLogRepository auditLogRepository;
  @Autowired private SecretBlobRepository blobRepository;
  @Autowired private BackendCircuitBreakers circuitBreakers;
  @Autowired private ObjectMapper objectMapper;

  private UUID tenantId;
  private CallerContext ctx;

  @BeforeEach
  void newTenant() {
    tenantId = UUID.randomUUID();
    ctx = CallerContext.builder().tenantId(tenantId).actorId("svc-billing").build();
  }

  @Test
  void shouldStoreAndRetrieveSecret() {
    var result = upsert(ctx, "stripe", API_KEY, "sk_live_1", Map.of("provider", "stripe"));

    assertThat(result.version()).isEqualTo(1);
    assertThat(result.created()).isTrue();
    assertThat(result.backendId()).isEqualTo(EmbeddedEncryptedBackend.INSTANCE_ID);
    var material = gateway.getSecretMaterial(ctx, "stripe", API_KEY).join();
    assertThat(text(material.payload())).isEqualTo("sk_live_1");
    assertThat(material.version()).isEqualTo(1);
    assertThat(material.parameters()).containsEntry("provider", "stripe");
  }

  @Test
  void shouldAppendVersionOnUpdate() {
    upsert(ctx, "stripe", API_KEY, "sk_live_1", Map.of());

    var second = upsert(ctx, "stripe", API_KEY, "sk_live_2", Map.of());

    assertThat(second.version()).isEqualTo(2);
    assertThat(second.created()).isFalse();
    assertThat(read(ctx, "stripe", API_KEY)).isEqualTo("sk_live_2");
    assertThat(text(gateway.getVersion(ctx, "stripe", API_KEY, 1).join().payload()))
        .isEqualTo("sk_live_1");
  }

  @Test
  void shouldKeepOnlyTheNewestVersionsOfTheType() {
    UpsertResult last = null;
    for (int i = 1; i <= 6; i++) {
      last = upsert(ctx, "orders-db", DB_PASSWORD, "pw-" + i, DB_PARAMS);
    }

    assertThat(last.version()).isEqualTo(6);
    assertThat(last.prunedVersions()).containsExactly(3);
    assertThat(gateway.listVersions(ctx, "orders-db", DB_PASSWORD).join())
        .extracting(VersionInfo::version)
        .containsExactly(6, 5, 4);
    assertFailsWith(
        gateway.getVersion(ctx, "orders-db", DB_PASSWORD, 1), ResourceNotFoundException.class);
    assertThat(text(gateway.getVersion(ctx, "orders-db", DB_PASSWORD, 4).join().payload()))
        .isEqualTo("pw-4");
    assertThat(
            blobRepository.findByTenantIdAndUserIdAndSecretIdAndSecretTypeIdAndVersion(
                tenantId, null, "orders-db", DB_PASSWORD, 1))
        .isEmpty();
  }

  @Test
  void shouldRollBackByWritingANewVersion() {
    for (int i = 1; i <= 3; i++) {
      upsert(ctx, "orders-db", DB_PASSWORD, "pw-" + i, DB_PARAMS);
    }

    var result = gateway.rollback(ctx, "orders-db", DB_PASSWORD, 1, 3).join();

    assertThat(result.version()).isEqualTo(4);
    assertThat(read(ctx, "orders-db", DB_PASSWORD)).isEqualTo("pw-1");
    var versions = gateway.listVersions(ctx, "orders-db", DB_PASSWORD).join();
    assertThat(versions).extracting(VersionInfo::version).containsExactly(4, 3, 2);
    assertThat(versions.get(0).current()).isTrue();
    assertThat(versions.get(0).parameters()).containsEntry("host", "db.internal");
  }

  @Test
  void shouldRejectRollbackToUnknownVersion() {
    upsert(ctx, "orders-db", DB_PASSWORD, "pw-1", DB_PARAMS);

    assertFailsWith(
        gateway.rollback(ctx, "orders-db", DB_PASSWORD, 7, null),
        ResourceNotFoundException.class);
  }

  @Test
  void shouldRejectStaleExpectedVersion() {
    upsert(ctx, "stripe", API_KEY, "sk_1", Map.of());
    upsert(ctx, "stripe", API_KEY, "sk_2", Map.of());

    assertFailsWith(
        gateway.upsertSecret(ctx, request("stripe", API_KEY, "sk_3", Map.of(), 1)),
        ConcurrentSecretModificationException.class);
    assertFailsWith(
        gateway.upsertSecret(ctx, request("stripe", API_KEY, "sk_3", Map.of(), 0)),
        ConcurrentSecretModificationException.class);

    var accepted = gateway.upsertSecret(ctx, request("stripe", API_KEY, "sk_3", Map.of(), 2));
    assertThat(accepted.join().version()).isEqualTo(3);
  }

  @Test
  void shouldRequireAbsentSecretWhenExpectingNothing() {
    var created = gateway.upsertSecret(ctx, request("github", API_KEY, "gh_1", Map.of(), 0));
    assertThat(created.join().created()).isTrue();

    assertFailsWith(
        gateway.upsertSecret(ctx, request("slack", API_KEY, "sl_1", Map.of(), 4)),
        ConcurrentSecretModificationException.class);
    assertNotFound(gateway.getSecretMaterial(ctx, "slack", API_KEY));
    assertThat(gateway.quotaStatus(ctx).join().secretCount()).isEqualTo(1);
  }

  @Test
  void shouldKeepOnlyCurrentVersionWhenVersioningIsDisabled() {
    for (int i = 1; i <= 3; i++) {
      upsert(ctx, "google", OAUTH_TOKEN, "token-" + i, Map.of());
    }

    assertThat(gateway.listVersions(ctx, "google", OAUTH_TOKEN).join())
        .extracting(VersionInfo::version)
        .containsExactly(3);
    assertNotFound(gateway.getVersion(ctx, "google", OAUTH_TOKEN, 2));
    assertThat(read(ctx, "google", OAUTH_TOKEN)).isEqualTo("token-3");
  }

  @Test
  void shouldAdvanceTheVersionCounterWhenVersioningIsDisabled() {
    upsert(ctx, "google", OAUTH_TOKEN, "token-1", Map.of());
    upsert(ctx, "google", OAUTH_TOKEN, "token-2", Map.of());

    assertFailsWith(
        gateway.upsertSecret(ctx, request("google", OAUTH_TOKEN, "token-3", Map.of(), 1)),
        ConcurrentSecretModificationException.class);
    var accepted =
        gateway.upsertSecret(ctx, request("google", OAUTH_TOKEN, "token-3", Map.of(), 2));
    assertThat(accepted.join().version()).isEqualTo(3);
  }

  @Test
  void shouldValidateParametersAgainstTheTypeSchema() {
    assertFailsWith(
        gateway.upsertSecret(ctx, request("orders-db", DB_PASSWORD, "pw", Map.of(), null)),
        ValidationFailedException.class);
    assertFailsWith(
        gateway.upsertSecret(
            ctx,
            request(
                "orders-db",
                DB_PASSWORD,
                "pw",
                Map.of("host", "db.internal", "port", "not-a-number"),
                null)),
        ValidationFailedException.class);

    assertNotFound(gateway.getSecretMaterial(ctx, "orders-db", DB_PASSWORD));
    assertThat(gateway.quotaStatus(ctx).join().secretCount()).isZero();
  }

  @Test
  void shouldRejectUnknownSecretType() {
    assertFailsWith(
        gateway.upsertSecret(ctx, request("x", "ssh_key", "k", Map.of(), null)),
        InvalidSecretTypeException.class);
  }

  @Test
  void shouldRejectSecretStoredUnderAnotherType() {
    upsert(ctx, "shared-name", API_KEY, "k", Map.of());

    assertFailsWith(
        gateway.upsertSecret(ctx, request("shared-name", OAUTH_TOKEN, "t", Map.of(), null)),
        InvalidSecretTypeException.class);
    assertNotFound(gateway.getSecretMaterial(ctx, "shared-name", OAUTH_TOKEN));
  }

  @Test
  void shouldForbidSecretTypesOutsideThePolicyDecision() {
    upsert(ctx, "orders-db", DB_PASSWORD, "pw", DB_PARAMS);
    var restricted =
        CallerContext.builder()
            .tenantId(tenantId)
            .actorId("svc-web")
            .allowedSecretTypes(Set.of(API_KEY))
            .build();

    assertFailsWith(
        gateway.getSecretMaterial(restricted, "orders-db", DB_PASSWORD), ForbiddenException.class);
    assertThat(gateway.listSecrets(restricted, null, PageRequest.of(0, 10)).join()).isEmpty();
  }

  @Test
  void shouldForbidCallersWithoutTenant() {
    var anonymous = CallerContext.anonymous();

    assertForbidden(gateway.getSecretMaterial(anonymous, "stripe", API_KEY));
    assertFailsWith(
        gateway.upsertSecret(anonymous, request("stripe", API_KEY, "k", Map.of(), null)),
        ForbiddenException.class);
    assertForbidden(gateway.listSecrets(anonymous, null, PageRequest.of(0, 10)));
  }

  @Test
  void shouldEnforcePayloadSizeLimit() {
    overrideLimits(new QuotaLimits(1000, 16, 50, 600, 6000, null));

    assertFailsWith(
        gateway.upsertSecret(ctx, request("stripe", API_KEY, "x".repeat(17), Map.of(), null)),
        SecretTooLargeException.class);
    assertThat(upsert(ctx, "stripe", API_KEY, "x".repeat(16), Map.of()).version()).isEqualTo(1);
  }

  @Test
  void shouldEnforceWriteRate() {
    overrideLimits(new QuotaLimits(1000, 65536, 50, 3, 6000, null));

    for (int i = 1; i <= 3; i++) {
      upsert(ctx, "stripe", API_KEY, "sk_" + i, Map.of());
    }

    assertFailsWith(
        gateway.upsertSecret(ctx, request("stripe", API_KEY, "sk_4", Map.of(), null)),
        QuotaExceededException.class);
    assertThat(read(ctx, "stripe", API_KEY)).isEqualTo("sk_3");
  }

  @Test
  void shouldEnforceSecretCount() {
    overrideLimits(new QuotaLimits(2, 65536, 50, 600, 6000, null));
    upsert(ctx, "stripe", API_KEY, "k", Map.of());
    upsert(ctx, "github", API_KEY, "k", Map.of());

    assertFailsWith(
        gateway.upsertSecret(ctx, request("slack", API_KEY, "k", Map.of(), null)),
        QuotaExceededException.class);
    assertThat(upsert(ctx, "stripe", API_KEY, "k2", Map.of()).version()).isEqualTo(2);

    gateway.deleteSecret(ctx, "github", API_KEY).join();

    assertThat(upsert(ctx, "slack", API_KEY, "k", Map.of()).created()).isTrue();
    assertThat(gateway.quotaStatus(ctx).join().secretCount()).isEqualTo(2);
  }

  @Test
  void shouldIsolateTenants() {
    upsert(ctx, "stripe", API_KEY, "tenant-one", Map.of());
    var other = CallerContext.builder().tenantId(UUID.randomUUID()).actorId("svc").build();

    assertNotFound(gateway.getSecretMaterial(other, "stripe", API_KEY));
    assertThat(gateway.listSecrets(other, null, PageRequest.of(0, 10)).join()).isEmpty();

    var created = upsert(other, "stripe", API_KEY, "tenant-two", Map.of());

    assertThat(created.created()).isTrue();
    assertThat(read(other, "stripe", API_KEY)).isEqualTo("tenant-two");
    assertThat(read(ctx, "stripe", API_KEY)).isEqualTo("tenant-one");
  }

  @Test
  void shouldHideUserOwnedSecretsFromOtherUsers() {
    var alice = CallerContext.builder().tenantId(tenantId).userId(UUID.randomUUID()).build();
    var bob = CallerContext.builder().tenantId(tenantId).userId(UUID.randomUUID()).build();
    upsert(alice, "personal-token", API_KEY, "alice-only", Map.of());
    upsert(ctx, "team-token", API_KEY, "shared", Map.of());

    assertThat(read(alice, "personal-token", API_KEY)).isEqualTo("alice-only");
    assertNotFound(gateway.getSecretMaterial(bob, "personal-token", API_KEY));
    assertFailsWith(
        gateway.upsertSecret(bob, request("personal-token", API_KEY, "x", Map.of(), null)),
        ResourceNotFoundException.class);
    assertThat(read(bob, "team-token", API_KEY)).isEqualTo("shared");
    assertThat(gateway.listSecrets(bob, API_KEY, PageRequest.of(0, 10)).join())
        .extracting(SecretSummary::secretId)
        .containsExactly("team-token");
  }

  @Test
  void shouldListSecretsByType() {
    upsert(ctx, "stripe", API_KEY, "k", Map.of());
    upsert(ctx, "github", API_KEY, "k", Map.of());
    upsert(ctx, "orders-db", DB_PASSWORD, "pw", DB_PARAMS);

    assertThat(gateway.listSecrets(ctx, API_KEY, PageRequest.of(0, 10)).join())
        .extracting(SecretSummary::secretId)
        .containsExactlyInAnyOrder("stripe", "github");
    assertThat(gateway.listSecrets(ctx, null, PageRequest.of(0, 10)).join().getTotalElements())
        .isEqualTo(3);
    var twoTypes =
        CallerContext.builder()
            .tenantId(tenantId)
            .allowedSecretTypes(Set.of(DB_PASSWORD, OAUTH_TOKEN))
            .build();
    assertThat(gateway.listSecrets(twoTypes, null, PageRequest.of(0, 10)).join())
        .extracting(SecretSummary::secretId)
        .containsExactly("orders-db");
  }

  @Test
  void shouldDeleteAllVersions() {
    upsert(ctx, "stripe", API_KEY, "sk_1", Map.of());
    upsert(ctx, "stripe", API_KEY, "sk_2", Map.of());

    gateway.deleteSecret(ctx, "stripe", API_KEY).join();

    assertNotFound(gateway.getSecretMaterial(ctx, "stripe", API_KEY));
    assertThat(
            blobRepository.findByTenantIdAndUserIdAndSecretIdAndSecretTypeId(
                tenantId, null, "stripe", API_KEY))
        .isEmpty();
    assertThat(gateway.quotaStatus(ctx).join().secretCount()).isZero();
    assertNotFound(gateway.deleteSecret(ctx, "stripe", API_KEY));
  }

  @Test
  void shouldFailFastWhileTheOnlyBackendIsOpen() {
    var breaker = circuitBreakers.forInstance(EmbeddedEncryptedBackend.INSTANCE_ID);
    breaker.transitionToForcedOpenState();
    try {
      assertFailsWith(
          gateway.upsertSecret(ctx, request("stripe", API_KEY, "k", Map.of(), null)),
          PluginUnavailableException.class);
    } finally {
      breaker.transitionToClosedState();
    }

    assertThat(gateway.quotaStatus(ctx).join().secretCount()).isZero();
    assertThat(upsert(ctx, "stripe", API_KEY, "k", Map.of()).version()).isEqualTo(1);
  }

  @Test
  void shouldRecordExactlyOneAuditEntryPerCall() {
    upsert(ctx, "stripe", API_KEY, "k", Map.of());
    read(ctx, "stripe", API_KEY);
    gateway.getSecretMaterial(ctx, "missing", API_KEY).exceptionally(e -> null).join();
    gateway.listVersions(ctx, "stripe", API_KEY).join();

    assertThat(auditLogRepository.countByTenantId(tenantId)).isEqualTo(4);
    var failures =
        auditLogRepository
            .findByFilter(
                tenantId, null, AuditOutcome.FAILURE, null, null, null, null, PageRequest.of(0, 10))
            .getContent();
    assertThat(failures)
        .singleElement()
        .satisfies(
            entry -> {
              assertThat(entry.getOperation()).isEqualTo(AuditOperation.GET_SECRET_MATERIAL);
              assertThat(entry.getSecretId()).isEqualTo("missing");
              assertThat(entry.getErrorCode()).isEqualTo("NOT_FOUND");
              assertThat(entry.getActorId()).isEqualTo("svc-billing");
            });
  }

  @Test
  void shouldNeverWriteSecretValuesIntoTheAuditTrail() {
    upsert(ctx, "stripe", API_KEY, "sk_live_audit_marker", Map.of());
    read(ctx, "stripe", API_KEY);

    var entries =
        auditLogRepository
            .findByFilter(tenantId, null, null, null, null, null, null, PageRequest.of(0, 10))
            .getContent();
    assertThat(entries).hasSize(2);
    assertThat(entries)
        .extracting(AuditLogEntry::getDetails)
        .allSatisfy(details -> assertThat(String.valueOf(details)).doesNotContain("sk_live"));
    assertThat(entries)
        .filteredOn(entry -> entry.getOperation() == AuditOperation.UPSERT_SECRET)
        .singleElement()
        .satisfies(entry -> assertThat(entry.getDetails()).containsEntry("version", 1));
  }

  @Test
  void shouldQueryAndExportTheTenantsAuditTrail() throws Exception {
    upsert(ctx, "stripe", API_KEY, "k", Map.of());
    read(ctx, "stripe", API_KEY);

    var page =
        gateway
            .queryAudit(
                ctx,
                new AuditQuery(AuditOperation.UPSERT_SECRET, null, null, null, null, null),
                PageRequest.of(0, 10))
            .join();
    assertThat(page.getContent())
        .singleElement()
        .satisfies(entry -> assertThat(entry.secretId()).isEqualTo("stripe"));

    var out = new StringWriter();
    long written = gateway.exportAudit(ctx, AuditQuery.all(), out).join();

    // upsert, read and the query above
    assertThat(written).isEqualTo(3);
    var lines = out.toString().lines().toList();
    assertThat(lines).hasSize(3);
    for (String line : lines) {
      assertThat(objectMapper.readTree(line).path("tenantId").asText())
          .isEqualTo(tenantId.toString());
    }
  }

  private UpsertResult upsert(
      CallerContext caller, String secretId, String type, String value, Map<String, Object> p) {
    return gateway.upsertSecret(caller, request(secretId, type, value, p, null)).join();
  }

  private String read(CallerContext caller, String secretId, String type) {
    return text(gateway.getSecretMaterial(caller, secretId, type).join().payload());
  }

  private void overrideLimits(QuotaLimits limits) {
    administration.overrideQuota(CallerContext.system(null), tenantId, limits).join();
  }

  private static UpsertSecretRequest request(
      String secretId, String type, String value, Map<String, Object> p, Integer expected) {
    return new UpsertSecretRequest(
        secretId, type, value.getBytes(StandardCharsets.UTF_8), p, expected);
  }

  private static String text(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private static void assertNotFound(CompletableFuture<?> future) {
    assertFailsWith(future, ResourceNotFoundException.class);
  }

  private static void assertForbidden(CompletableFuture<?> future) {
    assertFailsWith(future, ForbiddenException.class);
  }

  private static void assertFailsWith(
      CompletableFuture<?> future, Class<? extends Throwable> expected) {
    assertThatThrownBy(future::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(expected);
  }
}
