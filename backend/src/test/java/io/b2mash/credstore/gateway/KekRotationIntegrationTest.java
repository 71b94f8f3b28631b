package io.b2mash.credstore.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.b2mash.credstore.TestcontainersConfiguration;
import io.b2mash.credstore.backend.embedded.SecretBlob;
import io.b2mash.credstore.backend.embedded.SecretBlobRepository;
import io.b2mash.credstore.crypto.KekRef;
import io.b2mash.credstore.crypto.KekStatus;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.exception.ValidationFailedException;
import io.b2mash.credstore.security.CallerContext;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/** Rotation, re-wrap and revocation of per-tenant KEKs while secrets stay readable. */
@SpringBootTest(properties = "credstore.crypto.kek-scope=TENANT")
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class KekRotationIntegrationTest {

  private static final String TYPE = "api_key";

  @Autowired private SecretGatewayService gateway;
  @Autowired private StoreAdministrationService administration;
  @Autowired private SecretBlobRepository blobRepository;

  private UUID tenantId;
  private String scope;
  private CallerContext ctx;

  @BeforeEach
  void newTenant() {
    tenantId = UUID.randomUUID();
    scope = tenantId.toString();
    ctx = CallerContext.builder().tenantId(tenantId).actorId("rotation-test").build();
  }

  @Test
  void shouldKeepSecretsReadableAcrossRotationRewrapAndRevoke() {
    for (String id : new String[] {"stripe", "github", "slack"}) {
      write(id, "value-of-" + id);
    }
    var original = new KekRef(scope, 1);
    assertThat(kekOf("stripe")).isEqualTo(original);

    var rotated = administration.rotateKek(ctx, scope).join();

    assertThat(rotated).isEqualTo(new KekRef(scope, 2));
    assertThat(read("github")).isEqualTo("value-of-github");
    assertThatThrownBy(() -> administration.revokeKek(ctx, original).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(ValidationFailedException.class);

    var result = administration.rewrap(ctx, scope).join();

    assertThat(result.rewrapped()).isEqualTo(3);
    assertThat(result.failed()).isZero();
    assertThat(result.remaining()).isZero();
    for (String id : new String[] {"stripe", "github", "slack"}) {
      assertThat(kekOf(id)).isEqualTo(rotated);
      assertThat(read(id)).isEqualTo("value-of-" + id);
    }

    administration.revokeKek(ctx, original).join();

    var keks = administration.listKeks(ctx, scope).join();
    assertThat(keks)
        .extracting(KekInfo::version, KekInfo::status, KekInfo::references)
        .containsExactly(tuple(2, KekStatus.ACTIVE, 3L), tuple(1, KekStatus.REVOKED, 0L));
    assertThat(read("slack")).isEqualTo("value-of-slack");
  }

  @Test
  void shouldSealNewVersionsWithTheRotatedKek() {
    write("stripe", "v1");
    var rotated = administration.rotateKek(ctx, scope).join();

    write("stripe", "v2");

    var blob =
        blobRepository.findByTenantIdAndUserIdAndSecretIdAndSecretTypeIdAndVersion(
            tenantId, null, "stripe", TYPE, 2);
    assertThat(blob).get().extracting(SecretBlob::kekRef).isEqualTo(rotated);
    assertThat(kekOf("stripe", 1)).isEqualTo(new KekRef(scope, 1));
  }

  @Test
  void shouldRefuseToRevokeTheActiveKek() {
    write("stripe", "v1");

    assertThatThrownBy(() -> administration.revokeKek(ctx, new KekRef(scope, 1)).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(ValidationFailedException.class);
  }

  @Test
  void shouldNotLetOneTenantManageAnotherTenantsKeks() {
    var otherScope = UUID.randomUUID().toString();

    assertThatThrownBy(() -> administration.rotateKek(ctx, otherScope).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(ForbiddenException.class);
    assertThatThrownBy(() -> administration.rotateKek(ctx, "global").join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(ForbiddenException.class);
  }

  private void write(String secretId, String value) {
    gateway
        .upsertSecret(
            ctx,
            new UpsertSecretRequest(
                secretId, TYPE, value.getBytes(StandardCharsets.UTF_8), Map.of()))
        .join();
  }

  private String read(String secretId) {
    return new String(
        gateway.getSecretMaterial(ctx, secretId, TYPE).join().payload(), StandardCharsets.UTF_8);
  }

  private KekRef kekOf(String secretId) {
    return kekOf(secretId, 1);
  }

  private KekRef kekOf(String secretId, int version) {
    return blobRepository
        .findByTenantIdAndUserIdAndSecretIdAndSecretTypeIdAndVersion(
            tenantId, null, secretId, TYPE, version)
        .orElseThrow()
        .kekRef();
  }
}
