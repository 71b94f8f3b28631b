package io.b2mash.credstore.backend.vault;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.credstore.backend.SecretLocator;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.exception.PluginUnavailableException;
import io.b2mash.credstore.exception.ResourceNotFoundException;
import io.b2mash.credstore.exception.TransientBackendException;
import io.b2mash.credstore.security.CallerContext;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class VaultKvBackendTest {

  private static final String VAULT = "http://vault.test:8200";
  private static final UUID TENANT = UUID.fromString("6f1c2a10-0000-4000-8000-000000000001");
  private static final UUID OTHER_TENANT = UUID.fromString("6f1c2a10-0000-4000-8000-000000000002");
  private static final String DATA_PATH =
      VAULT + "/v1/secret/data/tenants/" + TENANT + "/api_key/stripe/v";
  private static final String METADATA_PATH =
      VAULT + "/v1/secret/metadata/tenants/" + TENANT + "/api_key/stripe";

  private MockRestServiceServer server;
  private VaultKvBackend backend;
  private final CallerContext ctx = CallerContext.builder().tenantId(TENANT).build();

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    backend =
        new VaultKvBackend(new VaultProperties(true, VAULT, "s.test-token", "secret"), builder);
  }

  private static String document(UUID tenant, String type, String user, String value) {
    return """
        {"data": {"data": {"tenant": "%s", "type": "%s", "user": "%s", "value": "%s"},
                  "metadata": {"version": 1}}}
        """
        .formatted(tenant, type, user, value);
  }

  private static String base64(String value) {
    return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void shouldWriteScopedDocumentToVersionPath() {
    server
        .expect(requestTo(DATA_PATH + "3"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("X-Vault-Token", "s.test-token"))
        .andExpect(jsonPath("$.data.tenant").value(TENANT.toString()))
        .andExpect(jsonPath("$.data.type").value("api_key"))
        .andExpect(jsonPath("$.data.user").value(""))
        .andExpect(jsonPath("$.data.value").value(base64("sk_live_123")))
        .andExpect(jsonPath("$.data.parameters.provider").value("stripe"))
        .andRespond(withSuccess());

    backend.upsertSecret(
        ctx,
        SecretLocator.of("stripe", "api_key", 3),
        "sk_live_123".getBytes(StandardCharsets.UTF_8),
        Map.of("provider", "stripe"));

    server.verify();
  }

  @Test
  void shouldReturnDecodedValueOnRead() {
    server
        .expect(requestTo(DATA_PATH + "1"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                document(TENANT, "api_key", "", base64("sk_live_123")),
                MediaType.APPLICATION_JSON));

    byte[] material = backend.getSecretMaterial(ctx, SecretLocator.of("stripe", "api_key", 1));

    assertThat(new String(material, StandardCharsets.UTF_8)).isEqualTo("sk_live_123");
  }

  @Test
  void shouldRejectDocumentOfAnotherTenant() {
    server
        .expect(requestTo(DATA_PATH + "1"))
        .andRespond(
            withSuccess(
                document(OTHER_TENANT, "api_key", "", base64("sk_live_123")),
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(
            () -> backend.getSecretMaterial(ctx, SecretLocator.of("stripe", "api_key", 1)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void shouldRejectDocumentOwnedByAnotherUser() {
    server
        .expect(requestTo(DATA_PATH + "1"))
        .andRespond(
            withSuccess(
                document(TENANT, "api_key", UUID.randomUUID().toString(), base64("x")),
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(
            () -> backend.getSecretMaterial(ctx, SecretLocator.of("stripe", "api_key", 1)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void shouldMapNotFoundToResourceNotFound() {
    server.expect(requestTo(DATA_PATH + "7")).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(
            () -> backend.getSecretMaterial(ctx, SecretLocator.of("stripe", "api_key", 7)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void shouldTreatServerErrorsAsTransient() {
    server
        .expect(requestTo(DATA_PATH + "1"))
        .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

    assertThatThrownBy(
            () -> backend.getSecretMaterial(ctx, SecretLocator.of("stripe", "api_key", 1)))
        .isInstanceOf(TransientBackendException.class);
  }

  @Test
  void shouldTreatThrottlingAsTransient() {
    server
        .expect(requestTo(DATA_PATH + "1"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

    assertThatThrownBy(
            () -> backend.getSecretMaterial(ctx, SecretLocator.of("stripe", "api_key", 1)))
        .isInstanceOf(TransientBackendException.class);
  }

  @Test
  void shouldNotRetryPermissionDenied() {
    server.expect(requestTo(DATA_PATH + "1")).andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(
            () -> backend.getSecretMaterial(ctx, SecretLocator.of("stripe", "api_key", 1)))
        .isInstanceOf(PluginUnavailableException.class);
  }

  @Test
  void shouldListThenDeleteEachVersionWhenDeletingAll() {
    server
        .expect(requestTo(METADATA_PATH + "?list=true"))
        .andExpect(method(HttpMethod.GET))
        .andRespond(
            withSuccess(
                "{\"data\": {\"keys\": [\"v1\", \"v2\", \"notes/\"]}}",
                MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(METADATA_PATH + "/v1"))
        .andExpect(method(HttpMethod.DELETE))
        .andRespond(withSuccess());
    server
        .expect(requestTo(METADATA_PATH + "/v2"))
        .andExpect(method(HttpMethod.DELETE))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    backend.deleteSecret(ctx, SecretLocator.allVersions("stripe", "api_key"));

    server.verify();
  }

  @Test
  void shouldIgnoreDeleteOfUnknownSecret() {
    server
        .expect(requestTo(METADATA_PATH + "?list=true"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    backend.deleteSecret(ctx, SecretLocator.allVersions("stripe", "api_key"));

    server.verify();
  }

  @Test
  void shouldRefuseCallsWithoutTenant() {
    assertThatThrownBy(
            () ->
                backend.getSecretMaterial(
                    CallerContext.anonymous(), SecretLocator.of("stripe", "api_key", 1)))
        .isInstanceOf(ForbiddenException.class);
  }
}
