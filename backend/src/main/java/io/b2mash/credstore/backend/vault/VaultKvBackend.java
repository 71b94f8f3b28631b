package io.b2mash.credstore.backend.vault;

import com.fasterxml.jackson.databind.JsonNode;
import io.b2mash.credstore.backend.SecretBackend;
import io.b2mash.credstore.backend.SecretBackendPlugin;
import io.b2mash.credstore.backend.SecretLocator;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.exception.PluginUnavailableException;
import io.b2mash.credstore.exception.ResourceNotFoundException;
import io.b2mash.credstore.exception.TransientBackendException;
import io.b2mash.credstore.security.CallerContext;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Stores secret material in an external HashiCorp Vault KV v2 engine. Each secret version lives at
 * its own path {@code tenants/{tenant}/{type}/{secret}/v{version}}. Tenant, type and owning user
 * are written into the document as well and re-checked on every read, so a path collision can
 * never hand one scope's data to another.
 *
 * <p>Vault encrypts at rest itself, so this backend does not envelope-encrypt and is skipped for
 * secret types that mandate local encryption.
 */
@Component
@ConditionalOnProperty(prefix = "credstore.backends.vault", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(VaultProperties.class)
@SecretBackendPlugin(
    instanceId = VaultKvBackend.INSTANCE_ID,
    priority = 50,
    vendor = "hashicorp",
    encrypting = false)
public class VaultKvBackend implements SecretBackend {

  public static final String INSTANCE_ID = "vault";

  private static final Logger log = LoggerFactory.getLogger(VaultKvBackend.class);

  private static final String SECRET_PATH = "/v1/{mount}/{kind}/tenants/{tenant}/{type}/{secret}";
  private static final String VERSION_PATH = SECRET_PATH + "/v{version}";

  private final RestClient restClient;
  private final String mount;

  public VaultKvBackend(VaultProperties properties, RestClient.Builder restClientBuilder) {
    Objects.requireNonNull(properties.address(), "credstore.backends.vault.address");
    this.mount = properties.mount();
    this.restClient =
        restClientBuilder
            .baseUrl(properties.address())
            .defaultHeader("X-Vault-Token", Objects.requireNonNullElse(properties.token(), ""))
            .build();
  }

  @Override
  public void upsertSecret(
      CallerContext ctx, SecretLocator locator, byte[] payload, Map<String, Object> parameters) {
    requireTenant(ctx);
    int version = locator.requireVersion();
    var document = new LinkedHashMap<String, Object>();
    document.put("tenant", ctx.tenantId().toString());
    document.put("type", locator.secretTypeId());
    document.put("user", ctx.userId() == null ? "" : ctx.userId().toString());
    document.put("value", Base64.getEncoder().encodeToString(payload));
    document.put("parameters", parameters == null ? Map.of() : parameters);

    exchange(
        locator,
        () ->
            restClient
                .post()
                .uri(VERSION_PATH, variables(ctx, locator, "data", version))
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("data", document))
                .retrieve()
                .toBodilessEntity());
    log.debug("Wrote {} v{} to vault", locator.secretId(), version);
  }

  @Override
  public byte[] getSecretMaterial(CallerContext ctx, SecretLocator locator) {
    requireTenant(ctx);
    int version = locator.requireVersion();
    JsonNode response =
        exchange(
            locator,
            () ->
                restClient
                    .get()
                    .uri(VERSION_PATH, variables(ctx, locator, "data", version))
                    .retrieve()
                    .body(JsonNode.class));
    if (response == null) {
      throw new ResourceNotFoundException("Secret", locator.secretId());
    }
    JsonNode document = response.path("data").path("data");
    String expectedUser = ctx.userId() == null ? "" : ctx.userId().toString();
    if (!ctx.tenantId().toString().equals(document.path("tenant").asText())
        || !locator.secretTypeId().equals(document.path("type").asText())
        || !expectedUser.equals(document.path("user").asText())) {
      log.warn("Vault document for {} does not match the requested scope", locator.secretId());
      throw new ResourceNotFoundException("Secret", locator.secretId());
    }
    return Base64.getDecoder().decode(document.path("value").asText());
  }

  @Override
  public void deleteSecret(CallerContext ctx, SecretLocator locator) {
    requireTenant(ctx);
    List<Integer> versions =
        locator.version() != null ? List.of(locator.version()) : listVersions(ctx, locator);
    for (int version : versions) {
      try {
        exchange(
            locator,
            () ->
                restClient
                    .delete()
                    .uri(VERSION_PATH, variables(ctx, locator, "metadata", version))
                    .retrieve()
                    .toBodilessEntity());
      } catch (ResourceNotFoundException e) {
        log.debug("Vault path for {} v{} already gone", locator.secretId(), version);
      }
    }
  }

  private List<Integer> listVersions(CallerContext ctx, SecretLocator locator) {
    JsonNode response;
    try {
      response =
          exchange(
              locator,
              () ->
                  restClient
                      .get()
                      .uri(
                          SECRET_PATH + "?list=true",
                          mount,
                          "metadata",
                          ctx.tenantId(),
                          locator.secretTypeId(),
                          locator.secretId())
                      .retrieve()
                      .body(JsonNode.class));
    } catch (ResourceNotFoundException e) {
      return List.of();
    }
    var versions = new ArrayList<Integer>();
    if (response != null) {
      for (JsonNode key : response.path("data").path("keys")) {
        String name = key.asText();
        if (name.matches("v\\d+")) {
          versions.add(Integer.parseInt(name.substring(1)));
        }
      }
    }
    return versions;
  }

  private Object[] variables(CallerContext ctx, SecretLocator locator, String kind, int version) {
    return new Object[] {
      mount, kind, ctx.tenantId(), locator.secretTypeId(), locator.secretId(), version
    };
  }

  private <T> T exchange(SecretLocator locator, Supplier<T> request) {
    try {
      return request.get();
    } catch (HttpClientErrorException.NotFound e) {
      throw new ResourceNotFoundException("Secret", locator.secretId());
    } catch (HttpClientErrorException e) {
      if (e.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)) {
        throw new TransientBackendException(INSTANCE_ID, "Vault throttled the request", e);
      }
      throw new PluginUnavailableException(
          "Vault rejected the request with status " + e.getStatusCode().value(), e);
    } catch (HttpServerErrorException e) {
      throw new TransientBackendException(
          INSTANCE_ID, "Vault returned status " + e.getStatusCode().value(), e);
    } catch (ResourceAccessException e) {
      throw new TransientBackendException(INSTANCE_ID, "Vault is unreachable", e);
    }
  }

  private static void requireTenant(CallerContext ctx) {
    if (!ctx.hasTenant()) {
      throw new ForbiddenException("Backend access requires a tenant scope");
    }
  }
}
