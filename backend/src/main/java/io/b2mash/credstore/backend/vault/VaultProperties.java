package io.b2mash.credstore.backend.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * HashiCorp Vault KV v2 backend settings. The backend is only registered when {@code enabled}.
 *
 * @param address base URL, e.g. {@code https://vault.internal:8200}
 * @param token Vault token sent as {@code X-Vault-Token}
 * @param mount KV v2 mount path
 */
@ConfigurationProperties(prefix = "credstore.backends.vault")
public record VaultProperties(
    boolean enabled, String address, String token, @DefaultValue("secret") String mount) {}
