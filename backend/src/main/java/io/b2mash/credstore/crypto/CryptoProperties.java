package io.b2mash.credstore.crypto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Crypto engine settings.
 *
 * @param masterKey Base64-encoded 256-bit key that encrypts KEK material at rest
 * @param defaultAlgorithm cipher used for new seals
 * @param kekScope whether KEKs are global or per tenant
 * @param rewrapBatchSize blobs re-wrapped per batch by the background job
 * @param kekCacheTtl how long unwrapped KEK material stays cached in memory
 */
@Validated
@ConfigurationProperties(prefix = "credstore.crypto")
public record CryptoProperties(
    String masterKey,
    @NotNull @DefaultValue("AES_256_GCM") CipherAlgorithm defaultAlgorithm,
    @NotNull @DefaultValue("GLOBAL") KekScopeMode kekScope,
    @Min(1) @DefaultValue("100") int rewrapBatchSize,
    @NotNull @DefaultValue("5m") Duration kekCacheTtl) {}
