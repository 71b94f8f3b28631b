package io.b2mash.credstore.quota;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Per-tenant ceilings.
 *
 * @param maxVersions upper bound on retained versions per secret; the secret type's own maximum
 *     applies when lower
 * @param auditRetentionDays audit entries older than this are swept; null falls back to {@code
 *     audit.retention.days}
 */
public record QuotaLimits(
    @Min(1) @DefaultValue("1000") int maxSecrets,
    @Min(1) @DefaultValue("65536") int maxPayloadBytes,
    @Min(1) @DefaultValue("50") int maxVersions,
    @Min(1) @DefaultValue("600") int writesPerMinute,
    @Min(1) @DefaultValue("6000") int readsPerMinute,
    @Min(1) Integer auditRetentionDays) {}
