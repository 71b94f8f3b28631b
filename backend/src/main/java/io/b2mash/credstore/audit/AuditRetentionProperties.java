package io.b2mash.credstore.audit;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for audit retention.
 *
 * @param days default retention window; a tenant quota can override it
 * @param purgeEnabled whether the scheduled sweep deletes anything
 */
@Validated
@ConfigurationProperties(prefix = "audit.retention")
public record AuditRetentionProperties(
    @Min(1) @DefaultValue("365") int days, @DefaultValue("true") boolean purgeEnabled) {}
