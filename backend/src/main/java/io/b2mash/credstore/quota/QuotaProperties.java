package io.b2mash.credstore.quota;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param defaults limits applied when a tenant is provisioned
 */
@Validated
@ConfigurationProperties(prefix = "credstore.quota")
public record QuotaProperties(@Valid @NotNull @DefaultValue QuotaLimits defaults) {}
