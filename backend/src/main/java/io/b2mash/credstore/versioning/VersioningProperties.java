package io.b2mash.credstore.versioning;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param staleReservationAge PENDING versions older than this are considered abandoned
 */
@Validated
@ConfigurationProperties(prefix = "credstore.versioning")
public record VersioningProperties(@NotNull @DefaultValue("10m") Duration staleReservationAge) {}
