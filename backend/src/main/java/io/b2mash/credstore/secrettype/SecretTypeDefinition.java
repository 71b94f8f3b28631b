package io.b2mash.credstore.secrettype;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Input for registering or updating a secret type, also bound from {@code credstore.secret-types}.
 *
 * @param maxVersions retained versions per secret, the current one included
 * @param retentionDays versions older than this are pruned; null keeps them regardless of age
 * @param encryptionRequired only locally encrypting backends may store this type
 */
public record SecretTypeDefinition(
    @NotBlank String id,
    ParameterSchema schema,
    @DefaultValue("true") boolean versioningEnabled,
    @Min(1) @DefaultValue("10") int maxVersions,
    @Min(1) Integer retentionDays,
    @DefaultValue("true") boolean encryptionRequired) {

  public SecretTypeDefinition {
    schema = schema == null ? ParameterSchema.open() : schema;
  }
}
