package io.b2mash.credstore.secrettype;

import jakarta.validation.Valid;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Secret types registered at startup from {@code credstore.secret-types}. */
@Validated
@ConfigurationProperties(prefix = "credstore")
public record SecretTypeProperties(@Valid List<SecretTypeDefinition> secretTypes) {

  public SecretTypeProperties {
    secretTypes = secretTypes == null ? List.of() : List.copyOf(secretTypes);
  }
}
