package io.b2mash.credstore.registry;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backend selection settings.
 *
 * @param vendor when set, only instances of this vendor are eligible
 * @param priorityOverrides instance id to priority, replacing the declared priority
 */
@ConfigurationProperties(prefix = "credstore.backends")
public record RegistryProperties(String vendor, Map<String, Integer> priorityOverrides) {

  public RegistryProperties {
    priorityOverrides = priorityOverrides == null ? Map.of() : Map.copyOf(priorityOverrides);
  }
}
