package io.b2mash.credstore.secrettype;

import io.b2mash.credstore.exception.ValidationFailedException;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Shape of the parameters stored next to a secret. A schema without declared properties accepts
 * any parameters; once properties are declared, undeclared names are rejected.
 *
 * @param properties parameter name to expected kind
 * @param required names that must be present
 */
public record ParameterSchema(Map<String, ParameterKind> properties, Set<String> required) {

  public ParameterSchema {
    properties = properties == null ? Map.of() : Map.copyOf(properties);
    required = required == null ? Set.of() : Set.copyOf(required);
    for (String name : required) {
      if (!properties.isEmpty() && !properties.containsKey(name)) {
        throw new IllegalArgumentException("Required parameter " + name + " is not declared");
      }
    }
  }

  public static ParameterSchema open() {
    return new ParameterSchema(Map.of(), Set.of());
  }

  /**
   * Checks parameters against the schema. Error details name parameters, never their values.
   *
   * @throws ValidationFailedException listing every violation
   */
  public void validate(Map<String, Object> parameters) {
    var actual = parameters == null ? Map.<String, Object>of() : parameters;
    var errors = new ArrayList<String>();
    for (String name : new TreeSet<>(required)) {
      if (actual.get(name) == null) {
        errors.add("missing required parameter '" + name + "'");
      }
    }
    if (!properties.isEmpty()) {
      for (var entry : new TreeMap<>(actual).entrySet()) {
        var kind = properties.get(entry.getKey());
        if (kind == null) {
          errors.add("unknown parameter '" + entry.getKey() + "'");
        } else if (entry.getValue() != null && !kind.accepts(entry.getValue())) {
          errors.add("parameter '" + entry.getKey() + "' must be " + kind);
        }
      }
    }
    if (!errors.isEmpty()) {
      throw new ValidationFailedException("Invalid parameters: " + String.join("; ", errors));
    }
  }
}
