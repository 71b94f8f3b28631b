package io.b2mash.credstore.secrettype;

/** Value kinds a secret type's free-form parameters may take. */
public enum ParameterKind {
  STRING,
  NUMBER,
  BOOLEAN;

  boolean accepts(Object value) {
    return switch (this) {
      case STRING -> value instanceof String;
      case NUMBER -> value instanceof Number;
      case BOOLEAN -> value instanceof Boolean;
    };
  }
}
