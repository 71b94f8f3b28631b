package io.b2mash.credstore.backend;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a secret backend instance. The backend registry discovers beans annotated
 * with this at startup and ranks them by priority.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface SecretBackendPlugin {

  /** Unique instance id (e.g., "embedded", "vault"). */
  String instanceId();

  /** Lower wins. Can be overridden per instance through configuration. */
  int priority();

  /** Vendor name used by the optional vendor filter. */
  String vendor();

  /** Whether the instance envelope-encrypts payloads itself through the crypto engine. */
  boolean encrypting();
}
