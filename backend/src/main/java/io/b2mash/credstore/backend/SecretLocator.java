package io.b2mash.credstore.backend;

import java.util.Objects;

/**
 * Addresses secret material inside a backend. Tenant and user come from the caller context.
 *
 * @param version a single version, or null to address every version (delete only)
 */
public record SecretLocator(String secretId, String secretTypeId, Integer version) {

  public SecretLocator {
    Objects.requireNonNull(secretId, "secretId");
    Objects.requireNonNull(secretTypeId, "secretTypeId");
  }

  public static SecretLocator of(String secretId, String secretTypeId, int version) {
    return new SecretLocator(secretId, secretTypeId, version);
  }

  public static SecretLocator allVersions(String secretId, String secretTypeId) {
    return new SecretLocator(secretId, secretTypeId, null);
  }

  public int requireVersion() {
    if (version == null) {
      throw new IllegalArgumentException("Secret " + secretId + " addressed without a version");
    }
    return version;
  }
}
