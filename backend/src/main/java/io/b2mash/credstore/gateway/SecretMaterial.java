package io.b2mash.credstore.gateway;

import java.util.Map;

/** Decrypted secret material of one version. The payload is redacted from {@link #toString()}. */
public record SecretMaterial(
    String secretId,
    String secretTypeId,
    int version,
    byte[] payload,
    Map<String, Object> parameters) {

  @Override
  public String toString() {
    return "SecretMaterial[secretId="
        + secretId
        + ", secretTypeId="
        + secretTypeId
        + ", version="
        + version
        + ", payload=<redacted>]";
  }
}
