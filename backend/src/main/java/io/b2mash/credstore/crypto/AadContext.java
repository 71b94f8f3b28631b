package io.b2mash.credstore.crypto;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/**
 * Scope bound into the authentication tag of every sealed secret. A ciphertext sealed for one
 * tenant, secret, type or user fails authentication when presented with any other.
 */
public record AadContext(UUID tenantId, String secretId, String secretTypeId, UUID userId) {

  private static final byte[] FORMAT = "credstore-aad-v1".getBytes(StandardCharsets.US_ASCII);

  public AadContext {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(secretId, "secretId");
    Objects.requireNonNull(secretTypeId, "secretTypeId");
  }

  /** Length-prefixed canonical encoding; an absent user id encodes as an empty field. */
  public byte[] encode() {
    var out = new ByteArrayOutputStream();
    writeField(out, FORMAT);
    writeField(out, tenantId.toString().getBytes(StandardCharsets.UTF_8));
    writeField(out, secretId.getBytes(StandardCharsets.UTF_8));
    writeField(out, secretTypeId.getBytes(StandardCharsets.UTF_8));
    writeField(
        out, userId == null ? new byte[0] : userId.toString().getBytes(StandardCharsets.UTF_8));
    return out.toByteArray();
  }

  private static void writeField(ByteArrayOutputStream out, byte[] value) {
    out.writeBytes(ByteBuffer.allocate(4).putInt(value.length).array());
    out.writeBytes(value);
  }
}
