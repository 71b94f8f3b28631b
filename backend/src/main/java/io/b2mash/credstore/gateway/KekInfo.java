package io.b2mash.credstore.gateway;

import io.b2mash.credstore.crypto.CipherAlgorithm;
import io.b2mash.credstore.crypto.KekMetadata;
import io.b2mash.credstore.crypto.KekStatus;
import java.time.Instant;

/**
 * KEK metadata as shown to administrators. Never carries key material.
 *
 * @param references blobs still wrapped under this KEK
 */
public record KekInfo(
    String scope,
    int version,
    KekStatus status,
    CipherAlgorithm algorithm,
    Instant createdAt,
    Instant rotatedAt,
    Instant revokedAt,
    long references) {

  static KekInfo from(KekMetadata kek, long references) {
    return new KekInfo(
        kek.getScope(),
        kek.getVersion(),
        kek.getStatus(),
        kek.getAlgorithm(),
        kek.getCreatedAt(),
        kek.getRotatedAt(),
        kek.getRevokedAt(),
        references);
  }
}
