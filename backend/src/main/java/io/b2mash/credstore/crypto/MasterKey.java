package io.b2mash.credstore.crypto;

import jakarta.annotation.PostConstruct;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/** Root key that encrypts KEK material at rest. Loaded from configuration, validated at startup. */
@Component
class MasterKey {

  private final SecretKeySpec key;
  private final SecureRandom secureRandom = new SecureRandom();

  MasterKey(CryptoProperties properties) {
    String encodedKey = properties.masterKey();
    if (encodedKey == null || encodedKey.isBlank()) {
      this.key = null; // Will fail at @PostConstruct
    } else {
      byte[] keyBytes = Base64.getDecoder().decode(encodedKey);
      this.key = new SecretKeySpec(keyBytes, "AES");
    }
  }

  @PostConstruct
  void validateKey() {
    if (key == null) {
      throw new IllegalStateException(
          "credstore.crypto.master-key is not set. "
              + "Cannot start without a master key for KEK storage.");
    }
    if (key.getEncoded().length != CipherAlgorithm.KEY_LENGTH) {
      throw new IllegalStateException(
          "credstore.crypto.master-key must be a Base64-encoded 256-bit (32-byte) key. "
              + "Got "
              + key.getEncoded().length
              + " bytes.");
    }
  }

  byte[] wrapKekMaterial(KekRef ref, byte[] material) throws GeneralSecurityException {
    return Aead.box(key, material, aad(ref), secureRandom);
  }

  byte[] unwrapKekMaterial(KekRef ref, byte[] wrapped) throws GeneralSecurityException {
    return Aead.unbox(key, wrapped, aad(ref));
  }

  private static byte[] aad(KekRef ref) {
    return ("kek|" + ref).getBytes(StandardCharsets.UTF_8);
  }
}
