package io.b2mash.credstore.crypto;

import io.b2mash.credstore.exception.DecryptionFailureException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.UUID;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Envelope encryption for secret payloads. Each seal generates a fresh DEK, encrypts the payload
 * with an authenticated cipher bound to the caller's {@link AadContext}, and wraps the DEK with
 * the active KEK of the tenant's scope. DEKs and KEKs never leave this class in clear.
 *
 * <p>Failures while opening a blob are never retried: an authentication failure is reported as
 * {@link DecryptionFailureException}, a missing or revoked KEK as {@code KekUnavailableException}.
 */
@Service
@EnableConfigurationProperties(CryptoProperties.class)
public class CryptoEngine {

  private final KeyManagementService keyManagementService;
  private final CryptoProperties properties;
  private final SecureRandom secureRandom = new SecureRandom();

  public CryptoEngine(KeyManagementService keyManagementService, CryptoProperties properties) {
    this.keyManagementService = keyManagementService;
    this.properties = properties;
  }

  /** Seals with the configured default cipher. */
  public SealedSecret seal(byte[] plaintext, AadContext aad) {
    return seal(plaintext, aad, properties.defaultAlgorithm());
  }

  public SealedSecret seal(byte[] plaintext, AadContext aad, CipherAlgorithm algorithm) {
    var kek = keyManagementService.active(scopeFor(aad.tenantId()));
    byte[] dek = newDek();
    try {
      byte[] nonce = Aead.newNonce(secureRandom);
      byte[] ciphertext =
          Aead.encrypt(
              algorithm,
              new SecretKeySpec(dek, algorithm.keyAlgorithm()),
              nonce,
              plaintext,
              aad.encode());
      byte[] wrappedDek = Aead.box(kek.key(), dek, wrapAad(kek.ref()), secureRandom);
      return new SealedSecret(algorithm, ciphertext, nonce, wrappedDek, kek.ref());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Encryption failed", e);
    } finally {
      Arrays.fill(dek, (byte) 0);
    }
  }

  /**
   * Opens a sealed secret. The KEK named by the blob may be active or deprecated. Any tampering
   * with the ciphertext, the wrapped DEK or the scope yields {@link DecryptionFailureException}.
   */
  public byte[] unseal(SealedSecret sealed, AadContext aad) {
    var kek = keyManagementService.resolve(sealed.kekRef());
    byte[] dek = unwrapDek(kek, sealed.wrappedDek());
    try {
      var algorithm = sealed.algorithm();
      return Aead.decrypt(
          algorithm,
          new SecretKeySpec(dek, algorithm.keyAlgorithm()),
          sealed.nonce(),
          sealed.ciphertext(),
          aad.encode());
    } catch (GeneralSecurityException e) {
      throw new DecryptionFailureException(
          "Secret " + aad.secretId() + " failed authentication for the requested scope", e);
    } finally {
      Arrays.fill(dek, (byte) 0);
    }
  }

  /**
   * Replaces the DEK wrapper only: unwraps with the KEK that currently protects it and wraps again
   * with the active KEK of the same scope. The payload ciphertext is untouched.
   */
  public WrappedDek rewrap(byte[] wrappedDek, KekRef current) {
    var oldKek = keyManagementService.resolve(current);
    var newKek = keyManagementService.active(current.scope());
    if (newKek.ref().equals(current)) {
      return new WrappedDek(wrappedDek, current);
    }
    byte[] dek = unwrapDek(oldKek, wrappedDek);
    try {
      return new WrappedDek(
          Aead.box(newKek.key(), dek, wrapAad(newKek.ref()), secureRandom), newKek.ref());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("DEK re-wrap failed", e);
    } finally {
      Arrays.fill(dek, (byte) 0);
    }
  }

  /** Rotates the KEK of a scope; see {@link KeyManagementService#rotate}. */
  public KekRef rotateKek(String scope) {
    return keyManagementService.rotate(scope);
  }

  /** KEK scope that protects a tenant's secrets under the configured scope mode. */
  public String scopeFor(UUID tenantId) {
    return properties.kekScope().scopeFor(tenantId);
  }

  private byte[] unwrapDek(KeyManagementService.KekHandle kek, byte[] wrappedDek) {
    try {
      return Aead.unbox(kek.key(), wrappedDek, wrapAad(kek.ref()));
    } catch (GeneralSecurityException e) {
      throw new DecryptionFailureException(
          "Wrapped DEK failed authentication under " + kek.ref(), e);
    }
  }

  private byte[] newDek() {
    byte[] dek = new byte[CipherAlgorithm.KEY_LENGTH];
    secureRandom.nextBytes(dek);
    return dek;
  }

  private static byte[] wrapAad(KekRef ref) {
    return ("dek|" + ref).getBytes(StandardCharsets.UTF_8);
  }
}
