package io.b2mash.credstore.crypto;

import java.security.spec.AlgorithmParameterSpec;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;

/**
 * Authenticated ciphers a blob may be sealed with. The identifier is persisted per blob so data
 * written under one default stays decryptable after the default changes.
 */
public enum CipherAlgorithm {
  AES_256_GCM("AES/GCM/NoPadding", "AES"),
  CHACHA20_POLY1305("ChaCha20-Poly1305", "ChaCha20");

  static final int NONCE_LENGTH = 12; // bytes, both ciphers
  static final int KEY_LENGTH = 32; // bytes
  private static final int GCM_TAG_LENGTH = 128; // bits

  private final String transformation;
  private final String keyAlgorithm;

  CipherAlgorithm(String transformation, String keyAlgorithm) {
    this.transformation = transformation;
    this.keyAlgorithm = keyAlgorithm;
  }

  String transformation() {
    return transformation;
  }

  String keyAlgorithm() {
    return keyAlgorithm;
  }

  AlgorithmParameterSpec parameterSpec(byte[] nonce) {
    return switch (this) {
      case AES_256_GCM -> new GCMParameterSpec(GCM_TAG_LENGTH, nonce);
      case CHACHA20_POLY1305 -> new IvParameterSpec(nonce);
    };
  }
}
