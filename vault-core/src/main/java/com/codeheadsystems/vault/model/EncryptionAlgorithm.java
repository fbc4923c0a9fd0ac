package com.codeheadsystems.vault.model;

/**
 * Content encryption algorithms.
 */
public enum EncryptionAlgorithm {
  /**
   * AES-256 in Galois/Counter Mode with a 96-bit nonce and a detached 128-bit tag.
   */
  AES256GCM(32, 12, 16);

  private final int keyLength;
  private final int nonceLength;
  private final int tagLength;

  EncryptionAlgorithm(int keyLength, int nonceLength, int tagLength) {
    this.keyLength = keyLength;
    this.nonceLength = nonceLength;
    this.tagLength = tagLength;
  }

  public int keyLength() {
    return keyLength;
  }

  public int nonceLength() {
    return nonceLength;
  }

  public int tagLength() {
    return tagLength;
  }
}
