package com.codeheadsystems.vault.model;

/**
 * A public/private key pair of a supported type. Owned by exactly one vault entry.
 *
 * @param type       the key type
 * @param publicKey  the public key
 * @param privateKey the private key
 */
public record KeyPair(KeyType type, PublicKey publicKey, PrivateKey privateKey) {

  public KeyPair {
    if (type == null || publicKey == null || privateKey == null) {
      throw new IllegalArgumentException("Key pair components must not be null");
    }
  }

  /**
   * Wipes the private half.
   */
  public void zeroize() {
    privateKey.zeroize();
  }
}
