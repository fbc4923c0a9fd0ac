package com.codeheadsystems.vault.model;

/**
 * Supported key types. The type encodes usage capability, not just the curve:
 * Ed25519 keys sign, X25519 keys perform key agreement.
 */
public enum KeyType {
  ED25519(32, 32, true, false),
  X25519(32, 32, false, true);

  private final int privateKeyLength;
  private final int publicKeyLength;
  private final boolean signing;
  private final boolean agreement;

  KeyType(int privateKeyLength, int publicKeyLength, boolean signing, boolean agreement) {
    this.privateKeyLength = privateKeyLength;
    this.publicKeyLength = publicKeyLength;
    this.signing = signing;
    this.agreement = agreement;
  }

  public int privateKeyLength() {
    return privateKeyLength;
  }

  public int publicKeyLength() {
    return publicKeyLength;
  }

  public boolean canSign() {
    return signing;
  }

  public boolean canAgree() {
    return agreement;
  }
}
