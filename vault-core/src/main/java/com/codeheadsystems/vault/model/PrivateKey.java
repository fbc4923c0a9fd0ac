package com.codeheadsystems.vault.model;

import com.codeheadsystems.vault.common.ByteUtils;

/**
 * Private key bytes. Sensitive: {@link #zeroize()} (or {@link #close()}) overwrites the buffer.
 * <p>
 * {@link #wrap(byte[])} does not copy, so wiping the key wipes the caller's array. Backends
 * that consume a private key wipe it once the key pair has been reconstructed.
 */
public final class PrivateKey implements AutoCloseable {

  private final byte[] bytes;

  private PrivateKey(byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("Private key bytes must not be null");
    }
    this.bytes = bytes;
  }

  /**
   * Takes ownership of the array without copying it.
   *
   * @param bytes the bytes
   * @return the private key
   */
  public static PrivateKey wrap(byte[] bytes) {
    return new PrivateKey(bytes);
  }

  /**
   * Copies the array, leaving the caller's buffer untouched when this key is wiped.
   *
   * @param bytes the bytes
   * @return the private key
   */
  public static PrivateKey copyOf(byte[] bytes) {
    return new PrivateKey(bytes == null ? null : bytes.clone());
  }

  /**
   * The live buffer.
   *
   * @return the byte [ ]
   */
  public byte[] bytes() {
    return bytes;
  }

  public int length() {
    return bytes.length;
  }

  public void zeroize() {
    ByteUtils.zeroize(bytes);
  }

  @Override
  public void close() {
    zeroize();
  }

  @Override
  public String toString() {
    return "PrivateKey[redacted]";
  }
}
