package com.codeheadsystems.vault.common;

import java.util.Arrays;

/**
 * Owns a sensitive buffer (shared secret, derived key, content-encryption key) and wipes it
 * on {@link #close()}. Intended for try-with-resources so early returns and exceptions clear
 * the buffer exactly like the success path.
 * <p>
 * The wrapped array is not copied; callers hand over ownership.
 */
public final class SecretBytes implements AutoCloseable {

  private final byte[] bytes;
  private volatile boolean destroyed;

  public SecretBytes(byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("Secret bytes must not be null");
    }
    this.bytes = bytes;
  }

  /**
   * The live buffer. Do not retain the reference beyond the owning scope.
   *
   * @return the byte [ ]
   * @throws IllegalStateException if the secret was already wiped
   */
  public byte[] bytes() {
    if (destroyed) {
      throw new IllegalStateException("Secret has been destroyed");
    }
    return bytes;
  }

  public int length() {
    return bytes.length;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public void close() {
    Arrays.fill(bytes, (byte) 0);
    destroyed = true;
  }

  @Override
  public String toString() {
    return "SecretBytes[" + bytes.length + " bytes]";
  }
}
