package com.codeheadsystems.vault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * Public key bytes. Serialises to JSON as a Base64 string.
 *
 * @param bytes the raw public key
 */
public record PublicKey(@JsonValue byte[] bytes) {

  public PublicKey {
    if (bytes == null) {
      throw new IllegalArgumentException("Public key bytes must not be null");
    }
    bytes = bytes.clone();
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static PublicKey of(byte[] bytes) {
    return new PublicKey(bytes);
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PublicKey other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "PublicKey[" + Hex.toHexString(bytes) + "]";
  }
}
