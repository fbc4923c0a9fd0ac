package com.codeheadsystems.vault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * Signature bytes produced by {@code keySign}.
 *
 * @param bytes the raw signature
 */
public record Signature(@JsonValue byte[] bytes) {

  public Signature {
    if (bytes == null) {
      throw new IllegalArgumentException("Signature bytes must not be null");
    }
    bytes = bytes.clone();
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Signature of(byte[] bytes) {
    return new Signature(bytes);
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Signature other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return "Signature[" + Hex.toHexString(bytes) + "]";
  }
}
