package com.codeheadsystems.vault.common;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Utility methods for octet string encoding, Base58 text encoding and buffer wiping.
 */
public class ByteUtils {

  private static final String BASE58_ALPHABET =
      "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
  private static final BigInteger BASE58 = BigInteger.valueOf(58);

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative integer to a big-endian octet string of specified length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(int value, int length) {
    if (value < 0 || (length < 4 && value >= (1 << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Base58 (Bitcoin alphabet) encoding. Leading zero bytes become leading '1' characters.
   *
   * @param input the input
   * @return the string
   */
  public static String base58(byte[] input) {
    int zeros = 0;
    while (zeros < input.length && input[zeros] == 0) {
      zeros++;
    }
    StringBuilder sb = new StringBuilder();
    BigInteger value = new BigInteger(1, input);
    while (value.signum() > 0) {
      BigInteger[] qr = value.divideAndRemainder(BASE58);
      sb.append(BASE58_ALPHABET.charAt(qr[1].intValue()));
      value = qr[0];
    }
    for (int i = 0; i < zeros; i++) {
      sb.append(BASE58_ALPHABET.charAt(0));
    }
    return sb.reverse().toString();
  }

  /**
   * Returns true if every character of the string belongs to the Base58 alphabet.
   *
   * @param value the value
   * @return the boolean
   */
  public static boolean isBase58(String value) {
    if (value == null || value.isEmpty()) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (BASE58_ALPHABET.indexOf(value.charAt(i)) < 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Overwrites the buffer with zeros. Null is ignored.
   *
   * @param buffer the buffer
   */
  public static void zeroize(byte[] buffer) {
    if (buffer != null) {
      Arrays.fill(buffer, (byte) 0);
    }
  }

  /**
   * Returns a copy of the array, treating null as empty.
   *
   * @param bytes the bytes
   * @return the byte [ ]
   */
  public static byte[] copyOrEmpty(byte[] bytes) {
    return bytes == null ? new byte[0] : bytes.clone();
  }
}
