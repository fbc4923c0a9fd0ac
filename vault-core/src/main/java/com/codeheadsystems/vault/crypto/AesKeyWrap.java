package com.codeheadsystems.vault.crypto;

import com.codeheadsystems.vault.common.SecretBytes;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESWrapEngine;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * AES-256 key wrap (RFC 3394). Wrapping adds one 8-byte block.
 */
public class AesKeyWrap {

  /**
   * Key-encryption key length for A256KW.
   */
  public static final int KEY_LENGTH = 32;
  /**
   * Wrap block size and overhead.
   */
  public static final int BLOCK = 8;

  private AesKeyWrap() {
  }

  /**
   * Wraps a key. Output length is {@code key.length + BLOCK}.
   *
   * @param kek the 32-byte key-encryption key
   * @param key the key to wrap; a multiple of 8 bytes, at least 16
   * @return the wrapped key
   */
  public static byte[] wrap(byte[] kek, byte[] key) {
    validateKek(ErrorKind.ENCRYPTION_FAILURE, kek);
    if (key.length < 2 * BLOCK || key.length % BLOCK != 0) {
      throw new VaultValidationException(ErrorKind.ENCRYPTION_FAILURE,
          "key to wrap must be a multiple of " + BLOCK + " bytes and at least " + (2 * BLOCK));
    }
    AESWrapEngine engine = new AESWrapEngine();
    engine.init(true, new KeyParameter(kek));
    return engine.wrap(key, 0, key.length);
  }

  /**
   * Unwraps a key and checks its integrity. Output length is {@code wrapped.length - BLOCK}.
   *
   * @param kek     the 32-byte key-encryption key
   * @param wrapped the wrapped key
   * @return the unwrapped key; close it when done
   * @throws VaultValidationException with {@link ErrorKind#DECRYPTION_FAILURE} if the input is
   *                                  shorter than one block or not block aligned
   * @throws VaultException           with {@link ErrorKind#DECRYPTION_FAILURE} if the integrity
   *                                  check fails
   */
  public static SecretBytes unwrap(byte[] kek, byte[] wrapped) {
    validateKek(ErrorKind.DECRYPTION_FAILURE, kek);
    if (wrapped == null || wrapped.length < BLOCK) {
      throw new VaultValidationException(ErrorKind.DECRYPTION_FAILURE,
          "wrapped key needs at least " + BLOCK + " bytes, has " + (wrapped == null ? 0 : wrapped.length));
    }
    int keyLength = wrapped.length - BLOCK;
    if (keyLength < 2 * BLOCK || keyLength % BLOCK != 0) {
      throw new VaultValidationException(ErrorKind.DECRYPTION_FAILURE,
          "wrapped key length " + wrapped.length + " is not a valid key wrap output");
    }
    AESWrapEngine engine = new AESWrapEngine();
    engine.init(false, new KeyParameter(kek));
    try {
      return new SecretBytes(engine.unwrap(wrapped, 0, wrapped.length));
    } catch (InvalidCipherTextException e) {
      throw new VaultException(ErrorKind.DECRYPTION_FAILURE, "AES key unwrap failed", e);
    }
  }

  private static void validateKek(ErrorKind kind, byte[] kek) {
    if (kek == null || kek.length != KEY_LENGTH) {
      throw new VaultValidationException(kind, "expected key-encryption key of length " + KEY_LENGTH);
    }
  }
}
