package com.codeheadsystems.vault.crypto;

import com.codeheadsystems.vault.common.ByteUtils;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import com.codeheadsystems.vault.model.EncryptionAlgorithm;
import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * AES-256-GCM with a detached tag.
 */
public class Aes256Gcm {

  private static final EncryptionAlgorithm ALGORITHM = EncryptionAlgorithm.AES256GCM;

  private Aes256Gcm() {
  }

  /**
   * Encrypts the plaintext. The caller supplies a fresh nonce per call.
   *
   * @param key            32-byte key
   * @param nonce          12-byte nonce
   * @param associatedData authenticated but unencrypted data
   * @param plaintext      the plaintext
   * @return ciphertext and tag
   */
  public static Sealed encrypt(byte[] key, byte[] nonce, byte[] associatedData, byte[] plaintext) {
    validate(ErrorKind.ENCRYPTION_FAILURE, key, nonce);
    GCMModeCipher cipher = init(true, key, nonce, associatedData);
    byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
    try {
      int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
      len += cipher.doFinal(out, len);
      int ciphertextLength = len - ALGORITHM.tagLength();
      return new Sealed(Arrays.copyOf(out, ciphertextLength),
          Arrays.copyOfRange(out, ciphertextLength, len));
    } catch (InvalidCipherTextException e) {
      throw new VaultException(ErrorKind.ENCRYPTION_FAILURE, "AES-256-GCM encryption failed", e);
    }
  }

  /**
   * Verifies the tag and decrypts. GCM never pads, so the result has exactly the length
   * of the authenticated plaintext.
   *
   * @param key            32-byte key
   * @param nonce          12-byte nonce
   * @param associatedData associated data used at encryption
   * @param ciphertext     the ciphertext
   * @param tag            16-byte tag
   * @return the plaintext
   * @throws VaultException with {@link ErrorKind#DECRYPTION_FAILURE} if authentication fails
   */
  public static byte[] decrypt(byte[] key, byte[] nonce, byte[] associatedData,
                               byte[] ciphertext, byte[] tag) {
    validate(ErrorKind.DECRYPTION_FAILURE, key, nonce);
    if (tag.length != ALGORITHM.tagLength()) {
      throw new VaultValidationException(ErrorKind.DECRYPTION_FAILURE,
          "expected tag of length " + ALGORITHM.tagLength() + ", got " + tag.length);
    }
    GCMModeCipher cipher = init(false, key, nonce, associatedData);
    byte[] out = new byte[cipher.getOutputSize(ciphertext.length + tag.length)];
    try {
      int len = cipher.processBytes(ciphertext, 0, ciphertext.length, out, 0);
      len += cipher.processBytes(tag, 0, tag.length, out, len);
      len += cipher.doFinal(out, len);
      return len == out.length ? out : Arrays.copyOf(out, len);
    } catch (InvalidCipherTextException e) {
      // GCM releases plaintext before the tag is checked.
      ByteUtils.zeroize(out);
      throw new VaultException(ErrorKind.DECRYPTION_FAILURE, "AES-256-GCM authentication failed", e);
    }
  }

  private static GCMModeCipher init(boolean forEncryption, byte[] key, byte[] nonce, byte[] associatedData) {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption,
        new AEADParameters(new KeyParameter(key), ALGORITHM.tagLength() * 8, nonce, associatedData));
    return cipher;
  }

  private static void validate(ErrorKind kind, byte[] key, byte[] nonce) {
    if (key == null || key.length != ALGORITHM.keyLength()) {
      throw new VaultValidationException(kind, "expected key of length " + ALGORITHM.keyLength());
    }
    if (nonce == null || nonce.length != ALGORITHM.nonceLength()) {
      throw new VaultValidationException(kind, "expected nonce of length " + ALGORITHM.nonceLength());
    }
  }

  /**
   * Ciphertext and detached authentication tag.
   */
  public record Sealed(byte[] ciphertext, byte[] tag) {
  }
}
