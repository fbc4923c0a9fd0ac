package com.codeheadsystems.vault.crypto;

import com.codeheadsystems.vault.common.ByteUtils;
import com.codeheadsystems.vault.common.SecretBytes;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.model.AgreementInfo;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Single-step Concat KDF with SHA-256 (NIST SP 800-56A §5.8.1) in the form used by JWA
 * ECDH-ES (RFC 7518 §4.6.2).
 * <p>
 * Round {@code i} (1-indexed) hashes: BE32(i) ‖ Z ‖ BE32(len(alg)) ‖ alg ‖ BE32(len(apu)) ‖ apu
 * ‖ BE32(len(apv)) ‖ apv ‖ pubInfo ‖ privInfo. The round digests are concatenated and
 * truncated to the requested length.
 */
public class ConcatKdf {

  private static final long MAX_ROUNDS = 0xFFFFFFFFL;

  private ConcatKdf() {
  }

  /**
   * Derives {@code length} bytes from a shared secret.
   *
   * @param algorithm    the algorithm identifier bound into the output
   * @param length       output length in bytes
   * @param sharedSecret the raw agreement output Z
   * @param agreement    party and supplemental context
   * @return the derived key; close it when done
   * @throws VaultException with {@link ErrorKind#ENCRYPTION_FAILURE} for a non-positive length
   *                        or a round count beyond the 32-bit counter
   */
  public static SecretBytes derive(String algorithm, int length, byte[] sharedSecret,
                                   AgreementInfo agreement) {
    SHA256Digest digest = new SHA256Digest();
    int hashLen = digest.getDigestSize();
    long rounds = ((long) length + hashLen - 1) / hashLen;
    if (length <= 0 || rounds > MAX_ROUNDS) {
      throw new VaultException(ErrorKind.ENCRYPTION_FAILURE,
          algorithm + ": invalid derived key length " + length);
    }
    byte[] alg = algorithm.getBytes(StandardCharsets.UTF_8);
    byte[] output = new byte[length];
    byte[] round = new byte[hashLen];
    try {
      int copied = 0;
      for (int counter = 1; counter <= rounds; counter++) {
        update(digest, ByteUtils.I2OSP(counter, 4));
        update(digest, sharedSecret);
        update(digest, ByteUtils.I2OSP(alg.length, 4));
        update(digest, alg);
        update(digest, ByteUtils.I2OSP(agreement.apu().length, 4));
        update(digest, agreement.apu());
        update(digest, ByteUtils.I2OSP(agreement.apv().length, 4));
        update(digest, agreement.apv());
        update(digest, agreement.pubInfo());
        update(digest, agreement.privInfo());
        digest.doFinal(round, 0);
        int toCopy = Math.min(length - copied, hashLen);
        System.arraycopy(round, 0, output, copied, toCopy);
        copied += toCopy;
      }
    } finally {
      ByteUtils.zeroize(round);
    }
    return new SecretBytes(output);
  }

  private static void update(SHA256Digest digest, byte[] data) {
    digest.update(data, 0, data.length);
  }
}
