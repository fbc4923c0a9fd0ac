package com.codeheadsystems.vault.crypto;

import com.codeheadsystems.vault.common.SecretBytes;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import com.codeheadsystems.vault.model.KeyType;
import com.codeheadsystems.vault.model.PrivateKey;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/**
 * X25519 (RFC 7748) Diffie-Hellman.
 */
public class KeyAgreement {

  private KeyAgreement() {
  }

  /**
   * Computes the raw shared secret between a private key and a peer public key.
   *
   * @param privateKey    our X25519 private key
   * @param peerPublicKey the peer's X25519 public key
   * @return the 32-byte shared secret; close it when done
   * @throws VaultValidationException with {@link ErrorKind#INVALID_PUBLIC_KEY} or
   *                                  {@link ErrorKind#INVALID_PRIVATE_KEY} on wrong lengths
   * @throws VaultException           with {@link ErrorKind#INVALID_PUBLIC_KEY} if the peer key
   *                                  is a low-order point (all-zero shared secret)
   */
  public static SecretBytes x25519(PrivateKey privateKey, byte[] peerPublicKey) {
    if (peerPublicKey == null || peerPublicKey.length != KeyType.X25519.publicKeyLength()) {
      throw new VaultValidationException(ErrorKind.INVALID_PUBLIC_KEY,
          "expected public key of length " + KeyType.X25519.publicKeyLength());
    }
    if (privateKey.length() != KeyType.X25519.privateKeyLength()) {
      throw new VaultValidationException(ErrorKind.INVALID_PRIVATE_KEY,
          "expected private key of length " + KeyType.X25519.privateKeyLength());
    }
    X25519Agreement agreement = new X25519Agreement();
    agreement.init(new X25519PrivateKeyParameters(privateKey.bytes(), 0));
    SecretBytes shared = new SecretBytes(new byte[agreement.getAgreementSize()]);
    try {
      agreement.calculateAgreement(new X25519PublicKeyParameters(peerPublicKey, 0), shared.bytes(), 0);
    } catch (IllegalStateException e) {
      shared.close();
      throw new VaultException(ErrorKind.INVALID_PUBLIC_KEY, "X25519 agreement failed", e);
    }
    return shared;
  }
}
