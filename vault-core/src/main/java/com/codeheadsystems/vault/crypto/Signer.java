package com.codeheadsystems.vault.crypto;

import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.model.KeyPair;
import com.codeheadsystems.vault.model.PublicKey;
import com.codeheadsystems.vault.model.Signature;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

/**
 * Pure Ed25519 (RFC 8032) signing and verification.
 */
public class Signer {

  private Signer() {
  }

  /**
   * Signs the message with a signing-capable key pair.
   *
   * @param keyPair the key pair
   * @param message the message
   * @return the signature
   * @throws VaultException with {@link ErrorKind#UNSUPPORTED_OPERATION} for agreement-only keys
   */
  public static Signature sign(KeyPair keyPair, byte[] message) {
    if (!keyPair.type().canSign()) {
      throw new VaultException(ErrorKind.UNSUPPORTED_OPERATION,
          keyPair.type() + " keys cannot be used for signing");
    }
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, new Ed25519PrivateKeyParameters(keyPair.privateKey().bytes(), 0));
    signer.update(message, 0, message.length);
    return Signature.of(signer.generateSignature());
  }

  /**
   * Verifies an Ed25519 signature.
   *
   * @param publicKey the signer's public key
   * @param message   the message
   * @param signature the signature
   * @return true if the signature is valid
   */
  public static boolean verify(PublicKey publicKey, byte[] message, Signature signature) {
    if (publicKey.length() != Ed25519PublicKeyParameters.KEY_SIZE) {
      return false;
    }
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(publicKey.bytes(), 0));
    verifier.update(message, 0, message.length);
    return verifier.verifySignature(signature.bytes());
  }
}
