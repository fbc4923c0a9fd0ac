package com.codeheadsystems.vault.crypto;

import com.codeheadsystems.vault.common.RandomProvider;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import com.codeheadsystems.vault.model.KeyPair;
import com.codeheadsystems.vault.model.KeyType;
import com.codeheadsystems.vault.model.PrivateKey;
import com.codeheadsystems.vault.model.PublicKey;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

/**
 * Generates key pairs and reconstructs them from raw private key bytes.
 */
public class KeyPairs {

  private KeyPairs() {
  }

  /**
   * Generates a fresh key pair.
   *
   * @param keyType        the key type
   * @param randomProvider source of randomness
   * @return the key pair
   */
  public static KeyPair generate(KeyType keyType, RandomProvider randomProvider) {
    return switch (keyType) {
      case ED25519 -> {
        Ed25519PrivateKeyParameters sk = new Ed25519PrivateKeyParameters(randomProvider.random());
        yield new KeyPair(keyType, PublicKey.of(sk.generatePublicKey().getEncoded()),
            PrivateKey.wrap(sk.getEncoded()));
      }
      case X25519 -> {
        X25519PrivateKeyParameters sk = new X25519PrivateKeyParameters(randomProvider.random());
        yield new KeyPair(keyType, PublicKey.of(sk.generatePublicKey().getEncoded()),
            PrivateKey.wrap(sk.getEncoded()));
      }
    };
  }

  /**
   * Reconstructs a key pair from raw private key bytes. The input is copied; wiping it
   * remains the caller's responsibility.
   *
   * @param keyType    the key type
   * @param privateKey the raw private key
   * @return the key pair
   * @throws VaultValidationException with {@link ErrorKind#INVALID_PRIVATE_KEY} if the length
   *                                  does not match the key type
   */
  public static KeyPair fromPrivateKey(KeyType keyType, byte[] privateKey) {
    if (privateKey == null || privateKey.length != keyType.privateKeyLength()) {
      throw new VaultValidationException(ErrorKind.INVALID_PRIVATE_KEY,
          "expected " + keyType + " private key of length " + keyType.privateKeyLength()
              + ", got " + (privateKey == null ? 0 : privateKey.length));
    }
    byte[] publicKey = switch (keyType) {
      case ED25519 -> new Ed25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
      case X25519 -> new X25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
    };
    return new KeyPair(keyType, PublicKey.of(publicKey), PrivateKey.copyOf(privateKey));
  }
}
