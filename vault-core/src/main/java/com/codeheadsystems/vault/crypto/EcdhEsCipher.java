package com.codeheadsystems.vault.crypto;

import com.codeheadsystems.vault.common.RandomProvider;
import com.codeheadsystems.vault.common.SecretBytes;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.model.CekAlgorithm;
import com.codeheadsystems.vault.model.EncryptedData;
import com.codeheadsystems.vault.model.EncryptionAlgorithm;
import com.codeheadsystems.vault.model.KeyPair;
import com.codeheadsystems.vault.model.KeyType;
import com.codeheadsystems.vault.model.PublicKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Anonymous-sender authenticated encryption between identities: ECDH-ES and ECDH-ES+A256KW
 * over X25519, Concat-KDF and AES-256-GCM.
 * <p>
 * Every {@link #encrypt} generates its own ephemeral X25519 key pair and nonce. Shared secrets,
 * derived keys and content-encryption keys are wiped before the call returns, on every path.
 */
public class EcdhEsCipher {

  private static final Logger log = LoggerFactory.getLogger(EcdhEsCipher.class);

  private final RandomProvider randomProvider;

  public EcdhEsCipher(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Encrypts the plaintext for the holder of the recipient's static X25519 key.
   *
   * @param encryptionAlgorithm the content encryption algorithm
   * @param cekAlgorithm        how the content-encryption key is established
   * @param plaintext           the plaintext
   * @param associatedData      data authenticated alongside the ciphertext
   * @param recipientPublicKey  the recipient's X25519 public key
   * @return the envelope
   * @throws VaultException with {@link ErrorKind#INVALID_PUBLIC_KEY} for unusable recipient
   *                        keys, {@link ErrorKind#ENCRYPTION_FAILURE} for primitive failures
   */
  public EncryptedData encrypt(EncryptionAlgorithm encryptionAlgorithm, CekAlgorithm cekAlgorithm,
                               byte[] plaintext, byte[] associatedData, PublicKey recipientPublicKey) {
    log.debug("encrypt(alg={}, cek={})", encryptionAlgorithm, cekAlgorithm.name());
    KeyPair ephemeral = KeyPairs.generate(KeyType.X25519, randomProvider);
    try (SecretBytes shared = KeyAgreement.x25519(ephemeral.privateKey(), recipientPublicKey.bytes())) {
      return switch (cekAlgorithm.mode()) {
        case DIRECT -> encryptDirect(encryptionAlgorithm, cekAlgorithm, shared, plaintext, associatedData,
            ephemeral.publicKey());
        case KEY_WRAP -> encryptWrapped(encryptionAlgorithm, cekAlgorithm, shared, plaintext, associatedData,
            ephemeral.publicKey());
      };
    } finally {
      ephemeral.zeroize();
    }
  }

  /**
   * Decrypts an envelope with the recipient's static key pair.
   *
   * @param encryptionAlgorithm the content encryption algorithm used at encryption
   * @param cekAlgorithm        the CEK algorithm used at encryption, with the same agreement info
   * @param data                the envelope
   * @param recipient           the recipient's static key pair
   * @return the plaintext
   * @throws VaultException with {@link ErrorKind#INVALID_PRIVATE_KEY} for non-agreement keys,
   *                        {@link ErrorKind#INVALID_PUBLIC_KEY} for a malformed ephemeral key,
   *                        {@link ErrorKind#DECRYPTION_FAILURE} when authentication fails
   */
  public byte[] decrypt(EncryptionAlgorithm encryptionAlgorithm, CekAlgorithm cekAlgorithm,
                        EncryptedData data, KeyPair recipient) {
    log.debug("decrypt(alg={}, cek={})", encryptionAlgorithm, cekAlgorithm.name());
    if (!recipient.type().canAgree()) {
      throw new VaultException(ErrorKind.INVALID_PRIVATE_KEY,
          recipient.type() + " keys are not supported for decryption");
    }
    try (SecretBytes shared = KeyAgreement.x25519(recipient.privateKey(), data.ephemeralPublicKey());
         SecretBytes cek = contentKey(encryptionAlgorithm, cekAlgorithm, shared, data)) {
      return open(encryptionAlgorithm, cek, data);
    }
  }

  private EncryptedData encryptDirect(EncryptionAlgorithm encryptionAlgorithm, CekAlgorithm cekAlgorithm,
                                      SecretBytes shared, byte[] plaintext, byte[] associatedData,
                                      PublicKey ephemeralPublicKey) {
    try (SecretBytes cek = ConcatKdf.derive(cekAlgorithm.name(), encryptionAlgorithm.keyLength(),
        shared.bytes(), cekAlgorithm.agreement())) {
      return seal(encryptionAlgorithm, cek, plaintext, associatedData, new byte[0], ephemeralPublicKey);
    }
  }

  private EncryptedData encryptWrapped(EncryptionAlgorithm encryptionAlgorithm, CekAlgorithm cekAlgorithm,
                                       SecretBytes shared, byte[] plaintext, byte[] associatedData,
                                       PublicKey ephemeralPublicKey) {
    try (SecretBytes kek = ConcatKdf.derive(cekAlgorithm.name(), AesKeyWrap.KEY_LENGTH,
        shared.bytes(), cekAlgorithm.agreement());
         SecretBytes cek = new SecretBytes(randomProvider.randomBytes(encryptionAlgorithm.keyLength()))) {
      byte[] encryptedCek = AesKeyWrap.wrap(kek.bytes(), cek.bytes());
      return seal(encryptionAlgorithm, cek, plaintext, associatedData, encryptedCek, ephemeralPublicKey);
    }
  }

  // The returned CEK is owned by the caller.
  private SecretBytes contentKey(EncryptionAlgorithm encryptionAlgorithm, CekAlgorithm cekAlgorithm,
                                 SecretBytes shared, EncryptedData data) {
    return switch (cekAlgorithm.mode()) {
      case DIRECT -> ConcatKdf.derive(cekAlgorithm.name(), encryptionAlgorithm.keyLength(),
          shared.bytes(), cekAlgorithm.agreement());
      case KEY_WRAP -> {
        try (SecretBytes kek = ConcatKdf.derive(cekAlgorithm.name(), AesKeyWrap.KEY_LENGTH,
            shared.bytes(), cekAlgorithm.agreement())) {
          yield AesKeyWrap.unwrap(kek.bytes(), data.encryptedCek());
        }
      }
    };
  }

  private EncryptedData seal(EncryptionAlgorithm encryptionAlgorithm, SecretBytes cek, byte[] plaintext,
                             byte[] associatedData, byte[] encryptedCek, PublicKey ephemeralPublicKey) {
    return switch (encryptionAlgorithm) {
      case AES256GCM -> {
        byte[] nonce = randomProvider.randomBytes(encryptionAlgorithm.nonceLength());
        Aes256Gcm.Sealed sealed = Aes256Gcm.encrypt(cek.bytes(), nonce, associatedData, plaintext);
        yield new EncryptedData(nonce, associatedData, sealed.tag(), sealed.ciphertext(),
            encryptedCek, ephemeralPublicKey.bytes());
      }
    };
  }

  private byte[] open(EncryptionAlgorithm encryptionAlgorithm, SecretBytes cek, EncryptedData data) {
    return switch (encryptionAlgorithm) {
      case AES256GCM -> Aes256Gcm.decrypt(cek.bytes(), data.nonce(), data.associatedData(),
          data.ciphertext(), data.tag());
    };
  }
}
