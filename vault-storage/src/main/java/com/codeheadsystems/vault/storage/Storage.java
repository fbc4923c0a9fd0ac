package com.codeheadsystems.vault.storage;

import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.model.CekAlgorithm;
import com.codeheadsystems.vault.model.DidType;
import com.codeheadsystems.vault.model.EncryptedData;
import com.codeheadsystems.vault.model.EncryptionAlgorithm;
import com.codeheadsystems.vault.model.KeyLocation;
import com.codeheadsystems.vault.model.KeyType;
import com.codeheadsystems.vault.model.NetworkName;
import com.codeheadsystems.vault.model.PrivateKey;
import com.codeheadsystems.vault.model.PublicKey;
import com.codeheadsystems.vault.model.Signature;
import com.codeheadsystems.vault.model.VaultDid;
import java.util.List;
import java.util.Optional;

/**
 * Secure key storage for decentralized identities.
 * <p>
 * A backend owns, per identity, a vault of key pairs addressed by {@link KeyLocation} and at
 * most one opaque blob. Private keys never leave the backend: callers sign, encrypt and decrypt
 * through it. Implementations must be thread-safe. Every operation may fail with a
 * {@link VaultException} carrying an {@link ErrorKind}; lookups against an identity without a
 * vault fail with {@link ErrorKind#VAULT_NOT_FOUND} rather than returning an empty result.
 * <p>
 * Typical backends are this module's in-memory {@code MemStore}, an encrypted file store, or a
 * hardware vault. Every backend is expected to pass the shared conformance suite.
 */
public interface Storage {

  /**
   * Creates a new identity with an Ed25519 key at {@code fragment}.
   * <p>
   * The key pair is reconstructed from {@code privateKey} when supplied, otherwise generated.
   * The identifier is derived from the public key and network. The existence check and the
   * registration are atomic; the supplied private key is wiped whether or not creation succeeds.
   *
   * @param didType    the identity kind
   * @param network    the network the identifier belongs to
   * @param fragment   the fragment of the initial key's location
   * @param privateKey an existing Ed25519 private key, or null to generate one
   * @return the identifier and the location of the initial key
   * @throws VaultException with {@link ErrorKind#ALREADY_EXISTS} if the identity is registered,
   *                        {@link ErrorKind#INVALID_PRIVATE_KEY} if the key is malformed,
   *                        {@link ErrorKind#INVALID_KEY_LOCATION} if the fragment is blank
   */
  CreatedIdentity didCreate(DidType didType, NetworkName network, String fragment, PrivateKey privateKey);

  /**
   * Removes an identity's vault and blob. Removed private keys are wiped.
   *
   * @param did the identity
   * @return true if anything was removed, false if there was nothing to do
   */
  boolean didPurge(VaultDid did);

  /**
   * Whether the identity has a vault in this backend.
   *
   * @param did the identity
   * @return the boolean
   */
  boolean didExists(VaultDid did);

  /**
   * All identities with a vault.
   *
   * @return the list
   */
  List<VaultDid> didList();

  /**
   * Generates a key pair and stores it in the identity's vault, creating the vault if absent.
   *
   * @param did      the identity
   * @param keyType  the key type
   * @param fragment the fragment of the location
   * @return the location derived from the new public key
   * @throws VaultException with {@link ErrorKind#INVALID_KEY_LOCATION} if the fragment is blank
   */
  KeyLocation keyGenerate(VaultDid did, KeyType keyType, String fragment);

  /**
   * Stores a key pair reconstructed from raw private key bytes at {@code location}, creating the
   * vault if absent. The key type comes from the location. The caller's private key buffer is
   * wiped on success and on failure.
   *
   * @param did        the identity
   * @param location   where to store the key; must be the location derived from its public key
   * @param privateKey the raw private key
   * @throws VaultException with {@link ErrorKind#INVALID_PRIVATE_KEY} if the key is malformed or
   *                        does not belong at {@code location}
   */
  void keyInsert(VaultDid did, KeyLocation location, PrivateKey privateKey);

  /**
   * Whether a key is stored at the location. False when the identity has no vault.
   *
   * @param did      the identity
   * @param location the location
   * @return the boolean
   */
  boolean keyExists(VaultDid did, KeyLocation location);

  /**
   * The public half of the key at the location.
   *
   * @param did      the identity
   * @param location the location
   * @return the public key
   * @throws VaultException with {@link ErrorKind#VAULT_NOT_FOUND} or {@link ErrorKind#KEY_NOT_FOUND}
   */
  PublicKey keyPublic(VaultDid did, KeyLocation location);

  /**
   * Deletes the key at the location. The private key is wiped.
   *
   * @param did      the identity
   * @param location the location
   * @return true if a key was removed, false if none was stored there
   * @throws VaultException with {@link ErrorKind#VAULT_NOT_FOUND}
   */
  boolean keyDelete(VaultDid did, KeyLocation location);

  /**
   * Signs with the key at the location.
   *
   * @param did      the identity
   * @param location the location of an Ed25519 key
   * @param data     the message
   * @return the signature
   * @throws VaultException with {@link ErrorKind#UNSUPPORTED_OPERATION} for agreement keys,
   *                        {@link ErrorKind#VAULT_NOT_FOUND} or {@link ErrorKind#KEY_NOT_FOUND}
   */
  Signature keySign(VaultDid did, KeyLocation location, byte[] data);

  /**
   * Encrypts for the holder of {@code recipientPublicKey} with a fresh ephemeral key. The
   * sender's vault is not consulted; the identity is accepted for symmetry with decryption.
   *
   * @param did                 the sending identity
   * @param plaintext           the plaintext
   * @param associatedData      data authenticated alongside the ciphertext
   * @param encryptionAlgorithm the content encryption algorithm
   * @param cekAlgorithm        how the content-encryption key is established
   * @param recipientPublicKey  the recipient's X25519 public key
   * @return the envelope
   * @throws VaultException with {@link ErrorKind#INVALID_PUBLIC_KEY} or
   *                        {@link ErrorKind#ENCRYPTION_FAILURE}
   */
  EncryptedData dataEncrypt(VaultDid did, byte[] plaintext, byte[] associatedData,
                            EncryptionAlgorithm encryptionAlgorithm, CekAlgorithm cekAlgorithm,
                            PublicKey recipientPublicKey);

  /**
   * Decrypts an envelope with the X25519 key at the location.
   *
   * @param did                 the receiving identity
   * @param data                the envelope
   * @param encryptionAlgorithm the content encryption algorithm used at encryption
   * @param cekAlgorithm        the CEK algorithm used at encryption
   * @param location            the location of the receiver's X25519 key
   * @return the plaintext
   * @throws VaultException with {@link ErrorKind#INVALID_PRIVATE_KEY} for signing keys,
   *                        {@link ErrorKind#DECRYPTION_FAILURE}, {@link ErrorKind#VAULT_NOT_FOUND}
   *                        or {@link ErrorKind#KEY_NOT_FOUND}
   */
  byte[] dataDecrypt(VaultDid did, EncryptedData data, EncryptionAlgorithm encryptionAlgorithm,
                     CekAlgorithm cekAlgorithm, KeyLocation location);

  /**
   * Stores or replaces the identity's blob.
   *
   * @param did   the identity
   * @param value the bytes
   */
  void blobSet(VaultDid did, byte[] value);

  /**
   * The identity's blob.
   *
   * @param did the identity
   * @return the last written bytes, or empty if none were written
   */
  Optional<byte[]> blobGet(VaultDid did);

  /**
   * Persists pending changes for all identities. A no-op for non-durable backends.
   */
  void flushChanges();

  /**
   * Persists pending changes for one identity. Defaults to a global flush.
   *
   * @param did the identity
   */
  default void flushChanges(VaultDid did) {
    flushChanges();
  }
}
