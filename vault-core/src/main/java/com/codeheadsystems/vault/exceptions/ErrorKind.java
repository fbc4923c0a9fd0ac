package com.codeheadsystems.vault.exceptions;

/**
 * Error taxonomy shared by every storage backend.
 */
public enum ErrorKind {
  /**
   * The identity derived from the supplied or generated key is already registered.
   */
  ALREADY_EXISTS,
  /**
   * No vault exists for the identity.
   */
  VAULT_NOT_FOUND,
  /**
   * The vault exists but holds no key at the location.
   */
  KEY_NOT_FOUND,
  /**
   * Private key bytes are malformed or unsuitable for the requested operation.
   */
  INVALID_PRIVATE_KEY,
  /**
   * Public key bytes are malformed or unsuitable for key agreement.
   */
  INVALID_PUBLIC_KEY,
  /**
   * The key type cannot perform the operation (e.g. signing with an agreement key).
   */
  UNSUPPORTED_OPERATION,
  /**
   * The fragment naming a key location is missing or blank.
   */
  INVALID_KEY_LOCATION,
  ENCRYPTION_FAILURE,
  DECRYPTION_FAILURE,
  /**
   * The backend's storage medium failed.
   */
  BACKEND_IO
}
