package com.codeheadsystems.vault.exceptions;

/**
 * Malformed input rejected before any cryptographic primitive was invoked: wrong key
 * lengths, truncated wrapped keys and the like. Carries the same {@link ErrorKind}
 * taxonomy as primitive-level failures.
 */
public class VaultValidationException extends VaultException {

  /**
   * Instantiates a new Vault validation exception.
   *
   * @param kind    the error kind
   * @param message the message
   */
  public VaultValidationException(final ErrorKind kind, final String message) {
    super(kind, message);
  }
}
