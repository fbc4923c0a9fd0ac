package com.codeheadsystems.vault.exceptions;

/**
 * Typed failure raised by storage backends and the cryptographic engine.
 * <p>
 * Messages never contain key material. Primitive failures keep the underlying
 * library exception as the cause.
 */
public class VaultException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Instantiates a new Vault exception.
   *
   * @param kind    the error kind
   * @param message the message
   */
  public VaultException(final ErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Vault exception.
   *
   * @param kind    the error kind
   * @param message the message
   * @param cause   the cause
   */
  public VaultException(final ErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
  }
}
