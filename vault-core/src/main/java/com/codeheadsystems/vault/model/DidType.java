package com.codeheadsystems.vault.model;

/**
 * The kind of identity a backend creates in {@code didCreate}.
 */
public enum DidType {
  IOTA_DID
}
