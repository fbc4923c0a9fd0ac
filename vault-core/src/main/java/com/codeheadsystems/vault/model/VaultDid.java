package com.codeheadsystems.vault.model;

import com.codeheadsystems.vault.common.ByteUtils;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * Identity identifier derived deterministically from a public key and a network tag.
 * <p>
 * Format: {@code did:iota:<tag>} on the main network and {@code did:iota:<network>:<tag>}
 * elsewhere, where the tag is the Base58 encoding of BLAKE2b-256 over the public key.
 *
 * @param value the full identifier string
 */
public record VaultDid(@JsonValue String value) {

  public static final String PREFIX = "did:iota:";

  public VaultDid {
    if (value == null || !value.startsWith(PREFIX)) {
      throw new IllegalArgumentException("Identifier must start with " + PREFIX + ": " + value);
    }
    String[] segments = value.substring(PREFIX.length()).split(":", -1);
    if (segments.length > 2 || !ByteUtils.isBase58(segments[segments.length - 1])) {
      throw new IllegalArgumentException("Malformed identifier: " + value);
    }
    if (segments.length == 2) {
      NetworkName.of(segments[0]);
    }
  }

  /**
   * Parses an identifier string.
   *
   * @param value the value
   * @return the vault did
   * @throws IllegalArgumentException if the string is not a well-formed identifier
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static VaultDid parse(String value) {
    return new VaultDid(value);
  }

  /**
   * Derives the identifier for a public key on the given network.
   *
   * @param didType   the identity kind
   * @param publicKey the public key bytes
   * @param network   the network
   * @return the vault did
   * @throws VaultValidationException with {@link ErrorKind#INVALID_PUBLIC_KEY} for empty keys
   */
  public static VaultDid derive(DidType didType, byte[] publicKey, NetworkName network) {
    if (publicKey == null || publicKey.length == 0) {
      throw new VaultValidationException(ErrorKind.INVALID_PUBLIC_KEY,
          "Cannot derive an identifier from an empty public key");
    }
    return switch (didType) {
      case IOTA_DID -> {
        Blake2bDigest digest = new Blake2bDigest(256);
        digest.update(publicKey, 0, publicKey.length);
        byte[] hash = new byte[digest.getDigestSize()];
        digest.doFinal(hash, 0);
        String tag = ByteUtils.base58(hash);
        yield new VaultDid(network.isMainnet()
            ? PREFIX + tag
            : PREFIX + network.name() + ":" + tag);
      }
    };
  }

  /**
   * The network this identifier belongs to.
   *
   * @return the network name
   */
  public NetworkName network() {
    String[] segments = value.substring(PREFIX.length()).split(":");
    return segments.length == 2 ? NetworkName.of(segments[0]) : NetworkName.MAINNET;
  }

  /**
   * The Base58 tag derived from the public key.
   *
   * @return the string
   */
  public String tag() {
    return value.substring(value.lastIndexOf(':') + 1);
  }

  @Override
  public String toString() {
    return value;
  }
}
