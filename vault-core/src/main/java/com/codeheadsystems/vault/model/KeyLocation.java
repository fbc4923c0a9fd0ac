package com.codeheadsystems.vault.model;

import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import java.util.regex.Pattern;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Address of one key within an identity's vault.
 * <p>
 * A location is a pure function of (key type, fragment, public key): the key hash is the
 * lowercase hex of the first eight bytes of SHA-256 over the public key. Two callers that
 * derive a location for the same key always collide, so existence checks and deletion need
 * no separate index. There is no public constructor; {@link #of} requires the public key.
 */
public final class KeyLocation {

  private static final int KEY_HASH_BYTES = 8;
  private static final Pattern KEY_HASH = Pattern.compile("[0-9a-f]{" + (KEY_HASH_BYTES * 2) + "}");

  private final KeyType keyType;
  private final String fragment;
  private final String keyHash;

  private KeyLocation(KeyType keyType, String fragment, String keyHash) {
    if (keyType == null) {
      throw new IllegalArgumentException("Key type is required");
    }
    if (fragment == null || fragment.isBlank()) {
      throw new IllegalArgumentException("Fragment must not be blank");
    }
    if (keyHash == null || !KEY_HASH.matcher(keyHash).matches()) {
      throw new IllegalArgumentException("Malformed key hash: " + keyHash);
    }
    this.keyType = keyType;
    this.fragment = fragment;
    this.keyHash = keyHash;
  }

  /**
   * Derives the location of a key.
   *
   * @param keyType   the key type
   * @param fragment  the human-readable fragment label
   * @param publicKey the public key bytes
   * @return the key location
   */
  public static KeyLocation of(KeyType keyType, String fragment, byte[] publicKey) {
    if (publicKey == null || publicKey.length == 0) {
      throw new IllegalArgumentException("Public key is required to derive a key location");
    }
    SHA256Digest digest = new SHA256Digest();
    digest.update(publicKey, 0, publicKey.length);
    byte[] hash = new byte[digest.getDigestSize()];
    digest.doFinal(hash, 0);
    return new KeyLocation(keyType, fragment, Hex.toHexString(hash, 0, KEY_HASH_BYTES));
  }

  /**
   * Checks a fragment before any key material is produced for it. Backends call this on entry
   * so a bad fragment never leaves a generated or reconstructed key behind.
   *
   * @param fragment the fragment
   * @return the fragment
   * @throws VaultValidationException with {@link ErrorKind#INVALID_KEY_LOCATION} if it is null or blank
   */
  public static String requireFragment(String fragment) {
    if (fragment == null || fragment.isBlank()) {
      throw new VaultValidationException(ErrorKind.INVALID_KEY_LOCATION, "Fragment must not be blank");
    }
    return fragment;
  }

  /**
   * Restores a persisted location.
   */
  @JsonCreator
  static KeyLocation fromJson(@JsonProperty("keyType") KeyType keyType,
                              @JsonProperty("fragment") String fragment,
                              @JsonProperty("keyHash") String keyHash) {
    return new KeyLocation(keyType, fragment, keyHash);
  }

  @JsonProperty("keyType")
  public KeyType keyType() {
    return keyType;
  }

  @JsonProperty("fragment")
  public String fragment() {
    return fragment;
  }

  @JsonProperty("keyHash")
  public String keyHash() {
    return keyHash;
  }

  /**
   * {@code fragment:keyHash}, suitable as a path segment or record key in durable backends.
   *
   * @return the string
   */
  public String canonical() {
    return fragment + ":" + keyHash;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof KeyLocation other
        && keyType == other.keyType
        && fragment.equals(other.fragment)
        && keyHash.equals(other.keyHash);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyType, fragment, keyHash);
  }

  @Override
  public String toString() {
    return "(" + fragment + ":" + keyHash + ":" + keyType + ")";
  }
}
