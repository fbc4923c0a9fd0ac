package com.codeheadsystems.vault.storage.config;

import com.codeheadsystems.vault.common.RandomProvider;
import java.security.SecureRandom;

/**
 * Configuration for the in-memory backend.
 *
 * @param randomProvider source of randomness for key generation, content-encryption keys and nonces
 * @param expand         when true, {@code toString()} prints the stored identities, locations and
 *                       public keys
 */
public record MemStoreConfig(RandomProvider randomProvider, boolean expand) {

  /**
   * Default configuration: system {@link SecureRandom}, compact {@code toString()}.
   */
  public static final MemStoreConfig DEFAULT = new MemStoreConfig(new RandomProvider(), false);

  public MemStoreConfig {
    if (randomProvider == null) {
      throw new IllegalArgumentException("randomProvider is required");
    }
  }

  /**
   * Creates a test configuration using the given random source and expanded output.
   */
  public static MemStoreConfig forTesting(SecureRandom random) {
    return new MemStoreConfig(new RandomProvider(random), true);
  }

  /**
   * Returns a new config identical to this one but with the given {@code expand} flag.
   */
  public MemStoreConfig withExpand(boolean expand) {
    return new MemStoreConfig(randomProvider, expand);
  }
}
