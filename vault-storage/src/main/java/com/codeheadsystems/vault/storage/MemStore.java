package com.codeheadsystems.vault.storage;

import com.codeheadsystems.vault.crypto.EcdhEsCipher;
import com.codeheadsystems.vault.crypto.KeyPairs;
import com.codeheadsystems.vault.crypto.Signer;
import com.codeheadsystems.vault.exceptions.ErrorKind;
import com.codeheadsystems.vault.exceptions.VaultException;
import com.codeheadsystems.vault.model.CekAlgorithm;
import com.codeheadsystems.vault.model.DidType;
import com.codeheadsystems.vault.model.EncryptedData;
import com.codeheadsystems.vault.model.EncryptionAlgorithm;
import com.codeheadsystems.vault.model.KeyLocation;
import com.codeheadsystems.vault.model.KeyPair;
import com.codeheadsystems.vault.model.KeyType;
import com.codeheadsystems.vault.model.NetworkName;
import com.codeheadsystems.vault.model.PrivateKey;
import com.codeheadsystems.vault.model.PublicKey;
import com.codeheadsystems.vault.model.Signature;
import com.codeheadsystems.vault.model.VaultDid;
import com.codeheadsystems.vault.storage.config.MemStoreConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link Storage}.
 * <p>
 * Vaults and blobs live in two maps, each behind its own read/write lock. {@link #didCreate}
 * holds the vaults write lock across its existence check and insert; {@link #didPurge} takes the
 * vaults lock before the blobs lock. Everything is lost when the process exits. Suitable for
 * development and testing only.
 */
@Singleton
public class MemStore implements Storage {

  private static final Logger log = LoggerFactory.getLogger(MemStore.class);

  private final Map<VaultDid, Map<KeyLocation, KeyPair>> vaults = new LinkedHashMap<>();
  private final Map<VaultDid, byte[]> blobs = new LinkedHashMap<>();
  private final ReentrantReadWriteLock vaultsLock = new ReentrantReadWriteLock();
  private final ReentrantReadWriteLock blobsLock = new ReentrantReadWriteLock();

  private final MemStoreConfig config;
  private final EcdhEsCipher cipher;

  public MemStore() {
    this(MemStoreConfig.DEFAULT);
  }

  @Inject
  public MemStore(final MemStoreConfig config) {
    this.config = config;
    this.cipher = new EcdhEsCipher(config.randomProvider());
    log.warn("Using MemStore: keys will NOT survive restarts. "
        + "Replace with a persistent Storage for production.");
  }

  @Override
  public CreatedIdentity didCreate(DidType didType, NetworkName network, String fragment, PrivateKey privateKey) {
    try {
      KeyLocation.requireFragment(fragment);
    } catch (VaultException e) {
      if (privateKey != null) {
        privateKey.zeroize();
      }
      throw e;
    }
    KeyPair keyPair = identityKey(privateKey);
    try {
      byte[] publicKey = keyPair.publicKey().bytes();
      VaultDid did = VaultDid.derive(didType, publicKey, network);
      KeyLocation location = KeyLocation.of(KeyType.ED25519, fragment, publicKey);
      withWrite(vaultsLock, () -> {
        if (vaults.containsKey(did)) {
          throw new VaultException(ErrorKind.ALREADY_EXISTS, "identity already exists: " + did);
        }
        Map<KeyLocation, KeyPair> vault = new LinkedHashMap<>();
        vault.put(location, keyPair);
        vaults.put(did, vault);
        return null;
      });
      log.debug("didCreate({}, {})", did, location);
      return new CreatedIdentity(did, location);
    } catch (RuntimeException e) {
      keyPair.zeroize();
      throw e;
    }
  }

  @Override
  public boolean didPurge(VaultDid did) {
    boolean removed = withWrite(vaultsLock, () -> {
      Map<KeyLocation, KeyPair> vault = vaults.remove(did);
      if (vault != null) {
        vault.values().forEach(KeyPair::zeroize);
      }
      boolean blobRemoved = withWrite(blobsLock, () -> blobs.remove(did) != null);
      return vault != null || blobRemoved;
    });
    log.debug("didPurge({}) -> {}", did, removed);
    return removed;
  }

  @Override
  public boolean didExists(VaultDid did) {
    return withRead(vaultsLock, () -> vaults.containsKey(did));
  }

  @Override
  public List<VaultDid> didList() {
    return withRead(vaultsLock, () -> new ArrayList<>(vaults.keySet()));
  }

  @Override
  public KeyLocation keyGenerate(VaultDid did, KeyType keyType, String fragment) {
    KeyLocation.requireFragment(fragment);
    KeyPair keyPair = KeyPairs.generate(keyType, config.randomProvider());
    try {
      KeyLocation location = KeyLocation.of(keyType, fragment, keyPair.publicKey().bytes());
      store(did, location, keyPair);
      log.debug("keyGenerate({}, {})", did, location);
      return location;
    } catch (RuntimeException e) {
      keyPair.zeroize();
      throw e;
    }
  }

  @Override
  public void keyInsert(VaultDid did, KeyLocation location, PrivateKey privateKey) {
    try {
      KeyPair keyPair = KeyPairs.fromPrivateKey(location.keyType(), privateKey.bytes());
      KeyLocation derived = KeyLocation.of(location.keyType(), location.fragment(), keyPair.publicKey().bytes());
      if (!derived.equals(location)) {
        keyPair.zeroize();
        throw new VaultException(ErrorKind.INVALID_PRIVATE_KEY,
            "private key does not belong at location " + location);
      }
      store(did, location, keyPair);
      log.debug("keyInsert({}, {})", did, location);
    } finally {
      privateKey.zeroize();
    }
  }

  @Override
  public boolean keyExists(VaultDid did, KeyLocation location) {
    return withRead(vaultsLock, () -> {
      Map<KeyLocation, KeyPair> vault = vaults.get(did);
      return vault != null && vault.containsKey(location);
    });
  }

  @Override
  public PublicKey keyPublic(VaultDid did, KeyLocation location) {
    return withRead(vaultsLock, () -> keyPair(did, location).publicKey());
  }

  @Override
  public boolean keyDelete(VaultDid did, KeyLocation location) {
    boolean removed = withWrite(vaultsLock, () -> {
      KeyPair keyPair = vault(did).remove(location);
      if (keyPair == null) {
        return false;
      }
      keyPair.zeroize();
      return true;
    });
    log.debug("keyDelete({}, {}) -> {}", did, location, removed);
    return removed;
  }

  @Override
  public Signature keySign(VaultDid did, KeyLocation location, byte[] data) {
    log.debug("keySign({}, {})", did, location);
    return withRead(vaultsLock, () -> Signer.sign(keyPair(did, location), data));
  }

  @Override
  public EncryptedData dataEncrypt(VaultDid did, byte[] plaintext, byte[] associatedData,
                                   EncryptionAlgorithm encryptionAlgorithm, CekAlgorithm cekAlgorithm,
                                   PublicKey recipientPublicKey) {
    log.debug("dataEncrypt({}, {})", did, cekAlgorithm.name());
    return cipher.encrypt(encryptionAlgorithm, cekAlgorithm, plaintext, associatedData, recipientPublicKey);
  }

  @Override
  public byte[] dataDecrypt(VaultDid did, EncryptedData data, EncryptionAlgorithm encryptionAlgorithm,
                            CekAlgorithm cekAlgorithm, KeyLocation location) {
    log.debug("dataDecrypt({}, {}, {})", did, location, cekAlgorithm.name());
    return withRead(vaultsLock,
        () -> cipher.decrypt(encryptionAlgorithm, cekAlgorithm, data, keyPair(did, location)));
  }

  @Override
  public void blobSet(VaultDid did, byte[] value) {
    byte[] copy = value.clone();
    withWrite(blobsLock, () -> blobs.put(did, copy));
    log.debug("blobSet({}, {} bytes)", did, copy.length);
  }

  @Override
  public Optional<byte[]> blobGet(VaultDid did) {
    return withRead(blobsLock, () -> Optional.ofNullable(blobs.get(did)).map(byte[]::clone));
  }

  @Override
  public void flushChanges() {
    // Nothing to persist.
  }

  @Override
  public String toString() {
    if (!config.expand()) {
      return "MemStore";
    }
    StringBuilder sb = new StringBuilder("MemStore{");
    withRead(vaultsLock, () -> {
      vaults.forEach((did, vault) -> {
        sb.append("\n  ").append(did).append(':');
        vault.forEach((location, keyPair) ->
            sb.append("\n    ").append(location).append(" => ").append(keyPair.publicKey()));
      });
      return null;
    });
    withRead(blobsLock, () -> {
      blobs.forEach((did, blob) -> sb.append("\n  blob ").append(did).append(": ").append(blob.length)
          .append(" bytes"));
      return null;
    });
    return sb.append("\n}").toString();
  }

  private KeyPair identityKey(PrivateKey privateKey) {
    if (privateKey == null) {
      return KeyPairs.generate(KeyType.ED25519, config.randomProvider());
    }
    try {
      return KeyPairs.fromPrivateKey(KeyType.ED25519, privateKey.bytes());
    } finally {
      privateKey.zeroize();
    }
  }

  private void store(VaultDid did, KeyLocation location, KeyPair keyPair) {
    withWrite(vaultsLock, () -> {
      KeyPair previous = vaults.computeIfAbsent(did, d -> new LinkedHashMap<>()).put(location, keyPair);
      if (previous != null) {
        previous.zeroize();
      }
      return null;
    });
  }

  // Callers hold the vaults lock.
  private Map<KeyLocation, KeyPair> vault(VaultDid did) {
    Map<KeyLocation, KeyPair> vault = vaults.get(did);
    if (vault == null) {
      throw new VaultException(ErrorKind.VAULT_NOT_FOUND, "no vault for " + did);
    }
    return vault;
  }

  private KeyPair keyPair(VaultDid did, KeyLocation location) {
    KeyPair keyPair = vault(did).get(location);
    if (keyPair == null) {
      throw new VaultException(ErrorKind.KEY_NOT_FOUND, "no key at " + location + " for " + did);
    }
    return keyPair;
  }

  private static <T> T withRead(ReentrantReadWriteLock lock, Supplier<T> action) {
    return locked(lock.readLock(), action);
  }

  private static <T> T withWrite(ReentrantReadWriteLock lock, Supplier<T> action) {
    return locked(lock.writeLock(), action);
  }

  private static <T> T locked(Lock lock, Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
