package com.codeheadsystems.vault.storage;

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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Non-blocking view of a {@link Storage}. Each call runs the corresponding {@link Storage}
 * operation on the supplied executor; failures complete the future exceptionally with the
 * backend's {@link com.codeheadsystems.vault.exceptions.VaultException} (wrapped in a
 * {@link java.util.concurrent.CompletionException} by {@code join()}).
 * <p>
 * Cancelling a returned future does not stop the underlying operation. A cancelled call may
 * still have changed the backend.
 */
@Singleton
public class AsyncStorage {

  private final Storage storage;
  private final Executor executor;

  @Inject
  public AsyncStorage(final Storage storage, final Executor executor) {
    this.storage = storage;
    this.executor = executor;
  }

  public Storage storage() {
    return storage;
  }

  public CompletableFuture<CreatedIdentity> didCreate(DidType didType, NetworkName network, String fragment,
                                                      PrivateKey privateKey) {
    return run(() -> storage.didCreate(didType, network, fragment, privateKey));
  }

  public CompletableFuture<Boolean> didPurge(VaultDid did) {
    return run(() -> storage.didPurge(did));
  }

  public CompletableFuture<Boolean> didExists(VaultDid did) {
    return run(() -> storage.didExists(did));
  }

  public CompletableFuture<List<VaultDid>> didList() {
    return run(storage::didList);
  }

  public CompletableFuture<KeyLocation> keyGenerate(VaultDid did, KeyType keyType, String fragment) {
    return run(() -> storage.keyGenerate(did, keyType, fragment));
  }

  public CompletableFuture<Void> keyInsert(VaultDid did, KeyLocation location, PrivateKey privateKey) {
    return CompletableFuture.runAsync(() -> storage.keyInsert(did, location, privateKey), executor);
  }

  public CompletableFuture<Boolean> keyExists(VaultDid did, KeyLocation location) {
    return run(() -> storage.keyExists(did, location));
  }

  public CompletableFuture<PublicKey> keyPublic(VaultDid did, KeyLocation location) {
    return run(() -> storage.keyPublic(did, location));
  }

  public CompletableFuture<Boolean> keyDelete(VaultDid did, KeyLocation location) {
    return run(() -> storage.keyDelete(did, location));
  }

  public CompletableFuture<Signature> keySign(VaultDid did, KeyLocation location, byte[] data) {
    return run(() -> storage.keySign(did, location, data));
  }

  public CompletableFuture<EncryptedData> dataEncrypt(VaultDid did, byte[] plaintext, byte[] associatedData,
                                                      EncryptionAlgorithm encryptionAlgorithm,
                                                      CekAlgorithm cekAlgorithm, PublicKey recipientPublicKey) {
    return run(() -> storage.dataEncrypt(did, plaintext, associatedData, encryptionAlgorithm, cekAlgorithm,
        recipientPublicKey));
  }

  public CompletableFuture<byte[]> dataDecrypt(VaultDid did, EncryptedData data,
                                               EncryptionAlgorithm encryptionAlgorithm,
                                               CekAlgorithm cekAlgorithm, KeyLocation location) {
    return run(() -> storage.dataDecrypt(did, data, encryptionAlgorithm, cekAlgorithm, location));
  }

  public CompletableFuture<Void> blobSet(VaultDid did, byte[] value) {
    return CompletableFuture.runAsync(() -> storage.blobSet(did, value), executor);
  }

  public CompletableFuture<Optional<byte[]>> blobGet(VaultDid did) {
    return run(() -> storage.blobGet(did));
  }

  public CompletableFuture<Void> flushChanges() {
    return CompletableFuture.runAsync(storage::flushChanges, executor);
  }

  public CompletableFuture<Void> flushChanges(VaultDid did) {
    return CompletableFuture.runAsync(() -> storage.flushChanges(did), executor);
  }

  private <T> CompletableFuture<T> run(Supplier<T> operation) {
    return CompletableFuture.supplyAsync(operation, executor);
  }
}
