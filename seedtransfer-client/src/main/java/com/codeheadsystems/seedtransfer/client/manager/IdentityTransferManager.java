package com.codeheadsystems.seedtransfer.client.manager;

import com.codeheadsystems.seedtransfer.backup.PassphraseBackupCipher;
import com.codeheadsystems.seedtransfer.checksum.ChecksumCalculator;
import com.codeheadsystems.seedtransfer.common.ByteUtils;
import com.codeheadsystems.seedtransfer.exceptions.BackupNotFoundException;
import com.codeheadsystems.seedtransfer.mnemonic.MnemonicCodec;
import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.codeheadsystems.seedtransfer.model.IdentityReference;
import com.codeheadsystems.seedtransfer.model.Mnemonic;
import com.codeheadsystems.seedtransfer.model.Seed;
import com.codeheadsystems.seedtransfer.qr.AssemblyEvent;
import com.codeheadsystems.seedtransfer.qr.FrameAssembler;
import com.codeheadsystems.seedtransfer.qr.QrFrameCodec;
import com.codeheadsystems.seedtransfer.store.IdentityStore;
import com.codeheadsystems.seedtransfer.transport.BackupTransport;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the device identity in and out: mnemonic export and import, animated QR export and
 * scanning, and passphrase backups on the backup server.
 * <p>
 * Everything that touches Argon2id or the network runs on the injected {@link Executor} and is
 * returned as a {@link CompletableFuture}. Passphrase arrays handed to this class are zeroed once
 * the operation has finished with them; callers must not reuse them.
 */
@Singleton
public class IdentityTransferManager {

  private static final Logger log = LoggerFactory.getLogger(IdentityTransferManager.class);

  private final MnemonicCodec mnemonicCodec;
  private final ChecksumCalculator checksumCalculator;
  private final QrFrameCodec frameCodec;
  private final PassphraseBackupCipher backupCipher;
  private final IdentityStore identityStore;
  private final BackupTransport backupTransport;
  private final Executor executor;

  /**
   * Instantiates a new identity transfer manager.
   *
   * @param mnemonicCodec      the mnemonic codec
   * @param checksumCalculator the checksum calculator
   * @param frameCodec         the frame codec
   * @param backupCipher       the backup cipher
   * @param identityStore      the local identity
   * @param backupTransport    the backup server
   * @param executor           runs the slow operations
   */
  @Inject
  public IdentityTransferManager(final MnemonicCodec mnemonicCodec,
                                 final ChecksumCalculator checksumCalculator,
                                 final QrFrameCodec frameCodec,
                                 final PassphraseBackupCipher backupCipher,
                                 final IdentityStore identityStore,
                                 final BackupTransport backupTransport,
                                 final Executor executor) {
    log.info("IdentityTransferManager()");
    this.mnemonicCodec = mnemonicCodec;
    this.checksumCalculator = checksumCalculator;
    this.frameCodec = frameCodec;
    this.backupCipher = backupCipher;
    this.identityStore = identityStore;
    this.backupTransport = backupTransport;
    this.executor = executor;
  }

  // ── Export ────────────────────────────────────────────────────────────────

  /**
   * @return the 24 words of the local identity
   */
  public CompletableFuture<Mnemonic> exportMnemonic() {
    log.debug("exportMnemonic()");
    return CompletableFuture.supplyAsync(() -> withIdentity(mnemonicCodec::encode), executor);
  }

  /**
   * @return the three encoded QR frames of the local identity, in display order
   */
  public CompletableFuture<List<String>> exportQrFrames() {
    log.debug("exportQrFrames()");
    return CompletableFuture.supplyAsync(
        () -> withIdentity(seed -> frameCodec.encodeAll(mnemonicCodec.encode(seed), seed)),
        executor);
  }

  /**
   * Encrypts the local identity under the passphrase and uploads it.
   *
   * @param identity   the name the backup is stored under
   * @param passphrase the passphrase; zeroed afterwards
   * @return completes once the server has stored the backup
   */
  public CompletableFuture<Void> createBackup(final IdentityReference identity,
                                              final char[] passphrase) {
    log.debug("createBackup(identity={})", identity);
    return CompletableFuture.runAsync(() -> {
      try {
        EncryptedBackup backup = withIdentity(seed -> backupCipher.encrypt(seed, passphrase));
        backupTransport.upload(identity, backup);
        log.info("createBackup: backup stored for identity={}", identity);
      } finally {
        ByteUtils.zero(passphrase);
      }
    }, executor);
  }

  // ── Import ────────────────────────────────────────────────────────────────

  /**
   * Decodes a typed mnemonic and stores it as the local identity.
   *
   * @param phrase 24 words separated by whitespace
   * @return completes once stored; fails with
   *     {@link com.codeheadsystems.seedtransfer.exceptions.InvalidMnemonicException}
   */
  public CompletableFuture<Void> importMnemonic(final String phrase) {
    log.debug("importMnemonic()");
    return CompletableFuture.runAsync(() -> store(mnemonicCodec.decode(phrase)), executor);
  }

  /**
   * Downloads the backup, decrypts it and stores it as the local identity.
   *
   * @param identity   the name the backup is stored under
   * @param passphrase the passphrase; zeroed afterwards
   * @return completes once stored; fails with {@link BackupNotFoundException} or
   *     {@link com.codeheadsystems.seedtransfer.exceptions.DecryptionFailedException}
   */
  public CompletableFuture<Void> restoreBackup(final IdentityReference identity,
                                               final char[] passphrase) {
    log.debug("restoreBackup(identity={})", identity);
    return CompletableFuture.runAsync(() -> {
      try {
        EncryptedBackup backup = backupTransport.download(identity)
            .orElseThrow(() -> new BackupNotFoundException("No backup found for identity: " + identity));
        store(backupCipher.decrypt(backup, passphrase));
        log.info("restoreBackup: identity restored from backup {}", identity);
      } finally {
        ByteUtils.zero(passphrase);
      }
    }, executor);
  }

  /**
   * Starts a new QR scanning attempt that imports into the local identity store.
   *
   * @param listener receives every assembler event
   * @return the session; close it when the scanner goes away
   */
  public FrameScanSession openScanSession(final Consumer<AssemblyEvent> listener) {
    log.debug("openScanSession()");
    FrameAssembler assembler = new FrameAssembler(frameCodec, mnemonicCodec, checksumCalculator,
        identityStore);
    return new FrameScanSession(assembler, listener);
  }

  /**
   * @return true if a local identity is present
   */
  public boolean hasIdentity() {
    return identityStore.get().map(seed -> {
      seed.destroy();
      return true;
    }).orElse(false);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private <T> T withIdentity(Function<Seed, T> action) {
    Seed seed = identityStore.get()
        .orElseThrow(() -> new IllegalStateException("No identity on this device"));
    try {
      return action.apply(seed);
    } finally {
      seed.destroy();
    }
  }

  private void store(Seed seed) {
    try {
      identityStore.set(seed);
    } finally {
      seed.destroy();
    }
  }
}
