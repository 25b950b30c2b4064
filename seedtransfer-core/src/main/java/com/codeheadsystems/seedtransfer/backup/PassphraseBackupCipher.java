package com.codeheadsystems.seedtransfer.backup;

import com.codeheadsystems.seedtransfer.common.ByteUtils;
import com.codeheadsystems.seedtransfer.exceptions.DecryptionFailedException;
import com.codeheadsystems.seedtransfer.model.Argon2Params;
import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.codeheadsystems.seedtransfer.model.Seed;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts the seed under a user passphrase for storage on the backup server.
 * <p>
 * Key: Argon2id(passphrase as UTF-8, fresh 16-byte salt) with the configured cost.
 * Blob: base64(nonce || AES-256-GCM ciphertext || tag). The salt and every cost parameter are
 * returned with the blob; none of them are secret.
 * <p>
 * Argon2id is deliberately slow. Call from a background thread.
 */
public class PassphraseBackupCipher {

  // Upper bounds applied to stored parameters before any work is done.
  static final int MAX_MEMORY_KIB = 1 << 20;
  static final int MAX_ITERATIONS = 64;
  static final int MAX_PARALLELISM = 16;

  private static final Logger log = LoggerFactory.getLogger(PassphraseBackupCipher.class);

  private final BackupConfig config;

  /**
   * Instantiates a new passphrase backup cipher.
   *
   * @param config cost parameters for new backups
   */
  public PassphraseBackupCipher(final BackupConfig config) {
    log.info("PassphraseBackupCipher(memoryKib={}, iterations={}, parallelism={})",
        config.memoryKib(), config.iterations(), config.parallelism());
    this.config = config;
  }

  /**
   * Encrypts the seed. A fresh salt and nonce are drawn on every call.
   *
   * @param seed       the seed
   * @param passphrase the user's passphrase; not modified
   * @return ciphertext plus the parameters needed to open it
   */
  public EncryptedBackup encrypt(final Seed seed, final char[] passphrase) {
    if (passphrase == null || passphrase.length == 0) {
      throw new IllegalArgumentException("Backup passphrase must not be empty");
    }
    Argon2Params params = new Argon2Params(
        config.randomProvider().randomBytes(Argon2Params.SALT_LENGTH),
        config.iterations(), config.memoryKib(), config.parallelism(),
        config.hashLength(), config.nonceLength(), config.macLength());
    byte[] nonce = config.randomProvider().randomBytes(params.nonceLength());
    byte[] key = deriveKey(passphrase, params);
    byte[] plaintext = seed.bytes();
    try {
      log.debug("encrypt: sealing seed");
      GCMModeCipher cipher = gcm(true, key, nonce, params.macLength());
      byte[] sealed = new byte[cipher.getOutputSize(plaintext.length)];
      int len = cipher.processBytes(plaintext, 0, plaintext.length, sealed, 0);
      len += cipher.doFinal(sealed, len);
      byte[] blob = ByteUtils.concat(nonce, Arrays.copyOf(sealed, len));
      return new EncryptedBackup(params, Base64.getEncoder().encodeToString(blob));
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("AES-GCM encryption failed", e);
    } finally {
      ByteUtils.zero(key);
      ByteUtils.zero(plaintext);
    }
  }

  /**
   * Opens a backup with the parameters stored alongside it.
   *
   * @param backup     the backup from the server
   * @param passphrase the user's passphrase; not modified
   * @return the seed
   * @throws DecryptionFailedException for a wrong passphrase, a damaged blob or damaged
   *                                   parameters, always with the same message
   */
  public Seed decrypt(final EncryptedBackup backup, final char[] passphrase) {
    Argon2Params params = backup.params();
    if (passphrase == null || !plausible(params)) {
      log.warn("decrypt: rejected backup parameters");
      throw new DecryptionFailedException();
    }
    byte[] blob;
    try {
      blob = Base64.getDecoder().decode(backup.ciphertextBase64());
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailedException(e);
    }
    if (blob.length != params.nonceLength() + Seed.LENGTH + params.macLength()) {
      throw new DecryptionFailedException();
    }

    byte[] nonce = Arrays.copyOfRange(blob, 0, params.nonceLength());
    byte[] key = deriveKey(passphrase, params);
    byte[] plaintext = new byte[Seed.LENGTH + params.macLength()];
    byte[] seedBytes = null;
    try {
      GCMModeCipher cipher = gcm(false, key, nonce, params.macLength());
      int len = cipher.processBytes(blob, nonce.length, blob.length - nonce.length, plaintext, 0);
      len += cipher.doFinal(plaintext, len);
      if (len != Seed.LENGTH) {
        throw new DecryptionFailedException();
      }
      seedBytes = Arrays.copyOf(plaintext, len);
      return Seed.of(seedBytes);
    } catch (InvalidCipherTextException e) {
      log.warn("decrypt: authentication failed");
      throw new DecryptionFailedException(e);
    } finally {
      ByteUtils.zero(key);
      ByteUtils.zero(plaintext);
      ByteUtils.zero(seedBytes);
    }
  }

  private static boolean plausible(Argon2Params p) {
    return p.salt().length >= 8
        && p.iterations() >= 1 && p.iterations() <= MAX_ITERATIONS
        && p.parallelism() >= 1 && p.parallelism() <= MAX_PARALLELISM
        && p.memoryKib() >= 8 * p.parallelism() && p.memoryKib() <= MAX_MEMORY_KIB
        && p.hashLength() == BackupConfig.KEY_LENGTH
        && p.nonceLength() >= BackupConfig.NONCE_LENGTH && p.nonceLength() <= 64
        && p.macLength() >= 12 && p.macLength() <= 16;
  }

  private static byte[] deriveKey(char[] passphrase, Argon2Params params) {
    Argon2Parameters argon2 = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(params.salt())
        .withMemoryAsKB(params.memoryKib())
        .withIterations(params.iterations())
        .withParallelism(params.parallelism())
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(argon2);
    byte[] password = utf8(passphrase);
    byte[] key = new byte[params.hashLength()];
    try {
      generator.generateBytes(password, key, 0, key.length);
      return key;
    } finally {
      ByteUtils.zero(password);
    }
  }

  private static GCMModeCipher gcm(boolean forEncryption, byte[] key, byte[] nonce, int macLength) {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(forEncryption, new AEADParameters(new KeyParameter(key), macLength * 8, nonce));
    return cipher;
  }

  private static byte[] utf8(char[] chars) {
    ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(chars));
    byte[] out = new byte[encoded.remaining()];
    encoded.get(out);
    if (encoded.hasArray()) {
      Arrays.fill(encoded.array(), (byte) 0);
    }
    return out;
  }
}
