package com.codeheadsystems.seedtransfer.backup;

import com.codeheadsystems.seedtransfer.common.RandomProvider;

/**
 * Cost and size parameters used when a new passphrase backup is created.
 * <p>
 * These only govern encryption. Decryption always uses the parameters stored with the
 * backup, so the defaults can be raised without breaking existing backups.
 *
 * @param memoryKib      Argon2id memory cost in KiB
 * @param iterations     Argon2id time cost
 * @param parallelism    Argon2id lanes
 * @param hashLength     derived key length; 32 for AES-256
 * @param nonceLength    AES-GCM nonce length
 * @param macLength      AES-GCM tag length
 * @param randomProvider source of salts and nonces
 */
public record BackupConfig(
    int memoryKib,
    int iterations,
    int parallelism,
    int hashLength,
    int nonceLength,
    int macLength,
    RandomProvider randomProvider) {

  /**
   * Lowest memory cost accepted for production backups (64 MiB).
   */
  public static final int MIN_MEMORY_KIB = 65536;

  /**
   * Lowest iteration count accepted for production backups.
   */
  public static final int MIN_ITERATIONS = 2;

  public static final int KEY_LENGTH = 32;
  public static final int NONCE_LENGTH = 12;
  public static final int MAC_LENGTH = 16;

  /**
   * Production defaults: 64 MiB, 2 iterations, 1 lane.
   */
  public static final BackupConfig DEFAULT = withArgon2id(MIN_MEMORY_KIB, MIN_ITERATIONS, 1);

  public BackupConfig {
    if (iterations < 1 || parallelism < 1 || memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("Invalid Argon2id cost: memoryKib=" + memoryKib
          + ", iterations=" + iterations + ", parallelism=" + parallelism);
    }
    if (hashLength != KEY_LENGTH) {
      throw new IllegalArgumentException("AES-256 needs a " + KEY_LENGTH + "-byte key");
    }
    if (nonceLength < NONCE_LENGTH || macLength < 12 || macLength > 16) {
      throw new IllegalArgumentException("Invalid AES-GCM nonce/tag length");
    }
    if (randomProvider == null) {
      throw new IllegalArgumentException("randomProvider is required");
    }
  }

  /**
   * Production configuration with the given Argon2id cost. Rejects anything below
   * {@link #MIN_MEMORY_KIB} and {@link #MIN_ITERATIONS}.
   *
   * @param memoryKib   memory cost in KiB
   * @param iterations  time cost
   * @param parallelism lanes
   * @return the config
   */
  public static BackupConfig withArgon2id(int memoryKib, int iterations, int parallelism) {
    if (memoryKib < MIN_MEMORY_KIB || iterations < MIN_ITERATIONS) {
      throw new IllegalArgumentException("Argon2id cost below the production floor of "
          + MIN_MEMORY_KIB + " KiB / " + MIN_ITERATIONS + " iterations");
    }
    return new BackupConfig(memoryKib, iterations, parallelism,
        KEY_LENGTH, NONCE_LENGTH, MAC_LENGTH, new RandomProvider());
  }

  /**
   * Cheap Argon2id cost for unit tests. Do not use in production.
   *
   * @return the config
   */
  public static BackupConfig forTesting() {
    return new BackupConfig(1024, 2, 1, KEY_LENGTH, NONCE_LENGTH, MAC_LENGTH, new RandomProvider());
  }

  /**
   * Returns a copy of this config using the given {@link RandomProvider}.
   *
   * @param randomProvider the provider
   * @return the config
   */
  public BackupConfig withRandomProvider(RandomProvider randomProvider) {
    return new BackupConfig(memoryKib, iterations, parallelism, hashLength, nonceLength,
        macLength, randomProvider);
  }
}
