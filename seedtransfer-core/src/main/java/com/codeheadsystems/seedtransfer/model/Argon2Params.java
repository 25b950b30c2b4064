package com.codeheadsystems.seedtransfer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The non-secret parameters needed to reverse a passphrase backup. Stored next to the
 * ciphertext so that raising the cost later does not strand older backups.
 *
 * @param salt         16 random bytes, fresh per backup
 * @param iterations   Argon2id time cost
 * @param memoryKib    Argon2id memory cost in KiB
 * @param parallelism  Argon2id lanes
 * @param hashLength   derived key length in bytes
 * @param nonceLength  AES-GCM nonce length in bytes
 * @param macLength    AES-GCM tag length in bytes
 */
public record Argon2Params(
    byte[] salt,
    int iterations,
    int memoryKib,
    int parallelism,
    int hashLength,
    int nonceLength,
    int macLength) {

  /**
   * Algorithm label written to the backup document.
   */
  public static final String TYPE = "argon2id";

  /**
   * Salt length in bytes.
   */
  public static final int SALT_LENGTH = 16;

  public Argon2Params {
    Objects.requireNonNull(salt, "salt");
    salt = salt.clone();
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Argon2Params other
        && Arrays.equals(salt, other.salt)
        && iterations == other.iterations
        && memoryKib == other.memoryKib
        && parallelism == other.parallelism
        && hashLength == other.hashLength
        && nonceLength == other.nonceLength
        && macLength == other.macLength;
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(salt), iterations, memoryKib, parallelism,
        hashLength, nonceLength, macLength);
  }

  @Override
  public String toString() {
    return "Argon2Params[iterations=" + iterations + ", memoryKib=" + memoryKib
        + ", parallelism=" + parallelism + ", hashLength=" + hashLength
        + ", nonceLength=" + nonceLength + ", macLength=" + macLength + "]";
  }
}
