package com.codeheadsystems.seedtransfer.common;

import java.security.SecureRandom;

/**
 * Injectable source of randomness for seeds, Argon2id salts and AES-GCM nonces.
 * Tests substitute a seeded {@link SecureRandom}; production uses the platform default.
 *
 * @param random the secure random backing every draw
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a provider backed by a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Returns {@code len} freshly drawn random bytes.
   *
   * @param len the number of bytes
   * @return a new array of random bytes
   */
  public byte[] randomBytes(int len) {
    if (len < 0) {
      throw new IllegalArgumentException("Negative length: " + len);
    }
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }
}
