package com.codeheadsystems.seedtransfer.model;

import com.codeheadsystems.seedtransfer.common.ByteUtils;
import com.codeheadsystems.seedtransfer.common.RandomProvider;
import java.security.MessageDigest;
import java.util.Arrays;
import javax.security.auth.Destroyable;

/**
 * The 32-byte root identity secret.
 * <p>
 * Bytes are copied on the way in and on the way out, so callers may zero their own arrays
 * freely. {@link #toString()} never prints the secret. Once {@link #destroy()} has been called
 * the instance is unusable and every accessor throws {@link IllegalStateException}.
 */
public final class Seed implements Destroyable {

  /**
   * Seed length in bytes.
   */
  public static final int LENGTH = 32;

  private final byte[] bytes;
  private volatile boolean destroyed;

  private Seed(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Wraps a copy of the given bytes.
   *
   * @param bytes exactly {@link #LENGTH} bytes
   * @return the seed
   */
  public static Seed of(byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Seed must be " + LENGTH + " bytes");
    }
    return new Seed(bytes.clone());
  }

  /**
   * Parses a 64-character hex string.
   *
   * @param hex the hex encoded seed
   * @return the seed
   */
  public static Seed fromHex(String hex) {
    byte[] decoded = ByteUtils.fromHex(hex);
    try {
      return of(decoded);
    } finally {
      ByteUtils.zero(decoded);
    }
  }

  /**
   * Draws a fresh random seed, used when a new identity is created.
   *
   * @param randomProvider the randomness source
   * @return a new seed
   */
  public static Seed generate(RandomProvider randomProvider) {
    return new Seed(randomProvider.randomBytes(LENGTH));
  }

  /**
   * Returns a copy of the secret bytes. The caller owns (and should zero) the copy.
   *
   * @return the seed bytes
   */
  public byte[] bytes() {
    checkLive();
    return bytes.clone();
  }

  /**
   * Lowercase hex of the secret, for writing to key storage.
   *
   * @return the hex encoding
   */
  public String toHex() {
    checkLive();
    return ByteUtils.toHex(bytes);
  }

  @Override
  public void destroy() {
    Arrays.fill(bytes, (byte) 0);
    destroyed = true;
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  private void checkLive() {
    if (destroyed) {
      throw new IllegalStateException("Seed has been destroyed");
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Seed other
        && !destroyed && !other.destroyed
        && MessageDigest.isEqual(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    // Constant so the secret never leaks through hash-based collections.
    return Seed.class.hashCode();
  }

  @Override
  public String toString() {
    return destroyed ? "Seed[destroyed]" : "Seed[redacted]";
  }
}
