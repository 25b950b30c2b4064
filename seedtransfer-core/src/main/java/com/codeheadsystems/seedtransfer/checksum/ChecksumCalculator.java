package com.codeheadsystems.seedtransfer.checksum;

import com.codeheadsystems.seedtransfer.common.ByteUtils;
import com.codeheadsystems.seedtransfer.exceptions.ChecksumMismatchException;
import com.codeheadsystems.seedtransfer.model.Seed;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Integrity tag carried in the last QR frame: HMAC-SHA256(key = seed, data = seed),
 * truncated to the first 8 bytes.
 * <p>
 * The key is the seed itself, so the receiver can only recompute the tag once it already holds
 * the seed it reassembled. This catches transcription and scan corruption between two devices.
 * It is NOT authentication: anyone who controls the displayed frames can substitute a different
 * seed together with that seed's matching tag. Both sides key the HMAC with the raw seed; no
 * derived subkey is used anywhere.
 */
public class ChecksumCalculator {

  /**
   * Tag length after truncation, in bytes.
   */
  public static final int TAG_LENGTH = 8;

  /**
   * Computes the truncated tag.
   *
   * @param seed the seed
   * @return the first {@link #TAG_LENGTH} bytes of HMAC-SHA256(seed, seed)
   */
  public byte[] checksum(final Seed seed) {
    byte[] key = seed.bytes();
    byte[] full = new byte[32];
    try {
      HMac hmac = new HMac(new SHA256Digest());
      hmac.init(new KeyParameter(key));
      hmac.update(key, 0, key.length);
      hmac.doFinal(full, 0);
      byte[] tag = new byte[TAG_LENGTH];
      System.arraycopy(full, 0, tag, 0, TAG_LENGTH);
      return tag;
    } finally {
      ByteUtils.zero(key);
      ByteUtils.zero(full);
    }
  }

  /**
   * @param seed the seed
   * @return the truncated tag as 16 lowercase hex characters
   */
  public String checksumHex(final Seed seed) {
    return ByteUtils.toHex(checksum(seed));
  }

  /**
   * Compares the recomputed tag with the one received in the checksum frame, character for
   * character. The sender always writes lowercase hex.
   *
   * @param seed        the reassembled seed
   * @param expectedHex the hex from the checksum frame
   * @throws ChecksumMismatchException if they differ
   */
  public void verify(final Seed seed, final String expectedHex) {
    byte[] actual = checksumHex(seed).getBytes(StandardCharsets.US_ASCII);
    byte[] expected = expectedHex.getBytes(StandardCharsets.US_ASCII);
    if (!MessageDigest.isEqual(actual, expected)) {
      throw new ChecksumMismatchException("Checksum frame does not match the reassembled seed");
    }
  }
}
