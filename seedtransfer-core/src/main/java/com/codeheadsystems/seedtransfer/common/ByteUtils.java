package com.codeheadsystems.seedtransfer.common;

import java.util.Arrays;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Byte array helpers shared by the codecs and the backup cipher.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the concatenation
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Lowercase hex encoding, two characters per byte.
   *
   * @param bytes the bytes
   * @return the hex string
   */
  public static String toHex(byte[] bytes) {
    return Hex.toHexString(bytes);
  }

  /**
   * Decodes a hex string (either case) into bytes.
   *
   * @param hex the hex string
   * @return the decoded bytes
   * @throws IllegalArgumentException if the string has odd length or a non-hex character
   */
  public static byte[] fromHex(String hex) {
    if (hex.length() % 2 != 0) {
      throw new IllegalArgumentException("Hex string must have even length");
    }
    try {
      return Hex.decodeStrict(hex);
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Invalid hex string", e);
    }
  }

  /**
   * Overwrites the array with zeros. Null-safe.
   *
   * @param bytes the array to clear
   */
  public static void zero(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }

  /**
   * Overwrites the array with NUL characters. Null-safe.
   *
   * @param chars the array to clear
   */
  public static void zero(char[] chars) {
    if (chars != null) {
      Arrays.fill(chars, '\0');
    }
  }
}
