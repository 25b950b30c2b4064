package com.codeheadsystems.seedtransfer.model;

/**
 * One frame of the animated QR transfer.
 * <p>
 * Wire form: {@code otp-e2ee-seed:<index>/<total>:<payload>}. Word frames carry a run of
 * space-joined mnemonic words; the last frame carries {@code check:<16 hex chars>}.
 *
 * @param index   1-based position
 * @param total   number of frames in the set
 * @param payload words, or the checksum marker plus hex
 */
public record QrFrame(int index, int total, String payload) {

  /**
   * Prefix every frame starts with.
   */
  public static final String PREFIX = "otp-e2ee-seed:";

  /**
   * Marker that starts the payload of the checksum frame.
   */
  public static final String CHECK_MARKER = "check:";

  public QrFrame {
    if (total < 1 || index < 1 || index > total) {
      throw new IllegalArgumentException("Frame index " + index + " outside 1.." + total);
    }
    if (payload == null) {
      throw new IllegalArgumentException("Frame payload must not be null");
    }
  }

  /**
   * @return true if this is the trailing checksum frame
   */
  public boolean isChecksumFrame() {
    return index == total;
  }

  /**
   * @return the payload with the checksum marker removed; only valid on the checksum frame
   */
  public String checksumHex() {
    if (!isChecksumFrame() || !payload.startsWith(CHECK_MARKER)) {
      throw new IllegalStateException("Frame " + index + " is not a checksum frame");
    }
    return payload.substring(CHECK_MARKER.length());
  }

  /**
   * @return the text to render into the QR symbol
   */
  public String encode() {
    return PREFIX + index + "/" + total + ":" + payload;
  }

  @Override
  public String toString() {
    return "QrFrame[" + index + "/" + total + "]";
  }
}
