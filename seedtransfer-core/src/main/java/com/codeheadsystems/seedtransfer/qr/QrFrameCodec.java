package com.codeheadsystems.seedtransfer.qr;

import com.codeheadsystems.seedtransfer.checksum.ChecksumCalculator;
import com.codeheadsystems.seedtransfer.exceptions.FrameFormatException;
import com.codeheadsystems.seedtransfer.mnemonic.MnemonicCodec;
import com.codeheadsystems.seedtransfer.model.Mnemonic;
import com.codeheadsystems.seedtransfer.model.QrFrame;
import com.codeheadsystems.seedtransfer.model.Seed;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a mnemonic into the fixed three-frame QR set and parses scanned frame text.
 * <p>
 * Frames 1 and 2 carry words 1-12 and 13-24; frame 3 carries {@code check:<hex>} from the
 * {@link ChecksumCalculator}. Each frame is self-describing, so a scanner can pick them up in
 * any order while the display cycles through them.
 */
public class QrFrameCodec {

  /**
   * Frames per transfer.
   */
  public static final int TOTAL_FRAMES = 3;

  /**
   * Words in each word-carrying frame.
   */
  public static final int WORDS_PER_FRAME = MnemonicCodec.WORD_COUNT / (TOTAL_FRAMES - 1);

  private static final Pattern WORD_RUN = Pattern.compile("[a-z]+( [a-z]+)*");
  private static final Pattern INDEX = Pattern.compile("[0-9]{1,9}");

  private final ChecksumCalculator checksumCalculator;

  /**
   * Instantiates a new QR frame codec.
   *
   * @param checksumCalculator produces the checksum frame payload
   */
  public QrFrameCodec(final ChecksumCalculator checksumCalculator) {
    this.checksumCalculator = checksumCalculator;
  }

  /**
   * Builds the frame set for display.
   *
   * @param mnemonic the 24-word mnemonic of {@code seed}
   * @param seed     the seed the checksum is computed over
   * @return frames 1..{@link #TOTAL_FRAMES} in index order
   */
  public List<QrFrame> split(final Mnemonic mnemonic, final Seed seed) {
    if (mnemonic.size() != MnemonicCodec.WORD_COUNT) {
      throw new IllegalArgumentException("Expected a " + MnemonicCodec.WORD_COUNT + "-word mnemonic");
    }
    List<QrFrame> frames = new ArrayList<>(TOTAL_FRAMES);
    for (int i = 0; i < TOTAL_FRAMES - 1; i++) {
      Mnemonic part = mnemonic.slice(i * WORDS_PER_FRAME, (i + 1) * WORDS_PER_FRAME);
      frames.add(new QrFrame(i + 1, TOTAL_FRAMES, part.phrase()));
    }
    frames.add(new QrFrame(TOTAL_FRAMES, TOTAL_FRAMES,
        QrFrame.CHECK_MARKER + checksumCalculator.checksumHex(seed)));
    return List.copyOf(frames);
  }

  /**
   * Same as {@link #split} but already rendered to wire text.
   *
   * @param mnemonic the mnemonic
   * @param seed     the seed
   * @return the encoded frame strings in index order
   */
  public List<String> encodeAll(final Mnemonic mnemonic, final Seed seed) {
    return split(mnemonic, seed).stream().map(QrFrame::encode).toList();
  }

  /**
   * Parses one scanned frame. Either a complete frame comes back or an exception is thrown;
   * there is no partially populated result.
   *
   * @param text the raw QR text
   * @return the parsed frame
   * @throws FrameFormatException if the text is not a valid frame of this protocol
   */
  public QrFrame parseOne(final String text) {
    if (text == null || !text.startsWith(QrFrame.PREFIX)) {
      throw new FrameFormatException("Invalid QR code format (prefix mismatch)");
    }
    String rest = text.substring(QrFrame.PREFIX.length());
    int colon = rest.indexOf(':');
    if (colon < 0) {
      throw new FrameFormatException("Invalid QR code format (structure error)");
    }
    String position = rest.substring(0, colon);
    String payload = rest.substring(colon + 1);

    int slash = position.indexOf('/');
    if (slash < 0) {
      throw new FrameFormatException("Invalid QR code format (frame info error)");
    }
    String indexText = position.substring(0, slash);
    String totalText = position.substring(slash + 1);
    if (!INDEX.matcher(indexText).matches() || !INDEX.matcher(totalText).matches()) {
      throw new FrameFormatException("Invalid QR code format (non-numeric frame number)");
    }
    int index = Integer.parseInt(indexText);
    int total = Integer.parseInt(totalText);
    if (total != TOTAL_FRAMES || index < 1 || index > total) {
      throw new FrameFormatException("Invalid QR code format (invalid frame number)");
    }

    if (index == total) {
      // The text after the marker is not checked here; a wrong value is a checksum mismatch.
      if (!payload.startsWith(QrFrame.CHECK_MARKER)
          || payload.length() == QrFrame.CHECK_MARKER.length()) {
        throw new FrameFormatException("Invalid QR code format (checksum marker missing)");
      }
    } else {
      if (!WORD_RUN.matcher(payload).matches()) {
        throw new FrameFormatException("Invalid QR code format (word frame malformed)");
      }
      int words = payload.split(" ").length;
      if (words != WORDS_PER_FRAME) {
        throw new FrameFormatException(
            "Invalid QR code format (expected " + WORDS_PER_FRAME + " words, got " + words + ")");
      }
    }
    return new QrFrame(index, total, payload);
  }
}
