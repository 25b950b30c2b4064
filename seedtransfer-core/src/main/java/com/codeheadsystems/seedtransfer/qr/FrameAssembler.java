package com.codeheadsystems.seedtransfer.qr;

import com.codeheadsystems.seedtransfer.checksum.ChecksumCalculator;
import com.codeheadsystems.seedtransfer.exceptions.ChecksumMismatchException;
import com.codeheadsystems.seedtransfer.exceptions.FrameFormatException;
import com.codeheadsystems.seedtransfer.exceptions.InvalidMnemonicException;
import com.codeheadsystems.seedtransfer.mnemonic.MnemonicCodec;
import com.codeheadsystems.seedtransfer.model.Mnemonic;
import com.codeheadsystems.seedtransfer.model.QrFrame;
import com.codeheadsystems.seedtransfer.model.Seed;
import com.codeheadsystems.seedtransfer.qr.AssemblerState.Phase;
import com.codeheadsystems.seedtransfer.qr.AssemblyEvent.Outcome;
import com.codeheadsystems.seedtransfer.store.IdentityStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receiving side of the animated QR transfer. Collects scanned frames until the set is
 * complete, then validates exactly once.
 * <p>
 * Transitions:
 * <pre>
 *   EMPTY --frame--> COLLECTING --last distinct frame--> VALIDATING --ok--> SUCCEEDED
 *     ^                   |                                   |
 *     +---- malformed ----+------- decode / checksum fail ----+
 * </pre>
 * A rescanned index is a no-op. Any rejection discards every held frame and returns to EMPTY
 * with the reason recorded, so the user can simply keep scanning. The seed reaches the
 * {@link IdentityStore} only on SUCCEEDED.
 * <p>
 * Thread-safe. Frame insertion is serialized on an internal lock; validation runs outside it,
 * and any frame offered while it runs is reported as {@link Outcome#IGNORED}.
 */
public class FrameAssembler {

  private static final Logger log = LoggerFactory.getLogger(FrameAssembler.class);

  private final QrFrameCodec frameCodec;
  private final MnemonicCodec mnemonicCodec;
  private final ChecksumCalculator checksumCalculator;
  private final IdentityStore identityStore;

  private final Object lock = new Object();
  private final Map<Integer, QrFrame> frames = new TreeMap<>();
  private volatile AssemblerState state = AssemblerState.empty(QrFrameCodec.TOTAL_FRAMES);

  /**
   * Instantiates a new frame assembler for one scanning attempt.
   *
   * @param frameCodec         parses scanned text
   * @param mnemonicCodec      decodes the reassembled words
   * @param checksumCalculator checks the decoded seed against the checksum frame
   * @param identityStore      receives the seed on success
   */
  public FrameAssembler(final QrFrameCodec frameCodec,
                        final MnemonicCodec mnemonicCodec,
                        final ChecksumCalculator checksumCalculator,
                        final IdentityStore identityStore) {
    this.frameCodec = frameCodec;
    this.mnemonicCodec = mnemonicCodec;
    this.checksumCalculator = checksumCalculator;
    this.identityStore = identityStore;
  }

  /**
   * @return the current state snapshot
   */
  public AssemblerState state() {
    return state;
  }

  /**
   * Offers one scanned text.
   *
   * @param text the raw QR payload
   * @return what happened
   */
  public AssemblyEvent offer(final String text) {
    final int index;
    final Map<Integer, QrFrame> complete;
    synchronized (lock) {
      AssemblerState current = state;
      if (current.phase() == Phase.VALIDATING || current.phase() == Phase.SUCCEEDED) {
        return AssemblyEvent.of(Outcome.IGNORED, 0, current,
            "Frame ignored while session is " + current.phase());
      }

      final QrFrame frame;
      try {
        frame = frameCodec.parseOne(text);
      } catch (FrameFormatException e) {
        log.warn("offer: malformed frame, discarding {} held frame(s): {}", frames.size(), e.getMessage());
        return reject(RejectionReason.FORMAT_ERROR, 0, e.getMessage());
      }

      index = frame.index();
      if (frames.containsKey(index)) {
        log.debug("offer: duplicate frame {}", index);
        return AssemblyEvent.of(Outcome.DUPLICATE, index, current,
            "Frame " + index + " already received");
      }

      frames.put(index, frame);
      state = current.withFrame(index);
      log.debug("offer: frame {} of {} received", index, frame.total());
      if (!state.complete()) {
        return AssemblyEvent.of(Outcome.ACCEPTED, index, state,
            "Frame " + index + " of " + frame.total() + " received");
      }

      state = state.validating();
      complete = new TreeMap<>(frames);
      frames.clear();
    }
    return validate(complete, index);
  }

  /**
   * Abandons whatever has been collected. Has no effect while validating or after success.
   */
  public void reset() {
    synchronized (lock) {
      if (state.phase() == Phase.EMPTY || state.phase() == Phase.COLLECTING) {
        frames.clear();
        state = AssemblerState.empty(state.total());
      }
    }
  }

  private AssemblyEvent validate(Map<Integer, QrFrame> complete, int lastIndex) {
    int total = state.total();
    Seed seed = null;
    boolean stored = false;
    try {
      List<String> words = new ArrayList<>();
      for (int i = 1; i < total; i++) {
        words.add(complete.get(i).payload());
      }
      Mnemonic mnemonic = Mnemonic.parse(String.join(" ", words));
      seed = mnemonicCodec.decode(mnemonic);
      checksumCalculator.verify(seed, complete.get(total).checksumHex());

      identityStore.set(seed);
      stored = true;
      synchronized (lock) {
        state = state.succeeded();
      }
      log.info("validate: all {} frames verified, identity imported", total);
      return AssemblyEvent.of(Outcome.SUCCEEDED, lastIndex, state, "Identity imported");
    } catch (InvalidMnemonicException e) {
      log.warn("validate: reassembled words rejected: {}", e.getMessage());
      return reject(RejectionReason.DECODE_ERROR, lastIndex, e.getMessage());
    } catch (ChecksumMismatchException e) {
      log.warn("validate: checksum mismatch, discarding frames");
      return reject(RejectionReason.CHECKSUM_MISMATCH, lastIndex,
          "Checksum mismatch! QR data may be corrupted or invalid.");
    } finally {
      if (seed != null) {
        seed.destroy();
      }
      if (!stored) {
        synchronized (lock) {
          if (state.phase() == Phase.VALIDATING) {
            // Store failure: nothing was imported, start over and let the exception surface.
            state = AssemblerState.empty(total);
          }
        }
      }
    }
  }

  private AssemblyEvent reject(RejectionReason reason, int frameIndex, String detail) {
    synchronized (lock) {
      frames.clear();
      state = state.rejected(reason);
      return AssemblyEvent.rejected(reason, frameIndex, state, detail);
    }
  }
}
