package com.codeheadsystems.seedtransfer.qr;

import java.util.Optional;

/**
 * What a single {@link FrameAssembler#offer(String)} did.
 *
 * @param outcome  the effect of the offered frame
 * @param frameIndex index of the offered frame, or 0 if it did not parse
 * @param state    the assembler state after the offer
 * @param reason   set only for {@link Outcome#REJECTED}
 * @param detail   human-readable explanation for status lines; never contains secrets
 */
public record AssemblyEvent(Outcome outcome,
                            int frameIndex,
                            AssemblerState state,
                            Optional<RejectionReason> reason,
                            String detail) {

  /**
   * Effect of one offered frame.
   */
  public enum Outcome {
    /** A new frame was stored; more are needed. */
    ACCEPTED,
    /** The index was already held; nothing changed. */
    DUPLICATE,
    /** Dropped because validation was running or the session had already succeeded. */
    IGNORED,
    /** The final frame arrived and everything checked out; the seed was stored. */
    SUCCEEDED,
    /** The session was discarded. */
    REJECTED
  }

  static AssemblyEvent of(Outcome outcome, int frameIndex, AssemblerState state, String detail) {
    return new AssemblyEvent(outcome, frameIndex, state, Optional.empty(), detail);
  }

  static AssemblyEvent rejected(RejectionReason reason, int frameIndex, AssemblerState state,
                                String detail) {
    return new AssemblyEvent(Outcome.REJECTED, frameIndex, state, Optional.of(reason), detail);
  }
}
