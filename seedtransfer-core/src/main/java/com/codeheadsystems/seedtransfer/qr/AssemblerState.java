package com.codeheadsystems.seedtransfer.qr;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of a {@link FrameAssembler}. Every transition produces a new instance.
 *
 * @param phase         where the session is
 * @param received      frame indices held so far
 * @param total         frames expected
 * @param lastRejection the reason the previous attempt was discarded, if any
 */
public record AssemblerState(Phase phase,
                             Set<Integer> received,
                             int total,
                             Optional<RejectionReason> lastRejection) {

  /**
   * Session phases. A rejected attempt goes back to {@link #EMPTY} with
   * {@link AssemblerState#lastRejection()} set.
   */
  public enum Phase {
    EMPTY,
    COLLECTING,
    VALIDATING,
    SUCCEEDED
  }

  public AssemblerState {
    received = Set.copyOf(received);
  }

  static AssemblerState empty(int total) {
    return new AssemblerState(Phase.EMPTY, Set.of(), total, Optional.empty());
  }

  AssemblerState withFrame(int index) {
    Set<Integer> next = new TreeSet<>(received);
    next.add(index);
    return new AssemblerState(Phase.COLLECTING, next, total, lastRejection);
  }

  AssemblerState validating() {
    return new AssemblerState(Phase.VALIDATING, received, total, lastRejection);
  }

  AssemblerState succeeded() {
    return new AssemblerState(Phase.SUCCEEDED, received, total, Optional.empty());
  }

  AssemblerState rejected(RejectionReason reason) {
    return new AssemblerState(Phase.EMPTY, Set.of(), total, Optional.of(reason));
  }

  /**
   * @return true once all frames are held
   */
  public boolean complete() {
    return received.size() == total;
  }

  /**
   * @return true if the session has finished successfully
   */
  public boolean isTerminal() {
    return phase == Phase.SUCCEEDED;
  }
}
