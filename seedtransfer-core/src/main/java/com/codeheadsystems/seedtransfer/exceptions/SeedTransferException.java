package com.codeheadsystems.seedtransfer.exceptions;

/**
 * Base type for every recoverable failure of a transfer attempt. None of these are fatal to
 * the process; each is local to one import or export attempt.
 */
public class SeedTransferException extends RuntimeException {

  /**
   * Instantiates a new seed transfer exception.
   *
   * @param message the message
   */
  public SeedTransferException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new seed transfer exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SeedTransferException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
