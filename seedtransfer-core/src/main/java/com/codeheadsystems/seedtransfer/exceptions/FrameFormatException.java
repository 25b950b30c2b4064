package com.codeheadsystems.seedtransfer.exceptions;

/**
 * Scanned QR text is not a well-formed transfer frame. Discard it and rescan.
 */
public class FrameFormatException extends SeedTransferException {

  public FrameFormatException(final String message) {
    super(message);
  }

  public FrameFormatException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
