package com.codeheadsystems.seedtransfer.exceptions;

/**
 * The reassembled seed does not match the checksum frame; the frames were corrupted or mixed from different exports.
 */
public class ChecksumMismatchException extends SeedTransferException {

  public ChecksumMismatchException(final String message) {
    super(message);
  }

  public ChecksumMismatchException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
