package com.codeheadsystems.seedtransfer.exceptions;

/**
 * Wrong word count, a word outside the list, or a bad embedded checksum.
 */
public class InvalidMnemonicException extends SeedTransferException {

  public InvalidMnemonicException(final String message) {
    super(message);
  }

  public InvalidMnemonicException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
