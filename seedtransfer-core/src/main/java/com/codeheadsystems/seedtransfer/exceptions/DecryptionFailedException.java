package com.codeheadsystems.seedtransfer.exceptions;

/**
 * A passphrase backup could not be opened. The message is fixed: it never says whether the
 * passphrase was wrong or the blob was damaged.
 */
public class DecryptionFailedException extends SeedTransferException {

  /**
   * The only message this exception ever carries.
   */
  public static final String MESSAGE = "Wrong passphrase or corrupted backup";

  public DecryptionFailedException() {
    super(MESSAGE);
  }

  public DecryptionFailedException(final Throwable cause) {
    super(MESSAGE, cause);
  }
}
