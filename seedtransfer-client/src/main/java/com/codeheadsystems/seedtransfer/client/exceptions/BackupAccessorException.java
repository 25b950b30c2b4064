package com.codeheadsystems.seedtransfer.client.exceptions;

import com.codeheadsystems.seedtransfer.exceptions.SeedTransferException;

/**
 * The backup server could not be reached or answered with an error.
 */
public class BackupAccessorException extends SeedTransferException {
  /**
   * Instantiates a new Backup accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public BackupAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
