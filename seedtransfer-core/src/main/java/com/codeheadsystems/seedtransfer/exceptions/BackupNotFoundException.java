package com.codeheadsystems.seedtransfer.exceptions;

/**
 * The backup server holds no backup for the requested identity.
 */
public class BackupNotFoundException extends SeedTransferException {

  public BackupNotFoundException(final String message) {
    super(message);
  }

  public BackupNotFoundException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
