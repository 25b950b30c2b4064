package com.codeheadsystems.seedtransfer.transport;

import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.codeheadsystems.seedtransfer.model.IdentityReference;
import java.util.Optional;

/**
 * Moves the opaque encrypted backup to and from the backup server.
 * <p>
 * The transport never sees the passphrase or the seed; it only carries ciphertext and the
 * non-secret KDF parameters.
 */
public interface BackupTransport {

  /**
   * Stores or replaces the backup for an identity.
   *
   * @param identity the owning identity
   * @param backup   ciphertext plus parameters
   */
  void upload(IdentityReference identity, EncryptedBackup backup);

  /**
   * Fetches the backup for an identity.
   *
   * @param identity the owning identity
   * @return the backup, or empty if none exists
   */
  Optional<EncryptedBackup> download(IdentityReference identity);
}
