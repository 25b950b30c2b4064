package com.codeheadsystems.seedtransfer.transport;

import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.codeheadsystems.seedtransfer.model.IdentityReference;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BackupTransport} backed by a {@link ConcurrentHashMap}, standing in for the backup
 * server in tests and offline runs.
 */
public class InMemoryBackupTransport implements BackupTransport {

  private static final Logger log = LoggerFactory.getLogger(InMemoryBackupTransport.class);

  private final ConcurrentHashMap<IdentityReference, EncryptedBackup> backups = new ConcurrentHashMap<>();

  @Override
  public void upload(IdentityReference identity, EncryptedBackup backup) {
    backups.put(identity, backup);
    log.debug("Stored backup for identity {}", identity);
  }

  @Override
  public Optional<EncryptedBackup> download(IdentityReference identity) {
    return Optional.ofNullable(backups.get(identity));
  }

  /**
   * Removes the backup for an identity, if present.
   *
   * @param identity the owning identity
   */
  public void delete(IdentityReference identity) {
    backups.remove(identity);
  }
}
