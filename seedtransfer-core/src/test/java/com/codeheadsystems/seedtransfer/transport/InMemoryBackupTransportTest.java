package com.codeheadsystems.seedtransfer.transport;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.seedtransfer.model.Argon2Params;
import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.codeheadsystems.seedtransfer.model.IdentityReference;
import org.junit.jupiter.api.Test;

class InMemoryBackupTransportTest {

  private static final IdentityReference ALICE = new IdentityReference("alice");
  private static final EncryptedBackup BACKUP =
      new EncryptedBackup(new Argon2Params(new byte[16], 2, 1024, 1, 32, 12, 16), "AAAA");

  private final InMemoryBackupTransport transport = new InMemoryBackupTransport();

  @Test
  void download_unknownIdentity_isEmpty() {
    assertThat(transport.download(ALICE)).isEmpty();
  }

  @Test
  void upload_thenDownload_returnsBackup() {
    transport.upload(ALICE, BACKUP);
    assertThat(transport.download(ALICE)).contains(BACKUP);
    assertThat(transport.download(new IdentityReference("bob"))).isEmpty();
  }

  @Test
  void delete_removesBackup() {
    transport.upload(ALICE, BACKUP);
    transport.delete(ALICE);
    assertThat(transport.download(ALICE)).isEmpty();
  }
}
