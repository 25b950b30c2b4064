package com.codeheadsystems.seedtransfer.model;

import java.util.Objects;

/**
 * A passphrase-protected seed as stored by the backup server. Opaque to the server.
 *
 * @param params           the KDF and AEAD parameters
 * @param ciphertextBase64 base64 of {@code nonce || ciphertext || tag}
 */
public record EncryptedBackup(Argon2Params params, String ciphertextBase64) {

  public EncryptedBackup {
    Objects.requireNonNull(params, "params");
    Objects.requireNonNull(ciphertextBase64, "ciphertextBase64");
  }
}
