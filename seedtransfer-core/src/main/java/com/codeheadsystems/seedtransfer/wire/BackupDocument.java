package com.codeheadsystems.seedtransfer.wire;

import com.codeheadsystems.seedtransfer.model.EncryptedBackup;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code PUT} and {@code GET /identity/backup/{identity}}.
 *
 * @param kdfParams     the key derivation parameters
 * @param encryptedSeed base64 of {@code nonce || ciphertext || tag}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackupDocument(@JsonProperty("kdfParams") KdfParamsDocument kdfParams,
                             @JsonProperty("encryptedSeed") String encryptedSeed) {

  public BackupDocument(EncryptedBackup backup) {
    this(new KdfParamsDocument(backup.params()), backup.ciphertextBase64());
  }

  /**
   * @return the domain backup
   * @throws IllegalArgumentException if a field is missing or malformed
   */
  public EncryptedBackup encryptedBackup() {
    if (kdfParams == null) {
      throw new IllegalArgumentException("Missing required field: kdfParams");
    }
    if (encryptedSeed == null || encryptedSeed.isBlank()) {
      throw new IllegalArgumentException("Missing required field: encryptedSeed");
    }
    return new EncryptedBackup(kdfParams.argon2Params(), encryptedSeed);
  }
}
