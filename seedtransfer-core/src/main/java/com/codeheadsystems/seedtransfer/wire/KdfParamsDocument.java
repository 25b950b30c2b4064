package com.codeheadsystems.seedtransfer.wire;

import com.codeheadsystems.seedtransfer.model.Argon2Params;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * JSON form of {@link Argon2Params}. The salt is base64-encoded; everything else is a plain
 * number.
 *
 * @param type        always {@code argon2id}
 * @param saltBase64  base64-encoded salt
 * @param iterations  Argon2id time cost
 * @param memory      Argon2id memory cost in KiB
 * @param parallelism Argon2id lanes
 * @param hashLength  derived key length
 * @param nonceLength AES-GCM nonce length
 * @param macLength   AES-GCM tag length
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KdfParamsDocument(
    @JsonProperty("type") String type,
    @JsonProperty("salt") String saltBase64,
    @JsonProperty("iterations") int iterations,
    @JsonProperty("memory") int memory,
    @JsonProperty("parallelism") int parallelism,
    @JsonProperty("hashLength") int hashLength,
    @JsonProperty("nonceLength") int nonceLength,
    @JsonProperty("macLength") int macLength) {

  public KdfParamsDocument(Argon2Params params) {
    this(Argon2Params.TYPE,
        Base64.getEncoder().encodeToString(params.salt()),
        params.iterations(),
        params.memoryKib(),
        params.parallelism(),
        params.hashLength(),
        params.nonceLength(),
        params.macLength());
  }

  /**
   * @return the domain parameters
   * @throws IllegalArgumentException on an unknown KDF type or a missing or invalid salt
   */
  public Argon2Params argon2Params() {
    if (!Argon2Params.TYPE.equals(type)) {
      throw new IllegalArgumentException("Unsupported KDF type: " + type);
    }
    if (saltBase64 == null || saltBase64.isBlank()) {
      throw new IllegalArgumentException("Missing required field: salt");
    }
    byte[] salt;
    try {
      salt = Base64.getDecoder().decode(saltBase64);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: salt", e);
    }
    return new Argon2Params(salt, iterations, memory, parallelism, hashLength, nonceLength,
        macLength);
  }
}
