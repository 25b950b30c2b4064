package com.codeheadsystems.seedtransfer.model;

/**
 * Names the account whose encrypted backup lives on the backup server (a username or user ID).
 *
 * @param value the identifier
 */
public record IdentityReference(String value) {

  public IdentityReference {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Identity reference must not be blank");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
