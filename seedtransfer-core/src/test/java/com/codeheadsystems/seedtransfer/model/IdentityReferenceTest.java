package com.codeheadsystems.seedtransfer.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class IdentityReferenceTest {

  @Test
  void toString_isTheValue() {
    assertThat(new IdentityReference("alice")).hasToString("alice");
  }

  @Test
  void constructor_blank_throws() {
    assertThatThrownBy(() -> new IdentityReference(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new IdentityReference(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
