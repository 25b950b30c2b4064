package com.codeheadsystems.seedtransfer.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class QrFrameTest {

  @Test
  void encode_producesWireForm() {
    assertThat(new QrFrame(2, 3, "a b c").encode()).isEqualTo("otp-e2ee-seed:2/3:a b c");
  }

  @Test
  void checksumHex_stripsMarker() {
    QrFrame frame = new QrFrame(3, 3, "check:0011223344556677");
    assertThat(frame.isChecksumFrame()).isTrue();
    assertThat(frame.checksumHex()).isEqualTo("0011223344556677");
  }

  @Test
  void checksumHex_onWordFrame_throws() {
    assertThatThrownBy(() -> new QrFrame(1, 3, "words").checksumHex())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void constructor_indexOutOfRange_throws() {
    assertThatThrownBy(() -> new QrFrame(0, 3, "x")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new QrFrame(4, 3, "x")).isInstanceOf(IllegalArgumentException.class);
  }
}
