package com.codeheadsystems.seedtransfer.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.seedtransfer.common.RandomProvider;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SeedTest {

  @Test
  void of_copiesInput() {
    byte[] raw = new byte[Seed.LENGTH];
    Seed seed = Seed.of(raw);
    raw[0] = 9;
    assertThat(seed.bytes()[0]).isZero();
  }

  @Test
  void bytes_returnsCopy() {
    Seed seed = Seed.of(new byte[Seed.LENGTH]);
    seed.bytes()[0] = 9;
    assertThat(seed.bytes()[0]).isZero();
  }

  @Test
  void of_wrongLength_throws() {
    assertThatThrownBy(() -> Seed.of(new byte[31])).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Seed.of(new byte[33])).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromHex_roundTripsWithToHex() {
    String hex = "7f".repeat(Seed.LENGTH);
    assertThat(Seed.fromHex(hex).toHex()).isEqualTo(hex);
  }

  @Test
  void generate_producesDistinctSeeds() {
    RandomProvider randomProvider = new RandomProvider();
    assertThat(Seed.generate(randomProvider)).isNotEqualTo(Seed.generate(randomProvider));
  }

  @Test
  void equals_comparesContent() {
    byte[] raw = new byte[Seed.LENGTH];
    Arrays.fill(raw, (byte) 1);
    assertThat(Seed.of(raw)).isEqualTo(Seed.of(raw)).hasSameHashCodeAs(Seed.of(raw));
  }

  @Test
  void toString_neverShowsBytes() {
    Seed seed = Seed.fromHex("ab".repeat(Seed.LENGTH));
    assertThat(seed.toString()).doesNotContain("ab");
  }

  @Test
  void destroy_makesSeedUnusable() {
    Seed seed = Seed.of(new byte[Seed.LENGTH]);
    seed.destroy();
    assertThat(seed.isDestroyed()).isTrue();
    assertThatThrownBy(seed::bytes).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(seed::toHex).isInstanceOf(IllegalStateException.class);
  }
}
