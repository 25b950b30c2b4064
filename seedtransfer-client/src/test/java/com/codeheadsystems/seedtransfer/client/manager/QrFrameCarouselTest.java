package com.codeheadsystems.seedtransfer.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QrFrameCarouselTest {

  private static final List<String> FRAMES = List.of("f1", "f2", "f3");

  @Mock private ScheduledExecutorService scheduler;

  @Test
  void advance_cyclesAndWraps() {
    QrFrameCarousel carousel = new QrFrameCarousel(FRAMES);

    assertThat(carousel.current()).isEqualTo("f1");
    assertThat(carousel.advance()).isEqualTo("f2");
    assertThat(carousel.advance()).isEqualTo("f3");
    assertThat(carousel.advance()).isEqualTo("f1");
    assertThat(carousel.size()).isEqualTo(3);
  }

  @Test
  void start_showsFirstFrameAndSchedulesAtDefaultInterval() {
    QrFrameCarousel carousel = new QrFrameCarousel(FRAMES);
    List<String> shown = new ArrayList<>();

    carousel.start(scheduler, shown::add);

    ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
    verify(scheduler).scheduleAtFixedRate(tick.capture(), eq(700L), eq(700L), eq(TimeUnit.MILLISECONDS));
    assertThat(shown).containsExactly("f1");

    tick.getValue().run();
    tick.getValue().run();
    tick.getValue().run();
    assertThat(shown).containsExactly("f1", "f2", "f3", "f1");
  }

  @Test
  void start_nonPositiveInterval_throws() {
    QrFrameCarousel carousel = new QrFrameCarousel(FRAMES);
    assertThatThrownBy(() -> carousel.start(scheduler, Duration.ZERO, frame -> { }))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_empty_throws() {
    assertThatThrownBy(() -> new QrFrameCarousel(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void defaultInterval_is700Millis() {
    assertThat(QrFrameCarousel.DEFAULT_INTERVAL).isEqualTo(Duration.ofMillis(700));
  }
}
