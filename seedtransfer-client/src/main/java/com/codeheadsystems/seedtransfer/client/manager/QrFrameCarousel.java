package com.codeheadsystems.seedtransfer.client.manager;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Cycles through the encoded QR frames for display on the sending device, so the receiver can
 * pick up all of them by pointing a camera at one screen.
 */
public class QrFrameCarousel {

  /**
   * Time each frame stays on screen.
   */
  public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(700);

  private final List<String> frames;
  private int position;

  /**
   * @param frames the encoded frames, in display order
   */
  public QrFrameCarousel(final List<String> frames) {
    if (frames == null || frames.isEmpty()) {
      throw new IllegalArgumentException("frames must not be empty");
    }
    this.frames = List.copyOf(frames);
  }

  public synchronized String current() {
    return frames.get(position);
  }

  /**
   * Moves to the next frame, wrapping after the last one.
   *
   * @return the frame now showing
   */
  public synchronized String advance() {
    position = (position + 1) % frames.size();
    return frames.get(position);
  }

  public int size() {
    return frames.size();
  }

  /**
   * Shows the current frame immediately, then the next one every {@code interval}.
   *
   * @param scheduler runs the display callback
   * @param interval  time per frame
   * @param display   receives each frame to show
   * @return cancel this to stop the carousel
   */
  public ScheduledFuture<?> start(final ScheduledExecutorService scheduler,
                                  final Duration interval,
                                  final Consumer<String> display) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    display.accept(current());
    long millis = interval.toMillis();
    return scheduler.scheduleAtFixedRate(() -> display.accept(advance()),
        millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * {@link #start(ScheduledExecutorService, Duration, Consumer)} with {@link #DEFAULT_INTERVAL}.
   */
  public ScheduledFuture<?> start(final ScheduledExecutorService scheduler,
                                  final Consumer<String> display) {
    return start(scheduler, DEFAULT_INTERVAL, display);
  }
}
