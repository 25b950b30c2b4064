package com.codeheadsystems.seedtransfer.client.manager;

import com.codeheadsystems.seedtransfer.qr.AssemblerState;
import com.codeheadsystems.seedtransfer.qr.AssemblerState.Phase;
import com.codeheadsystems.seedtransfer.qr.AssemblyEvent;
import com.codeheadsystems.seedtransfer.qr.AssemblyEvent.Outcome;
import com.codeheadsystems.seedtransfer.qr.FrameAssembler;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One camera scanning attempt. Scan callbacks hand raw texts to {@link #submit(String)}, which
 * never blocks; a single worker thread feeds them to the {@link FrameAssembler} in arrival order.
 * <p>
 * Texts arriving while the assembler is validating, or while {@code MAX_PENDING} are already
 * queued, are dropped.
 * <p>
 * {@link #completion()} completes once the identity has been imported, and completes
 * exceptionally if the identity store fails.
 */
public class FrameScanSession implements AutoCloseable {

  static final int MAX_PENDING = 32;

  private static final Logger log = LoggerFactory.getLogger(FrameScanSession.class);

  private final FrameAssembler assembler;
  private final Consumer<AssemblyEvent> listener;
  private final ExecutorService worker;
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private final AtomicInteger pending = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Instantiates a new frame scan session with its own worker thread.
   *
   * @param assembler the assembler for this attempt
   * @param listener  receives every event, on the worker thread
   */
  public FrameScanSession(final FrameAssembler assembler, final Consumer<AssemblyEvent> listener) {
    this(assembler, listener, Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "frame-scan-session");
      thread.setDaemon(true);
      return thread;
    }));
  }

  FrameScanSession(final FrameAssembler assembler,
                   final Consumer<AssemblyEvent> listener,
                   final ExecutorService worker) {
    this.assembler = assembler;
    this.listener = listener;
    this.worker = worker;
  }

  /**
   * Queues a scanned text.
   *
   * @param text the raw QR payload
   * @return false if the text was dropped
   */
  public boolean submit(final String text) {
    if (closed.get() || completion.isDone()) {
      return false;
    }
    Phase phase = assembler.state().phase();
    if (phase == Phase.VALIDATING || phase == Phase.SUCCEEDED) {
      return false;
    }
    if (pending.incrementAndGet() > MAX_PENDING) {
      pending.decrementAndGet();
      log.debug("submit: queue full, dropping frame");
      return false;
    }
    try {
      worker.execute(() -> process(text));
      return true;
    } catch (RejectedExecutionException e) {
      pending.decrementAndGet();
      log.debug("submit: session closed, dropping frame");
      return false;
    }
  }

  /**
   * @return completes when the identity has been imported
   */
  public CompletableFuture<Void> completion() {
    return completion;
  }

  public AssemblerState state() {
    return assembler.state();
  }

  /**
   * Abandons the session. Queued texts are discarded and an unfinished {@link #completion()} is
   * cancelled.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      log.debug("close()");
      worker.shutdownNow();
      assembler.reset();
      completion.cancel(false);
    }
  }

  private void process(String text) {
    pending.decrementAndGet();
    if (closed.get()) {
      return;
    }
    final AssemblyEvent event;
    try {
      event = assembler.offer(text);
    } catch (RuntimeException e) {
      log.error("process: identity import failed", e);
      completion.completeExceptionally(e);
      return;
    }
    listener.accept(event);
    if (event.outcome() == Outcome.SUCCEEDED) {
      completion.complete(null);
      worker.shutdown();
    }
  }
}
