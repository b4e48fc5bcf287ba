package io.recall.schedule;

import io.recall.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cancellable ticker that drives both background pipelines.
 *
 * <p>After {@link #start()}, a single daemon thread waits the initial delay and then runs
 * the task repeatedly, sleeping {@code interval} after a successful run and
 * {@code errorCooldown} after a failed one. Exceptions are logged and never end the loop;
 * only {@link #stop()}, {@link #close()}, an interrupt or an {@link Error} do. Once the
 * thread has exited, {@link #isRunning()} reports {@code false}.
 *
 * <p>{@link #stop()} is cooperative: it sets the stop flag and wakes the sleeping thread,
 * so a running task finishes its current iteration. {@link #close()} additionally waits up
 * to {@code stopTimeout} and then interrupts the thread.
 *
 * <p>Create instances via {@link #builder(String)}.
 */
public final class PeriodicLoop implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PeriodicLoop.class.getName());

  /**
   * One iteration of loop work.
   */
  @FunctionalInterface
  public interface Task {
    void run() throws Exception;
  }

  private final String name;
  private final Task task;
  private final Duration initialDelay;
  private final Duration interval;
  private final Duration errorCooldown;
  private final Duration stopTimeout;

  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private ExecutorService executor;
  private volatile boolean stopped;
  private volatile boolean exited;
  private volatile long iterations;

  private PeriodicLoop(Builder builder) {
    this.name = builder.name;
    this.task = Objects.requireNonNull(builder.task, "task");
    this.initialDelay = requireNonNegative(builder.initialDelay, "initialDelay");
    this.interval = requirePositive(builder.interval, "interval");
    this.errorCooldown = requirePositive(
        builder.errorCooldown != null ? builder.errorCooldown : builder.interval, "errorCooldown");
    this.stopTimeout = requireNonNegative(builder.stopTimeout, "stopTimeout");
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Starts the loop thread. Calling it again while running is a no-op.
   *
   * @throws IllegalStateException if the loop has been stopped
   */
  public synchronized void start() {
    if (stopped) {
      throw new IllegalStateException("Loop " + name + " has been stopped");
    }
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory(name + "-"));
    executor.execute(this::runLoop);
    logger.info("Started loop " + name);
  }

  private void runLoop() {
    try {
      if (!pause(initialDelay)) {
        return;
      }
      while (!stopped) {
        Duration next = interval;
        try {
          task.run();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        } catch (Exception e) {
          logger.log(Level.SEVERE, "Loop " + name + " iteration failed; retrying after "
              + errorCooldown, e);
          next = errorCooldown;
        }
        iterations++;
        if (!pause(next)) {
          return;
        }
      }
    } catch (Error e) {
      logger.log(Level.SEVERE, "Loop " + name + " terminated by fatal error", e);
      throw e;
    } finally {
      if (!stopped) {
        logger.warning("Loop " + name + " exited without stop()");
      }
      exited = true;
    }
  }

  /** Returns {@code false} when the loop should exit. */
  private boolean pause(Duration duration) {
    if (stopped) {
      return false;
    }
    if (duration.isZero()) {
      return true;
    }
    try {
      return !stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /**
   * Requests a cooperative stop. The current iteration, if any, runs to completion.
   */
  public void stop() {
    stopped = true;
    stopSignal.countDown();
  }

  /**
   * Waits for the loop thread to exit after {@link #stop()}.
   *
   * @return {@code true} if the thread exited (or was never started) within the timeout
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    ExecutorService current;
    synchronized (this) {
      current = executor;
    }
    if (current == null) {
      return true;
    }
    current.shutdown();
    return current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isRunning() {
    synchronized (this) {
      if (executor == null) {
        return false;
      }
    }
    return !stopped && !exited;
  }

  /** Number of completed iterations (successful or failed). */
  public long iterations() {
    return iterations;
  }

  /**
   * Stops the loop, waits up to the configured stop timeout, then cancels it hard.
   */
  @Override
  public void close() {
    stop();
    try {
      if (!awaitTermination(stopTimeout)) {
        logger.warning("Loop " + name + " did not stop within " + stopTimeout + "; cancelling");
        synchronized (this) {
          executor.shutdownNow();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      synchronized (this) {
        executor.shutdownNow();
      }
    }
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
    return value;
  }

  private static Duration requireNonNegative(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
    }
    return value;
  }

  /**
   * Builder for {@link PeriodicLoop}.
   */
  public static final class Builder {
    private final String name;
    private Task task;
    private Duration initialDelay = Duration.ZERO;
    private Duration interval;
    private Duration errorCooldown;
    private Duration stopTimeout = Duration.ofSeconds(5);

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    /** <b>Required.</b> */
    public Builder task(Task task) {
      this.task = task;
      return this;
    }

    /** Delay before the first iteration. Default: none. */
    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    /** <b>Required.</b> Pause after a successful iteration. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /** Pause after a failed iteration. Default: same as {@code interval}. */
    public Builder errorCooldown(Duration errorCooldown) {
      this.errorCooldown = errorCooldown;
      return this;
    }

    /** How long {@link #close()} waits before cancelling. Default: 5 seconds. */
    public Builder stopTimeout(Duration stopTimeout) {
      this.stopTimeout = stopTimeout;
      return this;
    }

    public PeriodicLoop build() {
      return new PeriodicLoop(this);
    }
  }
}
