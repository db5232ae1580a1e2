package dev.pgcdc.vertx.replication.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Decides whether a supervisor starts a fresh replication session after the previous one ended
 * with a fatal error, and how long it waits first.
 *
 * <p>Sessions never restart themselves; this policy belongs to whoever owns the session. The
 * default is {@link #never()}.
 */
public final class RestartPolicy {
  private Duration initialBackoff = Duration.ofSeconds(1);
  private Duration maxBackoff = Duration.ofSeconds(30);
  private double backoffMultiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxRestarts = 0;
  private Predicate<Throwable> restartOn = err -> true;
  private final boolean enabled;

  private RestartPolicy(boolean enabled) {
    this.enabled = enabled;
  }

  public static RestartPolicy never() {
    return new RestartPolicy(false);
  }

  public static RestartPolicy withBackoff() {
    return new RestartPolicy(true);
  }

  public RestartPolicy copy() {
    RestartPolicy copy = new RestartPolicy(enabled);
    copy.initialBackoff = initialBackoff;
    copy.maxBackoff = maxBackoff;
    copy.backoffMultiplier = backoffMultiplier;
    copy.jitter = jitter;
    copy.maxRestarts = maxRestarts;
    copy.restartOn = restartOn;
    return copy;
  }

  public RestartPolicy setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
    return this;
  }

  public RestartPolicy setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
    return this;
  }

  public RestartPolicy setBackoffMultiplier(double backoffMultiplier) {
    this.backoffMultiplier = backoffMultiplier;
    return this;
  }

  public RestartPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  /**
   * Upper bound of restarts, {@code 0} for unbounded.
   */
  public RestartPolicy setMaxRestarts(long maxRestarts) {
    this.maxRestarts = maxRestarts;
    return this;
  }

  public RestartPolicy setRestartOn(Predicate<Throwable> restartOn) {
    this.restartOn = Objects.requireNonNull(restartOn, "restartOn");
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxRestarts() {
    return maxRestarts;
  }

  /**
   * @param failure the fatal error that ended the session
   * @param restartsSoFar restarts already performed for this stream
   */
  public boolean shouldRestart(Throwable failure, long restartsSoFar) {
    if (!enabled || !restartOn.test(failure)) {
      return false;
    }
    return maxRestarts == 0 || restartsSoFar < maxRestarts;
  }

  public Duration backoff(long restartsSoFar) {
    double exponential = initialBackoff.toMillis()
      * Math.pow(Math.max(1.0d, backoffMultiplier), Math.max(0L, restartsSoFar));
    long capped = Math.min((long) exponential, maxBackoff.toMillis());
    if (jitter == 0.0d || capped == 0L) {
      return Duration.ofMillis(capped);
    }
    long spread = (long) (capped * jitter);
    return Duration.ofMillis(ThreadLocalRandom.current().nextLong(capped - spread, capped + spread + 1));
  }

  public void validate() {
    if (initialBackoff.isNegative()) {
      throw new IllegalArgumentException("initialBackoff must be >= 0");
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
    }
    if (backoffMultiplier < 1.0d) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }
    if (maxRestarts < 0) {
      throw new IllegalArgumentException("maxRestarts must be >= 0");
    }
  }
}
