/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.controlloop.reconciler.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs of a reconcile worker.
 *
 * <p>Zero or {@code null} durations fall back to the defaults below when the worker is built. The
 * cluster-sync delay has no default and stays zero unless configured.
 */
public final class WorkerTiming {
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(10);
  public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(5);
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(1);

  private final Duration pollInterval;
  private final Duration retryDelay;
  private final Duration clusterSyncDelay;
  private final Duration initialBackoff;
  private final Duration maxBackoff;

  public WorkerTiming(
      Duration pollInterval,
      Duration retryDelay,
      Duration clusterSyncDelay,
      Duration initialBackoff,
      Duration maxBackoff) {
    this.pollInterval = orZero(pollInterval, "pollInterval");
    this.retryDelay = orZero(retryDelay, "retryDelay");
    this.clusterSyncDelay = orZero(clusterSyncDelay, "clusterSyncDelay");
    this.initialBackoff = orZero(initialBackoff, "initialBackoff");
    this.maxBackoff = orZero(maxBackoff, "maxBackoff");
  }

  /** All defaults, no cluster-sync delay. */
  public static WorkerTiming defaults() {
    return new WorkerTiming(null, null, null, null, null).withDefaults();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Copy with every unset field replaced by its default. */
  public WorkerTiming withDefaults() {
    Duration backoffCeiling = maxBackoff.isZero() ? DEFAULT_MAX_BACKOFF : maxBackoff;
    Duration backoffFloor = initialBackoff.isZero() ? DEFAULT_INITIAL_BACKOFF : initialBackoff;
    return new WorkerTiming(
        pollInterval.isZero() ? DEFAULT_POLL_INTERVAL : pollInterval,
        retryDelay.isZero() ? DEFAULT_RETRY_DELAY : retryDelay,
        clusterSyncDelay,
        backoffFloor,
        backoffCeiling);
  }

  /** Copy with new retry and cluster-sync delays; everything else is kept. */
  public WorkerTiming withDelays(Duration retryDelay, Duration clusterSyncDelay) {
    return new WorkerTiming(pollInterval, retryDelay, clusterSyncDelay, initialBackoff, maxBackoff);
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  public Duration retryDelay() {
    return retryDelay;
  }

  public Duration clusterSyncDelay() {
    return clusterSyncDelay;
  }

  public Duration initialBackoff() {
    return initialBackoff;
  }

  public Duration maxBackoff() {
    return maxBackoff;
  }

  private static Duration orZero(Duration value, String field) {
    if (value == null) {
      return Duration.ZERO;
    }
    if (value.isNegative()) {
      throw new IllegalArgumentException(field + " must not be negative: " + value);
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WorkerTiming)) {
      return false;
    }
    WorkerTiming that = (WorkerTiming) o;
    return pollInterval.equals(that.pollInterval)
        && retryDelay.equals(that.retryDelay)
        && clusterSyncDelay.equals(that.clusterSyncDelay)
        && initialBackoff.equals(that.initialBackoff)
        && maxBackoff.equals(that.maxBackoff);
  }

  @Override
  public int hashCode() {
    return Objects.hash(pollInterval, retryDelay, clusterSyncDelay, initialBackoff, maxBackoff);
  }

  @Override
  public String toString() {
    return "WorkerTiming{pollInterval="
        + pollInterval
        + ", retryDelay="
        + retryDelay
        + ", clusterSyncDelay="
        + clusterSyncDelay
        + ", initialBackoff="
        + initialBackoff
        + ", maxBackoff="
        + maxBackoff
        + "}";
  }

  public static final class Builder {
    private Duration pollInterval;
    private Duration retryDelay;
    private Duration clusterSyncDelay;
    private Duration initialBackoff;
    private Duration maxBackoff;

    private Builder() {}

    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
      return this;
    }

    public Builder clusterSyncDelay(Duration clusterSyncDelay) {
      this.clusterSyncDelay = clusterSyncDelay;
      return this;
    }

    public Builder initialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
      return this;
    }

    public Builder maxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
      return this;
    }

    public WorkerTiming build() {
      return new WorkerTiming(
          pollInterval, retryDelay, clusterSyncDelay, initialBackoff, maxBackoff);
    }
  }
}
