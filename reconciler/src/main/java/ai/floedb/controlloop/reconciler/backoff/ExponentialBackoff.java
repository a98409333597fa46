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

package ai.floedb.controlloop.reconciler.backoff;

import ai.floedb.controlloop.reconciler.spi.BackoffTracker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/**
 * Doubling backoff per key, bounded by {@code maxBackoff}.
 *
 * <p>The first failure of a key starts at {@code initialBackoff}, capped like every later step. An entry idle for more than
 * twice {@code maxBackoff} is treated as fresh on the next failure and is removed by {@link #gc()}.
 */
public class ExponentialBackoff implements BackoffTracker {
  private static final Logger LOG = Logger.getLogger(ExponentialBackoff.class);

  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final Clock clock;
  private final Map<String, Entry> entries = new ConcurrentHashMap<>();

  public ExponentialBackoff(Duration initialBackoff, Duration maxBackoff) {
    this(initialBackoff, maxBackoff, Clock.systemUTC());
  }

  public ExponentialBackoff(Duration initialBackoff, Duration maxBackoff, Clock clock) {
    this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
    this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("backoff bounds must not be negative");
    }
  }

  @Override
  public void next(String key, Instant now) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(now, "now");
    entries.compute(
        key,
        (k, entry) -> {
          if (entry == null || hasExpired(now, entry.lastUpdate)) {
            return new Entry(capped(initialBackoff), now);
          }
          return new Entry(capped(entry.backoff.multipliedBy(2)), now);
        });
  }

  @Override
  public Duration get(String key) {
    Entry entry = entries.get(key);
    return entry == null ? Duration.ZERO : entry.backoff;
  }

  @Override
  public void reset(String key) {
    entries.remove(key);
  }

  @Override
  public boolean isInBackOffSince(String key, Instant eventTime) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return false;
    }
    if (hasExpired(eventTime, entry.lastUpdate)) {
      return false;
    }
    return Duration.between(eventTime, clock.instant()).compareTo(entry.backoff) < 0;
  }

  @Override
  public void gc() {
    Instant now = clock.instant();
    int before = entries.size();
    entries.entrySet().removeIf(e -> hasExpired(now, e.getValue().lastUpdate));
    int removed = before - entries.size();
    if (removed > 0) {
      LOG.debugf("Backoff gc removed %d idle entries", removed);
    }
  }

  int size() {
    return entries.size();
  }

  private Duration capped(Duration backoff) {
    return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
  }

  private boolean hasExpired(Instant eventTime, Instant lastUpdate) {
    return Duration.between(lastUpdate, eventTime).compareTo(maxBackoff.multipliedBy(2)) > 0;
  }

  private static final class Entry {
    final Duration backoff;
    final Instant lastUpdate;

    Entry(Duration backoff, Instant lastUpdate) {
      this.backoff = backoff;
      this.lastUpdate = lastUpdate;
    }
  }
}
