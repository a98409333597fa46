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
import ai.floedb.controlloop.reconciler.spi.StopSignal;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/** Periodically sweeps idle entries out of a {@link BackoffTracker} until stopped. */
public final class BackoffGarbageCollector {
  private static final Logger LOG = Logger.getLogger(BackoffGarbageCollector.class);

  public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(1);

  private BackoffGarbageCollector() {}

  public static ScheduledExecutorService start(
      String name, BackoffTracker backoff, Duration interval, StopSignal stop) {
    long everyMs = Math.max(1L, interval.toMillis());
    ScheduledExecutorService sweeper =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, name + "-backoff-gc");
              t.setDaemon(true);
              return t;
            });
    sweeper.scheduleWithFixedDelay(
        () -> sweepSafely(name, backoff), everyMs, everyMs, TimeUnit.MILLISECONDS);
    stop.onStop(sweeper::shutdownNow);
    return sweeper;
  }

  private static void sweepSafely(String name, BackoffTracker backoff) {
    try {
      backoff.gc();
    } catch (RuntimeException e) {
      LOG.warnf(e, "Backoff gc failed for worker %s", name);
    }
  }
}
