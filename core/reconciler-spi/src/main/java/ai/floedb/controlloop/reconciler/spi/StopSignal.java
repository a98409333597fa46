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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * One-shot cooperative cancellation shared by a worker and its background tasks.
 *
 * <p>Callbacks run once, on the thread that calls {@link #stop()}. A callback registered after the
 * signal fired runs immediately on the registering thread.
 */
public final class StopSignal {
  private static final Logger LOG = Logger.getLogger(StopSignal.class);

  private final CountDownLatch latch = new CountDownLatch(1);
  private final List<Runnable> callbacks = new ArrayList<>();
  private boolean stopped;

  public static StopSignal create() {
    return new StopSignal();
  }

  public void onStop(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    synchronized (callbacks) {
      if (!stopped) {
        callbacks.add(callback);
        return;
      }
    }
    runSafely(callback);
  }

  /** Fires the signal. Later calls are no-ops. */
  public void stop() {
    List<Runnable> toRun;
    synchronized (callbacks) {
      if (stopped) {
        return;
      }
      stopped = true;
      toRun = List.copyOf(callbacks);
      callbacks.clear();
    }
    latch.countDown();
    for (Runnable callback : toRun) {
      runSafely(callback);
    }
  }

  public boolean isStopped() {
    return latch.getCount() == 0;
  }

  /**
   * Waits up to {@code timeout} for the signal.
   *
   * @return {@code true} if the signal fired
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  private static void runSafely(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOG.warnf(e, "Stop callback failed");
    }
  }
}
