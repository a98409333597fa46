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

import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import ai.floedb.controlloop.reconciler.spi.BackoffTracker;
import ai.floedb.controlloop.reconciler.spi.StopSignal;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.Test;

class BackoffGarbageCollectorTest {

  @Test
  void sweepsPeriodicallyUntilStopped() {
    BackoffTracker backoff = mock(BackoffTracker.class);
    StopSignal stop = StopSignal.create();

    ScheduledExecutorService sweeper =
        BackoffGarbageCollector.start("test", backoff, Duration.ofMillis(5), stop);

    await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(backoff, atLeast(2)).gc());

    stop.stop();
    await().atMost(Duration.ofSeconds(5)).until(sweeper::isTerminated);
  }

  @Test
  void failingSweepDoesNotCancelSchedule() {
    BackoffTracker backoff = mock(BackoffTracker.class);
    doThrow(new IllegalStateException("boom")).when(backoff).gc();
    StopSignal stop = StopSignal.create();

    BackoffGarbageCollector.start("test", backoff, Duration.ofMillis(5), stop);
    try {
      await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(backoff, atLeast(3)).gc());
    } finally {
      stop.stop();
    }
  }
}
