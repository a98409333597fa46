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

package ai.floedb.controlloop.reconciler.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import ai.floedb.controlloop.reconciler.backoff.ExponentialBackoff;
import ai.floedb.controlloop.reconciler.delivery.HeapDelayingDeliverer;
import ai.floedb.controlloop.reconciler.queue.DedupingWorkQueue;
import ai.floedb.controlloop.reconciler.queue.WorkQueueMetrics;
import ai.floedb.controlloop.reconciler.spi.QualifiedName;
import ai.floedb.controlloop.reconciler.spi.ReconcileFunction;
import ai.floedb.controlloop.reconciler.spi.ReconciliationStatus;
import ai.floedb.controlloop.reconciler.spi.StopSignal;
import ai.floedb.controlloop.reconciler.spi.WorkerTiming;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AsyncReconcileWorkerSchedulingTest {
  private static final QualifiedName KEY = QualifiedName.of("ns", "a");
  private static final Duration QUIET = Duration.ofMillis(200);

  private static final WorkerTiming FAST =
      WorkerTiming.builder()
          .pollInterval(Duration.ofMillis(10))
          .retryDelay(Duration.ofMillis(20))
          .initialBackoff(Duration.ofMillis(20))
          .maxBackoff(Duration.ofMillis(100))
          .build();

  private StopSignal stop;
  private List<QualifiedName> calls;
  private List<Long> callNanos;

  @BeforeEach
  void setUp() {
    stop = StopSignal.create();
    calls = new CopyOnWriteArrayList<>();
    callNanos = new CopyOnWriteArrayList<>();
  }

  @AfterEach
  void tearDown() {
    stop.stop();
  }

  @Test
  void enqueuedKeyIsReconciledExactlyOnce() throws Exception {
    AsyncReconcileWorker worker = new AsyncReconcileWorker("once", recording(List.of()), FAST);
    worker.run(stop);

    worker.enqueue(KEY);

    await().atMost(Duration.ofSeconds(5)).until(() -> calls.size() == 1);
    Thread.sleep(QUIET.toMillis());
    assertThat(calls).containsExactly(KEY);
  }

  @Test
  void concurrentPendingEnqueuesCollapse() throws Exception {
    AsyncReconcileWorker worker = new AsyncReconcileWorker("collapse", recording(List.of()), FAST);

    ExecutorService callers = Executors.newFixedThreadPool(8);
    CountDownLatch go = new CountDownLatch(1);
    try {
      for (int i = 0; i < 100; i++) {
        callers.submit(
            () -> {
              go.await();
              worker.enqueue(KEY);
              return null;
            });
      }
      go.countDown();
      callers.shutdown();
      assertThat(callers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    } finally {
      callers.shutdownNow();
    }

    worker.run(stop);

    await().atMost(Duration.ofSeconds(5)).until(() -> calls.size() >= 1);
    Thread.sleep(QUIET.toMillis());
    assertThat(calls).containsExactly(KEY);
  }

  @Test
  void enqueueDuringReconcileIsRedeliveredOnceAfterwards() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger invocations = new AtomicInteger();
    ReconcileFunction blockingFirst =
        qn -> {
          if (invocations.incrementAndGet() == 1) {
            entered.countDown();
            try {
              release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          }
          return ReconciliationStatus.ALL_OK;
        };
    HeapDelayingDeliverer deliverer = new HeapDelayingDeliverer("inflight");
    DedupingWorkQueue<QualifiedName> queue = new DedupingWorkQueue<>("inflight");
    AsyncReconcileWorker worker =
        new AsyncReconcileWorker(
            "inflight",
            blockingFirst,
            FAST,
            deliverer,
            queue,
            new ExponentialBackoff(FAST.initialBackoff(), FAST.maxBackoff()),
            WorkQueueMetrics.noop(),
            Clock.systemUTC(),
            Duration.ofMinutes(1));
    worker.run(stop);

    worker.enqueue(KEY);
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    for (int i = 0; i < 10; i++) {
      worker.enqueue(KEY);
    }
    await().atMost(Duration.ofSeconds(5)).until(() -> deliverer.pending() == 0);
    assertThat(queue.len()).as("in-flight key is held back").isZero();

    release.countDown();

    await().atMost(Duration.ofSeconds(5)).until(() -> invocations.get() == 2);
    Thread.sleep(QUIET.toMillis());
    assertThat(invocations).hasValue(2);
  }

  @Test
  void errorsBackOffThenSucceed() throws Exception {
    AsyncReconcileWorker worker =
        new AsyncReconcileWorker(
            "backoff",
            recording(List.of(ReconciliationStatus.ERROR, ReconciliationStatus.ERROR)),
            FAST);
    worker.run(stop);

    worker.enqueue(KEY);

    await().atMost(Duration.ofSeconds(5)).until(() -> calls.size() == 3);
    Thread.sleep(QUIET.toMillis());
    assertThat(calls).hasSize(3);

    long firstToThird = callNanos.get(2) - callNanos.get(0);
    assertThat(firstToThird).isGreaterThanOrEqualTo(Duration.ofMillis(20 + 40).toNanos());
    long firstToSecond = callNanos.get(1) - callNanos.get(0);
    long secondToThird = callNanos.get(2) - callNanos.get(1);
    assertThat(firstToSecond).isGreaterThanOrEqualTo(Duration.ofMillis(20).toNanos());
    assertThat(secondToThird).isGreaterThanOrEqualTo(Duration.ofMillis(40).toNanos());
  }

  @Test
  void needsRecheckWaitsForRetryDelay() throws Exception {
    AsyncReconcileWorker worker =
        new AsyncReconcileWorker(
            "recheck", recording(List.of(ReconciliationStatus.NEEDS_RECHECK)), FAST);
    worker.run(stop);

    worker.enqueue(KEY);

    await().atMost(Duration.ofSeconds(5)).until(() -> calls.size() == 2);
    assertThat(callNanos.get(1) - callNanos.get(0))
        .isGreaterThanOrEqualTo(Duration.ofMillis(20).toNanos());
  }

  @Test
  void immediateEnqueueSupersedesPendingRetry() throws Exception {
    AsyncReconcileWorker worker =
        new AsyncReconcileWorker(
            "supersede",
            recording(List.of()),
            WorkerTiming.builder()
                .pollInterval(Duration.ofMillis(10))
                .retryDelay(Duration.ofHours(1))
                .build());
    worker.run(stop);

    worker.enqueueForRetry(KEY);
    worker.enqueue(KEY);

    await().atMost(Duration.ofSeconds(5)).until(() -> calls.size() == 1);
  }

  @Test
  void enqueueBeforeRunIsDeliveredOnceRunning() throws Exception {
    AsyncReconcileWorker worker = new AsyncReconcileWorker("early", recording(List.of()), FAST);
    worker.enqueue(KEY);
    Thread.sleep(50);
    assertThat(calls).isEmpty();

    worker.run(stop);

    await().atMost(Duration.ofSeconds(5)).until(() -> calls.size() == 1);
  }

  @Test
  void stopEndsLoopAndIgnoresLaterEnqueues() throws Exception {
    AsyncReconcileWorker worker = new AsyncReconcileWorker("stop", recording(List.of()), FAST);
    worker.run(stop);
    worker.enqueue(KEY);
    await().atMost(Duration.ofSeconds(5)).until(() -> calls.size() == 1);

    stop.stop();

    assertThat(worker.awaitTermination(Duration.ofSeconds(1))).isTrue();
    worker.enqueue(KEY);
    worker.enqueueForError(KEY);
    worker.enqueueWithDelay(QualifiedName.of("ns", "b"), Duration.ZERO);
    Thread.sleep(QUIET.toMillis());
    assertThat(calls).hasSize(1);
  }

  /** Returns the given statuses in order, then ALL_OK forever. */
  @Test
  void errorThrownByReconcileKeepsWorkerRunning() {
    QualifiedName boom = QualifiedName.of("ns", "boom");
    QualifiedName ok = QualifiedName.of("ns", "ok");
    AsyncReconcileWorker worker =
        new AsyncReconcileWorker(
            "erroring",
            qn -> {
              calls.add(qn);
              if (qn.equals(boom)) {
                throw new AssertionError("boom");
              }
              return ReconciliationStatus.ALL_OK;
            },
            FAST);
    worker.run(stop);

    worker.enqueue(boom);
    await().atMost(Duration.ofSeconds(5)).until(() -> calls.contains(boom));
    worker.enqueue(ok);

    await().atMost(Duration.ofSeconds(5)).until(() -> calls.contains(ok));
    await("failed key is retried with backoff")
        .atMost(Duration.ofSeconds(5))
        .until(() -> calls.stream().filter(boom::equals).count() >= 2);
  }

  private ReconcileFunction recording(List<ReconciliationStatus> script) {
    AtomicInteger idx = new AtomicInteger();
    return qn -> {
      callNanos.add(System.nanoTime());
      calls.add(qn);
      int i = idx.getAndIncrement();
      return i < script.size() ? script.get(i) : ReconciliationStatus.ALL_OK;
    };
  }
}
