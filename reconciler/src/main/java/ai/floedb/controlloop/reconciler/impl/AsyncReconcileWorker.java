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

import ai.floedb.controlloop.reconciler.backoff.BackoffGarbageCollector;
import ai.floedb.controlloop.reconciler.backoff.ExponentialBackoff;
import ai.floedb.controlloop.reconciler.delivery.HeapDelayingDeliverer;
import ai.floedb.controlloop.reconciler.queue.DedupingWorkQueue;
import ai.floedb.controlloop.reconciler.queue.WorkQueueMetrics;
import ai.floedb.controlloop.reconciler.spi.BackoffTracker;
import ai.floedb.controlloop.reconciler.spi.DelayedDeliverer;
import ai.floedb.controlloop.reconciler.spi.NamedObject;
import ai.floedb.controlloop.reconciler.spi.QualifiedName;
import ai.floedb.controlloop.reconciler.spi.ReconcileFunction;
import ai.floedb.controlloop.reconciler.spi.ReconcileWorker;
import ai.floedb.controlloop.reconciler.spi.ReconciliationStatus;
import ai.floedb.controlloop.reconciler.spi.StopSignal;
import ai.floedb.controlloop.reconciler.spi.WorkQueue;
import ai.floedb.controlloop.reconciler.spi.WorkerTiming;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jboss.logging.Logger;

/**
 * Default {@link ReconcileWorker}.
 *
 * <p>Every enqueue goes through the delayed deliverer, whose handler feeds the work queue; a single
 * poll thread drains the queue and reconciles one key at a time. Backoff and pending deliveries
 * are both keyed by {@link QualifiedName#toString()}.
 */
public class AsyncReconcileWorker implements ReconcileWorker {
  private static final Logger LOG = Logger.getLogger(AsyncReconcileWorker.class);

  private final String name;
  private final ReconcileFunction reconcile;
  private final DelayedDeliverer deliverer;
  private final WorkQueue<QualifiedName> queue;
  private final BackoffTracker backoff;
  private final WorkQueueMetrics metrics;
  private final Clock clock;
  private final Duration backoffGcInterval;
  private final AtomicBoolean started = new AtomicBoolean(false);

  private volatile WorkerTiming timing;
  private volatile ScheduledExecutorService poller;

  public AsyncReconcileWorker(String name, ReconcileFunction reconcile, WorkerTiming timing) {
    this(
        name,
        reconcile,
        timing,
        WorkQueueMetrics.noop(),
        BackoffGarbageCollector.DEFAULT_INTERVAL);
  }

  public AsyncReconcileWorker(
      String name,
      ReconcileFunction reconcile,
      WorkerTiming timing,
      WorkQueueMetrics metrics,
      Duration backoffGcInterval) {
    this(
        name,
        reconcile,
        Objects.requireNonNull(timing, "timing").withDefaults(),
        metrics,
        backoffGcInterval,
        Clock.systemUTC());
  }

  private AsyncReconcileWorker(
      String name,
      ReconcileFunction reconcile,
      WorkerTiming timing,
      WorkQueueMetrics metrics,
      Duration backoffGcInterval,
      Clock clock) {
    this(
        name,
        reconcile,
        timing,
        new HeapDelayingDeliverer(name, clock),
        new DedupingWorkQueue<>(name, metrics),
        new ExponentialBackoff(timing.initialBackoff(), timing.maxBackoff(), clock),
        metrics,
        clock,
        backoffGcInterval);
  }

  /** Wires explicit collaborators. The backoff bounds in {@code timing} are not re-applied. */
  public AsyncReconcileWorker(
      String name,
      ReconcileFunction reconcile,
      WorkerTiming timing,
      DelayedDeliverer deliverer,
      WorkQueue<QualifiedName> queue,
      BackoffTracker backoff,
      WorkQueueMetrics metrics,
      Clock clock,
      Duration backoffGcInterval) {
    this.name = Objects.requireNonNull(name, "name");
    this.reconcile = Objects.requireNonNull(reconcile, "reconcile");
    this.timing = Objects.requireNonNull(timing, "timing").withDefaults();
    this.deliverer = Objects.requireNonNull(deliverer, "deliverer");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.backoffGcInterval = Objects.requireNonNull(backoffGcInterval, "backoffGcInterval");
  }

  public String name() {
    return name;
  }

  public WorkerTiming timing() {
    return timing;
  }

  @Override
  public void enqueue(QualifiedName qualifiedName) {
    deliver(qualifiedName, Duration.ZERO, false);
  }

  @Override
  public void enqueueForError(QualifiedName qualifiedName) {
    deliver(qualifiedName, Duration.ZERO, true);
  }

  @Override
  public void enqueueForRetry(QualifiedName qualifiedName) {
    deliver(qualifiedName, timing.retryDelay(), false);
  }

  @Override
  public void enqueueForClusterSync(QualifiedName qualifiedName) {
    deliver(qualifiedName, timing.clusterSyncDelay(), false);
  }

  @Override
  public void enqueueObject(NamedObject obj) {
    enqueue(QualifiedName.of(obj));
  }

  @Override
  public void enqueueWithDelay(QualifiedName qualifiedName, Duration delay) {
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative: " + delay);
    }
    deliver(qualifiedName, delay, false);
  }

  @Override
  public synchronized void setDelay(Duration retryDelay, Duration clusterSyncDelay) {
    timing = timing.withDelays(retryDelay, clusterSyncDelay);
    LOG.debugf(
        "Worker %s delays updated retry=%s clusterSync=%s", name, retryDelay, clusterSyncDelay);
  }

  @Override
  public void run(StopSignal stop) {
    Objects.requireNonNull(stop, "stop");
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Worker " + name + " is already running");
    }
    WorkerTiming current = timing;
    LOG.infof("Starting reconcile worker %s %s", name, current);

    BackoffGarbageCollector.start(name, backoff, backoffGcInterval, stop);
    deliverer.start(this::onDelivery);

    ScheduledExecutorService executor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, name + "-worker");
              t.setDaemon(true);
              return t;
            });
    long everyMs = Math.max(1L, current.pollInterval().toMillis());
    executor.scheduleWithFixedDelay(this::drainSafely, 0L, everyMs, TimeUnit.MILLISECONDS);
    poller = executor;

    stop.onStop(this::shutDown);
  }

  @Override
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    ScheduledExecutorService executor = poller;
    if (executor == null) {
      return false;
    }
    return executor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  private void shutDown() {
    LOG.infof("Stopping reconcile worker %s", name);
    queue.shutDown();
    deliverer.stop();
    ScheduledExecutorService executor = poller;
    if (executor != null) {
      executor.shutdown();
    }
  }

  /**
   * Grows and applies backoff for failures and clears it for everything else, then arms the
   * delivery. Re-arming a pending key replaces its fire time.
   */
  private void deliver(QualifiedName qualifiedName, Duration delay, boolean failed) {
    Objects.requireNonNull(qualifiedName, "qualifiedName");
    String key = qualifiedName.toString();
    Duration total = delay;
    if (failed) {
      backoff.next(key, clock.instant());
      total = total.plus(backoff.get(key));
    } else {
      backoff.reset(key);
    }
    LOG.debugf("Worker %s scheduling %s in %s", name, key, total);
    deliverer.deliverAfter(key, qualifiedName, total);
  }

  // Runs on the deliverer thread; must not block.
  private void onDelivery(Object payload) {
    if (payload instanceof QualifiedName qualifiedName) {
      queue.add(qualifiedName);
      return;
    }
    LOG.debugf("Worker %s dropping unexpected delivery payload %s", name, payload);
  }

  private void drainSafely() {
    try {
      while (processNext()) {
        // keep draining until the queue shuts down
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.debugf("Worker %s interrupted", name);
    } catch (RuntimeException | Error e) {
      LOG.warnf(e, "Worker %s drain loop failed", name);
    }
  }

  boolean processNext() throws InterruptedException {
    Optional<QualifiedName> next = queue.get();
    if (next.isEmpty()) {
      return false;
    }
    QualifiedName qualifiedName = next.get();
    try {
      ReconciliationStatus status = reconcileSafely(qualifiedName);
      metrics.reconciled(status);
      switch (status) {
        case ALL_OK -> {}
        case ERROR -> enqueueForError(qualifiedName);
        case NEEDS_RECHECK -> enqueueForRetry(qualifiedName);
        case NOT_SYNCED -> enqueueForClusterSync(qualifiedName);
      }
    } finally {
      queue.done(qualifiedName);
    }
    return true;
  }

  private ReconciliationStatus reconcileSafely(QualifiedName qualifiedName) {
    ReconciliationStatus status;
    try {
      status = reconcile.reconcile(qualifiedName);
    } catch (RuntimeException | Error e) {
      LOG.warnf(e, "Worker %s failed to reconcile %s", name, qualifiedName);
      return ReconciliationStatus.ERROR;
    }
    if (status == null) {
      LOG.warnf("Worker %s: reconcile of %s returned no status", name, qualifiedName);
      return ReconciliationStatus.ERROR;
    }
    return status;
  }
}
