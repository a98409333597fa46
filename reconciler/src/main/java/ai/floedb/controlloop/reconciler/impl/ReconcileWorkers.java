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

import ai.floedb.controlloop.reconciler.config.WorkerConfig;
import ai.floedb.controlloop.reconciler.queue.MicrometerWorkQueueMetrics;
import ai.floedb.controlloop.reconciler.queue.WorkQueueMetrics;
import ai.floedb.controlloop.reconciler.spi.ReconcileFunction;
import ai.floedb.controlloop.reconciler.spi.ReconcileWorker;
import ai.floedb.controlloop.reconciler.spi.StopSignal;
import ai.floedb.controlloop.reconciler.spi.WorkerTiming;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/**
 * Builds and runs named reconcile workers from {@link WorkerConfig}.
 *
 * <p>All workers share one stop signal, fired when the bean is destroyed.
 */
@ApplicationScoped
public class ReconcileWorkers {
  private static final Logger LOG = Logger.getLogger(ReconcileWorkers.class);

  @Inject WorkerConfig config;
  @Inject MeterRegistry meterRegistry;

  private final StopSignal stop = StopSignal.create();
  private final Map<String, ReconcileWorker> workers = new ConcurrentHashMap<>();

  /** Creates a worker and starts it. Names must be unique for the lifetime of the bean. */
  public ReconcileWorker start(String name, ReconcileFunction reconcile) {
    ReconcileWorker worker = create(name, reconcile);
    worker.run(stop);
    return worker;
  }

  /** Creates a worker without starting it, so callers can enqueue before {@code run}. */
  public ReconcileWorker create(String name, ReconcileFunction reconcile) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(reconcile, "reconcile");
    if (stop.isStopped()) {
      throw new IllegalStateException("Reconcile workers are shut down");
    }
    WorkQueueMetrics metrics =
        config.metricsEnabled() && meterRegistry != null
            ? new MicrometerWorkQueueMetrics(name, meterRegistry)
            : WorkQueueMetrics.noop();
    AsyncReconcileWorker worker =
        new AsyncReconcileWorker(
            name, reconcile, timingFrom(config), metrics, config.backoffGcInterval());
    if (workers.putIfAbsent(name, worker) != null) {
      throw new IllegalArgumentException("Reconcile worker " + name + " already exists");
    }
    LOG.debugf("Created reconcile worker %s", name);
    return worker;
  }

  public StopSignal stopSignal() {
    return stop;
  }

  @PreDestroy
  void close() {
    if (!workers.isEmpty()) {
      LOG.infof("Stopping %d reconcile workers", workers.size());
    }
    stop.stop();
  }

  static WorkerTiming timingFrom(WorkerConfig config) {
    return WorkerTiming.builder()
        .pollInterval(config.pollInterval())
        .retryDelay(config.retryDelay())
        .clusterSyncDelay(config.clusterSyncDelay())
        .initialBackoff(config.initialBackoff())
        .maxBackoff(config.maxBackoff())
        .build()
        .withDefaults();
  }
}
