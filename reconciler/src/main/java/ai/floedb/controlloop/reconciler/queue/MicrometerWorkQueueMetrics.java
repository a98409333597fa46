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

package ai.floedb.controlloop.reconciler.queue;

import ai.floedb.controlloop.reconciler.spi.ReconciliationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntSupplier;

/** Publishes work queue metrics to Micrometer, tagged with the queue name. */
public class MicrometerWorkQueueMetrics implements WorkQueueMetrics {
  public static final String DEPTH = "controlloop.workqueue.depth";
  public static final String ADDS = "controlloop.workqueue.adds";
  public static final String QUEUE_LATENCY = "controlloop.workqueue.queue.latency";
  public static final String WORK_DURATION = "controlloop.workqueue.work.duration";
  public static final String RECONCILES = "controlloop.reconcile.outcomes";

  private static final String TAG_NAME = "name";
  private static final String TAG_STATUS = "status";

  private final String name;
  private final MeterRegistry registry;
  private final Counter adds;
  private final Timer queueLatency;
  private final Timer workDuration;
  private final Map<ReconciliationStatus, Counter> outcomes =
      new EnumMap<>(ReconciliationStatus.class);

  public MicrometerWorkQueueMetrics(String name, MeterRegistry registry) {
    this.name = Objects.requireNonNull(name, "name");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.adds =
        Counter.builder(ADDS)
            .description("Items added to the work queue")
            .tag(TAG_NAME, name)
            .register(registry);
    this.queueLatency =
        Timer.builder(QUEUE_LATENCY)
            .description("Time an item waits in the queue before processing starts")
            .tag(TAG_NAME, name)
            .register(registry);
    this.workDuration =
        Timer.builder(WORK_DURATION)
            .description("Time spent processing an item")
            .tag(TAG_NAME, name)
            .register(registry);
    for (ReconciliationStatus status : ReconciliationStatus.values()) {
      outcomes.put(
          status,
          Counter.builder(RECONCILES)
              .description("Reconcile calls by outcome")
              .tag(TAG_NAME, name)
              .tag(TAG_STATUS, status.name().toLowerCase(Locale.ROOT))
              .register(registry));
    }
  }

  @Override
  public void bindDepth(IntSupplier depth) {
    Gauge.builder(DEPTH, depth, IntSupplier::getAsInt)
        .description("Items waiting in the work queue")
        .tag(TAG_NAME, name)
        .strongReference(true)
        .register(registry);
  }

  @Override
  public void added() {
    adds.increment();
  }

  @Override
  public void started(Duration queuedFor) {
    queueLatency.record(queuedFor);
  }

  @Override
  public void finished(Duration workedFor) {
    workDuration.record(workedFor);
  }

  @Override
  public void reconciled(ReconciliationStatus status) {
    outcomes.get(status).increment();
  }
}
