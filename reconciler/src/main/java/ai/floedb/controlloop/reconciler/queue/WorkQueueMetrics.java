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
import java.time.Duration;
import java.util.function.IntSupplier;

/** Instrumentation hooks for one named work queue and the worker draining it. */
public interface WorkQueueMetrics {

  /** Registers the live depth of the queue. Called once by the queue on construction. */
  void bindDepth(IntSupplier depth);

  void added();

  /** An item left the queue after waiting {@code queuedFor}. */
  void started(Duration queuedFor);

  /** Processing of an item finished after {@code workedFor}. */
  void finished(Duration workedFor);

  void reconciled(ReconciliationStatus status);

  static WorkQueueMetrics noop() {
    return NoopWorkQueueMetrics.INSTANCE;
  }

  final class NoopWorkQueueMetrics implements WorkQueueMetrics {
    private static final NoopWorkQueueMetrics INSTANCE = new NoopWorkQueueMetrics();

    private NoopWorkQueueMetrics() {}

    @Override
    public void bindDepth(IntSupplier depth) {}

    @Override
    public void added() {}

    @Override
    public void started(Duration queuedFor) {}

    @Override
    public void finished(Duration workedFor) {}

    @Override
    public void reconciled(ReconciliationStatus status) {}
  }
}
