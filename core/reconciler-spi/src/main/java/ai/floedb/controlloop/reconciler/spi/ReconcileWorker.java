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

/**
 * Schedules reconciliation of keys: deduplicates pending work, retries failures with backoff and
 * delays rechecks.
 *
 * <p>Every enqueue method is non-blocking and safe to call from any thread at any time after
 * construction. Work enqueued before {@link #run} is delivered once the worker runs; work enqueued
 * after the stop signal fired is dropped.
 */
public interface ReconcileWorker {

  /** Schedules the key right away and clears its backoff. */
  void enqueue(QualifiedName qualifiedName);

  /** Schedules the key after its cluster-sync delay. */
  void enqueueForClusterSync(QualifiedName qualifiedName);

  /** Grows the key's backoff and schedules it after the new backoff delay. */
  void enqueueForError(QualifiedName qualifiedName);

  /** Schedules the key after the fixed retry delay. */
  void enqueueForRetry(QualifiedName qualifiedName);

  void enqueueObject(NamedObject obj);

  void enqueueWithDelay(QualifiedName qualifiedName, Duration delay);

  /** Starts the background threads. Returns immediately; they run until {@code stop} fires. */
  void run(StopSignal stop);

  void setDelay(Duration retryDelay, Duration clusterSyncDelay);

  /**
   * Waits for the processing loop to exit after the stop signal fired.
   *
   * @return {@code true} if the loop exited within {@code timeout}
   */
  boolean awaitTermination(Duration timeout) throws InterruptedException;
}
