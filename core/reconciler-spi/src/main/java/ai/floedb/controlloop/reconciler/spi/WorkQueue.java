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

import java.util.Optional;

/**
 * Deduplicating FIFO of work items.
 *
 * <p>An item is held at most once: adding an item that is already queued is a no-op, and adding
 * an item that is being processed marks it dirty so it is queued again when {@link #done} is
 * called for it.
 */
public interface WorkQueue<T> {

  void add(T item);

  /**
   * Blocks until an item is available. Returns empty once the queue is shut down and drained.
   * Every item returned must be passed to {@link #done} exactly once.
   */
  Optional<T> get() throws InterruptedException;

  void done(T item);

  /** Number of items waiting to be processed. */
  int len();

  /** Refuses further adds and wakes every waiting {@link #get()}. */
  void shutDown();

  boolean isShuttingDown();
}
