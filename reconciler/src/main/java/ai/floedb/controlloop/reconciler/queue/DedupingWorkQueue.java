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

import ai.floedb.controlloop.reconciler.spi.WorkQueue;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/**
 * {@link WorkQueue} that keeps each item at most once across the waiting and in-flight sets.
 *
 * <p>{@code dirty} holds every item that needs processing, {@code processing} every item handed out
 * by {@link #get()} and not yet {@link #done}. An item that is dirty and processing at the same
 * time is queued again by {@link #done}.
 */
public class DedupingWorkQueue<T> implements WorkQueue<T> {
  private static final Logger LOG = Logger.getLogger(DedupingWorkQueue.class);

  private final String name;
  private final WorkQueueMetrics metrics;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition available = lock.newCondition();
  private final Deque<T> queue = new ArrayDeque<>();
  private final Set<T> dirty = new HashSet<>();
  private final Set<T> processing = new HashSet<>();
  private final Map<T, Long> addedAtNanos = new HashMap<>();
  private final Map<T, Long> startedAtNanos = new HashMap<>();
  private boolean shuttingDown;

  public DedupingWorkQueue(String name) {
    this(name, WorkQueueMetrics.noop());
  }

  public DedupingWorkQueue(String name, WorkQueueMetrics metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    metrics.bindDepth(this::len);
  }

  public String name() {
    return name;
  }

  @Override
  public void add(T item) {
    Objects.requireNonNull(item, "item");
    lock.lock();
    try {
      if (shuttingDown) {
        LOG.debugf("Queue %s shutting down, ignoring %s", name, item);
        return;
      }
      if (!dirty.add(item)) {
        return;
      }
      metrics.added();
      addedAtNanos.putIfAbsent(item, System.nanoTime());
      if (processing.contains(item)) {
        return;
      }
      queue.addLast(item);
      available.signal();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<T> get() throws InterruptedException {
    lock.lock();
    try {
      while (queue.isEmpty() && !shuttingDown) {
        available.await();
      }
      if (queue.isEmpty()) {
        return Optional.empty();
      }
      T item = queue.pollFirst();
      processing.add(item);
      dirty.remove(item);
      long now = System.nanoTime();
      Long addedAt = addedAtNanos.remove(item);
      if (addedAt != null) {
        metrics.started(Duration.ofNanos(now - addedAt));
      }
      startedAtNanos.put(item, now);
      return Optional.of(item);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void done(T item) {
    Objects.requireNonNull(item, "item");
    lock.lock();
    try {
      if (!processing.remove(item)) {
        LOG.debugf("Queue %s: done called for %s which is not in flight", name, item);
        return;
      }
      Long startedAt = startedAtNanos.remove(item);
      if (startedAt != null) {
        metrics.finished(Duration.ofNanos(System.nanoTime() - startedAt));
      }
      if (dirty.contains(item)) {
        queue.addLast(item);
        available.signal();
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int len() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void shutDown() {
    lock.lock();
    try {
      if (shuttingDown) {
        return;
      }
      shuttingDown = true;
      available.signalAll();
    } finally {
      lock.unlock();
    }
    LOG.debugf("Queue %s shut down", name);
  }

  @Override
  public boolean isShuttingDown() {
    lock.lock();
    try {
      return shuttingDown;
    } finally {
      lock.unlock();
    }
  }
}
