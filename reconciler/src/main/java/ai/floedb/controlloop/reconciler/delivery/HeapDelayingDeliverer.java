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

package ai.floedb.controlloop.reconciler.delivery;

import ai.floedb.controlloop.reconciler.spi.DelayedDeliverer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/**
 * {@link DelayedDeliverer} backed by a min-heap of fire times and a single timer thread.
 *
 * <p>Fire times are tracked on {@link System#nanoTime()}; the clock is only used to turn absolute
 * instants into delays.
 */
public class HeapDelayingDeliverer implements DelayedDeliverer {
  private static final Logger LOG = Logger.getLogger(HeapDelayingDeliverer.class);

  private enum State {
    NEW,
    RUNNING,
    STOPPED
  }

  private final String name;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final PriorityQueue<Item> heap =
      new PriorityQueue<>(
          Comparator.comparingLong((Item i) -> i.fireAtNanos).thenComparingLong(i -> i.seq));
  private final Map<String, Item> byKey = new HashMap<>();

  private State state = State.NEW;
  private long seq;
  private Consumer<Object> handler;
  private Thread timer;

  public HeapDelayingDeliverer(String name) {
    this(name, Clock.systemUTC());
  }

  public HeapDelayingDeliverer(String name, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void start(Consumer<Object> handler) {
    Objects.requireNonNull(handler, "handler");
    lock.lock();
    try {
      if (state != State.NEW) {
        throw new IllegalStateException("Deliverer " + name + " already " + state);
      }
      this.handler = handler;
      state = State.RUNNING;
      timer = new Thread(this::loop, name + "-deliverer");
      timer.setDaemon(true);
      timer.start();
    } finally {
      lock.unlock();
    }
    LOG.debugf("Deliverer %s started", name);
  }

  @Override
  public void deliverAfter(String key, Object payload, Duration delay) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(delay, "delay");
    long delayNanos = delay.isNegative() ? 0L : saturatedNanos(delay);
    arm(key, payload, System.nanoTime() + delayNanos);
  }

  @Override
  public void deliverAt(String key, Object payload, Instant deliverAt) {
    Objects.requireNonNull(deliverAt, "deliverAt");
    deliverAfter(key, payload, Duration.between(clock.instant(), deliverAt));
  }

  @Override
  public int pending() {
    lock.lock();
    try {
      return heap.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void stop() {
    lock.lock();
    try {
      if (state == State.STOPPED) {
        return;
      }
      state = State.STOPPED;
      heap.clear();
      byKey.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    LOG.debugf("Deliverer %s stopped", name);
  }

  private void arm(String key, Object payload, long fireAtNanos) {
    lock.lock();
    try {
      if (state == State.STOPPED) {
        LOG.debugf("Deliverer %s stopped, dropping delivery for %s", name, key);
        return;
      }
      Item previous = byKey.remove(key);
      if (previous != null) {
        heap.remove(previous);
      }
      Item item = new Item(key, payload, fireAtNanos, seq++);
      byKey.put(key, item);
      heap.add(item);
      if (heap.peek() == item) {
        changed.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  private void loop() {
    while (true) {
      List<Item> due;
      try {
        due = awaitDue();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOG.debugf("Deliverer %s interrupted", name);
        return;
      }
      if (due == null) {
        return;
      }
      for (Item item : due) {
        try {
          handler.accept(item.payload);
        } catch (RuntimeException | Error e) {
          LOG.warnf(e, "Deliverer %s handler failed for %s", name, item.key);
        }
      }
    }
  }

  /** Blocks until at least one item is due. Returns {@code null} once stopped. */
  private List<Item> awaitDue() throws InterruptedException {
    lock.lock();
    try {
      while (true) {
        if (state != State.RUNNING) {
          return null;
        }
        Item head = heap.peek();
        if (head == null) {
          changed.await();
          continue;
        }
        long waitNanos = head.fireAtNanos - System.nanoTime();
        if (waitNanos > 0) {
          changed.awaitNanos(waitNanos);
          continue;
        }
        List<Item> due = new ArrayList<>();
        long now = System.nanoTime();
        while (!heap.isEmpty() && heap.peek().fireAtNanos - now <= 0) {
          Item item = heap.poll();
          byKey.remove(item.key);
          due.add(item);
        }
        return due;
      }
    } finally {
      lock.unlock();
    }
  }

  private static long saturatedNanos(Duration delay) {
    try {
      return delay.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE / 2;
    }
  }

  private static final class Item {
    final String key;
    final Object payload;
    final long fireAtNanos;
    final long seq;

    Item(String key, Object payload, long fireAtNanos, long seq) {
      this.key = key;
      this.payload = payload;
      this.fireAtNanos = fireAtNanos;
      this.seq = seq;
    }
  }
}
