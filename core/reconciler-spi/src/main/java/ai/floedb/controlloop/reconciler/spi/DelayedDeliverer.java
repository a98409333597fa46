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
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Hands a payload to a handler once its delay has elapsed.
 *
 * <p>At most one delivery is pending per key. Arming a key that is already pending replaces its
 * fire time and payload. Deliveries armed before {@link #start} are kept and fire once started;
 * deliveries armed after {@link #stop} are dropped. Implementations are safe for concurrent use.
 */
public interface DelayedDeliverer {

  /**
   * Starts delivering to {@code handler}. The handler runs on the deliverer's own thread and must
   * not block.
   */
  void start(Consumer<Object> handler);

  void deliverAfter(String key, Object payload, Duration delay);

  void deliverAt(String key, Object payload, Instant deliverAt);

  /** Number of armed deliveries that have not fired yet. */
  int pending();

  /** Stops the timer. Idempotent. */
  void stop();
}
