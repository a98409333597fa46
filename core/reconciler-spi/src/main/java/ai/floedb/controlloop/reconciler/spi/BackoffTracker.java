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

/** Per-key exponential backoff. Implementations are safe for concurrent use. */
public interface BackoffTracker {

  /** Records a failure for {@code key} observed at {@code now} and grows its delay. */
  void next(String key, Instant now);

  /** Current delay for {@code key}, {@link Duration#ZERO} when the key has no entry. */
  Duration get(String key);

  void reset(String key);

  /** Whether {@code eventTime} falls inside the backoff window opened by the last failure. */
  boolean isInBackOffSince(String key, Instant eventTime);

  /** Drops entries that have been idle long enough to be considered healthy again. */
  void gc();
}
