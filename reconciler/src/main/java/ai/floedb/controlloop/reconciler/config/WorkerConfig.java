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

package ai.floedb.controlloop.reconciler.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import java.time.Duration;

@ConfigMapping(prefix = "controlloop.worker")
public interface WorkerConfig {
  @WithDefault("PT1S")
  Duration pollInterval();

  @WithDefault("PT10S")
  Duration retryDelay();

  @WithDefault("PT0S")
  Duration clusterSyncDelay();

  @WithDefault("PT5S")
  Duration initialBackoff();

  @WithDefault("PT1M")
  Duration maxBackoff();

  @WithDefault("PT1M")
  Duration backoffGcInterval();

  @WithDefault("true")
  boolean metricsEnabled();
}
