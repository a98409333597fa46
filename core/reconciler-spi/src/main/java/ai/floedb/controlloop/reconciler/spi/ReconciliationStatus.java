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

/** Outcome of a single reconcile call; decides how the key is scheduled next. */
public enum ReconciliationStatus {
  /** Observed state matches desired state. Nothing else is scheduled. */
  ALL_OK,
  /** Reconciliation failed. The key is retried with growing backoff. */
  ERROR,
  /** The key should be looked at again after the fixed retry delay. */
  NEEDS_RECHECK,
  /** The wider system is not synced yet. The key is retried after the cluster-sync delay. */
  NOT_SYNCED
}
