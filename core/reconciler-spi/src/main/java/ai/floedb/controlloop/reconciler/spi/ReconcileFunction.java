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

/**
 * Brings the entity identified by a key to its desired state.
 *
 * <p>Implementations must be idempotent: the worker deduplicates pending scheduling, not effects,
 * so the same key may be reconciled many times.
 */
@FunctionalInterface
public interface ReconcileFunction {
  ReconciliationStatus reconcile(QualifiedName qualifiedName);
}
