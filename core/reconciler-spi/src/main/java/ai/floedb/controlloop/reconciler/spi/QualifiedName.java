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

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one unit of reconcilable work by namespace and name.
 *
 * <p>The canonical string form ({@code namespace/name}, or just {@code name} for cluster-scoped
 * resources) is the key under which backoff and pending deliveries are tracked, so it must stay
 * stable and collision-free. Neither part may contain {@value #SEPARATOR}.
 */
public final class QualifiedName implements Comparable<QualifiedName> {
  public static final String SEPARATOR = "/";

  private static final Comparator<QualifiedName> ORDER =
      Comparator.comparing(QualifiedName::namespace).thenComparing(QualifiedName::name);

  private final String namespace;
  private final String name;

  private QualifiedName(String namespace, String name) {
    this.namespace = namespace;
    this.name = name;
  }

  public static QualifiedName of(String namespace, String name) {
    String ns = namespace == null ? "" : namespace.trim();
    Objects.requireNonNull(name, "name");
    String n = name.trim();
    if (n.isEmpty()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (ns.contains(SEPARATOR) || n.contains(SEPARATOR)) {
      throw new IllegalArgumentException(
          "namespace and name must not contain '" + SEPARATOR + "': " + ns + ", " + n);
    }
    return new QualifiedName(ns, n);
  }

  public static QualifiedName clusterScoped(String name) {
    return of("", name);
  }

  public static QualifiedName of(NamedObject obj) {
    Objects.requireNonNull(obj, "obj");
    return of(obj.namespace(), obj.name());
  }

  /** Inverse of {@link #toString()}. */
  public static QualifiedName parse(String value) {
    Objects.requireNonNull(value, "value");
    int idx = value.indexOf(SEPARATOR);
    if (idx < 0) {
      return clusterScoped(value);
    }
    return of(value.substring(0, idx), value.substring(idx + 1));
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  public boolean isClusterScoped() {
    return namespace.isEmpty();
  }

  @Override
  public int compareTo(QualifiedName other) {
    return ORDER.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QualifiedName)) {
      return false;
    }
    QualifiedName that = (QualifiedName) o;
    return namespace.equals(that.namespace) && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, name);
  }

  @Override
  public String toString() {
    return namespace.isEmpty() ? name : namespace + SEPARATOR + name;
  }
}
