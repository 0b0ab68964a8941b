/*
 * Copyright 2025 XueFeng Ma
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
package locksmith.core;

import locksmith.api.Resourceful;
import locksmith.api.lock.Backoff;
import locksmith.api.lock.LockSession;
import locksmith.api.lock.ReadWriteLock;
import com.google.common.annotations.Beta;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A keyed store for data that is read often and written rarely. Lookups share a {@link
 * ReadWriteLock}; mutations take it exclusively.
 *
 * <p>Values are copied on the way in and on the way out with the cache's copier, so no caller ever
 * holds a reference into the mapping. Neither keys nor values may be {@code null}.
 *
 * @param <K> the key type; keys must be immutable
 * @param <V> the value type
 */
@Beta
@ThreadSafe
public final class GuardedCache<K, V> extends Resourceful {

  private static final AtomicLong SEQUENCE = new AtomicLong();

  private final ReadWriteLock lock;
  private final UnaryOperator<V> copier;

  @GuardedBy("lock")
  private final Map<K, V> entries = new HashMap<>();

  GuardedCache(ReadWriteLock lock, UnaryOperator<V> copier) {
    this.lock = Objects.requireNonNull(lock, "lock");
    this.copier = Objects.requireNonNull(copier, "copier");
  }

  public static <K, V> GuardedCache<K, V> create(UnaryOperator<V> copier) {
    return new GuardedCache<>(
        new DefaultReadWriteLock(
            "guarded-cache-" + SEQUENCE.incrementAndGet(), Backoff.DEFAULT, false),
        copier);
  }

  /** Creates a cache of immutable values, which are handed out without copying. */
  public static <K, V> GuardedCache<K, V> createImmutable() {
    return create(UnaryOperator.identity());
  }

  @Override
  public String getResourceId() {
    return lock.getResourceId();
  }

  /**
   * @return a copy of the value mapped to {@code key}, or empty
   */
  public Optional<V> get(K key) {
    Objects.requireNonNull(key, "key");
    try (LockSession ignored = lock.acquireShared()) {
      V value = entries.get(key);
      return value == null ? Optional.empty() : Optional.of(copier.apply(value));
    }
  }

  /** Maps {@code key} to a copy of {@code value}, replacing any previous mapping. */
  public void set(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    V copy = copier.apply(value);
    try (LockSession ignored = lock.acquireExclusive()) {
      entries.put(key, copy);
    }
  }

  /**
   * Removes every entry matching {@code predicate}. The predicate runs under the exclusive lock and
   * must not retain the value it is shown.
   *
   * @return the number of entries removed
   */
  public int removeIf(BiPredicate<? super K, ? super V> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    try (LockSession ignored = lock.acquireExclusive()) {
      int removed = 0;
      for (Iterator<Map.Entry<K, V>> it = entries.entrySet().iterator(); it.hasNext(); ) {
        Map.Entry<K, V> entry = it.next();
        if (predicate.test(entry.getKey(), entry.getValue())) {
          it.remove();
          removed++;
        }
      }
      return removed;
    }
  }

  /**
   * @return the value that was mapped to {@code key}, or empty
   */
  public Optional<V> remove(K key) {
    Objects.requireNonNull(key, "key");
    try (LockSession ignored = lock.acquireExclusive()) {
      return Optional.ofNullable(entries.remove(key));
    }
  }

  /**
   * Returns a copy of the value mapped to {@code key}, loading and storing it first if absent.
   *
   * <p>The lookup runs under the shared lock. On a miss the shared lock is released, the exclusive
   * lock is acquired and the lookup is repeated, because another writer may have stored the value
   * in between. {@code loader} therefore runs at most once per missing key, under the exclusive
   * lock, and must not access this cache.
   */
  public V getOrCompute(K key, Function<? super K, ? extends V> loader) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(loader, "loader");
    try (LockSession ignored = lock.acquireShared()) {
      V value = entries.get(key);
      if (value != null) {
        return copier.apply(value);
      }
    }
    try (LockSession ignored = lock.acquireExclusive()) {
      V value = entries.get(key);
      if (value == null) {
        value = Objects.requireNonNull(loader.apply(key), "loader returned null");
        entries.put(key, value);
      }
      return copier.apply(value);
    }
  }

  public int size() {
    try (LockSession ignored = lock.acquireShared()) {
      return entries.size();
    }
  }

  /**
   * @return an immutable copy of the whole mapping, with copied values
   */
  public ImmutableMap<K, V> snapshot() {
    try (LockSession ignored = lock.acquireShared()) {
      return ImmutableMap.copyOf(Maps.transformValues(entries, copier::apply));
    }
  }

  @Override
  public void close() {
    lock.close();
    closed.set(true);
  }

  @Override
  public String toString() {
    return "GuardedCache{" + lock.getResourceId() + '}';
  }
}
