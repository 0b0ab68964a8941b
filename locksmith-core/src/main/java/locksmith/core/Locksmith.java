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

import locksmith.api.LockStateException;
import locksmith.api.Resourceful;
import locksmith.api.lock.Backoff;
import locksmith.api.lock.ExclusiveLock;
import locksmith.api.lock.ReadWriteLock;
import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.errorprone.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Creates named primitives and owns their lifecycle.
 *
 * <p>Every primitive created here is registered under its type and name and is closed by {@link
 * #close()}. The registry itself is a {@link GuardedResource}, so it is safe to share one {@code
 * Locksmith} between all threads of an application.
 *
 * <pre>{@code
 * try (Locksmith locksmith = Locksmith.builder().backoff(Backoff.ofMillis(1, 20)).build()) {
 *   ExclusiveLock lock = locksmith.getLock("accounts");
 *   ...
 * }
 * }</pre>
 */
@ThreadSafe
public class Locksmith implements AutoCloseable {

  private final Logger log = LoggerFactory.getLogger(Locksmith.class);

  private final Backoff backoff;
  private final boolean fair;

  private final GuardedResource<Table<Class<? extends Resourceful>, String, Resourceful>>
      resources;

  public Locksmith() {
    this(builder());
  }

  private Locksmith(Builder builder) {
    this.backoff = builder.backoff;
    this.fair = builder.fair;
    this.resources =
        GuardedResource.of(HashBasedTable.create(), table -> HashBasedTable.create(table));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @throws IllegalArgumentException if a lock with this name exists
   */
  public ExclusiveLock newLock(String name) {
    return register(ExclusiveLock.class, name, () -> new DefaultExclusiveLock(name, backoff));
  }

  /** Returns the lock with this name, creating it on first use. */
  public ExclusiveLock getLock(String name) {
    return getOrRegister(ExclusiveLock.class, name, () -> new DefaultExclusiveLock(name, backoff));
  }

  /**
   * @throws IllegalArgumentException if a read-write lock with this name exists
   */
  public ReadWriteLock newReadWriteLock(String name) {
    return register(
        ReadWriteLock.class, name, () -> new DefaultReadWriteLock(name, backoff, fair));
  }

  /** Returns the read-write lock with this name, creating it on first use. */
  public ReadWriteLock getReadWriteLock(String name) {
    return getOrRegister(
        ReadWriteLock.class, name, () -> new DefaultReadWriteLock(name, backoff, fair));
  }

  /**
   * @throws IllegalArgumentException if a resource with this name exists
   */
  public <T> GuardedResource<T> newResource(String name, T initial, UnaryOperator<T> copier) {
    return register(
        GuardedResource.class,
        name,
        () -> new GuardedResource<>(initial, copier, new DefaultExclusiveLock(name, backoff)));
  }

  /**
   * @throws IllegalArgumentException if a cache with this name exists
   */
  public <K, V> GuardedCache<K, V> newCache(String name, UnaryOperator<V> copier) {
    return register(
        GuardedCache.class,
        name,
        () -> new GuardedCache<K, V>(new DefaultReadWriteLock(name, backoff, fair), copier));
  }

  private <R extends Resourceful> R register(
      Class<? extends Resourceful> type, String name, Supplier<R> factory) {
    checkName(name);
    return resources.withExclusive(
        table -> {
          Preconditions.checkArgument(
              !table.contains(type, name),
              "%s named '%s' already exists",
              type.getSimpleName(),
              name);
          R created = factory.get();
          table.put(type, name, created);
          return created;
        });
  }

  @SuppressWarnings("unchecked")
  private <R extends Resourceful> R getOrRegister(
      Class<? extends Resourceful> type, String name, Supplier<R> factory) {
    checkName(name);
    return resources.withExclusive(
        table -> {
          R existing = (R) table.get(type, name);
          if (existing != null && !existing.isClosed()) {
            return existing;
          }
          R created = factory.get();
          table.put(type, name, created);
          return created;
        });
  }

  private static void checkName(String name) {
    Objects.requireNonNull(name, "name");
    Preconditions.checkArgument(!name.isBlank(), "name must not be blank");
  }

  /**
   * @return the number of registered primitives
   */
  public int size() {
    return resources.withExclusive(Table::size);
  }

  /**
   * Closes every registered primitive. Primitives that are still held are skipped, logged, and
   * reported together once all others were closed.
   *
   * @throws LockStateException if any primitive was still held
   */
  @Override
  public void close() {
    List<Resourceful> registered =
        resources.withExclusive(
            table -> {
              List<Resourceful> all = ImmutableList.copyOf(table.values());
              table.clear();
              return all;
            });

    List<RuntimeException> failures = new ArrayList<>();
    for (Resourceful resourceful : registered) {
      try {
        resourceful.close();
      } catch (RuntimeException e) {
        log.warn("Primitive {} is still in use at teardown", resourceful.getResourceId(), e);
        failures.add(e);
      }
    }
    if (!failures.isEmpty()) {
      LockStateException failure =
          new LockStateException(failures.size() + " primitive(s) were still in use at teardown");
      failures.forEach(failure::addSuppressed);
      throw failure;
    }
  }

  /** Configuration of a {@link Locksmith}. */
  public static final class Builder {

    private Backoff backoff = Backoff.DEFAULT;
    private boolean fair = false;

    private Builder() {}

    /** The polling schedule of timed acquisitions. */
    public Builder backoff(Backoff backoff) {
      this.backoff = Objects.requireNonNull(backoff, "backoff");
      return this;
    }

    /**
     * Whether read-write locks hand their internal state lock to the longest waiting thread. Does
     * not change the writer-preference policy.
     */
    public Builder fair(boolean fair) {
      this.fair = fair;
      return this;
    }

    public Locksmith build() {
      return new Locksmith(this);
    }
  }
}
