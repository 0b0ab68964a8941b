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
import locksmith.api.ReentrantAcquisitionException;
import locksmith.api.Resourceful;
import locksmith.api.guard.GuardedFunction;
import locksmith.api.lock.Backoff;
import locksmith.api.lock.ExclusiveLock;
import com.google.common.annotations.Beta;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * A value that can only be reached while its own lock is held.
 *
 * <p>The resource owns the value and one {@link ExclusiveLock}. No method hands the value out: work
 * is passed in as a callback, runs while the lock is held, and the lock is released when the
 * callback returns or throws. Reading a value out is done with {@link #snapshot()}, which returns an
 * independent copy made by the resource's copier.
 *
 * <pre>{@code
 * GuardedResource<List<String>> names = GuardedResource.of(new ArrayList<>(), ArrayList::new);
 * names.withExclusive(list -> list.add("alice"));
 * List<String> copy = names.snapshot();
 * }</pre>
 *
 * <p>A callback must not keep a reference to the value, and must not call {@code withExclusive}
 * on the same resource; the nested call fails with {@link ReentrantAcquisitionException}.
 *
 * @param <T> the guarded value type
 */
@Beta
@ThreadSafe
public final class GuardedResource<T> extends Resourceful {

  private static final AtomicLong SEQUENCE = new AtomicLong();

  private final ExclusiveLock lock;
  private final UnaryOperator<T> copier;

  @GuardedBy("lock")
  private T value;

  GuardedResource(T initial, UnaryOperator<T> copier, ExclusiveLock lock) {
    this.value = initial;
    this.copier = Objects.requireNonNull(copier, "copier");
    this.lock = Objects.requireNonNull(lock, "lock");
  }

  /**
   * Creates a resource whose snapshots are made by {@code copier}.
   *
   * @param initial the initial value; ownership passes to the resource
   * @param copier returns an independent deep-enough copy of a value
   */
  public static <T> GuardedResource<T> of(T initial, UnaryOperator<T> copier) {
    return new GuardedResource<>(
        initial,
        copier,
        new DefaultExclusiveLock("guarded-resource-" + SEQUENCE.incrementAndGet(), Backoff.DEFAULT));
  }

  /**
   * Creates a resource holding an immutable value. Snapshots return the value itself, which is only
   * safe because nobody can mutate it.
   */
  public static <T> GuardedResource<T> ofImmutable(T initial) {
    return of(initial, UnaryOperator.identity());
  }

  @Override
  public String getResourceId() {
    return lock.getResourceId();
  }

  /**
   * Runs {@code fn} against the value while holding the lock.
   *
   * @param fn the work; must not retain the value
   * @return what {@code fn} returns
   * @throws X whatever {@code fn} throws, after the lock was released
   * @throws ReentrantAcquisitionException if called from inside a callback of this resource
   * @throws LockStateException if the resource is closed
   */
  public <R, X extends Throwable> R withExclusive(GuardedFunction<? super T, ? extends R, X> fn)
      throws X {
    Objects.requireNonNull(fn, "fn");
    lock.acquire();
    try {
      return fn.apply(value);
    } finally {
      lock.release();
    }
  }

  /**
   * Runs {@code fn} only if the lock is free right now.
   *
   * @return the result of {@code fn}, or empty if the lock was busy. A {@code null} result is
   *     indistinguishable from a busy lock.
   */
  public <R, X extends Throwable> Optional<R> tryWithExclusive(
      GuardedFunction<? super T, ? extends R, X> fn) throws X {
    Objects.requireNonNull(fn, "fn");
    if (!lock.tryAcquire()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(fn.apply(value));
    } finally {
      lock.release();
    }
  }

  /**
   * Replaces the value with {@code fn(value)} atomically. For immutable values this is the way to
   * change them.
   */
  public void update(UnaryOperator<T> fn) {
    Objects.requireNonNull(fn, "fn");
    lock.acquire();
    try {
      value = fn.apply(value);
    } finally {
      lock.release();
    }
  }

  /**
   * @return an independent copy of the value, taken while holding the lock. Later changes to the
   *     resource do not show through it.
   */
  public T snapshot() {
    return withExclusive(copier::apply);
  }

  /** The lock guarding the value, for acquiring several resources together. */
  ExclusiveLock guard() {
    return lock;
  }

  /** Direct access for code that acquired {@link #guard()} itself. */
  T valueUnderLock() {
    Preconditions.checkState(
        lock.isHeldByCurrentThread(), "Guard of %s is not held by the current thread", lock);
    return value;
  }

  @Override
  public void close() {
    lock.close();
    closed.set(true);
  }

  @Override
  public String toString() {
    return "GuardedResource{" + lock.getResourceId() + '}';
  }
}
