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

import locksmith.api.ReentrantAcquisitionException;
import locksmith.api.guard.CriticalSection;
import locksmith.api.guard.GuardedBiFunction;
import locksmith.api.lock.ExclusiveLock;
import locksmith.api.lock.LockSession;
import com.google.common.annotations.Beta;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.MustBeClosed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Acquires several {@link ExclusiveLock locks} as one step without risking deadlock, whatever order
 * the callers list them in.
 *
 * <p>The acquisition strategy is as follows:
 *
 * <ol>
 *   <li><b>Blocking Step:</b> acquire one lock of the set with a blocking call. The first pass
 *       starts with the first lock of the caller's list.
 *   <li><b>Optimistic Pass:</b> try every other lock, in list order, with the non-blocking {@link
 *       ExclusiveLock#tryAcquire()}.
 *   <li><b>Back-off:</b> on the first failed attempt release everything acquired in this pass, make
 *       the lock that failed the next pass's blocking lock, and start over.
 * </ol>
 *
 * A thread only ever blocks while holding nothing else, so no cycle of waiting threads can form.
 * Other threads never observe a partially acquired set for longer than one pass, and the caller
 * only continues once all locks are held.
 */
@Beta
public final class MultiLockAcquirer {

  private static final Logger log = LoggerFactory.getLogger(MultiLockAcquirer.class);

  private MultiLockAcquirer() {}

  /**
   * Acquires all {@code locks} and returns a session whose {@code close()} releases them all, in
   * reverse order.
   *
   * @param locks the locks to hold together; at least one, no duplicates
   * @throws IllegalArgumentException if {@code locks} is empty or contains a lock twice
   * @throws ReentrantAcquisitionException if the current thread already holds one of the locks;
   *     nothing is acquired in that case
   */
  @MustBeClosed
  public static LockSession acquireAll(List<? extends ExclusiveLock> locks) {
    List<ExclusiveLock> ordered = validate(locks);
    int retries = acquire(ordered);
    List<LockSession> holds = new ArrayList<>(ordered.size());
    for (ExclusiveLock lock : ordered) {
      holds.add(lock.currentSession());
    }
    String description =
        ordered.stream().map(ExclusiveLock::getResourceId).collect(Collectors.joining(",", "[", "]"));
    return new LockSession(description, () -> closeAll(holds), retries);
  }

  /**
   * Runs {@code action} while holding all {@code locks}. The locks are released when the action
   * returns or throws; the action's exception reaches the caller unchanged.
   */
  public static <R, X extends Throwable> R withAll(
      List<? extends ExclusiveLock> locks, CriticalSection<R, X> action) throws X {
    Objects.requireNonNull(action, "action");
    try (LockSession ignored = acquireAll(locks)) {
      return action.call();
    }
  }

  /**
   * Runs {@code fn} against the values of two resources while holding both of their locks, e.g. to
   * move an element from one guarded container to another atomically.
   *
   * @throws IllegalArgumentException if {@code first} and {@code second} are the same resource
   */
  public static <A, B, R, X extends Throwable> R transferBetween(
      GuardedResource<A> first,
      GuardedResource<B> second,
      GuardedBiFunction<? super A, ? super B, ? extends R, X> fn)
      throws X {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    Objects.requireNonNull(fn, "fn");
    Preconditions.checkArgument(first != second, "Cannot transfer within the same resource");
    return withAll(
        List.of(first.guard(), second.guard()),
        () -> fn.apply(first.valueUnderLock(), second.valueUnderLock()));
  }

  private static List<ExclusiveLock> validate(List<? extends ExclusiveLock> locks) {
    Objects.requireNonNull(locks, "locks");
    Preconditions.checkArgument(!locks.isEmpty(), "At least one lock is required");
    Set<ExclusiveLock> seen = Sets.newIdentityHashSet();
    for (ExclusiveLock lock : locks) {
      Objects.requireNonNull(lock, "locks contains null");
      Preconditions.checkArgument(seen.add(lock), "Lock listed twice: %s", lock.getResourceId());
      if (lock.isHeldByCurrentThread()) {
        throw new ReentrantAcquisitionException(lock.getResourceId());
      }
    }
    return ImmutableList.copyOf(locks);
  }

  /**
   * @return the number of back-offs needed
   */
  private static int acquire(List<ExclusiveLock> locks) {
    int size = locks.size();
    int blocking = 0;
    int retries = 0;
    for (; ; ) {
      Deque<ExclusiveLock> held = new ArrayDeque<>(size);
      int failed = -1;
      try {
        locks.get(blocking).acquire();
        held.push(locks.get(blocking));
        for (int i = 0; i < size; i++) {
          if (i == blocking) {
            continue;
          }
          ExclusiveLock next = locks.get(i);
          if (!next.tryAcquire()) {
            failed = i;
            break;
          }
          held.push(next);
        }
      } catch (RuntimeException | Error e) {
        try {
          release(held);
        } catch (RuntimeException releaseFailure) {
          e.addSuppressed(releaseFailure);
        }
        throw e;
      }

      if (failed < 0) {
        if (retries > 0 && log.isDebugEnabled()) {
          log.debug("Acquired {} locks after {} back-offs", size, retries);
        }
        return retries;
      }

      int releasing = held.size();
      release(held);
      retries++;
      if (log.isDebugEnabled()) {
        log.debug(
            "Lock {} is busy, released {} held lock(s) and backing off (retry {})",
            locks.get(failed).getResourceId(),
            releasing,
            retries);
      }
      blocking = failed;
      Thread.yield();
    }
  }

  /**
   * Closes the sessions in reverse order. Every session is closed even if an earlier one fails;
   * sessions closed by an earlier attempt are skipped by {@link LockSession#close()} itself.
   */
  private static void closeAll(List<LockSession> holds) {
    RuntimeException failure = null;
    for (int i = holds.size() - 1; i >= 0; i--) {
      try {
        holds.get(i).close();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  /** Releases in stack order. Every lock is released even if an earlier release fails. */
  private static void release(Deque<ExclusiveLock> held) {
    RuntimeException failure = null;
    while (!held.isEmpty()) {
      try {
        held.pop().release();
      } catch (RuntimeException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
