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
package locksmith.api.lock;

import locksmith.api.IllegalOwnershipException;
import locksmith.api.LockStateException;
import locksmith.api.ReentrantAcquisitionException;
import locksmith.api.Resourceful;
import locksmith.api.guard.CriticalSection;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.MustBeClosed;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * An {@code ExclusiveLock} is a tool for controlling access to a shared resource by multiple
 * threads. Only one thread at a time can hold the lock and all access to the shared resource is
 * required to be preceded by acquiring the lock.
 *
 * <p>The lock is owned by the thread that acquired it. Only that thread can release it, and it may
 * not acquire it a second time before releasing: the lock is not reentrant, and both misuses are
 * reported with an exception instead of corrupting the lock's state.
 *
 * <p>Prefer the scoped forms, which release the lock on every exit path:
 *
 * <pre>{@code
 * try (LockSession session = lock.lock()) {
 *   // access the protected resource
 * }
 *
 * int size = lock.withLock(() -> queue.size());
 * }</pre>
 *
 * <p>No ordering is promised among blocked waiters. Implementations of this class are expected to
 * be thread-safe.
 */
public abstract class ExclusiveLock extends Resourceful {

  /**
   * Acquires the lock.
   *
   * <p>If the lock is not available then the current thread becomes disabled for thread scheduling
   * purposes and lies dormant until the lock has been acquired. Interrupts do not end the wait; the
   * interrupt status is preserved.
   *
   * @throws ReentrantAcquisitionException if the current thread already holds the lock
   * @throws LockStateException if the lock is closed
   */
  public abstract void acquire();

  /**
   * Acquires the lock unless the current thread is {@linkplain Thread#interrupt interrupted}.
   *
   * @throws InterruptedException if the current thread is interrupted while waiting
   * @throws ReentrantAcquisitionException if the current thread already holds the lock
   * @throws LockStateException if the lock is closed
   */
  public abstract void acquireInterruptibly() throws InterruptedException;

  /**
   * Acquires the lock only if it is free at the time of invocation. Never waits for the holder.
   *
   * @return {@code true} if the lock was acquired
   * @throws ReentrantAcquisitionException if the current thread already holds the lock
   * @throws LockStateException if the lock is closed
   */
  @CheckReturnValue
  public abstract boolean tryAcquire();

  /**
   * Acquires the lock if it becomes free within the given waiting time, polling with the default
   * {@link Backoff}.
   *
   * @param time the maximum time to wait for the lock; a value {@code <= 0} makes a single attempt
   * @param unit the time unit of the {@code time} argument
   * @throws InterruptedException if the current thread is interrupted while waiting
   * @throws TimeoutException if the waiting time elapses before the lock could be acquired
   */
  public abstract void acquire(long time, TimeUnit unit)
      throws InterruptedException, TimeoutException;

  /**
   * Acquires the lock if it becomes free within the given waiting time.
   *
   * <p>The wait is a sequence of {@link #tryAcquire()} attempts separated by the pauses of {@code
   * backoff}. The caller does not join the lock's wait queue, so a timed acquisition can always be
   * abandoned without disturbing other waiters.
   *
   * @param time the maximum time to wait for the lock; a value {@code <= 0} makes a single attempt
   * @param unit the time unit of the {@code time} argument
   * @param backoff the pause schedule between two attempts
   * @throws InterruptedException if the current thread is interrupted while waiting
   * @throws TimeoutException if the waiting time elapses before the lock could be acquired
   */
  public abstract void acquire(long time, TimeUnit unit, Backoff backoff)
      throws InterruptedException, TimeoutException;

  /**
   * Releases the lock.
   *
   * @throws IllegalOwnershipException if the current thread does not hold the lock
   */
  public abstract void release();

  /**
   * @return {@code true} if the current thread holds the lock
   */
  public abstract boolean isHeldByCurrentThread();

  /**
   * @return {@code true} if any thread holds the lock. For diagnostics only.
   */
  public abstract boolean isLocked();

  /**
   * Returns a session bound to the hold the current thread has right now. Closing the session
   * releases exactly that hold. Once the hold has ended some other way, closing the session fails
   * with {@link IllegalOwnershipException} and releases nothing, even if the thread has acquired
   * the lock again since.
   *
   * @throws IllegalOwnershipException if the current thread does not hold the lock
   */
  @MustBeClosed
  public abstract LockSession currentSession();

  /**
   * Acquires the lock and returns a session whose {@link LockSession#close()} releases it.
   *
   * @return the held session
   */
  @MustBeClosed
  public LockSession lock() {
    acquire();
    return currentSession();
  }

  /**
   * Runs {@code action} while holding the lock and releases the lock afterwards, whether the action
   * returns or throws.
   *
   * @param action the work to run exclusively
   * @return the action's result
   * @throws X whatever the action throws, unchanged
   */
  public <R, X extends Throwable> R withLock(CriticalSection<R, X> action) throws X {
    acquire();
    try {
      return action.call();
    } finally {
      release();
    }
  }
}
