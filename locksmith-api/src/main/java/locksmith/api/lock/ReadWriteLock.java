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
import locksmith.api.LockUpgradeException;
import locksmith.api.ReentrantAcquisitionException;
import locksmith.api.Resourceful;
import locksmith.api.guard.CriticalSection;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.MustBeClosed;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A {@code ReadWriteLock} grants either shared access to any number of readers or exclusive access
 * to a single writer, never both at once.
 *
 * <p>The lock prefers writers: once a writer waits, no new shared access is granted until that
 * writer has had its turn. A steady stream of readers therefore cannot starve a writer. No FIFO
 * order is promised among waiters of the same kind.
 *
 * <p>Neither side is reentrant. A reader may not acquire shared access again, a writer may not
 * acquire either side again, and a reader may not upgrade to exclusive access. The correct way to
 * go from reading to writing is to release the shared hold, acquire exclusive access and then
 * re-check whatever was observed while reading.
 *
 * <p>Implementations of this class are expected to be thread-safe.
 */
public abstract class ReadWriteLock extends Resourceful {

  /**
   * Acquires shared access, waiting while a writer holds the lock or any writer is waiting for it.
   *
   * @return a session bound to this hold. Its {@code close()} performs {@link #releaseShared()},
   *     unless the hold has already ended, in which case it fails with {@link
   *     IllegalOwnershipException} and releases nothing.
   * @throws ReentrantAcquisitionException if the current thread already holds either side
   */
  @MustBeClosed
  public abstract LockSession acquireShared();

  /**
   * Acquires shared access only if it can be granted immediately under the writer-preference rule.
   *
   * @return {@code true} if shared access was acquired
   */
  @CheckReturnValue
  public abstract boolean tryAcquireShared();

  /**
   * Acquires shared access if it can be granted within the given waiting time. The caller polls
   * with the default {@link Backoff}.
   *
   * @throws TimeoutException if the waiting time elapses first
   */
  @MustBeClosed
  public abstract LockSession acquireShared(long time, TimeUnit unit)
      throws InterruptedException, TimeoutException;

  /**
   * Releases the current thread's shared access.
   *
   * @throws IllegalOwnershipException if the current thread holds no shared access
   */
  public abstract void releaseShared();

  /**
   * Acquires exclusive access, waiting until there are no readers and no writer.
   *
   * @return a session bound to this hold. Its {@code close()} performs {@link #releaseExclusive()},
   *     unless the hold has already ended, in which case it fails with {@link
   *     IllegalOwnershipException} and releases nothing.
   * @throws LockUpgradeException if the current thread holds shared access
   * @throws ReentrantAcquisitionException if the current thread already holds exclusive access
   */
  @MustBeClosed
  public abstract LockSession acquireExclusive();

  /**
   * Acquires exclusive access only if the lock is idle.
   *
   * @return {@code true} if exclusive access was acquired
   */
  @CheckReturnValue
  public abstract boolean tryAcquireExclusive();

  /**
   * Acquires exclusive access if the lock becomes idle within the given waiting time. A timed
   * writer polls and is not counted as a waiting writer, so it does not hold back new readers.
   *
   * @throws TimeoutException if the waiting time elapses first
   */
  @MustBeClosed
  public abstract LockSession acquireExclusive(long time, TimeUnit unit)
      throws InterruptedException, TimeoutException;

  /**
   * Releases exclusive access.
   *
   * @throws IllegalOwnershipException if the current thread is not the writer
   */
  public abstract void releaseExclusive();

  /**
   * @return the number of threads currently holding shared access
   */
  public abstract int getReadHoldCount();

  /**
   * @return {@code true} if a writer holds the lock
   */
  public abstract boolean isWriteLocked();

  /**
   * @return the number of writers blocked in {@link #acquireExclusive()}
   */
  public abstract int getWaitingWriters();

  public abstract boolean isSharedHeldByCurrentThread();

  public abstract boolean isExclusiveHeldByCurrentThread();

  /**
   * Runs {@code action} with shared access and releases it afterwards, whether the action returns
   * or throws.
   */
  public <R, X extends Throwable> R withShared(CriticalSection<R, X> action) throws X {
    try (LockSession ignored = acquireShared()) {
      return action.call();
    }
  }

  /**
   * Runs {@code action} with exclusive access and releases it afterwards, whether the action
   * returns or throws.
   */
  public <R, X extends Throwable> R withExclusive(CriticalSection<R, X> action) throws X {
    try (LockSession ignored = acquireExclusive()) {
      return action.call();
    }
  }
}
