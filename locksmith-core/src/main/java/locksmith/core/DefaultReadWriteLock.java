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

import locksmith.api.IllegalOwnershipException;
import locksmith.api.LockStateException;
import locksmith.api.LockUpgradeException;
import locksmith.api.ReentrantAcquisitionException;
import locksmith.api.lock.Backoff;
import locksmith.api.lock.LockSession;
import locksmith.api.lock.ReadWriteLock;
import com.google.common.annotations.Beta;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The default {@link ReadWriteLock}.
 *
 * <h3>State</h3>
 *
 * The lock is {@code Idle}, {@code Shared(readers > 0)} or {@code Exclusive(writer)}, plus a count
 * of writers blocked in {@link #acquireExclusive()}. All of it is protected by one internal {@link
 * ReentrantLock} with two {@link Condition conditions}:
 *
 * <ul>
 *   <li><b>readerCondition:</b> readers wait here while a writer holds the lock or any writer is
 *       waiting.
 *   <li><b>writerCondition:</b> writers wait here while the lock is not idle.
 * </ul>
 *
 * <h3>Writer-Preference Policy</h3>
 *
 * A new reader is admitted only when no writer holds the lock <em>and</em> no writer is waiting.
 * When the lock becomes idle a single waiting writer is signalled if there is one; otherwise all
 * waiting readers are signalled, since they can all proceed together.
 *
 * <p>Condition waits release the internal lock, so the lock never waits while holding anything
 * another waiter needs.
 *
 * <h3>Holds</h3>
 *
 * Every grant, shared or exclusive, gets a number. The readers are kept in a map from thread to
 * the number of its hold, which is what lets the lock reject a release from a thread that is not a
 * reader, a second shared acquisition and an upgrade attempt. A {@link LockSession} remembers the
 * number of the hold it was opened for and only ever releases that hold.
 */
@Beta
@ThreadSafe
final class DefaultReadWriteLock extends ReadWriteLock {

  private final Logger log = LoggerFactory.getLogger(DefaultReadWriteLock.class);

  private final String resourceId;
  private final Backoff defaultBackoff;

  private final ReentrantLock stateLock;
  private final Condition readerCondition;
  private final Condition writerCondition;

  @GuardedBy("stateLock")
  private final Map<Thread, Long> readers = new HashMap<>();

  @GuardedBy("stateLock")
  private Thread writer;

  @GuardedBy("stateLock")
  private long writerHold;

  @GuardedBy("stateLock")
  private long grants;

  @GuardedBy("stateLock")
  private int waitingWriters;

  /**
   * @param resourceId the lock id
   * @param defaultBackoff the polling schedule of the timed acquisitions
   * @param fair whether the internal lock hands itself to the longest waiting thread
   */
  DefaultReadWriteLock(String resourceId, Backoff defaultBackoff, boolean fair) {
    this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
    this.defaultBackoff = Objects.requireNonNull(defaultBackoff, "defaultBackoff");
    this.stateLock = new ReentrantLock(fair);
    this.readerCondition = stateLock.newCondition();
    this.writerCondition = stateLock.newCondition();
  }

  @Override
  public String getResourceId() {
    return resourceId;
  }

  // --- Shared side ---

  @Override
  public LockSession acquireShared() {
    Thread current = Thread.currentThread();
    long hold;
    stateLock.lock();
    try {
      checkSharedAcquirable(current);
      while (writer != null || waitingWriters > 0) {
        readerCondition.awaitUninterruptibly();
        ensureOpen();
      }
      hold = grantShared(current);
    } finally {
      stateLock.unlock();
    }
    return sharedSession(hold);
  }

  @Override
  public boolean tryAcquireShared() {
    Thread current = Thread.currentThread();
    stateLock.lock();
    try {
      checkSharedAcquirable(current);
      if (writer != null || waitingWriters > 0) {
        return false;
      }
      grantShared(current);
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public LockSession acquireShared(long time, TimeUnit unit)
      throws InterruptedException, TimeoutException {
    TimedAcquisition.acquire(resourceId, this::tryAcquireShared, time, unit, defaultBackoff);
    stateLock.lock();
    try {
      return sharedSession(readers.get(Thread.currentThread()));
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public void releaseShared() {
    stateLock.lock();
    try {
      if (!readers.containsKey(Thread.currentThread())) {
        throw new IllegalOwnershipException(resourceId, "Current thread holds no shared access");
      }
      unlockShared();
    } finally {
      stateLock.unlock();
    }
  }

  private LockSession sharedSession(long hold) {
    return new LockSession(resourceId, () -> releaseSharedHold(hold));
  }

  private void releaseSharedHold(long expected) {
    stateLock.lock();
    try {
      Long current = readers.get(Thread.currentThread());
      if (current == null || current != expected) {
        throw new IllegalOwnershipException(
            resourceId, "The session's shared hold has already ended");
      }
      unlockShared();
    } finally {
      stateLock.unlock();
    }
  }

  @GuardedBy("stateLock")
  private void unlockShared() {
    readers.remove(Thread.currentThread());
    if (readers.isEmpty()) {
      signalNext();
    }
  }

  @GuardedBy("stateLock")
  private void checkSharedAcquirable(Thread current) {
    ensureOpen();
    if (writer == current) {
      throw new ReentrantAcquisitionException(
          resourceId, "Exclusive holder cannot acquire shared access");
    }
    if (readers.containsKey(current)) {
      throw new ReentrantAcquisitionException(resourceId, "Current thread already holds shared access");
    }
  }

  @GuardedBy("stateLock")
  private long grantShared(Thread current) {
    long hold = ++grants;
    readers.put(current, hold);
    return hold;
  }

  // --- Exclusive side ---

  @Override
  public LockSession acquireExclusive() {
    Thread current = Thread.currentThread();
    long hold;
    stateLock.lock();
    try {
      checkExclusiveAcquirable(current);
      waitingWriters++;
      try {
        while (writer != null || !readers.isEmpty()) {
          writerCondition.awaitUninterruptibly();
          ensureOpen();
        }
      } finally {
        waitingWriters--;
      }
      hold = grantExclusive(current);
    } finally {
      stateLock.unlock();
    }
    return exclusiveSession(hold);
  }

  @Override
  public boolean tryAcquireExclusive() {
    Thread current = Thread.currentThread();
    stateLock.lock();
    try {
      checkExclusiveAcquirable(current);
      if (writer != null || !readers.isEmpty()) {
        return false;
      }
      grantExclusive(current);
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public LockSession acquireExclusive(long time, TimeUnit unit)
      throws InterruptedException, TimeoutException {
    TimedAcquisition.acquire(resourceId, this::tryAcquireExclusive, time, unit, defaultBackoff);
    stateLock.lock();
    try {
      return exclusiveSession(writerHold);
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public void releaseExclusive() {
    stateLock.lock();
    try {
      if (writer != Thread.currentThread()) {
        throw new IllegalOwnershipException(resourceId, "Current thread is not the writer");
      }
      unlockExclusive();
    } finally {
      stateLock.unlock();
    }
  }

  private LockSession exclusiveSession(long hold) {
    return new LockSession(resourceId, () -> releaseExclusiveHold(hold));
  }

  private void releaseExclusiveHold(long expected) {
    stateLock.lock();
    try {
      if (writer != Thread.currentThread() || writerHold != expected) {
        throw new IllegalOwnershipException(
            resourceId, "The session's exclusive hold has already ended");
      }
      unlockExclusive();
    } finally {
      stateLock.unlock();
    }
  }

  @GuardedBy("stateLock")
  private void unlockExclusive() {
    writer = null;
    signalNext();
  }

  @GuardedBy("stateLock")
  private void checkExclusiveAcquirable(Thread current) {
    ensureOpen();
    if (readers.containsKey(current)) {
      throw new LockUpgradeException(resourceId);
    }
    if (writer == current) {
      throw new ReentrantAcquisitionException(resourceId);
    }
  }

  @GuardedBy("stateLock")
  private long grantExclusive(Thread current) {
    writer = current;
    writerHold = ++grants;
    return writerHold;
  }

  /** Called when the lock has just become idle. */
  @GuardedBy("stateLock")
  private void signalNext() {
    if (waitingWriters > 0) {
      writerCondition.signal();
    } else {
      readerCondition.signalAll();
    }
  }

  // --- Diagnostics ---

  @Override
  public int getReadHoldCount() {
    stateLock.lock();
    try {
      return readers.size();
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public boolean isWriteLocked() {
    stateLock.lock();
    try {
      return writer != null;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public int getWaitingWriters() {
    stateLock.lock();
    try {
      return waitingWriters;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public boolean isSharedHeldByCurrentThread() {
    stateLock.lock();
    try {
      return readers.containsKey(Thread.currentThread());
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public boolean isExclusiveHeldByCurrentThread() {
    stateLock.lock();
    try {
      return writer == Thread.currentThread();
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public void close() {
    stateLock.lock();
    try {
      if (writer != null || !readers.isEmpty() || waitingWriters > 0) {
        throw new LockStateException(
            String.format(
                "Cannot close read-write lock %s while it is in use"
                    + " (readers=%d, writer=%s, waitingWriters=%d)",
                resourceId, readers.size(), ThreadUtils.describe(writer), waitingWriters));
      }
      if (closed.compareAndSet(false, true)) {
        // Waiters observe the closed state and fail instead of waiting forever.
        readerCondition.signalAll();
        writerCondition.signalAll();
        if (log.isDebugEnabled()) {
          log.debug("Read-write lock {} closed", resourceId);
        }
      }
    } finally {
      stateLock.unlock();
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new LockStateException("Lock is closed: " + resourceId);
    }
  }

  @Override
  public String toString() {
    stateLock.lock();
    try {
      return String.format(
          "ReadWriteLock{%s, readers=%d, writer=%s, waitingWriters=%d}",
          resourceId, readers.size(), ThreadUtils.describe(writer), waitingWriters);
    } finally {
      stateLock.unlock();
    }
  }
}
