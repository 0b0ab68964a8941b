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
import locksmith.api.ReentrantAcquisitionException;
import locksmith.api.lock.Backoff;
import locksmith.api.lock.ExclusiveLock;
import locksmith.api.lock.LockSession;
import com.google.common.annotations.Beta;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The default {@link ExclusiveLock}.
 *
 * <p>The lock state is a single owner field, {@code null} while unlocked. It is protected by a
 * private {@link ReentrantLock} that is only ever held for the few instructions needed to read or
 * flip the owner, and blocked acquirers wait on its {@code released} condition. That internal lock
 * is an implementation detail: it is never held while user code runs.
 *
 * <p>Note: the lock is bound to the thread that acquired it. Only that thread can invoke {@link
 * #release()} successfully.
 */
@Beta
@ThreadSafe
final class DefaultExclusiveLock extends ExclusiveLock {

  private final Logger log = LoggerFactory.getLogger(DefaultExclusiveLock.class);

  private final String resourceId;
  private final Backoff defaultBackoff;

  private final ReentrantLock stateLock = new ReentrantLock();
  private final Condition released = stateLock.newCondition();

  @GuardedBy("stateLock")
  private Thread owner;

  // Numbers every grant, so a session can tell its own hold from a later one.
  @GuardedBy("stateLock")
  private long hold;

  DefaultExclusiveLock(String resourceId, Backoff defaultBackoff) {
    this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
    this.defaultBackoff = Objects.requireNonNull(defaultBackoff, "defaultBackoff");
  }

  @Override
  public String getResourceId() {
    return resourceId;
  }

  @Override
  public void acquire() {
    Thread current = Thread.currentThread();
    stateLock.lock();
    try {
      checkAcquirable(current);
      while (owner != null) {
        released.awaitUninterruptibly();
        ensureOpen();
      }
      grant(current);
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public void acquireInterruptibly() throws InterruptedException {
    Thread current = Thread.currentThread();
    stateLock.lockInterruptibly();
    try {
      checkAcquirable(current);
      while (owner != null) {
        released.await();
        ensureOpen();
      }
      grant(current);
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public boolean tryAcquire() {
    Thread current = Thread.currentThread();
    stateLock.lock();
    try {
      checkAcquirable(current);
      if (owner != null) {
        return false;
      }
      grant(current);
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public void acquire(long time, TimeUnit unit) throws InterruptedException, TimeoutException {
    acquire(time, unit, defaultBackoff);
  }

  @Override
  public void acquire(long time, TimeUnit unit, Backoff backoff)
      throws InterruptedException, TimeoutException {
    TimedAcquisition.acquire(resourceId, this::tryAcquire, time, unit, backoff);
  }

  @Override
  public void release() {
    stateLock.lock();
    try {
      if (owner != Thread.currentThread()) {
        throw new IllegalOwnershipException(resourceId);
      }
      unlockOwned();
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public LockSession currentSession() {
    long current;
    stateLock.lock();
    try {
      if (owner != Thread.currentThread()) {
        throw new IllegalOwnershipException(resourceId);
      }
      current = hold;
    } finally {
      stateLock.unlock();
    }
    return new LockSession(resourceId, () -> releaseHold(current));
  }

  /** Releases the lock only if it is still the hold numbered {@code expected}. */
  private void releaseHold(long expected) {
    stateLock.lock();
    try {
      if (owner != Thread.currentThread() || hold != expected) {
        throw new IllegalOwnershipException(resourceId, "The session's hold has already ended");
      }
      unlockOwned();
    } finally {
      stateLock.unlock();
    }
  }

  @GuardedBy("stateLock")
  private void grant(Thread current) {
    owner = current;
    hold++;
  }

  @GuardedBy("stateLock")
  private void unlockOwned() {
    owner = null;
    // Any single waiter can take over; waking more would only make them queue again.
    released.signal();
  }

  @Override
  public boolean isHeldByCurrentThread() {
    stateLock.lock();
    try {
      return owner == Thread.currentThread();
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public boolean isLocked() {
    stateLock.lock();
    try {
      return owner != null;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public void close() {
    stateLock.lock();
    try {
      if (owner != null) {
        throw new LockStateException(
            "Cannot close lock "
                + resourceId
                + " while it is held by "
                + ThreadUtils.describe(owner));
      }
      if (closed.compareAndSet(false, true)) {
        released.signalAll();
        if (log.isDebugEnabled()) {
          log.debug("Exclusive lock {} closed", resourceId);
        }
      }
    } finally {
      stateLock.unlock();
    }
  }

  @GuardedBy("stateLock")
  private void checkAcquirable(Thread current) {
    ensureOpen();
    if (owner == current) {
      throw new ReentrantAcquisitionException(resourceId);
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
      return "ExclusiveLock{" + resourceId + ", owner=" + ThreadUtils.describe(owner) + '}';
    } finally {
      stateLock.unlock();
    }
  }
}
