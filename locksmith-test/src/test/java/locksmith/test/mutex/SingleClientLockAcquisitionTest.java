package locksmith.test.mutex;

import locksmith.api.IllegalOwnershipException;
import locksmith.api.lock.ExclusiveLock;
import locksmith.api.lock.LockSession;
import locksmith.test.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SingleClientLockAcquisitionTest extends BaseTest {

  @Test
  @DisplayName("TC-01: acquire and release by a single thread")
  void testAcquireAndRelease() {
    ExclusiveLock lock = locksmith.newLock("tc01-lock");

    lock.acquire();
    assertThat(lock.isLocked()).isTrue();
    assertThat(lock.isHeldByCurrentThread()).isTrue();

    lock.release();
    assertThat(lock.isLocked()).isFalse();
    assertThat(lock.isHeldByCurrentThread()).isFalse();
  }

  @Test
  @DisplayName("TC-02: tryAcquire fails without blocking while another thread holds the lock")
  void testTryAcquireWhileHeldElsewhere() throws Exception {
    ExclusiveLock lock = locksmith.newLock("tc02-lock");

    lock.acquire();
    try {
      boolean acquired =
          CompletableFuture.supplyAsync(lock::tryAcquire).get(5, TimeUnit.SECONDS);
      assertThat(acquired).isFalse();
      assertThat(lock.isHeldByCurrentThread()).isTrue();
    } finally {
      lock.release();
    }

    assertThat(lock.tryAcquire()).isTrue();
    lock.release();
  }

  @Test
  @DisplayName("TC-03: a blocked acquirer proceeds once the holder releases")
  void testBlockedAcquirerProceedsAfterRelease() throws Exception {
    ExclusiveLock lock = locksmith.newLock("tc03-lock");
    lock.acquire();

    Thread waiter =
        newThread(
            "tc03-waiter",
            () -> {
              lock.acquire();
              lock.release();
            });
    waiter.start();
    awaitBlocked(waiter);
    assertThat(waiter.isAlive()).isTrue();

    lock.release();
    waiter.join(WAIT_TIMEOUT.toMillis());
    assertThat(waiter.isAlive()).isFalse();
    assertThat(lock.isLocked()).isFalse();
  }

  @Test
  @DisplayName("TC-04: a lock session releases on close and tolerates a second close")
  void testSessionReleasesOnce() {
    ExclusiveLock lock = locksmith.newLock("tc04-lock");

    LockSession session = lock.lock();
    assertThat(lock.isHeldByCurrentThread()).isTrue();
    session.close();
    assertThat(session.isReleased()).isTrue();
    assertThat(lock.isLocked()).isFalse();

    session.close();
    assertThat(lock.isLocked()).isFalse();
  }

  @Test
  @DisplayName("TC-72: a session whose hold already ended never releases a later hold")
  void testStaleSessionDoesNotReleaseLaterHold() {
    ExclusiveLock lock = locksmith.newLock("tc72-lock");

    LockSession first = lock.lock();
    lock.release();
    LockSession second = lock.lock();

    assertThatThrownBy(first::close)
        .isInstanceOf(IllegalOwnershipException.class)
        .hasMessageContaining("tc72-lock");
    assertThat(lock.isHeldByCurrentThread()).isTrue();
    assertThat(second.isReleased()).isFalse();

    second.close();
    assertThat(second.isReleased()).isTrue();
    assertThat(lock.isLocked()).isFalse();
    // Still stale, and there is nothing left for it to release.
    assertThatThrownBy(first::close).isInstanceOf(IllegalOwnershipException.class);
    assertThat(lock.isLocked()).isFalse();
  }

  @Test
  @DisplayName("TC-05: try-with-resources releases when the body throws")
  void testSessionReleasesOnException() {
    ExclusiveLock lock = locksmith.newLock("tc05-lock");
    IllegalStateException failure = new IllegalStateException("boom");

    Throwable thrown = null;
    try (LockSession ignored = lock.lock()) {
      throw failure;
    } catch (IllegalStateException e) {
      thrown = e;
    }

    assertThat(thrown).isSameAs(failure);
    assertThat(lock.isLocked()).isFalse();
  }

  @Test
  @DisplayName("TC-06: withLock returns the action's result and releases afterwards")
  void testWithLock() {
    ExclusiveLock lock = locksmith.newLock("tc06-lock");

    String result = lock.withLock(() -> lock.isHeldByCurrentThread() ? "held" : "not held");

    assertThat(result).isEqualTo("held");
    assertThat(lock.isLocked()).isFalse();
  }
}
