package locksmith.test.mutex;

import locksmith.api.IllegalOwnershipException;
import locksmith.api.lock.ExclusiveLock;
import locksmith.api.lock.LockSession;
import locksmith.test.BaseTest;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NonOwnerLockReleaseTest extends BaseTest {

  @Test
  @DisplayName("TC-10: releasing a lock nobody holds fails")
  void testReleaseUnheldLock() {
    ExclusiveLock lock = locksmith.newLock("tc10-lock");

    assertThatThrownBy(lock::release)
        .isInstanceOf(IllegalOwnershipException.class)
        .isInstanceOf(IllegalMonitorStateException.class)
        .hasMessageContaining("tc10-lock");
  }

  @Test
  @DisplayName("TC-11: a non-owner cannot release the lock and the owner keeps it")
  void testNonOwnerLockRelease() throws Exception {
    ExclusiveLock lock = locksmith.newLock("tc11-lock");
    lock.acquire();
    try {
      CompletableFuture<Void> release = CompletableFuture.runAsync(lock::release);

      assertThatThrownBy(() -> release.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(IllegalOwnershipException.class);
      Assertions.assertThat(lock.isHeldByCurrentThread()).isTrue();
    } finally {
      lock.release();
    }
  }

  @Test
  @DisplayName("TC-12: a session cannot be closed by another thread")
  void testSessionClosedByOtherThread() throws Exception {
    ExclusiveLock lock = locksmith.newLock("tc12-lock");
    LockSession session = lock.lock();
    try {
      CompletableFuture<Void> close = CompletableFuture.runAsync(session::close);

      assertThatThrownBy(() -> close.get(5, TimeUnit.SECONDS))
          .hasCauseInstanceOf(IllegalOwnershipException.class);
      Assertions.assertThat(session.isReleased()).isFalse();
    } finally {
      session.close();
    }
    Assertions.assertThat(lock.isLocked()).isFalse();
  }
}
