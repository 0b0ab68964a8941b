package locksmith.test.mutex;

import locksmith.api.ReentrantAcquisitionException;
import locksmith.api.lock.ExclusiveLock;
import locksmith.test.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReentrantAcquisitionTest extends BaseTest {

  @Test
  @DisplayName("TC-13: the holder acquiring again is rejected instead of deadlocking")
  void testReentrantAcquire() {
    ExclusiveLock lock = locksmith.newLock("tc13-lock");
    lock.acquire();
    try {
      assertThatThrownBy(lock::acquire).isInstanceOf(ReentrantAcquisitionException.class);
      assertThatThrownBy(lock::tryAcquire).isInstanceOf(ReentrantAcquisitionException.class);
      assertThatThrownBy(lock::acquireInterruptibly)
          .isInstanceOf(ReentrantAcquisitionException.class);
      assertThatThrownBy(() -> lock.acquire(100, TimeUnit.MILLISECONDS))
          .isInstanceOf(ReentrantAcquisitionException.class);

      assertThat(lock.isHeldByCurrentThread()).isTrue();
    } finally {
      lock.release();
    }
    assertThat(lock.isLocked()).isFalse();
  }

  @Test
  @DisplayName("TC-14: nested withLock on the same lock is rejected and the outer hold survives")
  void testNestedWithLock() {
    ExclusiveLock lock = locksmith.newLock("tc14-lock");

    Boolean stillHeld =
        lock.withLock(
            () -> {
              assertThatThrownBy(() -> lock.withLock(() -> "inner"))
                  .isInstanceOf(ReentrantAcquisitionException.class);
              return lock.isHeldByCurrentThread();
            });

    assertThat(stillHeld).isTrue();
    assertThat(lock.isLocked()).isFalse();
  }
}
