package locksmith.test.registry;

import locksmith.api.LockStateException;
import locksmith.api.lock.Backoff;
import locksmith.api.lock.ExclusiveLock;
import locksmith.api.lock.ReadWriteLock;
import locksmith.core.GuardedResource;
import locksmith.core.Locksmith;
import locksmith.test.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LocksmithRegistryTest extends BaseTest {

  @Test
  @DisplayName("TC-66: names are unique per primitive type")
  void testDuplicateNames() {
    locksmith.newLock("tc66-name");

    assertThatThrownBy(() -> locksmith.newLock("tc66-name"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("tc66-name");
    // A different type may reuse the name.
    ReadWriteLock rw = locksmith.newReadWriteLock("tc66-name");
    assertThat(rw.getResourceId()).isEqualTo("tc66-name");
  }

  @Test
  @DisplayName("TC-67: getLock returns the registered instance")
  void testGetLock() {
    ExclusiveLock first = locksmith.getLock("tc67-lock");
    ExclusiveLock second = locksmith.getLock("tc67-lock");

    assertThat(second).isSameAs(first);
    assertThat(locksmith.getReadWriteLock("tc67-rw"))
        .isSameAs(locksmith.getReadWriteLock("tc67-rw"));
  }

  @Test
  @DisplayName("TC-68: getLock replaces a closed lock with a fresh one")
  void testGetLockAfterClose() {
    ExclusiveLock first = locksmith.getLock("tc68-lock");
    first.close();

    ExclusiveLock replacement = locksmith.getLock("tc68-lock");

    assertThat(replacement).isNotSameAs(first);
    assertThat(replacement.isClosed()).isFalse();
  }

  @Test
  @DisplayName("TC-69: blank names are rejected")
  void testBlankName() {
    assertThatThrownBy(() -> locksmith.newLock(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> locksmith.newLock(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  @DisplayName("TC-70: closing the registry closes every idle primitive and reports held ones")
  void testCloseWithHeldLock() {
    Locksmith registry = new Locksmith();
    ExclusiveLock idle = registry.newLock("idle");
    ExclusiveLock held = registry.newLock("held");
    GuardedResource<StringBuilder> resource =
        registry.newResource("resource", new StringBuilder(), StringBuilder::new);
    held.acquire();

    try {
      assertThatThrownBy(registry::close)
          .isInstanceOf(LockStateException.class)
          .satisfies(
              failure -> assertThat(failure.getSuppressed()).hasSize(1));

      assertThat(idle.isClosed()).isTrue();
      assertThat(resource.isClosed()).isTrue();
      assertThat(held.isClosed()).isFalse();
      assertThat(registry.size()).isZero();
    } finally {
      held.release();
      held.close();
    }
  }

  @Test
  @DisplayName("TC-71: the builder's backoff drives timed acquisitions")
  void testBuilder() throws Exception {
    Locksmith registry =
        Locksmith.builder().backoff(Backoff.ofMillis(5, 20)).fair(true).build();
    try {
      ExclusiveLock lock = registry.newLock("timed");
      lock.acquire();
      Thread other =
          newThread(
              "tc71-other",
              () -> {
                try {
                  lock.acquire(50, TimeUnit.MILLISECONDS);
                  lock.release();
                  throw new AssertionError("lock should have stayed busy");
                } catch (TimeoutException expected) {
                  // expected
                } catch (InterruptedException e) {
                  Thread.currentThread().interrupt();
                }
              });
      other.start();
      other.join(WAIT_TIMEOUT.toMillis());
      lock.release();

      assertThat(registry.size()).isEqualTo(1);
    } finally {
      registry.close();
    }
    assertThat(registry.size()).isZero();
  }
}
