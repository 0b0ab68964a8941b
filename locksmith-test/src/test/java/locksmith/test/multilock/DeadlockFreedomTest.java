package locksmith.test.multilock;

import locksmith.api.lock.ExclusiveLock;
import locksmith.core.GuardedCounter;
import locksmith.core.MultiLockAcquirer;
import locksmith.test.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/** Opposite and random acquisition orders must always complete. */
public class DeadlockFreedomTest extends BaseTest {

  @Test
  @DisplayName("TC-35: two threads taking [X, Y] and [Y, X] in a loop never deadlock")
  void testOppositeOrders() throws Exception {
    ExclusiveLock x = locksmith.newLock("tc35-x");
    ExclusiveLock y = locksmith.newLock("tc35-y");
    int iterations = 1_000;
    GuardedCounter completed = new GuardedCounter();
    CountDownLatch start = new CountDownLatch(1);

    ExecutorService executor = newExecutorService(2);
    try {
      Future<?> forward = executor.submit(() -> loop(List.of(x, y), iterations, start, completed));
      Future<?> backward = executor.submit(() -> loop(List.of(y, x), iterations, start, completed));
      start.countDown();

      forward.get(WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
      backward.get(WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
    } finally {
      shutdown(executor);
    }

    assertThat(completed.get()).isEqualTo(2L * iterations);
    assertThat(x.isLocked()).isFalse();
    assertThat(y.isLocked()).isFalse();
  }

  @Test
  @DisplayName("TC-36: many threads taking overlapping subsets in random orders all finish")
  void testRandomOrders() throws Exception {
    List<ExclusiveLock> locks = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      locks.add(locksmith.newLock("tc36-lock-" + i));
    }
    int threads = 8;
    int iterations = 300;
    AtomicInteger violations = new AtomicInteger();
    int[] insideCounts = new int[locks.size()];
    GuardedCounter completed = new GuardedCounter();
    CountDownLatch start = new CountDownLatch(1);

    ExecutorService executor = newExecutorService(threads);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        long seed = 31L * t + 7;
        futures.add(
            executor.submit(
                () -> {
                  Random random = new Random(seed);
                  start.await();
                  for (int i = 0; i < iterations; i++) {
                    List<Integer> indices = new ArrayList<>(List.of(0, 1, 2, 3, 4));
                    Collections.shuffle(indices, random);
                    List<Integer> picked = indices.subList(0, 2 + random.nextInt(4));
                    List<ExclusiveLock> subset = new ArrayList<>();
                    picked.forEach(index -> subset.add(locks.get(index)));

                    MultiLockAcquirer.withAll(
                        subset,
                        () -> {
                          for (int index : picked) {
                            if (++insideCounts[index] != 1) {
                              violations.incrementAndGet();
                            }
                          }
                          Thread.yield();
                          for (int index : picked) {
                            insideCounts[index]--;
                          }
                          return null;
                        });
                    completed.increment();
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
      }
    } finally {
      shutdown(executor);
    }

    assertThat(violations.get()).isZero();
    assertThat(completed.get()).isEqualTo((long) threads * iterations);
    assertThat(locks).noneMatch(ExclusiveLock::isLocked);
  }

  private static Void loop(
      List<ExclusiveLock> locks, int iterations, CountDownLatch start, GuardedCounter completed)
      throws InterruptedException {
    start.await();
    for (int i = 0; i < iterations; i++) {
      MultiLockAcquirer.withAll(
          locks,
          () -> {
            completed.increment();
            return null;
          });
    }
    return null;
  }
}
