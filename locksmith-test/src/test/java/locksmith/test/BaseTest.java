package locksmith.test;

import locksmith.api.lock.Backoff;
import locksmith.core.Locksmith;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Base class of the concurrency tests. Provides one {@link Locksmith} per test class, named worker
 * threads, and polling helpers for waiting on another thread's progress.
 *
 * <p>Every wait is bounded so that a deadlock fails the test instead of hanging the build.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class BaseTest {

  protected static final Duration WAIT_TIMEOUT = Duration.ofSeconds(30);

  protected Locksmith locksmith;

  @BeforeAll
  void setupLocksmith() {
    locksmith = Locksmith.builder().backoff(Backoff.ofMillis(1, 10)).build();
  }

  /** Also asserts that no test left a primitive held. */
  @AfterAll
  void closeLocksmith() {
    locksmith.close();
  }

  public ExecutorService newExecutorService(int threads) {
    return Executors.newFixedThreadPool(
        threads, new ThreadFactoryBuilder().setNameFormat("locksmith-test-worker-%d").build());
  }

  public Thread newThread(String name, Runnable task) {
    Thread thread = new Thread(task, name);
    thread.setDaemon(true);
    return thread;
  }

  public static void shutdown(ExecutorService executorService) throws InterruptedException {
    executorService.shutdown();
    if (!executorService.awaitTermination(WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
      executorService.shutdownNow();
      throw new AssertionError("Workers did not terminate within " + WAIT_TIMEOUT);
    }
  }

  /**
   * Waits for every worker, failing with the first worker's exception or after {@link
   * #WAIT_TIMEOUT}.
   */
  public static void awaitAll(List<? extends Future<?>> futures) throws Exception {
    for (Future<?> future : futures) {
      future.get(WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
    }
  }

  /** Polls {@code condition} until it holds, failing after {@link #WAIT_TIMEOUT}. */
  public static void awaitUntil(String description, BooleanSupplier condition)
      throws InterruptedException {
    long deadline = System.nanoTime() + WAIT_TIMEOUT.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() - deadline > 0) {
        throw new AssertionError("Timed out waiting until " + description);
      }
      Thread.sleep(1L);
    }
  }

  /** Waits until {@code thread} is parked, i.e. blocked on a lock it asked for. */
  public static void awaitBlocked(Thread thread) throws InterruptedException {
    awaitUntil(
        thread.getName() + " is blocked",
        () -> {
          Thread.State state = thread.getState();
          return state == Thread.State.WAITING || state == Thread.State.TIMED_WAITING;
        });
  }
}
