package locksmith.benchmark;

import locksmith.api.lock.ExclusiveLock;
import locksmith.core.Locksmith;
import locksmith.core.MultiLockAcquirer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(
    value = 1,
    jvmArgs = {"-Xms2G", "-Xmx2G"})
@Warmup(iterations = 3, time = 5)
@Measurement(iterations = 5, time = 10)
public class ExclusiveLockBenchmark {
  private Locksmith locksmith;
  private ExclusiveLock lock;
  private List<ExclusiveLock> forward;
  private List<ExclusiveLock> backward;

  @Setup
  public void setup() {
    locksmith = new Locksmith();
    lock = locksmith.newLock("benchmark-lock");
    ExclusiveLock x = locksmith.newLock("benchmark-x");
    ExclusiveLock y = locksmith.newLock("benchmark-y");
    forward = List.of(x, y);
    backward = List.of(y, x);
  }

  @TearDown
  public void tearDown() {
    locksmith.close();
  }

  @Benchmark
  @Threads(1)
  public void acquireAndRelease_NoContention(Blackhole blackhole) {
    lock.acquire();
    try {
      blackhole.consume(0);
    } finally {
      lock.release();
    }
  }

  @Benchmark
  @Threads(32)
  public void acquireAndRelease_WithContention(Blackhole blackhole) {
    lock.acquire();
    try {
      blackhole.consume(0);
    } finally {
      lock.release();
    }
  }

  @Benchmark
  @Threads(8)
  public void withAll_OppositeOrders(Blackhole blackhole) {
    List<ExclusiveLock> order =
        Thread.currentThread().getId() % 2 == 0 ? forward : backward;
    MultiLockAcquirer.withAll(
        order,
        () -> {
          blackhole.consume(0);
          return null;
        });
  }
}
