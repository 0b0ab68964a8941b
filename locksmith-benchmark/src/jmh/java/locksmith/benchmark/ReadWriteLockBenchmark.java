package locksmith.benchmark;

import locksmith.api.lock.LockSession;
import locksmith.api.lock.ReadWriteLock;
import locksmith.core.GuardedCache;
import locksmith.core.Locksmith;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Group)
@Fork(
    value = 1,
    jvmArgs = {"-Xms2G", "-Xmx2G"})
@Warmup(iterations = 3, time = 5)
@Measurement(iterations = 5, time = 10)
public class ReadWriteLockBenchmark {
  private Locksmith locksmith;
  private ReadWriteLock lock;
  private GuardedCache<String, String> cache;

  @Setup
  public void setup() {
    locksmith = new Locksmith();
    lock = locksmith.newReadWriteLock("benchmark-rw");
    cache = locksmith.newCache("benchmark-cache", value -> value);
    cache.set("key", "value");
  }

  @TearDown
  public void tearDown() {
    locksmith.close();
  }

  @Benchmark
  @Group("readMostly")
  @GroupThreads(15)
  public void read(Blackhole blackhole) {
    try (LockSession ignored = lock.acquireShared()) {
      blackhole.consume(0);
    }
  }

  @Benchmark
  @Group("readMostly")
  @GroupThreads(1)
  public void write(Blackhole blackhole) {
    try (LockSession ignored = lock.acquireExclusive()) {
      blackhole.consume(0);
    }
  }

  @Benchmark
  @Group("cache")
  @GroupThreads(15)
  public void cacheGet(Blackhole blackhole) {
    blackhole.consume(cache.get("key"));
  }

  @Benchmark
  @Group("cache")
  @GroupThreads(1)
  public void cacheSet() {
    cache.set("key", "value");
  }
}
