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

import com.google.errorprone.annotations.ThreadSafe;

/** A counter whose every read and update holds its lock. */
@ThreadSafe
public final class GuardedCounter {

  private static final class Cell {
    long value;

    Cell(long value) {
      this.value = value;
    }
  }

  private final GuardedResource<Cell> cell;

  public GuardedCounter() {
    this(0L);
  }

  public GuardedCounter(long initial) {
    this.cell = GuardedResource.of(new Cell(initial), c -> new Cell(c.value));
  }

  public void increment() {
    incrementAndGet();
  }

  public void decrement() {
    cell.withExclusive(c -> --c.value);
  }

  public long incrementAndGet() {
    return cell.withExclusive(c -> ++c.value);
  }

  public long get() {
    return cell.withExclusive(c -> c.value);
  }
}
