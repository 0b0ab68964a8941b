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

import locksmith.api.LockStateException;
import com.google.errorprone.annotations.ThreadSafe;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * A line-oriented sink shared by many threads, such as an application log file. Each line is
 * written whole, prefixed with the writing thread: {@code [thread] message} or {@code
 * [ERROR][thread] message}.
 *
 * <p>The sink is owned by the appender. It is created explicitly and torn down with {@link
 * #close()}, which closes the sink if it is {@link Closeable}; later writes fail with {@link
 * LockStateException}.
 */
@ThreadSafe
public final class GuardedAppender implements Closeable {

  private static final class Sink {
    final Appendable out;
    boolean closed;

    Sink(Appendable out) {
      this.out = out;
    }
  }

  private final GuardedResource<Sink> sink;

  public GuardedAppender(Appendable out) {
    Objects.requireNonNull(out, "out");
    this.sink =
        GuardedResource.of(
            new Sink(out),
            s -> {
              throw new UnsupportedOperationException("A sink cannot be copied");
            });
  }

  public void log(String message) throws IOException {
    append("", message);
  }

  public void logError(String message) throws IOException {
    append("[ERROR]", message);
  }

  private void append(String prefix, String message) throws IOException {
    String line =
        prefix + '[' + Thread.currentThread().getName() + "] " + message + System.lineSeparator();
    sink.withExclusive(
        s -> {
          if (s.closed) {
            throw new LockStateException("Appender is closed: " + sink.getResourceId());
          }
          s.out.append(line);
          return null;
        });
  }

  /** Closes the sink once. Later and concurrent calls find it closed and return. */
  @Override
  public void close() throws IOException {
    sink.withExclusive(
        s -> {
          if (!s.closed) {
            s.closed = true;
            if (s.out instanceof Closeable closeable) {
              closeable.close();
            }
          }
          return null;
        });
  }
}
