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
package locksmith.api.lock;

import com.google.common.base.Preconditions;

import java.time.Duration;
import java.util.Objects;

/**
 * Polling schedule of a timed acquisition. A timed acquisition never parks on the lock's wait
 * queue; it repeats non-blocking attempts, sleeping between them for a delay that starts at {@code
 * initialDelay} and doubles up to {@code maxDelay}.
 *
 * @param initialDelay the pause after the first failed attempt
 * @param maxDelay the upper bound of the pause between two attempts
 */
public record Backoff(Duration initialDelay, Duration maxDelay) {

  public static final Backoff DEFAULT = new Backoff(Duration.ofMillis(1), Duration.ofMillis(50));

  public Backoff {
    Objects.requireNonNull(initialDelay, "initialDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    Preconditions.checkArgument(
        !initialDelay.isNegative() && !initialDelay.isZero(),
        "initialDelay must be positive: %s",
        initialDelay);
    Preconditions.checkArgument(
        maxDelay.compareTo(initialDelay) > 0,
        "maxDelay %s must be greater than initialDelay %s",
        maxDelay,
        initialDelay);
  }

  public static Backoff ofMillis(long initialDelayMillis, long maxDelayMillis) {
    return new Backoff(Duration.ofMillis(initialDelayMillis), Duration.ofMillis(maxDelayMillis));
  }
}
