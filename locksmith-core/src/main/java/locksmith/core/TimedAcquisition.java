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

import locksmith.api.LocksmithException;
import locksmith.api.lock.Backoff;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Deadline-bounded acquisition built from non-blocking attempts.
 *
 * <p>The attempt is retried while it returns {@code false}, pausing according to the {@link
 * Backoff}, until it succeeds or the deadline passes. Usage and state errors raised by the attempt
 * abort the loop and reach the caller unchanged.
 */
final class TimedAcquisition {

  private TimedAcquisition() {}

  /**
   * @param resourceId the lock id, for messages
   * @param attempt a non-blocking acquisition attempt
   * @param time the maximum time to wait; {@code <= 0} makes a single attempt
   * @param unit the time unit of {@code time}
   * @param backoff the pause schedule between attempts
   * @throws InterruptedException if interrupted while pausing between attempts
   * @throws TimeoutException if no attempt succeeded before the deadline
   */
  static void acquire(
      String resourceId, BooleanSupplier attempt, long time, TimeUnit unit, Backoff backoff)
      throws InterruptedException, TimeoutException {
    Objects.requireNonNull(unit, "TimeUnit cannot be null for a timed acquisition");
    Objects.requireNonNull(backoff, "backoff");

    if (attempt.getAsBoolean()) {
      return;
    }
    long timeoutNanos = unit.toNanos(time);
    if (timeoutNanos < 2L) {
      throw new TimeoutException("Unable to acquire lock without waiting: " + resourceId);
    }
    if (Thread.interrupted()) {
      throw new InterruptedException();
    }

    Boolean acquired;
    try {
      acquired = Failsafe.with(retryPolicy(Duration.ofNanos(timeoutNanos), backoff))
          .get(attempt::getAsBoolean);
    } catch (FailsafeException e) {
      if (e.getCause() instanceof InterruptedException interrupted) {
        Thread.interrupted();
        throw interrupted;
      }
      throw e;
    }
    if (!Boolean.TRUE.equals(acquired)) {
      throw new TimeoutException("Unable to acquire lock within the specified time: " + resourceId);
    }
  }

  private static RetryPolicy<Boolean> retryPolicy(Duration deadline, Backoff backoff) {
    // Failsafe requires delay < maxDelay and delay < maxDuration.
    Duration delay = min(backoff.initialDelay(), deadline.dividedBy(2));
    Duration maxDelay = min(backoff.maxDelay(), deadline);
    if (maxDelay.compareTo(delay) <= 0) {
      maxDelay = delay.plusNanos(1);
    }
    return RetryPolicy.<Boolean>builder()
        .handleResult(Boolean.FALSE)
        .abortOn(
            failure ->
                failure instanceof IllegalMonitorStateException
                    || failure instanceof LocksmithException)
        .withBackoff(delay, maxDelay)
        .withMaxRetries(-1)
        .withMaxDuration(deadline)
        .build();
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}
