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

import com.google.errorprone.annotations.ThreadSafe;

import java.util.Objects;

/**
 * A scoped hold on one or more locks. Closing the session releases everything it holds; it is meant
 * for try-with-resources so that the release happens on every exit path:
 *
 * <pre>{@code
 * try (LockSession session = lock.lock()) {
 *   // access the protected resource
 * }
 * }</pre>
 *
 * <p>Only the thread that opened the session may close it. Closing it again after a successful
 * close does nothing.
 */
@ThreadSafe
public final class LockSession implements AutoCloseable {

  private final String resourceId;
  private final Runnable release;
  private final int retries;

  // Written by the holder thread only.
  private volatile boolean released;

  public LockSession(String resourceId, Runnable release) {
    this(resourceId, release, 0);
  }

  /**
   * @param resourceId the id of the held lock, or a description of the held set
   * @param release releases the hold; must reject a caller that is not the holder
   * @param retries how many back-offs the acquisition needed
   */
  public LockSession(String resourceId, Runnable release, int retries) {
    this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
    this.release = Objects.requireNonNull(release, "release");
    this.retries = retries;
  }

  public String getResourceId() {
    return resourceId;
  }

  /**
   * @return the number of times the acquisition released everything and started over. Always 0 for
   *     a single lock.
   */
  public int getRetries() {
    return retries;
  }

  public boolean isReleased() {
    return released;
  }

  /**
   * Releases the hold.
   *
   * @throws locksmith.api.IllegalOwnershipException if the calling thread is not the holder
   */
  @Override
  public void close() {
    if (released) {
      return;
    }
    release.run();
    released = true;
  }

  @Override
  public String toString() {
    return "LockSession{" + resourceId + ", released=" + released + '}';
  }
}
