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

package locksmith.api;

/**
 * Base class of programming errors against a lock. A usage error means the caller broke the lock's
 * contract; continuing would corrupt the lock's invariants, so these are never retried or ignored.
 *
 * <p>Extends {@link IllegalMonitorStateException} so that callers handling the JDK's own lock
 * misuse signal also observe these.
 */
public abstract class LockUsageException extends IllegalMonitorStateException {

  private final String resourceId;

  protected LockUsageException(String resourceId, String message) {
    super(message + ": " + resourceId);
    this.resourceId = resourceId;
  }

  /**
   * @return the id of the lock that was misused
   */
  public String getResourceId() {
    return resourceId;
  }
}
