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
 * Thrown when the holder of a non-reentrant lock tries to acquire it again. Without this check the
 * thread would wait for itself forever.
 */
public class ReentrantAcquisitionException extends LockUsageException {

  public ReentrantAcquisitionException(String resourceId) {
    super(resourceId, "Current thread already holds the lock");
  }

  public ReentrantAcquisitionException(String resourceId, String message) {
    super(resourceId, message);
  }
}
