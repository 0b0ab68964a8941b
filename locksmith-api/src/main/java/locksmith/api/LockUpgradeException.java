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
 * Thrown when a thread holding shared access to a read-write lock asks for exclusive access without
 * releasing first.
 *
 * <p>Release the shared hold, acquire exclusive access, then re-validate whatever was observed
 * under the shared hold: another writer may have run in between.
 */
public class LockUpgradeException extends LockUsageException {

  public LockUpgradeException(String resourceId) {
    super(resourceId, "Shared holder cannot upgrade to exclusive access");
  }
}
