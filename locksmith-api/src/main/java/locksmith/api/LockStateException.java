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
 * Thrown when a primitive is used in a lifecycle state that does not permit the operation: acquiring
 * a closed lock, or closing a lock that is still held.
 */
public class LockStateException extends LocksmithException {

  public LockStateException(String message) {
    super(message);
  }

  public LockStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
