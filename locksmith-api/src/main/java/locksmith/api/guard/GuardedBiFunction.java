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
package locksmith.api.guard;

/**
 * Work executed against two guarded values while both of their locks are held.
 *
 * @param <A> the first guarded value type
 * @param <B> the second guarded value type
 * @param <R> the result type
 * @param <X> the exception type the work may throw
 */
@FunctionalInterface
public interface GuardedBiFunction<A, B, R, X extends Throwable> {

  R apply(A first, B second) throws X;
}
