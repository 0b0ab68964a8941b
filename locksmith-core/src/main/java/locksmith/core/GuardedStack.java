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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.ThreadSafe;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * A last-in-first-out stack whose compound operations are atomic.
 *
 * <p>There is deliberately no {@code peek()}/{@code pop()} pair a caller could combine into a
 * check-then-act race: {@link #tryPop()} checks for emptiness and removes the top element under one
 * lock acquisition.
 *
 * @param <E> the element type; elements must not be {@code null}
 */
@ThreadSafe
public final class GuardedStack<E> {

  private final GuardedResource<Deque<E>> elements;

  public GuardedStack() {
    this.elements = GuardedResource.of(new ArrayDeque<>(), ArrayDeque::new);
  }

  public void push(E element) {
    Objects.requireNonNull(element, "element");
    elements.withExclusive(deque -> {
      deque.push(element);
      return null;
    });
  }

  /**
   * @return the removed top element, or empty if the stack was empty
   */
  public Optional<E> tryPop() {
    return elements.withExclusive(deque -> Optional.ofNullable(deque.poll()));
  }

  /**
   * @return the removed top element
   * @throws NoSuchElementException if the stack is empty
   */
  public E pop() {
    return tryPop().orElseThrow(() -> new NoSuchElementException("Stack is empty"));
  }

  public int size() {
    return elements.withExclusive(Deque::size);
  }

  public boolean isEmpty() {
    return elements.withExclusive(Deque::isEmpty);
  }

  /**
   * @return a copy of the elements, top first
   */
  public ImmutableList<E> toList() {
    return elements.withExclusive(deque -> ImmutableList.copyOf(deque));
  }
}
