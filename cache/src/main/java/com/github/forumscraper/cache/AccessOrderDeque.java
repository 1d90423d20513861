/*
 * Copyright 2026 Forum Scraper Authors. All Rights Reserved.
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
package com.github.forumscraper.cache;

import static java.util.Objects.requireNonNull;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.jspecify.annotations.Nullable;

import com.github.forumscraper.cache.AccessOrderDeque.AccessOrder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A linked deque implementation used to represent the access-order (recency) queue. The head is the
 * least recently used element and the tail is the most recently used one. The links are stored on
 * the elements themselves, so that moving an element to the tail does not allocate.
 * <p>
 * This class is not thread-safe; the cache only touches it while holding its lock.
 *
 * @param <E> the type of elements held in this deque
 */
final class AccessOrderDeque<E extends AccessOrder<E>> implements Iterable<E> {

  // The first and last elements are manipulated instead of a sentinel element to avoid the
  // insertion of null checks. The links of a removed element are cleared so that a stale node
  // cannot be mistaken for a linked one.

  /**
   * Pointer to first node.
   * Invariant: (first == null && last == null) ||
   *            (first.prev == null)
   */
  @Nullable E first;

  /**
   * Pointer to last node.
   * Invariant: (first == null && last == null) ||
   *            (last.next == null)
   */
  @Nullable E last;

  /** The number of linked elements. */
  int size;

  /** The number of structural modifications, used to fail fast on concurrent iteration. */
  int modCount;

  public boolean isEmpty() {
    return (first == null);
  }

  public int size() {
    return size;
  }

  /** Returns the least recently used element, or null if empty. */
  public @Nullable E peekFirst() {
    return first;
  }

  /** Returns the most recently used element, or null if empty. */
  public @Nullable E peekLast() {
    return last;
  }

  /** Returns if the element is currently linked on this deque. */
  public boolean contains(AccessOrder<?> e) {
    return (e.getPreviousInAccessOrder() != null)
        || (e.getNextInAccessOrder() != null)
        || (e == first);
  }

  /**
   * Links the element to the back of the deque so that it becomes the most recently used element.
   *
   * @param e the unlinked element
   * @return true if the element was added
   */
  @CanIgnoreReturnValue
  public boolean offerLast(E e) {
    requireNonNull(e);
    if (contains(e)) {
      return false;
    }
    linkLast(e);
    return true;
  }

  /** Moves the linked element to the back of the deque, marking it as the most recently used. */
  public void moveToBack(E e) {
    if (e != last) {
      unlink(e);
      linkLast(e);
    }
  }

  /**
   * Unlinks the element if it is present.
   *
   * @return true if the element was removed
   */
  @CanIgnoreReturnValue
  public boolean remove(E e) {
    if (contains(e)) {
      unlink(e);
      return true;
    }
    return false;
  }

  /** Unlinks every element, clearing their links. */
  public void clear() {
    @Nullable E e = first;
    while (e != null) {
      E next = e.getNextInAccessOrder();
      e.setPreviousInAccessOrder(null);
      e.setNextInAccessOrder(null);
      e = next;
    }
    first = last = null;
    size = 0;
    modCount++;
  }

  void linkLast(E e) {
    E l = last;
    last = e;

    if (l == null) {
      first = e;
    } else {
      l.setNextInAccessOrder(e);
      e.setPreviousInAccessOrder(l);
    }
    size++;
    modCount++;
  }

  void unlink(E e) {
    E prev = e.getPreviousInAccessOrder();
    E next = e.getNextInAccessOrder();

    if (prev == null) {
      first = next;
    } else {
      prev.setNextInAccessOrder(next);
      e.setPreviousInAccessOrder(null);
    }

    if (next == null) {
      last = prev;
    } else {
      next.setPreviousInAccessOrder(prev);
      e.setNextInAccessOrder(null);
    }
    size--;
    modCount++;
  }

  /** Returns an iterator from the least to the most recently used element. */
  @Override
  public Iterator<E> iterator() {
    return new Iterator<E>() {
      @Nullable E cursor = first;
      final int expectedModCount = modCount;

      @Override
      public boolean hasNext() {
        return (cursor != null);
      }

      @Override
      public E next() {
        if (modCount != expectedModCount) {
          throw new ConcurrentModificationException();
        }
        E e = cursor;
        if (e == null) {
          throw new NoSuchElementException();
        }
        cursor = e.getNextInAccessOrder();
        return e;
      }
    };
  }

  /**
   * An element that is linked on the access-order deque.
   */
  interface AccessOrder<T extends AccessOrder<T>> {

    /**
     * Retrieves the previous element or {@code null} if either the element is unlinked or the
     * first element on the deque.
     */
    @Nullable T getPreviousInAccessOrder();

    /** Sets the previous element or {@code null} if there is no link. */
    void setPreviousInAccessOrder(@Nullable T prev);

    /**
     * Retrieves the next element or {@code null} if either the element is unlinked or the last
     * element on the deque.
     */
    @Nullable T getNextInAccessOrder();

    /** Sets the next element or {@code null} if there is no link. */
    void setNextInAccessOrder(@Nullable T next);
  }
}
