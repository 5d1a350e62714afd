package io.lacuna.trie;

import io.lacuna.trie.hash.IHashable;
import io.lacuna.trie.utils.Iterators;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.stream.Stream;

/**
 * An immutable singly-linked list.  Adding to the front and taking the rest are constant time, and every list shares
 * its tail with the list it was built from.
 * <p>
 * Each list is either the shared empty list, or a cell holding an element and a reference to the rest of the list.
 * Cells are never modified once constructed.
 *
 * @author ztellman
 */
@SuppressWarnings("unchecked")
public class List<V> implements ICollection<V>, IHashable {

  public static final List EMPTY = new List();

  private final V head;
  private final List<V> tail;
  private final long size;

  private int hash = -1;
  private long longHash = -1;

  private List() {
    this.head = null;
    this.tail = null;
    this.size = 0;
  }

  private List(V head, List<V> tail) {
    this.head = head;
    this.tail = tail;
    this.size = tail.size + 1;
  }

  public static <V> List<V> empty() {
    return (List<V>) EMPTY;
  }

  @SafeVarargs
  public static <V> List<V> of(V... elements) {
    List<V> list = empty();
    for (int i = elements.length - 1; i >= 0; i--) {
      list = list.pushFront(elements[i]);
    }
    return list;
  }

  /**
   * @return a list containing the remaining elements of the iterator, in the same order
   */
  public static <V> List<V> from(Iterator<V> iterator) {
    ArrayList<V> buffer = new ArrayList<>();
    iterator.forEachRemaining(buffer::add);

    List<V> list = empty();
    for (int i = buffer.size() - 1; i >= 0; i--) {
      list = list.pushFront(buffer.get(i));
    }
    return list;
  }

  /**
   * @return a list containing the elements of the iterable, in the same order
   */
  public static <V> List<V> from(Iterable<V> iterable) {
    return from(iterable.iterator());
  }

  ///

  /**
   * @return a new list, with {@code value} in front of every element in this list
   */
  public List<V> pushFront(V value) {
    return new List<>(value, this);
  }

  /**
   * @return the first element of the list
   * @throws EmptyCollectionException if the list is empty
   */
  public V first() {
    if (size == 0) {
      throw new EmptyCollectionException("first of empty list");
    }
    return head;
  }

  /**
   * @return the list without its first element
   * @throws EmptyCollectionException if the list is empty
   */
  public List<V> rest() {
    if (size == 0) {
      throw new EmptyCollectionException("rest of empty list");
    }
    return tail;
  }

  /**
   * @return the last element of the list, found by walking the entire list
   * @throws EmptyCollectionException if the list is empty
   */
  public V last() {
    if (size == 0) {
      throw new EmptyCollectionException("last of empty list");
    }

    List<V> l = this;
    while (l.size > 1) {
      l = l.tail;
    }
    return l.head;
  }

  /**
   * @return the list, without its first {@code n} elements
   * @throws IllegalArgumentException if {@code n} is negative
   * @throws EmptyCollectionException if the list has fewer than {@code n} elements
   */
  public List<V> drop(long n) {
    if (n < 0) {
      throw new IllegalArgumentException("cannot drop a negative number of elements: " + n);
    } else if (n > size) {
      throw new EmptyCollectionException("cannot drop " + n + " elements from a list of size " + size);
    }

    List<V> l = this;
    for (long i = 0; i < n; i++) {
      l = l.tail;
    }
    return l;
  }

  /**
   * @return a new list with the elements in the opposite order
   */
  public List<V> reverse() {
    List<V> result = empty();
    for (List<V> l = this; l.size > 0; l = l.tail) {
      result = result.pushFront(l.head);
    }
    return result;
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public Iterator<V> iterator() {
    return new Iterator<V>() {
      List<V> curr = List.this;

      @Override
      public boolean hasNext() {
        return curr.size > 0;
      }

      @Override
      public V next() {
        if (curr.size == 0) {
          throw new NoSuchElementException();
        }
        V value = curr.head;
        curr = curr.tail;
        return value;
      }
    };
  }

  @Override
  public Stream<V> stream() {
    return Iterators.toStream(iterator(), size, Spliterator.ORDERED);
  }

  /**
   * @throws UnhashableValueException if any element cannot be hashed
   */
  @Override
  public long longHash() {
    if (longHash == -1) {
      longHash = Lists.longHash(this);
    }
    return longHash;
  }

  @Override
  public int hashCode() {
    if (hash == -1) {
      hash = (int) Lists.hash(this);
    }
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof List) {
      return Lists.equals(this, (List<V>) obj);
    }
    return false;
  }

  @Override
  public String toString() {
    return Lists.toString(this);
  }
}
