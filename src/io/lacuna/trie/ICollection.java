package io.lacuna.trie;

import io.lacuna.trie.utils.Iterators;

import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;

/**
 * The operations shared by every persistent collection.  None of them modify the collection.
 *
 * @author ztellman
 */
public interface ICollection<V> extends Iterable<V> {

  /**
   * @return the number of elements in the collection
   */
  long size();

  /**
   * @return true, if the collection has no elements
   */
  default boolean isEmpty() {
    return size() == 0;
  }

  @Override
  default Spliterator<V> spliterator() {
    return Spliterators.spliterator(iterator(), size(), Spliterator.IMMUTABLE);
  }

  /**
   * @return a {@link java.util.stream.Stream}, representing the elements in the collection
   */
  default Stream<V> stream() {
    return Iterators.toStream(iterator(), size(), 0);
  }
}
