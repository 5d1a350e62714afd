package io.lacuna.trie.utils;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * @author ztellman
 */
public class Iterators {

  /**
   * @return an iterator which lazily applies {@code f} to each value yielded by {@code it}
   */
  public static <U, V> Iterator<V> map(Iterator<U> it, Function<U, V> f) {
    return new Iterator<V>() {
      @Override
      public boolean hasNext() {
        return it.hasNext();
      }

      @Override
      public V next() {
        return f.apply(it.next());
      }
    };
  }

  /**
   * @return a sequential stream over an iterator of known size, whose source never changes
   */
  public static <V> Stream<V> toStream(Iterator<V> it, long size, int characteristics) {
    Spliterator<V> spliterator = Spliterators.spliterator(it, size, characteristics | Spliterator.IMMUTABLE);
    return StreamSupport.stream(spliterator, false);
  }
}
