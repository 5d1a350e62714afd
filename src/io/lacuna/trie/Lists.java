package io.lacuna.trie;

import io.lacuna.trie.hash.Hashing;

import java.util.Iterator;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Utility functions for {@link List}.
 *
 * @author ztellman
 */
public class Lists {

  public static <V> boolean equals(List<V> a, List<V> b) {
    return equals(a, b, Objects::equals);
  }

  /**
   * @param equals a comparison predicate for the elements of the lists
   * @return true, if both lists have the same length and pairwise equal elements
   */
  public static <V> boolean equals(List<V> a, List<V> b, BiPredicate<V, V> equals) {
    if (a == b) {
      return true;
    } else if (a.size() != b.size()) {
      return false;
    }

    Iterator<V> ia = a.iterator();
    Iterator<V> ib = b.iterator();
    while (ia.hasNext()) {
      if (!equals.test(ia.next(), ib.next())) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the same hash as a {@link java.util.List} with the same elements
   */
  public static <V> long hash(List<V> l) {
    return hash(l, Objects::hashCode);
  }

  /**
   * @return a 64-bit hash, using {@link Hashing} for each element
   */
  public static <V> long longHash(List<V> l) {
    return hash(l, Hashing::hash);
  }

  /**
   * @return an order-dependent combination of each element's hash, starting from 1
   */
  public static <V> long hash(List<V> l, ToLongFunction<V> hash) {
    long result = 1;
    for (V v : l) {
      result = Hashing.combineOrdered(result, hash.applyAsLong(v));
    }
    return result;
  }

  public static <V> String toString(List<V> l) {
    return toString(l, Objects::toString);
  }

  /**
   * @param printer a function which returns a string representation of an element
   */
  public static <V> String toString(List<V> l, Function<V, String> printer) {
    StringJoiner joiner = new StringJoiner(", ", "[", "]");
    l.forEach(v -> joiner.add(printer.apply(v)));
    return joiner.toString();
  }
}
