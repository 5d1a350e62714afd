package io.lacuna.trie;

import io.lacuna.trie.hash.Hashing;

import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;
import java.util.stream.Collector;

/**
 * Utility functions for {@link HashTrieSet}.
 *
 * @author ztellman
 */
@SuppressWarnings("unchecked")
public class Sets {

  /**
   * Keeps whatever value is already present.  The values of a set's map are never read, and a set built from
   * {@link HashTrieMap#keys()} still carries the map's values, so this must accept anything.
   */
  static final BinaryOperator KEEP_FIRST = (a, b) -> a;

  /**
   * @return a hash which doesn't depend on the order of iteration
   */
  public static <V> long hash(HashTrieSet<V> s, ToLongFunction<V> hash) {
    long result = 0;
    for (V v : s) {
      result = Hashing.combineUnordered(result, hash.applyAsLong(v));
    }
    return result;
  }

  /**
   * @return true, if both sets contain the same elements
   */
  public static <V> boolean equals(HashTrieSet<V> a, HashTrieSet<V> b) {
    return a == b || (a.size() == b.size() && containsAll(b, a));
  }

  /**
   * @return true, if {@code a} contains every element of {@code b}
   */
  public static <V> boolean containsAll(HashTrieSet<V> a, HashTrieSet<V> b) {
    for (V v : b) {
      if (!a.contains(v)) {
        return false;
      }
    }
    return true;
  }

  public static <V> String toString(HashTrieSet<V> s) {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    s.forEach(v -> joiner.add(String.valueOf(v)));
    return joiner.toString();
  }

  public static <V> Collector<V, ?, HashTrieSet<V>> collector() {
    Supplier<HashTrieMap.Linear<V, Void>> supplier = () -> HashTrieMap.<V, Void>empty().linear();
    BiConsumer<HashTrieMap.Linear<V, Void>, V> accumulator = (acc, v) -> acc.put(v, null, KEEP_FIRST);
    BinaryOperator<HashTrieMap.Linear<V, Void>> combiner = (x, y) -> x.forked().merge(y.forked(), KEEP_FIRST).linear();

    return Collector.of(supplier, accumulator, combiner, (HashTrieMap.Linear<V, Void> acc) -> new HashTrieSet<V>(acc.forked()), Collector.Characteristics.UNORDERED);
  }
}
