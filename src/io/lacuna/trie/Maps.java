package io.lacuna.trie;

import io.lacuna.trie.hash.Hashing;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;
import java.util.stream.Collector;

/**
 * Utility functions for {@link HashTrieMap}.
 *
 * @author ztellman
 */
@SuppressWarnings("unchecked")
public class Maps {

  static final Object DEFAULT_VALUE = new Object();

  public static final BinaryOperator MERGE_LAST_WRITE_WINS = (a, b) -> b;

  /**
   * An immutable key/value pair, equal to any other {@link IEntry} with equal key and value.
   */
  public static class Entry<K, V> implements IEntry<K, V> {
    private final K key;
    private final V value;

    public Entry(K key, V value) {
      this.key = key;
      this.value = value;
    }

    @Override
    public K key() {
      return key;
    }

    @Override
    public V value() {
      return value;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(key) * 31 + Objects.hashCode(value);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      } else if (!(obj instanceof IEntry)) {
        return false;
      }
      IEntry<?, ?> e = (IEntry<?, ?>) obj;
      return Objects.equals(key, e.key()) && Objects.equals(value, e.value());
    }

    @Override
    public String toString() {
      return key + " = " + value;
    }
  }

  /**
   * @return the entries as {@code {k1 v1, k2 v2}}, in iteration order
   */
  public static <K, V> String toString(HashTrieMap<K, V> m) {
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    m.forEach(e -> joiner.add(e.key() + " " + e.value()));
    return joiner.toString();
  }

  /**
   * @return a hash which doesn't depend on the order of iteration, combining each key's hash with its value's hash
   */
  public static <K, V> long hash(HashTrieMap<K, V> m, ToLongFunction<K> keyHash, ToLongFunction<V> valHash) {
    long hash = 0;
    for (IEntry<K, V> e : m) {
      hash = Hashing.combineUnordered(hash, (keyHash.applyAsLong(e.key()) * 31) ^ valHash.applyAsLong(e.value()));
    }
    return hash;
  }

  /**
   * Checks equality by lookup rather than by layout, so the maps may use different hash functions.  Keys are matched
   * using the semantics of {@code b}.
   *
   * @return true, if both maps contain the same keys, with equal values
   */
  public static <K, V> boolean equals(HashTrieMap<K, V> a, HashTrieMap<K, V> b) {
    if (a == b) {
      return true;
    } else if (a.size() != b.size()) {
      return false;
    }

    HashTrieMap<K, Object> m = (HashTrieMap<K, Object>) b;
    for (IEntry<K, V> e : a) {
      Object val = m.get(e.key(), DEFAULT_VALUE);
      if (val == DEFAULT_VALUE || !Objects.equals(val, e.value())) {
        return false;
      }
    }
    return true;
  }

  static <K> boolean equivEquality(HashTrieMap<K, ?> a, HashTrieMap<K, ?> b) {
    return a.keyHash() == b.keyHash() && a.keyEquality() == b.keyEquality();
  }

  // entry-by-entry fallbacks, for maps whose tries can't be combined directly

  static <K, V> HashTrieMap<K, V> merge(HashTrieMap<K, V> a, HashTrieMap<K, V> b, BinaryOperator<V> mergeFn) {
    HashTrieMap.Linear<K, V> acc = a.linear();
    b.forEach(e -> acc.put(e.key(), e.value(), mergeFn));
    return acc.forked();
  }

  static <K, V> HashTrieMap<K, V> difference(HashTrieMap<K, V> a, HashTrieMap<K, ?> b) {
    HashTrieMap.Linear<K, V> acc = a.linear();
    b.forEach(e -> acc.remove(e.key()));
    return acc.forked();
  }

  static <K, V> HashTrieMap<K, V> intersection(HashTrieMap<K, V> a, HashTrieMap<K, ?> b) {
    HashTrieMap.Linear<K, V> acc = new HashTrieMap<K, V>(a.keyHash(), a.keyEquality()).linear();
    for (IEntry<K, V> e : a) {
      if (b.contains(e.key())) {
        acc.put(e.key(), e.value(), MERGE_LAST_WRITE_WINS);
      }
    }
    return acc.forked();
  }

  public static <T, K, V> Collector<T, ?, HashTrieMap<K, V>> collector(Function<T, K> keyFn, Function<T, V> valFn) {
    return collector(keyFn, valFn, (BinaryOperator<V>) MERGE_LAST_WRITE_WINS);
  }

  /**
   * @param mergeFn combines the values of elements which map to the same key, earlier value first
   */
  public static <T, K, V> Collector<T, ?, HashTrieMap<K, V>> collector(
    Function<T, K> keyFn,
    Function<T, V> valFn,
    BinaryOperator<V> mergeFn) {

    Supplier<HashTrieMap.Linear<K, V>> supplier = () -> HashTrieMap.<K, V>empty().linear();
    BiConsumer<HashTrieMap.Linear<K, V>, T> accumulator = (acc, t) -> acc.put(keyFn.apply(t), valFn.apply(t), mergeFn);
    BinaryOperator<HashTrieMap.Linear<K, V>> combiner = (x, y) -> x.forked().merge(y.forked(), mergeFn).linear();

    return Collector.of(supplier, accumulator, combiner, HashTrieMap.Linear::forked, Collector.Characteristics.UNORDERED);
  }
}
