package io.lacuna.trie;

import io.lacuna.trie.hash.Hashing;
import io.lacuna.trie.hash.IHashable;
import io.lacuna.trie.utils.Iterators;

import java.util.Iterator;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.ToLongFunction;
import java.util.stream.Stream;

/**
 * A set which builds atop {@link HashTrieMap}, and shares the same performance characteristics.
 *
 * @author ztellman
 */
@SuppressWarnings("unchecked")
public class HashTrieSet<V> implements ICollection<V>, IHashable {

  private static final HashTrieSet EMPTY = new HashTrieSet();

  final HashTrieMap<V, Void> map;

  private int hash = -1;
  private long longHash = -1;

  /**
   * @return a set of every value {@code iterator} has left
   */
  public static <V> HashTrieSet<V> from(Iterator<V> iterator) {
    HashTrieMap.Linear<V, Void> set = HashTrieMap.<V, Void>empty().linear();
    iterator.forEachRemaining(v -> set.put(v, null, Sets.KEEP_FIRST));
    return new HashTrieSet<>(set.forked());
  }

  /**
   * @return a set of every value in {@code iterable}
   */
  public static <V> HashTrieSet<V> from(Iterable<V> iterable) {
    return from(iterable.iterator());
  }

  @SafeVarargs
  public static <V> HashTrieSet<V> of(V... elements) {
    HashTrieMap.Linear<V, Void> set = HashTrieMap.<V, Void>empty().linear();
    for (V e : elements) {
      set.put(e, null, Sets.KEEP_FIRST);
    }
    return new HashTrieSet<>(set.forked());
  }

  public static <V> HashTrieSet<V> empty() {
    return (HashTrieSet<V>) EMPTY;
  }

  public HashTrieSet() {
    this(HashTrieMap.empty());
  }

  /**
   * @param hashFn   hashes each element
   * @param equalsFn decides whether two elements are the same
   */
  public HashTrieSet(ToLongFunction<V> hashFn, BiPredicate<V, V> equalsFn) {
    this(new HashTrieMap<>(hashFn, equalsFn));
  }

  HashTrieSet(HashTrieMap<V, Void> map) {
    this.map = map;
  }

  ///

  /**
   * @return the function this set hashes elements with
   */
  public ToLongFunction<V> valueHash() {
    return map.keyHash();
  }

  /**
   * @return the predicate this set compares elements with
   */
  public BiPredicate<V, V> valueEquality() {
    return map.keyEquality();
  }

  /**
   * @return whether {@code value} is an element
   */
  public boolean contains(V value) {
    return map.contains(value);
  }

  @Override
  public long size() {
    return map.size();
  }

  /**
   * @return the set, containing {@code value}, or this same set if {@code value} is already present
   */
  public HashTrieSet<V> insert(V value) {
    if (map.contains(value)) {
      return this;
    }
    return new HashTrieSet<>(map.insert(value, null, (BinaryOperator<Void>) Sets.KEEP_FIRST));
  }

  /**
   * @return a set without {@code value}
   * @throws KeyNotFoundException if {@code value} isn't in the set
   */
  public HashTrieSet<V> remove(V value) {
    return new HashTrieSet<>(map.remove(value));
  }

  /**
   * @return the set, without {@code value}, or this same set if {@code value} isn't present
   */
  public HashTrieSet<V> discard(V value) {
    HashTrieMap<V, Void> mapPrime = map.discard(value);
    return map == mapPrime ? this : new HashTrieSet<>(mapPrime);
  }

  @Override
  public Iterator<V> iterator() {
    return Iterators.map(map.iterator(), IEntry::key);
  }

  @Override
  public Stream<V> stream() {
    return Iterators.toStream(iterator(), size(), Spliterator.DISTINCT);
  }

  /**
   * @return a new set, representing the union with {@code s}
   */
  public HashTrieSet<V> union(HashTrieSet<V> s) {
    if (s.size() == 0) {
      return this;
    } else if (size() == 0) {
      return s;
    }
    return new HashTrieSet<>(map.merge(s.map, (BinaryOperator<Void>) Sets.KEEP_FIRST));
  }

  /**
   * @return a new set, representing the difference with {@code s}
   */
  public HashTrieSet<V> difference(HashTrieSet<V> s) {
    return new HashTrieSet<>(map.difference(s.map));
  }

  /**
   * @return a new set, representing the intersection with {@code s}
   */
  public HashTrieSet<V> intersection(HashTrieSet<V> s) {
    return new HashTrieSet<>(map.intersection(s.map));
  }

  /**
   * @return a new set, containing the elements which are in exactly one of the two sets
   */
  public HashTrieSet<V> symmetricDifference(HashTrieSet<V> s) {
    return difference(s).union(s.difference(this));
  }

  /**
   * @return true, if every element of this set is also in {@code s}
   */
  public boolean isSubsetOf(HashTrieSet<V> s) {
    return size() <= s.size() && Sets.containsAll(s, this);
  }

  /**
   * @return true, if every element of {@code s} is also in this set
   */
  public boolean isSupersetOf(HashTrieSet<V> s) {
    return s.isSubsetOf(this);
  }

  /**
   * @return a hash which depends only on the elements, using {@link Hashing}
   * @throws UnhashableValueException if any element cannot be hashed
   */
  @Override
  public long longHash() {
    if (longHash == -1) {
      longHash = Sets.hash(this, Hashing::hash);
    }
    return longHash;
  }

  @Override
  public int hashCode() {
    if (hash == -1) {
      hash = (int) Sets.hash(this, Objects::hashCode);
    }
    return hash;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof HashTrieSet) {
      HashTrieSet<V> s = (HashTrieSet<V>) obj;
      if (Maps.equivEquality(map, s.map)) {
        // only the keys matter, and a set of map keys still holds the map's values
        return ((HashTrieMap) map).equals(s.map, (BiPredicate<Object, Object>) (a, b) -> true);
      } else {
        return Sets.equals(this, s);
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return Sets.toString(this);
  }
}
