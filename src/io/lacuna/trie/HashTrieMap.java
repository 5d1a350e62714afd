package io.lacuna.trie;

import io.lacuna.trie.hash.Hashing;
import io.lacuna.trie.hash.IHashable;
import io.lacuna.trie.nodes.MapNodes;
import io.lacuna.trie.nodes.MapNodes.INode;
import io.lacuna.trie.nodes.MapNodes.Node;
import io.lacuna.trie.utils.Iterators;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.ToLongFunction;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * A persistent hash map, stored as the compressed hash trie described by Steindorfer and Vinju in
 * <a href=https://michael.steindorfer.name/publications/oopsla15.pdf>this paper</a> and keyed on all 64 bits of each
 * key's hash.  Hashing and key equality can be supplied by the caller, and default to {@link Hashing}.
 * <p>
 * Every update returns a new map, which shares all of its structure with the original except for the path from the
 * root to the changed entry.  The original map is never affected, and any number of threads may read a map without
 * coordination.
 * <p>
 * Two maps with the same keys always have the same trie layout, so equality and the set operations (union,
 * difference, intersection) work slot by slot instead of looking up each entry.
 *
 * @author ztellman
 */
@SuppressWarnings("unchecked")
public class HashTrieMap<K, V> implements ICollection<IEntry<K, V>>, IHashable {

  private static final HashTrieMap EMPTY = new HashTrieMap();

  private final ToLongFunction<K> hashFn;
  private final BiPredicate<K, K> equalsFn;
  final Node<K, V> root;

  private int hash = -1;
  private long longHash = -1;

  ///

  /**
   * @return a map containing the same entries as {@code map}
   */
  public static <K, V> HashTrieMap<K, V> from(java.util.Map<K, V> map) {
    Linear<K, V> result = HashTrieMap.<K, V>empty().linear();
    map.forEach((k, v) -> result.put(k, v, Maps.MERGE_LAST_WRITE_WINS));
    return result.forked();
  }

  /**
   * @param entries key/value pairs
   * @return a map containing the remaining entries, where later entries shadow earlier ones with the same key
   */
  public static <K, V> HashTrieMap<K, V> from(Iterator<IEntry<K, V>> entries) {
    Linear<K, V> result = HashTrieMap.<K, V>empty().linear();
    entries.forEachRemaining(e -> result.put(e.key(), e.value(), Maps.MERGE_LAST_WRITE_WINS));
    return result.forked();
  }

  /**
   * @param entries key/value pairs
   * @return a map containing the entries, where later entries shadow earlier ones with the same key
   */
  public static <K, V> HashTrieMap<K, V> from(Iterable<IEntry<K, V>> entries) {
    return from(entries.iterator());
  }

  public static <K, V> HashTrieMap<K, V> empty() {
    return (HashTrieMap<K, V>) EMPTY;
  }

  public HashTrieMap() {
    this(Node.EMPTY, Hashing.DEFAULT_HASH, Hashing.DEFAULT_EQUALS);
  }

  /**
   * @param hashFn   a function which yields the 64-bit hash value of keys
   * @param equalsFn decides whether two keys are the same
   */
  public HashTrieMap(ToLongFunction<K> hashFn, BiPredicate<K, K> equalsFn) {
    this(Node.EMPTY, hashFn, equalsFn);
  }

  private HashTrieMap(Node<K, V> root, ToLongFunction<K> hashFn, BiPredicate<K, K> equalsFn) {
    this.root = root;
    this.hashFn = hashFn;
    this.equalsFn = equalsFn;
  }

  ///

  /**
   * @return the function this map hashes keys with
   */
  public ToLongFunction<K> keyHash() {
    return hashFn;
  }

  /**
   * @return the predicate this map compares keys with
   */
  public BiPredicate<K, K> keyEquality() {
    return equalsFn;
  }

  /**
   * @return the value stored under {@code key}, or {@code defaultValue} if it's absent
   */
  public V get(K key, V defaultValue) {
    Object val = MapNodes.get(root, 0, keyHash(key), key, equalsFn, Maps.DEFAULT_VALUE);
    return val == Maps.DEFAULT_VALUE ? defaultValue : (V) val;
  }

  /**
   * @return an {@code Optional} containing the value under {@code key}, or nothing if the value is {@code null} or is
   * not contained within the map
   */
  public Optional<V> get(K key) {
    return Optional.ofNullable(get(key, null));
  }

  /**
   * @return the value under {@code key}
   * @throws KeyNotFoundException if there is no such key
   */
  public V getOrThrow(K key) {
    Object val = get(key, (V) Maps.DEFAULT_VALUE);
    if (val == Maps.DEFAULT_VALUE) {
      throw new KeyNotFoundException(key);
    }
    return (V) val;
  }

  /**
   * @return whether {@code key} is present
   */
  public boolean contains(K key) {
    return MapNodes.contains(root, 0, keyHash(key), key, equalsFn);
  }

  /**
   * @return a map where {@code key} maps to {@code value}, or this map if it already did
   */
  public HashTrieMap<K, V> insert(K key, V value) {
    if (get(key, (V) Maps.DEFAULT_VALUE) == value) {
      return this;
    }
    return insert(key, value, (BinaryOperator<V>) Maps.MERGE_LAST_WRITE_WINS);
  }

  /**
   * @param merge called with the existing value and then {@code value} when {@code key} is already present, and
   *              returns the value to store
   * @return a map with the combined value under {@code key}
   */
  public HashTrieMap<K, V> insert(K key, V value, BinaryOperator<V> merge) {
    Node<K, V> rootPrime = root.put(0, new Object(), keyHash(key), key, value, equalsFn, merge);
    return new HashTrieMap<>(rootPrime, hashFn, equalsFn);
  }

  /**
   * @param update a function which takes the current value under {@code key}, or {@code null} if there is none, and
   *               returns the new value
   * @return a map holding the returned value under {@code key}
   */
  public HashTrieMap<K, V> update(K key, UnaryOperator<V> update) {
    return insert(key, update.apply(get(key, null)), (BinaryOperator<V>) Maps.MERGE_LAST_WRITE_WINS);
  }

  /**
   * @return a map without {@code key}
   * @throws KeyNotFoundException if there is no such key
   */
  public HashTrieMap<K, V> remove(K key) {
    HashTrieMap<K, V> result = discard(key);
    if (result == this) {
      throw new KeyNotFoundException(key);
    }
    return result;
  }

  /**
   * @return a map without {@code key}, or this map if it was never present
   */
  public HashTrieMap<K, V> discard(K key) {
    INode<K, V> rootPrime = root.remove(0, new Object(), keyHash(key), key, equalsFn);
    return rootPrime == root ? this : new HashTrieMap<>((Node<K, V>) rootPrime, hashFn, equalsFn);
  }

  /**
   * @return a set of all keys in the map, which shares the map's structure
   */
  public HashTrieSet<K> keys() {
    return new HashTrieSet<K>((HashTrieMap<K, Void>) this);
  }

  /**
   * @return all values in the map, in the same order as the entries
   */
  public Iterable<V> values() {
    return () -> Iterators.map(iterator(), IEntry::value);
  }

  @Override
  public long size() {
    return root.size();
  }

  @Override
  public Iterator<IEntry<K, V>> iterator() {
    return root.iterator();
  }

  @Override
  public Stream<IEntry<K, V>> stream() {
    return Iterators.toStream(iterator(), size(), Spliterator.DISTINCT);
  }

  /**
   * @return every entry from either map, preferring the values of {@code m} for shared keys
   */
  public HashTrieMap<K, V> union(HashTrieMap<K, V> m) {
    return merge(m, (BinaryOperator<V>) Maps.MERGE_LAST_WRITE_WINS);
  }

  /**
   * @param mergeFn combines this map's value and {@code m}'s value for every shared key
   * @return every entry from either map
   */
  public HashTrieMap<K, V> merge(HashTrieMap<K, V> m, BinaryOperator<V> mergeFn) {
    if (m.size() == 0) {
      return this;
    } else if (Maps.equivEquality(this, m)) {
      Node<K, V> rootPrime = MapNodes.merge(0, new Object(), root, m.root, equalsFn, mergeFn);
      return new HashTrieMap<>(rootPrime, hashFn, equalsFn);
    } else {
      return Maps.merge(this, m, mergeFn);
    }
  }

  /**
   * @return the entries of this map whose keys are absent from {@code m}
   */
  public HashTrieMap<K, V> difference(HashTrieMap<K, ?> m) {
    if (Maps.equivEquality(this, m)) {
      INode<K, V> rootPrime = MapNodes.difference(0, new Object(), root, ((HashTrieMap<K, V>) m).root, equalsFn);
      return rootPrime == null ? new HashTrieMap<>(hashFn, equalsFn) : new HashTrieMap<>((Node<K, V>) rootPrime, hashFn, equalsFn);
    } else {
      return Maps.difference(this, m);
    }
  }

  /**
   * @return the entries of this map whose keys are absent from {@code keys}
   */
  public HashTrieMap<K, V> difference(HashTrieSet<K> keys) {
    return difference(keys.map);
  }

  /**
   * @return the entries of this map whose keys are also in {@code m}
   */
  public HashTrieMap<K, V> intersection(HashTrieMap<K, ?> m) {
    if (Maps.equivEquality(this, m)) {
      INode<K, V> rootPrime = MapNodes.intersection(0, new Object(), root, ((HashTrieMap<K, V>) m).root, equalsFn);
      return rootPrime == null ? new HashTrieMap<>(hashFn, equalsFn) : new HashTrieMap<>((Node<K, V>) rootPrime, hashFn, equalsFn);
    } else {
      return Maps.intersection(this, m);
    }
  }

  /**
   * @return the entries of this map whose keys are also in {@code keys}
   */
  public HashTrieMap<K, V> intersection(HashTrieSet<K> keys) {
    return intersection(keys.map);
  }

  /**
   * @return a hash which depends only on the entries, using {@link Hashing} for both keys and values
   * @throws UnhashableValueException if any key or value cannot be hashed
   */
  @Override
  public long longHash() {
    if (longHash == -1) {
      longHash = Maps.hash(this, Hashing::hash, Hashing::hash);
    }
    return longHash;
  }

  @Override
  public int hashCode() {
    if (hash == -1) {
      hash = (int) Maps.hash(this, Objects::hashCode, Objects::hashCode);
    }
    return hash;
  }

  /**
   * @param valEquals compares the values of each shared key
   * @return whether both maps hold the same keys, with matching values
   */
  public boolean equals(HashTrieMap<K, V> m, BiPredicate<V, V> valEquals) {
    if (Maps.equivEquality(this, m)) {
      return root.equals(m.root, equalsFn, valEquals);
    } else {
      return Maps.equals(this, m);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof HashTrieMap) {
      return equals((HashTrieMap<K, V>) obj, Objects::equals);
    }
    return false;
  }

  @Override
  public String toString() {
    return Maps.toString(this);
  }

  ///

  /**
   * @return a temporarily mutable copy of this map, which must be discarded once {@link Linear#forked()} is called
   */
  Linear<K, V> linear() {
    return new Linear<>(root, hashFn, equalsFn);
  }

  private long keyHash(K key) {
    return hashFn.applyAsLong(key);
  }

  /**
   * An accumulator which updates nodes in-place, as long as those nodes were created by the accumulator.  Used for
   * bulk construction, and never exposed outside the package.
   */
  static final class Linear<K, V> {

    private final ToLongFunction<K> hashFn;
    private final BiPredicate<K, K> equalsFn;
    private Node<K, V> root;
    private Object editor = new Object();

    Linear(Node<K, V> root, ToLongFunction<K> hashFn, BiPredicate<K, K> equalsFn) {
      this.root = root;
      this.hashFn = hashFn;
      this.equalsFn = equalsFn;
    }

    Linear<K, V> put(K key, V value, BinaryOperator<V> merge) {
      root = root.put(0, editor, hashFn.applyAsLong(key), key, value, equalsFn, merge);
      return this;
    }

    Linear<K, V> remove(K key) {
      root = (Node<K, V>) root.remove(0, editor, hashFn.applyAsLong(key), key, equalsFn);
      return this;
    }

    /**
     * @return an immutable map with the accumulated entries; further updates to this accumulator will not affect it
     */
    HashTrieMap<K, V> forked() {
      editor = new Object();
      return new HashTrieMap<>(root, hashFn, equalsFn);
    }
  }
}
