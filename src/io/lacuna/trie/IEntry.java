package io.lacuna.trie;

/**
 * A key/value pair, as yielded when iterating over a {@link HashTrieMap}.
 *
 * @author ztellman
 */
public interface IEntry<K, V> {

  static <K, V> IEntry<K, V> of(K key, V value) {
    return new Maps.Entry<>(key, value);
  }

  K key();

  V value();
}
