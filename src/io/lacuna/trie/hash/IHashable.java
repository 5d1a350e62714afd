package io.lacuna.trie.hash;

/**
 * A value which can provide its own 64-bit hash.  The hash must be consistent with {@code equals()}: two equal values
 * must always yield the same hash.
 * <p>
 * All collections in this library implement this interface, computing their hash from their contents, so that they
 * can be used as keys of other collections.
 *
 * @author ztellman
 */
public interface IHashable {

  /**
   * @return a 64-bit hash, consistent with {@code equals()}
   * @throws io.lacuna.trie.UnhashableValueException if the value contains something which cannot be hashed
   */
  long longHash();
}
