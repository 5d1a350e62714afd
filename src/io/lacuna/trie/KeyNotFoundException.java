package io.lacuna.trie;

import java.util.NoSuchElementException;

/**
 * Thrown when an operation requires a key to be present, and it isn't.
 *
 * @author ztellman
 */
public class KeyNotFoundException extends NoSuchElementException {

  private final transient Object key;

  public KeyNotFoundException(Object key) {
    super(String.valueOf(key));
    this.key = key;
  }

  /**
   * @return the missing key
   */
  public Object key() {
    return key;
  }
}
