package io.lacuna.trie;

/**
 * Thrown when a value is used as a key, but cannot provide a stable hash.  Arrays and the mutable JDK collections fall
 * into this category.
 *
 * @author ztellman
 */
public class UnhashableValueException extends IllegalArgumentException {

  private final Class<?> type;

  public UnhashableValueException(Class<?> type) {
    super("unhashable type: " + type.getName());
    this.type = type;
  }

  /**
   * @return the class of the value which couldn't be hashed
   */
  public Class<?> type() {
    return type;
  }
}
