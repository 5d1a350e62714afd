package io.lacuna.trie;

import java.util.NoSuchElementException;

/**
 * Thrown when reading past the end of a collection, such as asking for the first element of an empty list.
 *
 * @author ztellman
 */
public class EmptyCollectionException extends NoSuchElementException {

  public EmptyCollectionException(String message) {
    super(message);
  }
}
