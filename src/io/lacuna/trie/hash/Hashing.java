package io.lacuna.trie.hash;

import io.lacuna.trie.UnhashableValueException;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.ToLongFunction;

/**
 * The default hashing and equality semantics for keys.  Values are dispatched on their type to produce a 64-bit hash
 * which is consistent with {@link Objects#equals(Object, Object)}:
 * <ul>
 *   <li>{@link IHashable} values provide their own hash, which for collections is computed from their contents</li>
 *   <li>strings, boxed numbers, and characters are hashed by value</li>
 *   <li>arrays and mutable JDK collections are rejected with {@link UnhashableValueException}</li>
 *   <li>everything else is hashed via {@code hashCode()}</li>
 * </ul>
 *
 * @author ztellman
 */
public class Hashing {

  private static final long NULL_HASH = 0x9E3779B97F4A7C15L;

  private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
  private static final long FNV_PRIME = 0x100000001b3L;

  public static final ToLongFunction DEFAULT_HASH = Hashing::hash;

  public static final BiPredicate DEFAULT_EQUALS = Hashing::equals;

  /**
   * @return a 64-bit hash of {@code value}
   * @throws UnhashableValueException if the value has no stable hash
   */
  public static long hash(Object value) {
    if (value == null) {
      return NULL_HASH;
    } else if (value instanceof IHashable) {
      return ((IHashable) value).longHash();
    } else if (value instanceof String) {
      return hash((String) value);
    } else if (value instanceof Long
      || value instanceof Integer
      || value instanceof Short
      || value instanceof Byte) {
      return mix(((Number) value).longValue());
    } else if (value instanceof Double) {
      return mix(Double.doubleToLongBits((Double) value));
    } else if (value instanceof Float) {
      return mix(Float.floatToIntBits((Float) value));
    } else if (value instanceof Character) {
      return mix((Character) value);
    } else if (!isHashable(value)) {
      throw new UnhashableValueException(value.getClass());
    } else {
      return mix(value.hashCode());
    }
  }

  /**
   * @return a 64-bit FNV-1a hash of the string's characters, passed through {@link #mix(long)}
   */
  public static long hash(String s) {
    long h = FNV_OFFSET_BASIS;
    for (int i = 0; i < s.length(); i++) {
      h ^= s.charAt(i);
      h *= FNV_PRIME;
    }
    return mix(h);
  }

  /**
   * @return true, if {@code a} and {@code b} are equivalent
   */
  public static boolean equals(Object a, Object b) {
    return Objects.equals(a, b);
  }

  /**
   * Checks whether a value can be hashed.  This only inspects the value itself, not anything it contains.
   *
   * @return false, if the value is an array or a mutable JDK collection, true otherwise
   */
  public static boolean isHashable(Object value) {
    if (value == null || value instanceof IHashable) {
      return true;
    }
    return !(value.getClass().isArray()
      || value instanceof java.util.Collection
      || value instanceof java.util.Map);
  }

  /**
   * The 64-bit finalizer from MurmurHash3, which ensures every input bit affects every output bit.
   */
  public static long mix(long h) {
    h ^= h >>> 33;
    h *= 0xff51afd7ed558ccdL;
    h ^= h >>> 33;
    h *= 0xc4ceb9fe1a85ec53L;
    h ^= h >>> 33;
    return h;
  }

  /**
   * @return the accumulated hash of an ordered sequence, after appending an element with hash {@code h}
   */
  public static long combineOrdered(long acc, long h) {
    return (acc * 31) + h;
  }

  /**
   * @return the accumulated hash of an unordered collection, after adding an element with hash {@code h}
   */
  public static long combineUnordered(long acc, long h) {
    return acc + mix(h);
  }
}
