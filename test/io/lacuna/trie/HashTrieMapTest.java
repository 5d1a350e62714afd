package io.lacuna.trie;

import org.junit.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class HashTrieMapTest extends HashTrieMapTestBase {

  static class NormalKey implements Key {
    final int value;

    NormalKey(int value) {
      this.value = value;
    }

    public int hashCode() {
      return value;
    }

    public boolean equals(Object obj) {
      return (obj instanceof NormalKey)
          && value == ((NormalKey) obj).value;
    }

    public String toString() {
      return String.valueOf(value);
    }
  }

  @Override
  protected Key newKey(int value) {
    return new NormalKey(value);
  }

  private static HashTrieMap<String, Object> fooBar() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("foo", "bar");
    m.put("baz", "quux");
    return HashTrieMap.from(m);
  }

  @Test
  public void test_insert_string_keys() {
    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("foo", "bar");
    expected.put("baz", "quux");
    expected.put("spam", 37);

    assertEquals(HashTrieMap.from(expected), fooBar().insert("spam", 37));
  }

  @Test
  public void test_remove_string_keys() {
    assertEquals(HashTrieMap.empty().insert("baz", "quux"), fooBar().remove("foo"));

    try {
      fooBar().remove("missing");
      fail("removed a missing key");
    } catch (KeyNotFoundException e) {
      assertEquals("missing", e.key());
      assertEquals("missing", e.getMessage());
    }
  }

  @Test
  public void test_from_entries() {
    HashTrieMap<String, Object> m = HashTrieMap.from(List.of(
        IEntry.<String, Object>of("foo", "bar"),
        IEntry.<String, Object>of("baz", "quux"),
        IEntry.<String, Object>of("foo", "shadowed")));

    assertEquals(2, m.size());
    assertEquals("shadowed", m.getOrThrow("foo"));
  }

  @Test
  public void test_collector() {
    HashTrieMap<Integer, String> m = java.util.stream.IntStream.range(0, 100)
        .boxed()
        .collect(Maps.collector(i -> i, String::valueOf));

    assertEquals(100, m.size());
    assertEquals("42", m.getOrThrow(42));

    HashTrieMap<Integer, Integer> counts = java.util.stream.IntStream.range(0, 100)
        .boxed()
        .collect(Maps.collector(i -> i % 10, i -> 1, Integer::sum));
    assertEquals(10, counts.size());
    assertEquals(10, (int) counts.getOrThrow(3));
  }

  @Test
  public void test_to_string() {
    assertEquals("{}", HashTrieMap.empty().toString());
    assertEquals("{a 1}", HashTrieMap.empty().insert("a", 1).toString());
  }

  @Test
  public void test_nested_collections_as_keys() {
    HashTrieMap<Object, String> m = HashTrieMap.empty();
    m = m.insert(List.of(1, 2, 3), "list")
        .insert(HashTrieSet.of("a", "b"), "set")
        .insert(fooBar(), "map");

    assertEquals("list", m.getOrThrow(List.of(1, 2, 3)));
    assertEquals("set", m.getOrThrow(HashTrieSet.of("b", "a")));
    assertEquals("map", m.getOrThrow(HashTrieMap.<String, Object>empty().insert("baz", "quux").insert("foo", "bar")));
    assertFalse(m.contains(List.of(3, 2, 1)));
  }

  @Test
  public void test_long_hash() {
    assertEquals(fooBar().longHash(), HashTrieMap.<String, Object>empty().insert("baz", "quux").insert("foo", "bar").longHash());
    assertNotEquals(fooBar().longHash(), fooBar().insert("foo", "baz").longHash());
  }

  @Test
  public void test_long_hash_is_cached() {
    HashTrieSetTest.CountingKey k = new HashTrieSetTest.CountingKey();
    HashTrieMap<Object, Object> m = HashTrieMap.empty().insert(k, "value");

    long hash = m.longHash();
    int count = k.count;
    assertEquals(hash, m.longHash());
    assertEquals(count, k.count);

    // a nested key is hashed once per lookup, not once per element
    HashTrieMap<Object, String> outer = HashTrieMap.<Object, String>empty().insert(m, "nested");
    count = k.count;
    assertEquals("nested", outer.getOrThrow(m));
    assertEquals(count, k.count);
  }

  @Test
  public void test_unhashable_keys() {
    try {
      HashTrieMap.empty().insert(new int[]{1, 2}, 1);
      fail("inserted an array key");
    } catch (UnhashableValueException e) {
      assertEquals(int[].class, e.type());
    }

    try {
      HashTrieMap.empty().insert(new ArrayList<>(), 1);
      fail("inserted a mutable list key");
    } catch (UnhashableValueException e) {
      assertEquals(ArrayList.class, e.type());
    }
  }

  @Test
  public void test_custom_equality() {
    HashTrieMap<String, Integer> m = new HashTrieMap<String, Integer>(
        s -> s.toLowerCase().hashCode(),
        String::equalsIgnoreCase);
    m = m.insert("Foo", 1).insert("FOO", 2);

    assertEquals(1, m.size());
    assertEquals(2, (int) m.getOrThrow("foo"));

    // with different semantics on each side, the receiver's semantics decide which keys match
    HashTrieMap<String, Integer> n = HashTrieMap.<String, Integer>empty().insert("foo", 3);
    assertEquals(1, m.union(n).size());
    assertEquals(3, (int) m.union(n).getOrThrow("FOO"));
    assertEquals(2, n.union(m).size());
    assertTrue(m.difference(n).isEmpty());
    assertEquals(n, n.difference(m));
  }
}
