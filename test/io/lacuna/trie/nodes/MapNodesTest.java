package io.lacuna.trie.nodes;

import io.lacuna.trie.IEntry;
import io.lacuna.trie.nodes.MapNodes.Collision;
import io.lacuna.trie.nodes.MapNodes.INode;
import io.lacuna.trie.nodes.MapNodes.Node;
import org.junit.Test;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;

import static org.junit.Assert.*;

@SuppressWarnings("unchecked")
public class MapNodesTest {

  private static final BiPredicate<Long, Long> KEY_EQUALS = Objects::equals;
  private static final BiPredicate<String, String> VAL_EQUALS = Objects::equals;
  private static final BinaryOperator<String> LAST_WINS = (a, b) -> b;

  private static Node<Long, String> empty() {
    return Node.EMPTY;
  }

  private static long spread(long k) {
    return k * 0x9E3779B97F4A7C15L;
  }

  private static Node<Long, String> put(Node<Long, String> n, long hash, long key) {
    return n.put(0, new Object(), hash, key, "v" + key, KEY_EQUALS, LAST_WINS);
  }

  private static Node<Long, String> remove(Node<Long, String> n, long hash, long key) {
    return (Node<Long, String>) n.remove(0, new Object(), hash, key, KEY_EQUALS);
  }

  private static Object get(Node<Long, String> n, long hash, long key) {
    return MapNodes.get(n, 0, hash, key, KEY_EQUALS, null);
  }

  private static Node<Long, String> range(long start, long end) {
    Node<Long, String> n = empty();
    for (long k = start; k < end; k++) {
      n = put(n, spread(k), k);
    }
    return n;
  }

  private static boolean same(INode<Long, String> a, INode<Long, String> b) {
    return a.equals(b, KEY_EQUALS, VAL_EQUALS);
  }

  @Test
  public void test_put_and_get() {
    Node<Long, String> n = range(0, 1000);
    assertEquals(1000, n.size());
    for (long k = 0; k < 1000; k++) {
      assertEquals("v" + k, get(n, spread(k), k));
    }
    assertNull(get(n, spread(1000), 1000L));
    assertEquals(0, empty().size());
  }

  @Test
  public void test_lookup_compares_hashes() {
    Node<Long, String> n = put(empty(), 1, 1);

    // same slot, same key, different hash
    assertNull(get(n, 1 + (1L << 40), 1));
  }

  @Test
  public void test_shared_prefix_descends() {
    Node<Long, String> n = put(put(empty(), 1, 1), 33, 2);

    assertEquals(0, n.entryCount());
    INode<Long, String> child = n.child(1, 0);
    assertTrue(child instanceof Node);
    assertEquals(2, ((Node<Long, String>) child).entryCount());
    assertEquals("v1", get(n, 1, 1));
    assertEquals("v2", get(n, 33, 2));
  }

  @Test
  public void test_hashes_differing_in_last_bits() {
    long h1 = 5;
    long h2 = 5 | (1L << 63);
    Node<Long, String> n = put(put(empty(), h1, 1), h2, 2);

    assertEquals(2, n.size());
    assertEquals("v1", get(n, h1, 1));
    assertEquals("v2", get(n, h2, 2));

    Set<Long> keys = new HashSet<>();
    for (IEntry<Long, String> e : n) {
      keys.add(e.key());
    }
    assertEquals(2, keys.size());

    Node<Long, String> m = remove(n, h2, 2);
    assertEquals(1, m.size());
    assertEquals(1, m.entryCount());
    assertNull(m.child(h1, 0));
    assertTrue(same(put(empty(), h1, 1), m));
  }

  @Test
  public void test_collision() {
    Node<Long, String> n = put(put(empty(), 7, 1), 7, 2);

    assertEquals(2, n.size());
    assertTrue(n.child(7, 0) instanceof Collision);
    assertEquals("v1", get(n, 7, 1));
    assertEquals("v2", get(n, 7, 2));
    assertNull(get(n, 7, 3));

    Node<Long, String> m = remove(n, 7, 2);
    assertEquals(1, m.size());
    assertEquals(1, m.entryCount());
    assertNull(m.child(7, 0));
    assertEquals("v1", get(m, 7, 1));
  }

  @Test
  public void test_collision_collapses_after_remove() {
    Node<Long, String> collision = put(put(empty(), 7, 1), 7, 2);
    Node<Long, String> n = put(collision, 39, 3);

    assertTrue(n.child(7, 0) instanceof Node);
    assertTrue(((Node<Long, String>) n.child(7, 0)).child(7, 5) instanceof Collision);

    Node<Long, String> m = remove(n, 39, 3);
    assertTrue(m.child(7, 0) instanceof Collision);
    assertTrue(same(collision, m));
  }

  @Test
  public void test_remove_missing_returns_same_node() {
    Node<Long, String> n = range(0, 100);
    assertSame(n, n.remove(0, new Object(), spread(100), 100L, KEY_EQUALS));
    assertSame(n, n.remove(0, new Object(), spread(5) + 1, 5L, KEY_EQUALS));

    Node<Long, String> c = put(put(empty(), 7, 1), 7, 2);
    assertSame(c, c.remove(0, new Object(), 7, 3L, KEY_EQUALS));
  }

  @Test
  public void test_structural_sharing() {
    Node<Long, String> a = range(0, 1000);
    long hash = spread(1000);
    Node<Long, String> b = put(a, hash, 1000);

    assertEquals(1000, a.size());
    assertNull(get(a, hash, 1000));
    assertEquals(1001, b.size());

    for (long k = 0; k < 1000; k++) {
      long h = spread(k);
      if ((h & 31) != (hash & 31)) {
        assertSame(a.child(h, 0), b.child(h, 0));
      }
    }
  }

  @Test
  public void test_editor_allows_updates_in_place() {
    Object editor = new Object();
    Node<Long, String> a = empty().put(0, editor, 1, 1L, "a", KEY_EQUALS, LAST_WINS);
    Node<Long, String> b = a.put(0, editor, 2, 2L, "b", KEY_EQUALS, LAST_WINS);

    assertNotSame(empty(), a);
    assertSame(a, b);
    assertEquals(0, empty().size());

    Node<Long, String> c = b.put(0, new Object(), 3, 3L, "c", KEY_EQUALS, LAST_WINS);
    assertNotSame(b, c);
    assertEquals(2, b.size());
    assertEquals(3, c.size());
  }

  @Test
  public void test_canonical_shape() {
    Node<Long, String> forward = range(0, 500);
    Node<Long, String> backward = empty();
    for (long k = 499; k >= 0; k--) {
      backward = put(backward, spread(k), k);
    }
    assertTrue(same(forward, backward));

    Node<Long, String> shrunk = range(0, 1000);
    for (long k = 500; k < 1000; k++) {
      shrunk = remove(shrunk, spread(k), k);
    }
    assertTrue(same(forward, shrunk));
    assertFalse(same(forward, remove(shrunk, spread(0), 0L)));
  }

  @Test
  public void test_set_operations() {
    Node<Long, String> a = range(0, 600);
    Node<Long, String> b = range(400, 1000);

    Node<Long, String> union = MapNodes.merge(0, new Object(), a, b, KEY_EQUALS, LAST_WINS);
    assertTrue(same(range(0, 1000), union));

    INode<Long, String> diff = MapNodes.difference(0, new Object(), a, b, KEY_EQUALS);
    assertTrue(same(range(0, 400), diff));

    INode<Long, String> inter = MapNodes.intersection(0, new Object(), a, b, KEY_EQUALS);
    assertTrue(same(range(400, 600), inter));

    assertNull(MapNodes.difference(0, new Object(), a, a, KEY_EQUALS));
    assertNull(MapNodes.intersection(0, new Object(), range(0, 10), range(10, 20), KEY_EQUALS));

    // the inputs are untouched
    assertTrue(same(range(0, 600), a));
    assertTrue(same(range(400, 1000), b));
  }

  @Test
  public void test_set_operations_with_collisions() {
    Node<Long, String> a = put(put(put(empty(), 7, 1), 7, 2), 8, 3);
    Node<Long, String> b = put(put(empty(), 7, 2), 7, 4);

    Node<Long, String> union = MapNodes.merge(0, new Object(), a, b, KEY_EQUALS, LAST_WINS);
    assertEquals(4, union.size());
    assertEquals("v4", get(union, 7, 4));

    INode<Long, String> diff = MapNodes.difference(0, new Object(), a, b, KEY_EQUALS);
    assertTrue(same(put(put(empty(), 7, 1), 8, 3), diff));

    INode<Long, String> inter = MapNodes.intersection(0, new Object(), a, b, KEY_EQUALS);
    assertTrue(same(put(empty(), 7, 2), inter));
  }

  @Test
  public void test_set_operations_across_entry_and_child() {
    // 1 and 33 share a slot at the root, so they sit in a child
    Node<Long, String> a = put(put(empty(), 1, 1), 33, 33);
    Node<Long, String> b = empty().put(0, new Object(), 33, 33L, "b", KEY_EQUALS, LAST_WINS);

    Node<Long, String> union = MapNodes.merge(0, new Object(), a, b, KEY_EQUALS, LAST_WINS);
    assertEquals(2, union.size());
    assertEquals("b", get(union, 33, 33));
    assertEquals("v33", get(MapNodes.merge(0, new Object(), b, a, KEY_EQUALS, LAST_WINS), 33, 33));

    INode<Long, String> inter = MapNodes.intersection(0, new Object(), a, b, KEY_EQUALS);
    assertTrue(same(put(empty(), 33, 33), inter));

    INode<Long, String> diff = MapNodes.difference(0, new Object(), a, b, KEY_EQUALS);
    assertTrue(same(put(empty(), 1, 1), diff));
    assertEquals(1, ((Node<Long, String>) diff).entryCount());
  }

  @Test
  public void test_nth() {
    Node<Long, String> n = range(0, 100);
    Set<Long> keys = new HashSet<>();
    for (long i = 0; i < n.size(); i++) {
      keys.add(n.nth(i).key());
    }
    assertEquals(100, keys.size());

    try {
      n.nth(100);
      fail("read past the end of a node");
    } catch (IndexOutOfBoundsException e) {
      // ok
    }
  }
}
