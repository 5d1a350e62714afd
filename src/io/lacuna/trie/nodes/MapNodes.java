package io.lacuna.trie.nodes;

import io.lacuna.trie.IEntry;
import io.lacuna.trie.Maps;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;

import static java.lang.System.arraycopy;

/**
 * A compressed hash-array mapped prefix trie (CHAMP), as described by Steindorfer and Vinju in
 * https://michael.steindorfer.name/publications/oopsla15.pdf, keyed on 64-bit hashes.
 * <p>
 * Each {@link Node} consumes five bits of the hash.  A slot either holds an entry inline, marked in {@code datamap}, or
 * a child node, marked in {@code nodemap}.  Keys whose hashes are identical in all 64 bits share a {@link Collision}.
 * <p>
 * A node may only be modified in-place by the {@code editor} which created it.  Every other update copies the node
 * first, so a node reachable from a published collection never changes.
 * <p>
 * The layout of a trie depends only on the keys it holds: below the root, a node has at least two entries and is never
 * just a wrapper around a single collision.  Every operation here restores that, so two tries can be compared slot by
 * slot.
 *
 * @author ztellman
 */
@SuppressWarnings("unchecked")
public class MapNodes {

  static final int BITS = 5;

  /**
   * The number of levels needed to consume all 64 bits of a hash.
   */
  static final int MAX_DEPTH = (Long.SIZE + BITS - 1) / BITS;

  private static final Object[] NO_OBJECTS = new Object[0];
  private static final long[] NO_HASHES = new long[0];

  public interface INode<K, V> {

    INode<K, V> put(int shift, Object editor, long hash, K key, V value, BiPredicate<K, K> equals, BinaryOperator<V> merge);

    /**
     * @return the node without {@code key}, or this same node if the key isn't present
     */
    INode<K, V> remove(int shift, Object editor, long hash, K key, BiPredicate<K, K> equals);

    /**
     * @return the hash of the {@code idx}-th entry stored directly in this node
     */
    long hash(int idx);

    long size();

    IEntry<K, V> nth(long idx);

    boolean equals(INode<K, V> n, BiPredicate<K, K> keyEquals, BiPredicate<V, V> valEquals);
  }

  public static class Node<K, V> implements INode<K, V>, Iterable<IEntry<K, V>> {

    public static final Node EMPTY = new Node(new Object());

    private final Object editor;

    int datamap;
    int nodemap;
    long size;

    // one slot per inline entry, in bit order
    long[] hashes = NO_HASHES;
    Object[] keys = NO_OBJECTS;
    Object[] values = NO_OBJECTS;

    // one slot per child, in bit order
    Object[] children = NO_OBJECTS;

    Node(Object editor) {
      this.editor = editor;
    }

    // lookup

    @Override
    public long size() {
      return size;
    }

    @Override
    public long hash(int idx) {
      return hashes[idx];
    }

    @Override
    public IEntry<K, V> nth(long idx) {
      if (idx < 0 || idx >= size) {
        throw new IndexOutOfBoundsException(idx + " must be within [0," + size + ")");
      }

      if (idx < keys.length) {
        int i = (int) idx;
        return new Maps.Entry<>((K) keys[i], (V) values[i]);
      }

      idx -= keys.length;
      for (Object c : children) {
        INode<K, V> child = (INode<K, V>) c;
        if (idx < child.size()) {
          return child.nth(idx);
        }
        idx -= child.size();
      }

      throw new IllegalStateException();
    }

    /**
     * @return the number of entries stored directly within this node
     */
    int entryCount() {
      return keys.length;
    }

    /**
     * @return the child under the slot {@code hash} selects at {@code shift}, or null if there isn't one
     */
    INode<K, V> child(long hash, int shift) {
      int bit = bit(hash, shift);
      return (nodemap & bit) != 0 ? childAt(bit) : null;
    }

    // updates

    @Override
    public Node<K, V> put(int shift, Object editor, long hash, K key, V value, BiPredicate<K, K> equals, BinaryOperator<V> merge) {
      int bit = bit(hash, shift);

      if ((datamap & bit) != 0) {
        int i = index(datamap, bit);
        K currKey = (K) keys[i];
        V currValue = (V) values[i];

        if (hashes[i] == hash && equals.test(key, currKey)) {
          Node<K, V> n = editable(editor);
          n.values[i] = merge.apply(currValue, value);
          return n;
        }

        // the slot is taken, so both entries move down a level
        INode<K, V> child = hashes[i] == hash
          ? new Collision<K, V>(hash, new Object[] {currKey, key}, new Object[] {currValue, value})
          : new Node<K, V>(editor)
            .addEntry(bit(hashes[i], shift + BITS), hashes[i], currKey, currValue)
            .put(shift + BITS, editor, hash, key, value, equals, merge);

        return editable(editor).removeEntry(bit).addChild(bit, child);

      } else if ((nodemap & bit) != 0) {
        INode<K, V> child = childAt(bit);
        long prevSize = child.size();
        INode<K, V> childPrime = child.put(shift + BITS, editor, hash, key, value, equals, merge);

        Node<K, V> n = editable(editor);
        n.children[index(nodemap, bit)] = childPrime;
        n.size += childPrime.size() - prevSize;
        return n;

      } else {
        return editable(editor).addEntry(bit, hash, key, value);
      }
    }

    @Override
    public INode<K, V> remove(int shift, Object editor, long hash, K key, BiPredicate<K, K> equals) {
      int bit = bit(hash, shift);

      if ((datamap & bit) != 0) {
        int i = index(datamap, bit);
        if (hashes[i] != hash || !equals.test(key, (K) keys[i])) {
          return this;
        }
        return editable(editor).removeEntry(bit).canonical(shift);

      } else if ((nodemap & bit) != 0) {
        INode<K, V> child = childAt(bit);
        long prevSize = child.size();
        INode<K, V> childPrime = child.remove(shift + BITS, editor, hash, key, equals);
        if (childPrime.size() == prevSize) {
          return this;
        }

        Node<K, V> n = editable(editor).removeChild(bit, prevSize);
        if (childPrime.size() > 0) {
          n.addChild(bit, childPrime);
        }
        return n.canonical(shift);

      } else {
        return this;
      }
    }

    // iteration

    @Override
    public Iterator<IEntry<K, V>> iterator() {
      return new EntryIterator<>(this);
    }

    // misc

    @Override
    public boolean equals(INode<K, V> o, BiPredicate<K, K> keyEquals, BiPredicate<V, V> valEquals) {
      if (this == o) {
        return true;
      } else if (!(o instanceof Node)) {
        return false;
      }

      Node<K, V> n = (Node<K, V>) o;
      if (n.size != size || n.datamap != datamap || n.nodemap != nodemap) {
        return false;
      }

      for (int i = 0; i < keys.length; i++) {
        if (hashes[i] != n.hashes[i]
          || !keyEquals.test((K) keys[i], (K) n.keys[i])
          || !valEquals.test((V) values[i], (V) n.values[i])) {
          return false;
        }
      }

      for (int i = 0; i < children.length; i++) {
        if (!((INode<K, V>) children[i]).equals((INode<K, V>) n.children[i], keyEquals, valEquals)) {
          return false;
        }
      }

      return true;
    }

    ///

    private Node<K, V> editable(Object editor) {
      if (editor == this.editor) {
        return this;
      }

      Node<K, V> n = new Node<>(editor);
      n.datamap = datamap;
      n.nodemap = nodemap;
      n.size = size;
      n.hashes = hashes.clone();
      n.keys = keys.clone();
      n.values = values.clone();
      n.children = children.clone();
      return n;
    }

    /**
     * @return the single collision beneath this node, if that's all it holds, otherwise the node itself
     */
    private INode<K, V> canonical(int shift) {
      if (shift > 0 && keys.length == 0 && children.length == 1 && children[0] instanceof Collision) {
        return (INode<K, V>) children[0];
      }
      return this;
    }

    private boolean occupies(int bit) {
      return ((datamap | nodemap) & bit) != 0;
    }

    private boolean hasEntry(int bit) {
      return (datamap & bit) != 0;
    }

    private INode<K, V> childAt(int bit) {
      return (INode<K, V>) children[index(nodemap, bit)];
    }

    // these modify the node in-place, and may only be called on a node owned by the current editor

    private Node<K, V> addEntry(int bit, long hash, K key, V value) {
      int i = index(datamap, bit);
      hashes = grow(hashes, i, hash);
      keys = grow(keys, i, key);
      values = grow(values, i, value);
      datamap |= bit;
      size++;
      return this;
    }

    private Node<K, V> removeEntry(int bit) {
      int i = index(datamap, bit);
      hashes = shrink(hashes, i);
      keys = shrink(keys, i);
      values = shrink(values, i);
      datamap &= ~bit;
      size--;
      return this;
    }

    private Node<K, V> addChild(int bit, INode<K, V> child) {
      if (child.size() == 1) {
        IEntry<K, V> e = child.nth(0);
        return addEntry(bit, child.hash(0), e.key(), e.value());
      }

      children = grow(children, index(nodemap, bit), child);
      nodemap |= bit;
      size += child.size();
      return this;
    }

    private Node<K, V> removeChild(int bit, long childSize) {
      children = shrink(children, index(nodemap, bit));
      nodemap &= ~bit;
      size -= childSize;
      return this;
    }

    private Node<K, V> copySlot(Node<K, V> src, int bit) {
      if (src.hasEntry(bit)) {
        int i = index(src.datamap, bit);
        return addEntry(bit, src.hashes[i], (K) src.keys[i], (V) src.values[i]);
      }
      return addChild(bit, src.childAt(bit));
    }
  }

  /**
   * Entries whose 64-bit hashes are identical, which can only be told apart by key equality.
   */
  public static class Collision<K, V> implements INode<K, V> {

    public final long hash;
    final Object[] keys;
    final Object[] values;

    Collision(long hash, Object[] keys, Object[] values) {
      this.hash = hash;
      this.keys = keys;
      this.values = values;
    }

    public boolean contains(long hash, K key, BiPredicate<K, K> equals) {
      return hash == this.hash && indexOf(key, equals) >= 0;
    }

    @Override
    public long size() {
      return keys.length;
    }

    @Override
    public long hash(int idx) {
      return hash;
    }

    @Override
    public IEntry<K, V> nth(long idx) {
      if (idx < 0 || idx >= keys.length) {
        throw new IndexOutOfBoundsException(idx + " must be within [0," + keys.length + ")");
      }
      int i = (int) idx;
      return new Maps.Entry<>((K) keys[i], (V) values[i]);
    }

    @Override
    public INode<K, V> put(int shift, Object editor, long hash, K key, V value, BiPredicate<K, K> equals, BinaryOperator<V> merge) {
      if (hash != this.hash) {
        return new Node<K, V>(editor)
          .addChild(bit(this.hash, shift), this)
          .put(shift, editor, hash, key, value, equals, merge);
      }

      int i = indexOf(key, equals);
      if (i < 0) {
        return new Collision<>(hash, grow(keys, keys.length, key), grow(values, values.length, value));
      }

      Object[] valuesPrime = values.clone();
      valuesPrime[i] = merge.apply((V) values[i], value);
      return new Collision<>(hash, keys, valuesPrime);
    }

    @Override
    public INode<K, V> remove(int shift, Object editor, long hash, K key, BiPredicate<K, K> equals) {
      int i = hash == this.hash ? indexOf(key, equals) : -1;
      return i < 0 ? this : new Collision<>(hash, shrink(keys, i), shrink(values, i));
    }

    @Override
    public boolean equals(INode<K, V> o, BiPredicate<K, K> keyEquals, BiPredicate<V, V> valEquals) {
      if (this == o) {
        return true;
      } else if (!(o instanceof Collision)) {
        return false;
      }

      Collision<K, V> c = (Collision<K, V>) o;
      if (c.hash != hash || c.keys.length != keys.length) {
        return false;
      }

      // entries are kept in insertion order, so match them up by key
      for (int i = 0; i < keys.length; i++) {
        int j = c.indexOf((K) keys[i], keyEquals);
        if (j < 0 || !valEquals.test((V) values[i], (V) c.values[j])) {
          return false;
        }
      }
      return true;
    }

    /**
     * @return a collision with only the entries whose keys satisfy {@code keep}, or null if there are none
     */
    Collision<K, V> filter(Predicate<K> keep) {
      Object[] ks = new Object[keys.length];
      Object[] vs = new Object[keys.length];
      int count = 0;
      for (int i = 0; i < keys.length; i++) {
        if (keep.test((K) keys[i])) {
          ks[count] = keys[i];
          vs[count] = values[i];
          count++;
        }
      }

      if (count == 0) {
        return null;
      } else if (count == keys.length) {
        return this;
      }

      Object[] ksPrime = new Object[count];
      Object[] vsPrime = new Object[count];
      arraycopy(ks, 0, ksPrime, 0, count);
      arraycopy(vs, 0, vsPrime, 0, count);
      return new Collision<>(hash, ksPrime, vsPrime);
    }

    private int indexOf(K key, BiPredicate<K, K> equals) {
      for (int i = 0; i < keys.length; i++) {
        if (equals.test(key, (K) keys[i])) {
          return i;
        }
      }
      return -1;
    }
  }

  /**
   * Walks the trie depth-first, yielding each node's inline entries before descending into its children.
   */
  private static class EntryIterator<K, V> implements Iterator<IEntry<K, V>> {

    private final ArrayDeque<INode<K, V>> pending = new ArrayDeque<>(MAX_DEPTH * 4);
    private Object[] keys = NO_OBJECTS;
    private Object[] values = NO_OBJECTS;
    private int idx = 0;

    EntryIterator(INode<K, V> root) {
      pending.push(root);
    }

    @Override
    public boolean hasNext() {
      while (idx == keys.length) {
        if (pending.isEmpty()) {
          return false;
        }
        visit(pending.pop());
      }
      return true;
    }

    @Override
    public IEntry<K, V> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      IEntry<K, V> e = new Maps.Entry<>((K) keys[idx], (V) values[idx]);
      idx++;
      return e;
    }

    private void visit(INode<K, V> n) {
      idx = 0;
      if (n instanceof Node) {
        Node<K, V> node = (Node<K, V>) n;
        keys = node.keys;
        values = node.values;
        for (int i = node.children.length - 1; i >= 0; i--) {
          pending.push((INode<K, V>) node.children[i]);
        }
      } else {
        Collision<K, V> c = (Collision<K, V>) n;
        keys = c.keys;
        values = c.values;
      }
    }
  }

  ///

  private static int bit(long hash, int shift) {
    return 1 << ((int) (hash >>> shift) & 31);
  }

  private static int index(int bitmap, int bit) {
    return Integer.bitCount(bitmap & (bit - 1));
  }

  private static Object[] grow(Object[] a, int idx, Object v) {
    Object[] result = new Object[a.length + 1];
    arraycopy(a, 0, result, 0, idx);
    result[idx] = v;
    arraycopy(a, idx, result, idx + 1, a.length - idx);
    return result;
  }

  private static long[] grow(long[] a, int idx, long v) {
    long[] result = new long[a.length + 1];
    arraycopy(a, 0, result, 0, idx);
    result[idx] = v;
    arraycopy(a, idx, result, idx + 1, a.length - idx);
    return result;
  }

  private static Object[] shrink(Object[] a, int idx) {
    if (a.length == 1) {
      return NO_OBJECTS;
    }
    Object[] result = new Object[a.length - 1];
    arraycopy(a, 0, result, 0, idx);
    arraycopy(a, idx + 1, result, idx, result.length - idx);
    return result;
  }

  private static long[] shrink(long[] a, int idx) {
    if (a.length == 1) {
      return NO_HASHES;
    }
    long[] result = new long[a.length - 1];
    arraycopy(a, 0, result, 0, idx);
    arraycopy(a, idx + 1, result, idx, result.length - idx);
    return result;
  }

  /// lookup

  /**
   * @return the entry under {@code key}, or null if there is no such entry
   */
  public static <K, V> IEntry<K, V> entry(INode<K, V> node, int shift, long hash, K key, BiPredicate<K, K> equals) {
    INode<K, V> curr = node;
    while (curr instanceof Node) {
      Node<K, V> n = (Node<K, V>) curr;
      int bit = bit(hash, shift);

      if ((n.datamap & bit) != 0) {
        int i = index(n.datamap, bit);
        return n.hashes[i] == hash && equals.test(key, (K) n.keys[i])
          ? new Maps.Entry<>((K) n.keys[i], (V) n.values[i])
          : null;
      } else if ((n.nodemap & bit) == 0) {
        return null;
      }

      curr = n.childAt(bit);
      shift += BITS;
    }

    Collision<K, V> c = (Collision<K, V>) curr;
    int i = c.hash == hash ? c.indexOf(key, equals) : -1;
    return i < 0 ? null : new Maps.Entry<>((K) c.keys[i], (V) c.values[i]);
  }

  public static <K, V> Object get(INode<K, V> node, int shift, long hash, K key, BiPredicate<K, K> equals, Object defaultValue) {
    IEntry<K, V> e = entry(node, shift, hash, key, equals);
    return e == null ? defaultValue : e.value();
  }

  public static <K, V> boolean contains(INode<K, V> node, int shift, long hash, K key, BiPredicate<K, K> equals) {
    return entry(node, shift, hash, key, equals) != null;
  }

  /// set operations
  //
  // Each walks the occupied slots of both nodes in parallel.  A slot which only one side occupies is carried over as-is,
  // an inline entry is looked up against the other side's slot, and two children are combined recursively.

  /**
   * @return a node with the entries of both {@code a} and {@code b}, using {@code merge} on any shared keys
   */
  public static <K, V> Node<K, V> merge(int shift, Object editor, Node<K, V> a, Node<K, V> b, BiPredicate<K, K> equals, BinaryOperator<V> merge) {
    Node<K, V> result = new Node<>(editor);

    for (int bits = a.datamap | a.nodemap | b.datamap | b.nodemap; bits != 0; bits &= bits - 1) {
      int bit = bits & -bits;

      if (!b.occupies(bit)) {
        result.copySlot(a, bit);
      } else if (!a.occupies(bit)) {
        result.copySlot(b, bit);
      } else if (b.hasEntry(bit)) {
        int i = index(b.datamap, bit);
        result.copySlot(a, bit).put(shift, editor, b.hashes[i], (K) b.keys[i], (V) b.values[i], equals, merge);
      } else if (a.hasEntry(bit)) {
        int i = index(a.datamap, bit);
        result.copySlot(b, bit).put(shift, editor, a.hashes[i], (K) a.keys[i], (V) a.values[i], equals, (x, y) -> merge.apply(y, x));
      } else {
        result.addChild(bit, mergeNodes(shift + BITS, editor, a.childAt(bit), b.childAt(bit), equals, merge));
      }
    }

    return result;
  }

  private static <K, V> INode<K, V> mergeNodes(int shift, Object editor, INode<K, V> a, INode<K, V> b, BiPredicate<K, K> equals, BinaryOperator<V> merge) {
    if (b instanceof Collision) {
      Collision<K, V> c = (Collision<K, V>) b;
      for (int i = 0; i < c.keys.length; i++) {
        a = a.put(shift, editor, c.hash, (K) c.keys[i], (V) c.values[i], equals, merge);
      }
      return a;
    } else if (a instanceof Collision) {
      Collision<K, V> c = (Collision<K, V>) a;
      for (int i = 0; i < c.keys.length; i++) {
        b = b.put(shift, editor, c.hash, (K) c.keys[i], (V) c.values[i], equals, (x, y) -> merge.apply(y, x));
      }
      return b;
    }
    return merge(shift, editor, (Node<K, V>) a, (Node<K, V>) b, equals, merge).canonical(shift);
  }

  /**
   * @return the entries of {@code a} whose keys aren't in {@code b}, or null if there are none
   */
  public static <K, V> INode<K, V> difference(int shift, Object editor, Node<K, V> a, Node<K, V> b, BiPredicate<K, K> equals) {
    Node<K, V> result = new Node<>(editor);

    for (int bits = a.datamap | a.nodemap; bits != 0; bits &= bits - 1) {
      int bit = bits & -bits;

      if (!b.occupies(bit)) {
        result.copySlot(a, bit);
      } else if (a.hasEntry(bit)) {
        int i = index(a.datamap, bit);
        if (!contains(b, shift, a.hashes[i], (K) a.keys[i], equals)) {
          result.copySlot(a, bit);
        }
      } else if (b.hasEntry(bit)) {
        int i = index(b.datamap, bit);
        result.addChild(bit, a.childAt(bit).remove(shift + BITS, editor, b.hashes[i], (K) b.keys[i], equals));
      } else {
        INode<K, V> child = diffNodes(shift + BITS, editor, a.childAt(bit), b.childAt(bit), equals);
        if (child != null) {
          result.addChild(bit, child);
        }
      }
    }

    return result.size == 0 ? null : result.canonical(shift);
  }

  private static <K, V> INode<K, V> diffNodes(int shift, Object editor, INode<K, V> a, INode<K, V> b, BiPredicate<K, K> equals) {
    if (a instanceof Collision) {
      Collision<K, V> c = (Collision<K, V>) a;
      return c.filter(k -> !contains(b, shift, c.hash, k, equals));
    } else if (b instanceof Collision) {
      Collision<K, V> c = (Collision<K, V>) b;
      for (int i = 0; i < c.keys.length; i++) {
        a = a.remove(shift, editor, c.hash, (K) c.keys[i], equals);
      }
      return a.size() > 0 ? a : null;
    }
    return difference(shift, editor, (Node<K, V>) a, (Node<K, V>) b, equals);
  }

  /**
   * @return the entries of {@code a} whose keys are also in {@code b}, or null if there are none
   */
  public static <K, V> INode<K, V> intersection(int shift, Object editor, Node<K, V> a, Node<K, V> b, BiPredicate<K, K> equals) {
    Node<K, V> result = new Node<>(editor);

    for (int bits = (a.datamap | a.nodemap) & (b.datamap | b.nodemap); bits != 0; bits &= bits - 1) {
      int bit = bits & -bits;

      if (a.hasEntry(bit)) {
        int i = index(a.datamap, bit);
        if (contains(b, shift, a.hashes[i], (K) a.keys[i], equals)) {
          result.copySlot(a, bit);
        }
      } else if (b.hasEntry(bit)) {
        int i = index(b.datamap, bit);
        IEntry<K, V> e = entry(a.childAt(bit), shift + BITS, b.hashes[i], (K) b.keys[i], equals);
        if (e != null) {
          result.addEntry(bit, b.hashes[i], e.key(), e.value());
        }
      } else {
        INode<K, V> child = intersectNodes(shift + BITS, editor, a.childAt(bit), b.childAt(bit), equals);
        if (child != null) {
          result.addChild(bit, child);
        }
      }
    }

    return result.size == 0 ? null : result.canonical(shift);
  }

  private static <K, V> INode<K, V> intersectNodes(int shift, Object editor, INode<K, V> a, INode<K, V> b, BiPredicate<K, K> equals) {
    if (a instanceof Collision) {
      Collision<K, V> c = (Collision<K, V>) a;
      return c.filter(k -> contains(b, shift, c.hash, k, equals));
    } else if (b instanceof Collision) {
      Collision<K, V> c = (Collision<K, V>) b;
      INode<K, V> result = null;
      for (int i = 0; i < c.keys.length; i++) {
        IEntry<K, V> e = entry(a, shift, c.hash, (K) c.keys[i], equals);
        if (e != null) {
          result = result == null
            ? new Collision<>(c.hash, new Object[] {e.key()}, new Object[] {e.value()})
            : result.put(shift, editor, c.hash, e.key(), e.value(), equals, null);
        }
      }
      return result;
    }
    return intersection(shift, editor, (Node<K, V>) a, (Node<K, V>) b, equals);
  }
}
