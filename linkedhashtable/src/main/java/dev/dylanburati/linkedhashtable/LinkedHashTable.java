package dev.dylanburati.linkedhashtable;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static dev.dylanburati.linkedhashtable.NodeStore.NIL;
import static dev.dylanburati.linkedhashtable.NodeStore.TAIL;

/**
 * Hash table which iterates in the order keys were first inserted.
 *
 * Entries live in a slot arena ({@link NodeStore}) whose slots are threaded by
 * a doubly linked list in insertion order, between two sentinel slots. A bucket
 * array ({@link HashIndex}) of chains through the same slots gives expected
 * constant-time lookup. The bucket count starts at 16 and doubles whenever an
 * insertion would take the load factor above 3/4; growing only rewires the
 * chains, so entry slots and positions survive it.
 *
 * Re-inserting a present key with {@link #insert} changes neither its position
 * nor its value. {@link #put} replaces the value but also keeps the position.
 *
 * Positions ({@link Position}, {@link ReadOnlyPosition}) are handles into the
 * insertion order that are checked against the table on every use; see
 * {@link ReadOnlyPosition} for the invalidation rules.
 *
 * <p>Lookups by {@code Object} ({@link #get}, {@link #containsKey},
 * {@link #getOrDefault}, {@link #remove(Object)}) hand the argument to the
 * table's {@link Hasher} and {@link KeyEquality} unchecked. With a hasher
 * typed narrower than {@code Object}, a key of another type throws
 * {@link ClassCastException}.
 *
 * <p><strong>This class is not synchronized.</strong> Concurrent use with at
 * least one writer must be synchronized externally.
 */
public class LinkedHashTable<K, V> extends AbstractMap<K, V> {
  private static final int DEFAULT_BUCKET_COUNT = 16;

  private Hasher<? super K> hasher;
  private KeyEquality<? super K> keyEquality;
  private Supplier<? extends V> defaultValue;
  final NodeStore<K, V> store;
  HashIndex<K> index;
  // INVARIANT: size == live slots in store == slots on the chains of index
  private int size;

  public LinkedHashTable() {
    this(DEFAULT_BUCKET_COUNT);
  }

  public LinkedHashTable(int initialBucketCount) {
    this(initialBucketCount, DefaultHasher.instance(), DefaultHasher.instance());
  }

  public LinkedHashTable(int initialBucketCount, final Hasher<? super K> hasher, final KeyEquality<? super K> keyEquality) {
    this(initialBucketCount, hasher, keyEquality, () -> null);
  }

  /**
   * @param initialBucketCount number of hash buckets to start with, at least 1
   * @param hasher bucket selection function, its result is read as unsigned
   * @param keyEquality key comparison, consistent with {@code hasher}
   * @param defaultValue supplies the value stored by {@link #getOrCreate} for a missing key
   */
  public LinkedHashTable(int initialBucketCount, final Hasher<? super K> hasher, final KeyEquality<? super K> keyEquality,
      final Supplier<? extends V> defaultValue) {
    if (initialBucketCount <= 0) {
      throw new IllegalArgumentException("expected positive initialBucketCount");
    }
    if (initialBucketCount > HashIndex.MAX_BUCKET_COUNT) {
      throw new IllegalArgumentException("initialBucketCount exceeds " + HashIndex.MAX_BUCKET_COUNT);
    }
    this.hasher = Objects.requireNonNull(hasher);
    this.keyEquality = Objects.requireNonNull(keyEquality);
    this.defaultValue = Objects.requireNonNull(defaultValue);
    this.store = new NodeStore<>((int) (initialBucketCount * 3L / 4));
    this.index = new HashIndex<>(this.store, initialBucketCount, hasher, keyEquality);
    this.size = 0;
  }

  /**
   * Creates an independent copy of {@code other}: same bucket count, hasher,
   * key equality and default value, and the same entries in the same order.
   * Values are copied by reference.
   */
  public LinkedHashTable(LinkedHashTable<K, V> other) {
    this(other.bucketCount(), other.hasher, other.keyEquality, other.defaultValue);
    this.populateFrom(other);
  }

  /**
   * Replaces the contents of this table with the entries of {@code other}, in
   * its order, and takes over its hasher, key equality and default value. The
   * bucket count is not reset first. Assigning a table to itself has no effect.
   */
  public void assign(LinkedHashTable<K, V> other) {
    if (other == this) {
      return;
    }
    this.clear();
    this.hasher = other.hasher;
    this.keyEquality = other.keyEquality;
    this.defaultValue = other.defaultValue;
    this.index = new HashIndex<>(this.store, this.index.bucketCount(), this.hasher, this.keyEquality);
    this.populateFrom(other);
  }

  private void populateFrom(LinkedHashTable<K, V> other) {
    NodeStore<K, V> src = other.store;
    for (int slot = src.first(); slot != TAIL; slot = src.after[slot]) {
      this.insertAbsentOrKeep(src.keyAt(slot), src.valueAt(slot));
    }
  }

  /**
   * Creates a shallow copy of this table, see {@link #LinkedHashTable(LinkedHashTable)}.
   */
  @Override
  public LinkedHashTable<K, V> clone() {
    return new LinkedHashTable<>(this);
  }

  @SuppressWarnings("unchecked")
  private static <K> K castUnsafe(Object k) {
    return (K) k;
  }

  @Override
  public int size() {
    return this.size;
  }

  @Override
  public boolean isEmpty() {
    return this.size == 0;
  }

  /** Current length of the bucket array. Only changes by doubling. */
  public int bucketCount() {
    return this.index.bucketCount();
  }

  /**
   * Inserts {@code pair} if its key is absent. If the key is present, nothing
   * changes and the result points at the existing entry.
   */
  public InsertResult<K, V> insert(Map.Entry<? extends K, ? extends V> pair) {
    return this.insert(pair.getKey(), pair.getValue());
  }

  public InsertResult<K, V> insert(K key, V value) {
    int slot = this.index.lookup(key);
    if (slot != NIL) {
      return new InsertResult<>(new Position<>(this, slot), false);
    }
    return new InsertResult<>(new Position<>(this, this.insertAbsent(key, value)), true);
  }

  private void insertAbsentOrKeep(K key, V value) {
    if (this.index.lookup(key) == NIL) {
      this.insertAbsent(key, value);
    }
  }

  // caller has checked that the key is absent
  private int insertAbsent(K key, V value) {
    this.index.maybeGrow(this.size);
    int slot = this.store.allocate(key, value);
    this.store.append(slot);
    this.index.link(slot);
    this.size++;
    return slot;
  }

  /**
   * Removes the entry at {@code position}. Only positions on that entry become
   * invalid.
   *
   * @throws InvalidIteratorException if the position belongs to another table,
   *   is the end position, or is no longer valid
   */
  public void erase(Position<K, V> position) {
    Objects.requireNonNull(position);
    if (position.owner != this) {
      throw new InvalidIteratorException("position belongs to a different table");
    }
    int slot = position.checkedSlot();
    if (slot == TAIL) {
      throw new InvalidIteratorException("cannot erase the end position");
    }
    this.removeSlot(slot);
  }

  private void removeSlot(int slot) {
    this.store.unlink(slot);
    this.index.unlink(slot);
    this.store.release(slot);
    this.size--;
  }

  /** Position of the entry for {@code key}, or {@link #end()} if absent. */
  public Position<K, V> find(K key) {
    int slot = this.index.lookup(key);
    return new Position<>(this, slot != NIL ? slot : TAIL);
  }

  public ReadOnlyPosition<K, V> readOnlyFind(K key) {
    int slot = this.index.lookup(key);
    return new ReadOnlyPosition<>(this, slot != NIL ? slot : TAIL);
  }

  /** 1 if {@code key} is present, else 0. */
  public int count(K key) {
    return this.index.lookup(key) != NIL ? 1 : 0;
  }

  /**
   * Value mapped to {@code key}.
   *
   * @throws IndexOutOfBoundException if the key is absent
   */
  public V at(K key) {
    int slot = this.index.lookup(key);
    if (slot == NIL) {
      throw new IndexOutOfBoundException("key not present: " + key);
    }
    return this.store.valueAt(slot);
  }

  /**
   * Value mapped to {@code key}; if absent, first inserts the key at the end of
   * the order with the table's default value.
   */
  public V getOrCreate(K key) {
    int slot = this.index.lookup(key);
    if (slot == NIL) {
      slot = this.insertAbsent(key, this.defaultValue.get());
    }
    return this.store.valueAt(slot);
  }

  /** Position of the first entry in insertion order, equal to {@link #end()} when empty. */
  public Position<K, V> begin() {
    return new Position<>(this, this.store.first());
  }

  public Position<K, V> end() {
    return new Position<>(this, TAIL);
  }

  public ReadOnlyPosition<K, V> readOnlyBegin() {
    return new ReadOnlyPosition<>(this, this.store.first());
  }

  public ReadOnlyPosition<K, V> readOnlyEnd() {
    return new ReadOnlyPosition<>(this, TAIL);
  }

  /** Removes every entry and invalidates every position. The bucket count is kept. */
  @Override
  public void clear() {
    this.store.clear();
    this.index.clear();
    this.size = 0;
  }

  @Override
  public boolean containsKey(Object key) {
    return this.index.lookup(castUnsafe(key)) != NIL;
  }

  @Override
  public boolean containsValue(Object value) {
    for (int slot = this.store.first(); slot != TAIL; slot = this.store.after[slot]) {
      if (Objects.equals(this.store.values[slot], value)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public V get(Object key) {
    return this.getOrDefault(key, null);
  }

  @Override
  public V getOrDefault(Object key, V defaultValue) {
    int slot = this.index.lookup(castUnsafe(key));
    if (slot == NIL) {
      return defaultValue;
    }
    return this.store.valueAt(slot);
  }

  /** Associates {@code value} with {@code key}. A present key keeps its position. */
  @Override
  public V put(K key, V value) {
    int slot = this.index.lookup(key);
    if (slot != NIL) {
      return this.store.setValueAt(slot, value);
    }
    this.insertAbsent(key, value);
    return null;
  }

  @Override
  public V remove(Object key) {
    int slot = this.index.lookup(castUnsafe(key));
    if (slot == NIL) {
      return null;
    }
    V result = this.store.valueAt(slot);
    this.removeSlot(slot);
    return result;
  }

  @Override
  public void forEach(BiConsumer<? super K, ? super V> action) {
    Objects.requireNonNull(action);
    for (int slot = this.store.first(); slot != TAIL; slot = this.store.after[slot]) {
      action.accept(this.store.keyAt(slot), this.store.valueAt(slot));
    }
  }

  @Override
  public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
    Objects.requireNonNull(function);
    for (int slot = this.store.first(); slot != TAIL; slot = this.store.after[slot]) {
      this.store.values[slot] = function.apply(this.store.keyAt(slot), this.store.valueAt(slot));
    }
  }

  @Override
  public Set<K> keySet() {
    return new KeySet<>(this);
  }

  @Override
  public Collection<V> values() {
    return new Values<>(this);
  }

  @Override
  public Set<Map.Entry<K, V>> entrySet() {
    return new EntrySet<>(this);
  }

  protected static class KeySet<K> extends AbstractSet<K> {
    private final LinkedHashTable<K, ?> owner;
    protected KeySet(final LinkedHashTable<K, ?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<K> iterator() {
      return new KeyIterator<>(owner);
    }
    public final boolean contains(Object o) {
      return owner.containsKey(o);
    }
    public final boolean remove(Object key) {
      int slot = owner.index.lookup(castUnsafe(key));
      if (slot == NIL) {
        return false;
      }
      owner.removeSlot(slot);
      return true;
    }
    public final void forEach(Consumer<? super K> action) {
      Objects.requireNonNull(action);
      for (int slot = owner.store.first(); slot != TAIL; slot = owner.store.after[slot]) {
        action.accept(owner.store.keyAt(slot));
      }
    }
  }

  protected static class Values<V> extends AbstractCollection<V> {
    private final LinkedHashTable<?, V> owner;
    protected Values(final LinkedHashTable<?, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<V> iterator() {
      return new ValueIterator<>(owner);
    }
    public final boolean contains(Object o) {
      return owner.containsValue(o);
    }
    public final void forEach(Consumer<? super V> action) {
      Objects.requireNonNull(action);
      for (int slot = owner.store.first(); slot != TAIL; slot = owner.store.after[slot]) {
        action.accept(owner.store.valueAt(slot));
      }
    }
  }

  protected static class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
    private final LinkedHashTable<K, V> owner;
    protected EntrySet(final LinkedHashTable<K, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<K, V>> iterator() {
      return new EntryIterator<>(owner);
    }
    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      int slot = owner.index.lookup(castUnsafe(e.getKey()));
      return slot != NIL && Objects.equals(owner.store.values[slot], e.getValue());
    }
    public final boolean remove(Object o) {
      if (o instanceof Map.Entry<?, ?>) {
        Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
        return owner.remove(e.getKey(), e.getValue());
      }
      return false;
    }
    public final void forEach(Consumer<? super Map.Entry<K, V>> action) {
      Objects.requireNonNull(action);
      for (int slot = owner.store.first(); slot != TAIL; slot = owner.store.after[slot]) {
        action.accept(new NodeEntry<>(owner, slot, true));
      }
    }
  }

  /**
   * Walks the order list. Erasing entries other than the upcoming one is fine;
   * if the upcoming entry is erased from outside the iterator, the next call to
   * {@code next()} throws {@link ConcurrentModificationException}.
   */
  protected abstract static class LinkedIterator<K, V> {
    protected final LinkedHashTable<K, V> owner;
    private int nextSlot;
    private int nextGeneration;
    private int lastSlot;
    private int lastGeneration;

    protected LinkedIterator(final LinkedHashTable<K, V> owner) {
      this.owner = owner;
      this.lastSlot = NIL;
      this.point(owner.store.first());
    }

    private void point(int slot) {
      this.nextSlot = slot;
      this.nextGeneration = owner.store.generations[slot];
    }

    public final boolean hasNext() {
      return this.nextSlot != TAIL;
    }

    public final void remove() {
      if (this.lastSlot == NIL) {
        throw new IllegalStateException();
      }
      if (owner.store.generations[this.lastSlot] != this.lastGeneration) {
        throw new ConcurrentModificationException();
      }
      owner.removeSlot(this.lastSlot);
      this.lastSlot = NIL;
    }

    protected final int advance() {
      if (this.nextSlot == TAIL) {
        throw new NoSuchElementException();
      }
      if (owner.store.generations[this.nextSlot] != this.nextGeneration) {
        throw new ConcurrentModificationException();
      }
      this.lastSlot = this.nextSlot;
      this.lastGeneration = this.nextGeneration;
      this.point(owner.store.after[this.lastSlot]);
      return this.lastSlot;
    }
  }

  protected static class KeyIterator<K> extends LinkedIterator<K, Object> implements Iterator<K> {
    @SuppressWarnings("unchecked")
    protected KeyIterator(final LinkedHashTable<K, ?> owner) {
      super((LinkedHashTable<K, Object>) owner);
    }
    public final K next() {
      int slot = this.advance();
      return owner.store.keyAt(slot);
    }
  }

  protected static class ValueIterator<V> extends LinkedIterator<Object, V> implements Iterator<V> {
    @SuppressWarnings("unchecked")
    protected ValueIterator(final LinkedHashTable<?, V> owner) {
      super((LinkedHashTable<Object, V>) owner);
    }
    public final V next() {
      int slot = this.advance();
      return owner.store.valueAt(slot);
    }
  }

  protected static class EntryIterator<K, V> extends LinkedIterator<K, V> implements Iterator<Map.Entry<K, V>> {
    protected EntryIterator(final LinkedHashTable<K, V> owner) {
      super(owner);
    }
    public final Map.Entry<K, V> next() {
      int slot = this.advance();
      return new NodeEntry<>(owner, slot, true);
    }
  }
}
