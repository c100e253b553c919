package dev.dylanburati.linkedhashtable;

import java.util.Map;

import static dev.dylanburati.linkedhashtable.NodeStore.HEAD;
import static dev.dylanburati.linkedhashtable.NodeStore.TAIL;

/**
 * Bidirectional position in the insertion order of a {@link LinkedHashTable}:
 * either at a live entry, or at the end (one past the last entry).
 *
 * Positions are immutable; {@link #next()} and {@link #previous()} return new
 * handles. A position stays usable until its entry is erased or its table is
 * cleared. Inserting other keys, growing the bucket array, and erasing other
 * entries leave it valid. Every operation on a position that is no longer
 * valid throws {@link InvalidIteratorException}.
 *
 * Two positions are equal when they belong to the same table and denote the
 * same entry (or are both its end), regardless of flavor.
 */
public class ReadOnlyPosition<K, V> {
  final LinkedHashTable<K, V> owner;
  final int slot;
  final int generation;

  ReadOnlyPosition(LinkedHashTable<K, V> owner, int slot) {
    this(owner, slot, owner.store.generations[slot]);
  }

  ReadOnlyPosition(LinkedHashTable<K, V> owner, int slot, int generation) {
    this.owner = owner;
    this.slot = slot;
    this.generation = generation;
  }

  /** Returns this position's slot, after checking that it is still current. */
  final int checkedSlot() {
    if (this.owner.store.generations[this.slot] != this.generation) {
      throw new InvalidIteratorException(this.slot == TAIL
          ? "end position was retired by clear()"
          : "position refers to an entry that is no longer in the table");
    }
    return this.slot;
  }

  private int checkedEntrySlot() {
    int s = this.checkedSlot();
    if (s == TAIL) {
      throw new InvalidIteratorException("end position has no entry");
    }
    return s;
  }

  final int nextSlot() {
    int s = this.checkedSlot();
    if (s == TAIL) {
      throw new InvalidIteratorException("cannot advance past the end");
    }
    return this.owner.store.after[s];
  }

  final int previousSlot() {
    int prev = this.owner.store.before[this.checkedSlot()];
    if (prev == HEAD) {
      throw new InvalidIteratorException("cannot retreat before the first entry");
    }
    return prev;
  }

  public ReadOnlyPosition<K, V> next() {
    return new ReadOnlyPosition<>(this.owner, this.nextSlot());
  }

  public ReadOnlyPosition<K, V> previous() {
    return new ReadOnlyPosition<>(this.owner, this.previousSlot());
  }

  public boolean isEnd() {
    return this.checkedSlot() == TAIL;
  }

  public K getKey() {
    return this.owner.store.keyAt(this.checkedEntrySlot());
  }

  public V getValue() {
    return this.owner.store.valueAt(this.checkedEntrySlot());
  }

  /**
   * A {@link Map.Entry} view of the entry at this position. Writes through to the
   * table when obtained from a mutable {@link Position}.
   */
  public Map.Entry<K, V> entry() {
    return new NodeEntry<>(this.owner, this.checkedEntrySlot(), false);
  }

  public ReadOnlyPosition<K, V> asReadOnly() {
    return new ReadOnlyPosition<>(this.owner, this.slot, this.generation);
  }

  /** Whether this position belongs to {@code table}. */
  public boolean belongsTo(LinkedHashTable<?, ?> table) {
    return this.owner == table;
  }

  @Override
  public final boolean equals(Object o) {
    if (!(o instanceof ReadOnlyPosition<?, ?>)) {
      return false;
    }
    ReadOnlyPosition<?, ?> p = (ReadOnlyPosition<?, ?>) o;
    return this.owner == p.owner && this.slot == p.slot && this.generation == p.generation;
  }

  @Override
  public final int hashCode() {
    return (System.identityHashCode(this.owner) * 31 + this.slot) * 31 + this.generation;
  }

  @Override
  public String toString() {
    if (this.owner.store.generations[this.slot] != this.generation) {
      return "Position[stale]";
    }
    if (this.slot == TAIL) {
      return "Position[end]";
    }
    return "Position[" + this.owner.store.keyAt(this.slot) + "=" + this.owner.store.valueAt(this.slot) + "]";
  }
}
