package dev.dylanburati.linkedhashtable;

import java.util.Map;

/**
 * A {@link ReadOnlyPosition} that can also replace the value of its entry, and
 * can be passed to {@link LinkedHashTable#erase}.
 */
public class Position<K, V> extends ReadOnlyPosition<K, V> {
  Position(LinkedHashTable<K, V> owner, int slot) {
    super(owner, slot);
  }

  @Override
  public Position<K, V> next() {
    return new Position<>(this.owner, this.nextSlot());
  }

  @Override
  public Position<K, V> previous() {
    return new Position<>(this.owner, this.previousSlot());
  }

  /** Replaces the value of the entry at this position, returning the previous value. */
  public V setValue(V value) {
    int s = this.checkedSlot();
    if (s == NodeStore.TAIL) {
      throw new InvalidIteratorException("end position has no entry");
    }
    return this.owner.store.setValueAt(s, value);
  }

  @Override
  public Map.Entry<K, V> entry() {
    // checks validity and rejects the end position
    this.getKey();
    return new NodeEntry<>(this.owner, this.slot, true);
  }
}
