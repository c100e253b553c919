package dev.dylanburati.linkedhashtable;

import java.util.Map;
import java.util.Objects;

/**
 * {@link Map.Entry} view of one live slot, used by the table's entry set and by
 * positions. Fails once the slot has been released.
 */
/* package-private */ class NodeEntry<K, V> implements Map.Entry<K, V> {
  private final LinkedHashTable<K, V> owner;
  private final int slot;
  private final int generation;
  private final boolean writable;

  NodeEntry(LinkedHashTable<K, V> owner, int slot, boolean writable) {
    this.owner = owner;
    this.slot = slot;
    this.generation = owner.store.generations[slot];
    this.writable = writable;
  }

  private int checkedSlot() {
    if (this.owner.store.generations[this.slot] != this.generation) {
      throw new IllegalStateException("Entry no longer in map");
    }
    return this.slot;
  }

  @Override
  public K getKey() {
    return this.owner.store.keyAt(this.checkedSlot());
  }

  @Override
  public V getValue() {
    return this.owner.store.valueAt(this.checkedSlot());
  }

  @Override
  public V setValue(V value) {
    if (!this.writable) {
      throw new UnsupportedOperationException("read-only entry");
    }
    return this.owner.store.setValueAt(this.checkedSlot(), value);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Map.Entry<?, ?>)) {
      return false;
    }
    Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
    return Objects.equals(this.getKey(), e.getKey()) && Objects.equals(this.getValue(), e.getValue());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.getKey()) ^ Objects.hashCode(this.getValue());
  }

  @Override
  public String toString() {
    return this.getKey() + "=" + this.getValue();
  }
}
