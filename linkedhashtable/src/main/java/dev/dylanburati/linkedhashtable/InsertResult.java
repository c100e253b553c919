package dev.dylanburati.linkedhashtable;

/**
 * Outcome of {@link LinkedHashTable#insert}: the position of the entry holding
 * the key, and whether that entry was created by the call.
 */
public final class InsertResult<K, V> {
  private final Position<K, V> position;
  private final boolean inserted;

  InsertResult(Position<K, V> position, boolean inserted) {
    this.position = position;
    this.inserted = inserted;
  }

  /** The new entry, or the existing entry that prevented the insertion. */
  public Position<K, V> position() {
    return this.position;
  }

  public boolean inserted() {
    return this.inserted;
  }
}
