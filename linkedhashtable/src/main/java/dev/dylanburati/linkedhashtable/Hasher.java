package dev.dylanburati.linkedhashtable;

/**
 * Computes hashes for bucket selection in a {@link LinkedHashTable}. The result
 * is treated as an unsigned 32-bit integer. The rules of {@link Object#hashCode}
 * also apply here, relative to the table's {@link KeyEquality}.
 */
public interface Hasher<K> {
  int hash(K key);
}
