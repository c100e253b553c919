package dev.dylanburati.linkedhashtable;

/**
 * Decides whether two keys denote the same entry. Used for chain matching and
 * duplicate detection; must be consistent with the table's {@link Hasher}.
 */
public interface KeyEquality<K> {
  boolean equal(K a, K b);
}
