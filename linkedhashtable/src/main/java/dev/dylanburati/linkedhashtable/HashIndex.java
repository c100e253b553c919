package dev.dylanburati.linkedhashtable;

import java.util.Arrays;

import static dev.dylanburati.linkedhashtable.NodeStore.NIL;
import static dev.dylanburati.linkedhashtable.NodeStore.TAIL;

/**
 * Bucket array over the slots of a {@link NodeStore}. Each bucket heads a chain
 * linked through {@code store.chain}; chains hold live slots only, never the
 * sentinels. Chain order is most-recently-linked first.
 */
/* package-private */ class HashIndex<K> {
  static final int MAX_BUCKET_COUNT = 1 << 30;

  private final NodeStore<K, ?> store;
  private final Hasher<? super K> hasher;
  private final KeyEquality<? super K> keyEquality;
  // INVARIANT: every live slot is on exactly one chain, the one for bucketOf(its key)
  int[] buckets;
  private int rehashCount;

  HashIndex(NodeStore<K, ?> store, int bucketCount, Hasher<? super K> hasher, KeyEquality<? super K> keyEquality) {
    this.store = store;
    this.hasher = hasher;
    this.keyEquality = keyEquality;
    this.buckets = new int[bucketCount];
    Arrays.fill(this.buckets, NIL);
    this.rehashCount = 0;
  }

  int bucketCount() {
    return this.buckets.length;
  }

  int rehashCount() {
    return this.rehashCount;
  }

  int bucketOf(K key) {
    return Integer.remainderUnsigned(this.hasher.hash(key), this.buckets.length);
  }

  /** Returns the live slot holding {@code key}, or {@code NIL}. */
  int lookup(K key) {
    int slot = this.buckets[this.bucketOf(key)];
    while (slot != NIL) {
      if (this.keyEquality.equal(this.store.keyAt(slot), key)) {
        return slot;
      }
      slot = this.store.chain[slot];
    }
    return NIL;
  }

  /** Prepends {@code slot} to the chain for its key. */
  void link(int slot) {
    int b = this.bucketOf(this.store.keyAt(slot));
    this.store.chain[slot] = this.buckets[b];
    this.buckets[b] = slot;
  }

  /** Removes {@code slot} from its chain by scanning that chain. */
  void unlink(int slot) {
    int b = this.bucketOf(this.store.keyAt(slot));
    int cur = this.buckets[b];
    if (cur == slot) {
      this.buckets[b] = this.store.chain[slot];
    } else {
      while (cur != NIL && this.store.chain[cur] != slot) {
        cur = this.store.chain[cur];
      }
      if (cur == NIL) {
        throw new IllegalStateException("slot " + slot + " missing from its bucket chain");
      }
      this.store.chain[cur] = this.store.chain[slot];
    }
    this.store.chain[slot] = NIL;
  }

  void clear() {
    Arrays.fill(this.buckets, NIL);
  }

  /**
   * Called when an insertion of a new key is about to happen, with the entry
   * count before that insertion. Doubles the bucket count if the insertion
   * would take the load factor above 3/4. Returns true if rehashed.
   */
  boolean maybeGrow(int size) {
    int cap = this.buckets.length;
    if ((size + 1L) * 4 > cap * 3L && cap < MAX_BUCKET_COUNT) {
      this.rehash(Math.min(cap << 1, MAX_BUCKET_COUNT));
      return true;
    }
    return false;
  }

  // Walks the order list, not the old buckets. Chains come out newest-first.
  private void rehash(int bucketCount) {
    int[] next = new int[bucketCount];
    Arrays.fill(next, NIL);
    this.buckets = next;
    for (int slot = this.store.first(); slot != TAIL; slot = this.store.after[slot]) {
      int b = this.bucketOf(this.store.keyAt(slot));
      this.store.chain[slot] = next[b];
      next[b] = slot;
    }
    this.rehashCount++;
  }
}
