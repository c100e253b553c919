package dev.dylanburati.linkedhashtable;

import java.util.Arrays;

/**
 * Arena of entry slots addressed by {@code int} handles. Each slot carries its
 * key and value plus three links: {@code before} and {@code after} thread the
 * live slots in insertion order, and {@code chain} is the next slot in the same
 * hash bucket, owned by {@link HashIndex}.
 *
 * Slots {@link #HEAD} and {@link #TAIL} are the permanent sentinels of the order
 * list. Released slots go onto a free list threaded through {@code after}, and
 * their generation is bumped so stale handles can be detected.
 */
/* package-private */ class NodeStore<K, V> {
  static final int NIL = -1;
  static final int HEAD = 0;
  static final int TAIL = 1;
  private static final int MIN_SLOTS = 8;
  // larger arenas are reached by doubling
  private static final int MAX_PRESIZE = 1 << 20;

  // INVARIANT 0: all six arrays have the same length
  // INVARIANT 1: slot s is live IFF HEAD < s < limit and before[s] != NIL
  // INVARIANT 2: walking after[] from HEAD reaches TAIL, visiting every live slot once
  Object[] keys;
  Object[] values;
  int[] before;
  int[] after;
  int[] chain;
  int[] generations;

  // slots below the limit have been handed out at least once
  private int limit;
  private int freeHead;

  NodeStore(int expectedEntries) {
    int cap = (int) Math.min(MAX_PRESIZE, Math.max(MIN_SLOTS, expectedEntries + 2L));
    this.keys = new Object[cap];
    this.values = new Object[cap];
    this.before = new int[cap];
    this.after = new int[cap];
    this.chain = new int[cap];
    this.generations = new int[cap];
    this.limit = 2;
    this.freeHead = NIL;

    this.before[HEAD] = NIL;
    this.after[HEAD] = TAIL;
    this.before[TAIL] = HEAD;
    this.after[TAIL] = NIL;
    this.chain[HEAD] = NIL;
    this.chain[TAIL] = NIL;
  }

  @SuppressWarnings("unchecked")
  K keyAt(int slot) {
    return (K) this.keys[slot];
  }

  @SuppressWarnings("unchecked")
  V valueAt(int slot) {
    return (V) this.values[slot];
  }

  V setValueAt(int slot, V value) {
    V prev = this.valueAt(slot);
    this.values[slot] = value;
    return prev;
  }

  boolean isLive(int slot) {
    return slot > TAIL && slot < this.limit && this.before[slot] != NIL;
  }

  int first() {
    return this.after[HEAD];
  }

  /** Takes a slot off the free list, or a fresh one, and fills it. Not yet linked anywhere. */
  int allocate(K key, V value) {
    int slot;
    if (this.freeHead != NIL) {
      slot = this.freeHead;
      this.freeHead = this.after[slot];
    } else {
      if (this.limit == this.keys.length) {
        this.grow();
      }
      slot = this.limit++;
    }
    this.keys[slot] = key;
    this.values[slot] = value;
    this.chain[slot] = NIL;
    return slot;
  }

  /** Links {@code slot} immediately before the tail sentinel. */
  void append(int slot) {
    int last = this.before[TAIL];
    this.before[slot] = last;
    this.after[slot] = TAIL;
    this.after[last] = slot;
    this.before[TAIL] = slot;
  }

  /** Removes a live slot from the order list. The slot keeps its contents until released. */
  void unlink(int slot) {
    int prev = this.before[slot];
    int next = this.after[slot];
    this.after[prev] = next;
    this.before[next] = prev;
  }

  /** Returns an unlinked slot to the free list. INVARIANT 1 upheld: before[slot] becomes NIL */
  void release(int slot) {
    this.keys[slot] = null;
    this.values[slot] = null;
    this.before[slot] = NIL;
    this.chain[slot] = NIL;
    this.generations[slot]++;
    this.after[slot] = this.freeHead;
    this.freeHead = slot;
  }

  /** Releases every live slot and resets the sentinels. Also retires all end positions. */
  void clear() {
    int cur = this.after[HEAD];
    while (cur != TAIL) {
      int next = this.after[cur];
      this.release(cur);
      cur = next;
    }
    this.after[HEAD] = TAIL;
    this.before[TAIL] = HEAD;
    this.generations[TAIL]++;
  }

  private void grow() {
    // INVARIANT 0 upheld: every array is resized together
    int cap = this.keys.length << 1;
    this.keys = Arrays.copyOf(this.keys, cap);
    this.values = Arrays.copyOf(this.values, cap);
    this.before = Arrays.copyOf(this.before, cap);
    this.after = Arrays.copyOf(this.after, cap);
    this.chain = Arrays.copyOf(this.chain, cap);
    this.generations = Arrays.copyOf(this.generations, cap);
  }
}
