package dev.dylanburati.linkedhashtable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static dev.dylanburati.linkedhashtable.NodeStore.NIL;
import static dev.dylanburati.linkedhashtable.NodeStore.TAIL;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Helpers {
  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  /** Entries in position order, walking begin() to end(). */
  public static <K, V> List<Map.Entry<K, V>> walk(LinkedHashTable<K, V> table) {
    List<Map.Entry<K, V>> result = new ArrayList<>();
    for (ReadOnlyPosition<K, V> p = table.readOnlyBegin(); !p.isEnd(); p = p.next()) {
      result.add(Pair.of(p.getKey(), p.getValue()));
    }
    return result;
  }

  /** A fresh table holding 1=a, 2=b, 3=c in that order. */
  public static LinkedHashTable<Integer, String> abc() {
    LinkedHashTable<Integer, String> m = new LinkedHashTable<>();
    m.insert(1, "a");
    m.insert(2, "b");
    m.insert(3, "c");
    return m;
  }

  public static <K> List<K> keys(LinkedHashTable<K, ?> table) {
    return new ArrayList<>(table.keySet());
  }

  /** Checks that the order list, the bucket chains and the size agree. */
  public static void assertConsistent(LinkedHashTable<?, ?> table) {
    NodeStore<?, ?> store = table.store;
    int ordered = 0;
    for (int slot = store.first(); slot != TAIL; slot = store.after[slot]) {
      assertTrue(store.isLive(slot), "order list reaches released slot " + slot);
      assertEquals(slot, store.after[store.before[slot]]);
      ordered++;
    }
    assertEquals(table.size(), ordered, "order list length");

    int chained = 0;
    int[] buckets = table.index.buckets;
    for (int b = 0; b < buckets.length; b++) {
      for (int slot = buckets[b]; slot != NIL; slot = store.chain[slot]) {
        assertTrue(store.isLive(slot), "chain reaches released slot " + slot);
        chained++;
      }
    }
    assertEquals(table.size(), chained, "chained slot count");
    assertTrue(table.size() * 4L <= table.bucketCount() * 3L, "load factor above 3/4");
  }
}
