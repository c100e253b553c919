package dev.dylanburati.linkedhashtable;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import static dev.dylanburati.linkedhashtable.Helpers.*;

class PositionTest {
  @Test void testForwardAndBackward() {
    LinkedHashTable<Integer, String> m = abc();
    Position<Integer, String> p = m.begin();
    assertEquals(1, p.getKey());
    p = p.next();
    assertEquals(2, p.getKey());
    p = p.next();
    assertEquals("c", p.getValue());
    p = p.next();
    assertTrue(p.isEnd());
    assertEquals(m.end(), p);

    p = p.previous();
    assertEquals(3, p.getKey());
    p = p.previous().previous();
    assertEquals(m.begin(), p);
  }

  @Test void testAdvancePastEnd() {
    LinkedHashTable<Integer, String> m = abc();
    assertThrows(InvalidIteratorException.class, () -> m.end().next());
    assertThrows(InvalidIteratorException.class, () -> m.readOnlyEnd().next());
    assertThrows(InvalidIteratorException.class, () -> m.begin().next().next().next().next());
  }

  @Test void testRetreatBeforeFirst() {
    LinkedHashTable<Integer, String> m = abc();
    assertThrows(InvalidIteratorException.class, () -> m.begin().previous());
    assertThrows(InvalidIteratorException.class, () -> m.readOnlyBegin().previous());
  }

  @Test void testEmptyTableBoundaries() {
    LinkedHashTable<Integer, String> empty = new LinkedHashTable<>();
    assertEquals(empty.end(), empty.begin());
    assertTrue(empty.begin().isEnd());
    assertThrows(InvalidIteratorException.class, () -> empty.end().previous());
    assertThrows(InvalidIteratorException.class, () -> empty.begin().next());
  }

  @Test void testDereferenceEnd() {
    LinkedHashTable<Integer, String> m = abc();
    assertThrows(InvalidIteratorException.class, () -> m.end().getKey());
    assertThrows(InvalidIteratorException.class, () -> m.end().getValue());
    assertThrows(InvalidIteratorException.class, () -> m.end().setValue("x"));
    assertThrows(InvalidIteratorException.class, () -> m.end().entry());
    assertThrows(InvalidIteratorException.class, () -> m.readOnlyEnd().entry());
  }

  @Test void testEqualityNeedsSameTable() {
    LinkedHashTable<Integer, String> m = abc();
    LinkedHashTable<Integer, String> other = new LinkedHashTable<>(m);
    assertNotEquals(m.end(), other.end());
    assertNotEquals(m.begin(), other.begin());
    assertEquals(m.begin().getKey(), other.begin().getKey());

    LinkedHashTable<Integer, String> empty1 = new LinkedHashTable<>();
    LinkedHashTable<Integer, String> empty2 = new LinkedHashTable<>();
    assertNotEquals(empty1.end(), empty2.end());
  }

  @Test void testEqualityAcrossFlavors() {
    LinkedHashTable<Integer, String> m = abc();
    ReadOnlyPosition<Integer, String> ro = m.readOnlyFind(2);
    Position<Integer, String> rw = m.find(2);
    assertEquals(ro, rw);
    assertEquals(rw, ro);
    assertEquals(ro.hashCode(), rw.hashCode());
    assertEquals(rw.asReadOnly(), ro);
    assertEquals(m.readOnlyEnd(), m.end());
    assertEquals(m.readOnlyFind(99), m.end());
    assertNotEquals(m.find(1), m.find(2));
  }

  @Test void testSetValueWritesThrough() {
    LinkedHashTable<Integer, String> m = abc();
    Position<Integer, String> p = m.find(2);
    assertEquals("b", p.setValue("B"));
    assertEquals("B", m.at(2));
    assertEquals("B", m.readOnlyFind(2).getValue());

    Map.Entry<Integer, String> e = m.find(3).entry();
    e.setValue("C");
    assertEquals("C", m.get(3));
  }

  @Test void testReadOnlyEntryRejectsWrites() {
    LinkedHashTable<Integer, String> m = abc();
    Map.Entry<Integer, String> e = m.readOnlyBegin().entry();
    assertEquals(Pair.of(1, "a"), e);
    assertThrows(UnsupportedOperationException.class, () -> e.setValue("z"));
    assertEquals("a", m.at(1));
  }

  @Test void testEraseInvalidatesOnlyErasedEntry() {
    LinkedHashTable<Integer, String> m = abc();
    Position<Integer, String> first = m.begin();
    Position<Integer, String> second = first.next();
    Position<Integer, String> third = second.next();
    Position<Integer, String> end = m.end();
    ReadOnlyPosition<Integer, String> secondRo = m.readOnlyFind(2);

    m.erase(second);
    assertThrows(InvalidIteratorException.class, second::getKey);
    assertThrows(InvalidIteratorException.class, secondRo::getValue);
    assertThrows(InvalidIteratorException.class, second::next);
    assertThrows(InvalidIteratorException.class, () -> m.erase(second));

    assertEquals(1, first.getKey());
    assertEquals(third, first.next());
    assertEquals(first, third.previous());
    assertEquals(end, third.next());
  }

  @Test void testReusedSlotDoesNotRevivePosition() {
    LinkedHashTable<Integer, String> m = abc();
    Position<Integer, String> second = m.find(2);
    m.erase(second);
    // the freed slot is handed to the next insertion
    Position<Integer, String> fresh = m.insert(4, "d").position();
    assertNotEquals(second, fresh);
    assertThrows(InvalidIteratorException.class, second::getKey);
    assertEquals("d", fresh.getValue());
  }

  @Test void testInsertAndGrowthKeepPositions() {
    LinkedHashTable<Integer, String> m = abc();
    Position<Integer, String> first = m.begin();
    Position<Integer, String> end = m.end();
    int bucketCount = m.bucketCount();
    for (int i = 100; i < 200; i++) {
      m.insert(i, "x");
    }
    assertTrue(m.bucketCount() > bucketCount);
    assertEquals(1, first.getKey());
    assertEquals("a", first.getValue());
    assertEquals(2, first.next().getKey());
    assertEquals(199, end.previous().getKey());
    assertConsistent(m);
  }

  @Test void testClearInvalidatesEverything() {
    LinkedHashTable<Integer, String> m = abc();
    Position<Integer, String> first = m.begin();
    Position<Integer, String> end = m.end();
    ReadOnlyPosition<Integer, String> roEnd = m.readOnlyEnd();
    m.clear();
    assertThrows(InvalidIteratorException.class, first::getKey);
    assertThrows(InvalidIteratorException.class, end::isEnd);
    assertThrows(InvalidIteratorException.class, roEnd::previous);
    assertNotEquals(end, m.end());
    assertTrue(m.end().isEnd());
  }

  @Test void testEraseForeignPosition() {
    LinkedHashTable<Integer, String> m = abc();
    LinkedHashTable<Integer, String> other = new LinkedHashTable<>(m);
    Position<Integer, String> foreign = other.begin();
    assertThrows(InvalidIteratorException.class, () -> m.erase(foreign));
    assertEquals(3, m.size());
    assertEquals(3, other.size());
    assertFalse(foreign.belongsTo(m));
    assertTrue(foreign.belongsTo(other));
  }

  @Test void testEraseEnd() {
    LinkedHashTable<Integer, String> m = abc();
    assertThrows(InvalidIteratorException.class, () -> m.erase(m.end()));
    assertEquals(3, m.size());
    assertConsistent(m);
  }

  @Test void testEraseWhileWalking() {
    LinkedHashTable<Integer, String> m = abc();
    for (Position<Integer, String> p = m.begin(); !p.isEnd(); ) {
      Position<Integer, String> next = p.next();
      if (p.getKey() % 2 == 1) {
        m.erase(p);
      }
      p = next;
    }
    assertEquals(List.of(Pair.of(2, "b")), walk(m));
  }

  @Test void testInvalidIteratorIsIllegalState() {
    LinkedHashTable<Integer, String> m = abc();
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> m.end().next());
    assertTrue(e instanceof InvalidIteratorException);
  }

  @Test void testToString() {
    LinkedHashTable<Integer, String> m = abc();
    assertEquals("Position[1=a]", m.begin().toString());
    assertEquals("Position[end]", m.end().toString());
    Position<Integer, String> p = m.begin();
    m.erase(p);
    assertEquals("Position[stale]", p.toString());
  }
}
