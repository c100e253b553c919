package dev.dylanburati.linkedhashtable;

import java.util.Objects;

/* package-private */ class DefaultHasher implements Hasher<Object>, KeyEquality<Object> {
  private static DefaultHasher instance = null;

  private DefaultHasher() {}

  static DefaultHasher instance() {
    if (instance == null) {
      instance = new DefaultHasher();
    }
    return instance;
  }

  @Override
  public int hash(Object key) {
    int h = Objects.hashCode(key);
    // fold the upper half in, so small power-of-two bucket counts see every bit
    return h ^ (h >>> 16);
  }

  @Override
  public boolean equal(Object a, Object b) {
    return Objects.equals(a, b);
  }
}
