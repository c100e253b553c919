package dev.dylanburati.linkedhashtable;

import java.util.Map;
import java.util.Objects;

/**
 * A key/value pair with an immutable key and a mutable value.
 */
public class Pair<K, V> implements Map.Entry<K, V> {
  private final K key;
  private V value;

  public Pair(K key, V value) {
    this.key = key;
    this.value = value;
  }

  public static <K, V> Pair<K, V> of(K key, V value) {
    return new Pair<>(key, value);
  }

  @Override
  public K getKey() {
    return this.key;
  }

  @Override
  public V getValue() {
    return this.value;
  }

  @Override
  public V setValue(V value) {
    V prev = this.value;
    this.value = value;
    return prev;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Map.Entry<?, ?>)) {
      return false;
    }
    Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
    return Objects.equals(this.key, e.getKey()) && Objects.equals(this.value, e.getValue());
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.key) ^ Objects.hashCode(this.value);
  }

  @Override
  public String toString() {
    return this.key + "=" + this.value;
  }
}
