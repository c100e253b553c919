package dev.dylanburati.linkedhashtable;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link LinkedHashTable#at} when the requested key is absent.
 */
public class IndexOutOfBoundException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;

  public IndexOutOfBoundException(String message) {
    super(message);
  }
}
