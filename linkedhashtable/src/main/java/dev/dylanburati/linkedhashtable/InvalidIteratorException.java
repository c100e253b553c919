package dev.dylanburati.linkedhashtable;

/**
 * Thrown when a position handle is misused: moved past either end of the
 * table, dereferenced at the end, used after its entry was erased or the table
 * was cleared, or passed to a table that does not own it.
 */
public class InvalidIteratorException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public InvalidIteratorException(String message) {
    super(message);
  }
}
