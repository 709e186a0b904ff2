package temporal.core;

/**
 * Raised when a temporal graph description fails validation: duplicate or negative vertices,
 * dangling endpoints, self-loops, repeated pairs or a lifetime mismatch.
 */
public final class InvalidGraphException extends TemporalGraphException {
  private static final long serialVersionUID = 1L;

  public InvalidGraphException(String field, Object value, String message) {
    super(field, value, message);
  }
}
