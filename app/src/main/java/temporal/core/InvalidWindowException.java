package temporal.core;

/** A window start or width that falls outside the lifetime of the temporal graph. */
public final class InvalidWindowException extends TemporalGraphException {
  private static final long serialVersionUID = 1L;

  public InvalidWindowException(String field, Object value, String message) {
    super(field, value, message);
  }
}
