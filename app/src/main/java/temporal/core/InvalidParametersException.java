package temporal.core;

/** Malformed random-generation arguments. */
public final class InvalidParametersException extends TemporalGraphException {
  private static final long serialVersionUID = 1L;

  public InvalidParametersException(String field, Object value, String message) {
    super(field, value, message);
  }
}
