package temporal.core;

import java.util.Objects;

/**
 * Base type for caller contract violations raised by the engine. Carries the offending field and
 * value so the request can be corrected.
 */
public abstract class TemporalGraphException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String field;
  private final transient Object value;

  protected TemporalGraphException(String field, Object value, String message) {
    super(message);
    this.field = Objects.requireNonNull(field, "field");
    this.value = value;
  }

  public String field() {
    return field;
  }

  public Object value() {
    return value;
  }
}
