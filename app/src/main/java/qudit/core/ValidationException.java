package qudit.core;

/**
 * Raised when a gate, control specification or operation is constructed from inconsistent or
 * out-of-range inputs. Always fatal to the construction that raised it.
 */
public class ValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ValidationException(String message) {
    super(message);
  }
}
