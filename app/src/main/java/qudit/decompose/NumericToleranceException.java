package qudit.decompose;

/** A decomposition's composed unitary disagrees with the dense unitary beyond tolerance. */
public final class NumericToleranceException extends RuntimeException {
  private final double error;
  private final double atol;

  public NumericToleranceException(String message, double error, double atol) {
    super(message + " (error " + error + " > atol " + atol + ")");
    this.error = error;
    this.atol = atol;
  }

  public double error() {
    return error;
  }

  public double atol() {
    return atol;
  }
}
