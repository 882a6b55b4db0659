package qudit.linalg;

/** Shared numeric tolerances. */
public final class Tolerance {
  private Tolerance() {}

  /** Default absolute tolerance for approximate comparisons of gate parameters. */
  public static final double DEFAULT_ATOL = 1e-8;

  /** Tolerance decompositions must meet when replayed against the dense unitary. */
  public static final double DECOMPOSITION_ATOL = 1e-10;

  public static boolean nearZero(double value, double atol) {
    return Math.abs(value) <= atol;
  }

  /** True when {@code value} is within {@code atol} of an integer multiple of {@code period}. */
  public static boolean nearZeroMod(double value, double period, double atol) {
    double rem = value % period;
    if (rem < 0) {
      rem += period;
    }
    return rem <= atol || period - rem <= atol;
  }
}
