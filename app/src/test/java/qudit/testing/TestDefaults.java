package qudit.testing;

import qudit.linalg.Tolerance;

/**
 * Centralized test configuration knobs. Lets JVM runners loosen or tighten the numeric
 * tolerance via the system property {@code qudit.atol} or the environment variable {@code
 * QUDIT_ATOL}.
 */
public final class TestDefaults {
  private static final String ATOL_PROPERTY = "qudit.atol";
  private static final String ATOL_ENV = "QUDIT_ATOL";

  private TestDefaults() {}

  /** Tolerance for unitary comparisons; defaults to the decomposition tolerance. */
  public static double atol() {
    String propertyValue = System.getProperty(ATOL_PROPERTY);
    if (propertyValue != null) {
      try {
        return Double.parseDouble(propertyValue);
      } catch (NumberFormatException ignored) {
        // fall back to env/default
      }
    }
    String envValue = System.getenv(ATOL_ENV);
    if (envValue != null) {
      try {
        return Double.parseDouble(envValue);
      } catch (NumberFormatException ignored) {
        // fall through
      }
    }
    return Tolerance.DECOMPOSITION_ATOL;
  }
}
