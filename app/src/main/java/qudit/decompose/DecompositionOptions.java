package qudit.decompose;

import qudit.linalg.Tolerance;

/**
 * Configuration for controlled-gate decomposition.
 *
 * @param atol largest entry-wise error the verifier accepts
 * @param maxDisjuncts sum-of-products conditions with more accepted tuples are left undecomposed
 * @param extractGlobalPhase move a sub-gate's global shift onto the first control
 * @param useCanonicalPairs fold qubit controls into CX/CCX/CZ/CCZ families where possible
 */
public record DecompositionOptions(
    double atol, int maxDisjuncts, boolean extractGlobalPhase, boolean useCanonicalPairs) {

  public static final int DEFAULT_MAX_DISJUNCTS = 256;

  public static DecompositionOptions defaults() {
    return new DecompositionOptions(
        Tolerance.DECOMPOSITION_ATOL, DEFAULT_MAX_DISJUNCTS, true, true);
  }

  public static DecompositionOptions normalize(DecompositionOptions options) {
    if (options == null) {
      return defaults();
    }
    DecompositionOptions defaults = defaults();
    double atol = options.atol() > 0 ? options.atol() : defaults.atol();
    int maxDisjuncts =
        options.maxDisjuncts() > 0 ? options.maxDisjuncts() : defaults.maxDisjuncts();
    return new DecompositionOptions(
        atol, maxDisjuncts, options.extractGlobalPhase(), options.useCanonicalPairs());
  }

  public DecompositionOptions withAtol(double newAtol) {
    return new DecompositionOptions(newAtol, maxDisjuncts, extractGlobalPhase, useCanonicalPairs);
  }

  public DecompositionOptions withMaxDisjuncts(int newMaxDisjuncts) {
    return new DecompositionOptions(atol, newMaxDisjuncts, extractGlobalPhase, useCanonicalPairs);
  }

  public DecompositionOptions withExtractGlobalPhase(boolean enabled) {
    return new DecompositionOptions(atol, maxDisjuncts, enabled, useCanonicalPairs);
  }

  public DecompositionOptions withCanonicalPairs(boolean enabled) {
    return new DecompositionOptions(atol, maxDisjuncts, extractGlobalPhase, enabled);
  }
}
