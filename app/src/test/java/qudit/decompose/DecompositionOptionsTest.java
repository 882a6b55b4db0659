package qudit.decompose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import qudit.linalg.Tolerance;

final class DecompositionOptionsTest {

  @Test
  void defaultsEnableEveryRule() {
    DecompositionOptions defaults = DecompositionOptions.defaults();
    assertEquals(Tolerance.DECOMPOSITION_ATOL, defaults.atol());
    assertEquals(DecompositionOptions.DEFAULT_MAX_DISJUNCTS, defaults.maxDisjuncts());
    assertTrue(defaults.extractGlobalPhase());
    assertTrue(defaults.useCanonicalPairs());
  }

  @Test
  void normalizeFillsInvalidLimits() {
    assertEquals(DecompositionOptions.defaults(), DecompositionOptions.normalize(null));
    DecompositionOptions normalized =
        DecompositionOptions.normalize(new DecompositionOptions(0.0, -3, false, false));
    assertEquals(Tolerance.DECOMPOSITION_ATOL, normalized.atol());
    assertEquals(DecompositionOptions.DEFAULT_MAX_DISJUNCTS, normalized.maxDisjuncts());
    assertFalse(normalized.extractGlobalPhase());
    assertFalse(normalized.useCanonicalPairs());
  }

  @Test
  void decomposerNormalizesItsOptions() {
    ControlledGateDecomposer decomposer =
        new ControlledGateDecomposer(new DecompositionOptions(-1.0, 0, true, true));
    assertEquals(DecompositionOptions.defaults(), decomposer.options());
  }
}
