package qudit.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class ParameterTest {

  @Test
  void symbolicParametersScaleTheirCoefficient() {
    Parameter t = Parameter.symbol("t").times(0.5);
    assertTrue(t.isSymbolic());
    assertEquals("0.5*t", t.toString());
    assertThrows(IllegalStateException.class, t::value);
    assertTrue(t.numericValue().isEmpty());
  }

  @Test
  void resolveSubstitutesKnownSymbols() {
    Parameter t = Parameter.symbol("t").times(2.0);
    Parameter resolved = t.resolve(ParamResolver.of("t", 0.25));
    assertFalse(resolved.isSymbolic());
    assertEquals(0.5, resolved.value());
  }

  @Test
  void resolveKeepsUnknownSymbols() {
    Parameter t = Parameter.symbol("t");
    assertEquals(t, t.resolve(ParamResolver.of("s", 1.0)));
  }

  @Test
  void integersPrintWithoutFraction() {
    assertEquals("1", Parameter.of(1.0).toString());
    assertEquals("0.125", Parameter.of(0.125).toString());
  }
}
