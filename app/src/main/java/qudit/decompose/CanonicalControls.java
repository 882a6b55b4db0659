package qudit.decompose;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import java.util.function.Function;
import qudit.core.Gate;
import qudit.core.Parameter;
import qudit.gates.CCXPowGate;
import qudit.gates.CCZPowGate;
import qudit.gates.CXPowGate;
import qudit.gates.CZPowGate;
import qudit.gates.EigenGate;
import qudit.gates.XPowGate;
import qudit.gates.ZPowGate;

/**
 * Table of gate families whose qubit-controlled form is itself a standard gate: {@code X -> CX
 * -> CCX} and {@code Z -> CZ -> CCZ}, for any exponent and zero global shift.
 */
public final class CanonicalControls {
  private static final ImmutableMap<Class<? extends EigenGate>, Function<Parameter, EigenGate>>
      NEXT =
          ImmutableMap.of(
              XPowGate.class, exponent -> new CXPowGate(exponent, 0.0),
              CXPowGate.class, exponent -> new CCXPowGate(exponent, 0.0),
              ZPowGate.class, exponent -> new CZPowGate(exponent, 0.0),
              CZPowGate.class, exponent -> new CCZPowGate(exponent, 0.0));

  private CanonicalControls() {}

  /** The gate equal to {@code gate} controlled by one default-valued qubit, if tabulated. */
  public static Optional<EigenGate> controlledForm(Gate gate) {
    if (!(gate instanceof EigenGate eigen) || eigen.globalShift() != 0.0) {
      return Optional.empty();
    }
    Function<Parameter, EigenGate> next = NEXT.get(eigen.getClass());
    return next == null ? Optional.empty() : Optional.of(next.apply(eigen.exponent()));
  }
}
