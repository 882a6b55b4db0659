package qudit.gates;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.Gate;
import qudit.core.GlobalPhaseSplit;
import qudit.core.ParamResolver;
import qudit.core.Parameter;
import qudit.core.ValidationException;
import qudit.linalg.Complex;
import qudit.linalg.ComplexMatrix;
import qudit.linalg.Tolerance;

/** Zero-qudit gate multiplying the state by {@code e^{i pi halfTurns}}. */
public final class GlobalPhaseGate implements Gate {
  private final Parameter halfTurns;

  public GlobalPhaseGate(Parameter halfTurns) {
    this.halfTurns = Objects.requireNonNull(halfTurns, "halfTurns");
  }

  /** Phase gate for a unit-modulus coefficient. */
  public static GlobalPhaseGate of(Complex coefficient) {
    Objects.requireNonNull(coefficient, "coefficient");
    if (Math.abs(coefficient.abs() - 1.0) > Tolerance.DEFAULT_ATOL) {
      throw new ValidationException("Coefficient is not unitary: " + coefficient);
    }
    return new GlobalPhaseGate(Parameter.of(coefficient.arg() / Math.PI));
  }

  public Parameter halfTurns() {
    return halfTurns;
  }

  @Override
  public List<Integer> qidShape() {
    return List.of();
  }

  @Override
  public Optional<ComplexMatrix> unitary() {
    return halfTurns
        .numericValue()
        .map(h -> ComplexMatrix.diagonal(Complex.expi(Math.PI * h)));
  }

  @Override
  public boolean hasUnitary() {
    return !halfTurns.isSymbolic();
  }

  @Override
  public Optional<Gate> pow(double exponent) {
    return Optional.of(new GlobalPhaseGate(halfTurns.times(exponent)));
  }

  @Override
  public boolean isParameterized() {
    return halfTurns.isSymbolic();
  }

  @Override
  public Gate resolveParameters(ParamResolver resolver) {
    Parameter resolved = halfTurns.resolve(resolver);
    return resolved.equals(halfTurns) ? this : new GlobalPhaseGate(resolved);
  }

  /** The whole gate is phase; the remainder acts on no qudits. */
  @Override
  public Optional<GlobalPhaseSplit> globalPhaseSplit() {
    return Optional.of(new GlobalPhaseSplit(IdentityGate.of(List.of()), halfTurns));
  }

  @Override
  public double traceDistanceBound() {
    return 0.0;
  }

  private Parameter canonicalHalfTurns() {
    if (halfTurns.isSymbolic()) {
      return halfTurns;
    }
    double reduced = halfTurns.value() % 2.0;
    if (reduced < 0) {
      reduced += 2.0;
    }
    if (Tolerance.nearZero(reduced - 2.0, Tolerance.DEFAULT_ATOL)) {
      reduced = 0.0;
    }
    return Parameter.of(reduced + 0.0);
  }

  @Override
  public String repr() {
    return "GlobalPhaseGate(halfTurns=" + halfTurns + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GlobalPhaseGate other)) {
      return false;
    }
    return canonicalHalfTurns().equals(other.canonicalHalfTurns());
  }

  @Override
  public int hashCode() {
    return Objects.hash(GlobalPhaseGate.class, canonicalHalfTurns());
  }

  @Override
  public String toString() {
    return "GlobalPhase(" + halfTurns + ")";
  }
}
