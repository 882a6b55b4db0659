package qudit.gates;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Gate;
import qudit.core.GlobalPhaseSplit;
import qudit.core.ParamResolver;
import qudit.core.Parameter;
import qudit.linalg.Complex;
import qudit.linalg.ComplexMatrix;
import qudit.linalg.Tolerance;

/**
 * Gate defined by its eigenspaces: {@code U = sum_k e^{i pi t (h_k + s)} P_k}, where {@code t}
 * is the exponent, {@code s} the global shift, {@code h_k} the eigenvalue half-turns and {@code
 * P_k} the matching projectors.
 *
 * <p>Equality compares the exponent reduced modulo the gate's period, so {@code Y**-1} equals
 * {@code Y}.
 */
public abstract class EigenGate implements Gate {
  private final Parameter exponent;
  private final double globalShift;

  protected EigenGate(Parameter exponent, double globalShift) {
    this.exponent = Objects.requireNonNull(exponent, "exponent");
    this.globalShift = globalShift + 0.0;
  }

  /** Eigenvalue half-turns with their projectors; projectors sum to the identity. */
  protected abstract List<EigenComponent> eigenComponents();

  /** Same gate family with different parameters. */
  protected abstract EigenGate withParameters(Parameter newExponent, double newGlobalShift);

  /** Short family name used in text forms, e.g. {@code X} or {@code CCZ}. */
  protected abstract String symbol();

  /** Wire symbols for a renderer, one per qudit. */
  protected abstract List<String> wireSymbols();

  public final Parameter exponent() {
    return exponent;
  }

  public final double globalShift() {
    return globalShift;
  }

  public EigenGate withExponent(Parameter newExponent) {
    return withParameters(newExponent, globalShift);
  }

  public EigenGate withGlobalShift(double newGlobalShift) {
    return withParameters(exponent, newGlobalShift);
  }

  @Override
  public Optional<ComplexMatrix> unitary() {
    if (exponent.isSymbolic()) {
      return Optional.empty();
    }
    double t = exponent.value();
    ComplexMatrix result = null;
    for (EigenComponent component : eigenComponents()) {
      Complex phase = Complex.expi(Math.PI * t * (component.halfTurns() + globalShift));
      ComplexMatrix term = component.projector().scale(phase);
      result = result == null ? term : result.plus(term);
    }
    return Optional.ofNullable(result);
  }

  @Override
  public boolean hasUnitary() {
    return !exponent.isSymbolic();
  }

  @Override
  public Optional<Gate> pow(double power) {
    return Optional.of(withExponent(exponent.times(power)));
  }

  @Override
  public boolean isParameterized() {
    return exponent.isSymbolic();
  }

  @Override
  public Gate resolveParameters(ParamResolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    Parameter resolved = exponent.resolve(resolver);
    return resolved.equals(exponent) ? this : withExponent(resolved);
  }

  @Override
  public Optional<GlobalPhaseSplit> globalPhaseSplit() {
    if (globalShift == 0.0) {
      return Optional.empty();
    }
    return Optional.of(new GlobalPhaseSplit(withGlobalShift(0.0), exponent.times(globalShift)));
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    return Optional.of(new DiagramInfo(wireSymbols(), exponent, true, -1));
  }

  /** Bound from the spread of eigenvalue angles; 1 for symbolic exponents. */
  @Override
  public double traceDistanceBound() {
    if (exponent.isSymbolic()) {
      return 1.0;
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (EigenComponent component : eigenComponents()) {
      double angle = Math.PI * exponent.value() * component.halfTurns();
      min = Math.min(min, angle);
      max = Math.max(max, angle);
    }
    double spread = max - min;
    return spread >= Math.PI ? 1.0 : Math.sin(spread / 2);
  }

  /**
   * Smallest exponent period shared by every shifted eigenvalue, or empty when the periods are
   * incommensurate.
   */
  Optional<Double> period() {
    List<Double> periods = new ArrayList<>();
    for (EigenComponent component : eigenComponents()) {
      double shifted = component.halfTurns() + globalShift;
      if (!Tolerance.nearZero(shifted, Tolerance.DEFAULT_ATOL)) {
        periods.add(Math.abs(2.0 / shifted));
      }
    }
    if (periods.isEmpty()) {
      return Optional.empty();
    }
    double candidate = periods.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
    for (double p : periods) {
      if (!Tolerance.nearZeroMod(candidate, p, Tolerance.DEFAULT_ATOL)) {
        return Optional.empty();
      }
    }
    return Optional.of(candidate);
  }

  Parameter canonicalExponent() {
    if (exponent.isSymbolic()) {
      return exponent;
    }
    Optional<Double> period = period();
    if (period.isEmpty()) {
      return exponent;
    }
    double p = period.get();
    double reduced = exponent.value() % p;
    if (reduced < 0) {
      reduced += p;
    }
    if (Tolerance.nearZero(reduced - p, Tolerance.DEFAULT_ATOL)) {
      reduced = 0.0;
    }
    // Folds -0.0 into 0.0.
    return Parameter.of(reduced + 0.0);
  }

  @Override
  public String repr() {
    return getClass().getSimpleName() + "(exponent=" + exponent + ", globalShift=" + globalShift
        + ")";
  }

  @Override
  public String toString() {
    if (!exponent.isSymbolic() && exponent.value() == 1.0) {
      return symbol();
    }
    return symbol() + "**" + exponent;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    EigenGate other = (EigenGate) o;
    return Double.compare(globalShift, other.globalShift) == 0
        && canonicalExponent().equals(other.canonicalExponent());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), globalShift, canonicalExponent());
  }

  /** Eigenvalue {@code e^{i pi halfTurns}} and the projector onto its eigenspace. */
  protected record EigenComponent(double halfTurns, ComplexMatrix projector) {
    public EigenComponent {
      Objects.requireNonNull(projector, "projector");
    }
  }
}
