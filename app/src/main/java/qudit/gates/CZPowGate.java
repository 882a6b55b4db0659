package qudit.gates;

import java.util.List;
import qudit.core.Parameter;
import qudit.linalg.ComplexMatrix;

/** Phases the {@code |11>} state by {@code e^{i pi t}}. */
public final class CZPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(0.0, ComplexMatrix.identity(4).minus(Projectors.allOnes(2))),
          new EigenComponent(1.0, Projectors.allOnes(2)));

  public CZPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static CZPowGate of(double exponent) {
    return new CZPowGate(Parameter.of(exponent), 0.0);
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(2, 2);
  }

  @Override
  protected List<EigenComponent> eigenComponents() {
    return COMPONENTS;
  }

  @Override
  protected CZPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new CZPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "CZ";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("@", "@");
  }
}
