package qudit.gates;

import java.util.List;
import qudit.core.Parameter;

/** Rotation about the Y axis of the Bloch sphere. */
public final class YPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(0.0, Projectors.plusSpace(Projectors.PAULI_Y)),
          new EigenComponent(1.0, Projectors.minusSpace(Projectors.PAULI_Y)));

  public YPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static YPowGate of(double exponent) {
    return new YPowGate(Parameter.of(exponent), 0.0);
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(2);
  }

  @Override
  protected List<EigenComponent> eigenComponents() {
    return COMPONENTS;
  }

  @Override
  protected YPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new YPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "Y";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("Y");
  }
}
