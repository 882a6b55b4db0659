package qudit.gates;

import java.util.List;
import qudit.core.Parameter;

/** Rotation about the X axis of the Bloch sphere; {@code X**1} is the bit flip. */
public final class XPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(0.0, Projectors.plusSpace(Projectors.PAULI_X)),
          new EigenComponent(1.0, Projectors.minusSpace(Projectors.PAULI_X)));

  public XPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static XPowGate of(double exponent) {
    return new XPowGate(Parameter.of(exponent), 0.0);
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
  protected XPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new XPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "X";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("X");
  }
}
