package qudit.gates;

import java.util.List;
import qudit.core.Parameter;

/** Powers of the Hadamard gate. */
public final class HPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(0.0, Projectors.plusSpace(Projectors.HADAMARD)),
          new EigenComponent(1.0, Projectors.minusSpace(Projectors.HADAMARD)));

  public HPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static HPowGate of(double exponent) {
    return new HPowGate(Parameter.of(exponent), 0.0);
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
  protected HPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new HPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "H";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("H");
  }
}
