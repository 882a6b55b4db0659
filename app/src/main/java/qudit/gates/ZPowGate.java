package qudit.gates;

import java.util.List;
import java.util.Optional;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Parameter;
import qudit.linalg.ComplexMatrix;

/** Phase rotation {@code diag(1, e^{i pi t})}; {@code Z**1} is the phase flip. */
public final class ZPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(0.0, ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, 0}})),
          new EigenComponent(1.0, ComplexMatrix.ofReal(new double[][] {{0, 0}, {0, 1}})));

  public ZPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static ZPowGate of(double exponent) {
    return new ZPowGate(Parameter.of(exponent), 0.0);
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
  protected ZPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new ZPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "Z";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("Z");
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    String named = namedQuarterTurn();
    if (named != null && globalShift() == 0.0) {
      return Optional.of(DiagramInfo.of(named));
    }
    return super.diagramInfo(args);
  }

  @Override
  public String toString() {
    if (globalShift() == 0.0 && !exponent().isSymbolic()) {
      double t = exponent().value();
      if (t == 0.5) {
        return "S";
      }
      if (t == -0.5) {
        return "S**-1";
      }
      if (t == 0.25) {
        return "T";
      }
      if (t == -0.25) {
        return "T**-1";
      }
    }
    return super.toString();
  }

  private String namedQuarterTurn() {
    if (exponent().isSymbolic()) {
      return null;
    }
    double t = exponent().value();
    if (t == 0.5) {
      return "S";
    }
    if (t == 0.25) {
      return "T";
    }
    return null;
  }
}
