package qudit.gates;

import java.util.List;
import java.util.Optional;
import qudit.core.Operation;
import qudit.core.Parameter;
import qudit.core.Qid;

/** Controlled {@code X**t}; the first qubit is the control. */
public final class CXPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(
              0.0, Projectors.offAllOnesPlus(1, Projectors.plusSpace(Projectors.PAULI_X))),
          new EigenComponent(
              1.0, Projectors.onAllOnes(1, Projectors.minusSpace(Projectors.PAULI_X))));

  public CXPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static CXPowGate of(double exponent) {
    return new CXPowGate(Parameter.of(exponent), 0.0);
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(2, 2);
  }

  /** Conjugates {@code CZ**t} by Hadamards on the target. */
  @Override
  public Optional<List<Operation>> decompose(List<Qid> qids) {
    validateArgs(qids);
    Qid target = qids.get(1);
    return Optional.of(
        List.of(
            CommonGates.H.on(target),
            new CZPowGate(exponent(), globalShift()).on(qids),
            CommonGates.H.on(target)));
  }

  @Override
  protected List<EigenComponent> eigenComponents() {
    return COMPONENTS;
  }

  @Override
  protected CXPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new CXPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "CX";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("@", "X");
  }
}
