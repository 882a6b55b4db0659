package qudit.gates;

import java.util.List;
import java.util.Optional;
import qudit.core.Operation;
import qudit.core.Parameter;
import qudit.core.Qid;

/** Doubly-controlled {@code X**t}; at exponent 1 this is the Toffoli gate. */
public final class CCXPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(
              0.0, Projectors.offAllOnesPlus(2, Projectors.plusSpace(Projectors.PAULI_X))),
          new EigenComponent(
              1.0, Projectors.onAllOnes(2, Projectors.minusSpace(Projectors.PAULI_X))));

  public CCXPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static CCXPowGate of(double exponent) {
    return new CCXPowGate(Parameter.of(exponent), 0.0);
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(2, 2, 2);
  }

  @Override
  public Optional<List<Operation>> decompose(List<Qid> qids) {
    validateArgs(qids);
    Qid target = qids.get(2);
    return Optional.of(
        List.of(
            CommonGates.H.on(target),
            new CCZPowGate(exponent(), globalShift()).on(qids),
            CommonGates.H.on(target)));
  }

  @Override
  protected List<EigenComponent> eigenComponents() {
    return COMPONENTS;
  }

  @Override
  protected CCXPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new CCXPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "CCX";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("@", "@", "X");
  }
}
