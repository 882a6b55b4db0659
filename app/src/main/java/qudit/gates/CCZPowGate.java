package qudit.gates;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import qudit.core.Operation;
import qudit.core.Parameter;
import qudit.core.Qid;
import qudit.linalg.ComplexMatrix;

/** Phases the {@code |111>} state by {@code e^{i pi t}}. */
public final class CCZPowGate extends EigenGate {
  private static final List<EigenComponent> COMPONENTS =
      List.of(
          new EigenComponent(0.0, ComplexMatrix.identity(8).minus(Projectors.allOnes(3))),
          new EigenComponent(1.0, Projectors.allOnes(3)));

  public CCZPowGate(Parameter exponent, double globalShift) {
    super(exponent, globalShift);
  }

  public static CCZPowGate of(double exponent) {
    return new CCZPowGate(Parameter.of(exponent), 0.0);
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(2, 2, 2);
  }

  /**
   * Phase-polynomial circuit of seven {@code Z**(t/4)} rotations between CNOT sweeps. The
   * global shift becomes a leading {@link GlobalPhaseGate}.
   */
  @Override
  public Optional<List<Operation>> decompose(List<Qid> qids) {
    validateArgs(qids);
    Qid a = qids.get(0);
    Qid b = qids.get(1);
    Qid c = qids.get(2);
    ZPowGate p = new ZPowGate(exponent().times(0.25), 0.0);
    ZPowGate pInverse = new ZPowGate(exponent().times(-0.25), 0.0);

    List<Operation> ops = new ArrayList<>();
    if (globalShift() != 0.0) {
      ops.add(new GlobalPhaseGate(exponent().times(globalShift())).on());
    }
    ops.add(p.on(a));
    ops.add(p.on(b));
    ops.add(p.on(c));
    sweep(ops, a, b, c);
    ops.add(pInverse.on(b));
    ops.add(p.on(c));
    sweep(ops, a, b, c);
    ops.add(pInverse.on(c));
    sweep(ops, a, b, c);
    ops.add(pInverse.on(c));
    sweep(ops, a, b, c);
    return Optional.of(List.copyOf(ops));
  }

  private static void sweep(List<Operation> ops, Qid a, Qid b, Qid c) {
    ops.add(CommonGates.CX.on(a, b));
    ops.add(CommonGates.CX.on(b, c));
  }

  @Override
  protected List<EigenComponent> eigenComponents() {
    return COMPONENTS;
  }

  @Override
  protected CCZPowGate withParameters(Parameter newExponent, double newGlobalShift) {
    return new CCZPowGate(newExponent, newGlobalShift);
  }

  @Override
  protected String symbol() {
    return "CCZ";
  }

  @Override
  protected List<String> wireSymbols() {
    return List.of("@", "@", "@");
  }
}
