package qudit.decompose;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qudit.controlled.ControlledGate;
import qudit.controls.ControlValues;
import qudit.controls.ProductOfSums;
import qudit.core.Gate;
import qudit.core.GlobalPhaseSplit;
import qudit.core.Operation;
import qudit.core.Parameter;
import qudit.core.Qid;
import qudit.gates.CommonGates;
import qudit.gates.EigenGate;
import qudit.gates.MatrixGate;
import qudit.gates.QuditPlusGate;
import qudit.gates.ZPowGate;
import qudit.linalg.Complex;
import qudit.linalg.ComplexMatrix;

/**
 * Rewrites a {@link ControlledGate} applied to concrete qudits into simpler operations with the
 * same unitary, global phase included.
 *
 * <p>Each call applies the first matching {@link DecompositionRule} once; the produced
 * operations may decompose further. Rules run in declaration order, so later rules can assume
 * earlier ones did not match: by the time {@link DecompositionRule#PHASE_EXTRACTION} is tried,
 * every control is a product entry accepting only its qudit's default value {@code d - 1}.
 */
public final class ControlledGateDecomposer {
  private static final Logger LOG = LoggerFactory.getLogger(ControlledGateDecomposer.class);

  private static final ControlledGateDecomposer DEFAULT =
      new ControlledGateDecomposer(DecompositionOptions.defaults());

  private final DecompositionOptions options;

  public ControlledGateDecomposer(DecompositionOptions options) {
    this.options = DecompositionOptions.normalize(options);
  }

  public static ControlledGateDecomposer withDefaults() {
    return DEFAULT;
  }

  public DecompositionOptions options() {
    return options;
  }

  /** One rewrite step, or empty when {@code gate} is a leaf. */
  public Optional<List<Operation>> decomposeOnce(ControlledGate gate, List<Qid> qids) {
    return decomposeStep(gate, qids).map(DecompositionStep::operations);
  }

  /** Like {@link #decomposeOnce} but also reports which rule fired. */
  public Optional<DecompositionStep> decomposeStep(ControlledGate gate, List<Qid> qids) {
    Objects.requireNonNull(gate, "gate");
    gate.validateArgs(qids);
    Optional<DecompositionStep> step = apply(new Target(gate, qids));
    if (step.isPresent()) {
      LOG.debug(
          "{} rewrote {} into {} operations",
          step.get().rule(),
          gate,
          step.get().operations().size());
    } else {
      LOG.debug("No decomposition for {}", gate);
    }
    return step;
  }

  private Optional<DecompositionStep> apply(Target target) {
    if (target.gate.numControls() == 0) {
      return step(DecompositionRule.NO_CONTROLS, target.subGateOp());
    }
    if (!(target.gate.controlValues() instanceof ProductOfSums product)) {
      return splitDisjunction(target);
    }
    Optional<DecompositionStep> step = dropUnconditional(target, product);
    if (step.isEmpty()) {
      step = splitValues(target, product);
    }
    if (step.isEmpty()) {
      step = relabelNonDefault(target, product);
    }
    if (step.isEmpty() && options.extractGlobalPhase()) {
      step = extractGlobalPhase(target);
    }
    if (step.isEmpty()) {
      step = controlledGlobalPhase(target);
    }
    if (step.isEmpty() && options.useCanonicalPairs()) {
      step = canonicalPair(target);
    }
    if (step.isEmpty()) {
      step = decomposeSubGate(target);
    }
    return step;
  }

  /** Splits the accepted tuples into disjoint Cartesian cubes, one controlled gate per cube. */
  private Optional<DecompositionStep> splitDisjunction(Target target) {
    List<List<Integer>> tuples = target.gate.controlValues().acceptedAssignments();
    if (tuples.size() > options.maxDisjuncts()) {
      LOG.debug(
          "{} accepts {} tuples, above maxDisjuncts={}",
          target.gate,
          tuples.size(),
          options.maxDisjuncts());
      return Optional.empty();
    }
    List<Operation> ops = new ArrayList<>();
    for (List<SortedSet<Integer>> cube : cubes(tuples, 0, target.gate.numControls())) {
      ControlledGate part =
          ControlledGate.builder(target.gate.subGate())
              .controlValues(ProductOfSums.of(cube))
              .controlQidShape(target.gate.controlQidShape())
              .build();
      ops.add(part.on(target.qids));
    }
    return step(DecompositionRule.DISJUNCTION_SPLIT, ops);
  }

  /**
   * Case-splits on the qudit at {@code position}, merging values whose remaining tuple sets
   * coincide. Produces at most one cube per tuple.
   */
  static List<List<SortedSet<Integer>>> cubes(
      List<List<Integer>> tuples, int position, int length) {
    List<List<SortedSet<Integer>>> result = new ArrayList<>();
    if (position == length) {
      if (!tuples.isEmpty()) {
        result.add(new ArrayList<>());
      }
      return result;
    }
    Map<Integer, Set<List<Integer>>> suffixesByValue = new TreeMap<>();
    for (List<Integer> tuple : tuples) {
      suffixesByValue
          .computeIfAbsent(tuple.get(position), v -> new TreeSet<>(ControlValues.LEXICOGRAPHIC))
          .add(tuple);
    }
    Map<Set<List<Integer>>, SortedSet<Integer>> valuesBySuffixes = new LinkedHashMap<>();
    Map<Set<List<Integer>>, List<List<Integer>>> representative = new LinkedHashMap<>();
    for (Map.Entry<Integer, Set<List<Integer>>> entry : suffixesByValue.entrySet()) {
      Set<List<Integer>> suffixes = new TreeSet<>(ControlValues.LEXICOGRAPHIC);
      for (List<Integer> tuple : entry.getValue()) {
        suffixes.add(tuple.subList(position + 1, length));
      }
      valuesBySuffixes.computeIfAbsent(suffixes, s -> new TreeSet<>()).add(entry.getKey());
      representative.putIfAbsent(suffixes, new ArrayList<>(entry.getValue()));
    }
    for (Map.Entry<Set<List<Integer>>, SortedSet<Integer>> entry : valuesBySuffixes.entrySet()) {
      for (List<SortedSet<Integer>> tail :
          cubes(representative.get(entry.getKey()), position + 1, length)) {
        List<SortedSet<Integer>> cube = new ArrayList<>(length - position);
        cube.add(entry.getValue());
        cube.addAll(tail);
        result.add(cube);
      }
    }
    return result;
  }

  private Optional<DecompositionStep> dropUnconditional(Target target, ProductOfSums product) {
    List<Integer> kept = new ArrayList<>();
    for (int i = 0; i < target.gate.numControls(); i++) {
      if (product.sumAt(i).size() < target.gate.controlQidShape().get(i)) {
        kept.add(i);
      }
    }
    if (kept.size() == target.gate.numControls()) {
      return Optional.empty();
    }
    if (kept.isEmpty()) {
      return step(DecompositionRule.DROP_UNCONDITIONAL, target.subGateOp());
    }
    List<SortedSet<Integer>> sums = new ArrayList<>();
    List<Integer> shape = new ArrayList<>();
    List<Qid> qids = new ArrayList<>();
    for (int i : kept) {
      sums.add(product.sumAt(i));
      shape.add(target.gate.controlQidShape().get(i));
      qids.add(target.qids.get(i));
    }
    qids.addAll(target.targets());
    ControlledGate reduced =
        ControlledGate.builder(target.gate.subGate())
            .controlValues(ProductOfSums.of(sums))
            .controlQidShape(shape)
            .build();
    return step(DecompositionRule.DROP_UNCONDITIONAL, reduced.on(qids));
  }

  /** The accepted subspaces of each value are disjoint, so the per-value operations commute. */
  private Optional<DecompositionStep> splitValues(Target target, ProductOfSums product) {
    for (int i = 0; i < target.gate.numControls(); i++) {
      SortedSet<Integer> values = product.sumAt(i);
      if (values.size() < 2) {
        continue;
      }
      List<Operation> ops = new ArrayList<>(values.size());
      for (int value : values) {
        List<SortedSet<Integer>> sums = new ArrayList<>(product.qubitSums());
        sums.set(i, new TreeSet<>(List.of(value)));
        ops.add(target.withValues(ProductOfSums.of(sums)).on(target.qids));
      }
      return step(DecompositionRule.VALUE_SPLIT, ops);
    }
    return Optional.empty();
  }

  private Optional<DecompositionStep> relabelNonDefault(Target target, ProductOfSums product) {
    List<Operation> before = new ArrayList<>();
    List<Operation> after = new ArrayList<>();
    for (int i = 0; i < target.gate.numControls(); i++) {
      int dim = target.gate.controlQidShape().get(i);
      int value = product.sumAt(i).first();
      if (value == dim - 1) {
        continue;
      }
      Qid control = target.qids.get(i);
      if (dim == 2) {
        before.add(CommonGates.X.on(control));
        after.add(CommonGates.X.on(control));
      } else {
        int shift = dim - 1 - value;
        before.add(new QuditPlusGate(dim, shift).on(control));
        after.add(new QuditPlusGate(dim, -shift).on(control));
      }
    }
    if (before.isEmpty()) {
      return Optional.empty();
    }
    List<Operation> ops = new ArrayList<>(before);
    ops.add(
        target.withValues(ProductOfSums.defaults(target.gate.controlQidShape())).on(target.qids));
    ops.addAll(after);
    return step(DecompositionRule.RELABEL_NON_DEFAULT, ops);
  }

  private Optional<DecompositionStep> extractGlobalPhase(Target target) {
    Optional<GlobalPhaseSplit> split = target.gate.subGate().globalPhaseSplit();
    if (split.isEmpty()
        || split.get().halfTurns().isSymbolic()
        || split.get().remainder().numQudits() == 0) {
      return Optional.empty();
    }
    List<Operation> ops = new ArrayList<>();
    ops.add(target.gate.withSubGate(split.get().remainder()).on(target.qids));
    ops.add(phaseOnControls(target, split.get().halfTurns().value()));
    return step(DecompositionRule.PHASE_EXTRACTION, ops);
  }

  private Optional<DecompositionStep> controlledGlobalPhase(Target target) {
    Optional<GlobalPhaseSplit> split = target.gate.subGate().globalPhaseSplit();
    if (split.isEmpty()
        || split.get().halfTurns().isSymbolic()
        || split.get().remainder().numQudits() != 0) {
      return Optional.empty();
    }
    return step(
        DecompositionRule.CONTROLLED_GLOBAL_PHASE,
        phaseOnControls(target, split.get().halfTurns().value()));
  }

  /**
   * Phase {@code e^{i pi halfTurns}} on level {@code d - 1} of the first control, controlled by
   * the remaining (default-valued) controls.
   */
  private static Operation phaseOnControls(Target target, double halfTurns) {
    List<Qid> controls = target.controls();
    Qid first = controls.get(0);
    Gate phase;
    if (first.dimension() == 2) {
      phase = new ZPowGate(Parameter.of(halfTurns), 0.0);
    } else {
      Complex[] diagonal = new Complex[first.dimension()];
      for (int k = 0; k < diagonal.length - 1; k++) {
        diagonal[k] = Complex.ONE;
      }
      diagonal[diagonal.length - 1] = Complex.expi(Math.PI * halfTurns);
      phase = MatrixGate.of(ComplexMatrix.diagonal(diagonal), List.of(first.dimension()));
    }
    return phase.on(first).controlledBy(controls.subList(1, controls.size()), null);
  }

  /** Folds qubit controls into the sub-gate from the innermost control outward. */
  private Optional<DecompositionStep> canonicalPair(Target target) {
    List<Integer> shape = target.gate.controlQidShape();
    Gate folded = target.gate.subGate();
    int remaining = shape.size();
    while (remaining > 0 && shape.get(remaining - 1) == 2) {
      Optional<EigenGate> next = CanonicalControls.controlledForm(folded);
      if (next.isEmpty()) {
        break;
      }
      folded = next.get();
      remaining--;
    }
    if (remaining == shape.size()) {
      return Optional.empty();
    }
    Gate result =
        remaining == 0
            ? folded
            : ControlledGate.builder(folded)
                .controlQidShape(shape.subList(0, remaining))
                .build();
    return step(DecompositionRule.CANONICAL_PAIR, result.on(target.qids));
  }

  private Optional<DecompositionStep> decomposeSubGate(Target target) {
    Optional<List<Operation>> inner = target.gate.subGate().decompose(target.targets());
    if (inner.isEmpty()) {
      return Optional.empty();
    }
    List<Operation> ops = new ArrayList<>(inner.get().size());
    for (Operation op : inner.get()) {
      ops.add(op.controlledBy(target.controls(), target.gate.controlValues()));
    }
    return step(DecompositionRule.SUB_GATE_DECOMPOSITION, ops);
  }

  private static Optional<DecompositionStep> step(DecompositionRule rule, Operation op) {
    return step(rule, List.of(op));
  }

  private static Optional<DecompositionStep> step(DecompositionRule rule, List<Operation> ops) {
    return Optional.of(new DecompositionStep(rule, ops));
  }

  /** A controlled gate together with the qudits it is applied to. */
  private static final class Target {
    private final ControlledGate gate;
    private final List<Qid> qids;

    private Target(ControlledGate gate, List<Qid> qids) {
      this.gate = gate;
      this.qids = List.copyOf(qids);
    }

    List<Qid> controls() {
      return qids.subList(0, gate.numControls());
    }

    List<Qid> targets() {
      return qids.subList(gate.numControls(), qids.size());
    }

    Operation subGateOp() {
      return gate.subGate().on(targets());
    }

    ControlledGate withValues(ProductOfSums values) {
      return ControlledGate.builder(gate.subGate())
          .controlValues(values)
          .controlQidShape(gate.controlQidShape())
          .build();
    }
  }
}
