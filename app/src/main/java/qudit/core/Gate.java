package qudit.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.controlled.ControlledGate;
import qudit.controls.ControlValues;
import qudit.linalg.ComplexMatrix;

/**
 * A quantum operation that can be applied to a fixed-shape list of qudits.
 *
 * <p>Every optional capability is an independent query with a "not available" default, so
 * callers branch on what a gate reports rather than on its runtime type:
 *
 * <ul>
 *   <li>{@link #unitary()} / {@link #hasUnitary()}
 *   <li>{@link #mixture()} / {@link #hasMixture()}
 *   <li>{@link #decompose(List)}
 *   <li>{@link #pow(double)} / {@link #inverse()}
 *   <li>{@link #isParameterized()} / {@link #resolveParameters(ParamResolver)}
 *   <li>{@link #globalPhaseSplit()}
 *   <li>{@link #diagramInfo(DiagramArgs)}
 * </ul>
 *
 * <p>Implementations are immutable value objects.
 */
public interface Gate {

  /** Dimension of each qudit the gate acts on, in application order. */
  List<Integer> qidShape();

  default int numQudits() {
    return qidShape().size();
  }

  /** Dense unitary, or empty when the gate has none or depends on unresolved symbols. */
  default Optional<ComplexMatrix> unitary() {
    return Optional.empty();
  }

  default boolean hasUnitary() {
    return unitary().isPresent();
  }

  /** Probabilistic mixture of unitaries. A unitary gate is a one-component mixture. */
  default Optional<List<MixtureComponent>> mixture() {
    return unitary().map(u -> List.of(new MixtureComponent(1.0, u)));
  }

  default boolean hasMixture() {
    return hasUnitary() || mixture().isPresent();
  }

  /**
   * Equivalent operation sequence on {@code qids}, exact including global phase, or empty when
   * the gate is a leaf.
   */
  default Optional<List<Operation>> decompose(List<Qid> qids) {
    return Optional.empty();
  }

  default Optional<Gate> pow(double exponent) {
    return Optional.empty();
  }

  default Optional<Gate> inverse() {
    return pow(-1.0);
  }

  default boolean isParameterized() {
    return false;
  }

  default Gate resolveParameters(ParamResolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    return this;
  }

  /**
   * Separates an explicit global phase factor carried on top of the gate's standard form, or
   * empty when the gate carries none.
   */
  default Optional<GlobalPhaseSplit> globalPhaseSplit() {
    return Optional.empty();
  }

  default boolean isMeasurement() {
    return false;
  }

  default Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    return Optional.empty();
  }

  /** Upper bound on the trace distance between input and output states. */
  default double traceDistanceBound() {
    return 1.0;
  }

  /** Text that reads like the expression constructing this gate. */
  default String repr() {
    return toString();
  }

  /** Fails with {@link ValidationException} if {@code qids} do not fit {@link #qidShape()}. */
  default void validateArgs(List<Qid> qids) {
    Objects.requireNonNull(qids, "qids");
    List<Integer> shape = qidShape();
    if (qids.size() != shape.size()) {
      throw new ValidationException(
          "Wrong number of qids for <" + this + ">. Expected " + shape.size() + " qids but got "
              + qids.size() + ": " + qids);
    }
    if (!Qid.shapeOf(qids).equals(shape)) {
      throw new ValidationException(
          "Wrong shape of qids for <" + this + ">. Expected " + shape + " but got "
              + Qid.shapeOf(qids) + ": " + qids);
    }
  }

  default Operation on(Qid... qids) {
    return new Operation(this, List.of(qids));
  }

  default Operation on(List<Qid> qids) {
    return new Operation(this, qids);
  }

  /** Controlled by one qubit accepting its default value. */
  default ControlledGate controlled() {
    return ControlledGate.of(this);
  }

  default ControlledGate controlled(int numControls) {
    return ControlledGate.builder(this).numControls(numControls).build();
  }

  default ControlledGate controlled(ControlValues controlValues) {
    return ControlledGate.builder(this).controlValues(controlValues).build();
  }

  default ControlledGate controlled(ControlValues controlValues, List<Integer> controlQidShape) {
    return ControlledGate.builder(this)
        .controlValues(controlValues)
        .controlQidShape(controlQidShape)
        .build();
  }
}
