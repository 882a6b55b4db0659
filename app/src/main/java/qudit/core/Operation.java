package qudit.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.controlled.ControlledGate;
import qudit.controls.ControlValues;
import qudit.linalg.ComplexMatrix;

/** A gate applied to concrete qudits. Construction validates the qudits against the gate. */
public record Operation(Gate gate, List<Qid> qids) {

  public Operation {
    Objects.requireNonNull(gate, "gate");
    Objects.requireNonNull(qids, "qids");
    qids = List.copyOf(qids);
    gate.validateArgs(qids);
  }

  public Optional<ComplexMatrix> unitary() {
    return gate.unitary();
  }

  public Optional<List<Operation>> decompose() {
    return gate.decompose(qids);
  }

  /**
   * This operation controlled by {@code controls}; {@code controlValues} may be {@code null} for
   * default values. Control dimensions are taken from the control qudits.
   */
  public Operation controlledBy(List<Qid> controls, ControlValues controlValues) {
    Objects.requireNonNull(controls, "controls");
    if (controls.isEmpty()) {
      return this;
    }
    ControlledGate.Builder builder =
        ControlledGate.builder(gate).controlQidShape(Qid.shapeOf(controls));
    if (controlValues != null) {
      builder.controlValues(controlValues);
    }
    List<Qid> all = new ArrayList<>(controls);
    all.addAll(qids);
    return builder.build().on(all);
  }

  public Optional<Operation> pow(double exponent) {
    return gate.pow(exponent).map(g -> g.on(qids));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(gate.toString()).append('(');
    for (int i = 0; i < qids.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(qids.get(i));
    }
    return sb.append(')').toString();
  }
}
