package qudit.gates;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Gate;
import qudit.core.ValidationException;

/** Computational-basis measurement of {@code n} qubits. Cannot be controlled. */
public final class MeasurementGate implements Gate {
  private final int numQubits;

  public MeasurementGate(int numQubits) {
    if (numQubits < 1) {
      throw new ValidationException("Measurement needs at least one qubit, got " + numQubits);
    }
    this.numQubits = numQubits;
  }

  @Override
  public List<Integer> qidShape() {
    return Collections.nCopies(numQubits, 2);
  }

  @Override
  public boolean isMeasurement() {
    return true;
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    return Optional.of(new DiagramInfo(Collections.nCopies(numQubits, "M"), null, true, -1));
  }

  @Override
  public String repr() {
    return "MeasurementGate(" + numQubits + ")";
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof MeasurementGate other && numQubits == other.numQubits);
  }

  @Override
  public int hashCode() {
    return Objects.hash(MeasurementGate.class, numQubits);
  }

  @Override
  public String toString() {
    return "M";
  }
}
