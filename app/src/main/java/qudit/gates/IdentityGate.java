package qudit.gates;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Gate;
import qudit.core.Operation;
import qudit.core.Qid;
import qudit.core.ValidationException;
import qudit.linalg.ComplexMatrix;
import qudit.linalg.QuditTensors;

/** Does nothing to qudits of the given shape. Decomposes into no operations. */
public final class IdentityGate implements Gate {
  private final List<Integer> shape;

  private IdentityGate(List<Integer> shape) {
    this.shape = shape;
  }

  public static IdentityGate of(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    for (int dim : shape) {
      if (dim < 1) {
        throw new ValidationException("Qudit dimension must be positive: " + shape);
      }
    }
    return new IdentityGate(List.copyOf(shape));
  }

  public static IdentityGate qubits(int count) {
    return of(Collections.nCopies(count, 2));
  }

  @Override
  public List<Integer> qidShape() {
    return shape;
  }

  @Override
  public Optional<ComplexMatrix> unitary() {
    return Optional.of(ComplexMatrix.identity(QuditTensors.dimension(shape)));
  }

  @Override
  public Optional<List<Operation>> decompose(List<Qid> qids) {
    validateArgs(qids);
    return Optional.of(List.of());
  }

  @Override
  public Optional<Gate> pow(double exponent) {
    return Optional.of(this);
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    String[] symbols = new String[shape.size()];
    Arrays.fill(symbols, "I");
    return Optional.of(new DiagramInfo(List.of(symbols), null, false, -1));
  }

  @Override
  public double traceDistanceBound() {
    return 0.0;
  }

  @Override
  public String repr() {
    return "IdentityGate(shape=" + shape + ")";
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof IdentityGate other && shape.equals(other.shape));
  }

  @Override
  public int hashCode() {
    return Objects.hash(IdentityGate.class, shape);
  }

  @Override
  public String toString() {
    return "I";
  }
}
