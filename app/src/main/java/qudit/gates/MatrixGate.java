package qudit.gates;

import java.util.ArrayList;
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
import qudit.linalg.Tolerance;

/**
 * Gate given directly by its unitary matrix. A 1x1 matrix acts on no qudits and decomposes into
 * a {@link GlobalPhaseGate}; larger matrices are leaves.
 */
public final class MatrixGate implements Gate {
  private static final double MAX_EXPONENT = 0x1p62;

  private final ComplexMatrix matrix;
  private final List<Integer> shape;

  private MatrixGate(ComplexMatrix matrix, List<Integer> shape) {
    this.matrix = matrix;
    this.shape = shape;
  }

  /**
   * @throws ValidationException if the matrix is not unitary or does not fit {@code shape}
   */
  public static MatrixGate of(ComplexMatrix matrix, List<Integer> shape) {
    Objects.requireNonNull(matrix, "matrix");
    Objects.requireNonNull(shape, "shape");
    int dim = QuditTensors.dimension(shape);
    if (matrix.rows() != dim || matrix.cols() != dim) {
      throw new ValidationException(
          "Matrix of size " + matrix.rows() + "x" + matrix.cols() + " does not fit shape "
              + shape);
    }
    if (!matrix.isUnitary(Tolerance.DEFAULT_ATOL)) {
      throw new ValidationException("Matrix is not unitary: " + matrix);
    }
    return new MatrixGate(matrix, List.copyOf(shape));
  }

  /** Infers an all-qubit shape from the matrix size. */
  public static MatrixGate of(ComplexMatrix matrix) {
    Objects.requireNonNull(matrix, "matrix");
    int size = matrix.rows();
    int qubits = Integer.numberOfTrailingZeros(size);
    if (size <= 0 || Integer.bitCount(size) != 1) {
      throw new ValidationException(
          "Matrix size " + size + " is not a power of two; pass the qudit shape explicitly");
    }
    return of(matrix, Collections.nCopies(qubits, 2));
  }

  public ComplexMatrix matrix() {
    return matrix;
  }

  @Override
  public List<Integer> qidShape() {
    return shape;
  }

  @Override
  public Optional<ComplexMatrix> unitary() {
    return Optional.of(matrix);
  }

  @Override
  public Optional<List<Operation>> decompose(List<Qid> qids) {
    validateArgs(qids);
    if (!shape.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(List.of(GlobalPhaseGate.of(matrix.get(0, 0)).on()));
  }

  /** Integer powers only, computed by repeated squaring. */
  @Override
  public Optional<Gate> pow(double exponent) {
    if (exponent != Math.rint(exponent) || Math.abs(exponent) > MAX_EXPONENT) {
      return Optional.empty();
    }
    long n = Math.abs((long) exponent);
    ComplexMatrix base = exponent < 0 ? matrix.dagger() : matrix;
    ComplexMatrix result = ComplexMatrix.identity(matrix.rows());
    while (n > 0) {
      if ((n & 1) == 1) {
        result = result.times(base);
      }
      n >>= 1;
      if (n > 0) {
        base = base.times(base);
      }
    }
    return Optional.of(new MatrixGate(result, shape));
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    List<String> symbols = new ArrayList<>(shape.size());
    for (int i = 0; i < shape.size(); i++) {
      symbols.add(i == 0 ? "M" : "#" + (i + 1));
    }
    return Optional.of(new DiagramInfo(symbols, null, true, -1));
  }

  @Override
  public String repr() {
    return "MatrixGate(matrix=" + matrix + ", shape=" + shape + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MatrixGate other)) {
      return false;
    }
    return shape.equals(other.shape) && matrix.equals(other.matrix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(matrix, shape);
  }

  @Override
  public String toString() {
    return "Matrix" + matrix;
  }
}
