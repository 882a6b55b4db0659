package qudit.linalg;

import java.util.List;
import java.util.Objects;

/** Index arithmetic over mixed-radix qudit registers. */
public final class QuditTensors {
  private QuditTensors() {}

  /** Total Hilbert-space dimension of the given qudit shape. */
  public static int dimension(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    int size = 1;
    for (int dim : shape) {
      size = Math.multiplyExact(size, dim);
    }
    return size;
  }

  /** Splits a big-endian basis index into one digit per qudit. */
  public static int[] digits(int index, List<Integer> shape) {
    int[] digits = new int[shape.size()];
    int rest = index;
    for (int i = shape.size() - 1; i >= 0; i--) {
      int dim = shape.get(i);
      digits[i] = rest % dim;
      rest /= dim;
    }
    return digits;
  }

  /** Inverse of {@link #digits(int, List)}. */
  public static int index(int[] digits, List<Integer> shape) {
    int index = 0;
    for (int i = 0; i < shape.size(); i++) {
      index = index * shape.get(i) + digits[i];
    }
    return index;
  }

  /**
   * Lifts {@code matrix}, acting on the qudits at {@code positions} (in that order), to the full
   * register {@code shape}, acting as identity on the remaining qudits.
   */
  public static ComplexMatrix embed(
      ComplexMatrix matrix, List<Integer> shape, List<Integer> positions) {
    Objects.requireNonNull(matrix, "matrix");
    Objects.requireNonNull(positions, "positions");
    int subDim = 1;
    for (int pos : positions) {
      subDim *= shape.get(pos);
    }
    if (matrix.rows() != subDim || matrix.cols() != subDim) {
      throw new IllegalArgumentException(
          "Matrix of size " + matrix.rows() + "x" + matrix.cols()
              + " does not act on qudits " + positions + " of shape " + shape);
    }
    int[] subShape = new int[positions.size()];
    for (int i = 0; i < positions.size(); i++) {
      subShape[i] = shape.get(positions.get(i));
    }

    int total = dimension(shape);
    ComplexMatrix.Builder builder = ComplexMatrix.builder(total, total);
    for (int col = 0; col < total; col++) {
      int[] colDigits = digits(col, shape);
      int subCol = 0;
      for (int i = 0; i < positions.size(); i++) {
        subCol = subCol * subShape[i] + colDigits[positions.get(i)];
      }
      for (int subRow = 0; subRow < subDim; subRow++) {
        Complex value = matrix.get(subRow, subCol);
        if (value.re() == 0.0 && value.im() == 0.0) {
          continue;
        }
        int[] rowDigits = colDigits.clone();
        int rest = subRow;
        for (int i = positions.size() - 1; i >= 0; i--) {
          rowDigits[positions.get(i)] = rest % subShape[i];
          rest /= subShape[i];
        }
        builder.set(index(rowDigits, shape), col, value);
      }
    }
    return builder.build();
  }
}
