package qudit.linalg;

import java.util.Arrays;
import java.util.Objects;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * Immutable dense complex matrix backed by an EJML {@link ZMatrixRMaj}.
 *
 * <p>Basis states of multi-qudit matrices are ordered big-endian: the first qudit is the most
 * significant digit of the row and column index.
 */
public final class ComplexMatrix {
  private final ZMatrixRMaj data;

  private ComplexMatrix(ZMatrixRMaj data) {
    this.data = data;
  }

  public static ComplexMatrix zeros(int rows, int cols) {
    requireSize(rows, cols);
    return new ComplexMatrix(new ZMatrixRMaj(rows, cols));
  }

  public static ComplexMatrix identity(int size) {
    requireSize(size, size);
    return new ComplexMatrix(CommonOps_ZDRM.identity(size));
  }

  public static ComplexMatrix diagonal(Complex... entries) {
    Objects.requireNonNull(entries, "entries");
    Builder builder = builder(entries.length, entries.length);
    for (int i = 0; i < entries.length; i++) {
      builder.set(i, i, entries[i]);
    }
    return builder.build();
  }

  /** Builds a matrix from rows of complex entries; every row must have the same length. */
  public static ComplexMatrix of(Complex[][] entries) {
    Objects.requireNonNull(entries, "entries");
    int rows = entries.length;
    int cols = rows == 0 ? 0 : entries[0].length;
    Builder builder = builder(rows, cols);
    for (int r = 0; r < rows; r++) {
      if (entries[r].length != cols) {
        throw new IllegalArgumentException("Ragged matrix rows");
      }
      for (int c = 0; c < cols; c++) {
        builder.set(r, c, entries[r][c]);
      }
    }
    return builder.build();
  }

  /** Builds a matrix from real entries. */
  public static ComplexMatrix ofReal(double[][] entries) {
    Objects.requireNonNull(entries, "entries");
    int rows = entries.length;
    int cols = rows == 0 ? 0 : entries[0].length;
    Builder builder = builder(rows, cols);
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        builder.set(r, c, Complex.real(entries[r][c]));
      }
    }
    return builder.build();
  }

  /** Copies an EJML matrix; later changes to {@code matrix} are not seen. */
  public static ComplexMatrix fromEjml(ZMatrixRMaj matrix) {
    Objects.requireNonNull(matrix, "matrix");
    return new ComplexMatrix(matrix.copy());
  }

  public static Builder builder(int rows, int cols) {
    return new Builder(rows, cols);
  }

  public int rows() {
    return data.getNumRows();
  }

  public int cols() {
    return data.getNumCols();
  }

  public boolean isSquare() {
    return rows() == cols();
  }

  public Complex get(int row, int col) {
    checkIndex(row, col);
    return new Complex(data.getReal(row, col), data.getImag(row, col));
  }

  /** A mutable copy for callers that continue in EJML. */
  public ZMatrixRMaj toEjml() {
    return data.copy();
  }

  public ComplexMatrix plus(ComplexMatrix other) {
    requireSameSize(other);
    ZMatrixRMaj sum = new ZMatrixRMaj(rows(), cols());
    CommonOps_ZDRM.add(data, other.data, sum);
    return new ComplexMatrix(sum);
  }

  public ComplexMatrix minus(ComplexMatrix other) {
    requireSameSize(other);
    ZMatrixRMaj difference = new ZMatrixRMaj(rows(), cols());
    CommonOps_ZDRM.subtract(data, other.data, difference);
    return new ComplexMatrix(difference);
  }

  public ComplexMatrix scale(Complex factor) {
    Objects.requireNonNull(factor, "factor");
    ZMatrixRMaj scaled = data.copy();
    CommonOps_ZDRM.scale(factor.re(), factor.im(), scaled);
    return new ComplexMatrix(scaled);
  }

  /** Matrix product {@code this * other}. */
  public ComplexMatrix times(ComplexMatrix other) {
    Objects.requireNonNull(other, "other");
    if (cols() != other.rows()) {
      throw new IllegalArgumentException(
          "Cannot multiply " + rows() + "x" + cols() + " by " + other.rows() + "x" + other.cols());
    }
    ZMatrixRMaj product = new ZMatrixRMaj(rows(), other.cols());
    CommonOps_ZDRM.mult(data, other.data, product);
    return new ComplexMatrix(product);
  }

  /** Kronecker product; {@code this} occupies the more significant index digits. */
  public ComplexMatrix kron(ComplexMatrix other) {
    Objects.requireNonNull(other, "other");
    int or = other.rows();
    int oc = other.cols();
    ZMatrixRMaj out = new ZMatrixRMaj(rows() * or, cols() * oc);
    for (int r1 = 0; r1 < rows(); r1++) {
      for (int c1 = 0; c1 < cols(); c1++) {
        double ar = data.getReal(r1, c1);
        double ai = data.getImag(r1, c1);
        if (ar == 0.0 && ai == 0.0) {
          continue;
        }
        for (int r2 = 0; r2 < or; r2++) {
          for (int c2 = 0; c2 < oc; c2++) {
            double br = other.data.getReal(r2, c2);
            double bi = other.data.getImag(r2, c2);
            out.set(r1 * or + r2, c1 * oc + c2, ar * br - ai * bi, ar * bi + ai * br);
          }
        }
      }
    }
    return new ComplexMatrix(out);
  }

  /** Conjugate transpose. */
  public ComplexMatrix dagger() {
    return new ComplexMatrix(
        CommonOps_ZDRM.transposeConjugate(data, new ZMatrixRMaj(cols(), rows())));
  }

  /** Largest entry-wise modulus of {@code this - other}. */
  public double maxAbsDifference(ComplexMatrix other) {
    requireSameSize(other);
    ZMatrixRMaj difference = minus(other).data;
    double max = 0.0;
    for (int i = 0; i < difference.getDataLength(); i += 2) {
      max = Math.max(max, Math.hypot(difference.data[i], difference.data[i + 1]));
    }
    return max;
  }

  public boolean isClose(ComplexMatrix other, double atol) {
    return rows() == other.rows() && cols() == other.cols() && maxAbsDifference(other) <= atol;
  }

  public boolean isUnitary(double atol) {
    return isSquare() && dagger().times(this).isIdentity(atol);
  }

  public boolean isIdentity(double atol) {
    return isSquare() && isClose(identity(rows()), atol);
  }

  private void checkIndex(int row, int col) {
    if (row < 0 || row >= rows() || col < 0 || col >= cols()) {
      throw new IndexOutOfBoundsException(
          "(" + row + ", " + col + ") outside " + rows() + "x" + cols());
    }
  }

  private void requireSameSize(ComplexMatrix other) {
    Objects.requireNonNull(other, "other");
    if (rows() != other.rows() || cols() != other.cols()) {
      throw new IllegalArgumentException(
          "Size mismatch: " + rows() + "x" + cols() + " vs " + other.rows() + "x" + other.cols());
    }
  }

  private static void requireSize(int rows, int cols) {
    if (rows < 0 || cols < 0) {
      throw new IllegalArgumentException("Negative matrix size: " + rows + "x" + cols);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ComplexMatrix other)) {
      return false;
    }
    return rows() == other.rows()
        && cols() == other.cols()
        && Arrays.equals(
            data.data, 0, data.getDataLength(), other.data.data, 0, other.data.getDataLength());
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        rows(), cols(), Arrays.hashCode(Arrays.copyOf(data.data, data.getDataLength())));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int r = 0; r < rows(); r++) {
      if (r > 0) {
        sb.append(", ");
      }
      sb.append('[');
      for (int c = 0; c < cols(); c++) {
        if (c > 0) {
          sb.append(", ");
        }
        sb.append(get(r, c));
      }
      sb.append(']');
    }
    return sb.append(']').toString();
  }

  /** Mutable staging area; {@link #build()} hands off the storage and may only be called once. */
  public static final class Builder {
    private ZMatrixRMaj staging;

    private Builder(int rows, int cols) {
      requireSize(rows, cols);
      this.staging = new ZMatrixRMaj(rows, cols);
    }

    public Builder set(int row, int col, Complex value) {
      Objects.requireNonNull(value, "value");
      ensureOpen();
      if (row < 0 || row >= staging.getNumRows() || col < 0 || col >= staging.getNumCols()) {
        throw new IndexOutOfBoundsException(
            "(" + row + ", " + col + ") outside " + staging.getNumRows() + "x"
                + staging.getNumCols());
      }
      staging.set(row, col, value.re(), value.im());
      return this;
    }

    public Builder add(int row, int col, Complex value) {
      ensureOpen();
      staging.set(
          row,
          col,
          staging.getReal(row, col) + value.re(),
          staging.getImag(row, col) + value.im());
      return this;
    }

    public ComplexMatrix build() {
      ensureOpen();
      ComplexMatrix matrix = new ComplexMatrix(staging);
      staging = null;
      return matrix;
    }

    private void ensureOpen() {
      if (staging == null) {
        throw new IllegalStateException("Builder already used");
      }
    }
  }
}
