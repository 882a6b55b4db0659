package qudit.gates;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Gate;
import qudit.core.ValidationException;
import qudit.linalg.Complex;
import qudit.linalg.ComplexMatrix;

/** Cyclic relabeling {@code |k> -> |k + shift mod d>} of a single qudit. */
public final class QuditPlusGate implements Gate {
  private final int dimension;
  private final int shift;

  public QuditPlusGate(int dimension, int shift) {
    if (dimension < 2) {
      throw new ValidationException("Qudit dimension must be at least 2, got " + dimension);
    }
    this.dimension = dimension;
    this.shift = Math.floorMod(shift, dimension);
  }

  public int dimension() {
    return dimension;
  }

  public int shift() {
    return shift;
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(dimension);
  }

  @Override
  public Optional<ComplexMatrix> unitary() {
    ComplexMatrix.Builder builder = ComplexMatrix.builder(dimension, dimension);
    for (int k = 0; k < dimension; k++) {
      builder.set((k + shift) % dimension, k, Complex.ONE);
    }
    return Optional.of(builder.build());
  }

  @Override
  public Optional<Gate> pow(double exponent) {
    if (Double.isInfinite(exponent) || exponent != Math.rint(exponent)) {
      return Optional.empty();
    }
    // Double % is exact, so reducing before the cast keeps huge exponents correct.
    int turns = Math.floorMod((int) (exponent % dimension), dimension);
    return Optional.of(
        new QuditPlusGate(dimension, Math.floorMod((long) turns * shift, dimension)));
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    return Optional.of(DiagramInfo.of("[+" + shift + "]"));
  }

  @Override
  public double traceDistanceBound() {
    return shift == 0 ? 0.0 : 1.0;
  }

  @Override
  public String repr() {
    return "QuditPlusGate(dimension=" + dimension + ", shift=" + shift + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QuditPlusGate other)) {
      return false;
    }
    return dimension == other.dimension && shift == other.shift;
  }

  @Override
  public int hashCode() {
    return Objects.hash(dimension, shift);
  }

  @Override
  public String toString() {
    return "[+" + shift + "]";
  }
}
