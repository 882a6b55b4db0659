package qudit.linalg;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

final class ComplexMatrixTest {

  private static final ComplexMatrix X = ComplexMatrix.ofReal(new double[][] {{0, 1}, {1, 0}});
  private static final ComplexMatrix Z = ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, -1}});

  @Test
  void kronOrdersFirstFactorAsMostSignificant() {
    ComplexMatrix xz = X.kron(Z);
    assertEquals(4, xz.rows());
    // |00> -> |10>, |01> -> -|11>
    assertTrue(xz.get(2, 0).isClose(Complex.ONE, 0.0));
    assertTrue(xz.get(3, 1).isClose(new Complex(-1, 0), 0.0));
    assertTrue(xz.get(0, 0).isClose(Complex.ZERO, 0.0));
  }

  @Test
  void productAndDagger() {
    ComplexMatrix y =
        ComplexMatrix.of(
            new Complex[][] {{Complex.ZERO, new Complex(0, -1)}, {Complex.I, Complex.ZERO}});
    // ZX = iY
    assertTrue(Z.times(X).isClose(y.scale(Complex.I), 1e-12));
    assertTrue(y.dagger().isClose(y, 1e-12));
    assertTrue(y.isUnitary(1e-12));
  }

  @Test
  void identityAndDiagonal() {
    assertTrue(ComplexMatrix.identity(3).isIdentity(0.0));
    ComplexMatrix d = ComplexMatrix.diagonal(Complex.ONE, Complex.I);
    assertEquals(Complex.I, d.get(1, 1));
    assertFalse(d.isIdentity(1e-9));
    assertTrue(d.isUnitary(1e-12));
  }

  @Test
  void maxAbsDifferenceRejectsSizeMismatch() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ComplexMatrix.identity(2).maxAbsDifference(ComplexMatrix.identity(3)));
    assertEquals(2.0, X.maxAbsDifference(X.scale(new Complex(-1, 0))), 1e-12);
  }

  @Test
  void builderIsSingleUse() {
    ComplexMatrix.Builder builder = ComplexMatrix.builder(1, 1).set(0, 0, Complex.ONE);
    builder.build();
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void equalityIsExact() {
    assertEquals(ComplexMatrix.identity(2), ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, 1}}));
    assertEquals(
        ComplexMatrix.identity(2).hashCode(),
        ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, 1}}).hashCode());
  }

  @Test
  void ejmlCopiesAreIndependent() {
    ZMatrixRMaj raw = X.toEjml();
    raw.set(0, 0, 5.0, 0.0);
    assertTrue(X.get(0, 0).isClose(Complex.ZERO, 0.0));

    ComplexMatrix copied = ComplexMatrix.fromEjml(raw);
    raw.set(0, 0, 0.0, 0.0);
    assertTrue(copied.get(0, 0).isClose(Complex.real(5.0), 0.0));
    assertTrue(X.minus(copied).get(0, 0).isClose(Complex.real(-5.0), 0.0));
  }

  @Test
  void scalarsMultiplyLikeComplexNumbers() {
    Complex product = new Complex(1, 2).times(new Complex(3, -1));
    assertTrue(product.isClose(new Complex(5, 5), 1e-12));
    assertEquals(5.0, new Complex(3, 4).abs(), 1e-12);
    assertEquals(new Complex(3, 4), Complex.of(new Complex(3, 4).toEjml()));
  }
}
