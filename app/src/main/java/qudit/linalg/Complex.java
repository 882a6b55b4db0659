package qudit.linalg;

import org.ejml.data.Complex_F64;
import org.ejml.ops.ComplexMath_F64;

/** Immutable complex number in rectangular form, convertible to EJML's mutable scalar. */
public record Complex(double re, double im) {

  public static final Complex ZERO = new Complex(0.0, 0.0);
  public static final Complex ONE = new Complex(1.0, 0.0);
  public static final Complex I = new Complex(0.0, 1.0);

  public static Complex real(double re) {
    return new Complex(re, 0.0);
  }

  public static Complex of(Complex_F64 value) {
    return new Complex(value.real, value.imaginary);
  }

  /** Returns {@code e^{i theta}}. */
  public static Complex expi(double theta) {
    return new Complex(Math.cos(theta), Math.sin(theta));
  }

  public Complex plus(Complex other) {
    return new Complex(re + other.re, im + other.im);
  }

  public Complex minus(Complex other) {
    return new Complex(re - other.re, im - other.im);
  }

  public Complex times(Complex other) {
    Complex_F64 product = new Complex_F64();
    ComplexMath_F64.multiply(toEjml(), other.toEjml(), product);
    return of(product);
  }

  public Complex times(double factor) {
    return new Complex(re * factor, im * factor);
  }

  public Complex conjugate() {
    return new Complex(re, -im);
  }

  public double abs() {
    return toEjml().getMagnitude();
  }

  /** Principal argument in (-pi, pi]. */
  public double arg() {
    return Math.atan2(im, re);
  }

  public Complex_F64 toEjml() {
    return new Complex_F64(re, im);
  }

  public boolean isClose(Complex other, double atol) {
    return minus(other).abs() <= atol;
  }

  @Override
  public String toString() {
    if (im == 0.0) {
      return Double.toString(re);
    }
    if (re == 0.0) {
      return im + "j";
    }
    return "(" + re + (im < 0 ? "-" : "+") + Math.abs(im) + "j)";
  }
}
