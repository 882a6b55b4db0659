package qudit.gates;

import qudit.linalg.Complex;
import qudit.linalg.ComplexMatrix;

/** Eigenspace projectors shared by the standard gates. */
final class Projectors {
  private Projectors() {}

  static final ComplexMatrix I2 = ComplexMatrix.identity(2);
  static final ComplexMatrix PAULI_X = ComplexMatrix.ofReal(new double[][] {{0, 1}, {1, 0}});
  static final ComplexMatrix PAULI_Y =
      ComplexMatrix.of(
          new Complex[][] {
            {Complex.ZERO, new Complex(0, -1)},
            {Complex.I, Complex.ZERO}
          });
  static final ComplexMatrix PAULI_Z = ComplexMatrix.ofReal(new double[][] {{1, 0}, {0, -1}});
  static final ComplexMatrix HADAMARD =
      ComplexMatrix.ofReal(new double[][] {{1, 1}, {1, -1}}).scale(Complex.real(Math.sqrt(0.5)));

  /** {@code (I + sigma) / 2}, the +1 eigenspace of an involution. */
  static ComplexMatrix plusSpace(ComplexMatrix sigma) {
    return I2.plus(sigma).scale(Complex.real(0.5));
  }

  /** {@code (I - sigma) / 2}, the -1 eigenspace of an involution. */
  static ComplexMatrix minusSpace(ComplexMatrix sigma) {
    return I2.minus(sigma).scale(Complex.real(0.5));
  }

  /** Projector onto the computational basis state with all qubits set, over {@code n} qubits. */
  static ComplexMatrix allOnes(int numQubits) {
    int dim = 1 << numQubits;
    return ComplexMatrix.builder(dim, dim).set(dim - 1, dim - 1, Complex.ONE).build();
  }

  /**
   * Lifts a single-qubit projector {@code p} onto the subspace where all {@code numControls}
   * leading qubits are 1; zero elsewhere.
   */
  static ComplexMatrix onAllOnes(int numControls, ComplexMatrix p) {
    return allOnes(numControls).kron(p);
  }

  /** Identity on every control pattern except all-ones, plus {@code p} on all-ones. */
  static ComplexMatrix offAllOnesPlus(int numControls, ComplexMatrix p) {
    int dim = 1 << numControls;
    ComplexMatrix rest = ComplexMatrix.identity(dim).minus(allOnes(numControls));
    return rest.kron(I2).plus(onAllOnes(numControls, p));
  }
}
