package qudit.core;

import java.util.List;
import java.util.Objects;
import qudit.linalg.ComplexMatrix;

/** Accessors that turn an unavailable capability into an exception naming the gate. */
public final class Protocols {
  private Protocols() {}

  public static ComplexMatrix unitary(Gate gate) {
    Objects.requireNonNull(gate, "gate");
    return gate.unitary()
        .orElseThrow(() -> new UnsupportedOperationException(gate + " has no unitary"));
  }

  public static List<MixtureComponent> mixture(Gate gate) {
    Objects.requireNonNull(gate, "gate");
    return gate.mixture()
        .orElseThrow(() -> new UnsupportedOperationException(gate + " has no mixture"));
  }

  public static Gate pow(Gate gate, double exponent) {
    Objects.requireNonNull(gate, "gate");
    return gate.pow(exponent)
        .orElseThrow(
            () -> new UnsupportedOperationException(gate + " cannot be raised to " + exponent));
  }

  public static Gate inverse(Gate gate) {
    Objects.requireNonNull(gate, "gate");
    return gate.inverse()
        .orElseThrow(() -> new UnsupportedOperationException(gate + " has no inverse"));
  }

  public static List<Operation> decomposeOnce(Operation operation) {
    Objects.requireNonNull(operation, "operation");
    return operation.decompose()
        .orElseThrow(
            () -> new UnsupportedOperationException(operation + " has no decomposition"));
  }
}
