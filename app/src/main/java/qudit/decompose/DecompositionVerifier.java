package qudit.decompose;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qudit.core.Circuits;
import qudit.core.Operation;
import qudit.linalg.ComplexMatrix;

/**
 * Replays the full recursive decomposition of an operation and compares the composed unitary
 * with the operation's dense unitary, phase included.
 */
public final class DecompositionVerifier {
  private static final Logger LOG = LoggerFactory.getLogger(DecompositionVerifier.class);

  private final double atol;

  public DecompositionVerifier(DecompositionOptions options) {
    this.atol = DecompositionOptions.normalize(options).atol();
  }

  public static DecompositionVerifier withDefaults() {
    return new DecompositionVerifier(DecompositionOptions.defaults());
  }

  /**
   * Returns the leaf operations of {@code operation}.
   *
   * @throws NumericToleranceException if the leaves do not reproduce the dense unitary
   * @throws UnsupportedOperationException if the operation or one of its leaves has no unitary
   */
  public List<Operation> verify(Operation operation) {
    Objects.requireNonNull(operation, "operation");
    ComplexMatrix expected =
        operation
            .unitary()
            .orElseThrow(
                () -> new UnsupportedOperationException(operation + " has no unitary"));
    List<Operation> leaves = Circuits.decompose(operation);
    ComplexMatrix actual =
        Circuits.unitary(operation.qids(), leaves)
            .orElseThrow(
                () ->
                    new UnsupportedOperationException(
                        "Decomposition of " + operation + " has operations without a unitary"));
    double error = actual.maxAbsDifference(expected);
    if (error > atol) {
      LOG.warn("Decomposition of {} is off by {} (atol {})", operation, error, atol);
      throw new NumericToleranceException(
          "Decomposition of " + operation + " does not match its unitary", error, atol);
    }
    LOG.debug("Verified {} via {} operations, error {}", operation, leaves.size(), error);
    return leaves;
  }
}
