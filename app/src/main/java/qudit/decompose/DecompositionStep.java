package qudit.decompose;

import java.util.List;
import java.util.Objects;
import qudit.core.Operation;

/** Operations produced by one rule application. */
public record DecompositionStep(DecompositionRule rule, List<Operation> operations) {

  public DecompositionStep {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(operations, "operations");
    operations = List.copyOf(operations);
  }
}
