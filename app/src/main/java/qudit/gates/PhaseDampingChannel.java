package qudit.gates;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Gate;
import qudit.core.ValidationException;

/**
 * Phase damping with rate {@code gamma}. Its Kraus operators are not unitary, so it has neither
 * a unitary nor a mixture and cannot be controlled.
 */
public final class PhaseDampingChannel implements Gate {
  private final double gamma;

  public PhaseDampingChannel(double gamma) {
    if (!(gamma >= 0.0 && gamma <= 1.0)) {
      throw new ValidationException("gamma must be in [0, 1], got " + gamma);
    }
    this.gamma = gamma;
  }

  public double gamma() {
    return gamma;
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(2);
  }

  @Override
  public boolean hasMixture() {
    return false;
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    return Optional.of(DiagramInfo.of("PD(" + gamma + ")"));
  }

  @Override
  public String repr() {
    return "PhaseDampingChannel(gamma=" + gamma + ")";
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof PhaseDampingChannel other && Double.compare(gamma, other.gamma) == 0);
  }

  @Override
  public int hashCode() {
    return Objects.hash(PhaseDampingChannel.class, gamma);
  }

  @Override
  public String toString() {
    return "phase_damp(gamma=" + gamma + ")";
  }
}
