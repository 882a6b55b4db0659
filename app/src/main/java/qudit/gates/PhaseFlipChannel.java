package qudit.gates;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Gate;
import qudit.core.MixtureComponent;
import qudit.core.ValidationException;

/** Applies {@code Z} with probability {@code p}, identity otherwise. */
public final class PhaseFlipChannel implements Gate {
  private final double p;

  public PhaseFlipChannel(double p) {
    if (!(p >= 0.0 && p <= 1.0)) {
      throw new ValidationException("Probability must be in [0, 1], got " + p);
    }
    this.p = p;
  }

  public double p() {
    return p;
  }

  @Override
  public List<Integer> qidShape() {
    return List.of(2);
  }

  @Override
  public Optional<List<MixtureComponent>> mixture() {
    return Optional.of(
        List.of(
            new MixtureComponent(1.0 - p, Projectors.I2),
            new MixtureComponent(p, Projectors.PAULI_Z)));
  }

  @Override
  public boolean hasMixture() {
    return true;
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    return Optional.of(DiagramInfo.of("PF(" + p + ")"));
  }

  @Override
  public String repr() {
    return "PhaseFlipChannel(p=" + p + ")";
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof PhaseFlipChannel other && Double.compare(p, other.p) == 0);
  }

  @Override
  public int hashCode() {
    return Objects.hash(PhaseFlipChannel.class, p);
  }

  @Override
  public String toString() {
    return "phase_flip(p=" + p + ")";
  }
}
