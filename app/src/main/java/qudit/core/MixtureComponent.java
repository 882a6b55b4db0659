package qudit.core;

import java.util.Objects;
import qudit.linalg.ComplexMatrix;

/** One branch of a probabilistic mixture of unitaries. */
public record MixtureComponent(double probability, ComplexMatrix unitary) {

  public MixtureComponent {
    Objects.requireNonNull(unitary, "unitary");
    if (probability < 0.0 || probability > 1.0 + 1e-12) {
      throw new IllegalArgumentException("Probability out of range: " + probability);
    }
  }
}
