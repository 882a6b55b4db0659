package qudit.gates;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.core.Gate;
import qudit.core.MixtureComponent;
import qudit.core.ParamResolver;
import qudit.core.Parameter;
import qudit.core.ValidationException;
import qudit.linalg.ComplexMatrix;
import qudit.linalg.QuditTensors;

/**
 * Applies {@code subGate} with some probability and does nothing otherwise. Only has a mixture
 * when the probability is numeric and the sub-gate has one.
 */
public final class RandomGateChannel implements Gate {
  private final Gate subGate;
  private final Parameter probability;

  public RandomGateChannel(Gate subGate, Parameter probability) {
    this.subGate = Objects.requireNonNull(subGate, "subGate");
    this.probability = Objects.requireNonNull(probability, "probability");
    if (!probability.isSymbolic()) {
      double p = probability.value();
      if (!(p >= 0.0 && p <= 1.0)) {
        throw new ValidationException("Probability must be in [0, 1], got " + p);
      }
    }
  }

  public RandomGateChannel(Gate subGate, double probability) {
    this(subGate, Parameter.of(probability));
  }

  public Gate subGate() {
    return subGate;
  }

  public Parameter probability() {
    return probability;
  }

  @Override
  public List<Integer> qidShape() {
    return subGate.qidShape();
  }

  @Override
  public Optional<List<MixtureComponent>> mixture() {
    if (probability.isSymbolic()) {
      return Optional.empty();
    }
    double p = probability.value();
    return subGate
        .mixture()
        .map(
            components -> {
              List<MixtureComponent> scaled = new ArrayList<>(components.size() + 1);
              for (MixtureComponent component : components) {
                scaled.add(
                    new MixtureComponent(component.probability() * p, component.unitary()));
              }
              if (p < 1.0) {
                int dim = QuditTensors.dimension(qidShape());
                scaled.add(new MixtureComponent(1.0 - p, ComplexMatrix.identity(dim)));
              }
              return List.copyOf(scaled);
            });
  }

  @Override
  public boolean hasMixture() {
    return !probability.isSymbolic() && subGate.hasMixture();
  }

  @Override
  public boolean isParameterized() {
    return probability.isSymbolic() || subGate.isParameterized();
  }

  @Override
  public Gate resolveParameters(ParamResolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    Gate resolvedSub = subGate.resolveParameters(resolver);
    Parameter resolvedProbability = probability.resolve(resolver);
    if (resolvedSub.equals(subGate) && resolvedProbability.equals(probability)) {
      return this;
    }
    return new RandomGateChannel(resolvedSub, resolvedProbability);
  }

  @Override
  public String repr() {
    return "RandomGateChannel(subGate=" + subGate.repr() + ", probability=" + probability + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RandomGateChannel other)) {
      return false;
    }
    return subGate.equals(other.subGate) && probability.equals(other.probability);
  }

  @Override
  public int hashCode() {
    return Objects.hash(subGate, probability);
  }

  @Override
  public String toString() {
    return subGate + "[prob=" + probability + "]";
  }
}
