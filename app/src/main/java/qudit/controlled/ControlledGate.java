package qudit.controlled;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qudit.controls.ControlValues;
import qudit.controls.ProductOfSums;
import qudit.controls.SumOfProducts;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.Gate;
import qudit.core.MixtureComponent;
import qudit.core.Operation;
import qudit.core.ParamResolver;
import qudit.core.Qid;
import qudit.core.ValidationException;
import qudit.decompose.ControlledGateDecomposer;
import qudit.linalg.Complex;
import qudit.linalg.ComplexMatrix;
import qudit.linalg.QuditTensors;

/**
 * A sub-gate applied only when its control qudits satisfy a {@link ControlValues} condition.
 *
 * <p>Qudit order is controls first, then the sub-gate's own qudits. Nested controlled gates are
 * flattened at construction: the new controls are prepended to the inner gate's controls and
 * the innermost non-controlled gate becomes the sub-gate, so equality and hashing depend only on
 * the resulting structure, not on how it was built.
 */
public final class ControlledGate implements Gate {
  private static final double PROBABILITY_SLACK = 1e-12;

  private final Gate subGate;
  private final ControlValues controlValues;
  private final List<Integer> controlQidShape;

  private ControlledGate(Gate subGate, ControlValues controlValues, List<Integer> controlQidShape) {
    this.subGate = subGate;
    this.controlValues = controlValues;
    this.controlQidShape = List.copyOf(controlQidShape);
  }

  /** One qubit control accepting its default value. */
  public static ControlledGate of(Gate subGate) {
    return builder(subGate).build();
  }

  public static ControlledGate of(Gate subGate, int numControls) {
    return builder(subGate).numControls(numControls).build();
  }

  public static ControlledGate of(Gate subGate, ControlValues controlValues) {
    return builder(subGate).controlValues(controlValues).build();
  }

  public static Builder builder(Gate subGate) {
    return new Builder(subGate);
  }

  public Gate subGate() {
    return subGate;
  }

  public ControlValues controlValues() {
    return controlValues;
  }

  public List<Integer> controlQidShape() {
    return controlQidShape;
  }

  public int numControls() {
    return controlQidShape.size();
  }

  @Override
  public List<Integer> qidShape() {
    List<Integer> shape = new ArrayList<>(controlQidShape);
    shape.addAll(subGate.qidShape());
    return List.copyOf(shape);
  }

  @Override
  public Optional<ComplexMatrix> unitary() {
    return subGate.unitary().map(this::lift);
  }

  @Override
  public boolean hasUnitary() {
    return subGate.hasUnitary();
  }

  @Override
  public Optional<List<MixtureComponent>> mixture() {
    Optional<List<MixtureComponent>> subMixture = subGate.mixture();
    if (subMixture.isEmpty()) {
      return Optional.empty();
    }
    List<MixtureComponent> lifted = new ArrayList<>();
    double total = 0.0;
    for (MixtureComponent component : subMixture.get()) {
      lifted.add(new MixtureComponent(component.probability(), lift(component.unitary())));
      total += component.probability();
    }
    double remaining = 1.0 - total;
    if (remaining > PROBABILITY_SLACK) {
      int dim = QuditTensors.dimension(qidShape());
      lifted.add(new MixtureComponent(remaining, ComplexMatrix.identity(dim)));
    }
    return Optional.of(List.copyOf(lifted));
  }

  @Override
  public boolean hasMixture() {
    return subGate.hasMixture();
  }

  @Override
  public Optional<List<Operation>> decompose(List<Qid> qids) {
    validateArgs(qids);
    return ControlledGateDecomposer.withDefaults().decomposeOnce(this, qids);
  }

  /**
   * {@code subGate ** exponent} under the same controls. Only available when the sub-gate
   * supports the power and every control accepts just its default value.
   */
  @Override
  public Optional<Gate> pow(double exponent) {
    if (!controlValues.acceptsOnlyDefaults(controlQidShape)) {
      return Optional.empty();
    }
    return subGate.pow(exponent).map(this::withSubGate);
  }

  @Override
  public boolean isParameterized() {
    return subGate.isParameterized();
  }

  /**
   * Resolves the sub-gate's parameters and rebuilds the controls around it.
   *
   * @throws ValidationException if the resolved sub-gate is a channel that cannot be controlled
   */
  @Override
  public Gate resolveParameters(ParamResolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    Gate resolved = subGate.resolveParameters(resolver);
    if (resolved.equals(subGate)) {
      return this;
    }
    return withSubGate(resolved);
  }

  @Override
  public Optional<DiagramInfo> diagramInfo(DiagramArgs args) {
    Objects.requireNonNull(args, "args");
    return subGate
        .diagramInfo(args.dropLeading(numControls()))
        .map(
            sub -> {
              List<String> symbols =
                  new ArrayList<>(controlValues.diagramLabels(controlQidShape));
              symbols.addAll(sub.wireSymbols());
              int exponentIndex = Math.max(sub.exponentQuditIndex(), 0) + numControls();
              return new DiagramInfo(symbols, sub.exponent(), true, exponentIndex);
            });
  }

  @Override
  public double traceDistanceBound() {
    return subGate.traceDistanceBound();
  }

  /** Same controls around a different sub-gate, re-running construction checks. */
  public ControlledGate withSubGate(Gate newSubGate) {
    return builder(newSubGate)
        .controlValues(controlValues)
        .controlQidShape(controlQidShape)
        .build();
  }

  /**
   * Block-diagonal lift: the identity on control assignments that do not fire, {@code u} on
   * those that do.
   */
  private ComplexMatrix lift(ComplexMatrix u) {
    int controlDim = QuditTensors.dimension(controlQidShape);
    int subDim = u.rows();
    int total = controlDim * subDim;
    ComplexMatrix.Builder builder = ComplexMatrix.builder(total, total);
    for (int c = 0; c < controlDim; c++) {
      int offset = c * subDim;
      int[] digits = QuditTensors.digits(c, controlQidShape);
      List<Integer> assignment = new ArrayList<>(digits.length);
      for (int digit : digits) {
        assignment.add(digit);
      }
      if (controlValues.matches(assignment)) {
        for (int r = 0; r < subDim; r++) {
          for (int k = 0; k < subDim; k++) {
            builder.set(offset + r, offset + k, u.get(r, k));
          }
        }
      } else {
        for (int r = 0; r < subDim; r++) {
          builder.set(offset + r, offset + r, Complex.ONE);
        }
      }
    }
    return builder.build();
  }

  @Override
  public String repr() {
    return "ControlledGate(subGate="
        + subGate.repr()
        + ", controlValues="
        + controlValues.repr()
        + ", controlQidShape="
        + controlQidShape
        + ")";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ControlledGate other)) {
      return false;
    }
    return subGate.equals(other.subGate)
        && controlQidShape.equals(other.controlQidShape)
        && controlValues.equals(other.controlValues);
  }

  @Override
  public int hashCode() {
    return Objects.hash(subGate, controlValues, controlQidShape);
  }

  @Override
  public String toString() {
    return controlValues.toString(controlQidShape) + subGate;
  }

  /**
   * Resolves control count, shape and values from whichever of them were supplied. Missing
   * shapes default to qubits, missing values to {@code d - 1} on every control.
   */
  public static final class Builder {
    private final Gate subGate;
    private Integer numControls;
    private ControlValues controlValues;
    private List<Integer> controlQidShape;

    private Builder(Gate subGate) {
      this.subGate = Objects.requireNonNull(subGate, "subGate");
    }

    public Builder numControls(int numControls) {
      if (numControls < 0) {
        throw new ValidationException("numControls must be non-negative, got " + numControls);
      }
      this.numControls = numControls;
      return this;
    }

    public Builder controlValues(ControlValues controlValues) {
      this.controlValues = Objects.requireNonNull(controlValues, "controlValues");
      return this;
    }

    /** One control per argument, each accepting exactly that value. */
    public Builder controlValues(int... values) {
      return controlValues(ProductOfSums.of(values));
    }

    public Builder controlQidShape(List<Integer> controlQidShape) {
      this.controlQidShape = List.copyOf(Objects.requireNonNull(controlQidShape, "shape"));
      return this;
    }

    public Builder controlQidShape(Integer... controlQidShape) {
      return controlQidShape(List.of(controlQidShape));
    }

    public ControlledGate build() {
      validateSubGate(subGate);

      ControlValues values = controlValues;
      if (values instanceof SumOfProducts sum && sum.conjunctions().size() == 1) {
        values = ProductOfSums.of(sum.conjunctions().get(0).stream().mapToInt(v -> v).toArray());
      }

      int count;
      if (numControls != null) {
        count = numControls;
      } else if (values != null) {
        count = values.numQudits();
      } else if (controlQidShape != null) {
        count = controlQidShape.size();
      } else {
        count = 1;
      }

      if (values != null && values.numQudits() != count) {
        throw new ValidationException(
            "numQudits(controlValues) != numControls (" + values.numQudits() + " != " + count
                + ")");
      }
      List<Integer> shape = controlQidShape;
      if (shape == null) {
        shape = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          shape.add(2);
        }
      }
      if (shape.size() != count) {
        throw new ValidationException(
            "controlQidShape.size() != numControls (" + shape.size() + " != " + count + ")");
      }
      for (int dim : shape) {
        if (dim < 2) {
          throw new ValidationException("Control qudit dimension must be at least 2: " + shape);
        }
      }
      if (values == null) {
        values = ProductOfSums.defaults(shape);
      }
      values.validate(shape);

      Gate sub = subGate;
      if (sub instanceof ControlledGate inner) {
        values = values.and(inner.controlValues);
        List<Integer> merged = new ArrayList<>(shape);
        merged.addAll(inner.controlQidShape);
        shape = merged;
        sub = inner.subGate;
      }
      return new ControlledGate(sub, values, shape);
    }

    private static void validateSubGate(Gate gate) {
      if (gate.isMeasurement()) {
        throw new ValidationException("Cannot control measurement " + gate);
      }
      if (!gate.hasMixture() && !gate.isParameterized()) {
        throw new ValidationException("Cannot control channel with non-unitary operators: " + gate);
      }
    }
  }
}
