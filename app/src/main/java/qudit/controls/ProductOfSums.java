package qudit.controls;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.stream.Collectors;
import qudit.core.ValidationException;

/**
 * Conjunction over control qudits of "the qudit's value is in its accepted set".
 *
 * <p>{@code ProductOfSums.of(List.of(Set.of(0), Set.of(0, 1)))} fires when the first control
 * is 0 and the second is 0 or 1.
 */
public final class ProductOfSums extends ControlValues {
  private final ImmutableList<ImmutableSortedSet<Integer>> qubitSums;

  private ProductOfSums(ImmutableList<ImmutableSortedSet<Integer>> qubitSums) {
    this.qubitSums = qubitSums;
  }

  /** One accepted set per control qudit. Every set must be non-empty. */
  public static ProductOfSums of(List<? extends Collection<Integer>> sums) {
    Objects.requireNonNull(sums, "sums");
    ImmutableList.Builder<ImmutableSortedSet<Integer>> builder = ImmutableList.builder();
    for (int i = 0; i < sums.size(); i++) {
      Collection<Integer> values = Objects.requireNonNull(sums.get(i), "sums[" + i + "]");
      if (values.isEmpty()) {
        throw new ValidationException("Control qudit " + i + " accepts no values");
      }
      builder.add(ImmutableSortedSet.copyOf(values));
    }
    return new ProductOfSums(builder.build());
  }

  /** One control per argument, each accepting exactly that value. */
  public static ProductOfSums of(int... values) {
    Objects.requireNonNull(values, "values");
    List<ImmutableSortedSet<Integer>> sums = new ArrayList<>(values.length);
    for (int value : values) {
      sums.add(ImmutableSortedSet.of(value));
    }
    return of(sums);
  }

  /** Every control qudit accepting only its maximal basis value {@code d - 1}. */
  public static ProductOfSums defaults(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    List<ImmutableSortedSet<Integer>> sums = new ArrayList<>(shape.size());
    for (int dim : shape) {
      sums.add(ImmutableSortedSet.of(dim - 1));
    }
    return of(sums);
  }

  public List<SortedSet<Integer>> qubitSums() {
    return List.copyOf(qubitSums);
  }

  public SortedSet<Integer> sumAt(int qudit) {
    return qubitSums.get(qudit);
  }

  @Override
  public int numQudits() {
    return qubitSums.size();
  }

  @Override
  public boolean matches(List<Integer> assignment) {
    Objects.requireNonNull(assignment, "assignment");
    if (assignment.size() != qubitSums.size()) {
      return false;
    }
    for (int i = 0; i < qubitSums.size(); i++) {
      if (!qubitSums.get(i).contains(assignment.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void validate(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    if (shape.size() != qubitSums.size()) {
      throw new ValidationException(
          "Control values " + repr() + " cover " + qubitSums.size() + " qudits but shape "
              + shape + " has " + shape.size());
    }
    for (int i = 0; i < qubitSums.size(); i++) {
      ImmutableSortedSet<Integer> values = qubitSums.get(i);
      int dim = shape.get(i);
      if (values.first() < 0 || values.last() >= dim) {
        throw new ValidationException(
            "Control values " + values + " outside of range for qudit number " + i
                + " of dimension " + dim);
      }
    }
  }

  /** Expands into the equivalent disjunction of full assignments. */
  public SumOfProducts toSumOfProducts() {
    return SumOfProducts.of(acceptedAssignments());
  }

  @Override
  public SortedSet<Integer> valuesAt(int qudit) {
    return qubitSums.get(qudit);
  }

  @Override
  public Optional<ProductOfSums> asProductOfSums() {
    return Optional.of(this);
  }

  @Override
  List<List<Integer>> computeAcceptedAssignments() {
    List<List<Integer>> axes = new ArrayList<>(qubitSums.size());
    for (ImmutableSortedSet<Integer> values : qubitSums) {
      axes.add(values.asList());
    }
    // Sorted axes make the product lexicographically ordered already.
    return Lists.cartesianProduct(axes);
  }

  @Override
  public List<String> diagramLabels(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    List<String> labels = new ArrayList<>(qubitSums.size());
    for (int i = 0; i < qubitSums.size(); i++) {
      ImmutableSortedSet<Integer> values = qubitSums.get(i);
      if (values.size() == 1 && values.first() == shape.get(i) - 1) {
        labels.add("@");
      } else {
        labels.add(
            values.stream().map(String::valueOf).collect(Collectors.joining(",", "(", ")")));
      }
    }
    return labels;
  }

  @Override
  public String repr() {
    return qubitSums.stream()
        .map(Object::toString)
        .collect(Collectors.joining(", ", "ProductOfSums([", "])"));
  }

  /** Text assuming qubit controls; see {@link #toString(List)}. */
  @Override
  public String toString() {
    return toString(Collections.nCopies(qubitSums.size(), 2));
  }

  /**
   * {@code C} per control when every control accepts only its default value {@code d - 1},
   * otherwise {@code C} followed by the accepted values of each control.
   */
  @Override
  public String toString(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    boolean trivial = shape.size() == qubitSums.size();
    for (int i = 0; trivial && i < qubitSums.size(); i++) {
      ImmutableSortedSet<Integer> values = qubitSums.get(i);
      trivial = values.size() == 1 && values.first() == shape.get(i) - 1;
    }
    if (trivial) {
      return "C".repeat(qubitSums.size());
    }
    StringBuilder sb = new StringBuilder();
    for (ImmutableSortedSet<Integer> values : qubitSums) {
      sb.append('C');
      values.forEach(sb::append);
    }
    return sb.toString();
  }
}
