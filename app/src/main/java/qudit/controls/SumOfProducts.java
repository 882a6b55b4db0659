package qudit.controls;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import qudit.core.ValidationException;

/**
 * Disjunction of complete control assignments: fires when the control qudits hold exactly one
 * of the listed tuples.
 *
 * <p>An optional name is used only for display; it does not take part in equality.
 */
public final class SumOfProducts extends ControlValues {
  private final ImmutableList<List<Integer>> conjunctions;
  private final int numQudits;
  private final String name;
  private final Supplier<Optional<ProductOfSums>> productForm =
      Suppliers.memoize(this::computeProductForm);

  private SumOfProducts(ImmutableList<List<Integer>> conjunctions, int numQudits, String name) {
    this.conjunctions = conjunctions;
    this.numQudits = numQudits;
    this.name = name;
  }

  public static SumOfProducts of(List<? extends List<Integer>> conjunctions) {
    return of(conjunctions, null);
  }

  /**
   * @param conjunctions accepted assignments; at least one, all of the same length
   * @param name optional display name, may be {@code null}
   */
  public static SumOfProducts of(List<? extends List<Integer>> conjunctions, String name) {
    Objects.requireNonNull(conjunctions, "conjunctions");
    if (conjunctions.isEmpty()) {
      throw new ValidationException("SumOfProducts needs at least one assignment");
    }
    int width = conjunctions.get(0).size();
    TreeSet<List<Integer>> canonical = new TreeSet<>(LEXICOGRAPHIC);
    for (List<Integer> tuple : conjunctions) {
      Objects.requireNonNull(tuple, "conjunction");
      if (tuple.size() != width) {
        throw new ValidationException(
            "Size of all product terms must be equal, got " + conjunctions);
      }
      canonical.add(List.copyOf(tuple));
    }
    return new SumOfProducts(ImmutableList.copyOf(canonical), width, name);
  }

  public String name() {
    return name;
  }

  /** Accepted tuples in canonical (sorted, deduplicated) order. */
  public List<List<Integer>> conjunctions() {
    return conjunctions;
  }

  @Override
  public int numQudits() {
    return numQudits;
  }

  @Override
  public boolean matches(List<Integer> assignment) {
    Objects.requireNonNull(assignment, "assignment");
    return conjunctions.contains(assignment);
  }

  @Override
  public void validate(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    if (shape.size() != numQudits) {
      throw new ValidationException(
          "Control values " + repr() + " cover " + numQudits + " qudits but shape " + shape
              + " has " + shape.size());
    }
    for (List<Integer> tuple : conjunctions) {
      for (int i = 0; i < numQudits; i++) {
        int value = tuple.get(i);
        if (value < 0 || value >= shape.get(i)) {
          throw new ValidationException(
              "Control values " + tuple + " outside of range for qudit number " + i
                  + " of dimension " + shape.get(i));
        }
      }
    }
  }

  @Override
  List<List<Integer>> computeAcceptedAssignments() {
    return conjunctions;
  }

  /**
   * The product of the per-qudit value sets, when the stored tuples are exactly that product.
   */
  @Override
  public Optional<ProductOfSums> asProductOfSums() {
    return productForm.get();
  }

  private Optional<ProductOfSums> computeProductForm() {
    List<SortedSet<Integer>> sums = new ArrayList<>(numQudits);
    long size = 1;
    for (int i = 0; i < numQudits; i++) {
      SortedSet<Integer> values = valuesAt(i);
      sums.add(values);
      size *= values.size();
      if (size > conjunctions.size()) {
        return Optional.empty();
      }
    }
    if (size != conjunctions.size()) {
      return Optional.empty();
    }
    return Optional.of(ProductOfSums.of(sums));
  }

  @Override
  public List<String> diagramLabels(List<Integer> shape) {
    List<String> labels = new ArrayList<>(numQudits);
    for (int i = 0; i < numQudits; i++) {
      if (name != null) {
        labels.add(i == numQudits - 1 ? "@(" + name + ")" : "@");
        continue;
      }
      StringBuilder column = new StringBuilder("@(");
      for (List<Integer> tuple : conjunctions) {
        column.append(tuple.get(i));
      }
      labels.add(column.append(')').toString());
    }
    return labels;
  }

  @Override
  public String repr() {
    String body =
        conjunctions.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
    return name == null
        ? "SumOfProducts(" + body + ")"
        : "SumOfProducts(" + body + ", name=\"" + name + "\")";
  }

  @Override
  public String toString() {
    if (name != null) {
      return "C_" + name;
    }
    return conjunctions.stream()
        .map(t -> t.stream().map(String::valueOf).collect(Collectors.joining()))
        .collect(Collectors.joining("_", "C_", ""));
  }
}
