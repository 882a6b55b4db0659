package qudit.controls;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Condition on the basis values of a list of control qudits under which a controlled gate fires.
 *
 * <p>Two encodings exist: {@link ProductOfSums} (a set of accepted values per qudit, combined by
 * conjunction) and {@link SumOfProducts} (a set of complete assignments, combined by
 * disjunction). Callers never need to know which one they hold: matching, validation,
 * enumeration and equality are all defined on the accepted-assignment set, so a product and a
 * sum that accept the same assignments are equal and share a hash code.
 */
public abstract class ControlValues implements Iterable<List<Integer>> {

  /** Lexicographic order on equal-length assignments. */
  public static final Comparator<List<Integer>> LEXICOGRAPHIC =
      (a, b) -> {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
          int cmp = Integer.compare(a.get(i), b.get(i));
          if (cmp != 0) {
            return cmp;
          }
        }
        return Integer.compare(a.size(), b.size());
      };

  private final Supplier<List<List<Integer>>> accepted =
      Suppliers.memoize(this::computeAcceptedAssignments);

  ControlValues() {}

  /** Number of control qudits the condition ranges over. */
  public abstract int numQudits();

  /** Whether the condition fires for the given control assignment. */
  public abstract boolean matches(List<Integer> assignment);

  /** Per-qudit short labels for a diagram renderer, one per control qudit. */
  public abstract List<String> diagramLabels(List<Integer> shape);

  /** Short text for the condition over controls of the given dimensions. */
  public String toString(List<Integer> shape) {
    return toString();
  }

  /** Text reading like the constructor call that produced this condition. */
  public abstract String repr();

  abstract List<List<Integer>> computeAcceptedAssignments();

  /**
   * Checks the condition against the control qudit dimensions.
   *
   * @throws qudit.core.ValidationException if the qudit counts differ or a value is outside
   *     {@code [0, d)}
   */
  public abstract void validate(List<Integer> shape);

  /**
   * Every accepted assignment, sorted lexicographically and without duplicates.
   *
   * <p>A product form is enumerated lazily, but its size must still fit an {@code int}.
   */
  public final List<List<Integer>> acceptedAssignments() {
    return accepted.get();
  }

  @Override
  public final Iterator<List<Integer>> iterator() {
    return acceptedAssignments().iterator();
  }

  /** Values that appear at {@code qudit} in some accepted assignment. */
  public SortedSet<Integer> valuesAt(int qudit) {
    Objects.checkIndex(qudit, numQudits());
    SortedSet<Integer> values = new TreeSet<>();
    for (List<Integer> assignment : acceptedAssignments()) {
      values.add(assignment.get(qudit));
    }
    return values;
  }

  /**
   * The condition on {@code this} qudits followed by {@code other}'s qudits, firing when both
   * fire. Two products stay a product; anything involving a sum becomes a sum.
   */
  public ControlValues and(ControlValues other) {
    Objects.requireNonNull(other, "other");
    if (this instanceof ProductOfSums left && other instanceof ProductOfSums right) {
      List<SortedSet<Integer>> sums = new ArrayList<>(left.qubitSums());
      sums.addAll(right.qubitSums());
      return ProductOfSums.of(sums);
    }
    List<List<Integer>> tuples = new ArrayList<>();
    for (List<List<Integer>> pair :
        Lists.cartesianProduct(acceptedAssignments(), other.acceptedAssignments())) {
      List<Integer> tuple = new ArrayList<>(pair.get(0));
      tuple.addAll(pair.get(1));
      tuples.add(tuple);
    }
    return SumOfProducts.of(tuples);
  }

  /** True when exactly one assignment is accepted and it is {@code d - 1} on every qudit. */
  public boolean acceptsOnlyDefaults(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    if (shape.size() != numQudits()) {
      return false;
    }
    Optional<ProductOfSums> product = asProductOfSums();
    if (product.isEmpty()) {
      return false;
    }
    for (int i = 0; i < shape.size(); i++) {
      SortedSet<Integer> values = product.get().sumAt(i);
      if (values.size() != 1 || values.first() != shape.get(i) - 1) {
        return false;
      }
    }
    return true;
  }

  /**
   * The equivalent product form, when the accepted set is exactly the Cartesian product of its
   * per-qudit value sets.
   */
  public abstract Optional<ProductOfSums> asProductOfSums();

  /**
   * Equal when both accept the same assignments. Product forms compare their per-qudit sets, so
   * wide products are never enumerated.
   */
  @Override
  public final boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ControlValues other) || numQudits() != other.numQudits()) {
      return false;
    }
    Optional<ProductOfSums> mine = asProductOfSums();
    Optional<ProductOfSums> theirs = other.asProductOfSums();
    if (mine.isPresent() && theirs.isPresent()) {
      return mine.get().qubitSums().equals(theirs.get().qubitSums());
    }
    if (mine.isPresent() || theirs.isPresent()) {
      return false;
    }
    // Neither is a product, so both are sums holding their tuples explicitly.
    return acceptedAssignments().equals(other.acceptedAssignments());
  }

  /** Hashes the per-qudit value projections, which equal conditions share. */
  @Override
  public final int hashCode() {
    List<SortedSet<Integer>> projections = new ArrayList<>(numQudits());
    for (int i = 0; i < numQudits(); i++) {
      projections.add(valuesAt(i));
    }
    return Objects.hash(numQudits(), projections);
  }
}
