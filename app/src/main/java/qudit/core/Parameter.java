package qudit.core;

import java.util.Objects;
import java.util.Optional;

/**
 * A real gate parameter: either a plain number, or a numeric coefficient times a named symbol
 * that is only known once a {@link ParamResolver} supplies it.
 */
public record Parameter(double coefficient, String symbol) {

  public static Parameter of(double value) {
    return new Parameter(value, null);
  }

  public static Parameter symbol(String name) {
    Objects.requireNonNull(name, "name");
    return new Parameter(1.0, name);
  }

  public boolean isSymbolic() {
    return symbol != null;
  }

  /** Numeric value; fails for unresolved symbols. */
  public double value() {
    if (isSymbolic()) {
      throw new IllegalStateException("Parameter " + this + " is unresolved");
    }
    return coefficient;
  }

  public Optional<Double> numericValue() {
    return isSymbolic() ? Optional.empty() : Optional.of(coefficient);
  }

  public Parameter times(double factor) {
    return new Parameter(coefficient * factor, symbol);
  }

  /** Substitutes the symbol if the resolver knows it; otherwise returns {@code this}. */
  public Parameter resolve(ParamResolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    if (!isSymbolic()) {
      return this;
    }
    return resolver.value(symbol).map(v -> of(coefficient * v)).orElse(this);
  }

  @Override
  public String toString() {
    if (!isSymbolic()) {
      return formatNumber(coefficient);
    }
    return coefficient == 1.0 ? symbol : formatNumber(coefficient) + "*" + symbol;
  }

  static String formatNumber(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }
}
