package qudit.core;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Assigns numeric values to parameter symbols. */
public record ParamResolver(Map<String, Double> values) {

  public ParamResolver {
    Objects.requireNonNull(values, "values");
    values = Map.copyOf(values);
  }

  public static ParamResolver of(Map<String, Double> values) {
    return new ParamResolver(values);
  }

  public static ParamResolver of(String symbol, double value) {
    return new ParamResolver(Map.of(symbol, value));
  }

  public Optional<Double> value(String symbol) {
    return Optional.ofNullable(values.get(symbol));
  }
}
