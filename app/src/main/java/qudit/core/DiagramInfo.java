package qudit.core;

import java.util.List;
import java.util.Objects;

/**
 * Per-wire symbols a renderer draws for a gate.
 *
 * @param wireSymbols one symbol per qudit, in qudit order
 * @param exponent exponent drawn next to the gate; {@code 1} is not drawn
 * @param connected whether the wires are joined by a vertical line
 * @param exponentQuditIndex wire the exponent is attached to, or {@code -1} for the last wire
 */
public record DiagramInfo(
    List<String> wireSymbols, Parameter exponent, boolean connected, int exponentQuditIndex) {

  public DiagramInfo {
    Objects.requireNonNull(wireSymbols, "wireSymbols");
    wireSymbols = List.copyOf(wireSymbols);
    exponent = exponent == null ? Parameter.of(1.0) : exponent;
  }

  public static DiagramInfo of(String... wireSymbols) {
    return new DiagramInfo(List.of(wireSymbols), Parameter.of(1.0), true, -1);
  }

  public DiagramInfo withExponent(Parameter newExponent) {
    return new DiagramInfo(wireSymbols, newExponent, connected, exponentQuditIndex);
  }
}
