package qudit.core;

import java.util.Objects;

/**
 * A gate written as {@code e^{i pi halfTurns} * remainder}, where the scalar factor is a global
 * phase that only becomes observable once the gate is controlled.
 */
public record GlobalPhaseSplit(Gate remainder, Parameter halfTurns) {

  public GlobalPhaseSplit {
    Objects.requireNonNull(remainder, "remainder");
    Objects.requireNonNull(halfTurns, "halfTurns");
  }
}
