package qudit.decompose;

/** Rewrite rules of {@link ControlledGateDecomposer}, in the order they are tried. */
public enum DecompositionRule {
  /** No controls left; the sub-gate is emitted as is. */
  NO_CONTROLS,
  /** Sum-of-products condition split into disjoint product cubes. */
  DISJUNCTION_SPLIT,
  /** Controls that accept every value of their qudit are removed. */
  DROP_UNCONDITIONAL,
  /** A control accepting several values becomes one operation per value. */
  VALUE_SPLIT,
  /** Non-default control values conjugated onto the default by cyclic relabeling. */
  RELABEL_NON_DEFAULT,
  /** Sub-gate global shift moved to a phase on the first control. */
  PHASE_EXTRACTION,
  /** Controlled pure phase turned into a phase on the first control. */
  CONTROLLED_GLOBAL_PHASE,
  /** Qubit controls folded into a canonical multi-qubit gate. */
  CANONICAL_PAIR,
  /** Each operation of the sub-gate's own decomposition, controlled. */
  SUB_GATE_DECOMPOSITION
}
