package qudit.core;

import java.util.List;

/** Context handed to {@link Gate#diagramInfo(DiagramArgs)} by a circuit renderer. */
public record DiagramArgs(List<Qid> knownQids) {

  /** Arguments for a renderer that does not know which qudits the gate is applied to. */
  public static final DiagramArgs UNINFORMED = new DiagramArgs(null);

  public DiagramArgs {
    knownQids = knownQids == null ? null : List.copyOf(knownQids);
  }

  public boolean hasKnownQids() {
    return knownQids != null;
  }

  /** Arguments for the gate acting on the qudits after the first {@code count}. */
  public DiagramArgs dropLeading(int count) {
    if (knownQids == null) {
      return this;
    }
    return new DiagramArgs(knownQids.subList(count, knownQids.size()));
  }
}
