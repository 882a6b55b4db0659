package qudit.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import qudit.linalg.ComplexMatrix;
import qudit.linalg.QuditTensors;

/** Helpers for operation sequences: recursive decomposition and composed unitaries. */
public final class Circuits {
  private static final int MAX_DECOMPOSITION_DEPTH = 256;

  private Circuits() {}

  /**
   * Recursively decomposes {@code operation} until every remaining operation reports no
   * decomposition. An operation without a decomposition yields itself.
   */
  public static List<Operation> decompose(Operation operation) {
    Objects.requireNonNull(operation, "operation");
    List<Operation> leaves = new ArrayList<>();
    Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(List.of(operation), 0));
    while (!stack.isEmpty()) {
      Frame frame = stack.peek();
      if (frame.next >= frame.ops.size()) {
        stack.pop();
        continue;
      }
      Operation op = frame.ops.get(frame.next++);
      Optional<List<Operation>> expanded = op.decompose();
      if (expanded.isEmpty()) {
        leaves.add(op);
        continue;
      }
      if (stack.size() >= MAX_DECOMPOSITION_DEPTH) {
        throw new IllegalStateException(
            "Decomposition of " + operation + " exceeded depth " + MAX_DECOMPOSITION_DEPTH);
      }
      stack.push(new Frame(expanded.get(), 0));
    }
    return List.copyOf(leaves);
  }

  /** Qudits touched by {@code operations}, in order of first appearance. */
  public static List<Qid> qids(List<Operation> operations) {
    Set<Qid> seen = new LinkedHashSet<>();
    for (Operation op : operations) {
      seen.addAll(op.qids());
    }
    return List.copyOf(seen);
  }

  /**
   * Unitary of applying {@code operations} in sequence, over the register {@code order}. Empty if
   * any operation lacks a unitary.
   */
  public static Optional<ComplexMatrix> unitary(List<Qid> order, List<Operation> operations) {
    Objects.requireNonNull(order, "order");
    Objects.requireNonNull(operations, "operations");
    List<Integer> shape = Qid.shapeOf(order);
    Map<Qid, Integer> positions = new HashMap<>();
    for (int i = 0; i < order.size(); i++) {
      positions.put(order.get(i), i);
    }
    ComplexMatrix total = ComplexMatrix.identity(QuditTensors.dimension(shape));
    for (Operation op : operations) {
      Optional<ComplexMatrix> u = op.unitary();
      if (u.isEmpty()) {
        return Optional.empty();
      }
      List<Integer> targets = new ArrayList<>(op.qids().size());
      for (Qid qid : op.qids()) {
        Integer pos = positions.get(qid);
        if (pos == null) {
          throw new IllegalArgumentException(op + " acts on " + qid + " outside " + order);
        }
        targets.add(pos);
      }
      total = QuditTensors.embed(u.get(), shape, targets).times(total);
    }
    return Optional.of(total);
  }

  private static final class Frame {
    private final List<Operation> ops;
    private int next;

    private Frame(List<Operation> ops, int next) {
      this.ops = ops;
      this.next = next;
    }
  }
}
