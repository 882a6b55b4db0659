package qudit.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A named quantum degree of freedom with a fixed number of basis states. */
public record Qid(String name, int dimension) {

  public Qid {
    Objects.requireNonNull(name, "name");
    if (dimension < 2) {
      throw new ValidationException("Qid dimension must be at least 2, got " + dimension);
    }
  }

  /** Qubit on a line at position {@code x}. */
  public static Qid line(int x) {
    return line(x, 2);
  }

  public static Qid line(int x, int dimension) {
    return new Qid("q(" + x + ")", dimension);
  }

  /** Qubits {@code q(0) .. q(n-1)}. */
  public static List<Qid> range(int n) {
    List<Qid> qids = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      qids.add(line(i));
    }
    return List.copyOf(qids);
  }

  /** One line qudit per entry of {@code shape}, numbered from zero. */
  public static List<Qid> forShape(List<Integer> shape) {
    Objects.requireNonNull(shape, "shape");
    List<Qid> qids = new ArrayList<>(shape.size());
    for (int i = 0; i < shape.size(); i++) {
      qids.add(line(i, shape.get(i)));
    }
    return List.copyOf(qids);
  }

  public static List<Integer> shapeOf(List<Qid> qids) {
    List<Integer> shape = new ArrayList<>(qids.size());
    for (Qid qid : qids) {
      shape.add(qid.dimension());
    }
    return List.copyOf(shape);
  }

  @Override
  public String toString() {
    return dimension == 2 ? name : name + " (d=" + dimension + ")";
  }
}
