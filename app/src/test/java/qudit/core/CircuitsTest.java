package qudit.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import qudit.gates.CommonGates;
import qudit.gates.PhaseFlipChannel;
import qudit.linalg.ComplexMatrix;
import qudit.testing.UnitaryAssertions;

final class CircuitsTest {

  @Test
  void leafOperationDecomposesToItself() {
    Operation x = CommonGates.X.on(Qid.line(0));
    assertEquals(List.of(x), Circuits.decompose(x));
  }

  @Test
  void cxExpandsToHadamardConjugatedCz() {
    List<Qid> q = Qid.range(2);
    List<Operation> leaves = Circuits.decompose(CommonGates.CX.on(q));
    assertEquals(
        List.of(
            CommonGates.H.on(q.get(1)), CommonGates.CZ.on(q), CommonGates.H.on(q.get(1))),
        leaves);
  }

  @Test
  void unitaryComposesInOrder() {
    List<Qid> q = Qid.range(2);
    List<Operation> ops =
        List.of(CommonGates.H.on(q.get(1)), CommonGates.CZ.on(q), CommonGates.H.on(q.get(1)));
    ComplexMatrix composed = Circuits.unitary(q, ops).orElseThrow();
    UnitaryAssertions.assertClose(CommonGates.CX.unitary().orElseThrow(), composed);
  }

  @Test
  void unitaryIsEmptyForChannels() {
    Qid q = Qid.line(0);
    assertTrue(
        Circuits.unitary(List.of(q), List.of(new PhaseFlipChannel(0.5).on(q))).isEmpty());
  }

  @Test
  void unitaryRejectsQidsOutsideOrder() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Circuits.unitary(List.of(Qid.line(0)), List.of(CommonGates.X.on(Qid.line(1)))));
  }

  @Test
  void qidsKeepFirstAppearanceOrder() {
    List<Qid> q = Qid.range(3);
    List<Operation> ops =
        List.of(CommonGates.CZ.on(q.get(2), q.get(0)), CommonGates.X.on(q.get(1)));
    assertEquals(List.of(q.get(2), q.get(0), q.get(1)), Circuits.qids(ops));
  }
}
