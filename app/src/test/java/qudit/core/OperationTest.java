package qudit.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import qudit.controlled.ControlledGate;
import qudit.controls.ProductOfSums;
import qudit.gates.CommonGates;

final class OperationTest {

  @Test
  void constructionValidatesQidCount() {
    ValidationException e =
        assertThrows(ValidationException.class, () -> CommonGates.CZ.on(Qid.line(0)));
    assertTrue(e.getMessage().contains("Wrong number of qids"), e.getMessage());
  }

  @Test
  void constructionValidatesQidShape() {
    ValidationException e =
        assertThrows(ValidationException.class, () -> CommonGates.X.on(Qid.line(0, 3)));
    assertTrue(e.getMessage().contains("Wrong shape of qids"), e.getMessage());
  }

  @Test
  void controlledByPrependsControlsAndTakesTheirShape() {
    Qid control = Qid.line(0, 3);
    Qid target = Qid.line(1);
    Operation op = CommonGates.Y.on(target).controlledBy(List.of(control), ProductOfSums.of(0));
    assertEquals(List.of(control, target), op.qids());
    ControlledGate gate = (ControlledGate) op.gate();
    assertEquals(List.of(3), gate.controlQidShape());
    assertEquals(ProductOfSums.of(0), gate.controlValues());
  }

  @Test
  void controlledByNothingIsIdentity() {
    Operation op = CommonGates.X.on(Qid.line(0));
    assertSame(op, op.controlledBy(List.of(), null));
  }

  @Test
  void textListsQids() {
    assertEquals("X(q(0))", CommonGates.X.on(Qid.line(0)).toString());
  }
}
