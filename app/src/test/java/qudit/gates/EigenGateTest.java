package qudit.gates;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import qudit.core.DiagramArgs;
import qudit.core.DiagramInfo;
import qudit.core.GlobalPhaseSplit;
import qudit.core.Operation;
import qudit.core.ParamResolver;
import qudit.core.Parameter;
import qudit.core.Protocols;
import qudit.core.Qid;
import qudit.linalg.Complex;
import qudit.linalg.ComplexMatrix;
import qudit.testing.UnitaryAssertions;

final class EigenGateTest {

  @Test
  void pauliUnitaries() {
    UnitaryAssertions.assertClose(Projectors.PAULI_X, Protocols.unitary(CommonGates.X));
    UnitaryAssertions.assertClose(Projectors.PAULI_Y, Protocols.unitary(CommonGates.Y));
    UnitaryAssertions.assertClose(Projectors.PAULI_Z, Protocols.unitary(CommonGates.Z));
    UnitaryAssertions.assertClose(Projectors.HADAMARD, Protocols.unitary(CommonGates.H));
    UnitaryAssertions.assertClose(
        ComplexMatrix.diagonal(Complex.ONE, Complex.I), Protocols.unitary(CommonGates.S));
  }

  @Test
  void squareRootOfXSquaresToX() {
    ComplexMatrix root = Protocols.unitary(XPowGate.of(0.5));
    UnitaryAssertions.assertClose(Projectors.PAULI_X, root.times(root));
  }

  @Test
  void globalShiftMultipliesByPhase() {
    ZPowGate shifted = new ZPowGate(Parameter.of(1.0), -0.5);
    UnitaryAssertions.assertClose(
        ComplexMatrix.diagonal(new Complex(0, -1), Complex.I), Protocols.unitary(shifted));
  }

  @Test
  void equalityReducesExponentByPeriod() {
    assertEquals(CommonGates.Y, YPowGate.of(-1.0));
    assertEquals(CommonGates.X, XPowGate.of(3.0));
    assertEquals(CommonGates.X.hashCode(), XPowGate.of(3.0).hashCode());
    assertEquals(CommonGates.Z, ZPowGate.of(-1.0));
    assertNotEquals(CommonGates.X, new XPowGate(Parameter.of(1.0), 0.5));
    assertNotEquals(CommonGates.X, CommonGates.Z);
    assertNotEquals(CommonGates.CZ, CZPowGate.of(0.5));
  }

  @Test
  void powMultipliesExponent() {
    assertEquals(Optional.of(CommonGates.Z), CommonGates.S.pow(2.0));
    assertEquals(Optional.of(ZPowGate.of(-0.25)), CommonGates.T.inverse());
    assertEquals(Optional.of(CCXPowGate.of(0.5)), CommonGates.CCX.pow(0.5));
  }

  @Test
  void symbolicExponent() {
    ZPowGate gate = new ZPowGate(Parameter.symbol("t"), 0.0);
    assertTrue(gate.isParameterized());
    assertFalse(gate.hasUnitary());
    assertTrue(gate.unitary().isEmpty());
    assertEquals(
        Optional.of(new ZPowGate(Parameter.symbol("t").times(2.0), 0.0)), gate.pow(2.0));
    assertEquals(CommonGates.S, gate.resolveParameters(ParamResolver.of("t", 0.5)));
    assertEquals("Z**t", gate.toString());
  }

  @Test
  void globalPhaseSplitSeparatesShift() {
    ZPowGate shifted = new ZPowGate(Parameter.of(0.5), 0.2);
    GlobalPhaseSplit split = shifted.globalPhaseSplit().orElseThrow();
    assertEquals(ZPowGate.of(0.5), split.remainder());
    assertEquals(0.1, split.halfTurns().value(), 1e-12);
    assertTrue(CommonGates.Z.globalPhaseSplit().isEmpty());
  }

  @Test
  void shortText() {
    assertEquals("X", CommonGates.X.toString());
    assertEquals("X**0.5", XPowGate.of(0.5).toString());
    assertEquals("S", CommonGates.S.toString());
    assertEquals("T", CommonGates.T.toString());
    assertEquals("S**-1", ZPowGate.of(-0.5).toString());
    assertEquals("Z**0.125", ZPowGate.of(0.125).toString());
    assertEquals("CZ", CommonGates.CZ.toString());
    assertEquals("CX", CommonGates.CX.toString());
    assertEquals("CCZ", CommonGates.CCZ.toString());
    assertEquals("CCX", CommonGates.CCX.toString());
    assertEquals("H", CommonGates.H.toString());
    assertEquals("XPowGate(exponent=0.5, globalShift=0.0)", XPowGate.of(0.5).repr());
  }

  @Test
  void diagramInfo() {
    DiagramInfo s = CommonGates.S.diagramInfo(DiagramArgs.UNINFORMED).orElseThrow();
    assertEquals(List.of("S"), s.wireSymbols());
    assertEquals(Parameter.of(1.0), s.exponent());
    DiagramInfo z = ZPowGate.of(0.125).diagramInfo(DiagramArgs.UNINFORMED).orElseThrow();
    assertEquals(List.of("Z"), z.wireSymbols());
    assertEquals(Parameter.of(0.125), z.exponent());
    DiagramInfo ccx = CommonGates.CCX.diagramInfo(DiagramArgs.UNINFORMED).orElseThrow();
    assertEquals(List.of("@", "@", "X"), ccx.wireSymbols());
  }

  @Test
  void singleQubitGatesAndCzAreLeaves() {
    assertTrue(CommonGates.X.decompose(List.of(Qid.line(0))).isEmpty());
    assertTrue(CommonGates.CZ.decompose(Qid.range(2)).isEmpty());
  }

  @Test
  void cxDecomposesExactly() {
    UnitaryAssertions.assertDecompositionExact(CXPowGate.of(0.3).on(Qid.range(2)));
    UnitaryAssertions.assertDecompositionExact(
        new CXPowGate(Parameter.of(0.7), 0.25).on(Qid.range(2)));
  }

  @Test
  void ccxAndCczDecomposeExactly() {
    UnitaryAssertions.assertDecompositionExact(CommonGates.CCX.on(Qid.range(3)));
    UnitaryAssertions.assertDecompositionExact(CommonGates.CCZ.on(Qid.range(3)));
    UnitaryAssertions.assertDecompositionExact(CCZPowGate.of(0.37).on(Qid.range(3)));
  }

  @Test
  void cczWithShiftLeadsWithGlobalPhase() {
    CCZPowGate shifted = new CCZPowGate(Parameter.of(0.5), 0.3);
    List<Operation> ops = shifted.decompose(Qid.range(3)).orElseThrow();
    assertEquals(new GlobalPhaseGate(Parameter.of(0.15)).on(), ops.get(0));
    UnitaryAssertions.assertDecompositionExact(shifted.on(Qid.range(3)));
  }

  @Test
  void traceDistanceBound() {
    assertEquals(1.0, CommonGates.X.traceDistanceBound(), 1e-12);
    assertEquals(Math.sin(Math.PI / 8), CommonGates.T.traceDistanceBound(), 1e-12);
    assertEquals(1.0, new XPowGate(Parameter.symbol("t"), 0.0).traceDistanceBound(), 1e-12);
  }
}
