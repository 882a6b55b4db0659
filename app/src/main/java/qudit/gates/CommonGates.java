package qudit.gates;

/** Frequently used gate instances. */
public final class CommonGates {
  private CommonGates() {}

  public static final XPowGate X = XPowGate.of(1.0);
  public static final YPowGate Y = YPowGate.of(1.0);
  public static final ZPowGate Z = ZPowGate.of(1.0);
  public static final HPowGate H = HPowGate.of(1.0);
  public static final ZPowGate S = ZPowGate.of(0.5);
  public static final ZPowGate T = ZPowGate.of(0.25);
  public static final CZPowGate CZ = CZPowGate.of(1.0);
  public static final CXPowGate CX = CXPowGate.of(1.0);
  public static final CCZPowGate CCZ = CCZPowGate.of(1.0);
  public static final CCXPowGate CCX = CCXPowGate.of(1.0);
}
