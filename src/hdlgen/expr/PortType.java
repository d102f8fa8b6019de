package hdlgen.expr;

/** Role of a port. Everything except {@link #Data} must be a single bit. */
public enum PortType {
  Data,
  Clock,
  AsyncReset,
  ClockEnable,
  Reset;

  public boolean isSingleBit() { return this != Data; }
}
