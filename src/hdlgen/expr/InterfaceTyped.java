package hdlgen.expr;

/** Implemented by interface instances and interface ports. */
public interface InterfaceTyped {
  InterfaceDefinition getDefinition();

  /**
   * Signal access; repeated calls with the same name return the same node.
   * @throws hdlgen.except.VarException if the interface has no such signal
   */
  InterfaceSignal signal(String signalName);
}
