package hdlgen.expr;

import hdlgen.except.UserException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;
import java.util.HashMap;

/**
 * An interface port, optionally bound to a modport. Declared as {@code bus_if.master bus} or {@code bus_if bus}.
 * The port direction is always {@link PortDirection#InOut}; the modport decides per signal.
 */
public class InterfacePort extends Port implements InterfaceTyped {
  private final InterfaceDefinition definition;
  private final String modport;
  private final HashMap<String, InterfaceSignal> signals = new HashMap<>();

  /** @param modport modport name, null to use the bare interface */
  public InterfacePort(Generator generator, String name, InterfaceDefinition definition, String modport) {
    super(generator, PortDirection.InOut, name, definition.getWidth(), false, PortType.Data);
    if (modport != null && !definition.hasModport(modport))
      throw new UserException("interface " + definition.getName() + " has no modport " + modport);
    this.definition = definition;
    this.modport = modport;
  }

  @Override
  public InterfaceDefinition getDefinition() {
    return definition;
  }

  /** @return the modport name, null if none */
  public String getModport() { return modport; }

  @Override
  public InterfaceSignal signal(String signalName) {
    return InterfaceSignal.lookup(this, definition, modport, signals, signalName);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
