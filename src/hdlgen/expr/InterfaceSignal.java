package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;
import java.util.Map;

/** Signal access {@code ifc.signal} on an interface instance or interface port. */
public class InterfaceSignal extends Var {
  private final Var parent;
  private final PortDirection modportDirection;

  InterfaceSignal(Var parent, String signalName, int width, PortDirection modportDirection) {
    super(parent.getGenerator(), signalName, width, false, VarType.Slice);
    this.parent = parent;
    this.modportDirection = modportDirection;
  }

  /** Shared lookup for interface-typed values; signals are cached in the given map. */
  static InterfaceSignal lookup(Var parent, InterfaceDefinition definition, String modport, Map<String, InterfaceSignal> cache,
                                String signalName) {
    InterfaceSignal cached = cache.get(signalName);
    if (cached != null)
      return cached;
    Integer signalWidth = definition.getSignals().get(signalName);
    if (signalWidth == null)
      throw new VarException("interface " + definition.getName() + " has no signal " + signalName, List.of(parent));
    PortDirection direction = null;
    if (modport != null) {
      direction = definition.getModports().get(modport).get(signalName);
      if (direction == null)
        throw new VarException("modport " + definition.getName() + "." + modport + " does not expose " + signalName, List.of(parent));
    }
    InterfaceSignal signal = new InterfaceSignal(parent, signalName, signalWidth, direction);
    cache.put(signalName, signal);
    return signal;
  }

  public Var getParentVar() { return parent; }

  /** @return the direction given by the parent's modport, null if the parent is not bound to one */
  public PortDirection getModportDirection() { return modportDirection; }

  /** Signals a modport declares as inputs are read-only inside the module. */
  @Override
  public boolean isAssignable() {
    return modportDirection != PortDirection.In;
  }

  @Override
  public Var getRootVar() {
    return parent.getRootVar();
  }

  @Override
  public IRNode getParent() {
    return parent;
  }

  @Override
  public int childCount() {
    return 1;
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return parent;
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return parent + "." + name;
  }
}
