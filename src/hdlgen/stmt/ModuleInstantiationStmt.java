package hdlgen.stmt;

import hdlgen.except.GeneratorException;
import hdlgen.except.StmtException;
import hdlgen.except.VarException;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.Port;
import hdlgen.expr.PortDirection;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instantiation of a child generator together with its port connections. Created by
 * {@link Generator#addChildGenerator(String, Generator)}.
 */
public class ModuleInstantiationStmt extends Stmt {
  private final Generator child;
  private final LinkedHashMap<Port, Var> connections = new LinkedHashMap<>();
  private final LinkedHashSet<Port> unconnected = new LinkedHashSet<>();

  public ModuleInstantiationStmt(Generator child) {
    super(StatementType.ModuleInstantiation);
    this.child = child;
  }

  public Generator getChildGenerator() { return child; }

  public String getInstanceName() { return child.getInstanceName(); }

  /**
   * Connects a port of the child to a value of the instantiating generator.
   * @throws VarException if the port is foreign, the value belongs elsewhere or the two are not compatible
   * @throws StmtException if the port is already connected
   */
  public void connect(Port port, Var value) {
    List<Var> both = List.of(port, value);
    if (port.getGenerator() != child)
      throw new VarException(port.getName() + " is not a port of " + child.getName(), both);
    Generator parent = getGenerator();
    if (parent == null)
      throw new StmtException("instantiation of " + child.getName() + " is not attached to a generator", List.of(this));
    if (!value.isGeneratorIndependent() && value.getGenerator() != parent)
      throw new VarException(String.format("%s does not belong to %s", value, parent.getName()), both);
    if (connections.containsKey(port) || unconnected.contains(port))
      throw new StmtException("port " + port.getName() + " of " + getInstanceName() + " is already connected", List.of(port, this));
    if (port.getWidth() != value.getWidth())
      throw new VarException(String.format("width mismatch connecting %s (%d bits) to %s (%d bits)", port.getName(), port.getWidth(),
                                           value, value.getWidth()),
                             both);
    if (port instanceof InterfaceTyped || value instanceof InterfaceTyped) {
      if (!(port instanceof InterfaceTyped) || !(value instanceof InterfaceTyped) ||
          ((InterfaceTyped)port).getDefinition() != ((InterfaceTyped)value).getDefinition())
        throw new VarException("interface port " + port.getName() + " needs an instance of the same interface", both);
    } else {
      AssignStmt.checkTypesCompatible(port, value, both);
    }
    if (port.getDirection() == PortDirection.Out && !(port instanceof InterfaceTyped)) {
      Var root = value.getRootVar();
      if (!value.isAssignable() || (root instanceof Port && ((Port)root).getDirection() == PortDirection.In))
        throw new VarException("output " + port.getName() + " must drive an assignable value, not " + value, both);
    }
    connections.put(port, value);
  }

  /** Marks a port as intentionally open. */
  public void leaveUnconnected(Port port) {
    if (port.getGenerator() != child)
      throw new VarException(port.getName() + " is not a port of " + child.getName(), List.of(port));
    if (connections.containsKey(port))
      throw new StmtException("port " + port.getName() + " of " + getInstanceName() + " is already connected", List.of(port, this));
    unconnected.add(port);
  }

  public Map<Port, Var> getConnections() { return Collections.unmodifiableMap(connections); }

  public Set<Port> getUnconnected() { return Collections.unmodifiableSet(unconnected); }

  public boolean isConnected(Port port) { return connections.containsKey(port); }

  /**
   * Checks that every input and inout port of the child is connected or explicitly left open. Outputs may stay open.
   * @throws GeneratorException naming the first missing port
   */
  public void verifyConnections() {
    for (Port port : child.getPorts()) {
      if (port.getDirection() == PortDirection.Out)
        continue;
      if (!connections.containsKey(port) && !unconnected.contains(port))
        throw new GeneratorException(String.format("port %s of instance %s (%s) is not connected", port.getName(), getInstanceName(),
                                                   child.getName()),
                                     List.of(port, this));
    }
  }

  @Override
  public int childCount() {
    return 1;
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return child;
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return child.getName() + " " + getInstanceName();
  }
}
