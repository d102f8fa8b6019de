package hdlgen.expr;

import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;

/** A value at a module boundary. Created through {@link Generator#port(PortDirection, String, int, boolean, PortType)}. */
public class Port extends Var {
  private final PortDirection direction;
  private final PortType portType;

  public Port(Generator generator, PortDirection direction, String name, int width, boolean isSigned, PortType portType) {
    super(generator, name, width, isSigned, VarType.PortIO);
    this.direction = direction;
    this.portType = portType;
  }

  public PortDirection getDirection() { return direction; }

  public PortType getPortType() { return portType; }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
