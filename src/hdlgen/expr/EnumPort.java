package hdlgen.expr;

import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;

/** A port of an enum type. */
public class EnumPort extends Port implements EnumTyped {
  private final EnumType enumType;

  public EnumPort(Generator generator, PortDirection direction, String name, EnumType enumType) {
    super(generator, direction, name, enumType.getWidth(), false, PortType.Data);
    this.enumType = enumType;
  }

  @Override
  public EnumType getEnumType() {
    return enumType;
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
