package hdlgen.expr;

import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;

/** A variable of an enum type. */
public class EnumVar extends Var implements EnumTyped {
  private final EnumType enumType;

  public EnumVar(Generator generator, String name, EnumType enumType) {
    super(generator, name, enumType.getWidth(), false, VarType.Base);
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
