package hdlgen.expr;

import hdlgen.except.UserException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;

/** A named value of an {@link EnumType}; rendered by its name. */
public class EnumConst extends Const implements EnumTyped {
  private final EnumType enumType;

  public EnumConst(Generator generator, EnumType enumType, String valueName) {
    super(generator, valueName, lookup(enumType, valueName), enumType.getWidth(), false);
    this.enumType = enumType;
  }

  private static long lookup(EnumType enumType, String valueName) {
    Long value = enumType.getValues().get(valueName);
    if (value == null)
      throw new UserException(enumType.getName() + " has no value named " + valueName);
    return value;
  }

  @Override
  public EnumType getEnumType() {
    return enumType;
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
