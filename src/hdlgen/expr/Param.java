package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;
import java.util.List;

/**
 * A module parameter. The initial value is what the module header declares; a different current value is emitted as an override
 * where the module is instantiated.
 */
public class Param extends Const {
  private final long initialValue;

  public Param(Generator generator, String name, int width, boolean isSigned, long initialValue) {
    super(generator, name, initialValue, width, isSigned);
    this.initialValue = initialValue;
  }

  public long getInitialValue() { return initialValue; }

  /** Overrides the value for this instance. */
  public void setValue(long newValue) {
    if (!Const.fits(newValue, width, isSigned))
      throw new VarException(String.format("value %d does not fit parameter %s (%d bits)", newValue, name, width), List.of(this));
    this.value = newValue;
  }

  public boolean isOverridden() { return value != initialValue; }

  @Override
  public boolean isGeneratorIndependent() {
    return false;
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
