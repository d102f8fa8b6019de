package hdlgen.expr;

import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;
import java.util.HashMap;

/** An interface instance declared inside a module. */
public class InterfaceVar extends Var implements InterfaceTyped {
  private final InterfaceDefinition definition;
  private final HashMap<String, InterfaceSignal> signals = new HashMap<>();

  public InterfaceVar(Generator generator, String name, InterfaceDefinition definition) {
    super(generator, name, definition.getWidth(), false, VarType.Base);
    this.definition = definition;
  }

  @Override
  public InterfaceDefinition getDefinition() {
    return definition;
  }

  @Override
  public InterfaceSignal signal(String signalName) {
    return InterfaceSignal.lookup(this, definition, null, signals, signalName);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
