package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;

/** Signedness cast, {@code $signed(a)} or {@code $unsigned(a)}. The width is unchanged. */
public class VarCasted extends Var {
  private final Var operand;

  public VarCasted(Var operand, boolean toSigned) {
    super(checked(operand).getGenerator(), "", operand.getWidth(), toSigned, VarType.Expression);
    this.operand = operand;
  }

  private static Var checked(Var operand) {
    if (operand instanceof InterfaceTyped || operand instanceof EnumTyped)
      throw new VarException("cannot change the signedness of typed value " + operand.getName(), List.of(operand));
    return operand;
  }

  public Var getOperand() { return operand; }

  @Override
  public boolean isGeneratorIndependent() {
    return operand.isGeneratorIndependent();
  }

  @Override
  public int childCount() {
    return 1;
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return operand;
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return (isSigned ? "$signed(" : "$unsigned(") + operand + ")";
  }
}
