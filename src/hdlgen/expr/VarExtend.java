package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;

/** Size cast {@code W'(a)}; zero- or sign-extends according to the operand's signedness. */
public class VarExtend extends Var {
  private final Var operand;

  public VarExtend(Var operand, int newWidth) {
    super(operand.getGenerator(), "", checkedWidth(operand, newWidth), operand.isSigned(), VarType.Expression);
    this.operand = operand;
  }

  private static int checkedWidth(Var operand, int newWidth) {
    if (operand instanceof InterfaceTyped)
      throw new VarException("interface " + operand.getName() + " cannot be extended", List.of(operand));
    if (newWidth < operand.getWidth())
      throw new VarException(String.format("cannot extend %s from %d to %d bits", operand, operand.getWidth(), newWidth),
                             List.of(operand));
    return newWidth;
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
    return width + "'(" + operand + ")";
  }
}
