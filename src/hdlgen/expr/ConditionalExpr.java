package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;

/** The ternary {@code cond ? a : b}. Built by {@link Generator#conditional(Var, Var, Var)}. */
public class ConditionalExpr extends Var {
  private final Var condition;
  private final Var whenTrue;
  private final Var whenFalse;

  public ConditionalExpr(Var condition, Var whenTrue, Var whenFalse) {
    super(checkedOwner(condition, whenTrue, whenFalse), "", whenTrue.getWidth(), whenTrue.isSigned(), VarType.Expression);
    this.condition = condition;
    this.whenTrue = whenTrue;
    this.whenFalse = whenFalse;
  }

  private static Generator checkedOwner(Var condition, Var whenTrue, Var whenFalse) {
    List<Var> operands = List.of(condition, whenTrue, whenFalse);
    if (condition.getWidth() != 1)
      throw new VarException("condition " + condition + " must be 1 bit wide", List.of(condition));
    for (Var operand : operands) {
      if (operand instanceof InterfaceTyped)
        throw new VarException("interface " + operand.getName() + " cannot be used as a value", operands);
    }
    if (whenTrue.getWidth() != whenFalse.getWidth() || whenTrue.isSigned() != whenFalse.isSigned())
      throw new VarException(String.format("branches of %s ? ... : ... differ in width or sign", condition),
                             List.of(whenTrue, whenFalse));
    return Var.ownerOf(operands);
  }

  public Var getCondition() { return condition; }

  public Var getTrueValue() { return whenTrue; }

  public Var getFalseValue() { return whenFalse; }

  @Override
  public int childCount() {
    return 3;
  }

  @Override
  public IRNode getChild(int index) {
    switch (index) {
    case 0:
      return condition;
    case 1:
      return whenTrue;
    case 2:
      return whenFalse;
    default:
      throw childIndexError(index);
    }
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return Expr.operand(condition) + " ? " + Expr.operand(whenTrue) + " : " + Expr.operand(whenFalse);
  }
}
