package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** Concatenation {@code {a, b, ...}}, first operand most significant. Unsigned. */
public class VarConcat extends Var {
  private final List<Var> operands;

  public VarConcat(List<? extends Var> operands) {
    super(checkedOwner(operands), "", operands.stream().mapToInt(Var::getWidth).sum(), false, VarType.Expression);
    this.operands = List.copyOf(operands);
  }

  private static Generator checkedOwner(List<? extends Var> operands) {
    if (operands.size() < 2)
      throw new VarException("concatenation needs at least two operands", operands);
    for (Var operand : operands) {
      if (operand instanceof InterfaceTyped)
        throw new VarException("interface " + operand.getName() + " cannot be concatenated", List.of(operand));
    }
    return Var.ownerOf(operands);
  }

  public List<Var> getOperands() { return Collections.unmodifiableList(operands); }

  @Override
  public int childCount() {
    return operands.size();
  }

  @Override
  public IRNode getChild(int index) {
    if (index < 0 || index >= operands.size())
      throw childIndexError(index);
    return operands.get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return operands.stream().map(Var::toString).collect(Collectors.joining(", ", "{", "}"));
  }
}
