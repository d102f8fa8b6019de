package hdlgen.expr;

import hdlgen.except.UserException;
import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Call of a function defined outside the design (a system function or one from an imported package), e.g. {@code $clog2(x)}.
 * The caller declares the result width and sign.
 */
public class FunctionCallVar extends Var {
  private final String functionName;
  private final List<Var> arguments;

  public FunctionCallVar(Generator generator, String functionName, List<? extends Var> arguments, int width, boolean isSigned) {
    super(generator, functionName, width, isSigned, VarType.Expression);
    if (functionName == null || functionName.isEmpty())
      throw new UserException("function name must not be empty");
    if (!arguments.isEmpty()) {
      Generator owner = Var.ownerOf(arguments);
      if (owner != generator && !arguments.stream().allMatch(Var::isGeneratorIndependent))
        throw new VarException("arguments of " + functionName + " belong to " + owner.getName(), arguments);
    }
    this.functionName = functionName;
    this.arguments = List.copyOf(arguments);
  }

  public String getFunctionName() { return functionName; }

  public List<Var> getArguments() { return Collections.unmodifiableList(arguments); }

  @Override
  public int childCount() {
    return arguments.size();
  }

  @Override
  public IRNode getChild(int index) {
    if (index < 0 || index >= arguments.size())
      throw childIndexError(index);
    return arguments.get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return arguments.stream().map(Var::toString).collect(Collectors.joining(", ", functionName + "(", ")"));
  }
}
