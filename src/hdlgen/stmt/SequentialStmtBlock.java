package hdlgen.stmt;

import hdlgen.except.StmtException;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.Var;
import hdlgen.ir.IRVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** {@code always_ff @(...)}. Assignments inside are nonblocking. */
public class SequentialStmtBlock extends StmtBlock {
  public record Sensitivity(BlockEdgeType edge, Var signal) {}

  private final ArrayList<Sensitivity> sensitivityList = new ArrayList<>();

  public SequentialStmtBlock() { super(StatementBlockType.Sequential); }

  public SequentialStmtBlock(List<Sensitivity> sensitivityList) {
    this();
    sensitivityList.forEach(entry -> addSensitivity(entry.edge(), entry.signal()));
  }

  /**
   * @return this, for chaining
   * @throws StmtException if the signal is not a single bit
   */
  public SequentialStmtBlock addSensitivity(BlockEdgeType edge, Var signal) {
    if (signal.getWidth() != 1 || signal instanceof InterfaceTyped)
      throw new StmtException("edge trigger " + signal + " must be a single bit", List.of(signal));
    if (getGenerator() != null && !signal.isGeneratorIndependent() && signal.getGenerator() != getGenerator())
      throw new StmtException("edge trigger " + signal + " belongs to another generator", List.of(signal, this));
    if (!signal.isGeneratorIndependent())
      adopt(signal.getGenerator());
    sensitivityList.add(new Sensitivity(edge, signal));
    return this;
  }

  public List<Sensitivity> getSensitivityList() { return Collections.unmodifiableList(sensitivityList); }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
