package hdlgen.ir;

import hdlgen.expr.ConditionalExpr;
import hdlgen.expr.Const;
import hdlgen.expr.EnumConst;
import hdlgen.expr.EnumPort;
import hdlgen.expr.EnumVar;
import hdlgen.expr.Expr;
import hdlgen.expr.FunctionCallVar;
import hdlgen.expr.InterfacePort;
import hdlgen.expr.InterfaceSignal;
import hdlgen.expr.InterfaceVar;
import hdlgen.expr.PackedSlice;
import hdlgen.expr.Param;
import hdlgen.expr.Port;
import hdlgen.expr.PortPackedStruct;
import hdlgen.expr.Var;
import hdlgen.expr.VarCasted;
import hdlgen.expr.VarConcat;
import hdlgen.expr.VarExtend;
import hdlgen.expr.VarPackedStruct;
import hdlgen.expr.VarSlice;
import hdlgen.expr.VarVarSlice;
import hdlgen.generator.Generator;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.CombinationalStmtBlock;
import hdlgen.stmt.EventTracingStmt;
import hdlgen.stmt.IfStmt;
import hdlgen.stmt.ModuleInstantiationStmt;
import hdlgen.stmt.ScopedStmtBlock;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.StmtBlock;
import hdlgen.stmt.SwitchStmt;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Visitor over the closed set of node classes. Every method has an empty default;
 * specialized node classes fall back to the method of their base class
 * (e.g. {@link #visit(EnumPort)} calls {@link #visit(Port)}, which calls {@link #visit(Var)}).
 */
public abstract class IRVisitor {

  /**
   * Visits root and every node reachable through {@link IRNode#getChild(int)}, pre-order, children in index order.
   * Shared nodes are visited once.
   * @param root the node to start from
   */
  public void visitRoot(IRNode root) {
    Set<IRNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    ArrayDeque<IRNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      IRNode node = stack.pop();
      if (!visited.add(node))
        continue;
      node.accept(this);
      // push in reverse so that child 0 is visited first
      for (int i = node.childCount() - 1; i >= 0; --i) {
        IRNode child = node.getChild(i);
        if (child != null && !visited.contains(child))
          stack.push(child);
      }
    }
  }

  // values
  public void visit(Var var) {}
  public void visit(Port port) { visit((Var)port); }
  public void visit(EnumVar var) { visit((Var)var); }
  public void visit(EnumPort port) { visit((Port)port); }
  public void visit(VarPackedStruct var) { visit((Var)var); }
  public void visit(PortPackedStruct port) { visit((Port)port); }
  public void visit(InterfaceVar var) { visit((Var)var); }
  public void visit(InterfacePort port) { visit((Port)port); }
  public void visit(VarSlice slice) { visit((Var)slice); }
  public void visit(VarVarSlice slice) { visit((Var)slice); }
  public void visit(PackedSlice slice) { visit((Var)slice); }
  public void visit(InterfaceSignal signal) { visit((Var)signal); }
  public void visit(Const constant) { visit((Var)constant); }
  public void visit(Param param) { visit((Const)param); }
  public void visit(EnumConst constant) { visit((Const)constant); }
  public void visit(Expr expr) { visit((Var)expr); }
  public void visit(VarConcat concat) { visit((Var)concat); }
  public void visit(VarExtend extend) { visit((Var)extend); }
  public void visit(VarCasted casted) { visit((Var)casted); }
  public void visit(ConditionalExpr expr) { visit((Var)expr); }
  public void visit(FunctionCallVar call) { visit((Var)call); }

  // statements
  public void visit(AssignStmt stmt) {}
  public void visit(StmtBlock block) {}
  public void visit(SequentialStmtBlock block) { visit((StmtBlock)block); }
  public void visit(CombinationalStmtBlock block) { visit((StmtBlock)block); }
  public void visit(ScopedStmtBlock block) { visit((StmtBlock)block); }
  public void visit(IfStmt stmt) {}
  public void visit(SwitchStmt stmt) {}
  public void visit(ModuleInstantiationStmt stmt) {}
  public void visit(EventTracingStmt stmt) {}

  // modules
  public void visit(Generator generator) {}
}
