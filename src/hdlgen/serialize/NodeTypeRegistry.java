package hdlgen.serialize;

import hdlgen.except.InternalException;
import hdlgen.except.UserException;
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
import hdlgen.ir.IRNode;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.CombinationalStmtBlock;
import hdlgen.stmt.EventTracingStmt;
import hdlgen.stmt.IfStmt;
import hdlgen.stmt.ModuleInstantiationStmt;
import hdlgen.stmt.ScopedStmtBlock;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.Stmt;
import hdlgen.stmt.StmtBlock;
import hdlgen.stmt.SwitchStmt;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Closed table of node classes with the discriminator tag written by the serializer and the tag of each class's base.
 * Abstract bases are listed too so that every base tag resolves.
 */
public class NodeTypeRegistry {
  /**
   * @param baseTag tag of the base class, null for the root
   */
  public record Entry(Class<? extends IRNode> type, String tag, String baseTag) {
    public boolean isAbstract() { return Modifier.isAbstract(type.getModifiers()); }
  }

  private static final LinkedHashMap<Class<? extends IRNode>, Entry> byClass = new LinkedHashMap<>();
  private static final HashMap<String, Entry> byTag = new HashMap<>();

  static {
    register(IRNode.class, "IRNode", null);
    register(Generator.class, "Generator", "IRNode");

    register(Var.class, "Var", "IRNode");
    register(Port.class, "Port", "Var");
    register(EnumVar.class, "EnumVar", "Var");
    register(EnumPort.class, "EnumPort", "Port");
    register(VarPackedStruct.class, "VarPackedStruct", "Var");
    register(PortPackedStruct.class, "PortPackedStruct", "Port");
    register(InterfaceVar.class, "InterfaceVar", "Var");
    register(InterfacePort.class, "InterfacePort", "Port");
    register(VarSlice.class, "VarSlice", "Var");
    register(VarVarSlice.class, "VarVarSlice", "Var");
    register(PackedSlice.class, "PackedSlice", "Var");
    register(InterfaceSignal.class, "InterfaceSignal", "Var");
    register(Const.class, "Const", "Var");
    register(Param.class, "Param", "Const");
    register(EnumConst.class, "EnumConst", "Const");
    register(Expr.class, "Expr", "Var");
    register(VarConcat.class, "VarConcat", "Var");
    register(VarExtend.class, "VarExtend", "Var");
    register(VarCasted.class, "VarCasted", "Var");
    register(ConditionalExpr.class, "ConditionalExpr", "Var");
    register(FunctionCallVar.class, "FunctionCallVar", "Var");

    register(Stmt.class, "Stmt", "IRNode");
    register(AssignStmt.class, "AssignStmt", "Stmt");
    register(StmtBlock.class, "StmtBlock", "Stmt");
    register(SequentialStmtBlock.class, "SequentialStmtBlock", "StmtBlock");
    register(CombinationalStmtBlock.class, "CombinationalStmtBlock", "StmtBlock");
    register(ScopedStmtBlock.class, "ScopedStmtBlock", "StmtBlock");
    register(IfStmt.class, "IfStmt", "Stmt");
    register(SwitchStmt.class, "SwitchStmt", "Stmt");
    register(ModuleInstantiationStmt.class, "ModuleInstantiationStmt", "Stmt");
    register(EventTracingStmt.class, "EventTracingStmt", "Stmt");
  }

  private static void register(Class<? extends IRNode> type, String tag, String baseTag) {
    if (baseTag != null && !byTag.containsKey(baseTag))
      throw new InternalException("base " + baseTag + " of " + tag + " must be registered first");
    Entry entry = new Entry(type, tag, baseTag);
    byClass.put(type, entry);
    byTag.put(tag, entry);
  }

  private NodeTypeRegistry() {}

  /**
   * @return the tag of the node's exact class
   * @throws InternalException if the class is not registered
   */
  public static String tagOf(IRNode node) {
    Entry entry = byClass.get(node.getClass());
    if (entry == null)
      throw new InternalException("node class " + node.getClass().getName() + " has no serialization tag");
    return entry.tag();
  }

  /** @throws UserException for an unknown tag */
  public static Entry entryOf(String tag) {
    Entry entry = byTag.get(tag);
    if (entry == null)
      throw new UserException("unknown node kind " + tag);
    return entry;
  }

  public static Optional<Entry> entryOf(Class<?> type) { return Optional.ofNullable(byClass.get(type)); }

  /** True if tag names ancestorTag or a class derived from it. */
  public static boolean isA(String tag, String ancestorTag) {
    for (String current = tag; current != null; current = entryOf(current).baseTag()) {
      if (current.equals(ancestorTag))
        return true;
    }
    return false;
  }

  public static Collection<Entry> entries() { return Collections.unmodifiableCollection(byClass.values()); }
}
