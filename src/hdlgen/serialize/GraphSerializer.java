package hdlgen.serialize;

import hdlgen.except.InternalException;
import hdlgen.except.UserException;
import hdlgen.expr.ConditionalExpr;
import hdlgen.expr.Const;
import hdlgen.expr.EnumConst;
import hdlgen.expr.EnumType;
import hdlgen.expr.EnumTyped;
import hdlgen.expr.Expr;
import hdlgen.expr.FunctionCallVar;
import hdlgen.expr.InterfaceDefinition;
import hdlgen.expr.InterfacePort;
import hdlgen.expr.InterfaceSignal;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.PackedSlice;
import hdlgen.expr.PackedStruct;
import hdlgen.expr.Param;
import hdlgen.expr.Port;
import hdlgen.expr.StructTyped;
import hdlgen.expr.TypeDefinition;
import hdlgen.expr.Var;
import hdlgen.expr.VarCasted;
import hdlgen.expr.VarConcat;
import hdlgen.expr.VarExtend;
import hdlgen.expr.VarSlice;
import hdlgen.expr.VarVarSlice;
import hdlgen.generator.Context;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.EventTracingStmt;
import hdlgen.stmt.IfStmt;
import hdlgen.stmt.ModuleInstantiationStmt;
import hdlgen.stmt.ScopedStmtBlock;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.Stmt;
import hdlgen.stmt.StmtBlock;
import hdlgen.stmt.SwitchStmt;
import java.io.Writer;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Writes a {@link Context} as a YAML document.
 * <p>
 * The document has a header, a table of type definitions, a table of generators and a table of nodes. Every node gets an integer
 * id and refers to other nodes by id, so a node shared by several users is written once. Nodes are listed so that each one only
 * refers to nodes listed before it: all declarations first, then statements and their operands depth first.
 * Only nodes reachable from a generator are written.
 */
public class GraphSerializer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String FORMAT = "hdlgen-graph";
  public static final int VERSION = 1;

  private final IdentityHashMap<TypeDefinition, Integer> typeIds = new IdentityHashMap<>();
  private final IdentityHashMap<Generator, Integer> generatorIds = new IdentityHashMap<>();
  private final IdentityHashMap<IRNode, Integer> nodeIds = new IdentityHashMap<>();
  private final List<Map<String, Object>> types = new ArrayList<>();
  private final List<Map<String, Object>> nodes = new ArrayList<>();

  private GraphSerializer() {}

  /** Serializes every generator of the context. */
  public static void serialize(Writer writer, Context context) {
    Map<String, Object> document = new GraphSerializer().toDocument(context);
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    new Yaml(options).dump(document, writer);
  }

  /** Builds the document tree that {@link #serialize(Writer, Context)} writes. */
  static Map<String, Object> document(Context context) { return new GraphSerializer().toDocument(context); }

  private Map<String, Object> toDocument(Context context) {
    List<Generator> generators = context.getGenerators();
    for (Generator generator : generators)
      generatorIds.put(generator, generatorIds.size());
    for (Generator generator : generators)
      generator.getTypeDefinitions().forEach(this::typeId);

    // declarations of every generator come first, so that instantiations can refer to ports of later generators
    for (Generator generator : generators) {
      generator.getPorts().forEach(this::visit);
      generator.getVars().forEach(this::visit);
      generator.getParams().forEach(this::visit);
    }
    for (Generator generator : generators) {
      generator.getStmts().forEach(this::visit);
      for (Var var : declarations(generator))
        var.sinks().forEach(this::visit);
    }

    List<Map<String, Object>> generatorTable = new ArrayList<>();
    for (Generator generator : generators) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("id", generatorIds.get(generator));
      entry.put("name", generator.getName());
      entry.put("external", generator.isExternal());
      entry.put("types", generator.getTypeDefinitions().stream().map(typeIds::get).toList());
      entry.put("stmts", generator.getStmts().stream().map(nodeIds::get).toList());
      generatorTable.add(entry);
    }

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("format", FORMAT);
    document.put("version", VERSION);
    document.put("types", types);
    document.put("generators", generatorTable);
    document.put("nodes", nodes);
    logger.debug("Serialized {} generator(s), {} type(s), {} node(s)", generators.size(), types.size(), nodes.size());
    return document;
  }

  private static List<Var> declarations(Generator generator) {
    List<Var> declarations = new ArrayList<>(generator.getPorts());
    declarations.addAll(generator.getVars());
    return declarations;
  }

  private int typeId(TypeDefinition definition) {
    Integer id = typeIds.get(definition);
    if (id != null)
      return id;
    id = typeIds.size();
    typeIds.put(definition, id);
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("id", id);
    entry.put("name", definition.getName());
    if (definition instanceof EnumType) {
      EnumType enumType = (EnumType)definition;
      entry.put("kind", "enum");
      entry.put("width", enumType.getWidth());
      entry.put("values", new LinkedHashMap<>(enumType.getValues()));
    } else if (definition instanceof PackedStruct) {
      entry.put("kind", "struct");
      List<Map<String, Object>> members = new ArrayList<>();
      for (PackedStruct.Member member : ((PackedStruct)definition).getMembers()) {
        Map<String, Object> memberEntry = new LinkedHashMap<>();
        memberEntry.put("name", member.name());
        memberEntry.put("width", member.width());
        memberEntry.put("signed", member.isSigned());
        members.add(memberEntry);
      }
      entry.put("members", members);
    } else if (definition instanceof InterfaceDefinition) {
      InterfaceDefinition ifc = (InterfaceDefinition)definition;
      entry.put("kind", "interface");
      entry.put("signals", new LinkedHashMap<>(ifc.getSignals()));
      Map<String, Object> modports = new LinkedHashMap<>();
      ifc.getModports().forEach((name, directions) -> {
        Map<String, Object> modport = new LinkedHashMap<>();
        directions.forEach((signal, direction) -> modport.put(signal, direction.name()));
        modports.put(name, modport);
      });
      entry.put("modports", modports);
    } else {
      throw new InternalException("unknown type definition " + definition.getClass().getSimpleName());
    }
    types.add(entry);
    return id;
  }

  private List<Integer> ids(List<? extends IRNode> list) {
    List<Integer> result = new ArrayList<>();
    for (IRNode node : list)
      result.add(nodeIds.get(node));
    return result;
  }

  /** Writes node after everything it refers to; values are followed by their sinks. */
  private void visit(IRNode node) {
    if (nodeIds.containsKey(node))
      return;
    for (IRNode dependency : dependencies(node))
      visit(dependency);
    // a dependency may have pulled this node in through its sinks
    if (nodeIds.containsKey(node))
      return;
    int id = nodeIds.size();
    nodeIds.put(node, id);
    nodes.add(describe(node, id));
    if (node instanceof Var && !isDeclaration((Var)node))
      ((Var)node).sinks().forEach(this::visit);
  }

  private static boolean isDeclaration(Var var) {
    Generator generator = var.getGenerator();
    return (var instanceof Port && generator.hasPort(var.getName()) && generator.getPort(var.getName()) == var) ||
        (generator.hasVar(var.getName()) && generator.getVar(var.getName()) == var);
  }

  private List<IRNode> dependencies(IRNode node) {
    List<IRNode> result = new ArrayList<>();
    if (node instanceof Var || node instanceof AssignStmt || node instanceof EventTracingStmt) {
      for (int i = 0; i < node.childCount(); ++i)
        result.add(node.getChild(i));
    } else if (node instanceof SequentialStmtBlock) {
      ((SequentialStmtBlock)node).getSensitivityList().forEach(entry -> result.add(entry.signal()));
      result.addAll(((StmtBlock)node).getStmts());
    } else if (node instanceof StmtBlock) {
      result.addAll(((StmtBlock)node).getStmts());
    } else if (node instanceof IfStmt) {
      IfStmt ifStmt = (IfStmt)node;
      result.add(ifStmt.getPredicate());
      result.addAll(ifStmt.thenBody().getStmts());
      result.addAll(ifStmt.elseBody().getStmts());
    } else if (node instanceof SwitchStmt) {
      SwitchStmt switchStmt = (SwitchStmt)node;
      result.add(switchStmt.getTarget());
      switchStmt.getCases().forEach((value, body) -> {
        result.add(value);
        result.addAll(body.getStmts());
      });
      switchStmt.getDefault().ifPresent(body -> result.addAll(body.getStmts()));
    } else if (node instanceof ModuleInstantiationStmt) {
      ModuleInstantiationStmt stmt = (ModuleInstantiationStmt)node;
      stmt.getConnections().forEach((port, value) -> {
        result.add(port);
        result.add(value);
      });
      result.addAll(stmt.getUnconnected());
    } else {
      throw new InternalException("cannot serialize " + node.getClass().getSimpleName());
    }
    return result;
  }

  private int generatorId(Generator generator) {
    Integer id = generatorIds.get(generator);
    if (id == null)
      throw new UserException("generator " + generator.getName() + " was not created through the serialized context");
    return id;
  }

  private Map<String, Object> describe(IRNode node, int id) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("id", id);
    entry.put("kind", NodeTypeRegistry.tagOf(node));
    entry.put("generator", generatorId(node.getGenerator()));
    if (node instanceof Var)
      describeVar((Var)node, entry);
    else
      describeStmt((Stmt)node, entry);
    return entry;
  }

  private void describeVar(Var var, Map<String, Object> entry) {
    if (var instanceof VarSlice) {
      entry.put("parent", nodeIds.get(((VarSlice)var).getParentVar()));
      entry.put("high", ((VarSlice)var).getHigh());
      entry.put("low", ((VarSlice)var).getLow());
    } else if (var instanceof VarVarSlice) {
      entry.put("parent", nodeIds.get(((VarVarSlice)var).getParentVar()));
      entry.put("index", nodeIds.get(((VarVarSlice)var).getIndex()));
    } else if (var instanceof PackedSlice) {
      entry.put("parent", nodeIds.get(((PackedSlice)var).getParentVar()));
      entry.put("member", var.getName());
    } else if (var instanceof InterfaceSignal) {
      entry.put("parent", nodeIds.get(((InterfaceSignal)var).getParentVar()));
      entry.put("signal", var.getName());
    } else if (var instanceof Param) {
      Param param = (Param)var;
      entry.put("name", param.getName());
      entry.put("width", param.getWidth());
      entry.put("signed", param.isSigned());
      entry.put("initial", param.getInitialValue());
      entry.put("value", param.getValue());
    } else if (var instanceof EnumConst) {
      entry.put("type", typeId(((EnumConst)var).getEnumType()));
      entry.put("value", var.getName());
    } else if (var instanceof Const) {
      entry.put("value", ((Const)var).getValue());
      entry.put("width", var.getWidth());
      entry.put("signed", var.isSigned());
    } else if (var instanceof Expr) {
      Expr expr = (Expr)var;
      entry.put("op", expr.getOp().name());
      entry.put("left", nodeIds.get(expr.getLeft()));
      if (expr.getRight() != null)
        entry.put("right", nodeIds.get(expr.getRight()));
    } else if (var instanceof VarConcat) {
      entry.put("operands", ids(((VarConcat)var).getOperands()));
    } else if (var instanceof VarExtend) {
      entry.put("operand", nodeIds.get(((VarExtend)var).getOperand()));
      entry.put("width", var.getWidth());
    } else if (var instanceof VarCasted) {
      entry.put("operand", nodeIds.get(((VarCasted)var).getOperand()));
      entry.put("signed", var.isSigned());
    } else if (var instanceof ConditionalExpr) {
      ConditionalExpr conditional = (ConditionalExpr)var;
      entry.put("condition", nodeIds.get(conditional.getCondition()));
      entry.put("true", nodeIds.get(conditional.getTrueValue()));
      entry.put("false", nodeIds.get(conditional.getFalseValue()));
    } else if (var instanceof FunctionCallVar) {
      entry.put("name", ((FunctionCallVar)var).getFunctionName());
      entry.put("width", var.getWidth());
      entry.put("signed", var.isSigned());
      entry.put("arguments", ids(((FunctionCallVar)var).getArguments()));
    } else {
      // declared values: plain, typed, ports
      if (!var.getGenerator().isDeclared(var))
        throw new UserException(String.format("%s is not declared in %s; create values through the generator", var.getName(),
                                              var.getGenerator().getName()));
      entry.put("name", var.getName());
      if (var instanceof EnumTyped)
        entry.put("type", typeId(((EnumTyped)var).getEnumType()));
      else if (var instanceof StructTyped)
        entry.put("type", typeId(((StructTyped)var).getStruct()));
      else if (var instanceof InterfaceTyped)
        entry.put("type", typeId(((InterfaceTyped)var).getDefinition()));
      else {
        entry.put("width", var.getWidth());
        entry.put("signed", var.isSigned());
      }
      if (var instanceof InterfacePort) {
        if (((InterfacePort)var).getModport() != null)
          entry.put("modport", ((InterfacePort)var).getModport());
      } else if (var instanceof Port) {
        entry.put("direction", ((Port)var).getDirection().name());
        entry.put("port_type", ((Port)var).getPortType().name());
      }
    }
    if (!var.getComment().isEmpty())
      entry.put("comment", var.getComment());
  }

  private void describeStmt(Stmt stmt, Map<String, Object> entry) {
    if (stmt instanceof AssignStmt) {
      AssignStmt assign = (AssignStmt)stmt;
      entry.put("target", nodeIds.get(assign.getTarget()));
      entry.put("source", nodeIds.get(assign.getSource()));
      entry.put("assignment", assign.getAssignmentType().name());
    } else if (stmt instanceof SequentialStmtBlock) {
      List<Map<String, Object>> sensitivity = new ArrayList<>();
      for (SequentialStmtBlock.Sensitivity item : ((SequentialStmtBlock)stmt).getSensitivityList()) {
        Map<String, Object> itemEntry = new LinkedHashMap<>();
        itemEntry.put("edge", item.edge().name());
        itemEntry.put("signal", nodeIds.get(item.signal()));
        sensitivity.add(itemEntry);
      }
      entry.put("sensitivity", sensitivity);
      entry.put("stmts", ids(((StmtBlock)stmt).getStmts()));
    } else if (stmt instanceof StmtBlock) {
      entry.put("stmts", ids(((StmtBlock)stmt).getStmts()));
    } else if (stmt instanceof IfStmt) {
      IfStmt ifStmt = (IfStmt)stmt;
      entry.put("predicate", nodeIds.get(ifStmt.getPredicate()));
      entry.put("then", ids(ifStmt.thenBody().getStmts()));
      entry.put("else", ids(ifStmt.elseBody().getStmts()));
    } else if (stmt instanceof SwitchStmt) {
      SwitchStmt switchStmt = (SwitchStmt)stmt;
      entry.put("target", nodeIds.get(switchStmt.getTarget()));
      List<Map<String, Object>> cases = new ArrayList<>();
      for (Map.Entry<Const, ScopedStmtBlock> item : switchStmt.getCases().entrySet()) {
        Map<String, Object> caseEntry = new LinkedHashMap<>();
        caseEntry.put("value", nodeIds.get(item.getKey()));
        caseEntry.put("body", ids(item.getValue().getStmts()));
        cases.add(caseEntry);
      }
      entry.put("cases", cases);
      switchStmt.getDefault().ifPresent(body -> entry.put("default", ids(body.getStmts())));
    } else if (stmt instanceof ModuleInstantiationStmt) {
      ModuleInstantiationStmt instance = (ModuleInstantiationStmt)stmt;
      entry.put("child", generatorId(instance.getChildGenerator()));
      entry.put("instance", instance.getInstanceName());
      List<Map<String, Object>> connections = new ArrayList<>();
      instance.getConnections().forEach((port, value) -> {
        Map<String, Object> connection = new LinkedHashMap<>();
        connection.put("port", nodeIds.get(port));
        connection.put("value", nodeIds.get(value));
        connections.add(connection);
      });
      entry.put("connections", connections);
      entry.put("unconnected", ids(new ArrayList<>(instance.getUnconnected())));
    } else if (stmt instanceof EventTracingStmt) {
      EventTracingStmt event = (EventTracingStmt)stmt;
      entry.put("event", event.getEventName());
      Map<String, Object> fields = new LinkedHashMap<>();
      event.getFields().forEach((name, value) -> fields.put(name, nodeIds.get(value)));
      entry.put("fields", fields);
      if (event.getTransaction() != null)
        entry.put("transaction", event.getTransaction());
      entry.put("action", event.getActionType().name());
    } else {
      throw new InternalException("cannot serialize " + stmt.getClass().getSimpleName());
    }
    if (!stmt.getComment().isEmpty())
      entry.put("comment", stmt.getComment());
  }
}
