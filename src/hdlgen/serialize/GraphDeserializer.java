package hdlgen.serialize;

import hdlgen.except.IRException;
import hdlgen.except.UserException;
import hdlgen.expr.Const;
import hdlgen.expr.EnumType;
import hdlgen.expr.ExprOp;
import hdlgen.expr.InterfaceDefinition;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.PackedStruct;
import hdlgen.expr.Param;
import hdlgen.expr.Port;
import hdlgen.expr.PortDirection;
import hdlgen.expr.PortType;
import hdlgen.expr.StructTyped;
import hdlgen.expr.TypeDefinition;
import hdlgen.expr.Var;
import hdlgen.expr.VarCasted;
import hdlgen.expr.VarConcat;
import hdlgen.expr.VarExtend;
import hdlgen.generator.Context;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.AssignmentType;
import hdlgen.stmt.BlockEdgeType;
import hdlgen.stmt.CombinationalStmtBlock;
import hdlgen.stmt.EventActionType;
import hdlgen.stmt.EventTracingStmt;
import hdlgen.stmt.IfStmt;
import hdlgen.stmt.ModuleInstantiationStmt;
import hdlgen.stmt.ScopedStmtBlock;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.Stmt;
import hdlgen.stmt.StmtBlock;
import hdlgen.stmt.SwitchStmt;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Restores a {@link Context} written by {@link GraphSerializer}.
 * <p>
 * Every node is rebuilt through the regular construction API, so all checks run again and the slice, expression and constant
 * caches end up populated exactly as if the design had been built by hand.
 */
public class GraphDeserializer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Instantiations are applied when the parent's statement list is rebuilt, so they keep their position. */
  private record PendingInstance(Generator parent, Map<?, ?> entry) {}

  private final Context context = new Context();
  private final HashMap<Integer, TypeDefinition> types = new HashMap<>();
  private final HashMap<Integer, Generator> generators = new HashMap<>();
  private final HashMap<Integer, Object> nodes = new HashMap<>();

  private GraphDeserializer() {}

  /**
   * @throws UserException if the input is not a serialized design or refers to nodes that do not exist
   * @throws IRException if rebuilding the design violates a construction rule
   */
  public static Context restore(Reader reader) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException e) {
      throw new UserException("design file is not valid YAML", e);
    }
    if (!(document instanceof Map))
      throw new UserException("design file does not contain a serialized design");
    try {
      return new GraphDeserializer().fromDocument((Map<?, ?>)document);
    } catch (ClassCastException e) {
      throw new UserException("design file has a field of the wrong type", e);
    }
  }

  private Context fromDocument(Map<?, ?> document) {
    if (!GraphSerializer.FORMAT.equals(document.get("format")))
      throw new UserException("unknown design format " + document.get("format"));
    int version = integer(document, "version");
    if (version != GraphSerializer.VERSION)
      throw new UserException("unsupported design format version " + version);

    for (Map<?, ?> entry : maps(document, "types"))
      types.put(integer(entry, "id"), restoreType(entry));
    List<Map<?, ?>> generatorTable = maps(document, "generators");
    for (Map<?, ?> entry : generatorTable) {
      Generator generator = context.generator(string(entry, "name"));
      generator.setExternal(Boolean.TRUE.equals(entry.get("external")));
      for (Object typeId : list(entry, "types"))
        generator.registerType(type(((Number)typeId).intValue()));
      generators.put(integer(entry, "id"), generator);
    }
    for (Map<?, ?> entry : maps(document, "nodes"))
      nodes.put(integer(entry, "id"), restoreNode(entry));
    // top-level statements last, in order; the hierarchy is rebuilt here as well
    for (Map<?, ?> entry : generatorTable) {
      Generator generator = generator(integer(entry, "id"));
      for (Object stmtId : list(entry, "stmts")) {
        Object stmt = node(((Number)stmtId).intValue());
        if (stmt instanceof PendingInstance)
          instantiate((PendingInstance)stmt);
        else
          generator.addStmt(stmt(stmt));
      }
    }
    logger.debug("Restored {} generator(s), {} node(s)", generators.size(), nodes.size());
    return context;
  }

  private TypeDefinition restoreType(Map<?, ?> entry) {
    String name = string(entry, "name");
    switch (string(entry, "kind")) {
    case "enum": {
      EnumType enumType = new EnumType(name, integer(entry, "width"));
      map(entry, "values").forEach((value, number) -> enumType.addValue(value.toString(), ((Number)number).longValue()));
      return enumType;
    }
    case "struct": {
      PackedStruct struct = new PackedStruct(name);
      for (Map<?, ?> member : maps(entry, "members"))
        struct.addMember(string(member, "name"), integer(member, "width"), bool(member, "signed"));
      return struct;
    }
    case "interface": {
      InterfaceDefinition definition = new InterfaceDefinition(name);
      map(entry, "signals").forEach((signal, width) -> definition.addSignal(signal.toString(), ((Number)width).intValue()));
      map(entry, "modports").forEach((modport, directions) -> {
        Map<String, PortDirection> parsed = new LinkedHashMap<>();
        ((Map<?, ?>)directions).forEach((signal, direction) -> parsed.put(signal.toString(), PortDirection.valueOf(direction.toString())));
        definition.addModport(modport.toString(), parsed);
      });
      return definition;
    }
    default:
      throw new UserException("unknown type kind " + entry.get("kind") + " of " + name);
    }
  }

  private Object restoreNode(Map<?, ?> entry) {
    String kind = string(entry, "kind");
    Generator generator = generator(integer(entry, "generator"));
    IRNode node;
    try {
      node = restoreNode(kind, generator, entry);
    } catch (ClassCastException | IllegalArgumentException e) {
      throw new UserException("malformed " + kind + " node " + entry.get("id"), e);
    }
    if (node == null)
      return new PendingInstance(generator, entry);
    if (entry.containsKey("comment")) {
      if (node instanceof Var)
        ((Var)node).setComment(string(entry, "comment"));
      else
        ((Stmt)node).setComment(string(entry, "comment"));
    }
    return node;
  }

  /** @return the node, or null for instantiations, which are deferred */
  private IRNode restoreNode(String kind, Generator generator, Map<?, ?> entry) {
    switch (kind) {
    case "Var":
      return generator.var(string(entry, "name"), integer(entry, "width"), bool(entry, "signed"));
    case "Port":
      return generator.port(direction(entry), string(entry, "name"), integer(entry, "width"), bool(entry, "signed"),
                            PortType.valueOf(string(entry, "port_type")));
    case "EnumVar":
      return generator.enumVar(string(entry, "name"), (EnumType)type(integer(entry, "type")));
    case "EnumPort":
      return generator.enumPort(direction(entry), string(entry, "name"), (EnumType)type(integer(entry, "type")));
    case "VarPackedStruct":
      return generator.structVar(string(entry, "name"), (PackedStruct)type(integer(entry, "type")));
    case "PortPackedStruct":
      return generator.structPort(direction(entry), string(entry, "name"), (PackedStruct)type(integer(entry, "type")));
    case "InterfaceVar":
      return generator.interfaceVar(string(entry, "name"), (InterfaceDefinition)type(integer(entry, "type")));
    case "InterfacePort":
      return generator.interfacePort(string(entry, "name"), (InterfaceDefinition)type(integer(entry, "type")),
                                     (String)entry.get("modport"));
    case "VarSlice":
      return var(entry, "parent").slice(integer(entry, "high"), integer(entry, "low"));
    case "VarVarSlice":
      return var(entry, "parent").slice(var(entry, "index"));
    case "PackedSlice":
      return ((StructTyped)var(entry, "parent")).member(string(entry, "member"));
    case "InterfaceSignal":
      return ((InterfaceTyped)var(entry, "parent")).signal(string(entry, "signal"));
    case "Const":
      return generator.constant(longValue(entry, "value"), integer(entry, "width"), bool(entry, "signed"));
    case "Param": {
      Param param = generator.parameter(string(entry, "name"), integer(entry, "width"), bool(entry, "signed"), longValue(entry, "initial"));
      param.setValue(longValue(entry, "value"));
      return param;
    }
    case "EnumConst":
      return generator.enumConst((EnumType)type(integer(entry, "type")), string(entry, "value"));
    case "Expr": {
      ExprOp op = ExprOp.valueOf(string(entry, "op"));
      Var left = var(entry, "left");
      if (!entry.containsKey("right"))
        return left.getGenerator().expr(op, left, null);
      Var right = var(entry, "right");
      return Var.ownerOf(List.of(left, right)).expr(op, left, right);
    }
    case "VarConcat": {
      List<Var> operands = new ArrayList<>();
      for (Object id : list(entry, "operands"))
        operands.add(var(((Number)id).intValue()));
      return new VarConcat(operands);
    }
    case "VarExtend":
      return new VarExtend(var(entry, "operand"), integer(entry, "width"));
    case "VarCasted":
      return new VarCasted(var(entry, "operand"), bool(entry, "signed"));
    case "ConditionalExpr":
      return generator.conditional(var(entry, "condition"), var(entry, "true"), var(entry, "false"));
    case "FunctionCallVar": {
      List<Var> arguments = new ArrayList<>();
      for (Object id : list(entry, "arguments"))
        arguments.add(var(((Number)id).intValue()));
      return generator.call(string(entry, "name"), integer(entry, "width"), bool(entry, "signed"), arguments.toArray(new Var[0]));
    }
    case "AssignStmt":
      return new AssignStmt(var(entry, "target"), var(entry, "source"), AssignmentType.valueOf(string(entry, "assignment")));
    case "CombinationalStmtBlock": {
      CombinationalStmtBlock block = new CombinationalStmtBlock();
      fill(block, list(entry, "stmts"));
      return block;
    }
    case "SequentialStmtBlock": {
      SequentialStmtBlock block = new SequentialStmtBlock();
      for (Map<?, ?> item : maps(entry, "sensitivity"))
        block.addSensitivity(BlockEdgeType.valueOf(string(item, "edge")), var(item, "signal"));
      fill(block, list(entry, "stmts"));
      return block;
    }
    case "IfStmt": {
      IfStmt ifStmt = new IfStmt(var(entry, "predicate"));
      fill(ifStmt.thenBody(), list(entry, "then"));
      fill(ifStmt.elseBody(), list(entry, "else"));
      return ifStmt;
    }
    case "SwitchStmt": {
      SwitchStmt switchStmt = new SwitchStmt(var(entry, "target"));
      for (Map<?, ?> item : maps(entry, "cases")) {
        ScopedStmtBlock body = switchStmt.addCase((Const)var(item, "value"));
        fill(body, list(item, "body"));
      }
      if (entry.containsKey("default"))
        fill(switchStmt.defaultBody(), list(entry, "default"));
      return switchStmt;
    }
    case "EventTracingStmt": {
      Map<String, Var> fields = new LinkedHashMap<>();
      map(entry, "fields").forEach((name, id) -> fields.put(name.toString(), var(((Number)id).intValue())));
      EventTracingStmt stmt = new EventTracingStmt(string(entry, "event"), fields);
      if (entry.get("transaction") != null)
        stmt.belongsTo(string(entry, "transaction"));
      stmt.setActionType(EventActionType.valueOf(string(entry, "action")));
      return stmt;
    }
    case "ModuleInstantiationStmt":
      return null;
    default:
      NodeTypeRegistry.Entry registered = NodeTypeRegistry.entryOf(kind);
      throw new UserException("node kind " + registered.tag() + " cannot be restored on its own");
    }
  }

  private void instantiate(PendingInstance pending) {
    Map<?, ?> entry = pending.entry();
    Generator child = generator(integer(entry, "child"));
    ModuleInstantiationStmt stmt = pending.parent().addChildGenerator(string(entry, "instance"), child);
    for (Map<?, ?> connection : maps(entry, "connections"))
      stmt.connect((Port)var(connection, "port"), var(connection, "value"));
    for (Object id : list(entry, "unconnected"))
      stmt.leaveUnconnected((Port)var(((Number)id).intValue()));
    if (entry.containsKey("comment"))
      stmt.setComment(string(entry, "comment"));
  }

  private void fill(StmtBlock block, List<?> ids) {
    for (Object id : ids)
      block.addStmt(stmt(node(((Number)id).intValue())));
  }

  // lookups

  private TypeDefinition type(int id) {
    TypeDefinition definition = types.get(id);
    if (definition == null)
      throw new UserException("reference to unknown type " + id);
    return definition;
  }

  private Generator generator(int id) {
    Generator generator = generators.get(id);
    if (generator == null)
      throw new UserException("reference to unknown generator " + id);
    return generator;
  }

  private Object node(int id) {
    Object node = nodes.get(id);
    if (node == null)
      throw new UserException("reference to node " + id + " before its definition");
    return node;
  }

  private Var var(int id) {
    Object node = node(id);
    if (!(node instanceof Var))
      throw new UserException("node " + id + " is not a value");
    return (Var)node;
  }

  private Var var(Map<?, ?> entry, String key) { return var(integer(entry, key)); }

  private static Stmt stmt(Object node) {
    if (!(node instanceof Stmt))
      throw new UserException("expected a statement, got " + node);
    return (Stmt)node;
  }

  private static PortDirection direction(Map<?, ?> entry) { return PortDirection.valueOf(string(entry, "direction")); }

  // field access

  private static Object field(Map<?, ?> entry, String key) {
    Object value = entry.get(key);
    if (value == null)
      throw new UserException("missing field " + key + " in " + entry);
    return value;
  }

  private static int integer(Map<?, ?> entry, String key) { return ((Number)field(entry, key)).intValue(); }

  private static long longValue(Map<?, ?> entry, String key) { return ((Number)field(entry, key)).longValue(); }

  private static boolean bool(Map<?, ?> entry, String key) { return (Boolean)field(entry, key); }

  private static String string(Map<?, ?> entry, String key) { return field(entry, key).toString(); }

  private static List<?> list(Map<?, ?> entry, String key) { return (List<?>)field(entry, key); }

  private static Map<?, ?> map(Map<?, ?> entry, String key) { return (Map<?, ?>)field(entry, key); }

  private static List<Map<?, ?>> maps(Map<?, ?> entry, String key) {
    List<Map<?, ?>> result = new ArrayList<>();
    for (Object item : list(entry, key))
      result.add((Map<?, ?>)item);
    return result;
  }
}
