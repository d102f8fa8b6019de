package hdlgen.codegen;

import hdlgen.except.InternalException;
import hdlgen.expr.Const;
import hdlgen.expr.EnumType;
import hdlgen.expr.EnumTyped;
import hdlgen.expr.InterfaceDefinition;
import hdlgen.expr.InterfacePort;
import hdlgen.expr.InterfaceVar;
import hdlgen.expr.PackedStruct;
import hdlgen.expr.Param;
import hdlgen.expr.Port;
import hdlgen.expr.PortDirection;
import hdlgen.expr.StructTyped;
import hdlgen.expr.TypeDefinition;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.AssignmentType;
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
import hdlgen.ui.HDLGenConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders a single generator as a SystemVerilog module.
 * <p>
 * Output is a pure function of the generator: typedefs at unit scope, module header with parameters and ports, declarations
 * grouped by kind, then the statements in insertion order.
 */
public class SystemVerilogCodeGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Generator generator;
  private final HDLGenConfig config;
  private final Map<Generator, String> moduleNames;
  private final String tab;

  public SystemVerilogCodeGen(Generator generator) { this(generator, new HDLGenConfig(), Map.of()); }

  /**
   * @param moduleNames names to use for this generator and its children where they differ from {@link Generator#getName()}
   */
  public SystemVerilogCodeGen(Generator generator, HDLGenConfig config, Map<Generator, String> moduleNames) {
    this.generator = generator;
    this.config = config;
    this.moduleNames = moduleNames;
    this.tab = config.tab();
  }

  /** {@code [w-1:0]}, or the empty string for a single bit. */
  public static String widthString(int width) { return width == 1 ? "" : "[" + (width - 1) + ":0]"; }

  private static String logicDecl(int width, boolean isSigned) {
    String range = widthString(width);
    return "logic" + (isSigned ? " signed" : "") + (range.isEmpty() ? "" : " " + range);
  }

  private String moduleName(Generator module) { return moduleNames.getOrDefault(module, module.getName()); }

  /** @return the complete module text */
  public String str() {
    logger.debug("Generating module {}", moduleName(generator));
    StringBuilder text = new StringBuilder();
    typedefs(text);
    header(text);
    declarations(text);
    StmtEmitter emitter = new StmtEmitter(text);
    for (Stmt stmt : generator.getStmts())
      stmt.accept(emitter);
    text.append("endmodule   // ").append(moduleName(generator)).append("\n");
    return text.toString();
  }

  private void typedefs(StringBuilder text) {
    List<TypeDefinition> definitions = new ArrayList<>(generator.getTypeDefinitions());
    for (TypeDefinition definition : definitions) {
      if (definition instanceof EnumType)
        text.append(enumTypedef((EnumType)definition)).append("\n");
    }
    for (TypeDefinition definition : definitions) {
      if (definition instanceof PackedStruct)
        text.append(structTypedef((PackedStruct)definition)).append("\n");
    }
  }

  private String enumTypedef(EnumType enumType) {
    String values = enumType.getValues()
                        .entrySet()
                        .stream()
                        .map(entry -> tab + entry.getKey() + " = " + Const.literal(entry.getValue(), enumType.getWidth(), false))
                        .collect(Collectors.joining(",\n"));
    return "typedef enum " + logicDecl(enumType.getWidth(), false) + " {\n" + values + "\n} " + enumType.getName() + ";\n";
  }

  private String structTypedef(PackedStruct struct) {
    StringBuilder text = new StringBuilder("typedef struct packed {\n");
    for (PackedStruct.Member member : struct.getMembers())
      text.append(tab).append(logicDecl(member.width(), member.isSigned())).append(" ").append(member.name()).append(";\n");
    return text.append("} ").append(struct.getName()).append(";\n").toString();
  }

  private void header(StringBuilder text) {
    text.append("module ").append(moduleName(generator));
    if (!generator.getParams().isEmpty()) {
      String params = generator.getParams()
                          .stream()
                          .map(param -> tab + "parameter " + param.getName() + " = " +
                                        Const.literal(param.getInitialValue(), param.getWidth(), param.isSigned()))
                          .collect(Collectors.joining(",\n"));
      text.append(" #(\n").append(params).append("\n)\n(");
    } else {
      text.append(" (");
    }
    if (generator.getPorts().isEmpty()) {
      text.append(");\n\n");
      return;
    }
    String ports = generator.getPorts().stream().map(port -> tab + portDecl(port)).collect(Collectors.joining(",\n"));
    text.append("\n").append(ports).append("\n);\n\n");
  }

  private String portDecl(Port port) {
    if (port instanceof InterfacePort) {
      InterfacePort ifcPort = (InterfacePort)port;
      String modport = ifcPort.getModport() == null ? "" : "." + ifcPort.getModport();
      return ifcPort.getDefinition().getName() + modport + " " + port.getName();
    }
    return port.getDirection().keyword + " " + typeName(port) + " " + port.getName();
  }

  /** Type part of a declaration for plain, enum and struct values. */
  private String typeName(Var var) {
    if (var instanceof EnumTyped)
      return ((EnumTyped)var).getEnumType().getName();
    if (var instanceof StructTyped)
      return ((StructTyped)var).getStruct().getName();
    return logicDecl(var.getWidth(), var.isSigned());
  }

  private void declarations(StringBuilder text) {
    List<Var> plain = new ArrayList<>();
    List<Var> enums = new ArrayList<>();
    List<Var> structs = new ArrayList<>();
    List<InterfaceVar> interfaces = new ArrayList<>();
    for (Var var : generator.getVars()) {
      if (var instanceof InterfaceVar)
        interfaces.add((InterfaceVar)var);
      else if (var instanceof StructTyped)
        structs.add(var);
      else if (var instanceof EnumTyped)
        enums.add(var);
      else if (var.getClass() == Var.class)
        plain.add(var);
      else
        throw new InternalException("cannot declare " + var.getClass().getSimpleName() + " " + var.getName());
    }
    List<Var> ordered = new ArrayList<>(plain);
    ordered.addAll(enums);
    ordered.addAll(structs);
    for (Var var : ordered) {
      comment(text, var.getComment(), 0);
      text.append(typeName(var)).append(" ").append(var.getName()).append(";\n");
    }
    for (InterfaceVar var : interfaces) {
      comment(text, var.getComment(), 0);
      text.append(var.getDefinition().getName()).append(" ").append(var.getName()).append("();\n");
    }
    if (!generator.getVars().isEmpty())
      text.append("\n");
  }

  private void comment(StringBuilder text, String comment, int indent) {
    if (!comment.isEmpty())
      text.append(tab.repeat(indent)).append("// ").append(comment).append("\n");
  }

  /** Text of an interface definition, emitted as its own unit. */
  public static String interfaceDefinition(InterfaceDefinition definition, String tab) {
    StringBuilder text = new StringBuilder("interface ").append(definition.getName()).append(";\n");
    definition.getSignals().forEach((name, width) -> text.append(tab).append(logicDecl(width, false)).append(" ").append(name).append(";\n"));
    for (Map.Entry<String, Map<String, PortDirection>> modport : definition.getModports().entrySet()) {
      String signals = modport.getValue()
                           .entrySet()
                           .stream()
                           .map(entry -> entry.getValue().keyword + " " + entry.getKey())
                           .collect(Collectors.joining(", "));
      text.append(tab).append("modport ").append(modport.getKey()).append("(").append(signals).append(");\n");
    }
    return text.append("endinterface   // ").append(definition.getName()).append("\n").toString();
  }

  /** Emits statements; the current indent level is kept across nested visits. */
  private class StmtEmitter extends IRVisitor {
    private final StringBuilder text;
    private int indent = 0;

    StmtEmitter(StringBuilder text) { this.text = text; }

    private String pad() { return tab.repeat(indent); }

    private void body(StmtBlock block) {
      ++indent;
      for (Stmt stmt : block.getStmts())
        stmt.accept(this);
      --indent;
    }

    @Override
    public void visit(AssignStmt stmt) {
      comment(text, stmt.getComment(), indent);
      String op = stmt.getAssignmentType() == AssignmentType.NonBlocking ? " <= " : " = ";
      if (stmt.getParent() instanceof Generator)
        text.append("assign ").append(stmt.getTarget()).append(op).append(stmt.getSource()).append(";\n");
      else
        text.append(pad()).append(stmt.getTarget()).append(op).append(stmt.getSource()).append(";\n");
    }

    @Override
    public void visit(CombinationalStmtBlock block) {
      comment(text, block.getComment(), indent);
      text.append(pad()).append("always_comb begin\n");
      body(block);
      text.append(pad()).append("end\n\n");
    }

    @Override
    public void visit(SequentialStmtBlock block) {
      comment(text, block.getComment(), indent);
      String sensitivity = block.getSensitivityList()
                               .stream()
                               .map(entry -> entry.edge().keyword + " " + entry.signal())
                               .collect(Collectors.joining(", "));
      text.append(pad()).append("always_ff @(").append(sensitivity).append(") begin\n");
      body(block);
      text.append(pad()).append("end\n\n");
    }

    @Override
    public void visit(StmtBlock block) {
      throw new InternalException("stray " + block.getClass().getSimpleName() + " in " + generator.getName());
    }

    @Override
    public void visit(IfStmt stmt) {
      comment(text, stmt.getComment(), indent);
      text.append(pad());
      emitIf(stmt);
    }

    /** Emits an if chain starting at the current position; else bodies holding a single if become {@code else if}. */
    private void emitIf(IfStmt stmt) {
      text.append("if (").append(stmt.getPredicate()).append(") begin\n");
      body(stmt.thenBody());
      text.append(pad()).append("end\n");
      if (stmt.hasElseIf()) {
        text.append(pad()).append("else ");
        emitIf((IfStmt)stmt.elseBody().getStmts().get(0));
      } else if (!stmt.elseBody().isEmpty()) {
        text.append(pad()).append("else begin\n");
        body(stmt.elseBody());
        text.append(pad()).append("end\n");
      }
    }

    @Override
    public void visit(SwitchStmt stmt) {
      comment(text, stmt.getComment(), indent);
      text.append(pad()).append("unique case (").append(stmt.getTarget()).append(")\n");
      ++indent;
      for (Map.Entry<Const, ScopedStmtBlock> item : stmt.getCases().entrySet())
        caseItem(item.getKey().toString(), item.getValue());
      Optional<ScopedStmtBlock> defaultBody = stmt.getDefault();
      if (defaultBody.isPresent())
        caseItem("default", defaultBody.get());
      --indent;
      text.append(pad()).append("endcase\n");
    }

    private void caseItem(String label, ScopedStmtBlock body) {
      text.append(pad()).append(label).append(": begin\n");
      body(body);
      text.append(pad()).append("end\n");
    }

    @Override
    public void visit(EventTracingStmt stmt) {
      if (!config.emit_event_comments)
        return;
      String fields = stmt.getFields()
                          .entrySet()
                          .stream()
                          .map(entry -> entry.getKey() + "=" + entry.getValue())
                          .collect(Collectors.joining(", "));
      text.append(pad()).append("// event ").append(stmt.getEventName()).append("(").append(fields).append(")");
      if (stmt.getTransaction() != null)
        text.append(" transaction ").append(stmt.getTransaction());
      if (stmt.getActionType() != EventActionType.None)
        text.append(" ").append(stmt.getActionType().name().toLowerCase());
      text.append("\n");
    }

    @Override
    public void visit(ModuleInstantiationStmt stmt) {
      Generator child = stmt.getChildGenerator();
      comment(text, stmt.getComment(), indent);
      text.append(pad()).append(moduleName(child));
      List<String> overrides = new ArrayList<>();
      for (Param param : child.getParams()) {
        if (param.isOverridden())
          overrides.add("." + param.getName() + "(" + Const.literal(param.getValue(), param.getWidth(), param.isSigned()) + ")");
      }
      if (!overrides.isEmpty())
        text.append(" #(").append(String.join(", ", overrides)).append(")");
      text.append(" ").append(stmt.getInstanceName());
      if (child.getPorts().isEmpty()) {
        text.append(" ();\n\n");
        return;
      }
      String connections = child.getPorts()
                               .stream()
                               .map(port -> pad() + tab + "." + port.getName() + "(" +
                                            (stmt.isConnected(port) ? stmt.getConnections().get(port).toString() : "") + ")")
                               .collect(Collectors.joining(",\n"));
      text.append(" (\n").append(connections).append("\n").append(pad()).append(");\n\n");
    }

    @Override
    public void visit(Var var) {
      throw new InternalException("value " + var + " reached the statement emitter");
    }

    @Override
    public void visit(Generator module) {
      throw new InternalException("generator " + module.getName() + " reached the statement emitter");
    }
  }
}
