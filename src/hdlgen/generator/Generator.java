package hdlgen.generator;

import hdlgen.except.GeneratorException;
import hdlgen.except.StmtException;
import hdlgen.except.UserException;
import hdlgen.expr.ConditionalExpr;
import hdlgen.expr.Const;
import hdlgen.expr.EnumConst;
import hdlgen.expr.EnumPort;
import hdlgen.expr.EnumType;
import hdlgen.expr.EnumVar;
import hdlgen.expr.Expr;
import hdlgen.expr.ExprOp;
import hdlgen.expr.FunctionCallVar;
import hdlgen.expr.InterfaceDefinition;
import hdlgen.expr.InterfacePort;
import hdlgen.expr.InterfaceVar;
import hdlgen.expr.PackedStruct;
import hdlgen.expr.Param;
import hdlgen.expr.Port;
import hdlgen.expr.PortDirection;
import hdlgen.expr.PortPackedStruct;
import hdlgen.expr.PortType;
import hdlgen.expr.TypeDefinition;
import hdlgen.expr.Var;
import hdlgen.expr.VarPackedStruct;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import hdlgen.stmt.AssignStmt;
import hdlgen.stmt.AssignmentType;
import hdlgen.stmt.BlockEdgeType;
import hdlgen.stmt.CombinationalStmtBlock;
import hdlgen.stmt.ModuleInstantiationStmt;
import hdlgen.stmt.SequentialStmtBlock;
import hdlgen.stmt.Stmt;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A hardware module: ports, variables, parameters, statements and child instances.
 * <p>
 * The generator is a container. It keeps declarations unique by name and the module hierarchy acyclic; checks on values and
 * statements are left to the value and statement classes. Expressions and constants are cached here so that building the same
 * expression twice yields the same node.
 */
public class Generator extends IRNode {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Pattern identifier = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

  private record ExprKey(ExprOp op, Var left, Var right) {}
  private record ConstKey(long value, int width, boolean isSigned) {}
  private record EnumConstKey(EnumType type, String valueName) {}

  private final Context context;
  private final String name;
  private String instanceName;
  private boolean external = false;
  private Generator parentGenerator;

  private final LinkedHashMap<String, Port> ports = new LinkedHashMap<>();
  private final LinkedHashMap<String, Var> vars = new LinkedHashMap<>();
  private final LinkedHashMap<String, Param> params = new LinkedHashMap<>();
  private final LinkedHashMap<String, ModuleInstantiationStmt> children = new LinkedHashMap<>();
  private final LinkedHashMap<String, TypeDefinition> typeDefinitions = new LinkedHashMap<>();
  private final ArrayList<Stmt> stmts = new ArrayList<>();

  private final HashMap<ExprKey, Expr> exprs = new HashMap<>();
  private final HashMap<ConstKey, Const> consts = new HashMap<>();
  private final HashMap<EnumConstKey, EnumConst> enumConsts = new HashMap<>();

  /** Creates a generator that belongs to no context. Prefer {@link Context#generator(String)}. */
  public Generator(String name) { this(null, name); }

  Generator(Context context, String name) {
    if (name == null || !identifier.matcher(name).matches())
      throw new UserException("invalid module name '" + name + "'");
    this.context = context;
    this.name = name;
    this.instanceName = name;
  }

  public String getName() { return name; }

  /** The instance name used by the parent; equals the module name until the generator is instantiated. */
  public String getInstanceName() { return instanceName; }

  /** @return the owning context, null for standalone generators */
  public Context getContext() { return context; }

  /** External generators stand for modules defined elsewhere; they are instantiated but not emitted. */
  public boolean isExternal() { return external; }

  public void setExternal(boolean external) { this.external = external; }

  /** @return the instantiating generator, null for a root */
  public Generator getParentGenerator() { return parentGenerator; }

  // declarations

  /**
   * Declares a port. Declaring the same name again with an identical declaration returns the existing port.
   * @throws GeneratorException on a conflicting redeclaration or a multi-bit clock or reset
   */
  public Port port(PortDirection direction, String name, int width, boolean isSigned, PortType portType) {
    if (portType.isSingleBit() && width != 1)
      throw new GeneratorException(String.format("%s port %s must be 1 bit wide, got %d", portType, name, width), List.of(this));
    return declare(name, Port.class, () -> new Port(this, direction, name, width, isSigned, portType),
                   port -> port.getDirection() == direction && port.getWidth() == width && port.isSigned() == isSigned &&
                           port.getPortType() == portType,
                   ports);
  }

  public Port input(String name, int width) { return input(name, width, false); }

  public Port input(String name, int width, boolean isSigned) { return port(PortDirection.In, name, width, isSigned, PortType.Data); }

  public Port output(String name, int width) { return output(name, width, false); }

  public Port output(String name, int width, boolean isSigned) { return port(PortDirection.Out, name, width, isSigned, PortType.Data); }

  public Port clock(String name) { return port(PortDirection.In, name, 1, false, PortType.Clock); }

  /** Declares an asynchronous reset input. */
  public Port reset(String name) { return port(PortDirection.In, name, 1, false, PortType.AsyncReset); }

  public EnumPort enumPort(PortDirection direction, String name, EnumType enumType) {
    registerType(enumType);
    return declare(name, EnumPort.class, () -> new EnumPort(this, direction, name, enumType),
                   port -> port.getDirection() == direction && port.getEnumType() == enumType, ports);
  }

  public PortPackedStruct structPort(PortDirection direction, String name, PackedStruct struct) {
    registerType(struct);
    return declare(name, PortPackedStruct.class, () -> new PortPackedStruct(this, direction, name, struct),
                   port -> port.getDirection() == direction && port.getStruct() == struct, ports);
  }

  /** @param modport modport to bind the port to, null for the bare interface */
  public InterfacePort interfacePort(String name, InterfaceDefinition definition, String modport) {
    registerType(definition);
    return declare(name, InterfacePort.class, () -> new InterfacePort(this, name, definition, modport),
                   port -> port.getDefinition() == definition && Objects.equals(port.getModport(), modport), ports);
  }

  public Var var(String name, int width) { return var(name, width, false); }

  /**
   * Declares a variable. Declaring the same name again with an identical declaration returns the existing variable.
   * @throws GeneratorException on a conflicting redeclaration
   */
  public Var var(String name, int width, boolean isSigned) {
    return declare(name, Var.class, () -> new Var(this, name, width, isSigned),
                   var -> var.getWidth() == width && var.isSigned() == isSigned, vars);
  }

  public EnumVar enumVar(String name, EnumType enumType) {
    registerType(enumType);
    return declare(name, EnumVar.class, () -> new EnumVar(this, name, enumType), var -> var.getEnumType() == enumType, vars);
  }

  public VarPackedStruct structVar(String name, PackedStruct struct) {
    registerType(struct);
    return declare(name, VarPackedStruct.class, () -> new VarPackedStruct(this, name, struct), var -> var.getStruct() == struct,
                   vars);
  }

  public InterfaceVar interfaceVar(String name, InterfaceDefinition definition) {
    registerType(definition);
    return declare(name, InterfaceVar.class, () -> new InterfaceVar(this, name, definition),
                   var -> var.getDefinition() == definition, vars);
  }

  /** Declares a parameter with its initial value. */
  public Param parameter(String name, int width, boolean isSigned, long initialValue) {
    return declare(name, Param.class, () -> new Param(this, name, width, isSigned, initialValue),
                   param -> param.getWidth() == width && param.isSigned() == isSigned && param.getInitialValue() == initialValue,
                   params);
  }

  @SuppressWarnings("unchecked")
  private <T extends Var> T declare(String name, Class<T> kind, Supplier<T> factory, Predicate<T> sameDeclaration,
                                    Map<String, ? super T> table) {
    if (name == null || !identifier.matcher(name).matches())
      throw new GeneratorException("invalid identifier '" + name + "'", List.of(this));
    Var existing = lookupDeclaration(name);
    if (existing != null) {
      if (existing.getClass() == kind && sameDeclaration.test((T)existing))
        return (T)existing;
      throw new GeneratorException(String.format("%s is already declared in %s with a different kind, width or type", name, this.name),
                                   List.of(existing));
    }
    if (children.containsKey(name))
      throw new GeneratorException(String.format("%s clashes with a child instance of %s", name, this.name),
                                   List.of(children.get(name).getChildGenerator()));
    T created = factory.get();
    table.put(name, created);
    return created;
  }

  /** @return true if var is the value declared under its name in this module */
  public boolean isDeclared(Var var) { return var.getGenerator() == this && lookupDeclaration(var.getName()) == var; }

  /**
   * Removes a port declaration and frees its name.
   * @return false if no port with this name exists
   * @throws GeneratorException if the port is still driven, read by a statement or connected in the parent instantiation
   */
  public boolean removePort(String name) {
    Port port = ports.get(name);
    if (port == null)
      return false;
    checkUnused(port);
    if (parentGenerator != null) {
      ModuleInstantiationStmt instance = parentGenerator.getInstantiation(this);
      if (instance.isConnected(port) || instance.getUnconnected().contains(port))
        throw new GeneratorException(String.format("port %s is still listed in instance %s", name, instanceName),
                                     List.of(port, instance));
    }
    ports.remove(name);
    logger.debug("Removed port {} from {}", name, this.name);
    return true;
  }

  /**
   * Removes a variable declaration and frees its name.
   * @return false if no variable with this name exists
   * @throws GeneratorException if the variable is still driven or read by a statement
   */
  public boolean removeVar(String name) {
    Var var = vars.get(name);
    if (var == null)
      return false;
    checkUnused(var);
    vars.remove(name);
    logger.debug("Removed variable {} from {}", name, this.name);
    return true;
  }

  private void checkUnused(Var declaration) {
    if (!declaration.sinks().isEmpty())
      throw new GeneratorException(String.format("%s is still driven by %d assignment(s)", declaration, declaration.sinks().size()),
                                   List.of(declaration));
    Set<IRNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Stmt stmt : stmts) {
      if (references(stmt, declaration, visited))
        throw new GeneratorException(String.format("%s is still used in %s", declaration, name), List.of(declaration, stmt));
    }
  }

  /** Walks the statements and values below node; child generators are not entered. */
  private static boolean references(IRNode node, Var declaration, Set<IRNode> visited) {
    if (node instanceof Generator || !visited.add(node))
      return false;
    if (node instanceof Var && ((Var)node).getRootVar() == declaration)
      return true;
    if (node instanceof SequentialStmtBlock) {
      for (SequentialStmtBlock.Sensitivity entry : ((SequentialStmtBlock)node).getSensitivityList()) {
        if (entry.signal().getRootVar() == declaration)
          return true;
      }
    }
    if (node instanceof ModuleInstantiationStmt) {
      for (Var value : ((ModuleInstantiationStmt)node).getConnections().values()) {
        if (references(value, declaration, visited))
          return true;
      }
    }
    for (int i = 0; i < node.childCount(); ++i) {
      if (references(node.getChild(i), declaration, visited))
        return true;
    }
    return false;
  }

  private Var lookupDeclaration(String name) {
    if (ports.containsKey(name))
      return ports.get(name);
    if (vars.containsKey(name))
      return vars.get(name);
    return params.get(name);
  }

  /**
   * Makes a type definition known to this module. Registering the same object again is a no-op.
   * @throws GeneratorException if a different definition with the same name is registered
   */
  public void registerType(TypeDefinition definition) {
    TypeDefinition existing = typeDefinitions.get(definition.getName());
    if (existing == null)
      typeDefinitions.put(definition.getName(), definition);
    else if (existing != definition)
      throw new GeneratorException(String.format("type %s is already defined differently in %s", definition.getName(), name),
                                   List.of(this));
  }

  // value factories

  /** @return the cached constant for (value, width, sign) */
  public Const constant(long value, int width, boolean isSigned) {
    return consts.computeIfAbsent(new ConstKey(value, width, isSigned), key -> new Const(this, value, width, isSigned));
  }

  /** @return the cached named value of an enum */
  public EnumConst enumConst(EnumType enumType, String valueName) {
    registerType(enumType);
    return enumConsts.computeIfAbsent(new EnumConstKey(enumType, valueName), key -> new EnumConst(this, enumType, valueName));
  }

  /**
   * Returns the expression for {@code op} over the operands, creating it on first use.
   * Called by the builders on {@link Var}.
   */
  public Expr expr(ExprOp op, Var left, Var right) {
    ExprKey key = new ExprKey(op, left, right);
    Expr cached = exprs.get(key);
    if (cached != null)
      return cached;
    Expr created = new Expr(op, left, right);
    exprs.put(key, created);
    return created;
  }

  /** {@code condition ? whenTrue : whenFalse} */
  public ConditionalExpr conditional(Var condition, Var whenTrue, Var whenFalse) {
    return new ConditionalExpr(condition, whenTrue, whenFalse);
  }

  /** Call of an externally defined function, e.g. {@code $clog2}. */
  public FunctionCallVar call(String functionName, int width, boolean isSigned, Var... arguments) {
    return new FunctionCallVar(this, functionName, List.of(arguments), width, isSigned);
  }

  // statements

  /**
   * Appends a top-level statement. Only continuous assignments, {@code always_comb}/{@code always_ff} blocks and instantiations
   * are allowed here; assignments become blocking.
   * @throws StmtException if the statement is not allowed at this level, is already attached or drives a value twice
   */
  public void addStmt(Stmt stmt) {
    if (!(stmt instanceof AssignStmt) && !(stmt instanceof CombinationalStmtBlock) && !(stmt instanceof SequentialStmtBlock) &&
        !(stmt instanceof ModuleInstantiationStmt))
      throw new StmtException(stmt.getClass().getSimpleName() + " is not allowed at the top level of " + name, List.of(stmt));
    if (stmt.getParent() != null)
      throw new StmtException("statement is already attached to another container", List.of(stmt, stmt.getParent()));
    Generator owner = stmt instanceof ModuleInstantiationStmt ? null : stmt.getGenerator();
    if (owner != null && owner != this)
      throw new StmtException(String.format("statement of %s added to %s", owner.getName(), name), List.of(stmt));
    if (stmt instanceof ModuleInstantiationStmt && ((ModuleInstantiationStmt)stmt).getChildGenerator().parentGenerator != this)
      throw new StmtException("instantiations are created with addChildGenerator", List.of(stmt));
    if (stmt instanceof SequentialStmtBlock) {
      List<SequentialStmtBlock.Sensitivity> sensitivityList = ((SequentialStmtBlock)stmt).getSensitivityList();
      if (sensitivityList.isEmpty())
        throw new StmtException("always_ff block in " + name + " has an empty sensitivity list", List.of(stmt));
      for (SequentialStmtBlock.Sensitivity entry : sensitivityList) {
        if (!entry.signal().isGeneratorIndependent() && entry.signal().getGenerator() != this)
          throw new StmtException("edge trigger " + entry.signal() + " does not belong to " + name, List.of(entry.signal(), stmt));
      }
    }
    if (stmt instanceof AssignStmt) {
      AssignStmt assign = (AssignStmt)stmt;
      for (Stmt existing : stmts) {
        if (existing instanceof AssignStmt && ((AssignStmt)existing).getTarget() == assign.getTarget())
          throw new StmtException(assign.getTarget() + " already has a continuous driver in " + name, List.of(existing, assign));
      }
      assign.resolveAssignmentType(AssignmentType.Blocking);
    }
    stmt.setParent(this);
    stmts.add(stmt);
  }

  /** Builds a continuous assignment {@code assign target = source} and appends it. */
  public AssignStmt assign(Var target, Var source) {
    AssignStmt stmt = new AssignStmt(target, source, AssignmentType.Undefined);
    addStmt(stmt);
    return stmt;
  }

  /**
   * Detaches a top-level statement. Removing an instantiation also removes the child generator.
   * @return true if the statement was attached here
   */
  public boolean removeStmt(Stmt stmt) {
    if (stmt instanceof ModuleInstantiationStmt)
      return removeChildGenerator(((ModuleInstantiationStmt)stmt).getChildGenerator());
    boolean removed = stmts.remove(stmt);
    if (removed)
      stmt.setParent(null);
    return removed;
  }

  /** Creates an {@code always_comb} block and appends it. */
  public CombinationalStmtBlock combinational() {
    CombinationalStmtBlock block = new CombinationalStmtBlock();
    addStmt(block);
    return block;
  }

  /** Creates an {@code always_ff} block triggered by one edge and appends it. */
  public SequentialStmtBlock sequential(BlockEdgeType edge, Var signal) {
    return sequential(List.of(new SequentialStmtBlock.Sensitivity(edge, signal)));
  }

  /**
   * Creates an {@code always_ff} block and appends it.
   * @throws StmtException if the list is empty or contains a multi-bit signal
   */
  public SequentialStmtBlock sequential(List<SequentialStmtBlock.Sensitivity> sensitivityList) {
    SequentialStmtBlock block = new SequentialStmtBlock(sensitivityList);
    addStmt(block);
    return block;
  }

  public List<Stmt> getStmts() { return Collections.unmodifiableList(stmts); }

  // hierarchy

  /**
   * Instantiates child under the given instance name and appends the instantiation statement. Port connections are made on the
   * returned statement.
   * @throws GeneratorException if child is this generator or an ancestor, already has a parent, or the name is taken
   */
  public ModuleInstantiationStmt addChildGenerator(String instanceName, Generator child) {
    if (child == this || isDescendantOf(child))
      throw new GeneratorException(String.format("instantiating %s in %s would create a cycle", child.getName(), name),
                                   List.of(this, child));
    if (child.parentGenerator != null)
      throw new GeneratorException(String.format("%s is already instantiated in %s", child.getName(),
                                                 child.parentGenerator.getName()),
                                   List.of(child));
    if (instanceName == null || !identifier.matcher(instanceName).matches())
      throw new GeneratorException("invalid instance name '" + instanceName + "'", List.of(this));
    if (children.containsKey(instanceName) || lookupDeclaration(instanceName) != null)
      throw new GeneratorException(String.format("instance name %s is already used in %s", instanceName, name), List.of(this, child));
    child.instanceName = instanceName;
    child.parentGenerator = this;
    ModuleInstantiationStmt stmt = new ModuleInstantiationStmt(child);
    addStmt(stmt);
    children.put(instanceName, stmt);
    logger.debug("Instantiated {} as {} in {}", child.getName(), instanceName, name);
    return stmt;
  }

  /**
   * Instantiates child and connects its ports in one step; the connections are verified immediately.
   * @throws GeneratorException if an input or inout port is left without a connection
   */
  public ModuleInstantiationStmt instantiate(String instanceName, Generator child, Map<Port, ? extends Var> connections) {
    ModuleInstantiationStmt stmt = addChildGenerator(instanceName, child);
    connections.forEach(stmt::connect);
    stmt.verifyConnections();
    return stmt;
  }

  /**
   * Connects two values: a port of a direct child is wired through its instantiation, anything else becomes the continuous
   * assignment {@code assign a = b}.
   */
  public void wire(Var a, Var b) {
    if (a instanceof Port && isChildPort((Port)a))
      getInstantiation(a.getGenerator()).connect((Port)a, b);
    else if (b instanceof Port && isChildPort((Port)b))
      getInstantiation(b.getGenerator()).connect((Port)b, a);
    else
      assign(a, b);
  }

  private boolean isChildPort(Port port) { return port.getGenerator().parentGenerator == this; }

  /**
   * Removes a child instance together with its instantiation statement.
   * @return true if child was a child of this generator
   */
  public boolean removeChildGenerator(Generator child) {
    if (child.parentGenerator != this)
      return false;
    ModuleInstantiationStmt stmt = children.remove(child.getInstanceName());
    stmts.remove(stmt);
    stmt.setParent(null);
    child.parentGenerator = null;
    child.instanceName = child.getName();
    return true;
  }

  private boolean isDescendantOf(Generator candidate) {
    for (Generator ancestor = parentGenerator; ancestor != null; ancestor = ancestor.parentGenerator) {
      if (ancestor == candidate)
        return true;
    }
    return false;
  }

  /** @return the instantiation statement of a direct child */
  public ModuleInstantiationStmt getInstantiation(Generator child) {
    if (child.parentGenerator != this)
      throw new UserException(child.getName() + " is not a child of " + name);
    return children.get(child.getInstanceName());
  }

  /** @return the child generators in instantiation order */
  public List<Generator> getChildGenerators() {
    List<Generator> result = new ArrayList<>();
    children.values().forEach(stmt -> result.add(stmt.getChildGenerator()));
    return result;
  }

  public boolean hasChildGenerator(String instanceName) { return children.containsKey(instanceName); }

  public Generator getChildGenerator(String instanceName) {
    ModuleInstantiationStmt stmt = children.get(instanceName);
    if (stmt == null)
      throw new UserException("no instance " + instanceName + " in " + name);
    return stmt.getChildGenerator();
  }

  // lookups

  public Collection<Port> getPorts() { return Collections.unmodifiableCollection(ports.values()); }

  public boolean hasPort(String name) { return ports.containsKey(name); }

  public Port getPort(String name) {
    Port port = ports.get(name);
    if (port == null)
      throw new UserException("no port " + name + " in " + this.name);
    return port;
  }

  public Collection<Var> getVars() { return Collections.unmodifiableCollection(vars.values()); }

  public boolean hasVar(String name) { return vars.containsKey(name); }

  public Var getVar(String name) {
    Var var = vars.get(name);
    if (var == null)
      throw new UserException("no variable " + name + " in " + this.name);
    return var;
  }

  public Collection<Param> getParams() { return Collections.unmodifiableCollection(params.values()); }

  public boolean hasParam(String name) { return params.containsKey(name); }

  public Param getParam(String name) {
    Param param = params.get(name);
    if (param == null)
      throw new UserException("no parameter " + name + " in " + this.name);
    return param;
  }

  /** Registered type definitions in registration order. */
  public Collection<TypeDefinition> getTypeDefinitions() { return Collections.unmodifiableCollection(typeDefinitions.values()); }

  @Override
  public IRNode getParent() {
    return parentGenerator;
  }

  @Override
  public Generator getGenerator() {
    return this;
  }

  @Override
  public int childCount() {
    return stmts.size();
  }

  @Override
  public IRNode getChild(int index) {
    if (index < 0 || index >= stmts.size())
      throw childIndexError(index);
    return stmts.get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
