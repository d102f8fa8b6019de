package hdlgen.codegen;

import hdlgen.expr.InterfaceDefinition;
import hdlgen.expr.InterfaceTyped;
import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ui.HDLGenConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Generates the SystemVerilog text of a whole generator tree.
 * <p>
 * Modules are emitted children first. Generators that share a module name and render identically are emitted once; if they render
 * differently, the later ones are renamed {@code name_unq0}, {@code name_unq1}, ... in the output only.
 */
public class VerilogModule {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private VerilogModule() {}

  /** Generates with default options. */
  public static LinkedHashMap<String, String> generate(Generator top) { return generate(top, new HDLGenConfig()); }

  /**
   * @return unit name to text, in emission order; interface definitions get their own entries ahead of the first module using them
   */
  public static LinkedHashMap<String, String> generate(Generator top, HDLGenConfig config) {
    LinkedHashMap<String, String> result = new LinkedHashMap<>();
    Map<Generator, String> moduleNames = new IdentityHashMap<>();
    for (Generator generator : postOrder(top)) {
      if (generator.isExternal()) {
        logger.debug("Skipping external module {}", generator.getName());
        continue;
      }
      for (InterfaceDefinition definition : usedInterfaces(generator))
        result.putIfAbsent(definition.getName(), SystemVerilogCodeGen.interfaceDefinition(definition, config.tab()));
      String name = generator.getName();
      String text = render(generator, name, config, moduleNames);
      int suffix = 0;
      while (result.containsKey(name) && !result.get(name).equals(text)) {
        name = generator.getName() + "_unq" + suffix++;
        text = render(generator, name, config, moduleNames);
      }
      if (!name.equals(generator.getName()))
        logger.debug("Module {} renamed to {} to avoid a clash", generator.getName(), name);
      moduleNames.put(generator, name);
      result.putIfAbsent(name, text);
    }
    return result;
  }

  private static String render(Generator generator, String name, HDLGenConfig config, Map<Generator, String> moduleNames) {
    Map<Generator, String> names = new IdentityHashMap<>(moduleNames);
    names.put(generator, name);
    return new SystemVerilogCodeGen(generator, config, names).str();
  }

  /** The generator tree below top, children before parents; external generators are leaves. */
  static List<Generator> postOrder(Generator top) {
    List<Generator> order = new ArrayList<>();
    Set<Generator> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    postOrder(top, order, seen);
    return order;
  }

  private static void postOrder(Generator generator, List<Generator> order, Set<Generator> seen) {
    if (!seen.add(generator))
      return;
    if (!generator.isExternal()) {
      for (Generator child : generator.getChildGenerators())
        postOrder(child, order, seen);
    }
    order.add(generator);
  }

  private static List<InterfaceDefinition> usedInterfaces(Generator generator) {
    List<InterfaceDefinition> used = new ArrayList<>();
    List<Var> declarations = new ArrayList<>(generator.getPorts());
    declarations.addAll(generator.getVars());
    for (Var var : declarations) {
      if (var instanceof InterfaceTyped && !used.contains(((InterfaceTyped)var).getDefinition()))
        used.add(((InterfaceTyped)var).getDefinition());
    }
    return used;
  }
}
