package hdlgen.expr;

import hdlgen.except.UserException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A SystemVerilog interface: ordered signals and named modports giving each listed signal a direction.
 */
public class InterfaceDefinition implements TypeDefinition {
  private final String name;
  private final LinkedHashMap<String, Integer> signals = new LinkedHashMap<>();
  private final LinkedHashMap<String, LinkedHashMap<String, PortDirection>> modports = new LinkedHashMap<>();

  public InterfaceDefinition(String name) {
    if (name == null || name.isEmpty())
      throw new UserException("interface name must not be empty");
    this.name = name;
  }

  /** @return this, for chaining */
  public InterfaceDefinition addSignal(String signalName, int width) {
    if (width < 1)
      throw new UserException("interface signal " + name + "." + signalName + " must be at least 1 bit wide");
    if (signals.containsKey(signalName))
      throw new UserException("interface " + name + " already has a signal named " + signalName);
    signals.put(signalName, width);
    return this;
  }

  /** @return this, for chaining */
  public InterfaceDefinition addModport(String modportName, Map<String, PortDirection> directions) {
    if (modports.containsKey(modportName))
      throw new UserException("interface " + name + " already has a modport named " + modportName);
    for (String signalName : directions.keySet()) {
      if (!signals.containsKey(signalName))
        throw new UserException("modport " + modportName + " refers to unknown signal " + signalName + " of " + name);
    }
    modports.put(modportName, new LinkedHashMap<>(directions));
    return this;
  }

  @Override
  public String getName() {
    return name;
  }

  public Map<String, Integer> getSignals() { return Collections.unmodifiableMap(signals); }

  public Map<String, Map<String, PortDirection>> getModports() { return Collections.unmodifiableMap(modports); }

  public boolean hasModport(String modportName) { return modports.containsKey(modportName); }

  /** Sum of the signal widths, at least 1. */
  public int getWidth() { return Math.max(1, signals.values().stream().mapToInt(Integer::intValue).sum()); }

  @Override
  public String toString() {
    return "interface " + name;
  }
}
