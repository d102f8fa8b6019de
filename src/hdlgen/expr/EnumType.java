package hdlgen.expr;

import hdlgen.except.UserException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An enumeration: a name, a bit width and an ordered table of named values.
 * Rendered as a {@code typedef enum logic [...] { ... } name;}.
 */
public class EnumType implements TypeDefinition {
  private final String name;
  private final int width;
  private final LinkedHashMap<String, Long> values = new LinkedHashMap<>();

  public EnumType(String name, int width) {
    if (name == null || name.isEmpty())
      throw new UserException("enum name must not be empty");
    if (width < 1)
      throw new UserException("enum " + name + " must be at least 1 bit wide");
    this.name = name;
    this.width = width;
  }

  /** Creates an enum and adds the given values in map iteration order. */
  public EnumType(String name, int width, Map<String, Long> values) {
    this(name, width);
    values.forEach(this::addValue);
  }

  /**
   * Adds a named value.
   * @return this, for chaining
   */
  public EnumType addValue(String valueName, long value) {
    if (values.containsKey(valueName))
      throw new UserException("enum " + name + " already has a value named " + valueName);
    if (values.containsValue(value))
      throw new UserException("enum " + name + " already has a value " + value);
    if (!Const.fits(value, width, false))
      throw new UserException(String.format("value %d of %s.%s does not fit in %d bits", value, name, valueName, width));
    values.put(valueName, value);
    return this;
  }

  @Override
  public String getName() {
    return name;
  }

  public int getWidth() { return width; }

  public Map<String, Long> getValues() { return Collections.unmodifiableMap(values); }

  public boolean hasValue(String valueName) { return values.containsKey(valueName); }

  @Override
  public String toString() {
    return "enum " + name;
  }
}
