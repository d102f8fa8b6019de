package hdlgen.ui;

import hdlgen.except.UserException;
import java.io.Reader;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Data-Class to hold tool options.
 */
public class HDLGenConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public int indent_size = 2;
  public String file_extension = ".sv";
  /** Keep event tracing statements and emit them as comments instead of removing them. */
  public boolean emit_event_comments = false;
  /** Verify instance port connections before generating code. */
  public boolean check_connections = true;

  /**
   * Reads options from a YAML mapping. Missing keys keep their defaults, unknown keys are ignored with a warning.
   * @throws UserException if the document is not a mapping or a value has the wrong type
   */
  public static HDLGenConfig load(Reader reader) {
    HDLGenConfig config = new HDLGenConfig();
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException e) {
      throw new UserException("config file is not valid YAML", e);
    }
    if (document == null)
      return config;
    if (!(document instanceof Map))
      throw new UserException("config file must contain a mapping of option names to values");
    for (Map.Entry<?, ?> setting : ((Map<?, ?>)document).entrySet()) {
      String key = setting.getKey().toString();
      Object value = setting.getValue();
      try {
        switch (key) {
        case "indent_size":
          config.indent_size = ((Number)value).intValue();
          if (config.indent_size < 0)
            throw new UserException("indent_size must not be negative");
          break;
        case "file_extension":
          config.file_extension = (String)value;
          break;
        case "emit_event_comments":
          config.emit_event_comments = (Boolean)value;
          break;
        case "check_connections":
          config.check_connections = (Boolean)value;
          break;
        default:
          logger.warn("Ignoring unknown option {}", key);
        }
      } catch (ClassCastException | NullPointerException e) {
        throw new UserException("invalid value for option " + key + ": " + value, e);
      }
    }
    return config;
  }

  /** The indentation unit used by code generation. */
  public String tab() { return " ".repeat(indent_size); }
}
