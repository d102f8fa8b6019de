package hdlgen.pass;

import hdlgen.except.UserException;
import hdlgen.generator.Generator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Runs named passes in registration order. */
public class PassManager {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LinkedHashMap<String, Pass> passes = new LinkedHashMap<>();

  /**
   * Appends a pass.
   * @throws UserException if a pass with that name is already registered
   */
  public PassManager register(String name, Pass pass) {
    if (passes.containsKey(name))
      throw new UserException("pass " + name + " is already registered");
    passes.put(name, pass);
    return this;
  }

  public boolean hasPass(String name) { return passes.containsKey(name); }

  public List<String> getPassNames() { return new ArrayList<>(passes.keySet()); }

  public void run(Generator top) {
    for (var entry : passes.entrySet()) {
      logger.debug("Running pass {} on {}", entry.getKey(), top.getName());
      entry.getValue().run(top);
    }
  }
}
