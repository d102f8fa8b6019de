package hdlgen;

import hdlgen.codegen.VerilogModule;
import hdlgen.event.EventInfo;
import hdlgen.except.IRException;
import hdlgen.generator.Generator;
import hdlgen.pass.PassManager;
import hdlgen.pass.Passes;
import hdlgen.ui.HDLGenConfig;
import hdlgen.util.FileWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers a generator tree: runs the pass pipeline, generates one SystemVerilog unit per module and writes them out.
 */
public class HDLGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final HDLGenConfig config;
  private final List<EventInfo> eventInfo = new ArrayList<>();

  public HDLGen() { this(new HDLGenConfig()); }

  public HDLGen(HDLGenConfig config) { this.config = config; }

  public HDLGenConfig getConfig() { return config; }

  /** @return the events collected by the last {@link #Lower(Generator)} */
  public List<EventInfo> getEventInfo() { return Collections.unmodifiableList(eventInfo); }

  /** The passes {@link #Lower(Generator)} runs, in order. */
  public PassManager createPassManager() {
    eventInfo.clear();
    return Passes.defaultPipeline(eventInfo, !config.emit_event_comments, config.check_connections);
  }

  /**
   * Runs the pass pipeline on top and generates the text of every module below it.
   * @return unit name to text, in emission order
   * @throws IRException if a pass or the code generator rejects the design
   */
  public LinkedHashMap<String, String> Lower(Generator top) {
    createPassManager().run(top);
    LinkedHashMap<String, String> units = VerilogModule.generate(top, config);
    logger.debug("Generated {} unit(s) for {}", units.size(), top.getName());
    return units;
  }

  /**
   * Lowers top and writes one file per unit to outPath.
   * @return true if the design was lowered and all files were written
   */
  public boolean Generate(Generator top, String outPath) {
    LinkedHashMap<String, String> units;
    try {
      units = Lower(top);
    } catch (IRException e) {
      logger.error(e.toDiagnostic().toString());
      return false;
    }
    FileWriter toFile = new FileWriter(outPath);
    for (Map.Entry<String, String> unit : units.entrySet())
      toFile.AddFile(unit.getKey() + config.file_extension, unit.getValue());
    boolean success = toFile.WriteFiles();
    if (success)
      logger.info("Generated {} file(s) in {}", units.size(), outPath);
    return success;
  }
}
