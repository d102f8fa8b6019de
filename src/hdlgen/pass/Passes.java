package hdlgen.pass;

import hdlgen.event.EventInfo;
import hdlgen.event.EventPasses;
import hdlgen.generator.Generator;
import hdlgen.stmt.ModuleInstantiationStmt;
import hdlgen.stmt.Stmt;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** The built-in passes and the default pipeline that runs before code generation. */
public class Passes {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String EXTRACT_EVENT_INFO = "extract_event_info";
  public static final String REMOVE_EVENT_STMTS = "remove_event_stmts";
  public static final String CHECK_INSTANCE_CONNECTIONS = "check_instance_connections";

  private Passes() {}

  /**
   * Builds the default pipeline.
   * @param eventInfo receives the events extracted by the first pass
   * @param removeEvents whether tracing statements are detached after extraction
   * @param checkConnections whether instance connections are verified
   */
  public static PassManager defaultPipeline(List<EventInfo> eventInfo, boolean removeEvents, boolean checkConnections) {
    PassManager manager = new PassManager();
    manager.register(EXTRACT_EVENT_INFO, top -> eventInfo.addAll(EventPasses.extractEventFireCondition(top)));
    if (removeEvents)
      manager.register(REMOVE_EVENT_STMTS, top -> {
        int removed = EventPasses.removeEventStmts(top);
        logger.debug("Removed {} event statement(s)", removed);
      });
    if (checkConnections)
      manager.register(CHECK_INSTANCE_CONNECTIONS, Passes::checkInstanceConnections);
    return manager;
  }

  /**
   * Verifies the port connections of every instantiation in the tree.
   * @throws hdlgen.except.GeneratorException for the first unconnected input
   */
  public static void checkInstanceConnections(Generator top) {
    for (Stmt stmt : top.getStmts()) {
      if (stmt instanceof ModuleInstantiationStmt)
        ((ModuleInstantiationStmt)stmt).verifyConnections();
    }
    for (Generator child : top.getChildGenerators())
      checkInstanceConnections(child);
  }
}
