package hdlgen.event;

import hdlgen.except.UserException;
import hdlgen.expr.Var;
import hdlgen.stmt.EventTracingStmt;
import java.util.ArrayList;
import java.util.Map;

/**
 * A named simulation event. Firing it produces an {@link EventTracingStmt} carrying a snapshot of the given field values; the
 * statement is placed like any other statement and later picked up by {@link EventPasses}.
 */
public class Event {
  private final String name;

  public Event(String name) {
    if (name == null || name.isEmpty())
      throw new UserException("event name must not be empty");
    this.name = name;
  }

  public String getName() { return name; }

  /**
   * @param fields field name to value; copied, later changes to the map are not seen
   * @throws hdlgen.except.VarException if the values belong to different generators
   */
  public EventTracingStmt fire(Map<String, Var> fields) {
    if (!fields.isEmpty())
      Var.ownerOf(new ArrayList<>(fields.values()));
    return new EventTracingStmt(name, fields);
  }

  @Override
  public String toString() {
    return "event " + name;
  }
}
