package hdlgen.stmt;

import hdlgen.expr.Var;
import hdlgen.generator.Generator;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records that an event fires with a snapshot of field values. Has no hardware semantics; tracing statements are collected by
 * the event passes and removed before code generation, or emitted as comments.
 */
public class EventTracingStmt extends Stmt {
  private final String eventName;
  private final LinkedHashMap<String, Var> fields;
  private String transaction;
  private EventActionType actionType = EventActionType.None;

  /** Created by {@code Event.fire}; the field map is copied. */
  public EventTracingStmt(String eventName, Map<String, Var> fields) {
    super(StatementType.EventTracing);
    this.eventName = eventName;
    this.fields = new LinkedHashMap<>(fields);
  }

  public String getEventName() { return eventName; }

  public Map<String, Var> getFields() { return Collections.unmodifiableMap(fields); }

  /** @return the transaction name, null if none */
  public String getTransaction() { return transaction; }

  public EventActionType getActionType() { return actionType; }

  /** Tags the event with a transaction. @return this, for chaining */
  public EventTracingStmt belongsTo(String transaction) {
    this.transaction = transaction;
    return this;
  }

  /** Marks the event as the start of its transaction. @return this, for chaining */
  public EventTracingStmt starts() {
    this.actionType = EventActionType.Start;
    return this;
  }

  /** Marks the event as the end of its transaction. @return this, for chaining */
  public EventTracingStmt terminates() {
    this.actionType = EventActionType.End;
    return this;
  }

  public void setActionType(EventActionType actionType) { this.actionType = actionType; }

  @Override
  public Generator getGenerator() {
    Generator generator = super.getGenerator();
    if (generator != null || fields.isEmpty())
      return generator;
    return fields.values().iterator().next().getGenerator();
  }

  @Override
  public int childCount() {
    return fields.size();
  }

  @Override
  public IRNode getChild(int index) {
    if (index < 0 || index >= fields.size())
      throw childIndexError(index);
    return new ArrayList<>(fields.values()).get(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "event " + eventName;
  }
}
