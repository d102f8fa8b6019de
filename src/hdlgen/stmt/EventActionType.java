package hdlgen.stmt;

/** Role of a tracing statement within a transaction. */
public enum EventActionType {
  None,
  Start,
  End
}
