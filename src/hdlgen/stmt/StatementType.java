package hdlgen.stmt;

/** Coarse kind of a statement; fixed by each concrete {@link Stmt} class. */
public enum StatementType {
  Assign,
  Block,
  If,
  Switch,
  ModuleInstantiation,
  EventTracing
}
