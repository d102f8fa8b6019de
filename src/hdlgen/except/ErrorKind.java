package hdlgen.except;

/** Error taxonomy; one value per exception class. */
public enum ErrorKind {
  /** Value-graph contract violation: width, signedness, slice range, ownership. */
  Var,
  /** Statement-graph contract violation: conflicting drivers, misplaced statements. */
  Stmt,
  /** Generator-container violation: name clashes, hierarchy cycles, missing port connections. */
  Generator,
  /** Broken invariant inside the core itself. */
  Internal,
  /** API misuse with no specific node to blame. */
  User
}
