package hdlgen.stmt;

public enum AssignmentType {
  /** {@code =} */
  Blocking,
  /** {@code <=} */
  NonBlocking,
  /** Not chosen yet; resolved when the statement is placed into a block or a generator. */
  Undefined
}
