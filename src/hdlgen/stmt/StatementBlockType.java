package hdlgen.stmt;

public enum StatementBlockType {
  /** {@code always_comb} */
  Combinational,
  /** {@code always_ff} */
  Sequential,
  /** Body of an if branch or a case item. */
  Scope
}
