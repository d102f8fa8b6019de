package hdlgen.expr;

/** Coarse kind of a value. Every concrete {@link Var} class fixes its tag in the constructor. */
public enum VarType {
  /** Declared variables, including enum-, struct- and interface-typed ones. */
  Base,
  /** Values computed from other values. */
  Expression,
  /** Part-selects: bit ranges, indexed bits, struct members, interface signals. */
  Slice,
  /** Literals, parameters and enum constants. */
  ConstValue,
  /** Module ports. */
  PortIO
}
