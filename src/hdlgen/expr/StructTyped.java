package hdlgen.expr;

/** Implemented by every value whose type is a {@link PackedStruct}. */
public interface StructTyped {
  PackedStruct getStruct();

  /**
   * Member access; repeated calls with the same name return the same node.
   * @throws hdlgen.except.VarException if the struct has no such member
   */
  PackedSlice member(String memberName);
}
