package hdlgen.expr;

/** Implemented by every value whose type is an {@link EnumType}. */
public interface EnumTyped {
  EnumType getEnumType();
}
