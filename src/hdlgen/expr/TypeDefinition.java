package hdlgen.expr;

/** A named user type (enum, packed struct, interface) that typed values refer to by identity. */
public interface TypeDefinition {
  String getName();
}
