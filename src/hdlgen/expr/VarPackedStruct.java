package hdlgen.expr;

import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;
import java.util.HashMap;

/** A variable of a packed struct type. */
public class VarPackedStruct extends Var implements StructTyped {
  private final PackedStruct struct;
  private final HashMap<String, PackedSlice> members = new HashMap<>();

  public VarPackedStruct(Generator generator, String name, PackedStruct struct) {
    super(generator, name, struct.getWidth(), false, VarType.Base);
    this.struct = struct;
  }

  @Override
  public PackedStruct getStruct() {
    return struct;
  }

  @Override
  public PackedSlice member(String memberName) {
    return PackedSlice.lookup(this, struct, members, memberName);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }
}
