package hdlgen.expr;

import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;
import java.util.HashMap;

/** A port of a packed struct type. */
public class PortPackedStruct extends Port implements StructTyped {
  private final PackedStruct struct;
  private final HashMap<String, PackedSlice> members = new HashMap<>();

  public PortPackedStruct(Generator generator, PortDirection direction, String name, PackedStruct struct) {
    super(generator, direction, name, struct.getWidth(), false, PortType.Data);
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
