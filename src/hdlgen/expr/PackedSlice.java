package hdlgen.expr;

import hdlgen.except.VarException;
import hdlgen.ir.IRNode;
import hdlgen.ir.IRVisitor;
import java.util.List;
import java.util.Map;

/** Member access {@code parent.member} on a struct-typed value. */
public class PackedSlice extends Var {
  private final Var parent;
  private final PackedStruct.Member member;
  private final int low;

  PackedSlice(Var parent, PackedStruct.Member member, int low) {
    super(parent.getGenerator(), member.name(), member.width(), member.isSigned(), VarType.Slice);
    this.parent = parent;
    this.member = member;
    this.low = low;
  }

  /** Shared lookup for struct-typed values; members are cached in the given map. */
  static PackedSlice lookup(Var parent, PackedStruct struct, Map<String, PackedSlice> cache, String memberName) {
    PackedSlice cached = cache.get(memberName);
    if (cached != null)
      return cached;
    // members are listed MSB first, the offset is the width of everything after the member
    int low = 0;
    PackedStruct.Member found = null;
    for (PackedStruct.Member candidate : struct.getMembers()) {
      if (found != null)
        low += candidate.width();
      else if (candidate.name().equals(memberName))
        found = candidate;
    }
    if (found == null)
      throw new VarException("struct " + struct.getName() + " has no member " + memberName, List.of(parent));
    PackedSlice slice = new PackedSlice(parent, found, low);
    cache.put(memberName, slice);
    return slice;
  }

  public Var getParentVar() { return parent; }

  public PackedStruct.Member getMember() { return member; }

  /** Bit offset of the member inside the struct. */
  public int getLow() { return low; }

  public int getHigh() { return low + width - 1; }

  @Override
  public Var getRootVar() {
    return parent.getRootVar();
  }

  @Override
  public IRNode getParent() {
    return parent;
  }

  @Override
  public int childCount() {
    return 1;
  }

  @Override
  public IRNode getChild(int index) {
    if (index == 0)
      return parent;
    throw childIndexError(index);
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return parent + "." + member.name();
  }
}
