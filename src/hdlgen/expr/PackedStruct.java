package hdlgen.expr;

import hdlgen.except.UserException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A packed struct. Members are listed MSB first, as in a SystemVerilog {@code struct packed}.
 */
public class PackedStruct implements TypeDefinition {
  public record Member(String name, int width, boolean isSigned) {}

  private final String name;
  private final ArrayList<Member> members = new ArrayList<>();

  public PackedStruct(String name) {
    if (name == null || name.isEmpty())
      throw new UserException("struct name must not be empty");
    this.name = name;
  }

  /**
   * Appends a member below the existing ones.
   * @return this, for chaining
   */
  public PackedStruct addMember(String memberName, int width, boolean isSigned) {
    if (width < 1)
      throw new UserException("struct member " + name + "." + memberName + " must be at least 1 bit wide");
    if (getMember(memberName).isPresent())
      throw new UserException("struct " + name + " already has a member named " + memberName);
    members.add(new Member(memberName, width, isSigned));
    return this;
  }

  public PackedStruct addMember(String memberName, int width) { return addMember(memberName, width, false); }

  @Override
  public String getName() {
    return name;
  }

  public List<Member> getMembers() { return Collections.unmodifiableList(members); }

  public Optional<Member> getMember(String memberName) {
    return members.stream().filter(member -> member.name().equals(memberName)).findFirst();
  }

  /** Total width; 0 while the struct has no members. */
  public int getWidth() { return members.stream().mapToInt(Member::width).sum(); }

  @Override
  public String toString() {
    return "struct " + name;
  }
}
