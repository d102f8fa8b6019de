package hdlgen.expr;

import hdlgen.except.InternalException;
import hdlgen.except.VarException;
import hdlgen.generator.Generator;
import hdlgen.ir.IRVisitor;
import java.util.List;

/**
 * An immediate value: a signed 64-bit payload with a width and signedness.
 * <p>
 * Out-of-range payloads are rejected, never wrapped: unsigned constants hold {@code [0, 2^width - 1]}, signed constants
 * {@code [-2^(width-1), 2^(width-1) - 1]}. Widths above 64 accept every payload the sign allows.
 */
public class Const extends Var {
  protected long value;

  /** Callers normally go through {@link Generator#constant(long, int, boolean)}, which caches constants. */
  public Const(Generator generator, long value, int width, boolean isSigned) { this(generator, "", value, width, isSigned); }

  protected Const(Generator generator, String name, long value, int width, boolean isSigned) {
    super(generator, name, checkedWidth(generator, value, width, isSigned), isSigned, VarType.ConstValue);
    this.value = value;
  }

  private static int checkedWidth(Generator generator, long value, int width, boolean isSigned) {
    if (generator == null)
      throw new InternalException("constant created without a generator");
    if (width >= 1 && !fits(value, width, isSigned))
      throw new VarException(String.format("constant %d does not fit in %d %s bits", value, width, isSigned ? "signed" : "unsigned"),
                             List.of(generator));
    return width;
  }

  /** @return true if value is representable in width bits with the given signedness */
  public static boolean fits(long value, int width, boolean isSigned) {
    if (width < 1)
      return false;
    if (!isSigned)
      return value >= 0 && (width >= 63 || value < (1L << width));
    if (width >= 64)
      return true;
    long bound = 1L << (width - 1);
    return value >= -bound && value < bound;
  }

  /** Renders a sized SystemVerilog literal: {@code 8'hFF}, {@code 8'sh7F}, {@code -8'sh80}. */
  public static String literal(long value, int width, boolean isSigned) {
    if (!isSigned)
      return width + "'h" + Long.toHexString(value).toUpperCase();
    if (value < 0)
      return "-" + width + "'sh" + Long.toUnsignedString(-value, 16).toUpperCase();
    return width + "'sh" + Long.toHexString(value).toUpperCase();
  }

  public long getValue() { return value; }

  @Override
  public boolean isGeneratorIndependent() {
    return true;
  }

  @Override
  public void accept(IRVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return literal(value, width, isSigned);
  }
}
