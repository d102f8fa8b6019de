package hdlgen.expr;

public enum PortDirection {
  In("input"),
  Out("output"),
  InOut("inout");

  public final String keyword;

  private PortDirection(String keyword) { this.keyword = keyword; }
}
