package hdlgen.stmt;

public enum BlockEdgeType {
  Posedge("posedge"),
  Negedge("negedge");

  public final String keyword;

  private BlockEdgeType(String keyword) { this.keyword = keyword; }
}
