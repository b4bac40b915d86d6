package dpgen.netlist;

/** The role of a {@link Signal} inside the generated module. */
public enum SignalRole {
  /** Module input port. Always part of the operand pool. */
  Input("input"),
  /** Module output port. Never read as an operand. */
  Output("output"),
  /** Internal continuous wire, driven by exactly one operation (or left undriven as a generation artifact). */
  Wire("wire"),
  /** Internal register, written only from mutually-exclusive control-block regions. Never read as an operand. */
  Register("reg");

  /** HDL keyword of the declaration. */
  public final String keyword;

  private SignalRole(String keyword) { this.keyword = keyword; }
}
