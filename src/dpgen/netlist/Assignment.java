package dpgen.netlist;

import java.util.Objects;

/** A procedural write of one signal into a register, inside a case item, a default case or a branch. */
public final class Assignment {
  private final Signal target;
  private final Signal source;

  /**
   * @param target the written signal; must be a {@link SignalRole#Register}, since it may be written from several exclusive regions
   * @param source the read signal
   */
  public Assignment(Signal target, Signal source) {
    this.target = Objects.requireNonNull(target);
    this.source = Objects.requireNonNull(source);
    if (target.getRole() != SignalRole.Register)
      throw new IllegalArgumentException("Assignment target " + target.getName() + " is not a register");
  }

  public Signal getTarget() { return target; }
  public Signal getSource() { return source; }

  @Override
  public String toString() {
    return target.getName() + " = " + source.getName();
  }
}
