package dpgen.netlist;

import java.util.Objects;

/**
 * A named, width-typed value of the generated netlist.
 * Signals are only created by {@link SignalRegistry}, which also owns them; operations and control blocks hold shared references.
 */
public final class Signal {
  private final int id;
  private final String name;
  private final int width;
  private final SignalRole role;
  private final boolean signed;

  Signal(int id, String name, int width, SignalRole role, boolean signed) {
    this.id = id;
    this.name = Objects.requireNonNull(name);
    this.width = width;
    this.role = Objects.requireNonNull(role);
    this.signed = signed;
  }

  /** Index of this signal in the arena of its {@link SignalRegistry}. Ids grow in creation order. */
  public int getId() { return id; }
  public String getName() { return name; }
  public int getWidth() { return width; }
  public SignalRole getRole() { return role; }
  public boolean isSigned() { return signed; }

  @Override
  public String toString() {
    return name + "(" + role.keyword + (signed ? " signed" : "") + " " + width + ")";
  }
}
