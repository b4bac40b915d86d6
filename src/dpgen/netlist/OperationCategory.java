package dpgen.netlist;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Groups of {@link OperationKind}s. The datapath generator first draws a category, then a kind within it. */
public enum OperationCategory {
  Arithmetic("arithmetic", true),
  Logical("logical", true),
  Comparison("comparison", true),
  Shift("shift", true),
  Mux("mux", true),
  Concat("concat", true),
  Reduction("reduction", true),
  /** Ternary select. Part of the operation model, but never drawn by the datapath generator. */
  Conditional("conditional", false);

  public final String serialName;
  /** Set if the category takes part in the weighted category draw. */
  public final boolean drawable;

  private OperationCategory(String serialName, boolean drawable) {
    this.serialName = serialName;
    this.drawable = drawable;
  }

  /** Kinds of this category, in declaration order. */
  public List<OperationKind> kinds() {
    return Stream.of(OperationKind.values()).filter(kind -> kind.category == this).collect(Collectors.toList());
  }
}
