package dpgen.generator;

import java.util.Optional;
import java.util.stream.Stream;

/** How operation depth labels are assigned after generation. */
public enum DepthMode {
  /**
   * Depth = creation index modulo max_depth, assigned after pipeline tagging.
   * Does not reflect combinational depth; pipeline tagging thus sees depth 0 for every operation.
   */
  Cyclic("cyclic"),
  /** Depth = longest operation path from a primary signal; pipeline stages are derived from it afterwards. */
  Dependency("dependency");

  public final String serialName;

  private DepthMode(String serialName) { this.serialName = serialName; }

  public static Optional<DepthMode> fromSerialName(String serialName) {
    return Stream.of(DepthMode.values()).filter(mode -> mode.serialName.equals(serialName)).findAny();
  }
}
