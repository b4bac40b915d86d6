package dpgen.netlist;

import java.util.List;

/**
 * Documents a set of expensive operations anchored by an enable signal.
 * The enable does not gate the operations structurally; the operations themselves are part of the main operation list.
 */
public class SharingGroup {
  private final Signal enable;
  private final List<Operation> operations;

  public SharingGroup(Signal enable, List<Operation> operations) {
    this.enable = enable;
    this.operations = List.copyOf(operations);
  }

  public Signal getEnable() { return enable; }
  public List<Operation> getOperations() { return operations; }
}
