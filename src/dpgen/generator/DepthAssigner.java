package dpgen.generator;

import dpgen.netlist.Operation;
import dpgen.netlist.Signal;
import java.util.HashMap;
import java.util.List;

/**
 * Depth and pipeline stage labelling of the main operation list.
 */
public class DepthAssigner {

  private DepthAssigner() {}

  /**
   * Labels each operation with its creation index modulo maxDepth.
   * Not a combinational depth: operand depths are not considered.
   */
  public static void assignCyclic(List<Operation> operations, int maxDepth) {
    for (int i = 0; i < operations.size(); ++i)
      operations.get(i).setDepth(i % maxDepth);
  }

  /**
   * Sets stage = floor(depth * numStages / maxDepth) from the current depth labels.
   */
  public static void tagStages(List<Operation> operations, int numStages, int maxDepth) {
    for (Operation op : operations)
      op.setStage((int)((long)op.getDepth() * numStages / maxDepth));
  }

  /**
   * Labels each operation with the length of the longest operation path from a primary signal.
   * Operands not produced by an operation of the list (inputs, undriven wires, control block results) count as depth -1,
   * so an operation reading only such signals gets depth 0.
   * Requires every producer to precede its consumers in the list.
   * @return the largest assigned depth, or -1 for an empty list
   */
  public static int assignByDependency(List<Operation> operations) {
    HashMap<Signal, Operation> producers = new HashMap<>();
    int maxDepth = -1;
    for (Operation op : operations) {
      int depth = 0;
      for (Signal operand : op.getOperands()) {
        Operation producer = producers.get(operand);
        if (producer != null)
          depth = Math.max(depth, producer.getDepth() + 1);
      }
      op.setDepth(depth);
      producers.put(op.getOutput(), op);
      maxDepth = Math.max(maxDepth, depth);
    }
    return maxDepth;
  }

  /**
   * Spreads dependency depths [0, maxDepthSeen] evenly over numStages stages.
   */
  public static void tagStagesByDependency(List<Operation> operations, int numStages, int maxDepthSeen) {
    for (Operation op : operations)
      op.setStage((int)Math.min(numStages - 1, (long)op.getDepth() * numStages / (maxDepthSeen + 1)));
  }
}
