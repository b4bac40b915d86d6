package dpgen.netlist;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A node computing one fresh output signal from a fixed-arity list of operand signals.
 * Depth and pipeline stage are labels set by the post-passes of the generator.
 */
public class Operation {
  private final OperationKind kind;
  private final Signal output;
  private final List<Signal> operands;
  private int depth = 0;
  private int stage = 0;

  private Operation(OperationKind kind, Signal output, List<Signal> operands) {
    this.kind = kind;
    this.output = output;
    this.operands = operands;
  }

  /**
   * Constructs an operation if the operands satisfy the arity of the kind.
   * @param kind the operation kind
   * @param output the signal driven by the operation
   * @param operands the operand signals, in order
   * @return the operation, or an empty Optional if there are too few or too many operands
   */
  public static Optional<Operation> create(OperationKind kind, Signal output, List<Signal> operands) {
    Objects.requireNonNull(kind);
    Objects.requireNonNull(output);
    if (operands.stream().anyMatch(Objects::isNull) || !kind.acceptsOperandCount(operands.size()))
      return Optional.empty();
    return Optional.of(new Operation(kind, output, List.copyOf(operands)));
  }

  public OperationKind getKind() { return kind; }
  public Signal getOutput() { return output; }
  public List<Signal> getOperands() { return operands; }

  public int getDepth() { return depth; }
  public void setDepth(int depth) { this.depth = depth; }

  public int getStage() { return stage; }
  public void setStage(int stage) { this.stage = stage; }

  @Override
  public String toString() {
    return output.getName() + " = " + kind.serialName + operands.stream().map(Signal::getName).collect(Collectors.toList());
  }
}
