package dpgen.netlist;

import java.util.List;

/**
 * Closed set of operation kinds. Each kind carries its operand arity and its output width/signedness inference.
 */
public enum OperationKind {
  ADD(OperationCategory.Arithmetic, "add", 2, 2, Inference.MaxWidthAnySigned),
  SUB(OperationCategory.Arithmetic, "sub", 2, 2, Inference.MaxWidthAnySigned),
  MUL(OperationCategory.Arithmetic, "mul", 2, 2, Inference.SumWidthAnySigned),
  DIV(OperationCategory.Arithmetic, "div", 2, 2, Inference.MaxWidthAnySigned),
  MOD(OperationCategory.Arithmetic, "mod", 2, 2, Inference.MaxWidthAnySigned),

  AND(OperationCategory.Logical, "and", 2, 2, Inference.MaxWidthUnsigned),
  OR(OperationCategory.Logical, "or", 2, 2, Inference.MaxWidthUnsigned),
  XOR(OperationCategory.Logical, "xor", 2, 2, Inference.MaxWidthUnsigned),
  NOT(OperationCategory.Logical, "not", 1, 1, Inference.FirstOperand),
  NAND(OperationCategory.Logical, "nand", 2, 2, Inference.MaxWidthUnsigned),
  NOR(OperationCategory.Logical, "nor", 2, 2, Inference.MaxWidthUnsigned),
  XNOR(OperationCategory.Logical, "xnor", 2, 2, Inference.MaxWidthUnsigned),

  EQ(OperationCategory.Comparison, "eq", 2, 2, Inference.SingleBit),
  NEQ(OperationCategory.Comparison, "neq", 2, 2, Inference.SingleBit),
  LT(OperationCategory.Comparison, "lt", 2, 2, Inference.SingleBit),
  GT(OperationCategory.Comparison, "gt", 2, 2, Inference.SingleBit),
  LTE(OperationCategory.Comparison, "lte", 2, 2, Inference.SingleBit),
  GTE(OperationCategory.Comparison, "gte", 2, 2, Inference.SingleBit),

  /** Shift left; operand 0 is shifted by operand 1. */
  SHL(OperationCategory.Shift, "shl", 2, 2, Inference.FirstOperand),
  /** Logical shift right. */
  SHR(OperationCategory.Shift, "shr", 2, 2, Inference.FirstOperand),
  /** Arithmetic shift right. */
  SHRA(OperationCategory.Shift, "shra", 2, 2, Inference.FirstOperand),

  RED_AND(OperationCategory.Reduction, "red_and", 1, 1, Inference.SingleBit),
  RED_OR(OperationCategory.Reduction, "red_or", 1, 1, Inference.SingleBit),
  RED_XOR(OperationCategory.Reduction, "red_xor", 1, 1, Inference.SingleBit),
  RED_NAND(OperationCategory.Reduction, "red_nand", 1, 1, Inference.SingleBit),
  RED_NOR(OperationCategory.Reduction, "red_nor", 1, 1, Inference.SingleBit),
  RED_XNOR(OperationCategory.Reduction, "red_xnor", 1, 1, Inference.SingleBit),

  /** Operands: selector, data when selector is set, data otherwise. */
  MUX2(OperationCategory.Mux, "mux2", 3, 3, Inference.MaxDataWidthAnySigned),
  /** Operands: selector (at least 2 bits wide), then data 0 to 3 indexed by the two low selector bits. */
  MUX4(OperationCategory.Mux, "mux4", 5, 5, Inference.FirstDataUnsigned),

  /** Operand 0 ends up in the most significant bits. */
  CONCAT(OperationCategory.Concat, "concat", 2, Integer.MAX_VALUE, Inference.SumWidthUnsigned),

  /** Operands: condition, value if true, value if false. */
  CONDITIONAL(OperationCategory.Conditional, "conditional", 3, 3, Inference.MaxDataWidthAnySigned);

  /** Output width and signedness rules, see {@link OperationKind#inferWidth(List)} */
  private enum Inference {
    /** max(w(a), w(b)); signed(a) OR signed(b) */
    MaxWidthAnySigned,
    /** w(a) + w(b); signed(a) OR signed(b) */
    SumWidthAnySigned,
    /** max(w(a), w(b)); unsigned */
    MaxWidthUnsigned,
    /** w(a); signed(a) */
    FirstOperand,
    /** 1 bit; unsigned */
    SingleBit,
    /** max over the two data operands following the selector; signed if either is */
    MaxDataWidthAnySigned,
    /** width of the first data operand following the selector; unsigned */
    FirstDataUnsigned,
    /** sum of all operand widths; unsigned */
    SumWidthUnsigned
  }

  public final OperationCategory category;
  public final String serialName;
  public final int minOperands;
  public final int maxOperands;
  private final Inference inference;

  private OperationKind(OperationCategory category, String serialName, int minOperands, int maxOperands, Inference inference) {
    this.category = category;
    this.serialName = serialName;
    this.minOperands = minOperands;
    this.maxOperands = maxOperands;
    this.inference = inference;
  }

  public boolean isUnary() { return maxOperands == 1; }

  /** Checks an operand count against the arity of this kind. */
  public boolean acceptsOperandCount(int count) { return count >= minOperands && count <= maxOperands; }

  /**
   * Infers the output width from the operand widths.
   * @param operands the operands, in operation order; must satisfy {@link #acceptsOperandCount(int)}
   * @return the output width (at least 1)
   * @throws ArithmeticException if the width does not fit into an int
   */
  public int inferWidth(List<Signal> operands) {
    checkArity(operands);
    switch (inference) {
    case MaxWidthAnySigned:
    case MaxWidthUnsigned:
      return Math.max(operands.get(0).getWidth(), operands.get(1).getWidth());
    case SumWidthAnySigned:
      return Math.addExact(operands.get(0).getWidth(), operands.get(1).getWidth());
    case FirstOperand:
      return operands.get(0).getWidth();
    case SingleBit:
      return 1;
    case MaxDataWidthAnySigned:
      return Math.max(operands.get(1).getWidth(), operands.get(2).getWidth());
    case FirstDataUnsigned:
      return operands.get(1).getWidth();
    case SumWidthUnsigned:
      return operands.stream().mapToInt(Signal::getWidth).reduce(0, Math::addExact);
    default:
      throw new IllegalStateException("Unhandled inference rule " + inference);
    }
  }

  /**
   * Infers the output signedness from the operands.
   * @param operands the operands, in operation order; must satisfy {@link #acceptsOperandCount(int)}
   */
  public boolean inferSigned(List<Signal> operands) {
    checkArity(operands);
    switch (inference) {
    case MaxWidthAnySigned:
    case SumWidthAnySigned:
      return operands.get(0).isSigned() || operands.get(1).isSigned();
    case FirstOperand:
      return operands.get(0).isSigned();
    case MaxDataWidthAnySigned:
      return operands.get(1).isSigned() || operands.get(2).isSigned();
    case MaxWidthUnsigned:
    case SingleBit:
    case FirstDataUnsigned:
    case SumWidthUnsigned:
      return false;
    default:
      throw new IllegalStateException("Unhandled inference rule " + inference);
    }
  }

  private void checkArity(List<Signal> operands) {
    if (!acceptsOperandCount(operands.size()))
      throw new IllegalArgumentException(this + " cannot take " + operands.size() + " operands");
  }
}
