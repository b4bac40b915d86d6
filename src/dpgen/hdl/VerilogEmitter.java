package dpgen.hdl;

import dpgen.netlist.Assignment;
import dpgen.netlist.Branch;
import dpgen.netlist.CaseItem;
import dpgen.netlist.CaseStatement;
import dpgen.netlist.ControlBlock;
import dpgen.netlist.IfElseChain;
import dpgen.netlist.NetlistRO;
import dpgen.netlist.Operation;
import dpgen.netlist.OperationKind;
import dpgen.netlist.OutputConnection;
import dpgen.netlist.SharingGroup;
import dpgen.netlist.Signal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders a generated netlist as one Verilog module. Stateless apart from the formatting options.
 */
public class VerilogEmitter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final String RULE = "// ============================================================================\n";
  private static final String SECTION_RULE = "// ========================================\n";

  /** Infix operator per binary kind, prefix operator per unary kind. NAND/NOR/XNOR wrap the base operator in a negation. */
  private static final EnumMap<OperationKind, String> operators = new EnumMap<>(OperationKind.class);
  static {
    operators.put(OperationKind.ADD, "+");
    operators.put(OperationKind.SUB, "-");
    operators.put(OperationKind.MUL, "*");
    operators.put(OperationKind.DIV, "/");
    operators.put(OperationKind.MOD, "%");
    operators.put(OperationKind.AND, "&");
    operators.put(OperationKind.OR, "|");
    operators.put(OperationKind.XOR, "^");
    operators.put(OperationKind.NOT, "~");
    operators.put(OperationKind.NAND, "&");
    operators.put(OperationKind.NOR, "|");
    operators.put(OperationKind.XNOR, "^");
    operators.put(OperationKind.EQ, "==");
    operators.put(OperationKind.NEQ, "!=");
    operators.put(OperationKind.LT, "<");
    operators.put(OperationKind.GT, ">");
    operators.put(OperationKind.LTE, "<=");
    operators.put(OperationKind.GTE, ">=");
    operators.put(OperationKind.SHL, "<<");
    operators.put(OperationKind.SHR, ">>");
    operators.put(OperationKind.SHRA, ">>>");
    operators.put(OperationKind.RED_AND, "&");
    operators.put(OperationKind.RED_OR, "|");
    operators.put(OperationKind.RED_XOR, "^");
    operators.put(OperationKind.RED_NAND, "~&");
    operators.put(OperationKind.RED_NOR, "~|");
    operators.put(OperationKind.RED_XNOR, "~^");
  }

  public String tab = "    ";

  private final NetlistRO netlist;
  private Optional<String> timestamp = Optional.empty();

  public VerilogEmitter(NetlistRO netlist) { this.netlist = netlist; }

  /** Sets the generation time printed in the header. Without a timestamp, the output only depends on the netlist. */
  public void setTimestamp(String timestamp) { this.timestamp = Optional.ofNullable(timestamp); }

  /** Renders the complete module. */
  public String emit() {
    StringBuilder out = new StringBuilder();
    emitHeader(out);
    emitModuleDeclaration(out);
    emitSignalDeclarations(out);
    emitCombinationalLogic(out);
    emitControlBlocks(out);
    emitOutputConnections(out);
    out.append("endmodule\n");
    logger.debug("Rendered module {} ({} characters)", netlist.getModuleName(), out.length());
    return out.toString();
  }

  private void emitHeader(StringBuilder out) {
    out.append(RULE);
    out.append("// Random Verilog Datapath Generator\n");
    timestamp.ifPresent(time -> out.append("// Generated: " + time + "\n"));
    out.append(RULE);
    out.append("// This file was automatically generated for synthesis tool benchmarking.\n");
    out.append("// Module: " + netlist.getModuleName() + "\n");
    out.append("// Seed: " + netlist.getSeed() + "\n");
    out.append("// Inputs: " + netlist.getInputs().size() + "\n");
    out.append("// Outputs: " + netlist.getOutputs().size() + "\n");
    out.append("// Operations: " + netlist.getOperations().size() + "\n");
    out.append("// Control blocks: " + netlist.getControlBlocks().size() + "\n");
    out.append(RULE + "\n");
  }

  private void emitModuleDeclaration(StringBuilder out) {
    List<String> ports = new ArrayList<>();
    netlist.getInputs().forEach(input -> ports.add(tab + CreateDecl(input)));
    netlist.getOutputs().forEach(output -> ports.add(tab + CreateDecl(output)));
    out.append("module " + netlist.getModuleName() + " (\n");
    if (!ports.isEmpty())
      out.append(String.join(",\n", ports) + "\n");
    out.append(");\n\n");
  }

  private void emitSignalDeclarations(StringBuilder out) {
    if (!netlist.getWires().isEmpty()) {
      out.append(tab + "// Internal wires\n");
      netlist.getWires().forEach(wire -> out.append(tab + CreateDecl(wire) + ";\n"));
      out.append("\n");
    }
    if (!netlist.getRegisters().isEmpty()) {
      out.append(tab + "// Registers\n");
      netlist.getRegisters().forEach(reg -> out.append(tab + CreateDecl(reg) + ";\n"));
      out.append("\n");
    }
  }

  private void emitCombinationalLogic(StringBuilder out) {
    if (netlist.getOperations().isEmpty()) {
      out.append(tab + "// No operations generated\n\n");
      return;
    }
    out.append(tab + SECTION_RULE);
    out.append(tab + "// Combinational Logic\n");
    out.append(tab + SECTION_RULE + "\n");
    for (Operation op : netlist.getOperations()) {
      out.append(tab + CreateAssign(op));
      if (netlist.getNumPipelineStages() > 0)
        out.append(" // depth " + op.getDepth() + ", stage " + op.getStage());
      out.append("\n");
    }
    out.append("\n");

    List<SharingGroup> groups = netlist.getSharingGroups();
    for (int i = 0; i < groups.size(); ++i) {
      SharingGroup group = groups.get(i);
      out.append(tab + "// Sharing group " + i + " (enable " + group.getEnable().getName() + "): " +
                 group.getOperations().stream().map(op -> op.getOutput().getName()).collect(Collectors.joining(", ")) + "\n");
    }
    if (!groups.isEmpty())
      out.append("\n");
  }

  private void emitControlBlocks(StringBuilder out) {
    if (netlist.getControlBlocks().isEmpty())
      return;
    out.append(tab + SECTION_RULE);
    out.append(tab + "// Control Flow Structures\n");
    out.append(tab + "// (for testing synthesis optimization)\n");
    out.append(tab + SECTION_RULE + "\n");
    for (ControlBlock block : netlist.getControlBlocks()) {
      // Operations local to a block are continuous assignments; only their results are selected procedurally.
      for (Operation op : block.operations())
        out.append(tab + CreateAssign(op) + "\n");
      if (block instanceof CaseStatement)
        emitCaseStatement(out, (CaseStatement)block);
      else if (block instanceof IfElseChain)
        emitIfElseChain(out, (IfElseChain)block);
      else
        throw new IllegalArgumentException("Unsupported control block " + block.getClass().getName());
      out.append("\n");
    }
  }

  private void emitCaseStatement(StringBuilder out, CaseStatement block) {
    String ind1 = tab.repeat(2);
    String ind2 = tab.repeat(3);
    out.append(tab + "always @(*) begin\n");
    out.append(ind1 + "case (" + block.getSelector().getName() + ")\n");
    for (CaseItem item : block.getCases()) {
      out.append(ind2 + item.getMatchValue() + ": begin\n");
      emitAssignments(out, item.getAssignments(), ind2 + tab);
      out.append(ind2 + "end\n");
    }
    if (!block.getDefaults().isEmpty()) {
      out.append(ind2 + "default: begin\n");
      emitAssignments(out, block.getDefaults(), ind2 + tab);
      out.append(ind2 + "end\n");
    }
    out.append(ind1 + "endcase\n");
    out.append(tab + "end\n");
  }

  private void emitIfElseChain(StringBuilder out, IfElseChain block) {
    String ind1 = tab.repeat(2);
    List<Branch> branches = block.getBranches();
    out.append(tab + "always @(*) begin\n");
    for (int i = 0; i < branches.size(); ++i) {
      Branch branch = branches.get(i);
      if (i == 0)
        out.append(ind1 + "if (" + branch.getCondition().orElseThrow().getName() + ") begin\n");
      else if (!branch.isElse())
        out.append(ind1 + "end else if (" + branch.getCondition().get().getName() + ") begin\n");
      else
        out.append(ind1 + "end else begin\n");
      emitAssignments(out, branch.getAssignments(), ind1 + tab);
    }
    if (!branches.isEmpty())
      out.append(ind1 + "end\n");
    out.append(tab + "end\n");
  }

  private void emitAssignments(StringBuilder out, List<Assignment> assignments, String indent) {
    for (Assignment assignment : assignments)
      out.append(indent + assignment.getTarget().getName() + " = " + assignment.getSource().getName() + ";\n");
  }

  private void emitOutputConnections(StringBuilder out) {
    if (netlist.getOutputConnections().isEmpty())
      return;
    out.append(tab + "// Outputs\n");
    for (OutputConnection connection : netlist.getOutputConnections()) {
      out.append(tab + "assign " + connection.getOutput().getName() + " = " + connection.getSource().getName() + ";");
      switch (connection.getCoercion()) {
      case UncheckedTruncate:
        out.append(" // unchecked truncation");
        break;
      case UncheckedExtend:
        out.append(" // unchecked extension");
        break;
      default:
        break;
      }
      if (connection.getCoercion() != OutputConnection.Coercion.Exact)
        out.append(" from " + connection.getSource().getWidth() + " to " + connection.getOutput().getWidth() + " bits");
      out.append("\n");
    }
    out.append("\n");
  }

  /**
   * Generates text like "wire signed [7:0] wire_3" (without semicolon).
   */
  public static String CreateDecl(Signal signal) {
    return signal.getRole().keyword + " " + (signal.isSigned() ? "signed " : "") + CreateRange(signal) + signal.getName();
  }

  /** Generates "[w-1:0] " for vectors and an empty string for single bits. */
  public static String CreateRange(Signal signal) {
    return signal.getWidth() > 1 ? "[" + (signal.getWidth() - 1) + ":0] " : "";
  }

  /** Generates "assign out = expr;" for an operation. */
  public static String CreateAssign(Operation op) { return "assign " + op.getOutput().getName() + " = " + CreateExpression(op) + ";"; }

  /** Generates the right hand side expression of an operation. */
  public static String CreateExpression(Operation op) {
    List<String> in = op.getOperands().stream().map(Signal::getName).collect(Collectors.toList());
    OperationKind kind = op.getKind();
    switch (kind) {
    case NOT:
    case RED_AND:
    case RED_OR:
    case RED_XOR:
    case RED_NAND:
    case RED_NOR:
    case RED_XNOR:
      return "(" + operators.get(kind) + in.get(0) + ")";
    case NAND:
    case NOR:
    case XNOR:
      return "~(" + in.get(0) + " " + operators.get(kind) + " " + in.get(1) + ")";
    case MUX2:
    case CONDITIONAL:
      return "(" + in.get(0) + " ? " + in.get(1) + " : " + in.get(2) + ")";
    case MUX4: {
      String sel = in.get(0);
      return "(" + sel + "[1] ? (" + sel + "[0] ? " + in.get(4) + " : " + in.get(3) + ") : (" + sel + "[0] ? " + in.get(2) + " : " + in.get(1) +
          "))";
    }
    case CONCAT:
      return "{" + String.join(", ", in) + "}";
    default:
      return "(" + in.get(0) + " " + operators.get(kind) + " " + in.get(1) + ")";
    }
  }
}
