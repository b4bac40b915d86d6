package dpgen.hdl;

import dpgen.netlist.NetlistRO;
import dpgen.netlist.Signal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a self-driving testbench for a generated module: random stimulus on all inputs, a VCD dump and a $monitor on all outputs.
 */
public class TestbenchEmitter {
  public String tab = "    ";
  /** Number of random input vectors applied. */
  public int numVectors = 100;

  private final NetlistRO netlist;
  private Optional<String> timestamp = Optional.empty();

  public TestbenchEmitter(NetlistRO netlist) { this.netlist = netlist; }

  public void setTimestamp(String timestamp) { this.timestamp = Optional.ofNullable(timestamp); }

  /** Name of the testbench module, tb_&lt;module&gt;. */
  public String getTestbenchName() { return "tb_" + netlist.getModuleName(); }

  public String emit() {
    String module = netlist.getModuleName();
    List<Signal> inputs = netlist.getInputs();
    List<Signal> outputs = netlist.getOutputs();
    String ind2 = tab.repeat(2);
    String ind3 = tab.repeat(3);
    StringBuilder out = new StringBuilder();

    out.append("// ============================================================================\n");
    out.append("// Testbench for " + module + "\n");
    timestamp.ifPresent(time -> out.append("// Generated: " + time + "\n"));
    out.append("// ============================================================================\n\n");
    out.append("`timescale 1ns / 1ps\n\n");
    out.append("module " + getTestbenchName() + ";\n\n");

    out.append(tab + "// Testbench signals\n");
    for (Signal input : inputs)
      out.append(tab + "reg " + (input.isSigned() ? "signed " : "") + VerilogEmitter.CreateRange(input) + input.getName() + ";\n");
    for (Signal output : outputs)
      out.append(tab + "wire " + (output.isSigned() ? "signed " : "") + VerilogEmitter.CreateRange(output) + output.getName() + ";\n");

    out.append("\n" + tab + "// Instantiate DUT\n");
    out.append(tab + module + " dut (\n");
    List<String> connections = new ArrayList<>();
    inputs.forEach(input -> connections.add(ind2 + "." + input.getName() + "(" + input.getName() + ")"));
    outputs.forEach(output -> connections.add(ind2 + "." + output.getName() + "(" + output.getName() + ")"));
    if (!connections.isEmpty())
      out.append(String.join(",\n", connections) + "\n");
    out.append(tab + ");\n\n");

    out.append(tab + "// Test stimulus\n");
    out.append(tab + "initial begin\n");
    out.append(ind2 + "$dumpfile(\"" + module + ".vcd\");\n");
    out.append(ind2 + "$dumpvars(0, " + getTestbenchName() + ");\n\n");
    out.append(ind2 + "// Initialize inputs\n");
    for (Signal input : inputs)
      out.append(ind2 + input.getName() + " = 0;\n");
    out.append("\n" + ind2 + "// Apply random test vectors\n");
    out.append(ind2 + "repeat (" + numVectors + ") begin\n");
    out.append(ind3 + "#10;\n");
    for (Signal input : inputs)
      out.append(ind3 + input.getName() + " = $random;\n");
    out.append(ind2 + "end\n\n");
    out.append(ind2 + "#100 $finish;\n");
    out.append(tab + "end\n\n");

    out.append(tab + "// Monitor outputs\n");
    out.append(tab + "initial begin\n");
    out.append(ind2 + "$monitor(\"Time=%0t\", $time");
    for (Signal output : outputs)
      out.append(", \" " + output.getName() + "=%h\", " + output.getName());
    out.append(");\n");
    out.append(tab + "end\n\n");
    out.append("endmodule\n");
    return out.toString();
  }
}
