package dpgen.netlist;

import java.util.List;

/**
 * Read-only view of a generated netlist, as consumed by the renderers.
 * All lists are in creation order, which is also declaration order.
 */
public interface NetlistRO {
  String getModuleName();
  /** The seed the netlist was generated from. */
  long getSeed();
  /** Number of configured pipeline stages; 0 for a purely combinational design. */
  int getNumPipelineStages();

  List<Signal> getInputs();
  List<Signal> getOutputs();
  List<Signal> getWires();
  List<Signal> getRegisters();

  /** The datapath operations, including those of sharing groups. Operations local to control blocks are not included. */
  List<Operation> getOperations();
  List<ControlBlock> getControlBlocks();
  List<SharingGroup> getSharingGroups();
  List<OutputConnection> getOutputConnections();
}
