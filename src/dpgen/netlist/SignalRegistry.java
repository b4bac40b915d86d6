package dpgen.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Append-only arena of all signals of one generation run.
 * Keeps the disjoint, declaration-ordered sequences of inputs, outputs, wires and registers.
 * Wires and registers share one name counter, so their names never collide.
 */
public class SignalRegistry {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ArrayList<Signal> arena = new ArrayList<>();
  private final ArrayList<Signal> inputs = new ArrayList<>();
  private final ArrayList<Signal> outputs = new ArrayList<>();
  private final ArrayList<Signal> wires = new ArrayList<>();
  private final ArrayList<Signal> registers = new ArrayList<>();

  private int internalCounter = 0;

  public Signal createInput(int width, boolean signed) { return add(inputs, "in_" + inputs.size(), width, SignalRole.Input, signed); }

  public Signal createOutput(int width, boolean signed) {
    return add(outputs, "out_" + outputs.size(), width, SignalRole.Output, signed);
  }

  public Signal createWire(int width, boolean signed) {
    return add(wires, "wire_" + internalCounter++, width, SignalRole.Wire, signed);
  }

  public Signal createRegister(int width, boolean signed) {
    return add(registers, "reg_" + internalCounter++, width, SignalRole.Register, signed);
  }

  private Signal add(List<Signal> sequence, String name, int width, SignalRole role, boolean signed) {
    if (width < 1)
      throw new IllegalArgumentException("Signal " + name + " must be at least 1 bit wide, got " + width);
    Signal signal = new Signal(arena.size(), name, width, role, signed);
    arena.add(signal);
    sequence.add(signal);
    logger.trace("Created {}", signal);
    return signal;
  }

  /**
   * Resolves an arena handle.
   * @param id the value of {@link Signal#getId()}
   * @return the signal
   */
  public Signal get(int id) { return arena.get(id); }

  /** Number of signals created so far, over all roles. */
  public int size() { return arena.size(); }

  public List<Signal> getInputs() { return Collections.unmodifiableList(inputs); }
  public List<Signal> getOutputs() { return Collections.unmodifiableList(outputs); }
  public List<Signal> getWires() { return Collections.unmodifiableList(wires); }
  public List<Signal> getRegisters() { return Collections.unmodifiableList(registers); }

  /**
   * Returns a snapshot of the signals that may be read as operands right now: all inputs followed by all wires.
   * Outputs and registers are never part of the pool.
   */
  public List<Signal> availablePool() {
    ArrayList<Signal> pool = new ArrayList<>(inputs.size() + wires.size());
    pool.addAll(inputs);
    pool.addAll(wires);
    return pool;
  }
}
