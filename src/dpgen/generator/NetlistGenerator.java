package dpgen.generator;

import dpgen.netlist.Branch;
import dpgen.netlist.CaseItem;
import dpgen.netlist.CaseStatement;
import dpgen.netlist.ControlBlock;
import dpgen.netlist.IfElseChain;
import dpgen.netlist.NetlistRO;
import dpgen.netlist.Operation;
import dpgen.netlist.OperationCategory;
import dpgen.netlist.OperationKind;
import dpgen.netlist.OutputConnection;
import dpgen.netlist.SharingGroup;
import dpgen.netlist.Signal;
import dpgen.netlist.SignalRegistry;
import dpgen.ui.GeneratorConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds one random datapath netlist from a configuration and its seed.
 * The configuration is expected to be validated already (see {@link GeneratorConfig#validate()}).
 *
 * All random draws happen in a fixed order, so equal configurations (including the seed) produce equal netlists.
 */
public class NetlistGenerator implements NetlistRO {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Probability of a 4-way mux in the mux category. */
  static final double MUX4_PROBABILITY = 0.3;
  /** Probability of an arithmetic operation (instead of a pass-through) per register and case item. */
  static final double CASE_OPERATION_PROBABILITY = 0.7;
  /** Probability of a multiplication (instead of a pass-through) per register and if/else branch. */
  static final double BRANCH_OPERATION_PROBABILITY = 0.8;
  /** Probability of a multiplication (instead of an addition) in a sharing group. */
  static final double SHARING_MUL_PROBABILITY = 0.7;
  /** Number of case statements or if/else chains if only the corresponding flag is set. */
  static final int DEFAULT_BLOCK_COUNT = 2;

  private static final List<OperationCategory> CATEGORY_ORDER =
      Stream.of(OperationCategory.values()).filter(category -> category.drawable).collect(Collectors.toList());
  private static final List<OperationKind> ARITHMETIC_ORDER =
      List.of(OperationKind.ADD, OperationKind.SUB, OperationKind.MUL, OperationKind.DIV, OperationKind.MOD);
  private static final List<OperationKind> SHIFT_ORDER = List.of(OperationKind.SHL, OperationKind.SHR, OperationKind.SHRA);

  private final GeneratorConfig cfg;
  private final DepthMode depthMode;
  private final GeneratorRandom rand;

  private final WeightedChoice<OperationCategory> categoryChoice;
  private final WeightedChoice<OperationKind> arithmeticChoice;
  private final WeightedChoice<OperationKind> shiftChoice;

  private final SignalRegistry signals = new SignalRegistry();
  private final ArrayList<Operation> operations = new ArrayList<>();
  private final ArrayList<ControlBlock> controlBlocks = new ArrayList<>();
  private final ArrayList<SharingGroup> sharingGroups = new ArrayList<>();
  private final ArrayList<OutputConnection> outputConnections = new ArrayList<>();

  private boolean generated = false;
  private int skippedOperations = 0;

  public NetlistGenerator(GeneratorConfig cfg) {
    this.cfg = cfg;
    this.depthMode = DepthMode.fromSerialName(cfg.depth_mode)
                         .orElseThrow(() -> new IllegalArgumentException("Unknown depth mode " + cfg.depth_mode));
    this.rand = new GeneratorRandom(cfg.seed);
    this.categoryChoice = new WeightedChoice<>(CATEGORY_ORDER, cfg.categoryWeights());
    this.arithmeticChoice = new WeightedChoice<>(ARITHMETIC_ORDER, cfg.arithmeticWeights());
    this.shiftChoice = new WeightedChoice<>(SHIFT_ORDER, cfg.shiftWeights());
  }

  /**
   * Runs all generation phases. Can be called only once per generator.
   */
  public void generate() {
    if (generated)
      throw new IllegalStateException("Netlist " + cfg.module_name + " has already been generated");
    generated = true;
    logger.debug("Generating netlist {} with seed {}", cfg.module_name, cfg.seed);

    generateInputs();
    generateOutputs();
    generateDatapath();

    if (cfg.num_pipeline_stages > 0 && depthMode == DepthMode.Cyclic)
      DepthAssigner.tagStages(operations, cfg.num_pipeline_stages, cfg.max_depth);

    generateControlBlocks();

    connectOutputs();
    assignDepths();

    logger.debug("Generated {} operations ({} attempts skipped)", operations.size(), skippedOperations);
    logger.debug("Generated {} control blocks", controlBlocks.size());
    logger.debug("Total signals: {}", signals.size());
  }

  private void generateInputs() {
    for (int i = 0; i < cfg.num_inputs; ++i) {
      int width = rand.randomInt(cfg.input_width_min, cfg.input_width_max);
      signals.createInput(width, randomSigned());
    }
  }

  private void generateOutputs() {
    for (int i = 0; i < cfg.num_outputs; ++i) {
      int width = rand.randomInt(cfg.output_width_min, cfg.output_width_max);
      signals.createOutput(width, randomSigned());
    }
  }

  /** Draws a signedness only if signed generation is enabled. */
  private boolean randomSigned() { return cfg.use_signed && rand.randomBool(0.5); }

  /** Width of internal registers; uses the input width range. */
  private int randomInternalWidth() { return rand.randomInt(cfg.input_width_min, cfg.input_width_max); }

  //////////   datapath   //////////

  private void generateDatapath() {
    for (int i = 0; i < cfg.num_operations; ++i) {
      OperationCategory category = categoryChoice.draw(rand);
      List<Signal> available = signals.availablePool();
      if (available.isEmpty())
        available = signals.getInputs(); // fallback, may be empty as well

      Optional<Operation> op = generateOperation(category, available);
      if (op.isPresent()) {
        operations.add(op.get());
        logger.trace("Operation {}: {}", i, op.get());
      } else {
        ++skippedOperations;
        logger.trace("Operation {}: skipped {} operation", i, category.serialName);
      }
    }
  }

  private Optional<Operation> generateOperation(OperationCategory category, List<Signal> available) {
    switch (category) {
    case Arithmetic:
      return instantiate(arithmeticChoice.draw(rand), drawOperands(available, 2));
    case Logical: {
      OperationKind kind = uniformKind(OperationCategory.Logical);
      return instantiate(kind, drawOperands(available, kind.isUnary() ? 1 : 2));
    }
    case Comparison:
      return instantiate(uniformKind(OperationCategory.Comparison), drawOperands(available, 2));
    case Shift:
      return instantiate(shiftChoice.draw(rand), drawOperands(available, 2));
    case Mux:
      return rand.randomBool(MUX4_PROBABILITY) ? generateMux4(available) : instantiate(OperationKind.MUX2, drawOperands(available, 3));
    case Concat:
      return instantiate(OperationKind.CONCAT, drawOperands(available, rand.randomInt(2, 4)));
    case Reduction:
      return instantiate(uniformKind(OperationCategory.Reduction), drawOperands(available, 1));
    default:
      throw new IllegalStateException("Category " + category + " is not generated by the datapath");
    }
  }

  private OperationKind uniformKind(OperationCategory category) {
    List<OperationKind> kinds = category.kinds();
    return kinds.get(rand.randomInt(0, kinds.size() - 1));
  }

  private Optional<Operation> generateMux4(List<Signal> available) {
    if (available.isEmpty())
      return Optional.empty();
    Signal sel = rand.pick(available);
    if (sel.getWidth() < 2) {
      // Needs a 2 bit selector. The substitute is left undriven.
      sel = signals.createWire(2, false);
      logger.trace("Substituted 2 bit selector {} for a 4-way mux", sel.getName());
    }
    List<Signal> operands = new ArrayList<>(5);
    operands.add(sel);
    operands.addAll(drawOperands(available, 4));
    return instantiate(OperationKind.MUX4, operands);
  }

  /**
   * Draws operands uniformly with replacement.
   * @return the operands, or an empty list if there are no candidates
   */
  private List<Signal> drawOperands(List<Signal> available, int count) {
    if (available.isEmpty())
      return Collections.emptyList();
    List<Signal> ret = new ArrayList<>(count);
    for (int i = 0; i < count; ++i)
      ret.add(rand.pick(available));
    return ret;
  }

  /**
   * Creates the output wire of an operation by width inference and constructs the operation.
   * @return the operation, or an empty Optional without creating a wire if the operands do not satisfy the arity
   *         or the inferred width does not fit into an int
   */
  private Optional<Operation> instantiate(OperationKind kind, List<Signal> operands) {
    if (!kind.acceptsOperandCount(operands.size()))
      return Optional.empty();
    int width;
    try {
      width = kind.inferWidth(operands);
    } catch (ArithmeticException e) {
      logger.trace("Dropped {} operation, output width exceeds {} bits", kind.serialName, Integer.MAX_VALUE);
      return Optional.empty();
    }
    Signal output = signals.createWire(width, kind.inferSigned(operands));
    return Operation.create(kind, output, operands);
  }

  //////////   control blocks   //////////

  private void generateControlBlocks() {
    if (cfg.generate_case_statements || cfg.num_case_statements > 0)
      generateCaseStatements();
    if (cfg.generate_if_else_chains || cfg.num_if_else_chains > 0)
      generateIfElseChains();
    if (cfg.generate_sharing_opportunities)
      generateSharingOpportunities();
  }

  private List<Signal> createSharedRegisters() {
    int numRegisters = rand.randomInt(1, 3);
    List<Signal> ret = new ArrayList<>(numRegisters);
    for (int i = 0; i < numRegisters; ++i) {
      int width = randomInternalWidth();
      ret.add(signals.createRegister(width, randomSigned()));
    }
    return ret;
  }

  private void generateCaseStatements() {
    int numStatements = cfg.num_case_statements > 0 ? cfg.num_case_statements : DEFAULT_BLOCK_COUNT;
    for (int i = 0; i < numStatements; ++i) {
      List<Signal> available = signals.availablePool();
      if (available.isEmpty()) {
        logger.debug("Skipping case statement {}, no selector candidates", i);
        continue;
      }
      Signal selector = rand.pick(available);
      int numCases = Math.min(1 << Math.min(selector.getWidth(), 4), cfg.cases_per_statement);

      CaseStatement block = new CaseStatement(selector);
      List<Signal> caseOutputs = createSharedRegisters();

      for (int caseVal = 0; caseVal < numCases; ++caseVal) {
        CaseItem item = block.addCase(caseVal);
        for (Signal output : caseOutputs) {
          Optional<Operation> op = Optional.empty();
          if (cfg.generate_sharing_opportunities && rand.randomBool(CASE_OPERATION_PROBABILITY)) {
            // An arithmetic unit per case; only one case is active at a time.
            List<Signal> operands = drawOperands(available, 2);
            op = instantiate(arithmeticChoice.draw(rand), operands);
          }
          if (op.isPresent()) {
            item.addOperation(op.get());
            item.addAssignment(output, op.get().getOutput());
          } else {
            item.addAssignment(output, rand.pick(available));
          }
        }
      }
      for (Signal output : caseOutputs)
        block.addDefault(output, rand.pick(available));

      controlBlocks.add(block);
      logger.debug("Generated case statement on {} with {} cases", selector.getName(), numCases);
    }
  }

  private void generateIfElseChains() {
    int numChains = cfg.num_if_else_chains > 0 ? cfg.num_if_else_chains : DEFAULT_BLOCK_COUNT;
    for (int i = 0; i < numChains; ++i) {
      List<Signal> available = signals.availablePool();
      if (available.size() < 3) {
        logger.debug("Skipping if/else chain {}, only {} pool signals", i, available.size());
        continue;
      }
      IfElseChain block = new IfElseChain();
      List<Signal> sharedOutputs = createSharedRegisters();

      int numBranches = rand.randomInt(2, 4);
      for (int branchIdx = 0; branchIdx < numBranches; ++branchIdx) {
        Branch branch = (branchIdx < numBranches - 1) ? block.addBranch(rand.pick(available)) : block.addElseBranch();
        for (Signal output : sharedOutputs) {
          Optional<Operation> op = Optional.empty();
          if (cfg.generate_sharing_opportunities && rand.randomBool(BRANCH_OPERATION_PROBABILITY)) {
            // Expensive multiplier per branch; the branches are mutually exclusive.
            op = instantiate(OperationKind.MUL, drawOperands(available, 2));
          }
          if (op.isPresent()) {
            branch.addOperation(op.get());
            branch.addAssignment(output, op.get().getOutput());
          } else {
            branch.addAssignment(output, rand.pick(available));
          }
        }
      }

      controlBlocks.add(block);
      logger.debug("Generated if/else chain with {} branches", numBranches);
    }
  }

  private void generateSharingOpportunities() {
    List<Signal> available = signals.availablePool();
    if (available.size() < 4) {
      logger.debug("Skipping sharing groups, only {} pool signals", available.size());
      return;
    }
    int numGroups = rand.randomInt(1, 3);
    for (int g = 0; g < numGroups; ++g) {
      Signal enable = rand.pick(available);
      int opsInGroup = rand.randomInt(2, 3);
      List<Operation> groupOps = new ArrayList<>(opsInGroup);
      for (int i = 0; i < opsInGroup; ++i) {
        List<Signal> operands = drawOperands(available, 2);
        OperationKind kind = rand.randomBool(SHARING_MUL_PROBABILITY) ? OperationKind.MUL : OperationKind.ADD;
        Optional<Operation> op = instantiate(kind, operands);
        if (op.isEmpty()) {
          ++skippedOperations;
          continue;
        }
        operations.add(op.get());
        groupOps.add(op.get());
      }
      if (groupOps.isEmpty())
        continue;
      sharingGroups.add(new SharingGroup(enable, groupOps));
      logger.debug("Generated sharing group on {} with {} operations", enable.getName(), groupOps.size());
    }
  }

  //////////   outputs and labels   //////////

  private void connectOutputs() {
    List<Signal> available = signals.availablePool();
    if (available.isEmpty()) {
      logger.debug("No signals available, outputs stay undriven");
      return;
    }
    for (Signal output : signals.getOutputs()) {
      OutputConnection connection = OutputConnection.connect(output, rand.pick(available));
      if (connection.getCoercion() != OutputConnection.Coercion.Exact)
        logger.debug("Output {} ({} bits) driven by {} ({} bits) without width adjustment", output.getName(), output.getWidth(),
                     connection.getSource().getName(), connection.getSource().getWidth());
      outputConnections.add(connection);
    }
  }

  private void assignDepths() {
    if (depthMode == DepthMode.Cyclic) {
      DepthAssigner.assignCyclic(operations, cfg.max_depth);
      return;
    }
    int maxDepthSeen = DepthAssigner.assignByDependency(operations);
    if (cfg.num_pipeline_stages > 0)
      DepthAssigner.tagStagesByDependency(operations, cfg.num_pipeline_stages, maxDepthSeen);
  }

  //////////   NetlistRO   //////////

  @Override
  public String getModuleName() {
    return cfg.module_name;
  }
  @Override
  public long getSeed() {
    return cfg.seed;
  }
  @Override
  public int getNumPipelineStages() {
    return cfg.num_pipeline_stages;
  }
  @Override
  public List<Signal> getInputs() {
    return signals.getInputs();
  }
  @Override
  public List<Signal> getOutputs() {
    return signals.getOutputs();
  }
  @Override
  public List<Signal> getWires() {
    return signals.getWires();
  }
  @Override
  public List<Signal> getRegisters() {
    return signals.getRegisters();
  }
  @Override
  public List<Operation> getOperations() {
    return Collections.unmodifiableList(operations);
  }
  @Override
  public List<ControlBlock> getControlBlocks() {
    return Collections.unmodifiableList(controlBlocks);
  }
  @Override
  public List<SharingGroup> getSharingGroups() {
    return Collections.unmodifiableList(sharingGroups);
  }
  @Override
  public List<OutputConnection> getOutputConnections() {
    return Collections.unmodifiableList(outputConnections);
  }

  /** Number of operation attempts dropped for lack of operands or an oversized output width. */
  public int getSkippedOperations() { return skippedOperations; }

  /** The signal arena of this run. */
  public SignalRegistry getSignals() { return signals; }
}
