package dpgen.ui;

import dpgen.generator.DepthMode;
import org.apache.logging.log4j.Logger;

/**
 * Data-Class to hold generator options. Field names double as the keys of the YAML configuration file.
 */
public class GeneratorConfig {

  // randomization
  public long seed = System.currentTimeMillis();

  // module properties
  public String module_name = "random_datapath";
  public int num_inputs = 8;
  public int num_outputs = 4;
  public int input_width_min = 8;
  public int input_width_max = 32;
  public int output_width_min = 8;
  public int output_width_max = 32;

  // datapath complexity
  public int num_operations = 50;
  public int max_depth = 10;
  public int num_pipeline_stages = 0; // 0: combinational only
  /** "cyclic" (index modulo max_depth) or "dependency" (longest path from the inputs) */
  public String depth_mode = "cyclic";

  // category weights, need not sum up to 1
  public double weight_arithmetic = 0.3;
  public double weight_logical = 0.2;
  public double weight_comparison = 0.1;
  public double weight_shift = 0.15;
  public double weight_mux = 0.15;
  public double weight_concat = 0.05;
  public double weight_reduction = 0.05;

  // arithmetic weights
  public double weight_add = 0.3;
  public double weight_sub = 0.3;
  public double weight_mult = 0.25;
  public double weight_div = 0.1;
  public double weight_mod = 0.05;

  // shift weights
  public double weight_sll = 0.4;
  public double weight_srl = 0.4;
  public double weight_sra = 0.2;

  public boolean use_signed = true;

  // control flow for resource sharing tests
  public boolean generate_case_statements = false;
  public boolean generate_if_else_chains = false;
  public boolean generate_sharing_opportunities = false;
  public int num_case_statements = 0;
  public int num_if_else_chains = 0;
  public int cases_per_statement = 4;

  // output
  public String output_file = "output.v";
  public boolean generate_testbench = false;

  /** Category weights in draw order: arithmetic, logical, comparison, shift, mux, concat, reduction. */
  public double[] categoryWeights() {
    return new double[] {weight_arithmetic, weight_logical, weight_comparison, weight_shift, weight_mux, weight_concat, weight_reduction};
  }

  /** Arithmetic weights in draw order: add, sub, mul, div, mod. */
  public double[] arithmeticWeights() { return new double[] {weight_add, weight_sub, weight_mult, weight_div, weight_mod}; }

  /** Shift weights in draw order: shift left, logical shift right, arithmetic shift right. */
  public double[] shiftWeights() { return new double[] {weight_sll, weight_srl, weight_sra}; }

  /**
   * Checks the configuration for consistency.
   * @throws ConfigException describing the first violated constraint
   */
  public void validate() throws ConfigException {
    if (module_name == null || !module_name.matches("[A-Za-z_][A-Za-z0-9_$]*"))
      throw new ConfigException("module_name must be a valid Verilog identifier, got '" + module_name + "'");
    if (num_inputs < 1 || num_inputs > 1000)
      throw new ConfigException("num_inputs must be between 1 and 1000");
    if (num_outputs < 1 || num_outputs > 1000)
      throw new ConfigException("num_outputs must be between 1 and 1000");
    if (input_width_min < 1 || input_width_min > input_width_max)
      throw new ConfigException("Invalid input width range [" + input_width_min + ", " + input_width_max + "]");
    if (output_width_min < 1 || output_width_min > output_width_max)
      throw new ConfigException("Invalid output width range [" + output_width_min + ", " + output_width_max + "]");
    if (num_operations < 1)
      throw new ConfigException("num_operations must be at least 1");
    if (max_depth < 1)
      throw new ConfigException("max_depth must be at least 1");
    if (num_pipeline_stages < 0)
      throw new ConfigException("num_pipeline_stages must not be negative");
    if (depth_mode == null || DepthMode.fromSerialName(depth_mode).isEmpty())
      throw new ConfigException("depth_mode must be 'cyclic' or 'dependency', got '" + depth_mode + "'");
    if (num_case_statements < 0 || num_if_else_chains < 0)
      throw new ConfigException("Control block counts must not be negative");
    if (cases_per_statement < 1)
      throw new ConfigException("cases_per_statement must be at least 1");
    if (positiveSum(categoryWeights()) <= 0.0)
      throw new ConfigException("Total operation weight must be positive");
    // Arithmetic kinds are also drawn by case statements, regardless of weight_arithmetic.
    if (positiveSum(arithmeticWeights()) <= 0.0)
      throw new ConfigException("Total arithmetic operation weight must be positive");
    if (weight_shift > 0.0 && positiveSum(shiftWeights()) <= 0.0)
      throw new ConfigException("Total shift operation weight must be positive if weight_shift is set");
    if (output_file == null || output_file.isEmpty())
      throw new ConfigException("No output file selected");
  }

  private static double positiveSum(double[] weights) {
    double sum = 0.0;
    for (double weight : weights)
      if (weight > 0.0)
        sum += weight;
    return sum;
  }

  /** Logs the configuration summary at INFO level. */
  public void print(Logger logger) {
    logger.info("=== Generator Configuration ===");
    logger.info("Seed: {}", seed);
    logger.info("Module: {}", module_name);
    logger.info("Inputs: {} (width: {}-{})", num_inputs, input_width_min, input_width_max);
    logger.info("Outputs: {} (width: {}-{})", num_outputs, output_width_min, output_width_max);
    logger.info("Operations: {}", num_operations);
    logger.info("Max depth: {} ({})", max_depth, depth_mode);
    logger.info("Pipeline stages: {}", num_pipeline_stages);
    logger.info("Case statements: {} (flag {}), if/else chains: {} (flag {}), sharing opportunities: {}", num_case_statements,
                generate_case_statements, num_if_else_chains, generate_if_else_chains, generate_sharing_opportunities);
    logger.info("Output file: {}", output_file);
    logger.info("================================");
  }
}
