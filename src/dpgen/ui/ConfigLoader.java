package dpgen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads generator options from a YAML mapping. Keys are the field names of {@link GeneratorConfig}; unknown keys are ignored with a warning.
 * Example:
 * <pre>
 * seed: 42
 * module_name: alu_mix
 * num_operations: 200
 * weight_mult: 0.5
 * generate_if_else_chains: true
 * </pre>
 */
public class ConfigLoader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private ConfigLoader() {}

  /**
   * Applies the options of a YAML file onto a configuration. Does not validate the result.
   * @param file the YAML file
   * @param cfg the configuration to update, usually holding the defaults
   * @return cfg
   * @throws ConfigException if the file cannot be read, is not a YAML mapping or holds values of the wrong type
   */
  public static GeneratorConfig load(File file, GeneratorConfig cfg) throws ConfigException {
    try (InputStream readFile = new FileInputStream(file)) {
      return load(readFile, file.getPath(), cfg);
    } catch (FileNotFoundException e) {
      throw new ConfigException("Could not open config file: " + file.getPath(), e);
    } catch (IOException e) {
      throw new ConfigException("Error reading config file: " + file.getPath(), e);
    }
  }

  /**
   * Applies the options of a YAML document onto a configuration. Does not validate the result.
   * @param in the YAML document
   * @param sourceName name of the document for error messages
   * @param cfg the configuration to update
   * @return cfg
   */
  public static GeneratorConfig load(InputStream in, String sourceName, GeneratorConfig cfg) throws ConfigException {
    Yaml yaml = new Yaml(new LoaderOptions());
    Object readData;
    try {
      readData = yaml.load(in);
    } catch (YAMLException e) {
      throw new ConfigException("Malformed config file " + sourceName + ": " + e.getMessage(), e);
    }
    if (readData == null) {
      logger.warn("Config file {} is empty", sourceName);
      return cfg;
    }
    if (!(readData instanceof Map))
      throw new ConfigException("Config file " + sourceName + " must contain a mapping of option names to values");
    for (Map.Entry<?, ?> setting : ((Map<?, ?>)readData).entrySet())
      applySetting(cfg, String.valueOf(setting.getKey()), setting.getValue(), sourceName);
    return cfg;
  }

  private static void applySetting(GeneratorConfig cfg, String key, Object value, String sourceName) throws ConfigException {
    switch (key) {
    case "seed":
      cfg.seed = asLong(key, value);
      break;
    case "module_name":
      cfg.module_name = asString(key, value);
      break;
    case "num_inputs":
      cfg.num_inputs = asInt(key, value);
      break;
    case "num_outputs":
      cfg.num_outputs = asInt(key, value);
      break;
    case "input_width_min":
      cfg.input_width_min = asInt(key, value);
      break;
    case "input_width_max":
      cfg.input_width_max = asInt(key, value);
      break;
    case "output_width_min":
      cfg.output_width_min = asInt(key, value);
      break;
    case "output_width_max":
      cfg.output_width_max = asInt(key, value);
      break;
    case "num_operations":
      cfg.num_operations = asInt(key, value);
      break;
    case "max_depth":
      cfg.max_depth = asInt(key, value);
      break;
    case "num_pipeline_stages":
      cfg.num_pipeline_stages = asInt(key, value);
      break;
    case "depth_mode":
      cfg.depth_mode = asString(key, value);
      break;
    case "weight_arithmetic":
      cfg.weight_arithmetic = asDouble(key, value);
      break;
    case "weight_logical":
      cfg.weight_logical = asDouble(key, value);
      break;
    case "weight_comparison":
      cfg.weight_comparison = asDouble(key, value);
      break;
    case "weight_shift":
      cfg.weight_shift = asDouble(key, value);
      break;
    case "weight_mux":
      cfg.weight_mux = asDouble(key, value);
      break;
    case "weight_concat":
      cfg.weight_concat = asDouble(key, value);
      break;
    case "weight_reduction":
      cfg.weight_reduction = asDouble(key, value);
      break;
    case "weight_add":
      cfg.weight_add = asDouble(key, value);
      break;
    case "weight_sub":
      cfg.weight_sub = asDouble(key, value);
      break;
    case "weight_mult":
      cfg.weight_mult = asDouble(key, value);
      break;
    case "weight_div":
      cfg.weight_div = asDouble(key, value);
      break;
    case "weight_mod":
      cfg.weight_mod = asDouble(key, value);
      break;
    case "weight_sll":
      cfg.weight_sll = asDouble(key, value);
      break;
    case "weight_srl":
      cfg.weight_srl = asDouble(key, value);
      break;
    case "weight_sra":
      cfg.weight_sra = asDouble(key, value);
      break;
    case "use_signed":
      cfg.use_signed = asBoolean(key, value);
      break;
    case "generate_case_statements":
      cfg.generate_case_statements = asBoolean(key, value);
      break;
    case "generate_if_else_chains":
      cfg.generate_if_else_chains = asBoolean(key, value);
      break;
    case "generate_sharing_opportunities":
      cfg.generate_sharing_opportunities = asBoolean(key, value);
      break;
    case "num_case_statements":
      cfg.num_case_statements = asInt(key, value);
      break;
    case "num_if_else_chains":
      cfg.num_if_else_chains = asInt(key, value);
      break;
    case "cases_per_statement":
      cfg.cases_per_statement = asInt(key, value);
      break;
    case "output_file":
      cfg.output_file = asString(key, value);
      break;
    case "generate_testbench":
      cfg.generate_testbench = asBoolean(key, value);
      break;
    default:
      logger.warn("Unknown config key '{}' in {}", key, sourceName);
    }
  }

  private static long asLong(String key, Object value) throws ConfigException {
    if (value instanceof Integer || value instanceof Long)
      return ((Number)value).longValue();
    if (value instanceof BigInteger && ((BigInteger)value).bitLength() < 64)
      return ((BigInteger)value).longValue();
    throw new ConfigException("Option '" + key + "' expects an integer, got '" + value + "'");
  }

  private static int asInt(String key, Object value) throws ConfigException {
    long ret = asLong(key, value);
    if (ret < Integer.MIN_VALUE || ret > Integer.MAX_VALUE)
      throw new ConfigException("Option '" + key + "' is out of range: " + value);
    return (int)ret;
  }

  private static double asDouble(String key, Object value) throws ConfigException {
    if (value instanceof Number)
      return ((Number)value).doubleValue();
    throw new ConfigException("Option '" + key + "' expects a number, got '" + value + "'");
  }

  private static boolean asBoolean(String key, Object value) throws ConfigException {
    if (value instanceof Boolean)
      return (Boolean)value;
    // flags may also be written as 1/0
    if (value instanceof Integer && ((Integer)value == 0 || (Integer)value == 1))
      return (Integer)value == 1;
    throw new ConfigException("Option '" + key + "' expects true or false, got '" + value + "'");
  }

  private static String asString(String key, Object value) throws ConfigException {
    if (value instanceof String || value instanceof Number)
      return value.toString();
    throw new ConfigException("Option '" + key + "' expects a string, got '" + value + "'");
  }
}
