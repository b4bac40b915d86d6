package dpgen.ui;

import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GeneratorConfigTest {

  static void assertInvalid(Consumer<GeneratorConfig> change) {
    GeneratorConfig cfg = new GeneratorConfig();
    change.accept(cfg);
    Assertions.assertThrows(ConfigException.class, () -> cfg.validate());
  }

  @Test
  void testDefaultsAreValid() throws ConfigException {
    GeneratorConfig cfg = new GeneratorConfig();
    cfg.validate();
    Assertions.assertEquals("random_datapath", cfg.module_name);
    Assertions.assertEquals(8, cfg.num_inputs);
    Assertions.assertEquals(50, cfg.num_operations);
    Assertions.assertEquals("cyclic", cfg.depth_mode);
    Assertions.assertEquals(7, cfg.categoryWeights().length);
    Assertions.assertEquals(0.25, cfg.arithmeticWeights()[2]);
    Assertions.assertEquals(0.2, cfg.shiftWeights()[2]);
    cfg.print(LogManager.getLogger());
  }

  @Test
  void testRanges() {
    assertInvalid(cfg -> cfg.num_inputs = 0);
    assertInvalid(cfg -> cfg.num_inputs = 1001);
    assertInvalid(cfg -> cfg.num_outputs = 0);
    assertInvalid(cfg -> cfg.input_width_min = 0);
    assertInvalid(cfg -> {
      cfg.input_width_min = 16;
      cfg.input_width_max = 8;
    });
    assertInvalid(cfg -> cfg.output_width_max = 4);
    assertInvalid(cfg -> cfg.num_operations = 0);
    assertInvalid(cfg -> cfg.max_depth = 0);
    assertInvalid(cfg -> cfg.num_pipeline_stages = -1);
    assertInvalid(cfg -> cfg.num_case_statements = -2);
    assertInvalid(cfg -> cfg.cases_per_statement = 0);
  }

  @Test
  void testNames() {
    assertInvalid(cfg -> cfg.module_name = "3bad");
    assertInvalid(cfg -> cfg.module_name = "has space");
    assertInvalid(cfg -> cfg.module_name = null);
    assertInvalid(cfg -> cfg.depth_mode = "topological");
    assertInvalid(cfg -> cfg.output_file = "");
  }

  @Test
  void testWeights() throws ConfigException {
    assertInvalid(cfg -> {
      cfg.weight_arithmetic = cfg.weight_logical = cfg.weight_comparison = cfg.weight_shift = 0;
      cfg.weight_mux = cfg.weight_concat = cfg.weight_reduction = 0;
    });
    assertInvalid(cfg -> cfg.weight_add = cfg.weight_sub = cfg.weight_mult = cfg.weight_div = cfg.weight_mod = 0);
    assertInvalid(cfg -> cfg.weight_sll = cfg.weight_srl = cfg.weight_sra = 0);

    GeneratorConfig noShift = new GeneratorConfig();
    noShift.weight_shift = 0;
    noShift.weight_sll = noShift.weight_srl = noShift.weight_sra = 0;
    noShift.validate();

    GeneratorConfig negative = new GeneratorConfig();
    negative.weight_logical = -1;
    negative.validate();
  }
}
