package dpgen.ui;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

  @TempDir Path tempDir;

  File write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file.toFile();
  }

  @Test
  void testLoad() throws Exception {
    File file = write("cfg.yaml", "seed: 42\n"
                                      + "module_name: alu_mix\n"
                                      + "num_operations: 200\n"
                                      + "weight_mult: 0.5\n"
                                      + "weight_div: 1\n"
                                      + "use_signed: false\n"
                                      + "generate_if_else_chains: 1\n"
                                      + "depth_mode: dependency\n"
                                      + "output_file: out/alu.v\n");
    GeneratorConfig cfg = ConfigLoader.load(file, new GeneratorConfig());
    Assertions.assertEquals(42, cfg.seed);
    Assertions.assertEquals("alu_mix", cfg.module_name);
    Assertions.assertEquals(200, cfg.num_operations);
    Assertions.assertEquals(0.5, cfg.weight_mult);
    Assertions.assertEquals(1.0, cfg.weight_div);
    Assertions.assertFalse(cfg.use_signed);
    Assertions.assertTrue(cfg.generate_if_else_chains);
    Assertions.assertEquals("dependency", cfg.depth_mode);
    Assertions.assertEquals("out/alu.v", cfg.output_file);
    // untouched options keep their defaults
    Assertions.assertEquals(8, cfg.num_inputs);
    cfg.validate();
  }

  @Test
  void testLargeSeed() throws Exception {
    GeneratorConfig cfg = ConfigLoader.load(write("seed.yaml", "seed: -6733423670758169604\n"), new GeneratorConfig());
    Assertions.assertEquals(-6733423670758169604L, cfg.seed);
    Assertions.assertThrows(ConfigException.class,
                            () -> ConfigLoader.load(write("huge.yaml", "seed: 99999999999999999999999\n"), new GeneratorConfig()));
  }

  @Test
  void testUnknownKeyIgnored() throws Exception {
    GeneratorConfig cfg = ConfigLoader.load(write("unknown.yaml", "use_tristate: 1\nnum_inputs: 3\n"), new GeneratorConfig());
    Assertions.assertEquals(3, cfg.num_inputs);
  }

  @Test
  void testEmptyFile() throws Exception {
    GeneratorConfig cfg = ConfigLoader.load(write("empty.yaml", ""), new GeneratorConfig());
    Assertions.assertEquals(50, cfg.num_operations);
  }

  @Test
  void testWrongTypes() throws IOException {
    File notInt = write("a.yaml", "num_inputs: many\n");
    File notBool = write("b.yaml", "use_signed: 2\n");
    File notNumber = write("c.yaml", "weight_add: [1, 2]\n");
    File intOverflow = write("d.yaml", "num_operations: 3000000000\n");
    File fractionalInt = write("e.yaml", "max_depth: 2.5\n");
    for (File file : new File[] {notInt, notBool, notNumber, intOverflow, fractionalInt})
      Assertions.assertThrows(ConfigException.class, () -> ConfigLoader.load(file, new GeneratorConfig()), file.getName());
  }

  @Test
  void testBadFiles() throws IOException {
    File missing = tempDir.resolve("missing.yaml").toFile();
    ConfigException ex = Assertions.assertThrows(ConfigException.class, () -> ConfigLoader.load(missing, new GeneratorConfig()));
    Assertions.assertTrue(ex.getMessage().contains("missing.yaml"));

    File malformed = write("malformed.yaml", "seed: [1, 2\n");
    Assertions.assertThrows(ConfigException.class, () -> ConfigLoader.load(malformed, new GeneratorConfig()));

    File list = write("list.yaml", "- seed\n- 42\n");
    Assertions.assertThrows(ConfigException.class, () -> ConfigLoader.load(list, new GeneratorConfig()));
  }
}
