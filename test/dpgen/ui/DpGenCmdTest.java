package dpgen.ui;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DpGenCmdTest {

  @TempDir Path tempDir;

  /** File content without the generation time, which differs between runs. */
  static String readStable(Path file) throws IOException {
    return Files.readAllLines(file, StandardCharsets.UTF_8)
        .stream()
        .filter(line -> !line.startsWith("// Generated:"))
        .collect(Collectors.joining("\n"));
  }

  @Test
  void testGenerate() throws IOException {
    Path out = tempDir.resolve("sub/dp.v");
    int ret = DpGenCmd.run(new String[] {"-q", "-o", out.toString(), "-m", "dp_top", "-s", "42", "-n", "30", "-i", "4", "-O", "2"});
    Assertions.assertEquals(0, ret);
    String text = Files.readString(out, StandardCharsets.UTF_8);
    Assertions.assertTrue(text.contains("module dp_top ("));
    Assertions.assertTrue(text.contains("// Seed: 42"));
    Assertions.assertTrue(text.contains("// Inputs: 4"));
    Assertions.assertTrue(text.contains("// Outputs: 2"));
    Assertions.assertTrue(text.contains("// Generated:"));
    Assertions.assertTrue(text.endsWith("endmodule\n"));
    Assertions.assertFalse(Files.exists(tempDir.resolve("sub/tb_dp.v")));
  }

  @Test
  void testSameSeedSameOutput() throws IOException {
    Path first = tempDir.resolve("a.v");
    Path second = tempDir.resolve("b.v");
    Assertions.assertEquals(0, DpGenCmd.run(new String[] {"-q", "-o", first.toString(), "-s", "1234", "-p", "2"}));
    Assertions.assertEquals(0, DpGenCmd.run(new String[] {"-q", "-o", second.toString(), "-s", "1234", "-p", "2"}));
    Assertions.assertEquals(readStable(first), readStable(second));
  }

  @Test
  void testTestbench() throws IOException {
    Path out = tempDir.resolve("mod.v");
    Assertions.assertEquals(0, DpGenCmd.run(new String[] {"-q", "-t", "-o", out.toString(), "-m", "mod"}));
    Path testbench = tempDir.resolve("tb_mod.v");
    Assertions.assertTrue(Files.exists(testbench));
    Assertions.assertTrue(Files.readString(testbench, StandardCharsets.UTF_8).contains("module tb_mod;"));
  }

  @Test
  void testConfigFileWithOverride() throws IOException {
    Path cfgFile = tempDir.resolve("cfg.yaml");
    Path out = tempDir.resolve("cfg.v");
    Files.writeString(cfgFile,
                      "module_name: from_file\nseed: 5\nnum_inputs: 3\ngenerate_case_statements: true\noutput_file: ignored.v\n",
                      StandardCharsets.UTF_8);
    Assertions.assertEquals(0, DpGenCmd.run(new String[] {"-q", "-c", cfgFile.toString(), "-o", out.toString(), "-i", "6"}));
    String text = Files.readString(out, StandardCharsets.UTF_8);
    Assertions.assertTrue(text.contains("module from_file ("));
    Assertions.assertTrue(text.contains("// Inputs: 6"));
    Assertions.assertTrue(text.contains("case ("));
  }

  @Test
  void testInvalidOptions() throws IOException {
    Path out = tempDir.resolve("x.v");
    Assertions.assertEquals(1, DpGenCmd.run(new String[] {"-q", "-o", out.toString(), "-n", "abc"}));
    Assertions.assertEquals(1, DpGenCmd.run(new String[] {"-q", "-o", out.toString(), "-s", "0x12"}));
    Assertions.assertEquals(1, DpGenCmd.run(new String[] {"-q", "-o", out.toString(), "-i", "0"}));
    Assertions.assertEquals(1, DpGenCmd.run(new String[] {"-q", "-o", out.toString(), "-m", "not valid"}));
    Assertions.assertEquals(1, DpGenCmd.run(new String[] {"-q", "-o", out.toString(), "-c", tempDir.resolve("none.yaml").toString()}));
    Assertions.assertEquals(1, DpGenCmd.run(new String[] {"--no-such-option"}));
    Assertions.assertFalse(Files.exists(out));
  }

  @Test
  void testUnwritableOutput() throws IOException {
    Path dir = tempDir.resolve("taken");
    Files.createDirectories(dir);
    Assertions.assertEquals(1, DpGenCmd.run(new String[] {"-q", "-o", dir.toString()}));
  }

  @Test
  void testHelp() { Assertions.assertEquals(0, DpGenCmd.run(new String[] {"-h"})); }
}
