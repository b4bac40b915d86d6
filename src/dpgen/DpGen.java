package dpgen;

import dpgen.generator.NetlistGenerator;
import dpgen.hdl.TestbenchEmitter;
import dpgen.hdl.VerilogEmitter;
import dpgen.netlist.NetlistRO;
import dpgen.ui.GeneratorConfig;
import dpgen.util.FileWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point for one generator run: builds the netlist and renders it (and optionally its testbench) to files.
 */
public class DpGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final GeneratorConfig cfg;
  private String timestamp = null;

  /**
   * @param cfg a validated configuration
   */
  public DpGen(GeneratorConfig cfg) { this.cfg = cfg; }

  /** Sets the generation time printed into the file headers; no time is printed if not set. */
  public void SetTimestamp(String timestamp) { this.timestamp = timestamp; }

  /** Builds the netlist without rendering it. */
  public NetlistRO GenerateNetlist() {
    NetlistGenerator generator = new NetlistGenerator(cfg);
    generator.generate();
    return generator;
  }

  /** Path of the testbench file for an output file: tb_&lt;name&gt; in the same directory. */
  public static String TestbenchFile(String outputFile) {
    Path outPath = Paths.get(outputFile);
    return outPath.resolveSibling("tb_" + outPath.getFileName().toString()).toString();
  }

  /**
   * Builds the netlist and registers the rendered files with a FileWriter.
   * @param toFile the file collection to add the module (and testbench) to
   * @return the generated netlist
   */
  public NetlistRO GenerateFiles(FileWriter toFile) {
    NetlistRO netlist = GenerateNetlist();

    VerilogEmitter verilog = new VerilogEmitter(netlist);
    verilog.setTimestamp(timestamp);
    toFile.UpdateContent(cfg.output_file, verilog.emit());

    if (cfg.generate_testbench) {
      TestbenchEmitter testbench = new TestbenchEmitter(netlist);
      testbench.setTimestamp(timestamp);
      toFile.UpdateContent(TestbenchFile(cfg.output_file), testbench.emit());
    }
    return netlist;
  }

  /**
   * Generates and writes all files.
   * @return true on success, false if a file could not be written
   */
  public boolean Generate() {
    FileWriter toFile = new FileWriter("");
    NetlistRO netlist = GenerateFiles(toFile);
    try {
      toFile.WriteFiles();
    } catch (UncheckedIOException e) {
      logger.fatal("Generation of " + cfg.module_name + " failed: " + e.getCause().getMessage());
      return false;
    }
    logger.info("Successfully generated: {} ({} operations, {} control blocks)", cfg.output_file, netlist.getOperations().size(),
                netlist.getControlBlocks().size());
    if (cfg.generate_testbench)
      logger.info("Successfully generated testbench: {}", TestbenchFile(cfg.output_file));
    return true;
  }
}
