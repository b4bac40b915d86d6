package dpgen.ui;

import dpgen.DpGen;
import java.io.File;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class DpGenCmd {
  // logging
  protected static Logger logger = null;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("dpgen - generate random Verilog datapaths for synthesis tool benchmarking", options);
  }

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    System.exit(run(args));
  }

  static Options createOptions() {
    Options options = new Options();
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with generator options; command line options take precedence")
                          .build());
    options.addOption(Option.builder("o").longOpt("output").argName("file").hasArg().required(false).desc("Output Verilog file").build());
    options.addOption(Option.builder("m").longOpt("module").argName("name").hasArg().required(false).desc("Module name").build());
    options.addOption(
        Option.builder("n").longOpt("num-ops").argName("count").hasArg().required(false).desc("Number of datapath operations").build());
    options.addOption(
        Option.builder("i").longOpt("inputs").argName("count").hasArg().required(false).desc("Number of input ports").build());
    options.addOption(
        Option.builder("O").longOpt("outputs").argName("count").hasArg().required(false).desc("Number of output ports").build());
    options.addOption(Option.builder("s").longOpt("seed").argName("seed").hasArg().required(false).desc("Random seed").build());
    options.addOption(
        Option.builder("d").longOpt("depth").argName("depth").hasArg().required(false).desc("Maximum logic depth").build());
    options.addOption(Option.builder("p")
                          .longOpt("pipeline")
                          .argName("stages")
                          .hasArg()
                          .required(false)
                          .desc("Number of pipeline stages to tag operations with, 0 for none")
                          .build());
    options.addOption(Option.builder("t").longOpt("testbench").required(false).desc("Also generate a testbench tb_<output>").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Runs the generator for a command line.
   * @return the process exit status: 0 on success, 1 on invalid options or failed output
   */
  static int run(String[] args) {
    if (logger == null)
      logger = LogManager.getLogger();
    Options options = createOptions();
    CommandLine line;
    try {
      line = new DefaultParser().parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 1;
    }

    // print help if requested
    if (line.hasOption("h")) {
      printHelp(options);
      return 0;
    }

    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    //////////   collect options   //////////
    GeneratorConfig cfg = new GeneratorConfig();
    try {
      if (line.hasOption("c"))
        ConfigLoader.load(new File(line.getOptionValue("c")), cfg);
      applyOverrides(line, cfg);
      cfg.validate();
    } catch (ConfigException e) {
      logger.error("Invalid configuration: " + e.getMessage());
      return 1;
    }
    if (line.hasOption("v") || line.hasOption("vv"))
      cfg.print(logger);

    //////////   generate   //////////
    DpGen generator = new DpGen(cfg);
    generator.SetTimestamp(LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));
    boolean success = generator.Generate();
    if (success) {
      logger.debug("To synthesize with Yosys: yosys -p \"read_verilog {}; synth -top {}; stat\"", cfg.output_file, cfg.module_name);
      logger.debug("To synthesize with Vivado: read_verilog {} ; synth_design -top {}", cfg.output_file, cfg.module_name);
    }
    return success ? 0 : 1;
  }

  private static void applyOverrides(CommandLine line, GeneratorConfig cfg) throws ConfigException {
    if (line.hasOption("o"))
      cfg.output_file = line.getOptionValue("o");
    if (line.hasOption("m"))
      cfg.module_name = line.getOptionValue("m");
    if (line.hasOption("n"))
      cfg.num_operations = parseInt(line, "n");
    if (line.hasOption("i"))
      cfg.num_inputs = parseInt(line, "i");
    if (line.hasOption("O"))
      cfg.num_outputs = parseInt(line, "O");
    if (line.hasOption("d"))
      cfg.max_depth = parseInt(line, "d");
    if (line.hasOption("p"))
      cfg.num_pipeline_stages = parseInt(line, "p");
    if (line.hasOption("s")) {
      try {
        cfg.seed = Long.parseLong(line.getOptionValue("s"));
      } catch (NumberFormatException e) {
        throw new ConfigException("Option --seed expects an integer, got '" + line.getOptionValue("s") + "'", e);
      }
    }
    if (line.hasOption("t"))
      cfg.generate_testbench = true;
  }

  private static int parseInt(CommandLine line, String opt) throws ConfigException {
    String value = line.getOptionValue(opt);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ConfigException("Option -" + opt + " expects an integer, got '" + value + "'", e);
    }
  }
}
