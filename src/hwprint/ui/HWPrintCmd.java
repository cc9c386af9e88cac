package hwprint.ui;

import hwprint.HWPrint;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class HWPrintCmd {
  // logging
  protected static Logger logger = null;

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("hwprintcmd - elaborate printf messages of a module description into FIRRTL", options);
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
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("messages.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the modules, their signals and printf messages")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files; results by default")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with tool options (clock_name, default_mode, pass_through_directives, indent)")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Runs the tool without terminating the JVM.
   * @return the exit status: 0 on success, 1 on any failure
   */
  static int run(String[] args) {
    if (logger == null)
      logger = LogManager.getLogger();
    Options options = createOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    String inputFileName;
    String configFileName;
    String outputDir;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelp(options);
        return 0;
      }

      inputFileName = line.getOptionValue("i");
      configFileName = line.getOptionValue("c");
      outputDir = (line.hasOption("o") ? line.getOptionValue("o") : "results");

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 1;
    }

    //////////   elaborate the description and write the IR   //////////
    try {
      HWPrintConfig cfg = new HWPrintConfig();
      if (configFileName != null) {
        try (InputStream in = new FileInputStream(configFileName)) {
          cfg = HWPrintConfig.load(in);
        }
      }
      HWPrint shim = new HWPrint(cfg);
      new DescriptionReader(shim).Read(new File(inputFileName));
      if (shim.GetModules().isEmpty())
        logger.warn("{} describes no modules", inputFileName);
      return shim.Generate(outputDir) ? 0 : 1;
    } catch (IOException e) {
      logger.error("Cannot read the input files: {}", e.getMessage());
      return 1;
    } catch (RuntimeException e) {
      logger.error("Elaboration failed: {}", e.getMessage());
      logger.debug("Elaboration failure", e);
      return 1;
    }
  }
}
