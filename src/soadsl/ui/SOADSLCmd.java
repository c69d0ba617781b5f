package soadsl.ui;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import soadsl.SOADSL;
import soadsl.convert.ConversionException;
import soadsl.drc.ValidationReport;
import soadsl.frontend.SpecParseException;
import soadsl.library.LibraryException;
import soadsl.model.SOADocument;
import soadsl.util.FileWriter;

public class SOADSLCmd {
  protected static Logger logger = null;

  public static final List<String> COMMANDS = List.of("validate", "convert", "generate", "compile");

  static Options options = new Options();

  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("soadsl <validate|convert|generate|compile> -i <rules.yaml> - compile SOA rules into Spectre monitors", options);
    System.exit(-1);
  };

  public static void main(String[] args) {
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_ERR);
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();
    SOADSLConfig config = new SOADSLConfig();

    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("rules.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML file with universal rules or monitor definitions")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("Output file (netlist for generate/compile, monitor YAML for convert); stdout by default")
                          .build());
    options.addOption(Option.builder("d")
                          .longOpt("devices")
                          .argName("devices.yaml")
                          .hasArg()
                          .required(false)
                          .desc("Device library, " + config.devices_path + " by default")
                          .build());
    options.addOption(Option.builder("m")
                          .longOpt("monitors")
                          .argName("monitors.yaml")
                          .hasArg()
                          .required(false)
                          .desc("Monitor library, " + config.monitors_path + " by default")
                          .build());
    options.addOption(Option.builder("s").longOpt("strict").required(false).desc("Treat validation warnings as errors").build());
    options.addOption(Option.builder("n").longOpt("no-validate").required(false).desc("Generate without validating first").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    String command = "";
    String input = "";
    try {
      CommandLine line = parser.parse(options, args);

      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }
      List<String> positional = line.getArgList();
      if (positional.size() != 1 || !COMMANDS.contains(positional.get(0))) {
        System.err.println("Expected exactly one command out of " + COMMANDS);
        printHelpAndExit(options);
      }
      command = positional.get(0);
      if (!line.hasOption("i")) {
        System.err.println("Missing input file (-i)");
        printHelpAndExit(options);
      }
      input = line.getOptionValue("i");
      if (line.hasOption("d"))
        config.devices_path = line.getOptionValue("d");
      if (line.hasOption("m"))
        config.monitors_path = line.getOptionValue("m");
      config.output = line.getOptionValue("o");
      config.strict = line.hasOption("s");
      config.skip_validation = line.hasOption("n");

      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException exp) {
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    }

    System.exit(run(command, input, config));
  }

  /**
   * Runs one command.
   *
   * @return the process exit status: 0 on success, 1 on failed validation or any error
   */
  public static int run(String command, String input, SOADSLConfig config) {
    if (logger == null)
      logger = LogManager.getLogger();
    try {
      SOADSL compiler = SOADSL.fromConfig(config);
      SOADocument document = compiler.parse(Paths.get(input));
      switch (command) {
      case "validate": {
        ValidationReport report = compiler.validate(document);
        System.out.print(report.format());
        return report.passed(config.strict) ? 0 : 1;
      }
      case "convert":
        emit(compiler.toYaml(compiler.convert(document)), config);
        return 0;
      case "generate":
        if (!config.skip_validation) {
          ValidationReport report = compiler.validate(document);
          if (report.hasErrors()) {
            logger.warn("SOADSLCmd. Validation found {} errors, generating anyway", report.getErrors().size());
            System.err.print(report.format());
          }
        }
        emit(compiler.generate(document), config);
        return 0;
      case "compile": {
        SOADSL.Compilation result = compiler.compile(document, config.strict, false);
        if (!result.succeeded()) {
          System.err.print(result.report().format());
          return 1;
        }
        if (!result.report().getWarnings().isEmpty())
          result.report().getWarnings().forEach(warning -> logger.warn(warning.toString()));
        emit(result.netlist(), config);
        return 0;
      }
      default:
        logger.error("Unknown command {}", command);
        return 1;
      }
    } catch (LibraryException | SpecParseException | ConversionException e) {
      logger.error(e.getMessage());
      System.err.println("Error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.error("Cannot write output: {}", e.getMessage());
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static void emit(String text, SOADSLConfig config) throws IOException {
    if (config.output == null) {
      System.out.print(text);
      return;
    }
    new FileWriter().WriteFile(config.output, text);
  }
}
