package hdlgen.ui;

import hdlgen.HDLGen;
import hdlgen.except.IRException;
import hdlgen.except.UserException;
import hdlgen.generator.Context;
import hdlgen.generator.Generator;
import hdlgen.serialize.GraphDeserializer;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;

public class HDLGenCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("hdlgencmd - generate SystemVerilog from a serialized design", options);
    System.exit(-1);
  };

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

    CommandLineParser parser = new DefaultParser();

    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("design.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file holding the serialized design")
                          .build());
    options.addOption(Option.builder("t")
                          .longOpt("top")
                          .argName("module name")
                          .hasArg()
                          .required(false)
                          .desc("Top module to generate; may be omitted if the design has a single root module")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("outdir")
                          .argName("directory")
                          .hasArg()
                          .required(false)
                          .desc("Directory to generate output-files, 'results' by default")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with code generation options")
                          .build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    String designFile = "";
    String topName = null;
    String outputDir = "";
    String configFile = null;
    try {
      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      // print help if requested
      if (line.hasOption("h")) {
        printHelpAndExit(options);
      }

      designFile = line.getOptionValue("i");
      topName = line.getOptionValue("t");
      outputDir = (line.hasOption("o") ? line.getOptionValue("o") : "results");
      configFile = line.getOptionValue("c");

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
      printHelpAndExit(options);
    }

    //////////   read config and design   //////////
    HDLGenConfig config = new HDLGenConfig();
    Generator top;
    try {
      if (configFile != null)
        config = readConfig(configFile);
      Context context = readDesign(designFile);
      top = selectTop(context, topName);
    } catch (IOException e) {
      logger.error("Input file could not be read: {}", e.getMessage());
      System.exit(1);
      return;
    } catch (IRException e) {
      logger.error(e.toDiagnostic().toString());
      System.exit(1);
      return;
    }

    //////////   lower the design and write the modules   //////////
    HDLGen hdlgen = new HDLGen(config);
    boolean success = hdlgen.Generate(top, outputDir);

    System.exit(success ? 0 : 1);
  }

  private static HDLGenConfig readConfig(String configFile) throws IOException {
    try (Reader reader = new InputStreamReader(new FileInputStream(configFile), StandardCharsets.UTF_8)) {
      return HDLGenConfig.load(reader);
    }
  }

  private static Context readDesign(String designFile) throws IOException {
    try (Reader reader = new InputStreamReader(new FileInputStream(designFile), StandardCharsets.UTF_8)) {
      Context context = GraphDeserializer.restore(reader);
      logger.info("Read {} module(s) from {}", context.getGenerators().size(), designFile);
      return context;
    }
  }

  /** Picks the top module: the named one, or the only root if no name is given. */
  static Generator selectTop(Context context, String topName) {
    if (topName != null)
      return context.getGenerator(topName);
    List<Generator> roots = context.getRoots();
    if (roots.size() != 1)
      throw new UserException("design has " + roots.size() + " root modules (" +
                              roots.stream().map(Generator::getName).collect(Collectors.joining(", ")) +
                              "), select one with -t");
    return roots.get(0);
  }
}
