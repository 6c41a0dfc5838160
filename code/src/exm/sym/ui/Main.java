/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sym.ui;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.sym.common.Logging;
import exm.sym.common.Settings;
import exm.sym.common.exceptions.InvalidOptionException;
import exm.sym.common.exceptions.SymFatal;
import exm.sym.common.exceptions.SymRuntimeError;
import exm.sym.tclbackend.tree.Proc;

/**
 * Command line interface to the sym compiler.  Some options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String EXPR_FLAG = "e";
  private static final String TCL_FLAG = "t";
  private static final String VALUE_FLAG = "v";
  private static final String PROC_NAME_FLAG = "n";
  private static final String OUTPUT_FLAG = "o";

  public static void main(String[] args) {
    try {
      Settings.initProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args symArgs = processArgs(args);

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String program = readProgram(symArgs);

    // Buffer output so we don't create invalid output in case of errors
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream out = utf8Stream(buffer);
    try {
      SymCompiler sym = new SymCompiler(logger, symArgs.mode,
                                        symArgs.bindings);
      sym.compile(program, out);
      writeOutput(buffer.toByteArray(), symArgs.outputFilename);
    } catch (SymFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option expr = new Option(EXPR_FLAG, "expr", true,
                    "Statement to compile, may be repeated");
    opts.addOption(expr);

    opts.addOption(TCL_FLAG, "tcl", false,
                   "Emit a Tcl procedure for the last expression");

    Option value = new Option(VALUE_FLAG, "value", true,
                    "Evaluate the last expression with name=value");
    value.setArgs(2);
    value.setValueSeparator('=');
    opts.addOption(value);

    opts.addOption(PROC_NAME_FLAG, "name", true,
                   "Name of the generated Tcl procedure");
    opts.addOption(OUTPUT_FLAG, "output", true,
                   "Write output to file instead of stdout");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    if (cmd.hasOption(TCL_FLAG) && cmd.hasOption(VALUE_FLAG)) {
      System.err.println("Options -" + TCL_FLAG + " and -" + VALUE_FLAG +
                         " cannot be combined");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    SymCompiler.OutputMode mode = SymCompiler.OutputMode.CANONICAL;
    if (cmd.hasOption(TCL_FLAG)) {
      mode = SymCompiler.OutputMode.TCL;
    } else if (cmd.hasOption(VALUE_FLAG)) {
      mode = SymCompiler.OutputMode.EVALUATE;
    }

    if (cmd.hasOption(PROC_NAME_FLAG)) {
      String procName = cmd.getOptionValue(PROC_NAME_FLAG);
      try {
        Proc.checkTclFunctionName(procName);
      } catch (SymRuntimeError ex) {
        System.err.println(ex.getMessage());
        System.exit(ExitCode.ERROR_COMMAND.code());
      }
      Settings.set(Settings.CODEGEN_PROC_NAME, procName);
    }

    Map<String, Double> bindings = new HashMap<String, Double>();
    Properties values = cmd.getOptionProperties(VALUE_FLAG);
    for (String name: values.stringPropertyNames()) {
      String val = values.getProperty(name);
      try {
        bindings.put(name, Double.parseDouble(val));
      } catch (NumberFormatException ex) {
        System.err.println("Invalid value for " + name + ": " + val);
        System.exit(ExitCode.ERROR_COMMAND.code());
      }
    }

    String[] exprs = cmd.getOptionValues(EXPR_FLAG);
    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length > 1 ||
        (exprs != null && remainingArgs.length > 0)) {
      System.err.println("Expected -" + EXPR_FLAG + " statements or at " +
            "most one input file, but got " + remainingArgs.length +
            " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String inputFilename = remainingArgs.length == 1 ? remainingArgs[0] : null;
    String statements = exprs == null ? null : StringUtils.join(exprs, '\n');
    return new Args(mode, bindings, statements, inputFilename,
                    cmd.getOptionValue(OUTPUT_FLAG));
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("sym [options] [input-file]", opts, false);
    System.out.println("Without an input file or -" + EXPR_FLAG +
                       ", statements are read from stdin");
  }

  /**
   * Program text from -e options, the input file, or stdin
   */
  private static String readProgram(Args args) {
    if (args.statements != null) {
      return args.statements;
    }
    try {
      if (args.inputFilename != null) {
        File input = new File(args.inputFilename);
        if (!input.isFile() || !input.canRead()) {
          System.err.println("Input file \"" + input + "\" is not readable");
          System.exit(ExitCode.ERROR_IO.code());
        }
        return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
      } else {
        return IOUtils.toString(System.in, StandardCharsets.UTF_8);
      }
    } catch (IOException ex) {
      System.err.println("Error reading input: " + ex.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  private static void writeOutput(byte[] output, String outputFilename) {
    try {
      if (outputFilename == null) {
        System.out.write(output);
        System.out.flush();
      } else {
        FileUtils.writeByteArrayToFile(new File(outputFilename), output);
      }
    } catch (IOException ex) {
      System.err.println("Error writing output: " + ex.getMessage());
      throw new SymFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static PrintStream utf8Stream(ByteArrayOutputStream buffer) {
    try {
      return new PrintStream(buffer, true, StandardCharsets.UTF_8.name());
    } catch (UnsupportedEncodingException ex) {
      throw new SymRuntimeError("UTF-8 not supported", ex);
    }
  }

  private static class Args {
    public final SymCompiler.OutputMode mode;
    public final Map<String, Double> bindings;
    /** newline-separated statements from the command line, or null */
    public final String statements;
    public final String inputFilename;
    public final String outputFilename;

    public Args(SymCompiler.OutputMode mode, Map<String, Double> bindings,
                String statements, String inputFilename,
                String outputFilename) {
      this.mode = mode;
      this.bindings = bindings;
      this.statements = statements;
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
    }
  }
}
