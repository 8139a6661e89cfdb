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
package exm.gotoc.ui;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
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

import exm.gotoc.common.Logging;
import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocFatal;
import exm.gotoc.common.exceptions.InvalidOptionException;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * Command line interface.  With no input, writes the machine model
 * environment table as JSON; with -c, checks that a JSON file is a
 * well-formed symbol table.  Most options are passed through
 * Java properties.  See Settings.java for handling of these options.
 */
public class Main {
  private static final String MACHINE_FLAG = "m";
  private static final String PRETTY_FLAG = "p";
  private static final String CHECK_FLAG = "c";
  private static final String NORMALIZE_FLAG = "n";
  private static final String NONDET_FLAG = "d";
  private static final String GEN_C_FLAG = "g";
  private static final String BINARY_FLAG = "b";
  private static final String PROPERTY_FLAG = "D";
  private static final List<File> temporaries = new ArrayList<File>();

  public static void main(String[] args) {
    Args gotocArgs = processArgs(args);

    try {
      Settings.initGotocProperties();
      applyArgs(gotocArgs);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    logger.debug("Arguments: " + StringUtils.join(args, ' '));
    GotocDriver driver = new GotocDriver(logger);
    try {
      if (gotocArgs.checkFilename != null) {
        runCheck(driver, gotocArgs.checkFilename);
      } else {
        runEmit(logger, driver, gotocArgs.outputFilename);
      }
      cleanupFiles(true, gotocArgs);
    } catch (GotocFatal ex) {
      cleanupFiles(false, gotocArgs);
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(new Option(MACHINE_FLAG, "machine", true,
                              "Machine model: x86_64 or aarch64"));
    opts.addOption(PRETTY_FLAG, "pretty", false, "Indent JSON output");
    opts.addOption(new Option(CHECK_FLAG, "check", true,
                              "Check JSON symbol table file and exit"));
    opts.addOption(NORMALIZE_FLAG, "normalize-names", false,
                   "Rewrite symbol names into valid C identifiers");
    opts.addOption(NONDET_FLAG, "nondet-functions", false,
                   "Replace nondet expressions with function calls");
    opts.addOption(GEN_C_FLAG, "gen-c", false,
                   "Rewrite expressions that are not valid C");
    opts.addOption(BINARY_FLAG, "goto-binary", false,
                   "Write goto binary instead of JSON");

    Option prop = new Option(PROPERTY_FLAG, true, "Set gotoc property");
    prop.setArgs(2);
    prop.setValueSeparator('=');
    opts.addOption(prop);
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

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length > 1) {
      System.err.println("Expected optional output file, but got " +
                         remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    String output = remainingArgs.length == 1 ? remainingArgs[0] : null;

    return new Args(output, cmd.getOptionValue(CHECK_FLAG),
                    cmd.getOptionValue(MACHINE_FLAG),
                    cmd.hasOption(PRETTY_FLAG),
                    cmd.hasOption(NORMALIZE_FLAG),
                    cmd.hasOption(NONDET_FLAG),
                    cmd.hasOption(GEN_C_FLAG),
                    cmd.hasOption(BINARY_FLAG),
                    cmd.getOptionProperties(PROPERTY_FLAG));
  }

  /**
   * Command line options override properties from the environment
   */
  private static void applyArgs(Args args) throws InvalidOptionException {
    for (String key: args.properties.stringPropertyNames()) {
      Settings.set(key, args.properties.getProperty(key));
    }
    if (args.machine != null) {
      Settings.set(Settings.MACHINE, args.machine);
    }
    if (args.pretty) {
      Settings.set(Settings.JSON_PRETTY, "true");
    }
    if (args.normalizeNames) {
      Settings.set(Settings.NORMALIZE_NAMES, "true");
    }
    if (args.nondetFunctions) {
      Settings.set(Settings.NONDET_FUNCTIONS, "true");
    }
    if (args.genC) {
      Settings.set(Settings.GEN_C, "true");
    }
    if (args.gotoBinary) {
      Settings.set(Settings.OUTPUT_FORMAT, Settings.OUTPUT_FORMAT_BINARY);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("gotoc [options] [<output>]", opts, true);
  }

  private static void runCheck(GotocDriver driver, String filename) {
    File input = new File(filename);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      throw new GotocFatal(ExitCode.ERROR_IO);
    }
    Reader reader = null;
    try {
      reader = new InputStreamReader(new FileInputStream(input),
                                     StandardCharsets.UTF_8);
      List<String> names = driver.check(reader);
      System.out.println(filename + ": " + names.size() + " symbols");
    } catch (IOException e) {
      System.err.println("Error opening " + input + ": " + e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_IO);
    } finally {
      IOUtils.closeQuietly(reader);
    }
  }

  private static void runEmit(Logger logger, GotocDriver driver,
                              String outputFilename) {
    MachineModel mm;
    boolean binary;
    try {
      mm = MachineModel.fromName(Settings.get(Settings.MACHINE));
      binary = Settings.get(Settings.OUTPUT_FORMAT).equals(
                                          Settings.OUTPUT_FORMAT_BINARY);
    } catch (InvalidOptionException e) {
      System.err.println(e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_COMMAND);
    }
    logger.debug("Machine model: " + mm);

    // Use intermediate file so we don't create invalid output on error
    File tmpOutput = setupTmpOutput();
    OutputStream stream = null;
    try {
      stream = new BufferedOutputStream(new FileOutputStream(tmpOutput));
      SymbolTable table = SymbolTable.withEnvironment(mm);
      if (binary) {
        driver.emitBinary(table, stream);
      } else {
        Writer writer = new OutputStreamWriter(stream,
                                               StandardCharsets.UTF_8);
        driver.emit(table, writer);
      }
      stream.close();
    } catch (IOException e) {
      System.err.println("Error writing " + tmpOutput + ": " +
                         e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_IO);
    } finally {
      IOUtils.closeQuietly(stream);
    }

    if (outputFilename == null) {
      copyToOutput(tmpOutput, System.out);
    } else {
      try {
        OutputStream out = new FileOutputStream(outputFilename);
        try {
          copyToOutput(tmpOutput, out);
        } finally {
          out.close();
        }
      } catch (IOException e) {
        System.err.println("Error opening " + outputFilename + ": " +
                           e.getMessage());
        throw new GotocFatal(ExitCode.ERROR_IO);
      }
    }
  }

  private static File setupTmpOutput() {
    try {
      File result = File.createTempFile("gotoc-out", ".tmp");
      temporaries.add(result);
      return result;
    } catch (IOException e) {
      System.err.println("Error while setting up temporary output: " +
                         e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_IO);
    }
  }

  /**
   * Copy file to output.  In event of failure, throw a fatal error
   */
  private static void copyToOutput(File inputFile, OutputStream output) {
    try {
      // Output stream works with non-seekable devices such as stdout
      FileUtils.copyFile(inputFile, output);
      output.flush();
    } catch (IOException e) {
      System.err.println("Error copying " + inputFile);
      e.printStackTrace();
      throw new GotocFatal(ExitCode.ERROR_IO);
    }
  }

  private static void cleanupFiles(boolean success, Args args) {
    if (!success && args.outputFilename != null) {
      File outFile = new File(args.outputFilename);
      if (outFile.exists()) {
        outFile.delete();
      }
    }
    for (File temp: temporaries) {
      if (temp.exists()) {
        temp.delete();
      }
    }
  }

  private static class Args {
    public final String outputFilename;
    public final String checkFilename;
    public final String machine;
    public final boolean pretty;
    public final boolean normalizeNames;
    public final boolean nondetFunctions;
    public final boolean genC;
    public final boolean gotoBinary;
    public final Properties properties;

    public Args(String outputFilename, String checkFilename, String machine,
                boolean pretty, boolean normalizeNames,
                boolean nondetFunctions, boolean genC, boolean gotoBinary,
                Properties properties) {
      this.outputFilename = outputFilename;
      this.checkFilename = checkFilename;
      this.machine = machine;
      this.pretty = pretty;
      this.normalizeNames = normalizeNames;
      this.nondetFunctions = nondetFunctions;
      this.genC = genC;
      this.gotoBinary = gotoBinary;
      this.properties = properties;
    }
  }
}
