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

import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

import org.apache.log4j.Logger;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocFatal;
import exm.gotoc.common.exceptions.IRException;
import exm.gotoc.common.exceptions.InvalidOptionException;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.opt.TransformPipeline;
import exm.gotoc.ir.opt.Validate;
import exm.gotoc.ir.tree.SymbolTable;
import exm.gotoc.irep.GotoBinaryWriter;
import exm.gotoc.irep.IrepJson;

/**
 * Orchestrates the passes between a built symbol table and its JSON
 * or goto binary output.  Errors are reported to stderr and turned into
 * {@link GotocFatal} with the matching exit code.
 */
public class GotocDriver {

  private final Logger logger;
  private final TransformPipeline pipeline;

  public GotocDriver(Logger logger) {
    this(logger, TransformPipeline.standard());
  }

  public GotocDriver(Logger logger, TransformPipeline pipeline) {
    this.logger = logger;
    this.pipeline = pipeline;
  }

  /**
   * Serialized form of a finished table
   */
  private static abstract class Sink {
    abstract void write(SymbolTable table)
        throws IOException, InvalidOptionException;
  }

  /**
   * Run enabled passes over table, optionally validate the result, and
   * write it as JSON.
   * @return the table that was written
   */
  public SymbolTable emit(SymbolTable table, final Writer output) {
    return emit(table, new Sink() {
      @Override
      void write(SymbolTable result)
          throws IOException, InvalidOptionException {
        IrepJson.write(result, output,
                       Settings.getBoolean(Settings.JSON_PRETTY));
        output.flush();
      }
    });
  }

  /**
   * As {@link #emit(SymbolTable, Writer)}, but write a goto binary
   */
  public SymbolTable emitBinary(SymbolTable table, final OutputStream output) {
    return emit(table, new Sink() {
      @Override
      void write(SymbolTable result) throws IOException {
        GotoBinaryWriter.write(result, output);
      }
    });
  }

  private SymbolTable emit(SymbolTable table, Sink sink) {
    try {
      logger.debug("Emitting table with " + table.size() + " symbols");
      SymbolTable result = pipeline.runPipeline(logger, table);
      if (Settings.getBoolean(Settings.VALIDATE)) {
        Validate.check(result);
      }
      sink.write(result);
      return result;
    } catch (GotocFatal e) {
      throw e;
    } catch (TransformException e) {
      System.err.println("gotoc error:");
      System.err.println(e.getMessage());
      if (logger.isDebugEnabled()) {
        logger.debug("Transform failed", e);
      }
      throw new GotocFatal(ExitCode.ERROR_USER);
    } catch (IOException e) {
      System.err.println("I/O error while writing to output");
      System.err.println(e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_IO);
    } catch (InvalidOptionException e) {
      System.err.println("Error in options: " + e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_COMMAND);
    } catch (Throwable e) {
      reportInternalError(e);
      throw new GotocFatal(ExitCode.ERROR_INTERNAL);
    }
  }

  /**
   * Check that input holds a well-formed serialized symbol table
   * @return symbol names in file order
   */
  public List<String> check(Reader input) {
    try {
      List<String> names = IrepJson.checkSymbolTable(input);
      logger.debug("Input is well-formed: " + names.size() + " symbols");
      return names;
    } catch (IRException e) {
      System.err.println("Malformed symbol table:");
      System.err.println(e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_INPUT);
    } catch (IOException e) {
      System.err.println("I/O error while reading input");
      System.err.println(e.getMessage());
      throw new GotocFatal(ExitCode.ERROR_IO);
    } catch (Throwable e) {
      reportInternalError(e);
      throw new GotocFatal(ExitCode.ERROR_INTERNAL);
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("GOTOC INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}
