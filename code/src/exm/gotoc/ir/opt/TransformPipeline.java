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
package exm.gotoc.ir.opt;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.InvalidOptionException;
import exm.gotoc.common.exceptions.TransformException;
import exm.gotoc.ir.tree.SymbolTable;

/**
 * Runs table transformers in order, skipping those whose config key
 * is set to false.  Each pass consumes the previous pass's table.
 */
public class TransformPipeline {

  private final List<TableTransformer> passes =
                                  new ArrayList<TableTransformer>();

  public void addPass(TableTransformer pass) {
    passes.add(pass);
  }

  public List<TableTransformer> passes() {
    return passes;
  }

  public SymbolTable runPipeline(Logger logger, SymbolTable table)
      throws TransformException {
    SymbolTable current = table;
    for (TableTransformer pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        current = pass.transform(current);
      } else {
        logger.debug("Skipping disabled pass: " + pass.getPassName());
      }
    }
    return current;
  }

  public boolean passEnabled(TableTransformer pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new GotocRuntimeError("Expected config key " +
                        pass.getConfigEnabledKey() + " to exist");
    }
  }

  /**
   * Passes in their standard order.  C generation runs first since it
   * introduces nondet values.  Name normalization runs last so that
   * generated nondet functions are normalized too.
   */
  public static TransformPipeline standard() {
    TransformPipeline pipeline = new TransformPipeline();
    pipeline.addPass(new GenCExprTransformer());
    pipeline.addPass(new NondetTransformer());
    pipeline.addPass(new NameTransformer());
    return pipeline;
  }
}
