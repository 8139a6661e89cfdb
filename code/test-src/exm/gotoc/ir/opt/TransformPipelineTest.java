package exm.gotoc.ir.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.gotoc.common.Logging;
import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.lang.Location;
import exm.gotoc.common.lang.MachineModel;
import exm.gotoc.common.lang.Types;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

public class TransformPipelineTest {

  private static final Logger logger = Logging.getGotocLogger();

  private static SymbolTable dottedTable() {
    SymbolTable st = new SymbolTable(MachineModel.x86_64());
    st.insert(Symbol.staticVariable("a.b", "a.b", Types.C_INT,
                                    Location.none()));
    return st;
  }

  @Test
  public void testStandardOrder() {
    TransformPipeline p = TransformPipeline.standard();
    assertEquals(3, p.passes().size());
    assertTrue(p.passes().get(0) instanceof GenCExprTransformer);
    assertTrue(p.passes().get(1) instanceof NondetTransformer);
    assertTrue(p.passes().get(2) instanceof NameTransformer);
  }

  @Test
  public void testDisabledPassSkipped() throws Exception {
    TransformPipeline p = new TransformPipeline();
    p.addPass(new NameTransformer());
    SymbolTable st = dottedTable();
    assertSame(st, p.runPipeline(logger, st));
  }

  @Test
  public void testEnabledPassRuns() throws Exception {
    String old = Settings.get(Settings.NORMALIZE_NAMES);
    Settings.set(Settings.NORMALIZE_NAMES, "true");
    try {
      TransformPipeline p = new TransformPipeline();
      p.addPass(new NameTransformer());
      p.addPass(new IdentityTransformer());
      SymbolTable result = p.runPipeline(logger, dottedTable());
      assertTrue(result.contains("a_b"));
      assertFalse(result.contains("a.b"));
    } finally {
      Settings.set(Settings.NORMALIZE_NAMES, old);
    }
  }

  @Test(expected=GotocRuntimeError.class)
  public void testUnknownKey() {
    TableTransformer pass = new IdentityTransformer() {
      @Override
      public String getConfigEnabledKey() {
        return "gotoc.opt.no-such-pass";
      }
    };
    new TransformPipeline().passEnabled(pass);
  }
}
