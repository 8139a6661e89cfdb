package exm.gotoc.common;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.junit.Test;

public class LoggingTest {

  @Test
  public void testEmittedOncePerLevel() {
    String msg = "duplicate warning " + System.nanoTime();
    assertTrue(Logging.addEmitted(Level.WARN, msg));
    assertFalse(Logging.addEmitted(Level.WARN, new String(msg)));
    assertTrue(Logging.addEmitted(Level.INFO, msg));
  }
}
