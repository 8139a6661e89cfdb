package exm.gotoc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.gotoc.common.exceptions.InvalidOptionException;

public class MachineModelTest {

  @Test
  public void testPointerWidthInBytes() {
    assertEquals(8, MachineModel.x86_64().pointerWidthInBytes());
    MachineModel m32 = MachineModel.builder().architecture("i386")
                          .pointerWidth(32).charWidth(8).build();
    assertEquals(4, m32.pointerWidthInBytes());
  }

  @Test
  public void testPresets() throws InvalidOptionException {
    MachineModel x86 = MachineModel.fromName("x86_64");
    MachineModel arm = MachineModel.fromName("AARCH64");
    assertEquals("x86_64", x86.architecture());
    assertEquals("aarch64", arm.architecture());
    assertFalse(x86.charIsUnsigned());
    assertTrue(arm.charIsUnsigned());
    assertEquals(128, x86.longDoubleWidth());
    assertEquals(64, arm.longDoubleWidth());
    assertFalse(x86.isBigEndian());
  }

  @Test(expected=InvalidOptionException.class)
  public void testUnknownMachine() throws InvalidOptionException {
    MachineModel.fromName("pdp11");
  }
}
