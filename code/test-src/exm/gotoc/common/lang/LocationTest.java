package exm.gotoc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.gotoc.common.Settings;
import exm.gotoc.common.exceptions.GotocRuntimeError;

public class LocationTest {

  @Test
  public void testShortString() {
    assertEquals("<none>", Location.none().shortString());
    assertEquals("<memcpy>:3",
                 Location.builtinFunction("memcpy", 3L).shortString());
    assertEquals("<memcpy>",
                 Location.builtinFunction("memcpy", null).shortString());
    assertEquals("a.rs:10", Location.loc("a.rs", "f", 10, 2L).shortString());
    assertEquals("<assertion>", Location.property(null, null, null, null,
                            "always fails", "assertion").shortString());
  }

  @Test
  public void testEquality() {
    Location l1 = Location.loc("a.rs", "f", 10, 2L);
    Location l2 = Location.loc("a.rs", "f", 10, 2L);
    assertEquals(l1, l2);
    assertEquals(l1.hashCode(), l2.hashCode());
    assertFalse(l1.equals(Location.loc("a.rs", "f", 11, 2L)));
    assertFalse(l1.equals(Location.loc("a.rs", null, 10, 2L)));
  }

  @Test
  public void testToProperty() {
    Location l = Location.loc("a.rs", "f", 10, 2L);
    Location p = l.toProperty("index in bounds", "bounds");
    assertTrue(p.isProperty());
    assertEquals("a.rs", p.filename());
    assertEquals("f", p.function());
    assertEquals(Long.valueOf(10), p.line());
    assertEquals("index in bounds", p.comment());
    assertEquals("bounds", p.propertyClass());

    Location b = Location.builtinFunction("memcpy", null)
                         .toProperty("overlap", "precondition");
    assertEquals("<builtin-library-memcpy>", b.filename());
    assertNull(b.line());
  }

  @Test(expected=GotocRuntimeError.class)
  public void testPropertyNeedsComment() {
    Location.property("a.rs", "f", 1L, 1L, null, "assertion");
  }

  @Test(expected=GotocRuntimeError.class)
  public void testNegativeLineRejected() {
    Location.loc("a.rs", "f", -1, null);
  }

  @Test
  public void testNegativeLineClamped() throws Exception {
    Settings.set(Settings.LOCATION_POLICY, Settings.LOCATION_POLICY_CLAMP);
    try {
      Location l = Location.loc("a.rs", "f", -5, -1L);
      assertEquals(Long.valueOf(0), l.line());
      assertEquals(Long.valueOf(0), l.column());
    } finally {
      Settings.set(Settings.LOCATION_POLICY,
                   Settings.LOCATION_POLICY_REJECT);
    }
  }
}
