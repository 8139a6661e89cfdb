package exm.gotoc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StringPoolTest {

  @Test
  public void testSameTextSameHandle() {
    StringPool pool = new StringPool();
    InternedString a = pool.intern("main::1::x");
    InternedString b = pool.intern(new String("main::1::x"));
    assertSame(a, b);
    assertEquals(1, pool.size());
    assertEquals("main::1::x", pool.toString(a));
  }

  @Test
  public void testPoolsAreSeparate() {
    StringPool p1 = new StringPool();
    StringPool p2 = new StringPool();
    InternedString a = p1.intern("foo");
    InternedString b = p2.intern("foo");
    assertNotSame(a, b);
    assertFalse(a.equals(b));
    assertTrue(p1.contains(a));
    assertFalse(p2.contains(a));
    assertNull(p1.lookup("bar"));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testForeignHandle() {
    StringPool p1 = new StringPool();
    StringPool p2 = new StringPool();
    p2.toString(p1.intern("foo"));
  }

  @Test(expected=NullPointerException.class)
  public void testInternNull() {
    new StringPool().intern(null);
  }

  @Test
  public void testGlobal() {
    assertSame(InternedString.of("global_name"),
               StringPool.global().lookup("global_name"));
    assertNull(InternedString.ofNullable(null));
    assertTrue(InternedString.of("").isEmpty());
  }

  @Test
  public void testEnteredPoolIsCurrent() {
    StringPool outer = new StringPool();
    StringPool inner = new StringPool();
    assertSame(StringPool.global(), StringPool.current());
    StringPool.Scope s1 = outer.enter();
    try {
      assertSame(outer, StringPool.current());
      StringPool.Scope s2 = inner.enter();
      try {
        InternedString x = InternedString.of("scoped_x");
        assertTrue(inner.contains(x));
        assertNull(outer.lookup("scoped_x"));
      } finally {
        s2.close();
      }
      assertSame(outer, StringPool.current());
    } finally {
      s1.close();
    }
    assertSame(StringPool.global(), StringPool.current());
  }
}
