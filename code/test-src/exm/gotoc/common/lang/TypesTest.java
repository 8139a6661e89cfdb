package exm.gotoc.common.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.gotoc.common.exceptions.GotocRuntimeError;
import exm.gotoc.common.exceptions.LayoutException;
import exm.gotoc.common.lang.Types.DatatypeComponent;
import exm.gotoc.common.lang.Types.Parameter;
import exm.gotoc.common.lang.Types.Type;
import exm.gotoc.ir.tree.Symbol;
import exm.gotoc.ir.tree.SymbolTable;

public class TypesTest {

  private static final MachineModel MM = MachineModel.x86_64();

  private static SymbolTable tableWithPair() {
    SymbolTable st = new SymbolTable(MM);
    st.insert(Symbol.structType("Pair", "Pair", Arrays.asList(
        DatatypeComponent.field("a", Types.C_INT),
        DatatypeComponent.field("b", Types.C_CHAR)), Location.none()));
    return st;
  }

  @Test
  public void testScalarSizes() throws LayoutException {
    SymbolTable st = new SymbolTable(MM);
    assertEquals(32, Types.C_INT.sizeInBits(st));
    assertEquals(64, Types.SIZE_T.sizeInBits(st));
    assertEquals(64, Types.DOUBLE.sizeInBits(st));
    assertEquals(64, Types.pointer(Types.C_CHAR).sizeInBits(st));
    assertEquals(12, Types.signedInt(12).sizeInBits(st));
    assertEquals(4, Types.C_INT.sizeOf(st));
    assertEquals(0, Types.EMPTY.sizeInBits(st));
  }

  @Test
  public void testAggregateSizes() throws LayoutException {
    SymbolTable st = tableWithPair();
    Type pair = Types.structTag("Pair");
    assertEquals(40, pair.sizeInBits(st));
    assertEquals(5, pair.sizeOf(st));
    assertEquals(400, Types.array(pair, 10).sizeInBits(st));
    assertEquals(0, Types.flexibleArray(pair).sizeInBits(st));

    Type u = Types.unionType("U", Arrays.asList(
        DatatypeComponent.field("i", Types.C_INT),
        DatatypeComponent.field("l", Types.C_LONG_INT)));
    assertEquals(64, u.sizeInBits(st));

    Type bits = Types.structType("Bits", Arrays.asList(
        DatatypeComponent.field("f", Types.C_INT.asBitfield(3)),
        DatatypeComponent.padding("$pad0", 5)));
    assertEquals(8, bits.sizeInBits(st));
  }

  @Test(expected=LayoutException.class)
  public void testInfiniteArrayHasNoSize() throws LayoutException {
    Types.infiniteArray(Types.C_INT).sizeInBits(new SymbolTable(MM));
  }

  @Test(expected=LayoutException.class)
  public void testBoolHasNoSize() throws LayoutException {
    Types.BOOL.sizeInBits(new SymbolTable(MM));
  }

  @Test
  public void testTagResolution() throws LayoutException {
    SymbolTable st = tableWithPair();
    Type tag = Types.structTag("Pair");
    assertEquals("tag-Pair", tag.aggrTag());
    assertEquals("Pair", tag.tag());
    assertEquals(Types.C_CHAR, tag.lookupFieldType("b", st));
    assertNull(tag.lookupFieldType("c", st));
    assertEquals(2, st.lookupComponents(tag).size());

    st.remove("tag-Pair");
    try {
      tag.sizeInBits(st);
      fail("Expected tag not to resolve");
    } catch (LayoutException e) {
      assertEquals("tag-Pair", e.getSymbolName());
    }
  }

  @Test(expected=LayoutException.class)
  public void testTagOfWrongKind() throws LayoutException {
    SymbolTable st = tableWithPair();
    Types.unionTag("Pair").sizeInBits(st);
  }

  @Test
  public void testIncomplete() {
    SymbolTable st = new SymbolTable(MM);
    st.insert(Symbol.incompleteStruct("Opaque", "Opaque", Location.none()));
    try {
      Types.structTag("Opaque").lookupComponents(st);
      fail("Expected no components for incomplete struct");
    } catch (LayoutException e) {
      // expected
    }
    Type full = Types.structType("Opaque", Collections.<DatatypeComponent>
                                                        emptyList());
    assertTrue(full.completes(Types.incompleteStruct("Opaque")));
    assertFalse(full.completes(Types.incompleteStruct("Other")));
    assertFalse(full.completes(Types.incompleteUnion("Opaque")));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testDuplicateComponent() {
    Types.structType("S", Arrays.asList(
        DatatypeComponent.field("x", Types.C_INT),
        DatatypeComponent.field("x", Types.C_CHAR)));
  }

  @Test(expected=GotocRuntimeError.class)
  public void testVectorOfNonNumeric() {
    Types.vector(Types.pointer(Types.C_INT), 4);
  }

  @Test(expected=GotocRuntimeError.class)
  public void testCodeParameter() {
    new Parameter(Types.code(Collections.<Parameter>emptyList(),
                             Types.EMPTY));
  }

  @Test
  public void testCodeTypeEqualityIgnoresNames() {
    Type f1 = Types.code(Arrays.asList(new Parameter(Types.C_INT, "f::x",
                                                     "x")), Types.BOOL);
    Type f2 = Types.codeWithUnnamedParameters(
        Arrays.<Type>asList(Types.C_INT), Types.BOOL);
    assertEquals(f1, f2);
    assertFalse(f1.equals(Types.variadicCode(f1.parameters(), Types.BOOL)));
  }

  @Test
  public void testEqualOnMachine() {
    assertTrue(Types.C_INT.isEqualOnMachine(Types.signedInt(32), MM));
    assertFalse(Types.C_INT.isEqualOnMachine(Types.unsignedInt(32), MM));
    assertTrue(Types.SIZE_T.isEqualOnMachine(Types.unsignedInt(64), MM));
    assertTrue(Types.C_CHAR.isSigned(MM));
    assertFalse(Types.C_CHAR.isSigned(MachineModel.aarch64()));
  }

  @Test
  public void testIdentifiers() {
    assertEquals("signed_32_bit", Types.signedInt(32).toIdentifier());
    assertEquals("array_of_3_int", Types.array(Types.C_INT, 3)
                                        .toIdentifier());
    assertEquals("tag_Pair", Types.structTag("Pair").toIdentifier());
  }

  @Test(expected=LayoutException.class)
  public void testArraySizeOverflow() throws LayoutException {
    Types.array(Types.C_LONG_INT, Long.MAX_VALUE / 2)
         .sizeInBits(new SymbolTable(MM));
  }

  @Test
  public void testStructSizeOverflow() {
    Type big = Types.array(Types.C_CHAR, Long.MAX_VALUE / 8);
    Type s = Types.structType("Huge", Arrays.asList(
        DatatypeComponent.field("a", big),
        DatatypeComponent.field("b", big)));
    try {
      s.sizeInBits(new SymbolTable(MM));
      fail("Expected size overflow");
    } catch (LayoutException e) {
      assertEquals("tag-Huge", e.getSymbolName());
    }
  }
}
