package org.ronjava.runtime.operators;

import org.junit.jupiter.api.Test;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RList;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;

import static org.junit.jupiter.api.Assertions.*;

public class SubsetOperatorsTest {

    private static RList namedList(String[] names, RValue... values) {
        RList list = new RList(values);
        list.setAttribute("names", RString.of(names));
        return list;
    }

    @Test
    void testExtractByPositionAndName() {
        RReal x = RReal.of(10, 20, 30);
        x.setAttribute("names", RString.of("a", "b", "c"));
        assertEquals(20.0, ((RReal) SubsetOperators.extract2(x, RInteger.of(2), null)).values[0]);
        assertEquals(30.0, ((RReal) SubsetOperators.extract2(x, RString.of("c"), null)).values[0]);
    }

    @Test
    void testExtractOutOfBounds() {
        RError e = assertThrows(RError.class,
                () -> SubsetOperators.extract2(RReal.of(1, 2), RInteger.of(3), null));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
        assertEquals("subscript out of bounds", e.detail());
        assertThrows(RError.class, () -> SubsetOperators.extract2(RReal.of(1, 2), RInteger.of(0), null));
        assertThrows(RError.class, () -> SubsetOperators.extract2(RReal.of(1, 2), RInteger.of(1, 2), null));
    }

    @Test
    void testExtractFromListReturnsElement() {
        RReal inner = RReal.of(1);
        RList list = new RList(new RValue[]{inner});
        assertSame(inner, SubsetOperators.extract2(list, RReal.of(1), null));
        assertSame(RNull.NULL, SubsetOperators.extract2(RNull.NULL, RReal.of(1), null));
    }

    @Test
    void testSubsetSelectsPositions() {
        RInteger x = RInteger.of(5, 6, 7, 8);
        assertArrayEquals(new int[]{6, 8},
                ((RInteger) SubsetOperators.subset(x, new RLogical(new int[]{0, 1}), null)).values);
        assertArrayEquals(new int[]{5, 7, 8},
                ((RInteger) SubsetOperators.subset(x, RReal.of(-2), null)).values);
        RInteger outside = (RInteger) SubsetOperators.subset(x, RInteger.of(1, 9), null);
        assertEquals(RInteger.NA, outside.values[1]);
        assertThrows(RError.class, () -> SubsetOperators.subset(x, RReal.of(-1, 2), null));
    }

    @Test
    void testDollar() {
        RList list = namedList(new String[]{"a", "b"}, RReal.of(1), RReal.of(2));
        assertEquals(2.0, ((RReal) SubsetOperators.dollar(list, "b", null)).values[0]);
        assertSame(RNull.NULL, SubsetOperators.dollar(list, "zz", null));

        REnvironment env = new REnvironment(null);
        env.define("v", RInteger.of(3));
        assertEquals(3, ((RInteger) SubsetOperators.dollar(env, "v", null)).values[0]);

        RError e = assertThrows(RError.class, () -> SubsetOperators.dollar(RReal.of(1), "a", null));
        assertEquals("$ operator is invalid for atomic vectors", e.detail());
    }

    @Test
    void testAssignNullRemovesListElement() {
        RList list = namedList(new String[]{"a", "b"}, RReal.of(1), RReal.of(2));
        RList result = (RList) SubsetOperators.assign2(list, RString.of("a"), RNull.NULL, null);
        assertEquals(1, result.length());
        assertEquals("b", result.nameAt(0));
    }

    @Test
    void testAssignWidensTarget() {
        RValue result = SubsetOperators.assign2(RInteger.of(1, 2), RReal.of(2), RString.of("x"), null);
        RString s = assertInstanceOf(RString.class, result);
        assertArrayEquals(new String[]{"1", "x"}, s.values);
    }

    @Test
    void testAssignBeyondEndGrows() {
        RReal result = (RReal) SubsetOperators.assign2(RReal.of(1), RReal.of(3), RReal.of(9), null);
        assertEquals(3, result.length());
        assertTrue(RReal.isNA(result.values[1]));
        assertEquals(9.0, result.values[2]);
    }

    @Test
    void testAssignCopiesSharedTarget() {
        RReal x = RReal.of(1, 2);
        x.markShared();
        RReal result = (RReal) SubsetOperators.assign2(x, RReal.of(1), RReal.of(5), null);
        assertNotSame(x, result);
        assertEquals(1.0, x.values[0]);
        assertEquals(5.0, result.values[0]);
    }

    @Test
    void testAssignSubsetRecyclesValue() {
        RReal result = (RReal) SubsetOperators.assignSubset(RReal.of(0, 0, 0, 0), RInteger.of(1, 2, 3, 4),
                RReal.of(1, 2), null);
        assertArrayEquals(new double[]{1, 2, 1, 2}, result.values);
        assertThrows(RError.class,
                () -> SubsetOperators.assignSubset(RReal.of(1), RInteger.of(1), RReal.of(new double[0]), null));
    }

    @Test
    void testDollarAssignTurnsNullIntoList() {
        RList result = (RList) SubsetOperators.dollarAssign(RNull.NULL, "k", RReal.of(4), null);
        assertEquals(1, result.length());
        assertEquals("k", result.nameAt(0));
    }
}
