package org.ronjava.runtime.operators;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RList;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;

import static org.junit.jupiter.api.Assertions.*;

public class ArithmeticOperatorsTest {

    @ParameterizedTest
    @CsvSource({
            "+, 7, 3, 10",
            "-, 7, 3, 4",
            "*, 7, 3, 21",
    })
    void testIntegerArithmeticStaysInteger(String op, int a, int b, int expected) {
        RValue r = ArithmeticOperators.binary(op, RInteger.of(a), RInteger.of(b), null);
        assertArrayEquals(new int[]{expected}, assertInstanceOf(RInteger.class, r).values);
    }

    @Test
    void testDivisionIsReal() {
        RValue r = ArithmeticOperators.binary("/", RInteger.of(7), RInteger.of(2), null);
        assertArrayEquals(new double[]{3.5}, assertInstanceOf(RReal.class, r).values);
    }

    @Test
    void testMixedOperandsGiveReal() {
        RValue r = ArithmeticOperators.binary("+", RInteger.of(1), RReal.of(0.5), null);
        assertArrayEquals(new double[]{1.5}, assertInstanceOf(RReal.class, r).values);
    }

    @Test
    void testIntegerOverflowIsNA() {
        RInteger r = (RInteger) ArithmeticOperators.binary("+", RInteger.of(Integer.MAX_VALUE), RInteger.of(1), null);
        assertEquals(RInteger.NA, r.values[0]);
    }

    @Test
    void testNAPropagates() {
        RInteger r = (RInteger) ArithmeticOperators.binary("*", RInteger.of(RInteger.NA, 2), RInteger.of(3), null);
        assertEquals(RInteger.NA, r.values[0]);
        assertEquals(6, r.values[1]);
        RReal d = (RReal) ArithmeticOperators.binary("-", RReal.of(RReal.NA), RReal.of(1), null);
        assertTrue(RReal.isNA(d.values[0]));
    }

    @Test
    void testRecycling() {
        RReal r = (RReal) ArithmeticOperators.binary("*", RReal.of(1, 2, 3, 4), RReal.of(10, 100), null);
        assertArrayEquals(new double[]{10, 200, 30, 400}, r.values);
    }

    @Test
    void testZeroLengthOperand() {
        RValue r = ArithmeticOperators.binary("+", RNull.NULL, RReal.of(1), null);
        assertEquals(0, r.length());
    }

    @Test
    void testNamesComeFromFullLengthOperand() {
        RReal a = RReal.of(1, 2);
        a.setAttribute("names", RString.of("x", "y"));
        RValue r = ArithmeticOperators.binary("+", RReal.of(1), a, null);
        assertArrayEquals(new String[]{"x", "y"}, ((RString) r.getAttribute("names")).values);
    }

    @Test
    void testComparisons() {
        RLogical r = (RLogical) ArithmeticOperators.binary("<", RReal.of(1, 5), RInteger.of(3), null);
        assertArrayEquals(new int[]{1, 0}, r.values);
        RLogical s = (RLogical) ArithmeticOperators.binary("==", RString.of("a", "b"), RString.of("b"), null);
        assertArrayEquals(new int[]{0, 1}, s.values);
        RLogical na = (RLogical) ArithmeticOperators.binary(">=", RReal.of(RReal.NA), RReal.of(1), null);
        assertEquals(RLogical.NA, na.values[0]);
    }

    @Test
    void testNonNumericOperand() {
        RError e = assertThrows(RError.class,
                () -> ArithmeticOperators.binary("+", RString.of("a"), RReal.of(1), null));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
        assertEquals("non-numeric argument to binary operator", e.detail());
        assertThrows(RError.class,
                () -> ArithmeticOperators.binary("+", new RList(new RValue[]{RReal.of(1)}), RReal.of(1), null));
    }

    @Test
    void testUnaryOperators() {
        RInteger neg = (RInteger) ArithmeticOperators.negate(RInteger.of(4), null);
        assertEquals(-4, neg.values[0]);
        RLogical not = (RLogical) ArithmeticOperators.not(RLogical.valueOf(true), null);
        assertEquals(0, not.values[0]);
        assertThrows(RError.class, () -> ArithmeticOperators.not(RString.of("a"), null));
    }
}
