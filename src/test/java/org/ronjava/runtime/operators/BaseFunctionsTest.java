package org.ronjava.runtime.operators;

import org.junit.jupiter.api.Test;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RList;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;

import static org.junit.jupiter.api.Assertions.*;

public class BaseFunctionsTest {

    @Test
    void testFormatScalars() {
        assertEquals("[1] 1", BaseFunctions.format(RReal.of(1)));
        assertEquals("[1] 1.5 2", BaseFunctions.format(RReal.of(1.5, 2)).replaceAll(" +", " "));
        assertEquals("[1] \"a\"", BaseFunctions.format(RString.of("a")));
        assertEquals("NULL", BaseFunctions.format(RNull.NULL));
        assertEquals("numeric(0)", BaseFunctions.format(new RReal(new double[0])));
        assertEquals("integer(0)", BaseFunctions.format(new RInteger(new int[0])));
    }

    @Test
    void testFormatNamedVector() {
        RInteger x = RInteger.of(1, 2);
        x.setAttribute("names", RString.of("a", "bb"));
        assertEquals("a bb\n1  2", BaseFunctions.format(x));
    }

    @Test
    void testFormatList() {
        RList list = new RList(new RValue[]{RReal.of(1), RString.of("z")});
        list.setAttribute("names", RString.of("a", ""));
        assertEquals("$a\n[1] 1\n\n[[2]]\n[1] \"z\"\n", BaseFunctions.format(list));
        assertEquals("list()", BaseFunctions.format(new RList(new RValue[0])));
    }

    @Test
    void testFormatShowsClassAttribute() {
        RReal x = RReal.of(1);
        x.setAttribute("class", RString.of("foo"));
        assertEquals("[1] 1\nattr(,\"class\")\n[1] \"foo\"", BaseFunctions.format(x));
    }
}
