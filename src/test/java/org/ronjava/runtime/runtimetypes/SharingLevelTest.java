package org.ronjava.runtime.runtimetypes;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SharingLevelTest {

    @Test
    void testFreshValuesAreUnshared() {
        assertEquals(SharingLevel.UNSHARED, RReal.of(1).shareLevel());
        assertEquals(SharingLevel.UNSHARED, new RList(new RValue[0]).shareLevel());
    }

    @Test
    void testBumpSaturates() {
        RInteger v = RInteger.of(1);
        v.bump();
        assertEquals(SharingLevel.BOUND_ONCE, v.shareLevel());
        v.bump();
        v.bump();
        assertEquals(SharingLevel.SHARED, v.shareLevel());
    }

    @Test
    void testEnsureUnsharedCopiesOnlySharedValues() {
        RInteger v = RInteger.of(1, 2);
        assertSame(v, v.ensureUnshared());
        v.bump();
        assertSame(v, v.ensureUnshared());
        v.bump();
        RValue copy = v.ensureUnshared();
        assertNotSame(v, copy);
        assertEquals(SharingLevel.UNSHARED, copy.shareLevel());
        ((RInteger) copy).values[0] = 10;
        assertEquals(1, v.values[0]);
    }

    @Test
    void testDuplicateKeepsAttributes() {
        RReal v = RReal.of(1, 2);
        v.setAttribute("names", RString.of("a", "b"));
        v.markShared();
        RReal copy = (RReal) v.ensureUnshared();
        assertEquals(RString.class, copy.getAttribute("names").getClass());
        assertEquals("b", ((RString) copy.getAttribute("names")).values[1]);
    }

    @Test
    void testListDuplicateSharesElements() {
        RReal element = RReal.of(1);
        RList list = new RList(new RValue[]{element});
        assertEquals(SharingLevel.BOUND_ONCE, element.shareLevel());
        RList copy = (RList) list.duplicate();
        assertSame(element, copy.values[0]);
        assertEquals(SharingLevel.SHARED, element.shareLevel());
    }

    @Test
    void testDefineBumpsOnlyForNewBinding() {
        REnvironment env = new REnvironment(null);
        RInteger v = RInteger.of(1);
        env.define("x", v);
        env.define("x", v);
        assertEquals(SharingLevel.BOUND_ONCE, v.shareLevel());
        env.define("y", v);
        assertEquals(SharingLevel.SHARED, v.shareLevel());
    }

    @Test
    void testReferenceTypesAreNeverCopied() {
        REnvironment env = new REnvironment(null);
        env.markShared();
        assertSame(env, env.ensureUnshared());
    }

    @Test
    void testSingletonsAreShared() {
        assertEquals(SharingLevel.SHARED, RLogical.TRUE.shareLevel());
        assertEquals(SharingLevel.SHARED, RNull.NULL.shareLevel());
    }
}
