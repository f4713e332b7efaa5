package org.ronjava.backend.bytecode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ronjava.runtime.runtimetypes.Completion;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ControlContextStackTest {

    private ControlContextStack contexts;
    private REnvironment outer;
    private REnvironment inner;

    @BeforeEach
    void setUp() {
        contexts = new ControlContextStack();
        outer = new REnvironment(null, "outer");
        inner = new REnvironment(outer);
    }

    @Test
    void testBreakTargetsInnermostLoopOfSameEnvironment() {
        ControlContext outerLoop = contexts.pushLoop(0, 0, 10, outer);
        ControlContext innerLoop = contexts.pushLoop(2, 4, 8, outer);
        contexts.pushCall(3, inner);
        assertSame(innerLoop, contexts.findTarget(Completion.breakLoop(), outer));
        assertNotSame(outerLoop, contexts.findTarget(Completion.continueLoop(), outer));
    }

    @Test
    void testLoopOfOtherEnvironmentIsNotATarget() {
        contexts.pushLoop(0, 0, 10, outer);
        contexts.pushCall(1, inner);
        assertNull(contexts.findTarget(Completion.breakLoop(), inner));
    }

    @Test
    void testReturnTargetsCallContext() {
        ControlContext call = contexts.pushCall(0, inner);
        contexts.pushLoop(1, 0, 5, inner);
        ControlFlowException e = contexts.signal(Completion.returnValue(RInteger.of(1)), inner, null);
        assertSame(call, e.target());
    }

    @Test
    void testSignalWithoutReceiverIsAnError() {
        RError e = assertThrows(RError.class, () -> contexts.signal(Completion.breakLoop(), outer, null));
        assertEquals(ErrorKind.NO_ENCLOSING_CONTEXT, e.kind());
    }

    @Test
    void testUnwindKeepsTargetAndPopThroughDropsIt() {
        ControlContext loop = contexts.pushLoop(0, 0, 3, outer);
        contexts.pushCall(1, inner);
        contexts.pushLoop(2, 0, 3, inner);
        contexts.unwindTo(loop);
        assertEquals(1, contexts.size());
        assertSame(loop, contexts.peek());
        contexts.popThrough(loop);
        assertEquals(0, contexts.size());
    }

    @Test
    void testPopOnEmptyStack() {
        RError e = assertThrows(RError.class, () -> contexts.pop());
        assertEquals(ErrorKind.BOUNDS_VIOLATION, e.kind());
    }
}
