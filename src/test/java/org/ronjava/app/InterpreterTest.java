package org.ronjava.app;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.mro.DefaultMethodRegistry;
import org.ronjava.runtime.runtimetypes.Completion;
import org.ronjava.runtime.runtimetypes.ControlFlowType;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RPrimitive;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.ronjava.TreeBuilder.*;

public class InterpreterTest {

    private Interpreter interpreter;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        interpreter = new Interpreter(new InterpreterOptions());
        output = new ByteArrayOutputStream();
        interpreter.setOutput(new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private RValue run(Node... statements) {
        Completion completion = interpreter.evaluate(block(statements));
        if (!completion.isNormal()) {
            fail("evaluation ended with " + completion
                    + (completion.error() != null ? ": " + completion.error().getMessage() : ""));
        }
        return completion.value();
    }

    private RError failure(Node... statements) {
        Completion completion = interpreter.evaluate(block(statements));
        assertEquals(ControlFlowType.ERROR, completion.type(), "expected an error, got " + completion);
        return completion.error();
    }

    private static double number(RValue v) {
        if (v instanceof RInteger i) {
            return i.values[0];
        }
        return assertInstanceOf(RReal.class, v).values[0];
    }

    private static String string(RValue v) {
        return assertInstanceOf(RString.class, v).values[0];
    }

    // =========================================================================
    // loops
    // =========================================================================

    @Test
    void testWhileLoopTerminates() {
        RValue i = run(
                assign("i", num(0)),
                call("while", call("<", sym("i"), num(3)),
                        block(assign("i", call("+", sym("i"), num(1))))),
                sym("i"));
        assertEquals(3.0, number(i));
    }

    @Test
    void testBreakLeavesLoop() {
        RValue i = run(
                assign("i", num(0)),
                call("while", call("<", sym("i"), num(3)),
                        block(assign("i", call("+", sym("i"), num(1))),
                                call("if", call("==", sym("i"), num(1)), call("break")))),
                sym("i"));
        assertEquals(1.0, number(i));
    }

    @Test
    void testNextSkipsRestOfBody() {
        RValue s = run(
                assign("s", num(0)),
                call("for", sym("i"), call("c", num(1), num(2), num(3), num(4)),
                        block(call("if", call("==", sym("i"), num(2)), call("next")),
                                assign("s", call("+", sym("s"), sym("i"))))),
                sym("s"));
        assertEquals(8.0, number(s));
    }

    @Test
    void testNextInsideOperandOfForLoop() {
        RValue s = run(
                assign("s", num(0)),
                call("for", sym("i"), call("c", num(1), num(2), num(3)),
                        assign("s", call("+", sym("s"),
                                call("if", call("==", sym("i"), num(2)), call("next"), sym("i"))))),
                sym("s"));
        assertEquals(4.0, number(s));
        assertEquals(0, interpreter.context().stack.size());
    }

    @Test
    void testBreakInsideOperandOfWhileLoop() {
        RValue i = run(
                assign("i", num(0)),
                call("while", lgl(true),
                        assign("i", call("+", sym("i"),
                                call("if", call("==", sym("i"), num(3)), call("break"), num(1))))),
                sym("i"));
        assertEquals(3.0, number(i));
        assertEquals(0, interpreter.context().stack.size());
    }

    @Test
    void testNextInsideOperandDoesNotLeaveValuesBehind() {
        RValue n = run(
                assign("n", num(0)),
                call("repeat", block(
                        assign("n", call("+", sym("n"), num(1))),
                        call("*", sym("n"), call("if", call("<", sym("n"), num(50)), call("next"), num(0))),
                        call("break"))),
                sym("n"));
        assertEquals(50.0, number(n));
        assertEquals(0, interpreter.context().stack.size());
    }

    @Test
    void testRepeatWithNextAndBreak() {
        RValue n = run(
                assign("n", num(0)),
                call("repeat", block(
                        assign("n", call("+", sym("n"), num(1))),
                        call("if", call("<", sym("n"), num(5)), call("next")),
                        call("break"))),
                sym("n"));
        assertEquals(5.0, number(n));
    }

    @Test
    void testForLoopValueIsInvisibleNull() {
        RValue v = run(call("for", sym("i"), call("c", num(1), num(2)), sym("i")));
        assertSame(RNull.NULL, v);
        assertFalse(interpreter.isVisible());
        assertEquals(2.0, number(interpreter.globalEnv().getLocal("i")));
    }

    @Test
    void testForOverEmptySequence() {
        RValue v = run(
                assign("hit", lgl(false)),
                call("for", sym("i"), nil(), assign("hit", lgl(true))),
                sym("hit"));
        assertSame(RLogical.FALSE, v);
    }

    @Test
    void testBreakInsidePromiseReachesLoop() {
        RValue i = run(
                assign("f", function("x", sym("x"))),
                assign("i", num(0)),
                call("while", lgl(true), block(
                        assign("i", call("+", sym("i"), num(1))),
                        call("f", call("if", call("==", sym("i"), num(2)), call("break"))))),
                sym("i"));
        assertEquals(2.0, number(i));
        assertEquals(0, interpreter.context().contexts.size());
    }

    @Test
    void testBreakAtTopLevelIsAnError() {
        RError e = failure(call("break"));
        assertEquals(ErrorKind.NO_ENCLOSING_CONTEXT, e.kind());
        assertEquals(0, interpreter.context().stack.size());
    }

    @Test
    void testInterruptStopsEndlessLoop() {
        interpreter.requestInterrupt();
        RError e = failure(call("repeat", block()));
        assertEquals(ErrorKind.INTERRUPT_REQUESTED, e.kind());
        assertEquals(0, interpreter.context().contexts.size());
        // the request is consumed
        assertEquals(1.0, number(run(num(1))));
    }

    // =========================================================================
    // closures and arguments
    // =========================================================================

    @Test
    void testReturnFromNestedLoop() {
        RValue v = run(
                assign("f", function(block(
                        call("for", sym("i"), call("c", num(1), num(2), num(3)),
                                call("if", call("==", sym("i"), num(2)),
                                        call("return", call("*", sym("i"), num(10))))),
                        num(0)))),
                call("f"));
        assertEquals(20.0, number(v));
        assertTrue(interpreter.isVisible());
    }

    @Test
    void testUnusedArgumentIsNeverEvaluated() {
        RValue v = run(
                assign("f", function("x", num(1))),
                call("f", call("no_such_function")));
        assertEquals(1.0, number(v));
    }

    @Test
    void testDefaultSeesOtherFormals() {
        RValue v = run(
                assign("h", function("a", formal("b", call("*", sym("a"), num(2))), sym("b"))),
                call("h", num(3)));
        assertEquals(6.0, number(v));
    }

    @Test
    void testNamedArgumentsMatchFirst() {
        RValue v = run(
                assign("f", function("a", "b", call("-", sym("a"), sym("b")))),
                call("f", num(1), named("a", num(10))));
        assertEquals(9.0, number(v));
    }

    @Test
    void testMissing() {
        run(assign("g", function("a", "b", call("missing", sym("b")))));
        assertSame(RLogical.TRUE, run(call("g", num(1))));
        assertSame(RLogical.FALSE, run(call("g", num(1), num(2))));
    }

    @Test
    void testMissingFollowsPassedFormal() {
        run(assign("inner", function("y", call("missing", sym("y")))),
                assign("outer", function("x", call("inner", sym("x")))));
        assertSame(RLogical.TRUE, run(call("outer")));
        assertSame(RLogical.FALSE, run(call("outer", num(1))));
    }

    @Test
    void testMissingArgumentWithoutDefault() {
        RError e = failure(
                assign("f", function("x", sym("x"))),
                call("f"));
        assertEquals(ErrorKind.MISSING_ARGUMENT, e.kind());
    }

    @Test
    void testDotsAreForwarded() {
        RValue v = run(
                assign("m", function("...", call("c", dots()))),
                call("m", num(1), num(2), num(3)));
        assertEquals(3, v.length());
    }

    @Test
    void testDotDotN() {
        RValue v = run(
                assign("k", function("...", sym("..2"))),
                call("k", num(1), num(5)));
        assertEquals(5.0, number(v));
    }

    @Test
    void testUnusedArgumentError() {
        RError e = failure(
                assign("f", function("x", sym("x"))),
                call("f", num(1), num(2)));
        assertEquals(ErrorKind.ARITY_MISMATCH, e.kind());
        assertTrue(e.detail().startsWith("unused argument"), e.detail());
    }

    @Test
    void testApplyingNonFunction() {
        RError e = failure(
                assign("x", num(1)),
                call("x", num(2)));
        assertEquals(ErrorKind.NOT_CALLABLE, e.kind());
    }

    @Test
    void testUnknownFunction() {
        RError e = failure(call("no_such_function", num(1)));
        assertEquals(ErrorKind.UNBOUND_VARIABLE, e.kind());
    }

    @Test
    void testClosureCapturesDefiningEnvironment() {
        RValue v = run(
                assign("make", function("n", function("x", call("+", sym("x"), sym("n"))))),
                assign("add2", call("make", num(2))),
                call("add2", num(5)));
        assertEquals(7.0, number(v));
    }

    @Test
    void testRecursion() {
        RValue v = run(
                assign("fact", function("n",
                        call("if", call("<", sym("n"), num(2)), num(1),
                                call("*", sym("n"), call("fact", call("-", sym("n"), num(1))))))),
                call("fact", num(5)));
        assertEquals(120.0, number(v));
    }

    @Test
    void testRunawayRecursionIsStopped() {
        InterpreterOptions options = new InterpreterOptions();
        options.maxCallDepth = 100;
        interpreter = new Interpreter(options);
        RError e = failure(
                assign("f", function(call("f"))),
                call("f"));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
        assertEquals(0, interpreter.context().evalDepth());
    }

    // =========================================================================
    // copy-on-write and complex assignment
    // =========================================================================

    @Test
    void testDollarAssignmentDoesNotTouchAliases() {
        run(
                assign("a", call("list", named("x", num(1)))),
                assign("b", sym("a")),
                assign(call("$", sym("a"), sym("x")), num(2)));
        assertEquals(2.0, number(run(call("$", sym("a"), sym("x")))));
        assertEquals(1.0, number(run(call("$", sym("b"), sym("x")))));
    }

    @Test
    void testReplacementInsideClosureCopiesInheritedValue() {
        RValue local = run(
                assign("x", call("c", num(1), num(2))),
                assign("f", function(block(
                        assign(call("[", sym("x"), num(1)), num(5)),
                        sym("x")))),
                call("f"));
        assertArrayEquals(new double[]{5, 2}, ((RReal) local).values);
        assertEquals(1.0, number(run(call("[[", sym("x"), num(1)))));
    }

    @Test
    void testReplacementOfArgumentLeavesCallerValue() {
        RValue changed = run(
                assign("x", call("c", num(1), num(2))),
                assign("g", function("y", block(
                        assign(call("[[", sym("y"), num(1)), num(7)),
                        sym("y")))),
                call("g", sym("x")));
        assertEquals(7.0, number(changed));
        assertArrayEquals(new double[]{1, 2}, ((RReal) interpreter.globalEnv().getLocal("x")).values);
    }

    @Test
    void testReplacementOfLocalValueIsInPlace() {
        run(assign("x", call("c", num(1), num(2))));
        RValue before = interpreter.globalEnv().getLocal("x");
        run(assign(call("[", sym("x"), num(1)), num(5)));
        assertSame(before, interpreter.globalEnv().getLocal("x"));
        assertArrayEquals(new double[]{5, 2}, ((RReal) before).values);
    }

    @Test
    void testAssignmentValueIsRightHandSide() {
        RValue v = run(
                assign("x", call("c", num(1), num(2))),
                assign(call("[[", sym("x"), num(2)), num(5)));
        assertEquals(5.0, number(v));
        assertFalse(interpreter.isVisible());
        RReal x = (RReal) interpreter.globalEnv().getLocal("x");
        assertArrayEquals(new double[]{1, 5}, x.values);
    }

    @Test
    void testNamesReplacement() {
        run(
                assign("x", call("c", num(1), num(2))),
                assign("y", sym("x")),
                assign(call("names", sym("x")), call("c", str("p"), str("q"))));
        RString names = (RString) run(call("names", sym("x")));
        assertArrayEquals(new String[]{"p", "q"}, names.values);
        assertSame(RNull.NULL, run(call("names", sym("y"))));
    }

    @Test
    void testNestedReplacement() {
        run(
                assign("x", call("list", named("a", call("c", num(1))))),
                assign("keep", sym("x")),
                assign(call("names", call("$", sym("x"), sym("a"))), str("k")));
        assertEquals("k", string(run(call("names", call("$", sym("x"), sym("a"))))));
        assertSame(RNull.NULL, run(call("names", call("$", sym("keep"), sym("a")))));
    }

    @Test
    void testReplacementOfUnboundTarget() {
        RError e = failure(assign(call("names", sym("nothing")), str("a")));
        assertEquals(ErrorKind.UNBOUND_VARIABLE, e.kind());
    }

    @Test
    void testClosureReplacementFunction() {
        RValue v = run(
                assign("second<-", function("x", "value", block(
                        assign(call("[[", sym("x"), num(2)), sym("value")),
                        sym("x")))),
                assign("v", call("c", num(1), num(2), num(3))),
                assign(call("second", sym("v")), num(9)),
                sym("v"));
        assertArrayEquals(new double[]{1, 9, 3}, ((RReal) v).values);
    }

    // =========================================================================
    // dispatch
    // =========================================================================

    @Test
    void testClassMethodWinsOverDefault() {
        RValue v = run(
                assign("print.foo", function("x", str("method"))),
                assign("obj", num(1)),
                assign(call("class", sym("obj")), str("foo")),
                call("print", sym("obj")));
        assertEquals("method", string(v));
        assertEquals("", output.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testPlainValueUsesDefault() {
        run(call("print", num(1)));
        assertEquals("[1] 1" + System.lineSeparator(), output.toString(StandardCharsets.UTF_8));
        assertFalse(interpreter.isVisible());
    }

    @Test
    void testClassWithoutMethodFallsBack() {
        run(
                assign("obj", num(2)),
                assign(call("class", sym("obj")), str("bar")),
                call("print", sym("obj")));
        String printed = output.toString(StandardCharsets.UTF_8);
        assertTrue(printed.startsWith("[1] 2"), printed);
        assertTrue(printed.contains("attr(,\"class\")"), printed);
    }

    @Test
    void testRegisteredMethod() {
        ((DefaultMethodRegistry) interpreter.methodRegistry()).register("baz", "print",
                RPrimitive.builtin("print.baz", (call, args, env, ctx) -> RString.of("registered")));
        RValue v = run(
                assign("obj", num(1)),
                assign(call("class", sym("obj")), str("baz")),
                call("print", sym("obj")));
        assertEquals("registered", string(v));
    }

    @Test
    void testMethodReceivesOriginalArguments() {
        RValue v = run(
                assign("format.foo", function("x", "digits", sym("digits"))),
                assign("obj", num(1)),
                assign(call("class", sym("obj")), str("foo")),
                call("format", sym("obj"), named("digits", num(3))));
        assertEquals(3.0, number(v));
    }

    @Test
    void testIndexingDispatchesOnObjects() {
        RValue v = run(
                assign("[[.rec", function("x", "i", str("custom"))),
                assign("obj", call("list", num(1))),
                assign(call("class", sym("obj")), str("rec")),
                call("[[", sym("obj"), num(1)));
        assertEquals("custom", string(v));
    }

    // =========================================================================
    // misc
    // =========================================================================

    @Test
    void testVisibility() {
        run(assign("x", num(1)));
        assertFalse(interpreter.isVisible());
        run(call("(", assign("x", num(1))));
        assertTrue(interpreter.isVisible());
        run(call("invisible", num(5)));
        assertFalse(interpreter.isVisible());
        run(sym("x"));
        assertTrue(interpreter.isVisible());
    }

    @Test
    void testQuoteAndEval() {
        RValue v = run(
                assign("q", call("quote", call("+", sym("y"), num(2)))),
                assign("y", num(1)),
                call("eval", sym("q")));
        assertEquals(3.0, number(v));
    }

    @Test
    void testArithmeticSlowPath() {
        RReal v = (RReal) run(call("+", call("c", num(1), num(2)), num(1)));
        assertArrayEquals(new double[]{2, 3}, v.values);
    }

    @Test
    void testShortCircuit() {
        assertSame(RLogical.FALSE, run(call("&&", lgl(false), call("no_such_function"))));
        assertSame(RLogical.TRUE, run(call("||", lgl(true), call("no_such_function"))));
    }

    @Test
    void testStateIsResetAfterError() {
        failure(call("+", num(1), str("a")));
        assertEquals(0, interpreter.context().stack.size());
        assertEquals(0, interpreter.context().contexts.size());
        assertEquals(2.0, number(run(call("+", num(1), num(1)))));
    }
}
