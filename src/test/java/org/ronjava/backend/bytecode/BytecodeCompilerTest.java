package org.ronjava.backend.bytecode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.ronjava.app.InterpreterOptions;
import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RCompilerException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.ronjava.TreeBuilder.*;

public class BytecodeCompilerTest {

    private ConstantPool pool;
    private InterpreterOptions options;

    static Stream<Arguments> lowerings() {
        return Stream.of(
                Arguments.of("constant", num(1),
                        "push ret"),
                Arguments.of("simple assignment", assign("x", num(1)),
                        "push dup stvar invisible ret"),
                Arguments.of("string target", assign(str("x"), num(1)),
                        "push dup stvar invisible ret"),
                Arguments.of("empty block", block(),
                        "push ret"),
                Arguments.of("block", block(num(1), num(2)),
                        "push pop push ret"),
                Arguments.of("parentheses", call("(", sym("x")),
                        "ldvar visible ret"),
                Arguments.of("if without else", call("if", sym("c"), num(1)),
                        "ldvar asbool brfalse push br push invisible ret"),
                Arguments.of("short-circuit and", call("&&", sym("a"), sym("b")),
                        "ldvar aslogical dup brfalse ldvar aslogical lgl_and ret"),
                Arguments.of("short-circuit or", call("||", sym("a"), sym("b")),
                        "ldvar aslogical dup brtrue ldvar aslogical lgl_or ret"),
                Arguments.of("quote", call("quote", call("+", sym("x"), num(1))),
                        "push_code ret"),
                Arguments.of("type test", call("is.null", sym("x")),
                        "ldvar is ret"),
                Arguments.of("extract", call("[[", sym("x"), num(1)),
                        "ldvar brobj push extract1 br dispatch ret"),
                Arguments.of("subset", call("[", sym("x"), num(1)),
                        "ldvar brobj push subset1 br dispatch ret"),
                Arguments.of("arithmetic", call("+", sym("a"), sym("b")),
                        "ldvar ldvar brnotnum add br ldfun put call_stack ret"),
                Arguments.of("dispatch generic", call("print", sym("x")),
                        "ldvar brobj ldfun swap call_stack br dispatch ret"),
                Arguments.of("generic call", call("f", sym("x"), num(1)),
                        "ldfun call ret"),
                Arguments.of("anonymous callee", call(call("g"), sym("x")),
                        "ldfun call isfun call ret"),
                Arguments.of("while", call("while", sym("c"), sym("x")),
                        "beginloop ldvar asbool brfalse ldvar pop br endcontext push invisible ret"),
                Arguments.of("repeat with break", call("repeat", call("break")),
                        "beginloop br pop br endcontext push invisible ret"),
                Arguments.of("for", call("for", sym("i"), sym("s"), sym("i")),
                        "ldvar push beginloop inc test_bounds brfalse dup2 extract1 stvar ldvar pop br"
                                + " endcontext pop pop push invisible ret"),
                Arguments.of("next inside an operand", call("repeat", call("+", sym("x"), call("next"))),
                        "beginloop ldvar pop br brnotnum add br ldfun put call_stack pop br"
                                + " endcontext push invisible ret"),
                Arguments.of("break outside a loop", call("break"),
                        "ldfun call ret"),
                Arguments.of("dollar assignment", assign(call("$", sym("a"), sym("x")), num(2)),
                        "push dup startassign uniq pick ldfun put promise pick call_stack stvar invisible ret"),
                Arguments.of("nested replacement", assign(call("names", call("$", sym("x"), sym("a"))), sym("v")),
                        "ldvar dup startassign uniq dup ldfun swap promise call_stack uniq pick"
                                + " ldfun put call_stack ldfun put promise pick call_stack stvar invisible ret"),
                Arguments.of("function literal", function("x", formal("y", num(2)), sym("x")),
                        "close ret")
        );
    }

    @BeforeEach
    void setUp() {
        pool = new ConstantPool();
        options = new InterpreterOptions();
    }

    private CompiledFunction compile(Node node) {
        return new BytecodeCompiler(pool, options).compile(node);
    }

    private static List<Integer> instructionStarts(Code code) {
        List<Integer> starts = new ArrayList<>();
        int pc = 0;
        while (pc < code.bytecode.length) {
            starts.add(pc);
            pc += Opcodes.length(code.bytecode[pc]);
        }
        return starts;
    }

    private static String mnemonics(Code code) {
        List<String> names = new ArrayList<>();
        for (int pc : instructionStarts(code)) {
            names.add(Opcodes.name(code.bytecode[pc]));
        }
        return String.join(" ", names);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("lowerings")
    void testLowering(String description, Node node, String expected) {
        CompiledFunction function = compile(node);
        assertEquals(expected, mnemonics(function.body()), Disassembler.disassemble(function));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("lowerings")
    void testBranchesStayInsideTheirCode(String description, Node node, String expected) {
        for (Code code : compile(node).codes()) {
            for (int pc : instructionStarts(code)) {
                int opcode = code.bytecode[pc];
                if (Opcodes.isJump(opcode)) {
                    int target = pc + 2 + code.bytecode[pc + 1];
                    assertTrue(target >= 0 && target < code.bytecode.length,
                            description + ": branch at " + pc + " to " + target);
                    assertTrue(instructionStarts(code).contains(target),
                            description + ": branch at " + pc + " lands inside an instruction");
                }
            }
        }
    }

    @Test
    void testCallArgumentsBecomePromiseCodes() {
        CallNode call = call("f", sym("x"), named("n", num(1)), empty());
        CompiledFunction function = compile(call);
        // two promise codes, then the body
        assertEquals(3, function.codeCount());
        assertEquals("ldvar ret", mnemonics(function.codeAt(0)));
        assertEquals("push ret", mnemonics(function.codeAt(1)));

        Code body = function.body();
        int callPc = instructionStarts(body).get(1);
        int[] argIndices = (int[]) pool.get(body.bytecode[callPc + 1]);
        assertArrayEquals(new int[]{0, 1, Opcodes.MISSING_ARG_IDX}, argIndices);
        String[] names = (String[]) pool.get(body.bytecode[callPc + 2]);
        assertArrayEquals(new String[]{null, "n", null}, names);
        assertSame(call, body.sourceAt(callPc));
    }

    @Test
    void testDotsArgumentIsSpliced() {
        CompiledFunction function = compile(call("f", dots()));
        Code body = function.body();
        int[] argIndices = (int[]) pool.get(body.bytecode[instructionStarts(body).get(1) + 1]);
        assertArrayEquals(new int[]{Opcodes.DOTS_ARG_IDX}, argIndices);
        assertEquals(1, function.codeCount());
    }

    @Test
    void testUnnamedCallHasNoNamesEntry() {
        Code body = compile(call("f", sym("x"))).body();
        assertEquals(Opcodes.NO_NAMES, body.bytecode[instructionStarts(body).get(1) + 2]);
    }

    @Test
    void testFunctionTemplate() {
        CompiledFunction outer = compile(function("x", formal("y", num(2)), sym("x")));
        Object template = pool.get(outer.body().bytecode[1]);
        CompiledFunction inner = assertInstanceOf(CompiledFunction.class, template);
        assertEquals(2, inner.formals().size());
        assertEquals("x", inner.formals().get(0).name());
        assertNull(inner.formals().get(0).defaultCode());
        assertEquals("push ret", mnemonics(inner.formals().get(1).defaultCode()));
        assertEquals("ldvar ret", mnemonics(inner.body()));
    }

    @Test
    void testBreakInPromiseIsNotLexical() {
        // the argument of f is a separate code object, so break there is a call
        CompiledFunction function = compile(call("while", lgl(true), call("f", call("break"))));
        assertEquals("ldfun call ret", mnemonics(function.codeAt(0)));
    }

    @Test
    void testDotsAsValueIsACompileError() {
        RCompilerException e = assertThrows(RCompilerException.class, () -> compile(assign("x", dots())));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    }

    @Test
    void testRepeatedFormalIsACompileError() {
        assertThrows(RCompilerException.class, () -> compile(function("x", "x", num(1))));
    }

    @Test
    void testConstantTargetIsInvalid() {
        RCompilerException e = assertThrows(RCompilerException.class, () -> compile(assign(num(1), num(2))));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_TARGET, e.kind());
    }

    @Test
    void testReplacementOfConstantIsInvalid() {
        RCompilerException e = assertThrows(RCompilerException.class,
                () -> compile(assign(call("f", num(1)), num(2))));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_TARGET, e.kind());
    }

    @Test
    void testAnonymousReplacementFunctionIsInvalid() {
        RCompilerException e = assertThrows(RCompilerException.class,
                () -> compile(assign(call(function("x", sym("x")), sym("a")), num(2))));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_TARGET, e.kind());
    }

    @Test
    void testDotsInReplacementIsInvalid() {
        RCompilerException e = assertThrows(RCompilerException.class,
                () -> compile(assign(call("[", sym("x"), dots()), num(2))));
        assertEquals(ErrorKind.INVALID_ASSIGNMENT_TARGET, e.kind());
    }

    @Test
    void testCompilerIsSingleUse() {
        BytecodeCompiler compiler = new BytecodeCompiler(pool, options);
        compiler.compile(num(1));
        assertThrows(IllegalStateException.class, () -> compiler.compile(num(2)));
    }

    @Test
    void testLoopFormShapes() {
        assertTrue(BytecodeCompiler.isLoopForm(call("while", sym("c"), sym("x"))));
        assertFalse(BytecodeCompiler.isLoopForm(call("while", sym("c"))));
        assertTrue(BytecodeCompiler.isLoopForm(call("for", sym("i"), sym("s"), sym("i"))));
        assertFalse(BytecodeCompiler.isLoopForm(call("for", str("i"), sym("s"), sym("i"))));
        assertFalse(BytecodeCompiler.isLoopForm(call("repeat", named("expr", sym("x")))));
    }
}
