package org.ronjava.backend.bytecode;

import org.ronjava.app.InterpreterOptions;
import org.ronjava.frontend.analysis.Visitor;
import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.FunctionNode;
import org.ronjava.frontend.astnode.MissingArgNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.frontend.astnode.SymbolNode;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RCompilerException;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RPromise;
import org.ronjava.runtime.runtimetypes.ValueType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compiles an expression tree into a {@link CompiledFunction}.
 * <p>
 * The traversal keeps a stack of code contexts: the function body is one, and every
 * argument passed lazily gets its own (a promise code). Each context carries the
 * loops lexically open in it, so {@code break} and {@code next} inside the same code
 * object become plain branches.
 * <p>
 * Calls are first matched against a table of special forms keyed by callee name and
 * argument shape. Whatever does not match becomes a generic call whose arguments are
 * promise codes.
 * <p>
 * A compiler instance produces exactly one compiled function; nested function
 * literals get their own instance.
 */
public class BytecodeCompiler implements Visitor {

    private final ConstantPool pool;
    private final InterpreterOptions options;
    private final Deque<CodeContext> contextStack = new ArrayDeque<>();
    private final List<Code> codes = new ArrayList<>();
    private boolean used;

    public BytecodeCompiler(ConstantPool pool, InterpreterOptions options) {
        this.pool = pool;
        this.options = options;
    }

    /**
     * Compiles a top-level expression: no formals, the expression is the body.
     */
    public CompiledFunction compile(Node expression) {
        return compileFunction(List.of(), expression, expression);
    }

    public CompiledFunction compileFunction(List<FunctionNode.Formal> formals, Node body, Node source) {
        if (used) {
            throw new IllegalStateException("BytecodeCompiler instances compile a single function");
        }
        used = true;

        Set<String> seen = new HashSet<>();
        List<CompiledFunction.Formal> compiledFormals = new ArrayList<>();
        for (FunctionNode.Formal formal : formals) {
            if (!seen.add(formal.name)) {
                throw new RCompilerException(ErrorKind.INVALID_ARGUMENT,
                        "repeated formal argument '" + formal.name + "'", source);
            }
            Code defaultCode = null;
            if (formal.defaultValue != null) {
                defaultCode = codes.get(compilePromise(formal.defaultValue));
            }
            compiledFormals.add(new CompiledFunction.Formal(formal.name, defaultCode));
        }

        pushContext();
        compileExpr(body);
        cs().emit(Opcodes.RET);
        codes.add(popContext(body));

        CompiledFunction function = new CompiledFunction(codes, compiledFormals, source);
        if (options.disassemble) {
            System.err.println(Disassembler.disassemble(function));
        }
        return function;
    }

    // =========================================================================
    // contexts and emission helpers
    // =========================================================================

    private static final class LoopInfo {
        final int nextLabel;
        final int breakLabel;
        // operand-stack depth at the loop head
        final int depth;

        LoopInfo(int nextLabel, int breakLabel, int depth) {
            this.nextLabel = nextLabel;
            this.breakLabel = breakLabel;
            this.depth = depth;
        }
    }

    private static final class CodeContext {
        final CodeStream cs = new CodeStream();
        final Deque<LoopInfo> loops = new ArrayDeque<>();
    }

    private void pushContext() {
        contextStack.push(new CodeContext());
    }

    private Code popContext(Node source) {
        return contextStack.pop().cs.finish(source, pool);
    }

    CodeStream cs() {
        return contextStack.peek().cs;
    }

    private Deque<LoopInfo> loops() {
        return contextStack.peek().loops;
    }

    void compileExpr(Node node) {
        node.accept(this);
    }

    /**
     * Compiles the expression into a new promise code of the current function.
     *
     * @return the code index used by PROMISE and PUSH_CODE immediates
     */
    int compilePromise(Node expression) {
        pushContext();
        compileExpr(expression);
        cs().emit(Opcodes.RET);
        codes.add(popContext(expression));
        return codes.size() - 1;
    }

    int symbol(String name) {
        return pool.insert(name.intern());
    }

    int source(Node node) {
        return pool.insert(node);
    }

    int constant(Object value) {
        return pool.insert(value);
    }

    int namesIndex(String[] names) {
        for (String name : names) {
            if (name != null) {
                return pool.insert(names);
            }
        }
        return Opcodes.NO_NAMES;
    }

    /**
     * Pushes an argument for a stack call: language arguments are wrapped in a promise,
     * literals are pushed directly.
     */
    void compileStackArg(Node arg) {
        if (arg instanceof SymbolNode || arg instanceof CallNode || arg instanceof FunctionNode) {
            cs().emit(Opcodes.PROMISE, compilePromise(arg));
        } else if (arg instanceof MissingArgNode) {
            cs().emit(Opcodes.PUSH, constant(RMissingArg.MISSING));
        } else {
            compileExpr(arg);
        }
    }

    static boolean isPlain(CallNode call, int argCount) {
        return call.argCount() == argCount && !call.hasNames() && !call.hasDotsOrMissing();
    }

    /**
     * Shapes the compiler lowers to loops. The loop primitives reject anything else,
     * so that a call of theirs never re-enters itself through compilation.
     */
    public static boolean isLoopForm(CallNode call) {
        String name = call.functionName();
        if (name == null) {
            return false;
        }
        return switch (name) {
            case "while" -> isPlain(call, 2);
            case "repeat" -> isPlain(call, 1);
            case "for" -> isPlain(call, 3) && call.arg(0) instanceof SymbolNode sym
                    && !sym.isDots() && sym.dotDotIndex() == 0;
            default -> false;
        };
    }

    // =========================================================================
    // leaves
    // =========================================================================

    @Override
    public void visit(SymbolNode node) {
        if (node.isDots()) {
            throw new RCompilerException(ErrorKind.INVALID_ARGUMENT, "'...' used in an incorrect context", node);
        }
        if (node.dotDotIndex() > 0) {
            cs().emit(Opcodes.LDDDVAR, symbol(node.name)).addSource(source(node));
        } else {
            cs().emit(Opcodes.LDVAR, symbol(node.name)).addSource(source(node));
        }
    }

    @Override
    public void visit(ConstantNode node) {
        cs().emit(Opcodes.PUSH, constant(node.value));
        // a pending argument carried as a constant is forced in its own environment
        if (node.value instanceof RPromise) {
            cs().emit(Opcodes.FORCE);
        }
    }

    @Override
    public void visit(MissingArgNode node) {
        cs().emit(Opcodes.PUSH, constant(RMissingArg.MISSING));
    }

    @Override
    public void visit(FunctionNode node) {
        CompiledFunction function = new BytecodeCompiler(pool, options)
                .compileFunction(node.formals, node.body, node);
        cs().emit(Opcodes.CLOSE, constant(function)).addSource(source(node));
    }

    // =========================================================================
    // calls
    // =========================================================================

    @Override
    public void visit(CallNode node) {
        String name = node.functionName();
        if (name != null && compileSpecialCall(node, name)) {
            return;
        }
        compileGenericCall(node);
    }

    private void compileGenericCall(CallNode call) {
        if (call.function instanceof SymbolNode sym && !sym.isDots()) {
            cs().emit(Opcodes.LDFUN, symbol(sym.name)).addSource(source(call));
        } else {
            compileExpr(call.function);
            cs().emit(Opcodes.ISFUN).addSource(source(call));
        }
        emitPromiseArgs(Opcodes.CALL, call, null);
    }

    /**
     * Emits CALL or DISPATCH with one promise code per argument.
     */
    private void emitPromiseArgs(short opcode, CallNode call, String selector) {
        int n = call.argCount();
        int[] argIndices = new int[n];
        String[] names = new String[n];
        for (int i = 0; i < n; i++) {
            CallNode.Argument arg = call.args.get(i);
            names[i] = arg.name;
            if (arg.isDots()) {
                argIndices[i] = Opcodes.DOTS_ARG_IDX;
            } else if (arg.value instanceof MissingArgNode) {
                argIndices[i] = Opcodes.MISSING_ARG_IDX;
            } else {
                argIndices[i] = compilePromise(arg.value);
            }
        }
        if (opcode == Opcodes.CALL) {
            cs().emit(Opcodes.CALL, constant(argIndices), namesIndex(names));
        } else {
            cs().emit(Opcodes.DISPATCH, constant(argIndices), namesIndex(names), symbol(selector));
        }
        cs().addSource(source(call));
    }

    private boolean compileSpecialCall(CallNode call, String name) {
        switch (name) {
            case "{":
                return compileBlock(call);
            case "(":
                if (!isPlain(call, 1)) {
                    return false;
                }
                compileExpr(call.arg(0));
                cs().emit(Opcodes.VISIBLE);
                return true;
            case "if":
                return compileIf(call);
            case "&&", "||":
                return compileLogical(call, name.equals("&&"));
            case "quote":
                if (call.argCount() != 1 || call.hasNames()) {
                    return false;
                }
                cs().emit(Opcodes.PUSH_CODE, compilePromise(call.arg(0))).addSource(source(call));
                return true;
            case "<-", "=":
                if (call.argCount() != 2 || call.hasNames()) {
                    return false;
                }
                CompileAssignment.compileAssignment(this, call);
                return true;
            case "is.null":
                return compileTypeTest(call, ValueType.NULL);
            case "is.list":
                return compileTypeTest(call, ValueType.LIST);
            case "is.pairlist":
                return compileTypeTest(call, ValueType.PAIRLIST);
            case "[[":
                return compileIndexing(call, Opcodes.EXTRACT1);
            case "[":
                return compileIndexing(call, Opcodes.SUBSET1);
            case "+":
                return compileArithmetic(call, Opcodes.ADD);
            case "-":
                return compileArithmetic(call, Opcodes.SUB);
            case "*":
                return compileArithmetic(call, Opcodes.MUL);
            case "<":
                return compileArithmetic(call, Opcodes.LT);
            case "while":
                return isLoopForm(call) && compileWhile(call);
            case "repeat":
                return isLoopForm(call) && compileRepeat(call);
            case "for":
                return isLoopForm(call) && compileFor(call);
            case "break", "next":
                if (call.argCount() != 0 || loops().isEmpty()) {
                    return false;
                }
                LoopInfo loop = loops().peek();
                // operands of the enclosing expression are dropped before leaving it
                for (int pending = cs().depth() - loop.depth; pending > 0; pending--) {
                    cs().emit(Opcodes.POP);
                }
                cs().emitBranch(Opcodes.BR, name.equals("break") ? loop.breakLabel : loop.nextLabel);
                return true;
            default:
                if (options.dispatchGenerics.contains(name)) {
                    return compileDispatchGeneric(call, name);
                }
                return false;
        }
    }

    private boolean compileBlock(CallNode call) {
        if (call.hasNames() || call.hasDotsOrMissing()) {
            return false;
        }
        CodeStream cs = cs();
        if (call.argCount() == 0) {
            cs.emit(Opcodes.PUSH, constant(RNull.NULL));
            return true;
        }
        for (int i = 0; i < call.argCount(); i++) {
            if (i > 0) {
                cs.emit(Opcodes.POP);
            }
            compileExpr(call.arg(i));
        }
        return true;
    }

    // cond asbool brfalse(else) then br(end); else: (else | push NULL invisible); end:
    private boolean compileIf(CallNode call) {
        if (!isPlain(call, 2) && !isPlain(call, 3)) {
            return false;
        }
        CodeStream cs = cs();
        int elseBranch = cs.mkLabel();
        int end = cs.mkLabel();
        compileExpr(call.arg(0));
        cs.emit(Opcodes.ASBOOL).addSource(source(call));
        cs.emitBranch(Opcodes.BRFALSE, elseBranch);
        compileExpr(call.arg(1));
        cs.emitBranch(Opcodes.BR, end);
        cs.bind(elseBranch);
        if (call.argCount() == 3) {
            compileExpr(call.arg(2));
        } else {
            cs.emit(Opcodes.PUSH, constant(RNull.NULL));
            cs.emit(Opcodes.INVISIBLE);
        }
        cs.bind(end);
        return true;
    }

    // lhs aslogical dup br(false|true) next; rhs aslogical lgl_(and|or); next:
    private boolean compileLogical(CallNode call, boolean isAnd) {
        if (!isPlain(call, 2)) {
            return false;
        }
        CodeStream cs = cs();
        int next = cs.mkLabel();
        compileExpr(call.arg(0));
        cs.emit(Opcodes.ASLOGICAL).addSource(source(call.arg(0)));
        cs.emit(Opcodes.DUP);
        cs.emitBranch(isAnd ? Opcodes.BRFALSE : Opcodes.BRTRUE, next);
        compileExpr(call.arg(1));
        cs.emit(Opcodes.ASLOGICAL).addSource(source(call.arg(1)));
        cs.emit(isAnd ? Opcodes.LGL_AND : Opcodes.LGL_OR);
        cs.bind(next);
        return true;
    }

    private boolean compileTypeTest(CallNode call, ValueType type) {
        if (!isPlain(call, 1)) {
            return false;
        }
        compileExpr(call.arg(0));
        cs().emit(Opcodes.IS, type.ordinal());
        return true;
    }

    // x brobj(obj) i extract1 br(next); obj: dispatch; next:
    private boolean compileIndexing(CallNode call, short fastOpcode) {
        if (!isPlain(call, 2)) {
            return false;
        }
        CodeStream cs = cs();
        int objBranch = cs.mkLabel();
        int next = cs.mkLabel();
        compileExpr(call.arg(0));
        cs.emitBranch(Opcodes.BROBJ, objBranch);
        compileExpr(call.arg(1));
        cs.emit(fastOpcode).addSource(source(call));
        cs.emitBranch(Opcodes.BR, next);
        cs.bind(objBranch);
        emitPromiseArgs(Opcodes.DISPATCH, call, call.functionName());
        cs.bind(next);
        return true;
    }

    // a b brnotnum(slow) op br(next); slow: ldfun(op) put(2) call_stack(2); next:
    private boolean compileArithmetic(CallNode call, short fastOpcode) {
        if (!isPlain(call, 2)) {
            return false;
        }
        CodeStream cs = cs();
        int slow = cs.mkLabel();
        int next = cs.mkLabel();
        compileExpr(call.arg(0));
        compileExpr(call.arg(1));
        cs.emitBranch(Opcodes.BRNOTNUM, slow);
        cs.emit(fastOpcode).addSource(source(call));
        cs.emitBranch(Opcodes.BR, next);
        cs.bind(slow);
        cs.emit(Opcodes.LDFUN, symbol(call.functionName())).addSource(source(call));
        cs.emit(Opcodes.PUT, 2);
        cs.emit(Opcodes.CALL_STACK, 2, Opcodes.NO_NAMES).addSource(source(call));
        cs.bind(next);
        return true;
    }

    private boolean compileWhile(CallNode call) {
        CodeStream cs = cs();
        int loopBranch = cs.mkLabel();
        int breakBranch = cs.mkLabel();
        cs.emitBranch(Opcodes.BEGINLOOP, breakBranch);
        cs.addSource(source(call));
        cs.bind(loopBranch);
        compileExpr(call.arg(0));
        cs.emit(Opcodes.ASBOOL).addSource(source(call));
        cs.emitBranch(Opcodes.BRFALSE, breakBranch);
        compileLoopBody(call.arg(1), loopBranch, breakBranch);
        cs.emitBranch(Opcodes.BR, loopBranch);
        endLoop(breakBranch);
        return true;
    }

    private boolean compileRepeat(CallNode call) {
        CodeStream cs = cs();
        int loopBranch = cs.mkLabel();
        int breakBranch = cs.mkLabel();
        cs.emitBranch(Opcodes.BEGINLOOP, breakBranch);
        cs.addSource(source(call));
        cs.bind(loopBranch);
        compileLoopBody(call.arg(0), loopBranch, breakBranch);
        cs.emitBranch(Opcodes.BR, loopBranch);
        endLoop(breakBranch);
        return true;
    }

    // seq 0L beginloop(break); loop: inc test_bounds brfalse(break) dup2 extract1 stvar(sym) body pop br(loop);
    // break: endcontext pop pop
    private boolean compileFor(CallNode call) {
        CodeStream cs = cs();
        SymbolNode variable = (SymbolNode) call.arg(0);
        int loopBranch = cs.mkLabel();
        int breakBranch = cs.mkLabel();
        compileExpr(call.arg(1));
        cs.emit(Opcodes.PUSH, constant(RInteger.of(0)));
        cs.emitBranch(Opcodes.BEGINLOOP, breakBranch);
        cs.addSource(source(call));
        cs.bind(loopBranch);
        cs.emit(Opcodes.INC);
        cs.emit(Opcodes.TEST_BOUNDS);
        cs.emitBranch(Opcodes.BRFALSE, breakBranch);
        cs.emit(Opcodes.DUP2);
        cs.emit(Opcodes.EXTRACT1).addSource(source(call));
        cs.emit(Opcodes.STVAR, symbol(variable.name));
        compileLoopBody(call.arg(2), loopBranch, breakBranch);
        cs.emitBranch(Opcodes.BR, loopBranch);
        cs.bind(breakBranch);
        cs.emit(Opcodes.ENDCONTEXT);
        cs.emit(Opcodes.POP);
        cs.emit(Opcodes.POP);
        cs.emit(Opcodes.PUSH, constant(RNull.NULL));
        cs.emit(Opcodes.INVISIBLE);
        return true;
    }

    private void compileLoopBody(Node body, int nextLabel, int breakLabel) {
        loops().push(new LoopInfo(nextLabel, breakLabel, cs().depth()));
        try {
            compileExpr(body);
        } finally {
            loops().pop();
        }
        cs().emit(Opcodes.POP);
    }

    private void endLoop(int breakBranch) {
        CodeStream cs = cs();
        cs.bind(breakBranch);
        cs.emit(Opcodes.ENDCONTEXT);
        cs.emit(Opcodes.PUSH, constant(RNull.NULL));
        cs.emit(Opcodes.INVISIBLE);
    }

    // recv brobj(obj) ldfun(sel) swap args.. call_stack br(next); obj: dispatch; next:
    private boolean compileDispatchGeneric(CallNode call, String selector) {
        if (call.argCount() < 1 || call.args.get(0).name != null || call.hasDotsOrMissing()) {
            return false;
        }
        CodeStream cs = cs();
        int objBranch = cs.mkLabel();
        int next = cs.mkLabel();
        compileExpr(call.arg(0));
        cs.emitBranch(Opcodes.BROBJ, objBranch);
        cs.emit(Opcodes.LDFUN, symbol(selector)).addSource(source(call));
        cs.emit(Opcodes.SWAP);
        String[] names = new String[call.argCount()];
        for (int i = 1; i < call.argCount(); i++) {
            compileStackArg(call.arg(i));
            names[i] = call.args.get(i).name;
        }
        cs.emit(Opcodes.CALL_STACK, call.argCount(), namesIndex(names)).addSource(source(call));
        cs.emitBranch(Opcodes.BR, next);
        cs.bind(objBranch);
        emitPromiseArgs(Opcodes.DISPATCH, call, selector);
        cs.bind(next);
        return true;
    }
}
