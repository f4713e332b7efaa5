package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.AbstractNode;
import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.mro.DispatchResolver;
import org.ronjava.runtime.operators.ArithmeticOperators;
import org.ronjava.runtime.operators.SubsetOperators;
import org.ronjava.runtime.runtimetypes.ArgumentList;
import org.ronjava.runtime.runtimetypes.ControlFlowType;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RClosure;
import org.ronjava.runtime.runtimetypes.RCodeRef;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RPairlist;
import org.ronjava.runtime.runtimetypes.RPromise;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RValue;
import org.ronjava.runtime.runtimetypes.RVector;
import org.ronjava.runtime.runtimetypes.SharingLevel;

/**
 * Stack machine that executes {@link Code} objects.
 * <p>
 * One shared operand stack and one context stack per {@link InterpreterContext}.
 * An activation only records where its part of the stacks begins; on a normal
 * return the operand stack is back at that depth plus the result.
 * <p>
 * Loop exits raised from a nested code object (a promise or a callee) arrive as a
 * {@link ControlFlowException}. The activation owning the target loop context
 * resumes at the loop head or exit; everyone else lets it pass.
 */
public class BytecodeInterpreter {

    static final String COMPILED_ANNOTATION = "compiled";

    private BytecodeInterpreter() {
    }

    /**
     * Evaluates an expression tree. Literal constants are returned as they are;
     * anything else is compiled once per tree node and executed.
     */
    public static RValue eval(Node expression, REnvironment env, InterpreterContext ctx) {
        if (expression instanceof ConstantNode constant) {
            ctx.visible = true;
            return constant.value;
        }
        return execute(compile(expression, ctx).body(), env, ctx);
    }

    /**
     * Compiles the expression as a top-level function, reusing the result cached on
     * the node by an earlier call with the same constant pool.
     */
    public static CompiledFunction compile(Node expression, InterpreterContext ctx) {
        AbstractNode annotated = expression instanceof AbstractNode n ? n : null;
        if (annotated != null && annotated.getAnnotation(COMPILED_ANNOTATION) instanceof CompiledFunction cached
                && cached.body().pool == ctx.pool) {
            return cached;
        }
        CompiledFunction function = new BytecodeCompiler(ctx.pool, ctx.options).compile(expression);
        if (annotated != null) {
            annotated.setAnnotation(COMPILED_ANNOTATION, function);
        }
        return function;
    }

    public static RValue execute(Code code, REnvironment env, InterpreterContext ctx) {
        ctx.enterEvaluation(code.source);
        OperandStack stack = ctx.stack;
        ControlContextStack contexts = ctx.contexts;
        int contextBase = contexts.size();
        int stackBase = stack.size();
        stack.reserve(code.stackLength + ctx.options.stackSlack);

        int[] bc = code.bytecode;
        ConstantPool pool = code.pool;
        CompiledFunction function = code.owner();
        boolean trace = ctx.options.trace;
        int pc = 0;

        try {
            while (true) {
                try {
                    while (true) {
                        int insnPc = pc;
                        if (insnPc >= bc.length) {
                            throw new RError(ErrorKind.BOUNDS_VIOLATION, "fell off the end of the code at pc " + insnPc);
                        }
                        short opcode = (short) bc[pc++];
                        if (trace) {
                            System.err.println(String.format("%4d: %-12s stack=%d", insnPc, Opcodes.name(opcode), stack.size()));
                        }

                        switch (opcode) {
                            // =================================================================
                            // STACK
                            // =================================================================

                            case Opcodes.PUSH: {
                                stack.push(pool.getValue(bc[pc++]));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.POP: {
                                stack.pop();
                                break;
                            }

                            case Opcodes.DUP: {
                                stack.push(stack.peek());
                                break;
                            }

                            case Opcodes.DUP2: {
                                RValue below = stack.peek(1);
                                RValue top = stack.peek();
                                stack.push(below);
                                stack.push(top);
                                break;
                            }

                            case Opcodes.SWAP: {
                                stack.pick(1);
                                break;
                            }

                            case Opcodes.PICK: {
                                stack.pick(bc[pc++]);
                                break;
                            }

                            case Opcodes.PUT: {
                                stack.put(bc[pc++]);
                                break;
                            }

                            // =================================================================
                            // VARIABLES
                            // =================================================================

                            case Opcodes.LDVAR: {
                                String name = pool.getSymbol(bc[pc++]);
                                stack.push(loadVariable(name, env, ctx, code.sourceAt(insnPc)));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.STARTASSIGN: {
                                String name = pool.getSymbol(bc[pc++]);
                                RValue v = loadVariable(name, env, ctx, code.sourceAt(insnPc));
                                if (!env.hasLocal(name)) {
                                    v.markShared();
                                }
                                stack.push(v);
                                break;
                            }

                            case Opcodes.LDDDVAR: {
                                String name = pool.getSymbol(bc[pc++]);
                                stack.push(loadDotDot(name, env, ctx, code.sourceAt(insnPc)));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.LDFUN: {
                                String name = pool.getSymbol(bc[pc++]);
                                stack.push(findFunction(name, env, ctx, code.sourceAt(insnPc)));
                                break;
                            }

                            case Opcodes.STVAR: {
                                env.define(pool.getSymbol(bc[pc++]), stack.pop());
                                break;
                            }

                            case Opcodes.IS: {
                                int typeOrdinal = bc[pc++];
                                RValue v = stack.pop();
                                stack.push(RLogical.valueOf(v.type().ordinal() == typeOrdinal));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.ISFUN: {
                                if (!stack.peek().isFunction()) {
                                    throw new RError(ErrorKind.NOT_CALLABLE, "attempt to apply non-function",
                                            code.sourceAt(insnPc));
                                }
                                break;
                            }

                            // =================================================================
                            // PROMISES AND CLOSURES
                            // =================================================================

                            case Opcodes.PROMISE: {
                                stack.push(new RPromise(function.codeAt(bc[pc++]), env));
                                break;
                            }

                            case Opcodes.PUSH_CODE: {
                                stack.push(new RCodeRef(function.codeAt(bc[pc++])));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.FORCE: {
                                stack.setTop(RPromise.forceValue(stack.peek(), ctx));
                                break;
                            }

                            case Opcodes.CLOSE: {
                                CompiledFunction template = (CompiledFunction) pool.get(bc[pc++]);
                                stack.push(new RClosure(template, env));
                                ctx.visible = true;
                                break;
                            }

                            // =================================================================
                            // CONTROL FLOW
                            // =================================================================

                            case Opcodes.BR: {
                                int offset = bc[pc++];
                                pc = jump(bc, pc, offset);
                                if (pc <= insnPc) {
                                    ctx.countStep();
                                }
                                break;
                            }

                            case Opcodes.BRTRUE: {
                                int offset = bc[pc++];
                                if (logicalScalar(stack.pop()) == 1) {
                                    pc = jump(bc, pc, offset);
                                }
                                break;
                            }

                            case Opcodes.BRFALSE: {
                                int offset = bc[pc++];
                                if (logicalScalar(stack.pop()) == 0) {
                                    pc = jump(bc, pc, offset);
                                }
                                break;
                            }

                            case Opcodes.BROBJ: {
                                int offset = bc[pc++];
                                if (stack.peek().isObject()) {
                                    pc = jump(bc, pc, offset);
                                }
                                break;
                            }

                            case Opcodes.BRNOTNUM: {
                                int offset = bc[pc++];
                                if (!isSimpleNumber(stack.peek(1)) || !isSimpleNumber(stack.peek())) {
                                    pc = jump(bc, pc, offset);
                                }
                                break;
                            }

                            case Opcodes.BEGINLOOP: {
                                int offset = bc[pc++];
                                int exitPc = jump(bc, pc, offset);
                                contexts.pushLoop(stack.size(), pc, exitPc, env);
                                break;
                            }

                            case Opcodes.ENDCONTEXT: {
                                ControlContext context = contexts.pop();
                                stack.truncate(context.stackDepth);
                                break;
                            }

                            case Opcodes.RET: {
                                RValue result = stack.pop();
                                if (stack.size() != stackBase) {
                                    throw new RError(ErrorKind.BOUNDS_VIOLATION, "operand stack holds "
                                            + (stack.size() - stackBase) + " stray values at return");
                                }
                                return result;
                            }

                            // =================================================================
                            // CALLS
                            // =================================================================

                            case Opcodes.CALL: {
                                int[] argIndices = (int[]) pool.get(bc[pc++]);
                                String[] names = names(pool, bc[pc++]);
                                CallNode call = (CallNode) code.sourceAt(insnPc);
                                RValue result = CallProtocol.callWithPromises(stack.peek(), function,
                                        argIndices, names, call, env, ctx);
                                stack.setTop(result);
                                break;
                            }

                            case Opcodes.CALL_STACK: {
                                int n = bc[pc++];
                                String[] names = names(pool, bc[pc++]);
                                CallNode call = (CallNode) code.sourceAt(insnPc);
                                RValue result = CallProtocol.callWithStack(stack.peek(n), stack.top(n),
                                        names, call, env, ctx);
                                stack.popN(n + 1);
                                stack.push(result);
                                break;
                            }

                            case Opcodes.DISPATCH: {
                                int[] argIndices = (int[]) pool.get(bc[pc++]);
                                String[] names = names(pool, bc[pc++]);
                                String selector = pool.getSymbol(bc[pc++]);
                                CallNode call = (CallNode) code.sourceAt(insnPc);
                                RValue receiver = stack.pop();
                                ArgumentList args = CallProtocol.promiseArguments(function, argIndices, names,
                                        env, call);
                                args.set(0, RPromise.forced(call.arg(0), receiver));
                                stack.push(DispatchResolver.dispatch(selector, receiver, args, call, env, ctx));
                                break;
                            }

                            case Opcodes.DISPATCH_STACK: {
                                int n = bc[pc++];
                                String[] names = names(pool, bc[pc++]);
                                String selector = pool.getSymbol(bc[pc++]);
                                CallNode call = (CallNode) code.sourceAt(insnPc);
                                RValue[] values = stack.top(n);
                                ArgumentList args = new ArgumentList();
                                for (int i = 0; i < n; i++) {
                                    args.add(names == null ? null : names[i], values[i]);
                                }
                                RValue receiver = RPromise.forceValue(values[0], ctx);
                                RValue result = DispatchResolver.dispatch(selector, receiver, args, call, env, ctx);
                                stack.popN(n);
                                stack.push(result);
                                break;
                            }

                            // =================================================================
                            // LOGICAL
                            // =================================================================

                            case Opcodes.ASBOOL: {
                                stack.setTop(asBool(stack.peek(), code.sourceAt(insnPc)));
                                break;
                            }

                            case Opcodes.ASLOGICAL: {
                                RValue v = stack.peek();
                                if (!(v instanceof RVector)) {
                                    throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid 'x' type in 'x && y'",
                                            code.sourceAt(insnPc));
                                }
                                stack.setTop(RLogical.valueOf(v.length() == 0 ? RLogical.NA : RVector.asLogical(v)));
                                break;
                            }

                            case Opcodes.LGL_AND: {
                                int b = logicalScalar(stack.pop());
                                int a = logicalScalar(stack.peek());
                                int r = a == 0 || b == 0 ? 0 : (a == RLogical.NA || b == RLogical.NA ? RLogical.NA : 1);
                                stack.setTop(RLogical.valueOf(r));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.LGL_OR: {
                                int b = logicalScalar(stack.pop());
                                int a = logicalScalar(stack.peek());
                                int r = a == 1 || b == 1 ? 1 : (a == RLogical.NA || b == RLogical.NA ? RLogical.NA : 0);
                                stack.setTop(RLogical.valueOf(r));
                                ctx.visible = true;
                                break;
                            }

                            // =================================================================
                            // ARITHMETIC FAST PATHS
                            // =================================================================

                            case Opcodes.ADD:
                            case Opcodes.SUB:
                            case Opcodes.MUL:
                            case Opcodes.LT: {
                                RValue b = stack.pop();
                                RValue a = stack.peek();
                                stack.setTop(ArithmeticOperators.binary(arithmeticOperator(opcode), a, b,
                                        code.sourceAt(insnPc)));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.INC: {
                                RInteger counter = (RInteger) stack.peek().ensureUnshared();
                                counter.values[0]++;
                                stack.setTop(counter);
                                break;
                            }

                            // =================================================================
                            // SUBSETTING
                            // =================================================================

                            case Opcodes.EXTRACT1: {
                                RValue index = stack.pop();
                                RValue x = stack.peek();
                                stack.setTop(SubsetOperators.extract2(x, index, code.sourceAt(insnPc)));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.SUBSET1: {
                                RValue index = stack.pop();
                                RValue x = stack.peek();
                                stack.setTop(SubsetOperators.subset(x, index, code.sourceAt(insnPc)));
                                ctx.visible = true;
                                break;
                            }

                            case Opcodes.TEST_BOUNDS: {
                                RValue seq = stack.peek(1);
                                int index = ((RInteger) stack.peek()).values[0];
                                stack.push(RLogical.valueOf(index <= sequenceLength(seq, code.sourceAt(insnPc))));
                                break;
                            }

                            // =================================================================
                            // SHARING AND VISIBILITY
                            // =================================================================

                            case Opcodes.UNIQ: {
                                stack.setTop(stack.peek().ensureUnshared());
                                break;
                            }

                            case Opcodes.INVISIBLE: {
                                ctx.visible = false;
                                break;
                            }

                            case Opcodes.VISIBLE: {
                                ctx.visible = true;
                                break;
                            }

                            default:
                                throw new RError(ErrorKind.BOUNDS_VIOLATION,
                                        "invalid opcode " + opcode + " at pc " + insnPc);
                        }
                    }
                } catch (ControlFlowException e) {
                    ControlContext target = e.target();
                    if (target.kind != ControlContext.Kind.LOOP || contexts.indexOf(target) < contextBase) {
                        throw e;
                    }
                    contexts.unwindTo(target);
                    stack.truncate(target.stackDepth);
                    pc = e.completion().type() == ControlFlowType.CONTINUE ? target.headPc : target.exitPc;
                }
            }
        } finally {
            contexts.truncate(contextBase);
            ctx.exitEvaluation();
        }
    }

    // =========================================================================
    // helpers
    // =========================================================================

    private static int jump(int[] bc, int pcAfter, int offset) {
        int target = pcAfter + offset;
        if (target < 0 || target >= bc.length) {
            throw new RError(ErrorKind.BOUNDS_VIOLATION,
                    "branch target " + target + " outside code of length " + bc.length);
        }
        return target;
    }

    private static String[] names(ConstantPool pool, int index) {
        return index == Opcodes.NO_NAMES ? null : (String[]) pool.get(index);
    }

    private static String arithmeticOperator(short opcode) {
        return switch (opcode) {
            case Opcodes.ADD -> "+";
            case Opcodes.SUB -> "-";
            case Opcodes.MUL -> "*";
            default -> "<";
        };
    }

    /**
     * Value of a logical scalar: 1, 0 or NA. Anything else is treated as NA.
     */
    private static int logicalScalar(RValue v) {
        if (v instanceof RLogical l && l.length() == 1) {
            return l.values[0];
        }
        return RLogical.NA;
    }

    static boolean isSimpleNumber(RValue v) {
        return (v instanceof RInteger || v instanceof RReal) && v.length() == 1 && !v.hasAttributes();
    }

    /**
     * Condition value of {@code if} and {@code while}: a non-NA logical scalar.
     */
    public static RLogical asBool(RValue v, Node source) {
        if (!(v instanceof RVector)) {
            throw new RError(ErrorKind.INVALID_ARGUMENT,
                    "argument is not interpretable as logical", source);
        }
        if (v.length() == 0) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "argument is of length zero", source);
        }
        int l = RVector.asLogical(v);
        if (l == RLogical.NA) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "missing value where TRUE/FALSE needed", source);
        }
        return RLogical.valueOf(l == 1);
    }

    private static int sequenceLength(RValue seq, Node source) {
        if (seq instanceof RVector || seq == RNull.NULL) {
            return seq.length();
        }
        throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid for() loop sequence", source);
    }

    private static RValue loadVariable(String name, REnvironment env, InterpreterContext ctx, Node source) {
        RValue v = env.lookup(name);
        if (v == null) {
            throw new RError(ErrorKind.UNBOUND_VARIABLE, "object '" + name + "' not found", source);
        }
        if (v == RMissingArg.MISSING) {
            throw new RError(ErrorKind.MISSING_ARGUMENT,
                    "argument \"" + name + "\" is missing, with no default", source);
        }
        if (v instanceof RPromise promise) {
            v = promise.force(ctx);
        }
        if (v.shareLevel() == SharingLevel.UNSHARED) {
            v.bump();
        }
        return v;
    }

    private static RValue loadDotDot(String name, REnvironment env, InterpreterContext ctx, Node source) {
        int n = Integer.parseInt(name.substring(2));
        RValue dots = env.lookup("...");
        if (!(dots instanceof RPairlist list)) {
            throw new RError(ErrorKind.UNBOUND_VARIABLE,
                    "'" + name + "' used in an incorrect context, no ... to look in", source);
        }
        if (n > list.size()) {
            throw new RError(ErrorKind.ARITY_MISMATCH,
                    "the ... list does not contain " + n + " elements", source);
        }
        RValue v = list.value(n - 1);
        if (v == RMissingArg.MISSING) {
            throw new RError(ErrorKind.MISSING_ARGUMENT,
                    "argument \"" + name + "\" is missing, with no default", source);
        }
        return RPromise.forceValue(v, ctx);
    }

    /**
     * Nearest binding of name whose value is a function. Promises met on the way
     * are forced; non-function bindings are skipped.
     *
     * @throws RError UNBOUND_VARIABLE when name is not bound at all, NOT_CALLABLE when
     *                no binding of it is a function
     */
    public static RValue findFunction(String name, REnvironment env, InterpreterContext ctx, Node source) {
        boolean bound = false;
        for (REnvironment e = env; e != null; e = e.parent()) {
            RValue v = e.getLocal(name);
            if (v == null) {
                continue;
            }
            bound = true;
            if (v instanceof RPromise promise) {
                v = promise.force(ctx);
            }
            if (v.isFunction()) {
                return v;
            }
        }
        if (bound) {
            throw new RError(ErrorKind.NOT_CALLABLE, "attempt to apply non-function: '" + name + "'", source);
        }
        throw new RError(ErrorKind.UNBOUND_VARIABLE, "could not find function \"" + name + "\"", source);
    }
}
