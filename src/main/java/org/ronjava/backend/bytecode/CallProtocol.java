package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.MissingArgNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.frontend.astnode.SymbolNode;
import org.ronjava.runtime.runtimetypes.ArgumentList;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RClosure;
import org.ronjava.runtime.runtimetypes.RCodeRef;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RPairlist;
import org.ronjava.runtime.runtimetypes.RPrimitive;
import org.ronjava.runtime.runtimetypes.RPromise;
import org.ronjava.runtime.runtimetypes.RValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies functions of the three kinds.
 * <ul>
 *   <li>BUILTIN: every argument is evaluated first, {@code ...} is spliced in forced;</li>
 *   <li>SPECIAL: receives the unevaluated call and the calling environment;</li>
 *   <li>CLOSURE: arguments are matched to formals in a new environment whose parent
 *       is the closure environment, and the body runs inside a call context.</li>
 * </ul>
 */
public final class CallProtocol {

    private CallProtocol() {
    }

    /**
     * CALL: arguments are promise codes of the calling function.
     */
    static RValue callWithPromises(RValue callee, CompiledFunction caller, int[] argIndices, String[] names,
                                   CallNode call, REnvironment env, InterpreterContext ctx) {
        if (callee instanceof RPrimitive primitive) {
            if (!primitive.isEager()) {
                return applySpecial(primitive, call, env, ctx);
            }
            ArgumentList args = new ArgumentList();
            for (int i = 0; i < argIndices.length; i++) {
                String name = names == null ? null : names[i];
                switch (argIndices[i]) {
                    case Opcodes.DOTS_ARG_IDX -> spliceDots(args, env, ctx, call, true);
                    case Opcodes.MISSING_ARG_IDX -> args.add(name, RMissingArg.MISSING);
                    default -> args.add(name, BytecodeInterpreter.execute(caller.codeAt(argIndices[i]), env, ctx));
                }
            }
            return applyBuiltin(primitive, call, args, env, ctx);
        }
        if (callee instanceof RClosure closure) {
            return applyClosure(closure, promiseArguments(caller, argIndices, names, env, call), call, ctx);
        }
        throw notCallable(call);
    }

    /**
     * Promise argument list for a CALL or DISPATCH site, with {@code ...} spliced in.
     */
    static ArgumentList promiseArguments(CompiledFunction caller, int[] argIndices, String[] names,
                                         REnvironment env, Node call) {
        ArgumentList args = new ArgumentList();
        for (int i = 0; i < argIndices.length; i++) {
            String name = names == null ? null : names[i];
            switch (argIndices[i]) {
                case Opcodes.DOTS_ARG_IDX -> spliceDots(args, env, null, call, false);
                case Opcodes.MISSING_ARG_IDX -> args.add(name, RMissingArg.MISSING);
                default -> args.add(name, new RPromise(caller.codeAt(argIndices[i]), env));
            }
        }
        return args;
    }

    /**
     * CALL_STACK: the arguments are values (or promises) already on the operand stack.
     * A special receives the call with its {@code *tmp*} and {@code *vtmp*} placeholders
     * replaced by the first and last stack value.
     */
    static RValue callWithStack(RValue callee, RValue[] values, String[] names, CallNode call,
                                REnvironment env, InterpreterContext ctx) {
        if (callee instanceof RPrimitive primitive && !primitive.isEager()) {
            CallNode filled = call != null ? fillPlaceholders(call, values, env)
                    : rebuildCall(new SymbolNode(primitive.name), stackArguments(values, names), env);
            return applySpecial(primitive, filled, env, ctx);
        }
        return apply(callee, stackArguments(values, names), call, env, ctx);
    }

    private static ArgumentList stackArguments(RValue[] values, String[] names) {
        ArgumentList args = new ArgumentList();
        for (int i = 0; i < values.length; i++) {
            args.add(names == null ? null : names[i], values[i]);
        }
        return args;
    }

    /**
     * Applies any function to an argument list of promises and values. A special
     * gets a call rebuilt from the arguments: evaluated ones as constants, pending
     * ones as their expressions (see {@link #valueNode}).
     */
    public static RValue apply(RValue function, ArgumentList args, Node call, REnvironment env,
                               InterpreterContext ctx) {
        if (function instanceof RPrimitive primitive) {
            if (primitive.isEager()) {
                ArgumentList forced = new ArgumentList();
                for (int i = 0; i < args.size(); i++) {
                    RValue v = args.value(i);
                    forced.add(args.name(i), v == RMissingArg.MISSING ? v : RPromise.forceValue(v, ctx));
                }
                return applyBuiltin(primitive, asCall(call, primitive), forced, env, ctx);
            }
            Node functionNode = call instanceof CallNode c ? c.function : new SymbolNode(primitive.name);
            return applySpecial(primitive, rebuildCall(functionNode, args, env), env, ctx);
        }
        if (function instanceof RClosure closure) {
            return applyClosure(closure, args, call, ctx);
        }
        throw notCallable(call);
    }

    public static RValue applyClosure(RClosure closure, ArgumentList args, Node call, InterpreterContext ctx) {
        REnvironment frame = new REnvironment(closure.env);
        ArgumentMatcher.match(closure.formals(), args, frame, call);

        OperandStack stack = ctx.stack;
        ControlContext context = ctx.contexts.pushCall(stack.size(), frame);
        if (ctx.options.trace) {
            System.err.println("enter " + describeCall(call) + " depth=" + ctx.contexts.size());
        }
        try {
            RValue result = BytecodeInterpreter.execute(closure.body(), frame, ctx);
            if (stack.size() != context.stackDepth) {
                throw new RError(ErrorKind.BOUNDS_VIOLATION, "operand stack not restored after call", call);
            }
            if (ctx.options.trace) {
                System.err.println("exit  " + describeCall(call));
            }
            return result;
        } catch (ControlFlowException e) {
            if (e.target() != context) {
                throw e;
            }
            stack.truncate(context.stackDepth);
            ctx.visible = true;
            return e.completion().value();
        } finally {
            ctx.contexts.popThrough(context);
        }
    }

    private static String describeCall(Node call) {
        return call instanceof CallNode c && c.functionName() != null ? c.functionName() : "<closure>";
    }

    private static RValue applySpecial(RPrimitive primitive, CallNode call, REnvironment env, InterpreterContext ctx) {
        RValue result = primitive.specialFunction().apply(call, env, ctx);
        applyVisibility(primitive, ctx);
        return result;
    }

    private static RValue applyBuiltin(RPrimitive primitive, CallNode call, ArgumentList args, REnvironment env,
                                       InterpreterContext ctx) {
        ctx.visible = true;
        RValue result = primitive.builtinFunction().apply(call, args, env, ctx);
        applyVisibility(primitive, ctx);
        return result;
    }

    private static void applyVisibility(RPrimitive primitive, InterpreterContext ctx) {
        switch (primitive.visibility) {
            case FORCE_ON -> ctx.visible = true;
            case FORCE_OFF -> ctx.visible = false;
            case SET_BY_FUNCTION -> {
            }
        }
    }

    /**
     * Appends the entries of the {@code ...} binding of env.
     */
    private static void spliceDots(ArgumentList args, REnvironment env, InterpreterContext ctx, Node call,
                                   boolean force) {
        RValue dots = env.lookup(SymbolNode.DOTS);
        if (dots == null || dots == RMissingArg.MISSING) {
            throw new RError(ErrorKind.UNBOUND_VARIABLE, "'...' used in an incorrect context", call);
        }
        RPairlist list = (RPairlist) dots;
        for (int i = 0; i < list.size(); i++) {
            RValue v = list.value(i);
            if (force && v != RMissingArg.MISSING) {
                v = RPromise.forceValue(v, ctx);
            }
            args.add(list.tag(i), v);
        }
    }

    private static CallNode fillPlaceholders(CallNode call, RValue[] values, REnvironment env) {
        List<CallNode.Argument> args = new ArrayList<>(call.argCount());
        for (CallNode.Argument arg : call.args) {
            Node value = arg.value;
            if (value instanceof SymbolNode sym) {
                if (sym.name.equals(CompileAssignment.OBJECT_PLACEHOLDER)) {
                    value = valueNode(values[0], env);
                } else if (sym.name.equals(CompileAssignment.VALUE_PLACEHOLDER)) {
                    value = valueNode(values[values.length - 1], env);
                }
            }
            args.add(new CallNode.Argument(arg.name, value));
        }
        return call.withArgs(call.function, args);
    }

    /**
     * Node standing for an already computed value. Language objects are quoted so a
     * special evaluating the node gets the object back instead of running it. A
     * pending promise of env is re-expressed as its expression; one created in another
     * environment stays a promise, so it is still evaluated where it was made.
     */
    static Node valueNode(RValue value, REnvironment env) {
        if (value instanceof RPromise promise) {
            if (promise.isForced()) {
                return valueNode(promise.value(), env);
            }
            return promise.env() == env ? promise.expression() : new ConstantNode(promise);
        }
        if (value instanceof RCodeRef ref) {
            return new CallNode(new SymbolNode("quote"), List.of(CallNode.Argument.positional(ref.expression())));
        }
        return new ConstantNode(value);
    }

    private static CallNode rebuildCall(Node function, ArgumentList args, REnvironment env) {
        List<CallNode.Argument> nodes = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            RValue v = args.value(i);
            Node node = v == RMissingArg.MISSING ? new MissingArgNode() : valueNode(v, env);
            nodes.add(new CallNode.Argument(args.name(i), node));
        }
        return new CallNode(function, nodes);
    }

    private static CallNode asCall(Node call, RPrimitive primitive) {
        return call instanceof CallNode c ? c : new CallNode(new SymbolNode(primitive.name), List.of());
    }

    private static RError notCallable(Node call) {
        return new RError(ErrorKind.NOT_CALLABLE, "attempt to apply non-function", call);
    }
}
