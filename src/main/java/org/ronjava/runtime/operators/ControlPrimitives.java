package org.ronjava.runtime.operators;

import org.ronjava.backend.bytecode.BytecodeCompiler;
import org.ronjava.backend.bytecode.BytecodeInterpreter;
import org.ronjava.backend.bytecode.InterpreterContext;
import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.frontend.astnode.ConstantNode;
import org.ronjava.frontend.astnode.MissingArgNode;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.frontend.astnode.SymbolNode;
import org.ronjava.runtime.runtimetypes.Completion;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RCodeRef;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RPromise;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;

/**
 * Lazy primitives: they receive the unevaluated call and evaluate arguments
 * themselves.
 * <p>
 * Loops reached here were not lowered by the compiler (the call was made
 * indirectly); they compile the call on the spot and run it. {@code break},
 * {@code next} and {@code return} raise a transfer aimed at the innermost matching
 * context of the calling environment.
 */
public class ControlPrimitives {

    private ControlPrimitives() {
    }

    public static RValue block(CallNode call, REnvironment env, InterpreterContext ctx) {
        RValue result = RNull.NULL;
        ctx.visible = true;
        for (CallNode.Argument arg : call.args) {
            result = BytecodeInterpreter.eval(arg.value, env, ctx);
        }
        return result;
    }

    public static RValue paren(CallNode call, REnvironment env, InterpreterContext ctx) {
        checkArity(call, 1);
        return BytecodeInterpreter.eval(call.arg(0), env, ctx);
    }

    public static RValue ifElse(CallNode call, REnvironment env, InterpreterContext ctx) {
        if (call.argCount() < 2 || call.argCount() > 3) {
            throw new RError(ErrorKind.ARITY_MISMATCH, "malformed if statement", call);
        }
        RValue condition = BytecodeInterpreter.eval(call.arg(0), env, ctx);
        if (BytecodeInterpreter.asBool(condition, call) == RLogical.TRUE) {
            return BytecodeInterpreter.eval(call.arg(1), env, ctx);
        }
        if (call.argCount() == 3) {
            return BytecodeInterpreter.eval(call.arg(2), env, ctx);
        }
        ctx.visible = false;
        return RNull.NULL;
    }

    /**
     * {@code while}, {@code repeat} and {@code for}.
     */
    public static RValue loop(CallNode call, REnvironment env, InterpreterContext ctx) {
        if (!BytecodeCompiler.isLoopForm(call)) {
            throw new RError(ErrorKind.ARITY_MISMATCH, "invalid " + call.functionName() + " loop", call);
        }
        return BytecodeInterpreter.eval(call, env, ctx);
    }

    public static RValue breakLoop(CallNode call, REnvironment env, InterpreterContext ctx) {
        throw ctx.contexts.signal(Completion.breakLoop(), env, call);
    }

    public static RValue nextIteration(CallNode call, REnvironment env, InterpreterContext ctx) {
        throw ctx.contexts.signal(Completion.continueLoop(), env, call);
    }

    public static RValue returnValue(CallNode call, REnvironment env, InterpreterContext ctx) {
        if (call.argCount() > 1) {
            throw new RError(ErrorKind.ARITY_MISMATCH, "multi-argument returns are not permitted", call);
        }
        RValue value = call.argCount() == 0 ? RNull.NULL : BytecodeInterpreter.eval(call.arg(0), env, ctx);
        throw ctx.contexts.signal(Completion.returnValue(value), env, call);
    }

    /**
     * {@code quote(expr)}: literals stand for themselves, other expressions become
     * code references.
     */
    public static RValue quote(CallNode call, REnvironment env, InterpreterContext ctx) {
        checkArity(call, 1);
        Node expr = expressionOf(call.arg(0));
        if (expr instanceof ConstantNode constant) {
            return constant.value;
        }
        return new RCodeRef(BytecodeInterpreter.compile(expr, ctx).body());
    }

    public static RValue dollar(CallNode call, REnvironment env, InterpreterContext ctx) {
        checkArity(call, 2);
        RValue x = BytecodeInterpreter.eval(call.arg(0), env, ctx);
        ctx.visible = true;
        return SubsetOperators.dollar(x, memberName(call.arg(1), call), call);
    }

    public static RValue dollarAssign(CallNode call, REnvironment env, InterpreterContext ctx) {
        checkArity(call, 3);
        RValue x = BytecodeInterpreter.eval(call.arg(0), env, ctx);
        String name = memberName(call.arg(1), call);
        RValue value = BytecodeInterpreter.eval(call.arg(2), env, ctx);
        ctx.visible = true;
        return SubsetOperators.dollarAssign(x, name, value, call);
    }

    /**
     * {@code missing(x)}: whether the formal x was left without an argument,
     * following promises that just pass on another formal.
     */
    public static RValue missing(CallNode call, REnvironment env, InterpreterContext ctx) {
        checkArity(call, 1);
        if (!(expressionOf(call.arg(0)) instanceof SymbolNode sym)) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid use of 'missing'", call);
        }
        if (!env.hasLocal(sym.name)) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "'missing' can only be used for arguments", call);
        }
        ctx.visible = true;
        return RLogical.valueOf(isMissing(env.getLocal(sym.name)));
    }

    private static boolean isMissing(RValue binding) {
        if (binding == RMissingArg.MISSING) {
            return true;
        }
        if (binding instanceof RPromise promise) {
            if (promise.isDefaultArgument()) {
                return true;
            }
            if (!promise.isForced() && promise.expression() instanceof SymbolNode sym && promise.env() != null
                    && promise.env().hasLocal(sym.name)) {
                return isMissing(promise.env().getLocal(sym.name));
            }
        }
        return false;
    }

    /**
     * The expression of an argument node. A call rebuilt from stack values carries
     * pending arguments as promise constants; those read as the promise's expression.
     */
    private static Node expressionOf(Node node) {
        if (node instanceof ConstantNode constant && constant.value instanceof RPromise promise
                && !promise.isForced()) {
            return promise.expression();
        }
        return node;
    }

    private static String memberName(Node argument, CallNode call) {
        Node node = expressionOf(argument);
        if (node instanceof SymbolNode sym) {
            return sym.name;
        }
        if (node instanceof ConstantNode constant && constant.value instanceof RString s && s.length() == 1) {
            return s.values[0];
        }
        if (node instanceof MissingArgNode) {
            throw new RError(ErrorKind.MISSING_ARGUMENT, "argument \"name\" is missing, with no default", call);
        }
        throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid subscript type", call);
    }

    private static void checkArity(CallNode call, int expected) {
        if (call.argCount() != expected) {
            throw new RError(ErrorKind.ARITY_MISMATCH, call.argCount() + " arguments passed to '"
                    + call.functionName() + "' which requires " + expected, call);
        }
    }
}
