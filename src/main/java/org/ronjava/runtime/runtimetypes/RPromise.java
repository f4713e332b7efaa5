package org.ronjava.runtime.runtimetypes;

import org.ronjava.backend.bytecode.BytecodeInterpreter;
import org.ronjava.backend.bytecode.Code;
import org.ronjava.backend.bytecode.InterpreterContext;
import org.ronjava.frontend.astnode.Node;

/**
 * A deferred computation: a code object (or a bare expression) and the environment
 * to evaluate it in. Forcing runs it at most once; the result is memoized and the
 * environment released.
 */
public final class RPromise extends RValue {
    private final Code code;
    private final Node expression;
    private REnvironment env;
    private RValue value;
    private boolean underEvaluation;
    private boolean defaultArgument;

    public RPromise(Code code, REnvironment env) {
        this.code = code;
        this.expression = code.source;
        this.env = env;
    }

    public RPromise(Node expression, REnvironment env) {
        this.code = null;
        this.expression = expression;
        this.env = env;
    }

    /**
     * A promise that is already forced, used to patch an evaluated receiver into
     * an argument list.
     */
    public static RPromise forced(Node expression, RValue value) {
        RPromise promise = new RPromise(expression, null);
        value.markShared();
        promise.value = value;
        return promise;
    }

    /**
     * A promise for the default value of a formal the caller did not supply.
     */
    public static RPromise defaultArgument(Code code, REnvironment env) {
        RPromise promise = new RPromise(code, env);
        promise.defaultArgument = true;
        return promise;
    }

    public boolean isDefaultArgument() {
        return defaultArgument;
    }

    public boolean isForced() {
        return value != null;
    }

    /**
     * The cached value, or null when not yet forced.
     */
    public RValue value() {
        return value;
    }

    public Node expression() {
        return expression;
    }

    public REnvironment env() {
        return env;
    }

    public RValue force(InterpreterContext ctx) {
        if (value != null) {
            return value;
        }
        if (underEvaluation) {
            throw new RError(ErrorKind.INVALID_ARGUMENT,
                    "promise already under evaluation: recursive default argument reference or earlier problems?",
                    expression);
        }
        underEvaluation = true;
        try {
            RValue result = code != null
                    ? BytecodeInterpreter.execute(code, env, ctx)
                    : BytecodeInterpreter.eval(expression, env, ctx);
            result.markShared();
            value = result;
            env = null;
            return result;
        } finally {
            underEvaluation = false;
        }
    }

    /**
     * Forces v when it is a promise, otherwise returns it unchanged.
     */
    public static RValue forceValue(RValue v, InterpreterContext ctx) {
        return v instanceof RPromise promise ? promise.force(ctx) : v;
    }

    @Override
    public ValueType type() {
        return ValueType.PROMISE;
    }

    @Override
    public String deparse() {
        return value != null ? value.deparse() : "<promise: " + expression + ">";
    }
}
