package org.ronjava.runtime.mro;

import org.ronjava.backend.bytecode.BytecodeInterpreter;
import org.ronjava.backend.bytecode.CallProtocol;
import org.ronjava.backend.bytecode.InterpreterContext;
import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.runtimetypes.ArgumentList;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RValue;

/**
 * Chooses the function a generic call on an object receiver runs.
 * <p>
 * Order: the class-based method registry when the receiver has a class, then the
 * formal method table when the receiver is flagged as a formal object, then the
 * plain function of the selector name.
 */
public final class DispatchResolver {

    private static final boolean TRACE_DISPATCH = System.getenv("RONJAVA_TRACE_DISPATCH") != null;

    private DispatchResolver() {
    }

    public static RValue dispatch(String selector, RValue receiver, ArgumentList args, Node call,
                                  REnvironment env, InterpreterContext ctx) {
        RValue method = resolve(selector, receiver, env, ctx, call);
        return CallProtocol.apply(method, args, call, env, ctx);
    }

    public static RValue resolve(String selector, RValue receiver, REnvironment env, InterpreterContext ctx,
                                 Node call) {
        if (receiver.isObject()) {
            RValue method = ctx.methodRegistry().lookup(receiver.classVector(), selector, env);
            if (method != null) {
                trace(selector, receiver, "class method");
                return method;
            }
        }
        FormalMethodTable formalMethods = ctx.formalMethods();
        if (receiver.isFormalObject() && formalMethods != null) {
            RValue method = formalMethods.lookup(receiver, selector);
            if (method != null) {
                trace(selector, receiver, "formal method");
                return method;
            }
        }
        trace(selector, receiver, "default");
        return BytecodeInterpreter.findFunction(selector, env, ctx, call);
    }

    private static void trace(String selector, RValue receiver, String outcome) {
        if (TRACE_DISPATCH) {
            System.err.println("dispatch " + selector + " on " + receiver.classVector() + ": " + outcome);
        }
    }
}
