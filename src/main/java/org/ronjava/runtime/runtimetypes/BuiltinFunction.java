package org.ronjava.runtime.runtimetypes;

import org.ronjava.backend.bytecode.InterpreterContext;
import org.ronjava.frontend.astnode.CallNode;

/**
 * Implementation of an eager primitive. Arguments arrive fully evaluated.
 */
@FunctionalInterface
public interface BuiltinFunction {

    RValue apply(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx);
}
