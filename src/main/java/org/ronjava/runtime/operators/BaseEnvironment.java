package org.ronjava.runtime.operators;

import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.runtime.runtimetypes.ArgumentList;
import org.ronjava.runtime.runtimetypes.BuiltinFunction;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RPrimitive;
import org.ronjava.runtime.runtimetypes.RPrimitive.Visibility;
import org.ronjava.runtime.runtimetypes.RValue;
import org.ronjava.runtime.runtimetypes.SpecialFunction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The table of primitives bound in the base environment.
 */
public final class BaseEnvironment {
    static final Map<String, RPrimitive> primitives = new LinkedHashMap<>();

    static {
        // Arithmetic and comparison
        for (String op : new String[]{"+", "-", "*", "/", "<", ">", "<=", ">=", "==", "!="}) {
            putBuiltin(op, (call, args, env, ctx) -> arithmetic(op, call, args));
        }
        putBuiltin("!", (call, args, env, ctx) -> ArithmeticOperators.not(BaseFunctions.argument(args, 0, call), call));

        // Constructors and structure
        putBuiltin("c", BaseFunctions::combine);
        putBuiltin("list", BaseFunctions::list);
        putBuiltin("length", BaseFunctions::length);

        // Attributes
        putBuiltin("names", (call, args, env, ctx) -> AttributeOperators.names(BaseFunctions.argument(args, 0, call)));
        putBuiltin("names<-", (call, args, env, ctx) ->
                AttributeOperators.setNames(BaseFunctions.argument(args, 0, call), value(args, call), call));
        putBuiltin("class", (call, args, env, ctx) -> AttributeOperators.classOf(BaseFunctions.argument(args, 0, call)));
        putBuiltin("class<-", (call, args, env, ctx) ->
                AttributeOperators.setClass(BaseFunctions.argument(args, 0, call), value(args, call), call));
        putBuiltin("attr", (call, args, env, ctx) -> AttributeOperators.attr(BaseFunctions.argument(args, 0, call),
                AttributeOperators.stringArgument(BaseFunctions.argument(args, 1, call), "which", call)));
        putBuiltin("attr<-", (call, args, env, ctx) -> AttributeOperators.setAttr(BaseFunctions.argument(args, 0, call),
                AttributeOperators.stringArgument(BaseFunctions.argument(args, 1, call), "which", call),
                value(args, call), call));

        // Indexing defaults
        putBuiltin("[[", (call, args, env, ctx) ->
                SubsetOperators.extract2(BaseFunctions.argument(args, 0, call), BaseFunctions.argument(args, 1, call), call));
        putBuiltin("[", (call, args, env, ctx) -> SubsetOperators.subset(BaseFunctions.argument(args, 0, call),
                args.size() > 1 ? args.value(1) : RMissingArg.MISSING, call));
        putBuiltin("[[<-", (call, args, env, ctx) -> SubsetOperators.assign2(BaseFunctions.argument(args, 0, call),
                BaseFunctions.argument(args, 1, call), value(args, call), call));
        putBuiltin("[<-", (call, args, env, ctx) -> SubsetOperators.assignSubset(BaseFunctions.argument(args, 0, call),
                args.size() > 2 ? args.value(1) : RMissingArg.MISSING, value(args, call), call));

        // Other eager functions
        putBuiltin("print", Visibility.FORCE_OFF, BaseFunctions::print);
        putBuiltin("identity", BaseFunctions::identity);
        putBuiltin("force", BaseFunctions::identity);
        putBuiltin("invisible", Visibility.FORCE_OFF, BaseFunctions::invisible);
        putBuiltin("is.null", BaseFunctions::isNull);
        putBuiltin("is.list", BaseFunctions::isList);
        putBuiltin("is.pairlist", BaseFunctions::isPairlist);
        putBuiltin("eval", Visibility.SET_BY_FUNCTION, BaseFunctions::eval);

        // Lazy primitives
        putSpecial("{", ControlPrimitives::block);
        putSpecial("(", Visibility.FORCE_ON, ControlPrimitives::paren);
        putSpecial("if", ControlPrimitives::ifElse);
        putSpecial("while", ControlPrimitives::loop);
        putSpecial("repeat", ControlPrimitives::loop);
        putSpecial("for", ControlPrimitives::loop);
        putSpecial("break", ControlPrimitives::breakLoop);
        putSpecial("next", ControlPrimitives::nextIteration);
        putSpecial("return", ControlPrimitives::returnValue);
        putSpecial("quote", Visibility.FORCE_ON, ControlPrimitives::quote);
        putSpecial("$", ControlPrimitives::dollar);
        putSpecial("$<-", ControlPrimitives::dollarAssign);
        putSpecial("missing", ControlPrimitives::missing);
    }

    private BaseEnvironment() {
    }

    private static void putBuiltin(String name, BuiltinFunction function) {
        primitives.put(name, RPrimitive.builtin(name, function));
    }

    private static void putBuiltin(String name, Visibility visibility, BuiltinFunction function) {
        primitives.put(name, RPrimitive.builtin(name, visibility, function));
    }

    private static void putSpecial(String name, SpecialFunction function) {
        primitives.put(name, RPrimitive.special(name, function));
    }

    private static void putSpecial(String name, Visibility visibility, SpecialFunction function) {
        primitives.put(name, RPrimitive.special(name, visibility, function));
    }

    /**
     * A new environment holding every primitive, with no parent.
     */
    public static REnvironment create() {
        REnvironment base = new REnvironment(null, "base");
        for (Map.Entry<String, RPrimitive> entry : primitives.entrySet()) {
            base.define(entry.getKey(), entry.getValue());
        }
        return base;
    }

    public static RPrimitive get(String name) {
        return primitives.get(name);
    }

    private static RValue arithmetic(String op, CallNode call, ArgumentList args) {
        if (args.size() == 1 && (op.equals("-") || op.equals("+"))) {
            RValue x = BaseFunctions.argument(args, 0, call);
            return op.equals("-") ? ArithmeticOperators.negate(x, call) : x;
        }
        if (args.size() != 2) {
            throw new RError(ErrorKind.ARITY_MISMATCH, "operator needs two arguments", call);
        }
        return ArithmeticOperators.binary(op, BaseFunctions.argument(args, 0, call),
                BaseFunctions.argument(args, 1, call), call);
    }

    // the replacement value: the argument named value, else the last one
    private static RValue value(ArgumentList args, CallNode call) {
        if (args.size() < 2) {
            throw new RError(ErrorKind.ARITY_MISMATCH, "replacement function needs a value argument", call);
        }
        RValue v = args.named("value");
        if (v == null) {
            v = BaseFunctions.argument(args, args.size() - 1, call);
        }
        return v;
    }
}
