package org.ronjava.backend.bytecode;

import org.ronjava.frontend.astnode.Node;
import org.ronjava.frontend.astnode.SymbolNode;
import org.ronjava.runtime.runtimetypes.ArgumentList;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RPairlist;
import org.ronjava.runtime.runtimetypes.RPromise;
import org.ronjava.runtime.runtimetypes.RValue;

import java.util.List;

/**
 * Binds actual arguments to the formals of a closure.
 * <p>
 * Named arguments are matched exactly first. The remaining positional arguments
 * fill the unmatched formals before {@code ...} in order. Whatever is left goes to
 * {@code ...} when the closure has one and is an error otherwise. A formal left
 * without an argument is bound to a promise of its default, evaluated in the new
 * frame, or to the missing marker.
 */
final class ArgumentMatcher {

    private ArgumentMatcher() {
    }

    static void match(List<CompiledFunction.Formal> formals, ArgumentList args, REnvironment frame, Node call) {
        int formalCount = formals.size();
        int argCount = args.size();
        RValue[] bound = new RValue[formalCount];
        boolean[] used = new boolean[argCount];

        int dotsIndex = -1;
        for (int f = 0; f < formalCount; f++) {
            if (formals.get(f).isDots()) {
                dotsIndex = f;
                break;
            }
        }

        for (int i = 0; i < argCount; i++) {
            String name = args.name(i);
            if (name == null) {
                continue;
            }
            for (int f = 0; f < formalCount; f++) {
                if (f != dotsIndex && formals.get(f).name().equals(name)) {
                    if (bound[f] != null) {
                        throw new RError(ErrorKind.ARITY_MISMATCH,
                                "formal argument \"" + name + "\" matched by multiple actual arguments", call);
                    }
                    bound[f] = args.value(i);
                    used[i] = true;
                    break;
                }
            }
        }

        int f = 0;
        for (int i = 0; i < argCount; i++) {
            if (used[i] || args.name(i) != null) {
                continue;
            }
            while (f < formalCount && f != dotsIndex && bound[f] != null) {
                f++;
            }
            if (f >= formalCount || f == dotsIndex) {
                break;
            }
            bound[f] = args.value(i);
            used[i] = true;
            f++;
        }

        RPairlist dots = dotsIndex >= 0 ? new RPairlist() : null;
        for (int i = 0; i < argCount; i++) {
            if (used[i]) {
                continue;
            }
            if (dots == null) {
                throw new RError(ErrorKind.ARITY_MISMATCH, "unused argument (" + describe(args, i) + ")", call);
            }
            dots.add(args.name(i), args.value(i));
        }

        for (int i = 0; i < formalCount; i++) {
            CompiledFunction.Formal formal = formals.get(i);
            if (i == dotsIndex) {
                frame.define(SymbolNode.DOTS, dots);
                continue;
            }
            RValue value = bound[i];
            if (value == null || value == RMissingArg.MISSING) {
                value = formal.defaultCode() != null
                        ? RPromise.defaultArgument(formal.defaultCode(), frame)
                        : RMissingArg.MISSING;
            }
            frame.define(formal.name(), value);
        }
    }

    private static String describe(ArgumentList args, int i) {
        RValue v = args.value(i);
        String text = v instanceof RPromise p && !p.isForced() ? String.valueOf(p.expression()) : v.deparse();
        return args.name(i) == null ? text : args.name(i) + " = " + text;
    }
}
