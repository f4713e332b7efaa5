package org.ronjava.runtime.operators;

import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;
import org.ronjava.runtime.runtimetypes.RVector;
import org.ronjava.runtime.runtimetypes.ValueType;

import java.util.TreeSet;

/**
 * {@code names}, {@code class}, {@code attr} and their replacement forms.
 */
public class AttributeOperators {

    private AttributeOperators() {
    }

    public static RValue names(RValue x) {
        if (x instanceof REnvironment env) {
            return new RString(new TreeSet<>(env.symbols()).toArray(new String[0]));
        }
        RValue names = x.getAttribute("names");
        return names == null ? RNull.NULL : names;
    }

    public static RValue setNames(RValue x, RValue value, Node call) {
        if (x == RNull.NULL) {
            return x;
        }
        if (!(x instanceof RVector)) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "names() applied to a non-vector", call);
        }
        RValue target = x.ensureUnshared();
        if (value == RNull.NULL) {
            target.setAttribute("names", null);
            return target;
        }
        String[] names = new String[x.length()];
        RVector source = RVector.coerce(value, ValueType.STRING);
        if (source.length() > names.length) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "'names' attribute [" + source.length()
                    + "] must be the same length as the vector [" + names.length + "]", call);
        }
        for (int i = 0; i < source.length(); i++) {
            names[i] = ((RString) source).values[i];
        }
        target.setAttribute("names", new RString(names));
        return target;
    }

    /**
     * The class attribute, or the implicit class of the value's type.
     */
    public static RValue classOf(RValue x) {
        RValue cls = x.getAttribute("class");
        if (cls != null) {
            return cls;
        }
        return RString.of(implicitClass(x.type()));
    }

    static String implicitClass(ValueType type) {
        return switch (type) {
            case NULL -> "NULL";
            case LOGICAL -> "logical";
            case INTEGER -> "integer";
            case REAL -> "numeric";
            case STRING -> "character";
            case LIST -> "list";
            case PAIRLIST -> "pairlist";
            case ENVIRONMENT -> "environment";
            case CLOSURE, BUILTIN, SPECIAL -> "function";
            case CODE -> "call";
            default -> type.typeName;
        };
    }

    public static RValue setClass(RValue x, RValue value, Node call) {
        return setAttr(x, "class", value, call);
    }

    public static RValue attr(RValue x, String which) {
        RValue v = x.getAttribute(which);
        return v == null ? RNull.NULL : v;
    }

    public static RValue setAttr(RValue x, String which, RValue value, Node call) {
        if (x == RNull.NULL) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "attempt to set an attribute on NULL", call);
        }
        if (which.equals("names")) {
            return setNames(x, value, call);
        }
        RValue target = x.ensureUnshared();
        if (which.equals("class") && value != RNull.NULL) {
            value = RVector.coerce(value, ValueType.STRING);
        }
        target.setAttribute(which, value);
        return target;
    }

    /**
     * Single string argument such as the {@code which} of {@code attr}.
     */
    static String stringArgument(RValue v, String what, Node call) {
        if (v instanceof RString s && s.length() == 1 && s.values[0] != null) {
            return s.values[0];
        }
        throw new RError(ErrorKind.INVALID_ARGUMENT, "'" + what + "' must be a character string", call);
    }
}
