package org.ronjava.runtime.operators;

import org.ronjava.backend.bytecode.BytecodeInterpreter;
import org.ronjava.backend.bytecode.InterpreterContext;
import org.ronjava.frontend.astnode.CallNode;
import org.ronjava.runtime.runtimetypes.ArgumentList;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RCodeRef;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RList;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;
import org.ronjava.runtime.runtimetypes.RVector;
import org.ronjava.runtime.runtimetypes.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Eager base functions that are not operators.
 */
public class BaseFunctions {

    private BaseFunctions() {
    }

    /**
     * {@code c(...)}: concatenates into the highest type among the arguments.
     */
    public static RValue combine(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        ValueType type = ValueType.NULL;
        int length = 0;
        boolean named = false;
        for (int i = 0; i < args.size(); i++) {
            RValue v = args.value(i);
            if (v == RNull.NULL || v == RMissingArg.MISSING) {
                continue;
            }
            ValueType t = v instanceof RVector ? v.type() : ValueType.LIST;
            if (RVector.rank(t) > RVector.rank(type)) {
                type = t;
            }
            length += v instanceof RVector ? v.length() : 1;
            named |= args.name(i) != null || (v instanceof RVector vec && vec.names() != null);
        }
        if (type == ValueType.NULL) {
            return RNull.NULL;
        }
        RVector out = RVector.allocate(type, length);
        String[] names = named ? new String[length] : null;
        int k = 0;
        for (int i = 0; i < args.size(); i++) {
            RValue v = args.value(i);
            if (v == RNull.NULL || v == RMissingArg.MISSING) {
                continue;
            }
            String prefix = args.name(i);
            if (!(v instanceof RVector vec)) {
                out.setElement(k, v);
                if (names != null) {
                    names[k] = prefix == null ? "" : prefix;
                }
                k++;
                continue;
            }
            for (int j = 0; j < vec.length(); j++, k++) {
                out.setElement(k, vec.elementAt(j));
                if (names != null) {
                    names[k] = elementName(prefix, vec.nameAt(j), j, vec.length());
                }
            }
        }
        if (names != null) {
            out.setAttribute("names", new RString(names));
        }
        return out;
    }

    private static String elementName(String prefix, String inner, int j, int length) {
        boolean hasInner = inner != null && !inner.isEmpty();
        if (prefix == null) {
            return hasInner ? inner : "";
        }
        if (hasInner) {
            return prefix + "." + inner;
        }
        return length == 1 ? prefix : prefix + (j + 1);
    }

    public static RValue list(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        RValue[] values = new RValue[args.size()];
        for (int i = 0; i < values.length; i++) {
            RValue v = args.value(i);
            if (v == RMissingArg.MISSING) {
                throw new RError(ErrorKind.MISSING_ARGUMENT, "argument " + (i + 1) + " is empty", call);
            }
            values[i] = v;
        }
        RList out = new RList(values);
        if (args.hasNames()) {
            String[] names = new String[values.length];
            for (int i = 0; i < names.length; i++) {
                names[i] = args.name(i) == null ? "" : args.name(i);
            }
            out.setAttribute("names", new RString(names));
        }
        return out;
    }

    public static RValue length(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        return RInteger.of(argument(args, 0, call).length());
    }

    /**
     * Writes the value to the interpreter's output and returns it invisibly.
     */
    public static RValue print(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        RValue x = argument(args, 0, call);
        ctx.out().println(format(x));
        return x;
    }

    public static RValue identity(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        return argument(args, 0, call);
    }

    public static RValue invisible(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        return args.size() == 0 ? RNull.NULL : args.value(0);
    }

    public static RValue isNull(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        return RLogical.valueOf(argument(args, 0, call) == RNull.NULL);
    }

    public static RValue isList(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        ValueType type = argument(args, 0, call).type();
        return RLogical.valueOf(type == ValueType.LIST || type == ValueType.PAIRLIST);
    }

    public static RValue isPairlist(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        ValueType type = argument(args, 0, call).type();
        return RLogical.valueOf(type == ValueType.PAIRLIST || type == ValueType.NULL);
    }

    /**
     * {@code eval(expr, envir)}: runs a quoted expression; any other value is its
     * own result.
     */
    public static RValue eval(CallNode call, ArgumentList args, REnvironment env, InterpreterContext ctx) {
        RValue expr = argument(args, 0, call);
        REnvironment target = env;
        RValue envir = args.named("envir");
        if (envir == null && args.size() > 1 && args.name(1) == null) {
            envir = args.value(1);
        }
        if (envir != null && envir != RMissingArg.MISSING) {
            if (!(envir instanceof REnvironment e)) {
                throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid 'envir' argument of type '"
                        + envir.type().typeName + "'", call);
            }
            target = e;
        }
        if (expr instanceof RCodeRef ref) {
            return BytecodeInterpreter.execute(ref.code, target, ctx);
        }
        ctx.visible = true;
        return expr;
    }

    static RValue argument(ArgumentList args, int i, CallNode call) {
        if (args.size() <= i) {
            throw new RError(ErrorKind.ARITY_MISMATCH, (i + 1) + " argument" + (i == 0 ? "" : "s")
                    + " passed where at least " + (i + 1) + " required", call);
        }
        RValue v = args.value(i);
        if (v == RMissingArg.MISSING) {
            throw new RError(ErrorKind.MISSING_ARGUMENT, "argument " + (i + 1) + " is missing, with no default", call);
        }
        return v;
    }

    // =========================================================================
    // printing
    // =========================================================================

    /**
     * Printed form of a value, one or more lines without a trailing newline.
     */
    public static String format(RValue x) {
        List<String> lines = new ArrayList<>();
        formatInto(x, "", lines);
        return String.join("\n", lines);
    }

    private static void formatInto(RValue x, String prefix, List<String> lines) {
        if (x == RNull.NULL) {
            lines.add("NULL");
        } else if (x instanceof RList list) {
            formatList(list, prefix, lines);
        } else if (x instanceof RVector vec) {
            formatAtomic(vec, lines);
        } else if (x instanceof RCodeRef ref) {
            lines.add(String.valueOf(ref.expression()));
        } else {
            lines.add(x.deparse());
        }
        for (Map.Entry<String, RValue> attribute : x.attributes().entrySet()) {
            if (attribute.getKey().equals("names")) {
                continue;
            }
            lines.add("attr(,\"" + attribute.getKey() + "\")");
            formatInto(attribute.getValue(), prefix, lines);
        }
    }

    private static void formatList(RList list, String prefix, List<String> lines) {
        if (list.length() == 0) {
            lines.add("list()");
            return;
        }
        for (int i = 0; i < list.length(); i++) {
            String name = list.nameAt(i);
            String tag = name != null && !name.isEmpty() ? prefix + "$" + name : prefix + "[[" + (i + 1) + "]]";
            lines.add(tag);
            formatInto(list.elementAt(i), tag, lines);
            lines.add("");
        }
    }

    private static void formatAtomic(RVector vec, List<String> lines) {
        int n = vec.length();
        if (n == 0) {
            lines.add(switch (vec.type()) {
                case LOGICAL -> "logical(0)";
                case INTEGER -> "integer(0)";
                case REAL -> "numeric(0)";
                default -> "character(0)";
            });
            return;
        }
        String[] cells = new String[n];
        int width = 0;
        for (int i = 0; i < n; i++) {
            cells[i] = vec instanceof RString s && s.values[i] != null ? RString.quote(s.values[i]) : vec.elementToString(i);
            width = Math.max(width, cells[i].length());
        }
        RString names = vec.names();
        if (names == null) {
            StringBuilder sb = new StringBuilder("[1]");
            for (String cell : cells) {
                sb.append(' ').append(pad(cell, width));
            }
            lines.add(sb.toString());
            return;
        }
        StringBuilder header = new StringBuilder();
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < n; i++) {
            String name = names.values[i] == null ? "<NA>" : names.values[i];
            int w = Math.max(width, name.length());
            if (i > 0) {
                header.append(' ');
                values.append(' ');
            }
            header.append(pad(name, w));
            values.append(pad(cells[i], w));
        }
        lines.add(header.toString());
        lines.add(values.toString());
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : " ".repeat(width - s.length()) + s;
    }
}
