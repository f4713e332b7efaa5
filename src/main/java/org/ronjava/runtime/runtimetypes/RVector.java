package org.ronjava.runtime.runtimetypes;

import org.ronjava.frontend.analysis.PrintVisitor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Common base of the atomic vectors and the generic list. Indices are 0-based
 * here; the 1-based surface indexing lives in the subset operators.
 */
public abstract class RVector extends RValue {

    @Override
    public abstract int length();

    /**
     * Element i as a value: a fresh length-one vector for atomic types, the element
     * itself for lists.
     */
    public abstract RValue elementAt(int i);

    /**
     * Stores a length-one value (or any value, for lists) at position i, coercing to
     * this vector's element type. The receiver must already be unshared.
     */
    public abstract void setElement(int i, RValue value);

    /**
     * Grows or shrinks in place, filling new slots with NA (NULL for lists).
     */
    public abstract void resize(int newLength);

    /**
     * A new vector of the same type and the given length, NA filled, without attributes.
     */
    public abstract RVector allocate(int length);

    public abstract String elementToString(int i);

    public boolean isNA(int i) {
        return false;
    }

    public RString names() {
        RValue names = getAttribute("names");
        return names instanceof RString str ? str : null;
    }

    public String nameAt(int i) {
        RString names = names();
        return names == null || i >= names.length() ? null : names.values[i];
    }

    /**
     * Position of the first element with the given name, or -1.
     */
    public int indexOfName(String name) {
        RString names = names();
        if (names == null) {
            return -1;
        }
        for (int i = 0; i < names.length(); i++) {
            if (name.equals(names.values[i])) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Sets the name of element i, creating the names attribute when needed.
     */
    public void setNameAt(int i, String name) {
        RString names = names();
        int len = length();
        if (names == null) {
            if (name == null) {
                return;
            }
            String[] empty = new String[len];
            Arrays.fill(empty, "");
            names = new RString(empty);
        } else {
            names = (RString) names.ensureUnshared();
            if (names.length() < len) {
                int old = names.length();
                names.resize(len);
                for (int k = old; k < len; k++) {
                    names.values[k] = "";
                }
            }
        }
        names.values[i] = name == null ? "" : name;
        setAttribute("names", names);
    }

    /**
     * Keeps the names attribute in step after a resize.
     */
    protected void resizeNames(int newLength) {
        RString names = names();
        if (names == null) {
            return;
        }
        RString copy = (RString) names.ensureUnshared();
        int old = copy.length();
        copy.resize(newLength);
        for (int k = old; k < newLength; k++) {
            copy.values[k] = "";
        }
        setAttribute("names", copy);
    }

    // -------------------------------------------------------------------------
    // coercion
    // -------------------------------------------------------------------------

    /**
     * Rank in the coercion order logical &lt; integer &lt; double &lt; character &lt; list.
     */
    public static int rank(ValueType type) {
        return switch (type) {
            case NULL -> 0;
            case LOGICAL -> 1;
            case INTEGER -> 2;
            case REAL -> 3;
            case STRING -> 4;
            default -> 5;
        };
    }

    public static RVector allocate(ValueType type, int length) {
        return switch (type) {
            case LOGICAL -> new RLogical(new int[length]);
            case INTEGER -> new RInteger(new int[length]);
            case REAL -> new RReal(new double[length]);
            case STRING -> new RString(new String[length]);
            case LIST -> new RList(new RValue[length]);
            default -> throw new RError(ErrorKind.INVALID_ARGUMENT, "cannot allocate a vector of type '" + type.typeName + "'");
        };
    }

    /**
     * Returns v converted to the given vector type. Returns v itself when it already
     * has that type. Names are kept.
     */
    public static RVector coerce(RValue v, ValueType type) {
        if (v.type() == type && v instanceof RVector vec) {
            return vec;
        }
        if (v == RNull.NULL) {
            return allocate(type, 0);
        }
        if (!(v instanceof RVector src)) {
            if (type == ValueType.LIST) {
                return new RList(new RValue[]{v});
            }
            throw new RError(ErrorKind.INVALID_ARGUMENT,
                    "cannot coerce type '" + v.type().typeName + "' to vector of type '" + type.typeName + "'");
        }
        RVector out = allocate(type, src.length());
        for (int i = 0; i < src.length(); i++) {
            out.setElement(i, src.elementAt(i));
        }
        RString names = src.names();
        if (names != null) {
            out.setAttribute("names", names);
        }
        return out;
    }

    public static double asDouble(RValue v) {
        if (v instanceof RReal r && r.length() >= 1) {
            return r.values[0];
        }
        if (v instanceof RInteger r && r.length() >= 1) {
            return r.values[0] == RInteger.NA ? RReal.NA : r.values[0];
        }
        if (v instanceof RLogical r && r.length() >= 1) {
            return r.values[0] == RLogical.NA ? RReal.NA : r.values[0];
        }
        if (v instanceof RString s && s.length() >= 1) {
            try {
                return s.values[0] == null ? RReal.NA : Double.parseDouble(s.values[0].trim());
            } catch (NumberFormatException e) {
                return RReal.NA;
            }
        }
        if (v instanceof RList l && l.length() >= 1) {
            return asDouble(l.values[0]);
        }
        return RReal.NA;
    }

    public static int asInt(RValue v) {
        if (v instanceof RInteger r && r.length() >= 1) {
            return r.values[0];
        }
        if (v instanceof RLogical r && r.length() >= 1) {
            return r.values[0] == RLogical.NA ? RInteger.NA : r.values[0];
        }
        double d = asDouble(v);
        return RReal.isNA(d) || Double.isNaN(d) ? RInteger.NA : (int) d;
    }

    /**
     * First element as a three-valued logical: 1, 0 or {@link RLogical#NA}.
     */
    public static int asLogical(RValue v) {
        if (v instanceof RLogical r && r.length() >= 1) {
            return r.values[0];
        }
        if (v instanceof RInteger r && r.length() >= 1) {
            return r.values[0] == RInteger.NA ? RLogical.NA : (r.values[0] != 0 ? 1 : 0);
        }
        if (v instanceof RReal r && r.length() >= 1) {
            double d = r.values[0];
            return Double.isNaN(d) ? RLogical.NA : (d != 0 ? 1 : 0);
        }
        if (v instanceof RString s && s.length() >= 1) {
            String str = s.values[0];
            if ("TRUE".equals(str) || "true".equals(str) || "T".equals(str) || "True".equals(str)) {
                return 1;
            }
            if ("FALSE".equals(str) || "false".equals(str) || "F".equals(str) || "False".equals(str)) {
                return 0;
            }
            return RLogical.NA;
        }
        return RLogical.NA;
    }

    public static String asString(RValue v) {
        if (v instanceof RVector vec && vec.length() >= 1) {
            if (vec instanceof RList l) {
                return asString(l.values[0]);
            }
            return vec.isNA(0) ? null : vec.elementToString(0);
        }
        return null;
    }

    /**
     * All elements rendered as strings, NA as null.
     */
    public List<String> asStrings() {
        List<String> out = new ArrayList<>(length());
        for (int i = 0; i < length(); i++) {
            out.add(isNA(i) ? null : elementToString(i));
        }
        return out;
    }

    // -------------------------------------------------------------------------
    // deparse
    // -------------------------------------------------------------------------

    protected String deparseElements(String emptyForm, boolean forceCombine) {
        int n = length();
        RString names = names();
        String body;
        if (n == 0) {
            body = emptyForm;
        } else if (n == 1 && names == null && !forceCombine) {
            body = deparseElement(0);
        } else {
            StringBuilder sb = new StringBuilder(forceCombine ? "list(" : "c(");
            for (int i = 0; i < n; i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                String name = names == null ? null : names.values[i];
                if (name != null && !name.isEmpty()) {
                    sb.append(PrintVisitor.quoteSymbol(name)).append(" = ");
                }
                sb.append(deparseElement(i));
            }
            body = sb.append(')').toString();
        }
        List<String> cls = classVector();
        if (cls.isEmpty()) {
            return body;
        }
        return "structure(" + body + ", class = " + new RString(cls.toArray(new String[0])).deparse() + ")";
    }

    protected abstract String deparseElement(int i);
}
