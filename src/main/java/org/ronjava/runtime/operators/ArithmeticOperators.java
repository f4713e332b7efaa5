package org.ronjava.runtime.operators;

import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;
import org.ronjava.runtime.runtimetypes.RVector;
import org.ronjava.runtime.runtimetypes.ValueType;

/**
 * Vectorized arithmetic and comparison. Shorter operands are recycled; the result
 * takes the names of the operand whose length it has.
 * <p>
 * Integer (and logical) operands give integer results for {@code + - *}; an
 * overflow gives NA. Any double operand, and division, give doubles.
 */
public class ArithmeticOperators {

    private ArithmeticOperators() {
    }

    public static boolean isComparison(String op) {
        return switch (op) {
            case "<", ">", "<=", ">=", "==", "!=" -> true;
            default -> false;
        };
    }

    public static RValue binary(String op, RValue a, RValue b, Node call) {
        RVector va = operand(a, call);
        RVector vb = operand(b, call);
        int la = va.length();
        int lb = vb.length();
        int n = la == 0 || lb == 0 ? 0 : Math.max(la, lb);

        RVector result;
        if (isComparison(op)) {
            if (va instanceof RString || vb instanceof RString) {
                result = compareStrings(op, va, vb, n);
            } else {
                result = compareNumbers(op, va, vb, n);
            }
        } else {
            if (va instanceof RString || vb instanceof RString) {
                throw new RError(ErrorKind.INVALID_ARGUMENT, "non-numeric argument to binary operator", call);
            }
            boolean real = op.equals("/") || va instanceof RReal || vb instanceof RReal;
            result = real ? realArithmetic(op, va, vb, n, call) : integerArithmetic(op, va, vb, n, call);
        }
        RString names = la == n ? va.names() : null;
        if (names == null && lb == n) {
            names = vb.names();
        }
        if (names != null) {
            result.setAttribute("names", names);
        }
        return result;
    }

    private static RVector operand(RValue v, Node call) {
        if (v == RNull.NULL) {
            return new RInteger(new int[0]);
        }
        if (v instanceof RVector vec && vec.type() != ValueType.LIST) {
            return vec;
        }
        throw new RError(ErrorKind.INVALID_ARGUMENT, "non-numeric argument to binary operator", call);
    }

    private static RVector integerArithmetic(String op, RVector a, RVector b, int n, Node call) {
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            int x = intAt(a, i % a.length());
            int y = intAt(b, i % b.length());
            if (x == RInteger.NA || y == RInteger.NA) {
                out[i] = RInteger.NA;
                continue;
            }
            long r = switch (op) {
                case "+" -> (long) x + y;
                case "-" -> (long) x - y;
                case "*" -> (long) x * y;
                default -> throw new RError(ErrorKind.INVALID_ARGUMENT, "unknown operator " + op, call);
            };
            out[i] = r > Integer.MAX_VALUE || r <= Integer.MIN_VALUE ? RInteger.NA : (int) r;
        }
        return new RInteger(out);
    }

    private static RVector realArithmetic(String op, RVector a, RVector b, int n, Node call) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double x = doubleAt(a, i % a.length());
            double y = doubleAt(b, i % b.length());
            if (RReal.isNA(x) || RReal.isNA(y)) {
                out[i] = RReal.NA;
                continue;
            }
            out[i] = switch (op) {
                case "+" -> x + y;
                case "-" -> x - y;
                case "*" -> x * y;
                case "/" -> x / y;
                default -> throw new RError(ErrorKind.INVALID_ARGUMENT, "unknown operator " + op, call);
            };
        }
        return new RReal(out);
    }

    private static RVector compareNumbers(String op, RVector a, RVector b, int n) {
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            double x = doubleAt(a, i % a.length());
            double y = doubleAt(b, i % b.length());
            out[i] = Double.isNaN(x) || Double.isNaN(y) ? RLogical.NA : (compare(op, Double.compare(x, y)) ? 1 : 0);
        }
        return new RLogical(out);
    }

    private static RVector compareStrings(String op, RVector a, RVector b, int n) {
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            String x = stringAt(a, i % a.length());
            String y = stringAt(b, i % b.length());
            out[i] = x == null || y == null ? RLogical.NA : (compare(op, x.compareTo(y)) ? 1 : 0);
        }
        return new RLogical(out);
    }

    private static boolean compare(String op, int cmp) {
        return switch (op) {
            case "<" -> cmp < 0;
            case ">" -> cmp > 0;
            case "<=" -> cmp <= 0;
            case ">=" -> cmp >= 0;
            case "==" -> cmp == 0;
            default -> cmp != 0;
        };
    }

    public static RValue not(RValue a, Node call) {
        if (!(a instanceof RVector vec) || a instanceof RString || vec.type() == ValueType.LIST) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid argument type", call);
        }
        int[] out = new int[vec.length()];
        for (int i = 0; i < out.length; i++) {
            int l = RVector.asLogical(vec.elementAt(i));
            out[i] = l == RLogical.NA ? RLogical.NA : 1 - l;
        }
        RLogical result = new RLogical(out);
        if (vec.names() != null) {
            result.setAttribute("names", vec.names());
        }
        return result;
    }

    public static RValue negate(RValue a, Node call) {
        RVector vec = operand(a, call);
        if (vec instanceof RString) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid argument to unary operator", call);
        }
        return binary("-", vec instanceof RReal ? RReal.of(0) : RInteger.of(0), vec, call);
    }

    private static int intAt(RVector v, int i) {
        if (v instanceof RInteger r) {
            return r.values[i];
        }
        if (v instanceof RLogical l) {
            return l.values[i];
        }
        return RVector.asInt(v.elementAt(i));
    }

    private static double doubleAt(RVector v, int i) {
        if (v instanceof RReal r) {
            return r.values[i];
        }
        int x = intAt(v, i);
        return x == RInteger.NA ? RReal.NA : x;
    }

    private static String stringAt(RVector v, int i) {
        return v.isNA(i) ? null : v.elementToString(i);
    }
}
