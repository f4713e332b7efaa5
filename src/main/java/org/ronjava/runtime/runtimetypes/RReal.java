package org.ronjava.runtime.runtimetypes;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;

/**
 * Double-precision vector. NA is a NaN with a dedicated payload, so that it can be
 * told apart from an arithmetic NaN.
 */
public final class RReal extends RVector {
    public static final double NA = Double.longBitsToDouble(0x7FF00000000007A2L);

    public double[] values;

    public RReal(double[] values) {
        this.values = values;
    }

    public static RReal of(double... values) {
        return new RReal(values);
    }

    public static boolean isNA(double d) {
        return Double.doubleToRawLongBits(d) == Double.doubleToRawLongBits(NA);
    }

    @Override
    public ValueType type() {
        return ValueType.REAL;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public RValue elementAt(int i) {
        return new RReal(new double[]{values[i]});
    }

    @Override
    public void setElement(int i, RValue value) {
        values[i] = asDouble(value);
    }

    @Override
    public void resize(int newLength) {
        int old = values.length;
        values = Arrays.copyOf(values, newLength);
        for (int k = old; k < newLength; k++) {
            values[k] = NA;
        }
        resizeNames(newLength);
    }

    @Override
    public RVector allocate(int length) {
        double[] v = new double[length];
        Arrays.fill(v, NA);
        return new RReal(v);
    }

    @Override
    public boolean isNA(int i) {
        return isNA(values[i]);
    }

    @Override
    public String elementToString(int i) {
        return format(values[i]);
    }

    /**
     * Formats with up to seven significant digits, dropping a trailing ".0".
     */
    public static String format(double d) {
        if (isNA(d)) {
            return "NA";
        }
        if (Double.isNaN(d)) {
            return "NaN";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "Inf" : "-Inf";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        BigDecimal rounded = new BigDecimal(d).round(new MathContext(7));
        return rounded.stripTrailingZeros().toPlainString();
    }

    @Override
    public RValue duplicate() {
        RReal copy = new RReal(values.clone());
        copyAttributesTo(copy);
        return copy;
    }

    @Override
    protected String deparseElement(int i) {
        return elementToString(i);
    }

    @Override
    public String deparse() {
        return deparseElements("numeric(0)", false);
    }
}
