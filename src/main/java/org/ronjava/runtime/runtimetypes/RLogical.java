package org.ronjava.runtime.runtimetypes;

import java.util.Arrays;

/**
 * Logical vector. Elements are 1, 0 or {@link #NA}.
 */
public final class RLogical extends RVector {
    public static final int NA = Integer.MIN_VALUE;

    public static final RLogical TRUE = shared(1);
    public static final RLogical FALSE = shared(0);
    public static final RLogical LOGICAL_NA = shared(NA);

    public int[] values;

    public RLogical(int[] values) {
        this.values = values;
    }

    private static RLogical shared(int value) {
        RLogical v = new RLogical(new int[]{value});
        v.markShared();
        return v;
    }

    public static RLogical valueOf(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * Maps a three-valued logical to one of the shared scalars.
     */
    public static RLogical valueOf(int tristate) {
        return tristate == NA ? LOGICAL_NA : valueOf(tristate != 0);
    }

    @Override
    public ValueType type() {
        return ValueType.LOGICAL;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public RValue elementAt(int i) {
        return valueOf(values[i]);
    }

    @Override
    public void setElement(int i, RValue value) {
        values[i] = asLogical(value);
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
        int[] v = new int[length];
        Arrays.fill(v, NA);
        return new RLogical(v);
    }

    @Override
    public boolean isNA(int i) {
        return values[i] == NA;
    }

    @Override
    public String elementToString(int i) {
        return values[i] == NA ? "NA" : (values[i] != 0 ? "TRUE" : "FALSE");
    }

    @Override
    public RValue duplicate() {
        RLogical copy = new RLogical(values.clone());
        copyAttributesTo(copy);
        return copy;
    }

    @Override
    protected String deparseElement(int i) {
        return elementToString(i);
    }

    @Override
    public String deparse() {
        return deparseElements("logical(0)", false);
    }
}
