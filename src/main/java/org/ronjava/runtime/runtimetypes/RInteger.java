package org.ronjava.runtime.runtimetypes;

import java.util.Arrays;

/**
 * Integer vector. {@link #NA} marks missing elements.
 */
public final class RInteger extends RVector {
    public static final int NA = Integer.MIN_VALUE;

    public int[] values;

    public RInteger(int[] values) {
        this.values = values;
    }

    public static RInteger of(int... values) {
        return new RInteger(values);
    }

    @Override
    public ValueType type() {
        return ValueType.INTEGER;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public RValue elementAt(int i) {
        return new RInteger(new int[]{values[i]});
    }

    @Override
    public void setElement(int i, RValue value) {
        values[i] = asInt(value);
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
        return new RInteger(v);
    }

    @Override
    public boolean isNA(int i) {
        return values[i] == NA;
    }

    @Override
    public String elementToString(int i) {
        return values[i] == NA ? "NA" : Integer.toString(values[i]);
    }

    @Override
    public RValue duplicate() {
        RInteger copy = new RInteger(values.clone());
        copyAttributesTo(copy);
        return copy;
    }

    @Override
    protected String deparseElement(int i) {
        return values[i] == NA ? "NA_integer_" : values[i] + "L";
    }

    @Override
    public String deparse() {
        return deparseElements("integer(0)", false);
    }
}
