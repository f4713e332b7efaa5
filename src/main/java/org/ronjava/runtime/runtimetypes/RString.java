package org.ronjava.runtime.runtimetypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Character vector. A null element is NA.
 */
public final class RString extends RVector {
    public String[] values;

    public RString(String[] values) {
        this.values = values;
    }

    public static RString of(String... values) {
        return new RString(values);
    }

    @Override
    public ValueType type() {
        return ValueType.STRING;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public RValue elementAt(int i) {
        return new RString(new String[]{values[i]});
    }

    @Override
    public void setElement(int i, RValue value) {
        values[i] = asString(value);
    }

    @Override
    public void resize(int newLength) {
        values = Arrays.copyOf(values, newLength);
        resizeNames(newLength);
    }

    @Override
    public RVector allocate(int length) {
        return new RString(new String[length]);
    }

    @Override
    public boolean isNA(int i) {
        return values[i] == null;
    }

    @Override
    public String elementToString(int i) {
        return values[i] == null ? "NA" : values[i];
    }

    public List<String> asList() {
        return new ArrayList<>(Arrays.asList(values));
    }

    @Override
    public RValue duplicate() {
        RString copy = new RString(values.clone());
        copyAttributesTo(copy);
        return copy;
    }

    @Override
    protected String deparseElement(int i) {
        return values[i] == null ? "NA" : quote(values[i]);
    }

    public static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String deparse() {
        return deparseElements("character(0)", false);
    }
}
