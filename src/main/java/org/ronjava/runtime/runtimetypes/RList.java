package org.ronjava.runtime.runtimetypes;

import java.util.Arrays;

/**
 * Generic vector. Elements are arbitrary values; each slot counts as one
 * reference for the sharing contract.
 */
public final class RList extends RVector {
    public RValue[] values;

    /**
     * Wraps the given elements. Null slots become NULL; elements are bumped.
     */
    public RList(RValue[] values) {
        this.values = values;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                values[i] = RNull.NULL;
            } else {
                values[i].bump();
            }
        }
    }

    @Override
    public ValueType type() {
        return ValueType.LIST;
    }

    @Override
    public int length() {
        return values.length;
    }

    @Override
    public RValue elementAt(int i) {
        return values[i];
    }

    @Override
    public void setElement(int i, RValue value) {
        value.bump();
        values[i] = value;
    }

    /**
     * Removes element i in place, with its name.
     */
    public void removeElement(int i) {
        RString names = names();
        RValue[] next = new RValue[values.length - 1];
        System.arraycopy(values, 0, next, 0, i);
        System.arraycopy(values, i + 1, next, i, values.length - i - 1);
        values = next;
        if (names != null) {
            String[] n = new String[names.values.length - 1];
            System.arraycopy(names.values, 0, n, 0, i);
            System.arraycopy(names.values, i + 1, n, i, names.values.length - i - 1);
            setAttribute("names", new RString(n));
        }
    }

    @Override
    public void resize(int newLength) {
        int old = values.length;
        values = Arrays.copyOf(values, newLength);
        for (int k = old; k < newLength; k++) {
            values[k] = RNull.NULL;
        }
        resizeNames(newLength);
    }

    @Override
    public RVector allocate(int length) {
        return new RList(new RValue[length]);
    }

    @Override
    public String elementToString(int i) {
        return values[i].deparse();
    }

    /**
     * Shallow copy: the elements now sit in two lists, so each one is bumped.
     */
    @Override
    public RValue duplicate() {
        RList copy = new RList(values.clone());
        copyAttributesTo(copy);
        return copy;
    }

    @Override
    protected String deparseElement(int i) {
        return values[i].deparse();
    }

    @Override
    public String deparse() {
        return deparseElements("list()", true);
    }
}
