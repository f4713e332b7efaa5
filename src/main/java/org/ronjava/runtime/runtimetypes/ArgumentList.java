package org.ronjava.runtime.runtimetypes;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered actual arguments with optional names. Values are promises, plain
 * values, or {@link RMissingArg#MISSING}.
 */
public final class ArgumentList {
    private final List<RValue> values = new ArrayList<>();
    private final List<String> names = new ArrayList<>();

    public ArgumentList add(String name, RValue value) {
        names.add(name == null || name.isEmpty() ? null : name);
        values.add(value);
        return this;
    }

    public ArgumentList add(RValue value) {
        return add(null, value);
    }

    public int size() {
        return values.size();
    }

    public RValue value(int i) {
        return values.get(i);
    }

    public String name(int i) {
        return names.get(i);
    }

    public void set(int i, RValue value) {
        values.set(i, value);
    }

    /**
     * First argument with the given name, or null.
     */
    public RValue named(String name) {
        int i = names.indexOf(name);
        return i < 0 ? null : values.get(i);
    }

    public boolean hasNames() {
        for (String name : names) {
            if (name != null) {
                return true;
            }
        }
        return false;
    }

    public List<RValue> values() {
        return values;
    }
}
