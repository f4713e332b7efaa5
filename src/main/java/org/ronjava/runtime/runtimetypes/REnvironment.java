package org.ronjava.runtime.runtimetypes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A mutable frame of symbol bindings with a parent link. Environments have
 * reference semantics: they are never duplicated.
 */
public class REnvironment extends RValue {
    private final Map<String, RValue> frame = new LinkedHashMap<>();
    private final REnvironment parent;
    private final String name;

    public REnvironment(REnvironment parent) {
        this(parent, null);
    }

    public REnvironment(REnvironment parent, String name) {
        this.parent = parent;
        this.name = name;
    }

    /**
     * Walks this frame and its parents.
     *
     * @return the bound value, or null when the symbol is unbound
     */
    public RValue lookup(String symbol) {
        for (REnvironment env = this; env != null; env = env.parent) {
            RValue value = env.frame.get(symbol);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public RValue getLocal(String symbol) {
        return frame.get(symbol);
    }

    public boolean hasLocal(String symbol) {
        return frame.containsKey(symbol);
    }

    /**
     * Binds the symbol in this frame. Re-binding the object already bound under the
     * symbol leaves its sharing level alone.
     */
    public void define(String symbol, RValue value) {
        RValue old = frame.put(symbol, value);
        if (old != value) {
            value.bump();
        }
    }

    public void remove(String symbol) {
        frame.remove(symbol);
    }

    public REnvironment parent() {
        return parent;
    }

    public Set<String> symbols() {
        return frame.keySet();
    }

    public String name() {
        return name;
    }

    @Override
    public ValueType type() {
        return ValueType.ENVIRONMENT;
    }

    @Override
    public int length() {
        return frame.size();
    }

    @Override
    public String deparse() {
        return name == null ? "<environment>" : "<environment: " + name + ">";
    }
}
