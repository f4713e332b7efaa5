package org.ronjava.backend.bytecode;

import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only table of constants referenced by index from instructions: literal
 * values, symbol names, source expressions, call-site argument tables and compiled
 * function templates.
 * <p>
 * Numeric scalars without attributes are deduplicated by type and value; every other
 * entry is deduplicated by identity. Symbol names are interned by the tree, so equal
 * names share an entry. Values entering the pool are marked shared for good.
 */
public final class ConstantPool {
    private final List<Object> constants = new ArrayList<>();
    private final Map<NumericKey, Integer> numericIndex = new HashMap<>();
    private final Map<Object, Integer> identityIndex = new IdentityHashMap<>();

    /**
     * Adds the object unless an equal numeric or the same object is present.
     *
     * @return the index of the entry
     */
    public int insert(Object value) {
        NumericKey key = NumericKey.of(value);
        Integer cached = key != null ? numericIndex.get(key) : identityIndex.get(value);
        if (cached != null) {
            return cached;
        }
        int index = constants.size();
        constants.add(value);
        if (key != null) {
            numericIndex.put(key, index);
        } else {
            identityIndex.put(value, index);
        }
        if (value instanceof RValue v) {
            v.markShared();
        }
        return index;
    }

    public Object get(int index) {
        return constants.get(index);
    }

    public RValue getValue(int index) {
        return (RValue) constants.get(index);
    }

    public String getSymbol(int index) {
        return (String) constants.get(index);
    }

    public int size() {
        return constants.size();
    }

    /**
     * Dedup key of a numeric scalar. Integers and doubles never collide.
     */
    private record NumericKey(char kind, long bits) {

        static NumericKey of(Object value) {
            if (value instanceof RReal r && r.length() == 1 && !r.hasAttributes()) {
                return new NumericKey('d', Double.doubleToRawLongBits(r.values[0]));
            }
            if (value instanceof RInteger i && i.length() == 1 && !i.hasAttributes()) {
                return new NumericKey('i', i.values[0]);
            }
            if (value instanceof Double d) {
                return new NumericKey('d', Double.doubleToRawLongBits(d));
            }
            if (value instanceof Integer i) {
                return new NumericKey('i', i);
            }
            return null;
        }
    }
}
