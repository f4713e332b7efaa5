package org.ronjava.runtime.operators;

import org.ronjava.frontend.astnode.Node;
import org.ronjava.runtime.runtimetypes.ErrorKind;
import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RError;
import org.ronjava.runtime.runtimetypes.RInteger;
import org.ronjava.runtime.runtimetypes.RList;
import org.ronjava.runtime.runtimetypes.RLogical;
import org.ronjava.runtime.runtimetypes.RMissingArg;
import org.ronjava.runtime.runtimetypes.RNull;
import org.ronjava.runtime.runtimetypes.RPairlist;
import org.ronjava.runtime.runtimetypes.RReal;
import org.ronjava.runtime.runtimetypes.RString;
import org.ronjava.runtime.runtimetypes.RValue;
import org.ronjava.runtime.runtimetypes.RVector;
import org.ronjava.runtime.runtimetypes.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Default behaviour of {@code [[}, {@code [}, {@code $} and their replacement forms.
 * Indices are 1-based. Every replacement unshares its target first and returns the
 * updated object.
 */
public class SubsetOperators {

    private SubsetOperators() {
    }

    // =========================================================================
    // extraction
    // =========================================================================

    /**
     * {@code x[[i]]}: one element. For lists this is the element itself.
     */
    public static RValue extract2(RValue x, RValue index, Node call) {
        if (x == RNull.NULL) {
            return RNull.NULL;
        }
        if (x instanceof REnvironment env) {
            RValue v = env.getLocal(nameIndex(index, call));
            return v == null ? RNull.NULL : v;
        }
        if (x instanceof RPairlist list) {
            int i = elementIndex(index, list.size(), name -> tagIndex(list, name), call);
            return list.value(i);
        }
        if (!(x instanceof RVector vec)) {
            throw notSubsettable(x, call);
        }
        int i = elementIndex(index, vec.length(), vec::indexOfName, call);
        return vec.elementAt(i);
    }

    /**
     * {@code x[i]}: a vector of the same type holding the selected elements.
     */
    public static RValue subset(RValue x, RValue index, Node call) {
        if (x == RNull.NULL) {
            return RNull.NULL;
        }
        if (index == RMissingArg.MISSING) {
            return x;
        }
        if (!(x instanceof RVector vec)) {
            throw notSubsettable(x, call);
        }
        int[] positions = positions(vec, index, call);
        RVector out = vec.allocate(positions.length);
        boolean named = vec.names() != null;
        for (int k = 0; k < positions.length; k++) {
            int p = positions[k];
            if (p >= 0 && p < vec.length()) {
                out.setElement(k, vec.elementAt(p));
                if (named) {
                    out.setNameAt(k, vec.nameAt(p));
                }
            } else if (named) {
                out.setNameAt(k, vec.type() == ValueType.LIST ? "<NA>" : "NA");
            }
        }
        return out;
    }

    /**
     * {@code x$name}.
     */
    public static RValue dollar(RValue x, String name, Node call) {
        if (x == RNull.NULL) {
            return RNull.NULL;
        }
        if (x instanceof REnvironment env) {
            RValue v = env.getLocal(name);
            return v == null ? RNull.NULL : v;
        }
        if (x instanceof RPairlist list) {
            int i = tagIndex(list, name);
            return i < 0 ? RNull.NULL : list.value(i);
        }
        if (x instanceof RList list) {
            int i = list.indexOfName(name);
            return i < 0 ? RNull.NULL : list.elementAt(i);
        }
        throw new RError(ErrorKind.INVALID_ARGUMENT, "$ operator is invalid for atomic vectors", call);
    }

    // =========================================================================
    // replacement
    // =========================================================================

    /**
     * {@code x[[i]] <- value}. Assigning NULL into a list removes the element.
     */
    public static RValue assign2(RValue x, RValue index, RValue value, Node call) {
        if (x instanceof REnvironment env) {
            env.define(nameIndex(index, call), value);
            return env;
        }
        RVector target = replacementTarget(x, value, call);
        String name = index instanceof RString s && s.length() == 1 ? s.values[0] : null;
        int i = name != null ? target.indexOfName(name) : positiveIndex(index, call);

        if (target instanceof RList list) {
            if (value == RNull.NULL) {
                if (i >= 0 && i < list.length()) {
                    list.removeElement(i);
                }
                return list;
            }
        } else if (!(value instanceof RVector v && v.type() != ValueType.LIST && v.length() == 1)) {
            if (value instanceof RVector v && v.type() == ValueType.LIST) {
                target = RVector.coerce(target, ValueType.LIST);
            } else {
                throw new RError(ErrorKind.INVALID_ARGUMENT, "more elements supplied than there are to replace", call);
            }
        }
        target = widenFor(target, value);

        if (i < 0) {
            i = target.length();
        }
        if (i >= target.length()) {
            target.resize(i + 1);
        }
        target.setElement(i, target instanceof RList ? value : firstElement(value));
        if (name != null && !name.equals(target.nameAt(i))) {
            target.setNameAt(i, name);
        }
        return target;
    }

    /**
     * {@code x[i] <- value}, with the value recycled over the selected positions.
     */
    public static RValue assignSubset(RValue x, RValue index, RValue value, Node call) {
        RVector target = replacementTarget(x, value, call);
        if (!(value instanceof RVector source) || value.length() == 0) {
            if (value == RNull.NULL && target.length() == 0) {
                return target;
            }
            throw new RError(ErrorKind.INVALID_ARGUMENT, "replacement has length zero", call);
        }
        target = widenFor(target, value);

        List<String> newNames = new ArrayList<>();
        int[] positions;
        if (index == RMissingArg.MISSING) {
            positions = new int[target.length()];
            for (int k = 0; k < positions.length; k++) {
                positions[k] = k;
            }
        } else if (index instanceof RString names) {
            positions = new int[names.length()];
            int next = target.length();
            for (int k = 0; k < positions.length; k++) {
                int p = target.indexOfName(names.values[k]);
                if (p < 0) {
                    p = next++;
                    newNames.add(names.values[k]);
                }
                positions[k] = p;
            }
        } else {
            positions = positions(target, index, call);
        }

        int max = target.length();
        for (int p : positions) {
            if (p < 0) {
                throw new RError(ErrorKind.INVALID_ARGUMENT, "NAs are not allowed in subscripted assignments", call);
            }
            max = Math.max(max, p + 1);
        }
        int oldLength = target.length();
        if (max > oldLength) {
            target.resize(max);
        }
        for (int k = 0; k < positions.length; k++) {
            RValue element = source.elementAt(k % source.length());
            target.setElement(positions[k], element);
        }
        for (int k = 0; k < newNames.size(); k++) {
            target.setNameAt(oldLength + k, newNames.get(k));
        }
        return target;
    }

    /**
     * {@code x$name <- value}. Atomic targets are turned into lists.
     */
    public static RValue dollarAssign(RValue x, String name, RValue value, Node call) {
        if (x instanceof REnvironment env) {
            env.define(name, value);
            return env;
        }
        RVector target;
        if (x == RNull.NULL) {
            target = new RList(new RValue[0]);
        } else if (x instanceof RList list) {
            target = (RVector) list.ensureUnshared();
        } else if (x instanceof RVector vec) {
            target = RVector.coerce(vec, ValueType.LIST);
            x.copyAttributesTo(target);
        } else {
            throw notSubsettable(x, call);
        }
        return assign2(target, RString.of(name), value, call);
    }

    // =========================================================================
    // index helpers
    // =========================================================================

    private static RVector replacementTarget(RValue x, RValue value, Node call) {
        if (x == RNull.NULL) {
            if (value instanceof RVector v && v.type() != ValueType.LIST && v.length() <= 1) {
                return RVector.allocate(v.type(), 0);
            }
            return new RList(new RValue[0]);
        }
        if (!(x instanceof RVector)) {
            throw notSubsettable(x, call);
        }
        return (RVector) x.ensureUnshared();
    }

    // coerce the target up when the value has a higher type
    private static RVector widenFor(RVector target, RValue value) {
        if (target instanceof RList || !(value instanceof RVector v)) {
            return target;
        }
        if (RVector.rank(v.type()) > RVector.rank(target.type())) {
            RVector widened = RVector.coerce(target, v.type());
            target.copyAttributesTo(widened);
            return widened;
        }
        return target;
    }

    private static RValue firstElement(RValue value) {
        return value instanceof RVector v && v.length() > 0 ? v.elementAt(0) : value;
    }

    private interface NameLookup {
        int indexOf(String name);
    }

    private static int elementIndex(RValue index, int length, NameLookup names, Node call) {
        if (index instanceof RString s) {
            if (s.length() != 1) {
                throw new RError(ErrorKind.INVALID_ARGUMENT, "attempt to select more than one element", call);
            }
            int i = s.values[0] == null ? -1 : names.indexOf(s.values[0]);
            if (i < 0) {
                throw new RError(ErrorKind.INVALID_ARGUMENT, "subscript out of bounds", call);
            }
            return i;
        }
        int i = positiveIndex(index, call);
        if (i >= length) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "subscript out of bounds", call);
        }
        return i;
    }

    /**
     * 0-based position from a numeric scalar index.
     */
    private static int positiveIndex(RValue index, Node call) {
        if (!(index instanceof RInteger || index instanceof RReal || index instanceof RLogical)) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid subscript type '" + index.type().typeName + "'", call);
        }
        if (index.length() != 1) {
            throw new RError(ErrorKind.INVALID_ARGUMENT,
                    index.length() == 0 ? "subscript of length zero" : "attempt to select more than one element",
                    call);
        }
        int i = RVector.asInt(index);
        if (i == RInteger.NA || i < 1) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "subscript out of bounds", call);
        }
        return i - 1;
    }

    private static String nameIndex(RValue index, Node call) {
        if (index instanceof RString s && s.length() == 1 && s.values[0] != null) {
            return s.values[0];
        }
        throw new RError(ErrorKind.INVALID_ARGUMENT, "wrong args for environment subassignment", call);
    }

    private static int tagIndex(RPairlist list, String name) {
        for (int i = 0; i < list.size(); i++) {
            if (name.equals(list.tag(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 0-based positions selected by a vector index; -1 stands for NA or out of range.
     */
    private static int[] positions(RVector x, RValue index, Node call) {
        int length = x.length();
        if (index instanceof RLogical l) {
            List<Integer> out = new ArrayList<>();
            int n = Math.max(length, l.length());
            for (int i = 0; i < n && l.length() > 0; i++) {
                int b = l.values[i % l.length()];
                if (b == RLogical.NA) {
                    out.add(-1);
                } else if (b == 1) {
                    out.add(i);
                }
            }
            return out.stream().mapToInt(Integer::intValue).toArray();
        }
        if (index instanceof RString names) {
            int[] out = new int[names.length()];
            for (int k = 0; k < out.length; k++) {
                out[k] = names.values[k] == null ? -1 : x.indexOfName(names.values[k]);
            }
            return out;
        }
        if (!(index instanceof RInteger || index instanceof RReal)) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "invalid subscript type '" + index.type().typeName + "'", call);
        }
        RVector idx = (RVector) index;
        boolean anyNegative = false;
        boolean anyPositive = false;
        for (int k = 0; k < idx.length(); k++) {
            int i = RVector.asInt(idx.elementAt(k));
            if (i != RInteger.NA && i < 0) {
                anyNegative = true;
            } else if (i == RInteger.NA || i > 0) {
                anyPositive = true;
            }
        }
        if (anyNegative && anyPositive) {
            throw new RError(ErrorKind.INVALID_ARGUMENT, "can't mix positive and negative subscripts", call);
        }
        if (anyNegative) {
            boolean[] drop = new boolean[length];
            for (int k = 0; k < idx.length(); k++) {
                int i = -RVector.asInt(idx.elementAt(k));
                if (i <= length) {
                    drop[i - 1] = true;
                }
            }
            List<Integer> out = new ArrayList<>();
            for (int i = 0; i < length; i++) {
                if (!drop[i]) {
                    out.add(i);
                }
            }
            return out.stream().mapToInt(Integer::intValue).toArray();
        }
        List<Integer> out = new ArrayList<>();
        for (int k = 0; k < idx.length(); k++) {
            int i = RVector.asInt(idx.elementAt(k));
            if (i == RInteger.NA) {
                out.add(-1);
            } else if (i > 0) {
                out.add(i - 1);
            }
        }
        return out.stream().mapToInt(Integer::intValue).toArray();
    }

    private static RError notSubsettable(RValue x, Node call) {
        return new RError(ErrorKind.INVALID_ARGUMENT,
                "object of type '" + x.type().typeName + "' is not subsettable", call);
    }
}
