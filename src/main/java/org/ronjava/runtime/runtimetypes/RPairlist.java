package org.ronjava.runtime.runtimetypes;

import org.ronjava.frontend.analysis.PrintVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Tagged sequence of values. The variadic binding {@code ...} of a closure
 * activation is a pairlist of (name, promise or value) entries.
 */
public final class RPairlist extends RValue {
    private final List<String> tags = new ArrayList<>();
    private final List<RValue> values = new ArrayList<>();

    public void add(String tag, RValue value) {
        value.bump();
        tags.add(tag);
        values.add(value);
    }

    public int size() {
        return values.size();
    }

    public String tag(int i) {
        return tags.get(i);
    }

    public RValue value(int i) {
        return values.get(i);
    }

    @Override
    public ValueType type() {
        return ValueType.PAIRLIST;
    }

    @Override
    public int length() {
        return values.size();
    }

    @Override
    public RValue duplicate() {
        RPairlist copy = new RPairlist();
        for (int i = 0; i < values.size(); i++) {
            copy.add(tags.get(i), values.get(i));
        }
        copyAttributesTo(copy);
        return copy;
    }

    @Override
    public String deparse() {
        StringBuilder sb = new StringBuilder("pairlist(");
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            if (tags.get(i) != null) {
                sb.append(PrintVisitor.quoteSymbol(tags.get(i))).append(" = ");
            }
            sb.append(values.get(i).deparse());
        }
        return sb.append(')').toString();
    }
}
