package org.ronjava.backend.bytecode;

import org.ronjava.runtime.runtimetypes.RValue;

import java.util.Arrays;

/**
 * The operand stack shared by all activations of one interpreter. Depth 0 is the top.
 */
public final class OperandStack {
    private RValue[] data = new RValue[64];
    private int size;

    public void push(RValue value) {
        if (size == data.length) {
            data = Arrays.copyOf(data, size * 2);
        }
        data[size++] = value;
    }

    public RValue pop() {
        RValue v = data[--size];
        data[size] = null;
        return v;
    }

    public RValue peek() {
        return data[size - 1];
    }

    public RValue peek(int depth) {
        return data[size - 1 - depth];
    }

    public void setTop(RValue value) {
        data[size - 1] = value;
    }

    public void popN(int n) {
        for (int i = 0; i < n; i++) {
            data[--size] = null;
        }
    }

    /**
     * The top n values, deepest first, without popping them.
     */
    public RValue[] top(int n) {
        return Arrays.copyOfRange(data, size - n, size);
    }

    /**
     * Moves the value at the given depth to the top.
     */
    public void pick(int depth) {
        int from = size - 1 - depth;
        RValue v = data[from];
        System.arraycopy(data, from + 1, data, from, depth);
        data[size - 1] = v;
    }

    /**
     * Moves the top value down to the given depth.
     */
    public void put(int depth) {
        int to = size - 1 - depth;
        RValue v = data[size - 1];
        System.arraycopy(data, to, data, to + 1, depth);
        data[to] = v;
    }

    public int size() {
        return size;
    }

    /**
     * Drops values until the stack has the given size.
     */
    public void truncate(int newSize) {
        if (newSize > size) {
            throw new IllegalStateException("cannot grow the stack from " + size + " to " + newSize);
        }
        Arrays.fill(data, newSize, size, null);
        size = newSize;
    }

    /**
     * Makes room for n more values without reallocation.
     */
    public void reserve(int n) {
        if (size + n > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, size + n));
        }
    }
}
