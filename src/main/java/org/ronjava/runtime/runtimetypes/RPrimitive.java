package org.ronjava.runtime.runtimetypes;

/**
 * A function implemented in Java, either eager (BUILTIN) or lazy (SPECIAL).
 */
public final class RPrimitive extends RValue {

    /**
     * How the primitive affects the visible flag.
     */
    public enum Visibility {
        FORCE_ON,
        FORCE_OFF,
        SET_BY_FUNCTION
    }

    public final String name;
    public final Visibility visibility;
    private final BuiltinFunction builtin;
    private final SpecialFunction special;

    private RPrimitive(String name, Visibility visibility, BuiltinFunction builtin, SpecialFunction special) {
        this.name = name;
        this.visibility = visibility;
        this.builtin = builtin;
        this.special = special;
        markShared();
    }

    public static RPrimitive builtin(String name, BuiltinFunction function) {
        return new RPrimitive(name, Visibility.FORCE_ON, function, null);
    }

    public static RPrimitive builtin(String name, Visibility visibility, BuiltinFunction function) {
        return new RPrimitive(name, visibility, function, null);
    }

    public static RPrimitive special(String name, SpecialFunction function) {
        return new RPrimitive(name, Visibility.SET_BY_FUNCTION, null, function);
    }

    public static RPrimitive special(String name, Visibility visibility, SpecialFunction function) {
        return new RPrimitive(name, visibility, null, function);
    }

    public boolean isEager() {
        return builtin != null;
    }

    public BuiltinFunction builtinFunction() {
        return builtin;
    }

    public SpecialFunction specialFunction() {
        return special;
    }

    @Override
    public ValueType type() {
        return builtin != null ? ValueType.BUILTIN : ValueType.SPECIAL;
    }

    @Override
    public String deparse() {
        return ".Primitive(\"" + name + "\")";
    }
}
