package org.ronjava.app;

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.schema.CoreSchema;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tunables of the compiler and the engine.
 * <p>
 * Defaults can be overridden from a YAML mapping, either passed explicitly or read
 * from the class-path resource {@code ronjava.yaml}. The environment flags
 * {@code RONJAVA_TRACE} and {@code RONJAVA_DISASSEMBLE} switch the diagnostics on
 * regardless of the file.
 */
public class InterpreterOptions implements Cloneable {
    public static final String RESOURCE_NAME = "ronjava.yaml";

    /** Evaluation steps between two looks at the interrupt flag. */
    public int interruptCheckInterval = 1000;
    /** Operand-stack headroom reserved on top of a code object's own need. */
    public int stackSlack = 5;
    /** Maximum nesting of code activations before evaluation is abandoned. */
    public int maxCallDepth = 2048;
    public boolean trace = false;
    public boolean disassemble = false;
    /** Functions whose calls dispatch on the class of their first argument. */
    public Set<String> dispatchGenerics = new LinkedHashSet<>(List.of("print", "format", "summary", "toString"));

    /**
     * Defaults, then {@code ronjava.yaml} when present on the class path, then
     * environment flags.
     */
    public static InterpreterOptions loadDefaults() {
        InterpreterOptions options;
        try (InputStream in = InterpreterOptions.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            options = in == null ? new InterpreterOptions() : load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE_NAME, e);
        }
        options.applyEnvironment();
        return options;
    }

    /**
     * Reads options from a YAML mapping. Keys not listed here are rejected.
     */
    public static InterpreterOptions load(InputStream in) {
        LoadSettings settings = LoadSettings.builder()
                .setSchema(new CoreSchema())
                .build();
        Load load = new Load(settings);
        Object document = load.loadFromInputStream(in);
        InterpreterOptions options = new InterpreterOptions();
        if (document == null) {
            return options;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Options document must be a mapping, got " + document.getClass().getSimpleName());
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            options.set(String.valueOf(entry.getKey()), entry.getValue());
        }
        return options;
    }

    private void set(String key, Object value) {
        switch (key) {
            case "interruptCheckInterval" -> interruptCheckInterval = positive(key, value);
            case "stackSlack" -> stackSlack = positive(key, value);
            case "maxCallDepth" -> maxCallDepth = positive(key, value);
            case "trace" -> trace = Boolean.TRUE.equals(value);
            case "disassemble" -> disassemble = Boolean.TRUE.equals(value);
            case "dispatchGenerics" -> {
                if (!(value instanceof List<?> list)) {
                    throw new IllegalArgumentException("dispatchGenerics must be a list");
                }
                Set<String> names = new LinkedHashSet<>();
                for (Object name : list) {
                    names.add(String.valueOf(name));
                }
                dispatchGenerics = names;
            }
            default -> throw new IllegalArgumentException("Unknown option: " + key);
        }
    }

    private static int positive(String key, Object value) {
        if (!(value instanceof Number number) || number.intValue() <= 0) {
            throw new IllegalArgumentException(key + " must be a positive integer, got " + value);
        }
        return number.intValue();
    }

    private void applyEnvironment() {
        if (System.getenv("RONJAVA_TRACE") != null) {
            trace = true;
        }
        if (System.getenv("RONJAVA_DISASSEMBLE") != null) {
            disassemble = true;
        }
    }

    @Override
    public InterpreterOptions clone() {
        try {
            InterpreterOptions copy = (InterpreterOptions) super.clone();
            copy.dispatchGenerics = new LinkedHashSet<>(dispatchGenerics);
            return copy;
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "InterpreterOptions{\n" +
                "    interruptCheckInterval=" + interruptCheckInterval + ",\n" +
                "    stackSlack=" + stackSlack + ",\n" +
                "    maxCallDepth=" + maxCallDepth + ",\n" +
                "    trace=" + trace + ",\n" +
                "    disassemble=" + disassemble + ",\n" +
                "    dispatchGenerics=" + new ArrayList<>(dispatchGenerics) + "\n" +
                "}";
    }
}
