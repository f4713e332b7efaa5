package org.ronjava.runtime.runtimetypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of all runtime values.
 * <p>
 * Every value carries a sharing level used for copy-on-write, and an optional
 * attribute map ({@code names}, {@code class}, and user attributes). The contract:
 * <ul>
 *   <li>fresh values start UNSHARED; pool constants and singletons are SHARED for good;</li>
 *   <li>binding into an environment or inserting into a container bumps the level;</li>
 *   <li>the value of a forced promise is SHARED;</li>
 *   <li>{@link #ensureUnshared()} returns this below SHARED, a duplicate otherwise.</li>
 * </ul>
 * Every mutating instruction and primitive goes through ensureUnshared first.
 */
public abstract class RValue {
    private SharingLevel sharing = SharingLevel.UNSHARED;
    private boolean formalObject;
    protected Map<String, RValue> attributes;

    public abstract ValueType type();

    public final SharingLevel shareLevel() {
        return sharing;
    }

    /**
     * Raises the sharing level by one step, saturating at SHARED.
     */
    public final void bump() {
        sharing = sharing.next();
    }

    public final void markShared() {
        sharing = SharingLevel.SHARED;
    }

    /**
     * Returns a value that may be mutated in place: this when the sharing level is
     * below SHARED, otherwise a duplicate whose level is UNSHARED.
     */
    public final RValue ensureUnshared() {
        return sharing == SharingLevel.SHARED ? duplicate() : this;
    }

    /**
     * Returns a shallow duplicate. Elements and attribute values are shared with the
     * original and bumped accordingly. Reference types (environments, promises,
     * primitives) return themselves and are mutated in place.
     */
    public RValue duplicate() {
        return this;
    }

    public int length() {
        return 1;
    }

    public boolean isFunction() {
        return type().isFunction();
    }

    // -------------------------------------------------------------------------
    // attributes
    // -------------------------------------------------------------------------

    public RValue getAttribute(String name) {
        return attributes == null ? null : attributes.get(name);
    }

    /**
     * Sets an attribute; a null or NULL value removes it. Callers must have
     * unshared the receiver first.
     */
    public void setAttribute(String name, RValue value) {
        if (value == null || value == RNull.NULL) {
            if (attributes != null) {
                attributes.remove(name);
                if (attributes.isEmpty()) {
                    attributes = null;
                }
            }
            return;
        }
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        value.bump();
        attributes.put(name, value);
    }

    public Map<String, RValue> attributes() {
        return attributes == null ? Collections.emptyMap() : Collections.unmodifiableMap(attributes);
    }

    public boolean hasAttributes() {
        return attributes != null && !attributes.isEmpty();
    }

    public void copyAttributesTo(RValue target) {
        if (attributes != null) {
            for (Map.Entry<String, RValue> entry : attributes.entrySet()) {
                target.setAttribute(entry.getKey(), entry.getValue());
            }
        }
        target.formalObject = formalObject;
    }

    /**
     * True when the value carries object-class metadata.
     */
    public boolean isObject() {
        return getAttribute("class") != null;
    }

    /**
     * The class vector, most specific first, or an empty list.
     */
    public List<String> classVector() {
        RValue cls = getAttribute("class");
        if (cls instanceof RString str) {
            return str.asList();
        }
        return List.of();
    }

    /**
     * Marks whether this value participates in formal (table-registered) method dispatch.
     */
    public void setFormalObject(boolean formalObject) {
        this.formalObject = formalObject;
    }

    public boolean isFormalObject() {
        return formalObject;
    }

    /**
     * Returns source text that evaluates to this value, where one exists.
     */
    public abstract String deparse();

    @Override
    public String toString() {
        return deparse();
    }
}
