package org.ronjava.runtime.mro;

import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RValue;

import java.util.List;

/**
 * Source of class-specific methods consulted by generic dispatch.
 */
public interface MethodRegistry {

    /**
     * Finds {@code <class>.<selector>} for the first class of the vector that has one.
     *
     * @param classVector classes of the receiver, most specific first
     * @param selector    the generic's name
     * @param env         the environment of the dispatching call
     * @return the method, or null when no class has one
     */
    RValue lookup(List<String> classVector, String selector, REnvironment env);
}
