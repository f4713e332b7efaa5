package org.ronjava.runtime.mro;

import org.ronjava.runtime.runtimetypes.RValue;

/**
 * Externally maintained table of formal methods, consulted only for receivers
 * marked with {@link RValue#isFormalObject()}.
 */
@FunctionalInterface
public interface FormalMethodTable {

    /**
     * @return the method for the receiver, or null
     */
    RValue lookup(RValue receiver, String selector);
}
