package org.ronjava.runtime.mro;

import org.ronjava.runtime.runtimetypes.REnvironment;
import org.ronjava.runtime.runtimetypes.RPromise;
import org.ronjava.runtime.runtimetypes.RValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks methods up in two places: first as a function named
 * {@code <class>.<selector>} visible from the dispatching environment, then in a
 * table of explicitly registered methods. Results from the table are cached per
 * (class vector, selector), including misses; registering a method clears the cache.
 */
public class DefaultMethodRegistry implements MethodRegistry {
    private final Map<String, RValue> registered = new HashMap<>();
    private final Map<String, RValue> methodCache = new HashMap<>();

    public void register(String className, String selector, RValue method) {
        registered.put(className + "." + selector, method);
        invalidateCache();
    }

    public void invalidateCache() {
        methodCache.clear();
    }

    @Override
    public RValue lookup(List<String> classVector, String selector, REnvironment env) {
        for (String className : classVector) {
            RValue method = findVisibleFunction(className + "." + selector, env);
            if (method != null) {
                return method;
            }
        }
        return findRegistered(classVector, selector);
    }

    private RValue findRegistered(List<String> classVector, String selector) {
        String cacheKey = String.join("/", classVector) + "::" + selector;
        if (methodCache.containsKey(cacheKey)) {
            return methodCache.get(cacheKey);
        }
        RValue found = null;
        for (String className : classVector) {
            found = registered.get(className + "." + selector);
            if (found != null) {
                break;
            }
        }
        methodCache.put(cacheKey, found);
        return found;
    }

    /**
     * Nearest function binding of name. Unforced promises are skipped: a method
     * definition is never a pending argument.
     */
    private static RValue findVisibleFunction(String name, REnvironment env) {
        for (REnvironment e = env; e != null; e = e.parent()) {
            RValue value = e.getLocal(name);
            if (value instanceof RPromise promise) {
                value = promise.value();
            }
            if (value != null && value.isFunction()) {
                return value;
            }
        }
        return null;
    }
}
