package com.scheep.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.scheep.debug.Debug;

/**
 * Table from head symbol to special-form handler.
 *
 * Mutable while the engine starts up, then sealed: after {@link #seal()} the
 * table is an unmodifiable snapshot, so lookups during evaluation need no lock.
 */
public final class SpecialForms {

    private static final String TAG = "scheep.forms";

    private volatile Map<String, SpecialForm> handlers = new LinkedHashMap<>();
    private volatile boolean sealed = false;

    public synchronized void register(String tag, SpecialForm handler) {
        if (tag == null || tag.isEmpty()) throw new IllegalArgumentException("tag must not be empty");
        if (handler == null) throw new IllegalArgumentException("handler must not be null");
        if (sealed) {
            throw new IllegalStateException("Special form registry is sealed; cannot register '" + tag + "'");
        }
        if (handlers.put(tag, handler) != null) {
            Debug.get().w(TAG, "special form '" + tag + "' re-registered");
        } else {
            Debug.get().t(TAG, "registered special form '" + tag + "'");
        }
    }

    public synchronized void seal() {
        if (sealed) return;
        handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
        sealed = true;
        Debug.get().d(TAG, "sealed with " + handlers.size() + " forms " + handlers.keySet());
    }

    public boolean isSealed() {
        return sealed;
    }

    /** @return the handler for {@code tag}, or null when it is not a special form */
    public SpecialForm get(String tag) {
        return handlers.get(tag);
    }

    public boolean has(String tag) {
        return handlers.containsKey(tag);
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
