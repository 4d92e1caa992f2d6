package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One scope level. Frames are shared between every environment chain and closure
 * that reaches them, so each single insert or overwrite is atomic for readers.
 * A frame never shrinks.
 */
public final class Frame {

    private final Map<String, Value> bindings = new ConcurrentHashMap<>();

    Frame(List<String> names, List<Value> values) {
        for (int i = 0; i < names.size(); i++) {
            bindings.put(names.get(i), values.get(i));
        }
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    /** @return the bound value, or null when this frame has no such binding */
    public Value get(String name) {
        return bindings.get(name);
    }

    /** Insert or overwrite. */
    void define(String name, Value value) {
        bindings.put(name, value);
    }

    /** Overwrite an existing binding only; returns false when the name is not bound here. */
    boolean replace(String name, Value value) {
        return bindings.replace(name, value) != null;
    }

    public int size() {
        return bindings.size();
    }

    /** Sorted copy of the bound names. */
    public List<String> names() {
        List<String> out = new ArrayList<>(bindings.keySet());
        Collections.sort(out);
        return out;
    }
}
