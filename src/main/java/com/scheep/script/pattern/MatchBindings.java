package com.scheep.script.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.scheep.script.parser.Value;

/**
 * Pattern variable to matched forms. Every variable maps to a sequence: a plain
 * variable holds one form, an ellipsis variable one form per repetition.
 * Instances are immutable.
 */
public final class MatchBindings {

    private static final MatchBindings EMPTY = new MatchBindings(Collections.emptyMap());

    private final Map<String, List<Value>> bindings;

    private MatchBindings(Map<String, List<Value>> bindings) {
        this.bindings = bindings;
    }

    public static MatchBindings empty() {
        return EMPTY;
    }

    /** @return a copy with {@code name} bound to exactly {@code forms}, replacing any previous binding */
    public MatchBindings with(String name, List<Value> forms) {
        Map<String, List<Value>> out = new LinkedHashMap<>(bindings);
        out.put(name, Collections.unmodifiableList(new ArrayList<>(forms)));
        return new MatchBindings(out);
    }

    /** Concatenates sequences stored under the same key, this one's entries first. */
    public MatchBindings merge(MatchBindings other) {
        if (other.bindings.isEmpty()) return this;
        if (bindings.isEmpty()) return other;

        Map<String, List<Value>> out = new LinkedHashMap<>(bindings);
        for (Map.Entry<String, List<Value>> e : other.bindings.entrySet()) {
            List<Value> mine = out.get(e.getKey());
            if (mine == null) {
                out.put(e.getKey(), e.getValue());
            } else {
                List<Value> joined = new ArrayList<>(mine.size() + e.getValue().size());
                joined.addAll(mine);
                joined.addAll(e.getValue());
                out.put(e.getKey(), Collections.unmodifiableList(joined));
            }
        }
        return new MatchBindings(out);
    }

    public boolean has(String name) {
        return bindings.containsKey(name);
    }

    /** @return the matched forms, or null when {@code name} is not a bound pattern variable */
    public List<Value> get(String name) {
        return bindings.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(bindings.keySet());
    }

    public Map<String, List<Value>> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof MatchBindings) && bindings.equals(((MatchBindings) o).bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
