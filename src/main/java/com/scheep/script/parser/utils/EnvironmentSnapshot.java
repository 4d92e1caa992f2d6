package com.scheep.script.parser.utils;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scheep.script.parser.Environment;
import com.scheep.script.parser.Frame;
import com.scheep.script.parser.Value;

/**
 * JSON views of environments for the REPL and for debugging.
 *
 * Layout:
 * <pre>
 * { "depth": 2,
 *   "frames": [ { "x": 10, "name": "\"text\"", "f": { "type": "compound", "params": ["a"] } },  // innermost
 *               { ... } ] }
 * </pre>
 *
 * Numbers and booleans map to JSON numbers and booleans, every other datum to
 * its printed form; procedures and macros map to a small descriptor object.
 */
public final class EnvironmentSnapshot {

    private static final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory nodes = JsonNodeFactory.instance;

    private EnvironmentSnapshot() {}

    /** Snapshot of every frame, innermost first. */
    public static ObjectNode snapshot(Environment env) {
        ObjectNode root = nodes.objectNode();
        List<Frame> frames = env.frames();
        root.put("depth", frames.size());
        ArrayNode out = root.putArray("frames");
        for (Frame f : frames) out.add(frame(f));
        return root;
    }

    /** Snapshot of one frame, keys sorted. */
    public static ObjectNode frame(Frame frame) {
        ObjectNode node = nodes.objectNode();
        for (String name : frame.names()) {
            Value v = frame.get(name);
            if (v != null) node.set(name, value(v));
        }
        return node;
    }

    public static JsonNode value(Value v) {
        switch (v.getType()) {
            case NUMBER:
                return nodes.numberNode(v.asNumber());
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case PRIMITIVE: {
                ObjectNode n = nodes.objectNode();
                n.put("type", "primitive");
                n.put("name", v.asPrimitive().name);
                return n;
            }
            case COMPOUND: {
                ObjectNode n = nodes.objectNode();
                n.put("type", "compound");
                if (v.asCompound().name != null) n.put("name", v.asCompound().name);
                ArrayNode params = n.putArray("params");
                for (String p : v.asCompound().params) params.add(p);
                return n;
            }
            case MACRO: {
                ObjectNode n = nodes.objectNode();
                n.put("type", "macro");
                n.put("name", v.asMacro().name);
                return n;
            }
            default:
                return nodes.textNode(v.toString());
        }
    }

    public static String toJson(Environment env) {
        return write(snapshot(env));
    }

    /** JSON of the outermost frame only, i.e. the global bindings of a REPL session. */
    public static String globalsToJson(Environment env) {
        List<Frame> frames = env.frames();
        if (frames.isEmpty()) return "{}";
        return write(frame(frames.get(frames.size() - 1)));
    }

    private static String write(Object node) {
        try {
            return om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize environment snapshot", e);
        }
    }
}
