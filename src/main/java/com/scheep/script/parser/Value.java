package com.scheep.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.scheep.script.pattern.SyntaxRules;

/**
 * A Scheme datum. Code and data share this representation: the reader produces
 * Value trees and the evaluator walks them directly.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, SYMBOL, LIST, PRIMITIVE, COMPOUND, MACRO }

    public static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    public static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);
    public static final Value EMPTY_LIST = new Value(Type.LIST, Collections.emptyList());
    public static final Value OK = symbol("ok");

    public final Type type;
    public final Object value;

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value symbol(String name) { return new Value(Type.SYMBOL, name); }
    public static Value primitive(PrimitiveProcedure p) { return new Value(Type.PRIMITIVE, p); }
    public static Value compound(CompoundProcedure p) { return new Value(Type.COMPOUND, p); }
    public static Value macro(SyntaxRules m) { return new Value(Type.MACRO, m); }

    /** Wraps {@code items} as an immutable list value (the caller's list is copied). */
    public static Value list(List<Value> items) {
        if (items == null || items.isEmpty()) return EMPTY_LIST;
        return new Value(Type.LIST, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public static Value list(Value... items) {
        List<Value> out = new ArrayList<>(items.length);
        Collections.addAll(out, items);
        return list(out);
    }

    public Type getType() { return type; }

    public boolean isSymbol() { return type == Type.SYMBOL; }
    public boolean isList() { return type == Type.LIST; }
    public boolean isEmptyList() { return type == Type.LIST && asList().isEmpty(); }

    public boolean isSymbol(String name) {
        return type == Type.SYMBOL && value.equals(name);
    }

    /** Only the boolean false is falsey. */
    public boolean isTrue() {
        return !(type == Type.BOOL && !((Boolean) value));
    }

    public boolean isSelfEvaluating() {
        return type == Type.NUMBER || type == Type.STRING || type == Type.BOOL;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw EvaluationException.wrongType("Expected number, got " + describe());
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw EvaluationException.wrongType("Expected boolean, got " + describe());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw EvaluationException.wrongType("Expected string, got " + describe());
        return (String) value;
    }

    public String asSymbol() {
        if (type != Type.SYMBOL) throw EvaluationException.wrongType("Expected symbol, got " + describe());
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw EvaluationException.wrongType("Expected list, got " + describe());
        return (List<Value>) value;
    }

    public PrimitiveProcedure asPrimitive() {
        if (type != Type.PRIMITIVE) throw EvaluationException.wrongType("Expected primitive, got " + describe());
        return (PrimitiveProcedure) value;
    }

    public CompoundProcedure asCompound() {
        if (type != Type.COMPOUND) throw EvaluationException.wrongType("Expected procedure, got " + describe());
        return (CompoundProcedure) value;
    }

    public SyntaxRules asMacro() {
        if (type != Type.MACRO) throw EvaluationException.wrongType("Expected macro, got " + describe());
        return (SyntaxRules) value;
    }

    /** Short form used in error messages: type plus printed value. */
    public String describe() {
        return type.name().toLowerCase(java.util.Locale.ROOT) + " " + this;
    }

    /** Printed form as used by {@code display}: strings are written raw. */
    public String display() {
        if (type == Type.STRING) return asString();
        if (type == Type.LIST) {
            StringBuilder sb = new StringBuilder("(");
            List<Value> items = asList();
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(items.get(i).display());
            }
            return sb.append(')').toString();
        }
        return toString();
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return asBool() ? "#t" : "#f";
            case STRING:
                return '"' + escape(asString()) + '"';
            case SYMBOL:
                return asSymbol();
            case LIST: {
                List<Value> items = asList();
                if (items.size() == 2 && items.get(0).isSymbol("quote")) {
                    return "'" + items.get(1);
                }
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(items.get(i));
                }
                return sb.append(')').toString();
            }
            case PRIMITIVE:
                return "#<primitive " + asPrimitive().name + ">";
            case COMPOUND: {
                String name = asCompound().name;
                return (name == null) ? "#<procedure>" : "#<procedure " + name + ">";
            }
            case MACRO:
                return "#<macro " + asMacro().name + ">";
            default:
                throw new IllegalStateException("Unhandled value type: " + type);
        }
    }

    static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Structural equality for data (numbers, booleans, strings, symbols, lists);
     * identity for procedures and macros.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case PRIMITIVE:
            case COMPOUND:
            case MACRO:
                return value == other.value;
            case NUMBER: {
                double a = (double) value;
                double b = (double) other.value;
                return a == b || (Double.isNaN(a) && Double.isNaN(b));
            }
            default:
                return Objects.equals(value, other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case PRIMITIVE:
            case COMPOUND:
            case MACRO:
                return System.identityHashCode(value);
            case NUMBER: {
                double d = (double) value;
                // -0.0 equals 0.0
                return 31 * type.hashCode() + Double.hashCode(d == 0.0 ? 0.0 : d);
            }
            default:
                return 31 * type.hashCode() + Objects.hashCode(value);
        }
    }
}
