package com.routedesk.support.routing.value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Typed view of ticket data used by rule predicates: text, number, boolean,
 * nested mapping, sequence, or absent.
 * <p>
 * Equality is structural. Numbers are normalized on construction so that
 * {@code 1} and {@code 1.0} are equal; values of different kinds never are.
 */
public sealed interface ContextValue
        permits ContextValue.Text, ContextValue.Number, ContextValue.Bool,
        ContextValue.Mapping, ContextValue.Sequence, ContextValue.Absent {

    static Text text(String value) {
        return new Text(value);
    }

    static Number number(BigDecimal value) {
        return new Number(value);
    }

    static Number number(long value) {
        return new Number(BigDecimal.valueOf(value));
    }

    static Bool bool(boolean value) {
        return new Bool(value);
    }

    static Absent absent() {
        return Absent.INSTANCE;
    }

    default boolean isPresent() {
        return !(this instanceof Absent);
    }

    record Text(String value) implements ContextValue {
        public Text {
            if (value == null) throw new IllegalArgumentException("text_value_required");
        }
    }

    record Number(BigDecimal value) implements ContextValue {
        public Number {
            if (value == null) throw new IllegalArgumentException("number_value_required");
            value = value.stripTrailingZeros();
        }
    }

    record Bool(boolean value) implements ContextValue {
    }

    record Mapping(Map<String, ContextValue> entries) implements ContextValue {
        private static final Mapping EMPTY = new Mapping(Map.of());

        public Mapping {
            entries = entries == null ? Map.of() : Map.copyOf(entries);
        }

        public static Mapping empty() {
            return EMPTY;
        }

        public ContextValue get(String key) {
            var v = entries.get(key);
            return v == null ? Absent.INSTANCE : v;
        }
    }

    record Sequence(List<ContextValue> items) implements ContextValue {
        public Sequence {
            items = items == null ? List.of() : List.copyOf(items);
        }

        public boolean contains(ContextValue candidate) {
            return candidate.isPresent() && items.contains(candidate);
        }

        public ContextValue get(int index) {
            if (index < 0 || index >= items.size()) return Absent.INSTANCE;
            return items.get(index);
        }
    }

    enum Absent implements ContextValue {
        INSTANCE
    }
}
