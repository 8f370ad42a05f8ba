package com.routedesk.support.routing.value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversions between Jackson trees and {@link ContextValue}.
 */
public final class ContextValues {

    private ContextValues() {
    }

    public static ContextValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ContextValue.absent();
        }
        if (node.isTextual()) {
            return ContextValue.text(node.textValue());
        }
        if (node.isNumber()) {
            return ContextValue.number(node.decimalValue());
        }
        if (node.isBoolean()) {
            return ContextValue.bool(node.booleanValue());
        }
        if (node.isArray()) {
            var items = new ArrayList<ContextValue>(node.size());
            for (var item : node) {
                var v = fromJson(item);
                if (v.isPresent()) items.add(v);
            }
            return new ContextValue.Sequence(items);
        }
        if (node.isObject()) {
            return mappingFromJson(node);
        }
        // binary / POJO nodes have no routing meaning
        return ContextValue.absent();
    }

    /**
     * Reads an object node as a mapping; anything else yields an empty mapping.
     * Null members are dropped so they resolve to absent.
     */
    public static ContextValue.Mapping mappingFromJson(JsonNode node) {
        if (node == null || !node.isObject()) return ContextValue.Mapping.empty();
        var entries = new LinkedHashMap<String, ContextValue>();
        var it = node.fields();
        while (it.hasNext()) {
            var e = it.next();
            var v = fromJson(e.getValue());
            if (v.isPresent()) entries.put(e.getKey(), v);
        }
        return new ContextValue.Mapping(entries);
    }

    /**
     * Reads a rule predicate. Unlike ticket data, null members are kept as
     * {@link ContextValue.Absent} so the key can never be satisfied.
     */
    public static Map<String, ContextValue> predicateFromJson(JsonNode node) {
        if (node == null || !node.isObject()) return Map.of();
        var entries = new LinkedHashMap<String, ContextValue>();
        var it = node.fields();
        while (it.hasNext()) {
            var e = it.next();
            entries.put(e.getKey(), fromJson(e.getValue()));
        }
        return entries;
    }

    public static JsonNode toJson(ContextValue value) {
        var f = JsonNodeFactory.instance;
        if (value instanceof ContextValue.Text t) return f.textNode(t.value());
        if (value instanceof ContextValue.Number n) return f.numberNode(n.value());
        if (value instanceof ContextValue.Bool b) return f.booleanNode(b.value());
        if (value instanceof ContextValue.Sequence s) {
            ArrayNode arr = f.arrayNode();
            s.items().forEach(item -> arr.add(toJson(item)));
            return arr;
        }
        if (value instanceof ContextValue.Mapping m) {
            return toJson(m.entries());
        }
        return f.nullNode();
    }

    public static ObjectNode toJson(Map<String, ContextValue> entries) {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        if (entries == null) return obj;
        // sorted for stable stored JSON
        entries.keySet().stream().sorted().forEach(k -> obj.set(k, toJson(entries.get(k))));
        return obj;
    }
}
