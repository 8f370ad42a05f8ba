package com.routedesk.support.routing.value;

/**
 * Dotted path lookup such as {@code data.shipTo.country} or {@code data.items.0.sku}.
 * A numeric segment indexes into a sequence. Any segment that cannot be
 * followed resolves the whole path to {@link ContextValue.Absent}.
 */
public final class ContextPath {

    private ContextPath() {
    }

    public static ContextValue resolve(ContextValue root, String path) {
        if (path == null || path.isEmpty()) return ContextValue.absent();

        ContextValue current = root;
        int start = 0;
        while (true) {
            int dot = path.indexOf('.', start);
            var segment = dot < 0 ? path.substring(start) : path.substring(start, dot);
            current = step(current, segment);
            if (!current.isPresent() || dot < 0) {
                return current;
            }
            start = dot + 1;
        }
    }

    private static ContextValue step(ContextValue current, String segment) {
        if (segment.isEmpty()) return ContextValue.absent();
        if (current instanceof ContextValue.Mapping m) {
            return m.get(segment);
        }
        if (current instanceof ContextValue.Sequence s) {
            var index = parseIndex(segment);
            return index < 0 ? ContextValue.absent() : s.get(index);
        }
        return ContextValue.absent();
    }

    private static int parseIndex(String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) return -1;
        }
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
