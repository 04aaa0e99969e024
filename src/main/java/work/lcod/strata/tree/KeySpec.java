package work.lcod.strata.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import work.lcod.strata.value.Value;

/**
 * Turns heterogeneous key arguments into a flat list of path segments. Every argument is
 * converted to text and split on dots, so {@code ("main", 1, "one")} and {@code "main.1.one"}
 * address the same node.
 */
public final class KeySpec {
    public static final String WILDCARD = "*";
    public static final String SEPARATOR = ".";

    private KeySpec() {}

    public static List<String> parse(Object... keys) {
        List<String> segments = new ArrayList<>();
        if (keys == null) {
            return segments;
        }
        for (Object key : keys) {
            append(segments, key);
        }
        return segments;
    }

    public static String join(Object... keys) {
        return String.join(SEPARATOR, parse(keys));
    }

    public static boolean endsWithWildcard(List<String> segments) {
        return !segments.isEmpty() && WILDCARD.equals(segments.get(segments.size() - 1));
    }

    private static void append(List<String> segments, Object key) {
        if (key instanceof Collection<?> collection) {
            for (Object item : collection) {
                append(segments, item);
            }
            return;
        }
        if (key instanceof Object[] array) {
            for (Object item : array) {
                append(segments, item);
            }
            return;
        }
        String text = key instanceof Value value ? value.asText() : String.valueOf(key);
        int start = 0;
        int dot;
        while ((dot = text.indexOf('.', start)) >= 0) {
            segments.add(text.substring(start, dot));
            start = dot + 1;
        }
        segments.add(text.substring(start));
    }
}
