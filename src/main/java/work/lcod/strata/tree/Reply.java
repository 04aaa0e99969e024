package work.lcod.strata.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.strata.value.Coercions;

/**
 * Multi-valued string map produced by settings evaluation. Keys keep their insertion order.
 */
public final class Reply {
    private final Map<String, List<String>> entries = new LinkedHashMap<>();

    public Reply add(String key, String... values) {
        List<String> list = entries.computeIfAbsent(key, k -> new ArrayList<>());
        Collections.addAll(list, values);
        return this;
    }

    public Reply set(String key, String... values) {
        entries.remove(key);
        return add(key, values);
    }

    /**
     * First value stored under {@code key}, or the empty string.
     */
    public String get(String key) {
        List<String> values = entries.get(key);
        return values == null || values.isEmpty() ? "" : values.get(0);
    }

    public long getInt(String key) {
        try {
            return Long.parseLong(get(key));
        } catch (NumberFormatException ex) {
            return 0L;
        }
    }

    public boolean getBool(String key) {
        return Boolean.TRUE.equals(Coercions.parseBoolean(get(key)));
    }

    public List<String> values(String key) {
        List<String> values = entries.get(key);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, List<String>> asMap() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        entries.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return copy;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Reply reply && entries.equals(reply.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
