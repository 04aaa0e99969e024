package work.lcod.strata.tree;

import java.util.Collection;
import java.util.Comparator;

/**
 * Orders child keys by their integer value. Keys with the same value ({@code 001}, {@code 01},
 * {@code 1}) fall back to text order; keys that are not integers rank below every number.
 */
public final class NumericKeyComparator implements Comparator<String> {
    public static final NumericKeyComparator INSTANCE = new NumericKeyComparator();

    private NumericKeyComparator() {}

    @Override
    public int compare(String left, String right) {
        Long a = parse(left);
        Long b = parse(right);
        if (a == null || b == null) {
            if (a == null && b == null) {
                return left.compareTo(right);
            }
            return a == null ? -1 : 1;
        }
        int byValue = Long.compare(a, b);
        return byValue != 0 ? byValue : left.compareTo(right);
    }

    public static boolean allNumeric(Collection<String> keys) {
        for (String key : keys) {
            if (parse(key) == null) {
                return false;
            }
        }
        return true;
    }

    static Long parse(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(key);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
