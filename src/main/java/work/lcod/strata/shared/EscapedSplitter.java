package work.lcod.strata.shared;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text on a separator that is not preceded by an escape sequence; escaped separators are
 * unescaped in the resulting parts ({@code a\,b,c} gives {@code [a,b, c]}).
 */
public final class EscapedSplitter {
    public static final String BACKSLASH = "\\";

    private EscapedSplitter() {}

    public static List<String> split(String text, String separator) {
        return split(text, separator, BACKSLASH, -1);
    }

    /**
     * Splits into at most {@code limit} parts; a negative limit means no limit, zero yields no parts.
     */
    public static List<String> split(String text, String separator, String escape, int limit) {
        List<String> parts = new ArrayList<>();
        if (limit == 0) {
            return parts;
        }
        String escapedSeparator = escape + separator;
        String rest = text;
        int remaining = limit;
        while ((remaining < 0 || remaining > 1) && !rest.isEmpty()) {
            int index = indexOf(rest, separator, escape);
            if (index < 0) {
                break;
            }
            parts.add(rest.substring(0, index).replace(escapedSeparator, separator));
            rest = rest.substring(index + separator.length());
            if (remaining > 0) {
                remaining--;
            }
        }
        parts.add(rest.replace(escapedSeparator, separator));
        return parts;
    }

    /**
     * Index of the first {@code separator} in {@code text} not preceded by {@code escape}, or -1.
     */
    public static int indexOf(String text, String separator, String escape) {
        int from = 0;
        while (true) {
            int index = text.indexOf(separator, from);
            if (index < 0) {
                return -1;
            }
            if (escape.isEmpty() || index < escape.length() || !text.startsWith(escape, index - escape.length())) {
                return index;
            }
            from = index + separator.length();
        }
    }
}
