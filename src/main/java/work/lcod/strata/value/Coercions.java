package work.lcod.strata.value;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.regex.Pattern;
import work.lcod.strata.shared.DurationParser;
import work.lcod.strata.shared.TimeParser;

/**
 * Total conversions from node values to caller types. A {@code null} value (a node without
 * payload) converts to text as the empty string and fails every other conversion.
 */
public final class Coercions {
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private Coercions() {}

    public static Lookup<String> toText(Value value) {
        return Lookup.found(Value.textOf(value));
    }

    public static Lookup<Long> toLong(Value value) {
        if (value instanceof Value.IntegerValue integer) {
            return Lookup.found(integer.value());
        }
        String text = Value.textOf(value);
        try {
            return Lookup.found(Long.parseLong(text));
        } catch (NumberFormatException ex) {
            return Lookup.invalid("invalid integer: \"" + text + "\"");
        }
    }

    public static Lookup<Double> toDouble(Value value) {
        if (value instanceof Value.FloatValue number) {
            return Lookup.found(number.value());
        }
        if (value instanceof Value.IntegerValue integer) {
            return Lookup.found((double) integer.value());
        }
        String text = Value.textOf(value);
        if (!DECIMAL.matcher(text).matches()) {
            return Lookup.invalid("invalid number: \"" + text + "\"");
        }
        return Lookup.found(Double.parseDouble(text));
    }

    public static Lookup<Boolean> toBoolean(Value value) {
        if (value instanceof Value.BooleanValue bool) {
            return Lookup.found(bool.value());
        }
        Boolean parsed = parseBoolean(Value.textOf(value));
        return parsed == null ? Lookup.invalid("bad value") : Lookup.found(parsed);
    }

    public static Lookup<Duration> toDuration(Value value) {
        if (value instanceof Value.DurationValue duration) {
            return Lookup.found(duration.value());
        }
        return DurationParser.parse(Value.textOf(value))
            .map(Lookup::found)
            .orElseGet(() -> Lookup.invalid("bad duration"));
    }

    public static Lookup<Instant> toInstant(Value value) {
        if (value instanceof Value.TimestampValue timestamp) {
            return Lookup.found(timestamp.value());
        }
        String text = Value.textOf(value);
        return TimeParser.parse(text)
            .map(Lookup::found)
            .orElseGet(() -> Lookup.invalid("bad time format: " + text));
    }

    /**
     * Parses the boolean spellings accepted in config files; returns {@code null} for anything else.
     */
    public static Boolean parseBoolean(String text) {
        if (text == null) {
            return null;
        }
        switch (text.toLowerCase(Locale.ROOT)) {
            case "1":
            case "t":
            case "true":
            case "on":
                return Boolean.TRUE;
            case "0":
            case "f":
            case "false":
            case "off":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
