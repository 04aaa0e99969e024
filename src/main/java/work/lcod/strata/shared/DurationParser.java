package work.lcod.strata.shared;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses user-friendly durations such as {@code 30s}, {@code 2d1h20m}, {@code 1 hour 5 minutes},
 * {@code 250ms} or clock notation {@code HH:MM[:SS]}. Days are plain 24 hour days.
 */
public final class DurationParser {
    private static final Pattern UNITS = Pattern.compile(
        "^(?:\\s*(\\d+)\\s*d(?:ays?)?)?"
            + "(?:\\s*(\\d+)\\s*h(?:ours?)?)?"
            + "(?:\\s*(\\d+)\\s*m(?:in(?:ute)?s?)?)?"
            + "(?:\\s*(\\d+)\\s*s(?:econds?)?)?"
            + "(?:\\s*(\\d+)\\s*ms)?$"
    );
    private static final Pattern CLOCK = Pattern.compile("^([0-9]{2,10}):([0-9]{2})(?::([0-9]{2}))?$");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        Matcher clock = CLOCK.matcher(trimmed);
        if (clock.matches()) {
            return Optional.of(Duration.ofHours(number(clock.group(1)))
                .plusMinutes(number(clock.group(2)))
                .plusSeconds(number(clock.group(3))));
        }
        Matcher units = UNITS.matcher(trimmed);
        if (!units.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Duration.ofDays(number(units.group(1)))
                .plusHours(number(units.group(2)))
                .plusMinutes(number(units.group(3)))
                .plusSeconds(number(units.group(4)))
                .plusMillis(number(units.group(5))));
        } catch (ArithmeticException | NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * Renders a duration in the unit notation accepted by {@link #parse(String)}, e.g. {@code 49h20m}.
     * Precision below one millisecond is dropped.
     */
    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder text = new StringBuilder();
        Duration remaining = duration;
        if (remaining.isNegative()) {
            text.append('-');
            remaining = remaining.negated();
        }
        long hours = remaining.toHours();
        int minutes = remaining.toMinutesPart();
        int seconds = remaining.toSecondsPart();
        int millis = remaining.toMillisPart();
        if (hours > 0) {
            text.append(hours).append('h');
        }
        if (minutes > 0) {
            text.append(minutes).append('m');
        }
        if (seconds > 0) {
            text.append(seconds).append('s');
        }
        if (millis > 0) {
            text.append(millis).append("ms");
        }
        if (text.length() == 0 || "-".contentEquals(text)) {
            text.append("0s");
        }
        return text.toString();
    }

    private static long number(String group) {
        if (group == null || group.isEmpty()) {
            return 0L;
        }
        return Long.parseLong(group);
    }
}
