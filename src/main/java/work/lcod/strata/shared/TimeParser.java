package work.lcod.strata.shared;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Parses timestamps written in one of the well-known layouts (RFC 3339, ANSI C, Unix date, RFC 822,
 * RFC 850, RFC 1123, plain date/time). Results are UTC instants truncated to seconds.
 */
public final class TimeParser {
    private static final List<DateTimeFormatter> ZONED_LAYOUTS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        pattern("EEE MMM ppd HH:mm:ss yyyy", ZoneOffset.UTC),
        pattern("EEE MMM ppd HH:mm:ss zzz yyyy", null),
        pattern("EEE MMM dd HH:mm:ss Z yyyy", null),
        shortYear("dd MMM ", " HH:mm zzz"),
        shortYear("dd MMM ", " HH:mm Z"),
        shortYear("EEEE, dd-MMM-", " HH:mm:ss zzz"),
        pattern("EEE, dd MMM yyyy HH:mm:ss zzz", null),
        pattern("EEE, dd MMM yyyy HH:mm:ss Z", null)
    );
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    private TimeParser() {}

    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        for (DateTimeFormatter layout : ZONED_LAYOUTS) {
            Optional<Instant> parsed = attempt(() -> ZonedDateTime.from(layout.parse(text)).toInstant());
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return attempt(() -> LocalDateTime.parse(text, DATE_TIME).toInstant(ZoneOffset.UTC))
            .or(() -> attempt(() -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC)));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get().truncatedTo(ChronoUnit.SECONDS));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter pattern(String pattern, ZoneOffset zone) {
        DateTimeFormatter formatter = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
        return zone == null ? formatter : formatter.withZone(zone);
    }

    private static DateTimeFormatter shortYear(String prefix, String suffix) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(prefix)
            .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
            .appendPattern(suffix)
            .toFormatter(Locale.ENGLISH);
    }
}
