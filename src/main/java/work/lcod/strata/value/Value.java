package work.lcod.strata.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import work.lcod.strata.shared.DurationParser;

/**
 * Typed payload carried by a tree node. The set of variants is closed; conversions to
 * caller types go through {@link Coercions}.
 */
public sealed interface Value
    permits Value.StringValue, Value.IntegerValue, Value.FloatValue, Value.BooleanValue,
        Value.DurationValue, Value.TimestampValue, Value.ListValue {

    /**
     * Canonical text form, used for settings payloads, dumps and string accessors.
     */
    String asText();

    /**
     * Plain Java object backing this value ({@code String}, {@code Long}, {@code Double},
     * {@code Boolean}, {@code Duration}, {@code Instant} or a {@code List} of those).
     */
    Object raw();

    static Value of(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Value value) {
            return value;
        }
        if (raw instanceof String str) {
            return new StringValue(str);
        }
        if (raw instanceof Boolean bool) {
            return new BooleanValue(bool);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return new IntegerValue(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return big.bitLength() < 64 ? new IntegerValue(big.longValue()) : new FloatValue(big.doubleValue());
        }
        if (raw instanceof Number number) {
            return new FloatValue(number.doubleValue());
        }
        if (raw instanceof Duration duration) {
            return new DurationValue(duration);
        }
        if (raw instanceof Instant instant) {
            return new TimestampValue(instant);
        }
        if (raw instanceof OffsetDateTime dateTime) {
            return new TimestampValue(dateTime.toInstant());
        }
        if (raw instanceof ZonedDateTime dateTime) {
            return new TimestampValue(dateTime.toInstant());
        }
        if (raw instanceof Iterable<?> iterable) {
            List<Value> items = new ArrayList<>();
            for (Object item : iterable) {
                if (item == null) {
                    throw new IllegalArgumentException("Unsupported null list item");
                }
                items.add(of(item));
            }
            return new ListValue(items);
        }
        if (raw instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }

    static String textOf(Value value) {
        return value == null ? "" : value.asText();
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record IntegerValue(long value) implements Value {
        @Override
        public String asText() {
            return Long.toString(value);
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record FloatValue(double value) implements Value {
        @Override
        public String asText() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            String text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
            return "-0".equals(text) ? "0" : text;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record BooleanValue(boolean value) implements Value {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record DurationValue(Duration value) implements Value {
        public DurationValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asText() {
            return DurationParser.format(value);
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record TimestampValue(Instant value) implements Value {
        public TimestampValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asText() {
            return value.toString();
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record ListValue(List<Value> items) implements Value {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public String asText() {
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    text.append(',');
                }
                text.append(items.get(i).asText());
            }
            return text.toString();
        }

        @Override
        public Object raw() {
            List<Object> plain = new ArrayList<>(items.size());
            for (Value item : items) {
                plain.add(item.raw());
            }
            return plain;
        }
    }
}
