package work.lcod.strata.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.strata.tree.Node;

class ValueTest {
    @Test
    void wrapsPlainJavaObjects() {
        assertNull(Value.of(null));
        assertEquals(new Value.IntegerValue(3), Value.of(3));
        assertEquals(new Value.IntegerValue(3), Value.of((short) 3));
        assertEquals(new Value.FloatValue(2.5), Value.of(2.5f));
        assertEquals(new Value.BooleanValue(true), Value.of(true));
        assertEquals(new Value.TimestampValue(Instant.parse("2020-01-01T00:00:00Z")),
            Value.of(OffsetDateTime.of(2020, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(1))));
        assertEquals(new Value.FloatValue(1.8446744073709552E19), Value.of(new BigInteger("18446744073709551616")));
        assertThrows(IllegalArgumentException.class, () -> Value.of(new Object()));
    }

    @Test
    void rendersCanonicalText() {
        assertEquals("3", Value.of(3.0).asText());
        assertEquals("3.14", Value.of(3.14).asText());
        assertEquals("-17", Value.of(-17L).asText());
        assertEquals("1h30m", Value.of(Duration.ofMinutes(90)).asText());
        assertEquals("1979-12-07T00:00:00Z", Value.of(Instant.parse("1979-12-07T00:00:00Z")).asText());
        assertEquals("a,1,true", Value.of(List.of("a", 1, true)).asText());
        assertEquals("", Value.textOf(null));
    }

    @Test
    void listsExposeRawItems() {
        Value list = Value.of(new Object[] {"a", 2L});
        assertEquals(List.of("a", 2L), list.raw());
    }

    @Test
    void rejectsNullListItems() {
        var fromList = assertThrows(IllegalArgumentException.class, () -> Value.of(Arrays.asList("a", null)));
        assertEquals("Unsupported null list item", fromList.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Value.of(new Object[] {"a", null}));
        assertThrows(IllegalArgumentException.class, () -> Node.newRoot().setKey("x", new Object[] {"a", null}));
    }
}
