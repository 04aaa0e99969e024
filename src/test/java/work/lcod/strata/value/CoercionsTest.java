package work.lcod.strata.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.strata.tree.Node;

class CoercionsTest {
    @Test
    void parsesBooleanSpellings() {
        for (String yes : List.of("1", "t", "T", "true", "TRUE", "on", "ON")) {
            assertEquals(Boolean.TRUE, Coercions.parseBoolean(yes), yes);
        }
        for (String no : List.of("0", "f", "F", "false", "FALSE", "off", "OFF")) {
            assertEquals(Boolean.FALSE, Coercions.parseBoolean(no), no);
        }
        assertNull(Coercions.parseBoolean(""));
        assertNull(Coercions.parseBoolean("untrue"));
        assertNull(Coercions.parseBoolean(null));
        assertEquals("bad value", Coercions.toBoolean(null).error().orElseThrow());
    }

    @Test
    void parsesSignedIntegers() {
        assertEquals(12345L, Coercions.toLong(Value.of("012345")).value());
        assertEquals(-98765432100L, Coercions.toLong(Value.of("-98765432100")).value());
        assertEquals(Long.MAX_VALUE, Coercions.toLong(Value.of("9223372036854775807")).value());
        assertEquals(Long.MIN_VALUE, Coercions.toLong(Value.of("-9223372036854775808")).value());
        assertEquals(Lookup.Status.INVALID, Coercions.toLong(Value.of("9223372036854775808")).status());
        assertEquals("invalid integer: \"3.141592653589793\"", Coercions.toLong(Value.of(Math.PI)).error().orElseThrow());
        assertEquals("invalid integer: \"\"", Coercions.toLong(null).error().orElseThrow());
    }

    @Test
    void floatsAcceptIntegersAndDecimals() {
        assertEquals(3.14159, Coercions.toDouble(Value.of("3.14159")).value());
        assertEquals(1.0, Coercions.toDouble(Value.of(1)).value());
        assertEquals(0.23, Coercions.toDouble(Value.of(".23")).value());
        assertFalse(Coercions.toDouble(Value.of("NaN")).isFound());
        assertFalse(Coercions.toDouble(Value.of("true")).isFound());
    }

    @Test
    void durationsAndTimes() {
        assertEquals(Duration.ofHours(49).plusMinutes(20), Coercions.toDuration(Value.of("2d1h20m")).value());
        assertEquals("bad duration", Coercions.toDuration(Value.of("a")).error().orElseThrow());
        assertEquals(Instant.parse("1979-12-07T00:00:00Z"), Coercions.toInstant(Value.of("1979-12-07")).value());
        assertEquals("bad time format: soon", Coercions.toInstant(Value.of("soon")).error().orElseThrow());
    }

    @Test
    void tryGettersReportOutcome() {
        Node node = Node.newNode("lol");
        assertEquals(Lookup.Status.NOT_FOUND, node.tryGetNode("x.y").status());

        node.setKey("x.y", "a");
        assertEquals("invalid integer: \"a\"", node.tryGetInt("x.y").error().orElseThrow());
        assertEquals("invalid number: \"a\"", node.tryGetFloat("x.y").error().orElseThrow());
        assertEquals("bad duration", node.tryGetDuration("x.y").error().orElseThrow());
        assertEquals("bad value", node.tryGetBool("x.y").error().orElseThrow());

        node.setKey("x.a", "true");
        node.setKey("x.b", "17");
        node.setKey("x.c", "2d1h20m");
        assertTrue(node.getBool("x.a"));
        assertEquals(17, node.getInt("x.b"));
        assertEquals(Duration.ofHours(49).plusMinutes(20), node.getDuration("x.c"));
    }

    @Test
    void plainGettersReturnZeroValues() {
        Node root = Node.newRoot();
        assertNull(root.get("missing"));
        assertNull(root.getNode("missing"));
        assertEquals("", root.getString("missing"));
        assertEquals(0, root.getInt("missing"));
        assertEquals(0.0, root.getFloat("missing"));
        assertFalse(root.getBool("missing"));
        assertEquals(Duration.ZERO, root.getDuration("missing"));
        assertEquals(Instant.EPOCH, root.getTime("missing"));
    }

    @Test
    void defaultGettersReturnCallerValues() {
        Node root = Node.newRoot();
        root.setKey("main.key", "1");
        root.setKey("main.duration", "10m");

        assertNull(root.getNodeOrDefault(null, "missing.path"));
        assertEquals(root.getNode("main"), root.getNodeOrDefault(null, "main"));
        assertEquals(Value.of("hi"), root.getOrDefault("hi", "missing.path"));
        assertEquals(Value.of("1"), root.getOrDefault("hi", "main.key"));
        assertEquals("x", root.getStringOrDefault("x", "missing.path"));
        assertEquals("1", root.getStringOrDefault("17", "main.key"));
        assertEquals(17, root.getIntOrDefault(17, "missing.path"));
        assertEquals(1, root.getIntOrDefault(17, "main.key"));
        assertEquals(17.0, root.getFloatOrDefault(17.0, "missing.path"));
        assertEquals(1.0, root.getFloatOrDefault(17, "main.key"));
        assertTrue(root.getBoolOrDefault(true, "missing.path"));
        assertTrue(root.getBoolOrDefault(false, "main.key"));
        assertEquals(Duration.ofMinutes(1), root.getDurationOrDefault(Duration.ofMinutes(1), "missing.path"));
        assertEquals(Duration.ofMinutes(10), root.getDurationOrDefault(Duration.ZERO, "main.duration"));
        assertEquals(2, root.getIntOrDefault(2, "main.duration"));
    }

    @Test
    void requireGettersThrowOnMissingOrInvalid() {
        Node root = Node.newRoot();
        root.setKey("string.one", "1");
        root.setKey("string.two", "2");
        root.setKey("bool.one", "true");
        root.setKey("float.one", "3.14159");
        root.setKey("duration.one", "1h");

        MissingKeyException missing = assertThrows(MissingKeyException.class, () -> root.require("missing.node"));
        assertEquals("Required conf key missing.node: node not found", missing.getMessage());
        assertEquals("missing.node", missing.path());
        assertEquals(Value.of("1"), root.require("string.one"));
        assertThrows(MissingKeyException.class, () -> root.requireNode("missing.node"));
        assertEquals("one", root.requireNode("string.one").key());
        assertThrows(MissingKeyException.class, () -> root.requireString("missing.node"));
        assertEquals("1", root.requireString("string.one"));

        ValueConversionException invalid = assertThrows(ValueConversionException.class, () -> root.requireInt("bool.one"));
        assertEquals("Required conf key bool.one: invalid integer: \"true\"", invalid.getMessage());
        assertEquals(1, root.requireInt("string.one"));
        assertThrows(ValueConversionException.class, () -> root.requireFloat("bool.one"));
        assertEquals(3.14159, root.requireFloat("float.one"));
        assertEquals(1.0, root.requireFloat("string.one"));
        assertThrows(ValueConversionException.class, () -> root.requireBool("string.two"));
        assertTrue(root.requireBool("string.one"));
        assertThrows(ConfigLookupException.class, () -> root.requireDuration("string.one"));
        assertEquals(Duration.ofHours(1), root.requireDuration("duration.one"));
    }
}
