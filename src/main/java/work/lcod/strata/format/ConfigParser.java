package work.lcod.strata.format;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.strata.shared.EscapedSplitter;
import work.lcod.strata.tree.Node;
import work.lcod.strata.value.Coercions;
import work.lcod.strata.value.Lookup;
import work.lcod.strata.value.Value;

/**
 * Reader for the line based config format.
 *
 * <ul>
 *   <li>blank lines and lines starting with {@code #} are ignored;</li>
 *   <li>{@code include other.conf} loads a file relative to the including one, at most once per
 *       load;</li>
 *   <li>{@code key[:type]=value} sets a key, where the optional type is one of {@code string int
 *       float bool duration date time}, or an array of those written {@code []int}; array items
 *       are separated by commas, {@code \,} stands for a literal comma;</li>
 *   <li>anything else is a syntax error.</li>
 * </ul>
 *
 * Keys and values are trimmed. Loading is not atomic: entries read before an error stay in the
 * tree.
 */
public final class ConfigParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigParser.class);

    private static final Pattern IGNORE = Pattern.compile("^\\s*(#.*)?$");
    private static final Pattern INCLUDE = Pattern.compile("^\\s*include (\\S+)\\s*$");
    private static final Pattern ENTRY = Pattern.compile(
        "^\\s*([^=\\s][^=]*?)(?::((?:\\[\\])?(?:string|int|float|bool|duration|date|time)))?\\s*=\\s*(.*?)\\s*$");

    private static final String ARRAY_PREFIX = "[]";

    private ConfigParser() {}

    public static Node mergeFile(Node target, Path file) throws IOException {
        return mergeFile(target, file, true);
    }

    /**
     * Loads {@code file} and the files it includes under {@code target}. With {@code strict} off,
     * unrecognized lines are skipped instead of failing the load.
     */
    public static Node mergeFile(Node target, Path file, boolean strict) throws IOException {
        new FileLoad(target, strict).load(file);
        return target;
    }

    /**
     * Reads entries from {@code reader}; {@code include} lines are not followed.
     */
    public static Node mergeReader(Node target, Reader reader, boolean strict) throws IOException {
        return mergeReader(target, reader, null, strict);
    }

    public static Node mergeReader(Node target, Reader reader, String source, boolean strict) throws IOException {
        BufferedReader lines = new BufferedReader(reader);
        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (IGNORE.matcher(line).matches()) {
                continue;
            }
            if (!applyEntry(target, line, source, lineNumber)) {
                rejectLine(line, source, lineNumber, strict);
            }
        }
        return target;
    }

    public static Node mergeText(Node target, String text) throws IOException {
        return mergeReader(target, new StringReader(text), true);
    }

    /**
     * Parses {@code raw} according to a declared entry type ({@code null} or empty for text).
     */
    public static Lookup<Value> parseValue(String type, String raw) {
        if (type == null || type.isEmpty()) {
            return Lookup.found(new Value.StringValue(raw));
        }
        if (!type.startsWith(ARRAY_PREFIX)) {
            return parseScalar(type, raw);
        }
        String itemType = type.substring(ARRAY_PREFIX.length());
        List<Value> items = new ArrayList<>();
        for (String item : EscapedSplitter.split(raw, ",")) {
            Lookup<Value> parsed = parseScalar(itemType, item);
            if (!parsed.isFound()) {
                return parsed;
            }
            items.add(parsed.value());
        }
        return Lookup.found(new Value.ListValue(items));
    }

    private static Lookup<Value> parseScalar(String type, String raw) {
        Value text = new Value.StringValue(raw);
        switch (type) {
            case "string":
                return Lookup.found(text);
            case "int":
                return Coercions.toLong(text).map(ConfigParser::wrap);
            case "float":
                return Coercions.toDouble(text).map(ConfigParser::wrap);
            case "bool":
                return Coercions.toBoolean(text).map(ConfigParser::wrap);
            case "duration":
                return Coercions.toDuration(text).map(ConfigParser::wrap);
            case "date":
            case "time":
                return Coercions.toInstant(text).map(ConfigParser::wrap);
            default:
                return Lookup.invalid("bad type: \"" + type + "\"");
        }
    }

    private static Lookup<Value> wrap(Object parsed) {
        return Lookup.found(Value.of(parsed));
    }

    private static boolean applyEntry(Node target, String line, String source, int lineNumber) throws ConfigSyntaxException {
        Matcher entry = ENTRY.matcher(line);
        if (!entry.matches()) {
            return false;
        }
        Lookup<Value> value = parseValue(entry.group(2), entry.group(3));
        if (!value.isFound()) {
            throw new ConfigSyntaxException(source, lineNumber, value.error().orElse("bad value"));
        }
        target.setKey(entry.group(1), value.value());
        return true;
    }

    private static void rejectLine(String line, String source, int lineNumber, boolean strict) throws ConfigSyntaxException {
        if (strict) {
            throw new ConfigSyntaxException(source, lineNumber, "bad format: \"" + line + "\"");
        }
        LOGGER.debug("Skipping unrecognized line {} of {}: {}", lineNumber, source, line);
    }

    /**
     * One top-level file load; remembers every file read so include cycles end.
     */
    private static final class FileLoad {
        private final Node target;
        private final boolean strict;
        private final Set<Path> seen = new HashSet<>();

        FileLoad(Node target, boolean strict) {
            this.target = target;
            this.strict = strict;
        }

        void load(Path file) throws IOException {
            if (!seen.add(file.toAbsolutePath().normalize())) {
                LOGGER.debug("Already loaded {}, skipping", file);
                return;
            }
            LOGGER.debug("Loading config file {}", file);
            String source = file.toString();
            try (BufferedReader lines = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                int lineNumber = 0;
                String line;
                while ((line = lines.readLine()) != null) {
                    lineNumber++;
                    if (IGNORE.matcher(line).matches()) {
                        continue;
                    }
                    Matcher include = INCLUDE.matcher(line);
                    if (include.matches()) {
                        include(file.resolveSibling(include.group(1)), source, lineNumber);
                    } else if (!applyEntry(target, line, source, lineNumber)) {
                        rejectLine(line, source, lineNumber, strict);
                    }
                }
            }
        }

        private void include(Path file, String source, int lineNumber) throws IOException {
            try {
                load(file);
            } catch (IOException ex) {
                throw new ConfigSyntaxException(source, lineNumber,
                    "including \"" + file + "\": " + describe(ex), ex);
            }
        }

        private static String describe(IOException ex) {
            if (ex instanceof ConfigSyntaxException) {
                return ex.getMessage();
            }
            return ex.getClass().getSimpleName() + ": " + ex.getMessage();
        }
    }
}
