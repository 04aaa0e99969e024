package work.lcod.strata.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.strata.tree.Node;
import work.lcod.strata.tree.NodeFlag;

/**
 * Maps YAML and TOML documents onto a tree with the same layout rules as {@link TreeJson}.
 */
public final class DocumentLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DocumentLoader() {}

    public static Node mergeYaml(Node target, Reader reader) throws IOException {
        return TreeJson.merge(target, YAML_MAPPER.readTree(reader));
    }

    /**
     * Writes a TOML document under {@code target}. Local dates and date-times are read as UTC.
     */
    public static Node mergeToml(Node target, Reader reader, String source) throws IOException {
        TomlParseResult result = Toml.parse(reader);
        if (result.hasErrors()) {
            TomlParseError error = result.errors().get(0);
            throw new ConfigSyntaxException(source, error.position().line(), "toml parse error: " + error.getMessage());
        }
        mergeTable(target, new ArrayList<>(), result);
        LOGGER.debug("Loaded TOML document {} with {} top-level key(s)", source, result.size());
        return target;
    }

    private static void mergeTable(Node target, List<String> path, TomlTable table) {
        if (table.isEmpty() && !path.isEmpty()) {
            target.addNode(path).addFlag(NodeFlag.FORCE_MAP);
            return;
        }
        for (String key : table.keySet()) {
            path.add(key);
            mergeValue(target, path, table.get(List.of(key)));
            path.remove(path.size() - 1);
        }
    }

    private static void mergeValue(Node target, List<String> path, Object value) {
        if (value instanceof TomlTable table) {
            mergeTable(target, path, table);
            return;
        }
        if (value instanceof TomlArray array) {
            if (array.isEmpty()) {
                target.addNode(path).addFlag(NodeFlag.FORCE_ARRAY);
                return;
            }
            for (int i = 0; i < array.size(); i++) {
                path.add(Integer.toString(i + 1));
                mergeValue(target, path, array.get(i));
                path.remove(path.size() - 1);
            }
            return;
        }
        target.set(path, convertScalar(value));
    }

    private static Object convertScalar(Object value) {
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof LocalTime time) {
            return time.toString();
        }
        return value;
    }
}
