package work.lcod.strata.api;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.strata.format.ConfigParser;
import work.lcod.strata.format.ConfigSyntaxException;
import work.lcod.strata.format.DocumentLoader;
import work.lcod.strata.format.TreeJson;
import work.lcod.strata.tree.Node;

/**
 * Public entry point for building trees from config files.
 */
public final class TreeLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeLoader.class);
    private static final String OVERRIDE_SOURCE = "override";

    /**
     * Loads every source and returns the top scope root. Read and syntax errors are reported as
     * {@link IllegalStateException}s carrying the underlying message.
     */
    public Node load(LoadOptions options) {
        Node current = Node.newRoot();
        boolean first = true;
        for (Path source : options.sources()) {
            if (options.stacked() && !first) {
                current = current.with();
            }
            SourceFormat format = options.formatOf(source);
            try {
                merge(current, source, format, options.strict());
            } catch (ConfigSyntaxException ex) {
                throw new IllegalStateException(ex.getMessage(), ex);
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to read " + source + ": " + ex.getMessage(), ex);
            }
            LOGGER.debug("Loaded {} as {}", source, format);
            first = false;
        }
        if (!options.overrides().isEmpty()) {
            current = current.with();
            for (String entry : options.overrides()) {
                applyOverride(current, entry);
            }
        }
        return current;
    }

    public static Node merge(Node target, Path source, SourceFormat format, boolean strict) throws IOException {
        switch (format) {
            case CONF:
                return ConfigParser.mergeFile(target, source, strict);
            case JSON:
                try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
                    return TreeJson.mergeJson(target, reader);
                }
            case YAML:
                try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
                    return DocumentLoader.mergeYaml(target, reader);
                }
            case TOML:
                try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
                    return DocumentLoader.mergeToml(target, reader, source.toString());
                }
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }

    /**
     * Copies a stack of scopes into a single tree; nearer scopes win. Child order follows
     * {@link Node#merge(Node)}, which sorts newly created keys.
     */
    public static Node flatten(Node scope) {
        Deque<Node> stack = new ArrayDeque<>();
        for (Node current = scope.root(); current != null; current = current.inheritedRoot()) {
            stack.push(current);
        }
        Node flat = Node.newRoot();
        while (!stack.isEmpty()) {
            Node layer = stack.pop();
            for (Node child : layer.children()) {
                flat.merge(child);
            }
        }
        return flat;
    }

    private static void applyOverride(Node scope, String entry) {
        try {
            ConfigParser.mergeReader(scope, new StringReader(entry), OVERRIDE_SOURCE, true);
        } catch (IOException ex) {
            throw new IllegalStateException(ex.getMessage(), ex);
        }
    }
}
