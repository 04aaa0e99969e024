package work.lcod.strata.api;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Document formats a tree can be loaded from.
 */
public enum SourceFormat {
    CONF,
    JSON,
    YAML,
    TOML;

    /**
     * Guesses the format from the file extension; unknown extensions are read as {@link #CONF}.
     */
    public static SourceFormat detect(Path path) {
        Path fileName = path.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return JSON;
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        if (name.endsWith(".toml")) {
            return TOML;
        }
        return CONF;
    }

    public static SourceFormat from(String value) {
        try {
            return SourceFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported format: " + value);
        }
    }
}
