package work.lcod.strata.format;

import java.io.IOException;

/**
 * A config source that could not be parsed, located by source name and line number.
 */
public class ConfigSyntaxException extends IOException {
    private final String source;
    private final int line;
    private final String reason;

    public ConfigSyntaxException(String source, int line, String reason) {
        this(source, line, reason, null);
    }

    public ConfigSyntaxException(String source, int line, String reason, Throwable cause) {
        super(location(source, line) + reason, cause);
        this.source = source;
        this.line = line;
        this.reason = reason;
    }

    /**
     * File name or other description of the input; {@code null} for anonymous readers.
     */
    public String source() {
        return source;
    }

    public int line() {
        return line;
    }

    public String reason() {
        return reason;
    }

    private static String location(String source, int line) {
        return source == null ? "line " + line + ": " : source + ":" + line + ": ";
    }
}
