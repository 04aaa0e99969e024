package work.lcod.strata.value;

/**
 * Raised by the {@code require*} accessors when a key is missing or its value cannot be converted.
 */
public class ConfigLookupException extends RuntimeException {
    private final String path;

    protected ConfigLookupException(String path, String reason) {
        super("Required conf key " + path + ": " + reason);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
