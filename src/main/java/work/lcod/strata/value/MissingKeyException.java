package work.lcod.strata.value;

public final class MissingKeyException extends ConfigLookupException {
    public MissingKeyException(String path) {
        super(path, "node not found");
    }
}
