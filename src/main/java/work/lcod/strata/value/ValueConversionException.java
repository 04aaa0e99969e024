package work.lcod.strata.value;

public final class ValueConversionException extends ConfigLookupException {
    public ValueConversionException(String path, String reason) {
        super(path, reason);
    }
}
