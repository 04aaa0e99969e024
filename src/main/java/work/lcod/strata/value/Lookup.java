package work.lcod.strata.value;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a typed lookup: a value, a missing key, or a value that could not be converted.
 */
public final class Lookup<T> {
    public enum Status {
        FOUND,
        NOT_FOUND,
        INVALID
    }

    private static final String NOT_FOUND_ERROR = "node not found";

    private final Status status;
    private final T value;
    private final String error;

    private Lookup(Status status, T value, String error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> Lookup<T> found(T value) {
        return new Lookup<>(Status.FOUND, value, null);
    }

    public static <T> Lookup<T> notFound() {
        return new Lookup<>(Status.NOT_FOUND, null, NOT_FOUND_ERROR);
    }

    public static <T> Lookup<T> invalid(String error) {
        return new Lookup<>(Status.INVALID, null, Objects.requireNonNull(error, "error"));
    }

    public Status status() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * The converted value; only meaningful when {@link #isFound()}.
     */
    public T value() {
        if (status != Status.FOUND) {
            throw new NoSuchElementException(error);
        }
        return value;
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public T orElse(T fallback) {
        return status == Status.FOUND ? value : fallback;
    }

    public <R> Lookup<R> map(Function<? super T, Lookup<R>> next) {
        if (status != Status.FOUND) {
            return new Lookup<>(status, null, error);
        }
        return next.apply(value);
    }

    /**
     * Returns the value or throws the lookup's failure as a {@link ConfigLookupException}.
     */
    public T orElseThrow(String path) {
        switch (status) {
            case FOUND:
                return value;
            case NOT_FOUND:
                throw new MissingKeyException(path);
            default:
                throw new ValueConversionException(path, error);
        }
    }

    @Override
    public String toString() {
        return status == Status.FOUND ? "Lookup[" + value + "]" : "Lookup[" + status + ": " + error + "]";
    }
}
