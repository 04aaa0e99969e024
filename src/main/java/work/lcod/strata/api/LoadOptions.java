package work.lcod.strata.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of how to build a tree from files.
 *
 * @param sources files to read, in order
 * @param stacked when set, every source after the first becomes a new scope over the previous ones
 * @param overrides {@code key[:type]=value} entries written into a final scope on top
 * @param format format for every source, instead of detecting it from the file extension
 * @param strict fail on unrecognized config lines instead of skipping them
 */
public record LoadOptions(
    List<Path> sources,
    boolean stacked,
    List<String> overrides,
    Optional<SourceFormat> format,
    boolean strict
) {
    public LoadOptions {
        sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        overrides = List.copyOf(Objects.requireNonNull(overrides, "overrides"));
        Objects.requireNonNull(format, "format");
    }

    public static Builder builder() {
        return new Builder();
    }

    public SourceFormat formatOf(Path source) {
        return format.orElseGet(() -> SourceFormat.detect(source));
    }

    public static final class Builder {
        private final List<Path> sources = new ArrayList<>();
        private boolean stacked;
        private final List<String> overrides = new ArrayList<>();
        private Optional<SourceFormat> format = Optional.empty();
        private boolean strict = true;

        public Builder source(Path source) {
            sources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public Builder sources(List<Path> paths) {
            paths.forEach(this::source);
            return this;
        }

        public Builder stacked(boolean stacked) {
            this.stacked = stacked;
            return this;
        }

        public Builder override(String entry) {
            overrides.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Builder overrides(List<String> entries) {
            entries.forEach(this::override);
            return this;
        }

        public Builder format(SourceFormat format) {
            this.format = Optional.ofNullable(format);
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public LoadOptions build() {
            return new LoadOptions(sources, stacked, overrides, format, strict);
        }
    }
}
