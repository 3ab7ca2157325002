package work.lcod.compendium.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable options for {@link Packs#compilePack}.
 */
public record CompileOptions(
    SerializationFormat format,
    boolean recursive,
    Optional<EntryTransformer> transformEntry
) {
    public CompileOptions {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(transformEntry, "transformEntry");
    }

    public static CompileOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SerializationFormat format = SerializationFormat.JSON;
        private boolean recursive;
        private EntryTransformer transformEntry;

        public Builder format(SerializationFormat format) {
            this.format = format;
            return this;
        }

        public Builder yaml(boolean yaml) {
            this.format = SerializationFormat.of(yaml);
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder transformEntry(EntryTransformer transformEntry) {
            this.transformEntry = transformEntry;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(format, recursive, Optional.ofNullable(transformEntry));
        }
    }
}
