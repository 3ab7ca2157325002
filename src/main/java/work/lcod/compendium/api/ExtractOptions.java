package work.lcod.compendium.api;

import java.util.Objects;
import java.util.Optional;
import work.lcod.compendium.hierarchy.Collection;

/**
 * Immutable options for {@link Packs#extractPack}. The document type is checked when the extraction starts.
 */
public record ExtractOptions(
    SerializationFormat format,
    Optional<DocumentType> documentType,
    Optional<Collection> collection,
    boolean folders,
    boolean clean,
    int jsonIndent,
    Optional<EntryTransformer> transformEntry,
    Optional<NameTransformer> transformName,
    Optional<NameTransformer> transformFolderName
) {
    public static final int DEFAULT_JSON_INDENT = 2;

    public ExtractOptions {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(documentType, "documentType");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(transformEntry, "transformEntry");
        Objects.requireNonNull(transformName, "transformName");
        Objects.requireNonNull(transformFolderName, "transformFolderName");
        if (jsonIndent < 0) {
            throw new IllegalArgumentException("jsonIndent must not be negative");
        }
    }

    /**
     * The configured collection, or the one registered for the document type.
     */
    public Optional<Collection> effectiveCollection() {
        return collection.or(() -> documentType.map(DocumentType::collection));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SerializationFormat format = SerializationFormat.JSON;
        private DocumentType documentType;
        private Collection collection;
        private boolean folders;
        private boolean clean;
        private int jsonIndent = DEFAULT_JSON_INDENT;
        private EntryTransformer transformEntry;
        private NameTransformer transformName;
        private NameTransformer transformFolderName;

        public Builder format(SerializationFormat format) {
            this.format = format;
            return this;
        }

        public Builder yaml(boolean yaml) {
            this.format = SerializationFormat.of(yaml);
            return this;
        }

        public Builder documentType(DocumentType documentType) {
            this.documentType = documentType;
            return this;
        }

        public Builder collection(Collection collection) {
            this.collection = collection;
            return this;
        }

        public Builder folders(boolean folders) {
            this.folders = folders;
            return this;
        }

        public Builder clean(boolean clean) {
            this.clean = clean;
            return this;
        }

        public Builder jsonIndent(int jsonIndent) {
            this.jsonIndent = jsonIndent;
            return this;
        }

        public Builder transformEntry(EntryTransformer transformEntry) {
            this.transformEntry = transformEntry;
            return this;
        }

        public Builder transformName(NameTransformer transformName) {
            this.transformName = transformName;
            return this;
        }

        public Builder transformFolderName(NameTransformer transformFolderName) {
            this.transformFolderName = transformFolderName;
            return this;
        }

        public ExtractOptions build() {
            return new ExtractOptions(
                format,
                Optional.ofNullable(documentType),
                Optional.ofNullable(collection),
                folders,
                clean,
                jsonIndent,
                Optional.ofNullable(transformEntry),
                Optional.ofNullable(transformName),
                Optional.ofNullable(transformFolderName)
            );
        }
    }
}
