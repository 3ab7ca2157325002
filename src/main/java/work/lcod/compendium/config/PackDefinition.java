package work.lcod.compendium.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.compendium.api.CompileOptions;
import work.lcod.compendium.api.DocumentType;
import work.lcod.compendium.api.ExtractOptions;
import work.lcod.compendium.api.SerializationFormat;
import work.lcod.compendium.api.StripFieldsTransformer;
import work.lcod.compendium.hierarchy.Collection;

/**
 * One {@code [packs.<name>]} table of {@code compendium.toml}, with paths already resolved.
 *
 * @param source directory holding the authored source files
 * @param pack directory of the compiled pack
 * @param strip top-level fields removed from every extracted entry
 */
public record PackDefinition(
    String name,
    Optional<DocumentType> type,
    Optional<Collection> collection,
    Path source,
    Path pack,
    SerializationFormat format,
    boolean recursive,
    boolean folders,
    boolean clean,
    int jsonIndent,
    List<String> strip
) {
    public PackDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(pack, "pack");
        Objects.requireNonNull(format, "format");
        strip = List.copyOf(strip);
    }

    public CompileOptions toCompileOptions() {
        return CompileOptions.builder()
            .format(format)
            .recursive(recursive)
            .build();
    }

    public ExtractOptions toExtractOptions() {
        var builder = ExtractOptions.builder()
            .format(format)
            .documentType(type.orElse(null))
            .collection(collection.orElse(null))
            .folders(folders)
            .clean(clean)
            .jsonIndent(jsonIndent);
        if (!strip.isEmpty()) {
            builder.transformEntry(new StripFieldsTransformer(strip));
        }
        return builder.build();
    }
}
