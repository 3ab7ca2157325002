package work.lcod.compendium.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;
import work.lcod.compendium.api.DocumentType;
import work.lcod.compendium.api.ExtractOptions;
import work.lcod.compendium.api.PackReport;
import work.lcod.compendium.api.Packs;
import work.lcod.compendium.api.StripFieldsTransformer;
import work.lcod.compendium.config.PackDefinition;
import work.lcod.compendium.hierarchy.Collection;

@CommandLine.Command(
    name = "extract",
    description = "Extract the documents of a pack directory (SRC) into source files under DEST.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ExtractCommand extends PackCommand {
    @CommandLine.Option(
        names = {"-t", "--type"},
        paramLabel = "TYPE",
        description = "Document type stored in the pack (Actor, Item, JournalEntry, ...).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String type;

    @CommandLine.Option(
        names = "--collection",
        description = "Collection stored in the pack, when it differs from the document type's.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String collection;

    @CommandLine.Option(names = "--folders", description = "Nest files in directories mirroring the pack's folders.")
    boolean folders;

    @CommandLine.Option(names = "--clean", description = "Delete DEST before extracting.")
    boolean clean;

    @CommandLine.Option(
        names = "--json-indent",
        paramLabel = "N",
        description = "Indentation of JSON output; 0 writes compact JSON.",
        defaultValue = "" + ExtractOptions.DEFAULT_JSON_INDENT
    )
    int jsonIndent;

    @CommandLine.Option(names = "--strip", paramLabel = "FIELD", arity = "1..*", description = "Top-level fields to drop from every entry.")
    List<String> strip = new ArrayList<>();

    @Override
    protected PackReport runDirect(Path source, Path destination) throws IOException {
        var builder = ExtractOptions.builder()
            .yaml(yaml)
            .documentType(resolveType())
            .collection(resolveCollection())
            .folders(folders)
            .clean(clean)
            .jsonIndent(jsonIndent);
        if (!strip.isEmpty()) {
            builder.transformEntry(new StripFieldsTransformer(strip));
        }
        return Packs.extractPack(source, destination, builder.build());
    }

    @Override
    protected PackReport runConfigured(PackDefinition definition) throws IOException {
        return Packs.extractPack(definition.pack(), definition.source(), definition.toExtractOptions());
    }

    private DocumentType resolveType() {
        if (type == null || type.isBlank()) {
            return null;
        }
        return DocumentType.fromName(type)
            .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "Unknown document type: " + type));
    }

    private Collection resolveCollection() {
        if (collection == null || collection.isBlank()) {
            return null;
        }
        return Collection.fromId(collection)
            .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "Unknown collection: " + collection));
    }
}
