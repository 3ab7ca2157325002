package work.lcod.compendium.pack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.compendium.api.EntryAction;
import work.lcod.compendium.api.ExtractOptions;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.api.PackReport;
import work.lcod.compendium.hierarchy.Collection;
import work.lcod.compendium.hierarchy.EmbeddedField;
import work.lcod.compendium.hierarchy.HierarchySchema;
import work.lcod.compendium.hierarchy.HierarchyWalker;
import work.lcod.compendium.hierarchy.PackDocument;
import work.lcod.compendium.key.CompositeKey;
import work.lcod.compendium.shared.DocumentCodec;
import work.lcod.compendium.store.IterationOptions;
import work.lcod.compendium.store.PackStore;

/**
 * Writes every primary document of a {@link PackStore} to its own source file, with its embedded documents
 * reassembled. Keys of embedded documents are never extraction roots; they are reached through their owner.
 */
public final class PackExtractor {
    static final String FOLDER_FILE_NAME = "_Folder";

    private static final Logger LOGGER = LoggerFactory.getLogger(PackExtractor.class);

    private final ExtractOptions options;

    public PackExtractor(ExtractOptions options) {
        this.options = options;
    }

    public PackReport.Outcome extract(PackStore store, Path destination) throws IOException {
        FolderIndex folders = options.folders()
            ? FolderIndex.build(store, options.transformFolderName())
            : FolderIndex.empty();
        Optional<Collection> expected = options.effectiveCollection();

        List<String> written = new ArrayList<>();
        int discarded = 0;
        var iterator = store.iterator(IterationOptions.forward());
        while (iterator.hasNext()) {
            var entry = iterator.next();
            CompositeKey key = PackKeys.decompose(entry.getKey());
            if (!key.isPrimary()) {
                continue;
            }
            Collection collection = Collection.fromId(key.rootCollection())
                .orElseThrow(() -> new PackException(
                    PackException.Kind.PARSE,
                    "Unknown collection '" + key.rootCollection() + "'",
                    entry.getKey()
                ));
            if (expected.isPresent() && collection != expected.get() && collection != Collection.FOLDERS) {
                LOGGER.warn("Extracting {} although the pack holds '{}' documents", entry.getKey(), expected.get().id());
            }

            PackDocument document = PackDocument.of(collection, entry.getValue(), entry.getKey());
            unpack(document.node(), collection, store, entry.getKey());
            if (TransformHooks.applyEntry(options.transformEntry(), document.node(), entry.getKey()) == EntryAction.DISCARD) {
                LOGGER.debug("Discarded {}", entry.getKey());
                discarded++;
                continue;
            }

            String name = fileName(key, document, folders);
            Path target = destination.resolve(name).normalize();
            if (!target.startsWith(destination.normalize())) {
                throw new PackException(
                    PackException.Kind.TRANSFORM,
                    "File name '" + name + "' points outside of " + destination,
                    entry.getKey()
                );
            }
            DocumentCodec.write(document.node(), target, options.format(), options.jsonIndent());
            written.add(name);
            LOGGER.info("Wrote {}", name);
        }
        return new PackReport.Outcome(written, List.of(), discarded);
    }

    /**
     * Gives every node of the hierarchy a fresh {@code _key} and replaces embedded id references with the
     * documents stored under the matching keys.
     */
    private static void unpack(ObjectNode root, Collection collection, PackStore store, String storedKey)
        throws IOException {
        HierarchyWalker.<CompositeKey>walk(root, collection, (node, nodeCollection, parentKey) -> {
            String source = parentKey == null ? storedKey : parentKey.toString();
            var document = PackDocument.of(nodeCollection, node, source);
            CompositeKey key = parentKey == null
                ? CompositeKey.primary(nodeCollection.id(), document.id())
                : parentKey.child(nodeCollection.id(), document.id());
            node.put(PackDocument.KEY_FIELD, key.toString());
            for (EmbeddedField field : HierarchySchema.fieldsOf(nodeCollection)) {
                resolveField(node, field, key, store);
            }
            return key;
        }, null);
    }

    private static void resolveField(ObjectNode node, EmbeddedField field, CompositeKey owner, PackStore store)
        throws IOException {
        JsonNode value = node.get(field.name());
        if (field.isCollectionValued()) {
            ArrayNode resolved = node.arrayNode();
            if (value != null && value.isArray()) {
                for (JsonNode element : value) {
                    resolved.add(resolveEmbedded(element, field, owner, store));
                }
            }
            node.set(field.name(), resolved);
        } else if (value == null || value.isNull()) {
            node.putNull(field.name());
        } else {
            node.set(field.name(), resolveEmbedded(value, field, owner, store));
        }
    }

    private static JsonNode resolveEmbedded(JsonNode reference, EmbeddedField field, CompositeKey owner, PackStore store)
        throws IOException {
        if (reference.isObject()) {
            return reference;
        }
        if (!reference.isTextual()) {
            throw new PackException(
                PackException.Kind.RESOLUTION,
                "Unsupported reference in '" + field.name() + "': " + reference,
                owner.toString()
            );
        }
        String key = owner.child(field.name(), reference.asText()).toString();
        JsonNode embedded = store.get(key)
            .orElseThrow(() -> new PackException(
                PackException.Kind.RESOLUTION,
                "Embedded document " + key + " is missing from the pack",
                owner.toString()
            ));
        if (!embedded.isObject()) {
            throw new PackException(PackException.Kind.RESOLUTION, "Embedded document " + key + " is not an object", owner.toString());
        }
        return embedded;
    }

    private String fileName(CompositeKey key, PackDocument document, FolderIndex folders) {
        Optional<String> folder = document.folder().flatMap(folders::pathOf);
        Optional<String> custom = TransformHooks.applyName(options.transformName(), document.node(), folder, key.toString());
        if (custom.isPresent()) {
            return custom.get();
        }
        String extension = "." + options.format().extension();
        String name;
        if (document.collection() == Collection.FOLDERS && folders.contains(document.id())) {
            name = folders.nameOf(document.id()).orElseThrow() + "/" + FOLDER_FILE_NAME + extension;
        } else {
            name = document.name()
                .map(value -> SafeFilenames.of(value) + "_" + key.leafId())
                .orElse(key.toString()) + extension;
        }
        return folder.map(path -> path + "/" + name).orElse(name);
    }
}
