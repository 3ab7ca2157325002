package work.lcod.compendium.pack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.compendium.api.CompileOptions;
import work.lcod.compendium.api.EntryAction;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.api.PackReport;
import work.lcod.compendium.hierarchy.Collection;
import work.lcod.compendium.hierarchy.HierarchySchema;
import work.lcod.compendium.hierarchy.HierarchyWalker;
import work.lcod.compendium.hierarchy.PackDocument;
import work.lcod.compendium.key.CompositeKey;
import work.lcod.compendium.shared.DocumentCodec;
import work.lcod.compendium.store.IterationOptions;
import work.lcod.compendium.store.PackStore;
import work.lcod.compendium.store.WriteBatch;

/**
 * Packs source files into a {@link PackStore}. Each file holds one document whose {@code _key} names its
 * place in the pack; embedded documents stay inline in their owner's value.
 * <p>
 * All puts, plus deletes for keys no longer backed by a source file, go into a single batch that is only
 * written once every file has been packed. Any failure before that leaves the store untouched.
 */
public final class PackCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PackCompiler.class);

    private final CompileOptions options;

    public PackCompiler(CompileOptions options) {
        this.options = options;
    }

    public PackReport.Outcome compile(List<Path> files, PackStore store) throws IOException {
        var run = new Run();
        for (Path file : files) {
            try {
                packFile(file, run);
            } catch (PackException ex) {
                LOGGER.error("Failed to pack {}. See error below.", file);
                throw ex;
            }
        }

        List<String> removed = new ArrayList<>();
        for (String key : store.keys()) {
            if (!run.staged.contains(key)) {
                run.batch.delete(key);
                removed.add(key);
                LOGGER.info("Removed {}", key);
            }
        }

        store.write(run.batch);
        compact(store);
        return new PackReport.Outcome(run.packed, removed, run.discarded);
    }

    private void packFile(Path file, Run run) throws IOException {
        String source = file.toString();
        ObjectNode document = DocumentCodec.read(file);
        declaredKey(document, source);
        if (TransformHooks.applyEntry(options.transformEntry(), document, source) == EntryAction.DISCARD) {
            LOGGER.debug("Discarded {}", file);
            run.discarded++;
            return;
        }
        // Read again: the transform may have re-keyed the entry.
        CompositeKey rootKey = declaredKey(document, source);
        Collection collection = collectionOf(rootKey, source);

        ObjectNode value = document.deepCopy();
        HierarchyWalker.<CompositeKey>walk(value, collection, (node, nodeCollection, parentKey) -> {
            var nodeDocument = PackDocument.of(nodeCollection, node, source);
            CompositeKey key = parentKey == null ? rootKey : parentKey.child(nodeCollection.id(), nodeDocument.id());
            node.remove(PackDocument.KEY_FIELD);
            claim(key, source, run);
            HierarchySchema.normalize(node, nodeCollection);
            return key;
        }, null);

        run.batch.put(rootKey.toString(), value);
        run.staged.add(rootKey.toString());
        run.packed.add(rootKey.toString());
        var packed = PackDocument.of(collection, value, source);
        LOGGER.info("Packed {}{}", packed.id(), packed.name().map(name -> " (" + name + ")").orElse(""));
    }

    private static void claim(CompositeKey key, String source, Run run) {
        if (!run.claimed.add(key.toString())) {
            throw new PackException(
                PackException.Kind.INTEGRITY,
                "An entry with key '" + key + "' was already packed and would be overwritten by this entry.",
                source
            );
        }
    }

    private static CompositeKey declaredKey(ObjectNode document, String source) {
        JsonNode key = document.get(PackDocument.KEY_FIELD);
        if (key == null || !key.isTextual()) {
            throw new PackException(PackException.Kind.PARSE, "Document has no '" + PackDocument.KEY_FIELD + "' field", source);
        }
        try {
            return CompositeKey.parse(key.asText());
        } catch (IllegalArgumentException ex) {
            throw new PackException(PackException.Kind.PARSE, ex.getMessage(), source, ex);
        }
    }

    private static Collection collectionOf(CompositeKey key, String source) {
        return Collection.fromId(key.leafCollection())
            .orElseThrow(() -> new PackException(
                PackException.Kind.PARSE,
                "Unknown collection '" + key.leafCollection() + "' in key " + key,
                source
            ));
    }

    /**
     * Compacts the span between the first and last key, found with single-entry scans in each direction.
     */
    private static void compact(PackStore store) throws IOException {
        Optional<String> first = boundaryKey(store, IterationOptions.forward().withLimit(1));
        Optional<String> last = boundaryKey(store, IterationOptions.backward().withLimit(1));
        if (first.isPresent() && last.isPresent()) {
            store.compactRange(first.get(), last.get());
        }
    }

    private static Optional<String> boundaryKey(PackStore store, IterationOptions options) throws IOException {
        var iterator = store.iterator(options);
        return iterator.hasNext() ? Optional.of(iterator.next().getKey()) : Optional.empty();
    }

    private static final class Run {
        private final WriteBatch batch = new WriteBatch();
        private final Set<String> claimed = new HashSet<>();
        private final Set<String> staged = new HashSet<>();
        private final List<String> packed = new ArrayList<>();
        private int discarded;
    }
}
