package work.lcod.compendium.pack;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.compendium.api.NameTransformer;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.hierarchy.Collection;
import work.lcod.compendium.hierarchy.PackDocument;
import work.lcod.compendium.key.CompositeKey;
import work.lcod.compendium.key.KeyCodec;
import work.lcod.compendium.store.IterationOptions;
import work.lcod.compendium.store.PackStore;

/**
 * Directory names and relative paths of the folders stored in a pack, keyed by folder id.
 */
public final class FolderIndex {
    private static final FolderIndex EMPTY = new FolderIndex(Map.of(), Map.of());

    private final Map<String, Folder> folders;
    private final Map<String, String> paths;

    private FolderIndex(Map<String, Folder> folders, Map<String, String> paths) {
        this.folders = folders;
        this.paths = paths;
    }

    public static FolderIndex empty() {
        return EMPTY;
    }

    /**
     * Scans the folder records of {@code store}. A folder whose parent is missing or unknown sits at the root.
     *
     * @throws PackException with kind {@link PackException.Kind#INTEGRITY} when parent links form a cycle
     */
    public static FolderIndex build(PackStore store, Optional<NameTransformer> transformFolderName) throws IOException {
        var folders = new LinkedHashMap<String, Folder>();
        var iterator = store.iterator(IterationOptions.forward());
        while (iterator.hasNext()) {
            var entry = iterator.next();
            CompositeKey key = PackKeys.decompose(entry.getKey());
            if (!key.isPrimary() || !Collection.FOLDERS.id().equals(key.rootCollection())) {
                continue;
            }
            PackDocument folder = PackDocument.of(Collection.FOLDERS, entry.getValue(), entry.getKey());
            String name = TransformHooks.applyName(transformFolderName, folder.node(), Optional.empty(), entry.getKey())
                .orElseGet(() -> folder.name()
                    .map(value -> SafeFilenames.of(value) + "_" + folder.id())
                    .orElse(entry.getKey()));
            folders.put(folder.id(), new Folder(name, folder.folder().orElse(null)));
        }

        var paths = new LinkedHashMap<String, String>();
        for (var entry : folders.entrySet()) {
            paths.put(entry.getKey(), resolvePath(entry.getKey(), entry.getValue(), folders));
        }
        return new FolderIndex(Collections.unmodifiableMap(folders), Collections.unmodifiableMap(paths));
    }

    public boolean contains(String folderId) {
        return folderId != null && folders.containsKey(folderId);
    }

    public boolean isEmpty() {
        return folders.isEmpty();
    }

    /**
     * Directory name of the folder itself.
     */
    public Optional<String> nameOf(String folderId) {
        return Optional.ofNullable(folderId == null ? null : folders.get(folderId)).map(Folder::name);
    }

    /**
     * Path from the root folder down to this folder, segments joined with {@code /}.
     */
    public Optional<String> pathOf(String folderId) {
        return Optional.ofNullable(folderId == null ? null : paths.get(folderId));
    }

    private static String resolvePath(String id, Folder folder, Map<String, Folder> folders) {
        Set<String> visited = new LinkedHashSet<>();
        visited.add(id);
        String path = folder.name();
        String parentId = folder.parent();
        Folder parent = parentId == null ? null : folders.get(parentId);
        while (parent != null) {
            if (!visited.add(parentId)) {
                throw new PackException(
                    PackException.Kind.INTEGRITY,
                    "Folder parents form a cycle: " + String.join(" -> ", visited) + " -> " + parentId,
                    KeyCodec.composeKey(Collection.FOLDERS.id(), id)
                );
            }
            path = parent.name() + "/" + path;
            parentId = parent.parent();
            parent = parentId == null ? null : folders.get(parentId);
        }
        return path;
    }

    private record Folder(String name, String parent) {}
}
