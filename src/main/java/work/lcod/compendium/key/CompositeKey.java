package work.lcod.compendium.key;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Location of a node in a pack: one collection segment and one id segment per nesting level.
 */
public record CompositeKey(List<String> collectionPath, List<String> idPath) {
    public CompositeKey {
        Objects.requireNonNull(collectionPath, "collectionPath");
        Objects.requireNonNull(idPath, "idPath");
        collectionPath = List.copyOf(collectionPath);
        idPath = List.copyOf(idPath);
        if (collectionPath.isEmpty() || collectionPath.size() != idPath.size()) {
            throw new IllegalArgumentException(
                "Composite key needs one id per collection level: " + collectionPath + " / " + idPath
            );
        }
        for (String segment : collectionPath) {
            requireSegment(segment);
        }
        for (String segment : idPath) {
            requireSegment(segment);
        }
    }

    public static CompositeKey primary(String collection, String id) {
        return new CompositeKey(List.of(collection), List.of(id));
    }

    public static CompositeKey parse(String key) {
        return KeyCodec.decomposeKey(key);
    }

    public CompositeKey child(String collection, String id) {
        var collections = new ArrayList<>(collectionPath);
        collections.add(collection);
        var ids = new ArrayList<>(idPath);
        ids.add(id);
        return new CompositeKey(collections, ids);
    }

    public boolean isPrimary() {
        return collectionPath.size() == 1;
    }

    public int depth() {
        return collectionPath.size();
    }

    public String rootCollection() {
        return collectionPath.get(0);
    }

    public String leafCollection() {
        return collectionPath.get(collectionPath.size() - 1);
    }

    public String leafId() {
        return idPath.get(idPath.size() - 1);
    }

    @Override
    public String toString() {
        return KeyCodec.composeKey(collectionPath, idPath);
    }

    private static void requireSegment(String segment) {
        if (!KeyCodec.isValidSegment(segment)) {
            throw new IllegalArgumentException("Invalid composite key segment: '" + segment + "'");
        }
    }
}
