package work.lcod.compendium.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered key-value store holding one compendium pack. Keys sort lexicographically.
 */
public interface PackStore extends Closeable {
    Optional<JsonNode> get(String key) throws IOException;

    /**
     * Entries in key order (or reverse key order). Values are copies owned by the caller.
     */
    Iterator<Map.Entry<String, JsonNode>> iterator(IterationOptions options) throws IOException;

    /**
     * Applies every operation of {@code batch} or none of them.
     */
    void write(WriteBatch batch) throws IOException;

    /**
     * Rewrites the storage backing the keys between {@code first} and {@code last} (inclusive) into its compact form.
     */
    void compactRange(String first, String last) throws IOException;

    default List<String> keys() throws IOException {
        var keys = new ArrayList<String>();
        iterator(IterationOptions.forward()).forEachRemaining(entry -> keys.add(entry.getKey()));
        return keys;
    }
}
