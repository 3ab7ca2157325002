package work.lcod.compendium.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Derives a file name (or a folder directory name) for an extracted entry.
 * An empty result falls back to the built-in naming.
 */
@FunctionalInterface
public interface NameTransformer {
    /**
     * @param entry the entry being named
     * @param folder relative path of the entry's folder, when folders are extracted and it has one
     */
    Optional<String> transform(ObjectNode entry, Optional<String> folder) throws Exception;
}
