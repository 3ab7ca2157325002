package work.lcod.compendium.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Called on every entry before it is packed or written. May mutate the entry in place.
 */
@FunctionalInterface
public interface EntryTransformer {
    /**
     * @return {@link EntryAction#DISCARD} to skip the entry
     */
    EntryAction transform(ObjectNode entry) throws Exception;
}
