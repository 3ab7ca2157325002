package work.lcod.compendium.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Removes the given top-level fields from every entry (for example volatile {@code _stats} blocks).
 */
public final class StripFieldsTransformer implements EntryTransformer {
    private final List<String> fields;

    public StripFieldsTransformer(List<String> fields) {
        this.fields = List.copyOf(fields);
    }

    public List<String> fields() {
        return fields;
    }

    @Override
    public EntryAction transform(ObjectNode entry) {
        entry.remove(fields);
        return EntryAction.KEEP;
    }
}
