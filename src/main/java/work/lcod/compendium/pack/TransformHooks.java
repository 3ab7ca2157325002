package work.lcod.compendium.pack;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import work.lcod.compendium.api.EntryAction;
import work.lcod.compendium.api.EntryTransformer;
import work.lcod.compendium.api.NameTransformer;
import work.lcod.compendium.api.PackException;

/**
 * Invokes caller-supplied hooks, reporting their failures as {@link PackException.Kind#TRANSFORM}.
 */
final class TransformHooks {
    private TransformHooks() {}

    static EntryAction applyEntry(Optional<EntryTransformer> transformer, ObjectNode entry, String source) {
        if (transformer.isEmpty()) {
            return EntryAction.KEEP;
        }
        EntryAction action;
        try {
            action = transformer.get().transform(entry);
        } catch (PackException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new PackException(PackException.Kind.TRANSFORM, "Entry transform failed: " + describe(ex), source, ex);
        }
        return action == null ? EntryAction.KEEP : action;
    }

    static Optional<String> applyName(
        Optional<NameTransformer> transformer,
        ObjectNode entry,
        Optional<String> folder,
        String source
    ) {
        if (transformer.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> name;
        try {
            name = transformer.get().transform(entry, folder);
        } catch (PackException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new PackException(PackException.Kind.TRANSFORM, "Name transform failed: " + describe(ex), source, ex);
        }
        if (name == null) {
            return Optional.empty();
        }
        return name.filter(value -> !value.isBlank());
    }

    private static String describe(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
