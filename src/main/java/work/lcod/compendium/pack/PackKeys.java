package work.lcod.compendium.pack;

import work.lcod.compendium.api.PackException;
import work.lcod.compendium.key.CompositeKey;
import work.lcod.compendium.key.KeyCodec;

/**
 * Decodes keys read back from a store, reporting malformed ones as {@link PackException.Kind#PARSE}.
 */
final class PackKeys {
    private PackKeys() {}

    static CompositeKey decompose(String key) {
        try {
            return KeyCodec.decomposeKey(key);
        } catch (IllegalArgumentException ex) {
            throw new PackException(PackException.Kind.PARSE, ex.getMessage(), key, ex);
        }
    }
}
