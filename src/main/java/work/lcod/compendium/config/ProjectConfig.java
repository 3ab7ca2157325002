package work.lcod.compendium.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.compendium.api.PackException;

/**
 * Packs declared in a {@code compendium.toml} file, in declaration order.
 */
public record ProjectConfig(Path file, Map<String, PackDefinition> packs) {
    public ProjectConfig {
        packs = Collections.unmodifiableMap(new LinkedHashMap<>(packs));
    }

    public PackDefinition pack(String name) {
        PackDefinition definition = packs.get(name);
        if (definition == null) {
            throw new PackException(
                PackException.Kind.CONFIGURATION,
                "Unknown pack '" + name + "'. Declared packs: " + String.join(", ", packs.keySet()),
                file.toString()
            );
        }
        return definition;
    }

    public List<PackDefinition> all() {
        return List.copyOf(packs.values());
    }
}
