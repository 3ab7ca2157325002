package work.lcod.compendium.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.compendium.api.DocumentType;
import work.lcod.compendium.api.ExtractOptions;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.api.SerializationFormat;
import work.lcod.compendium.hierarchy.Collection;

/**
 * Reads {@code compendium.toml}. Relative paths resolve against the directory of the file.
 */
public final class ProjectConfigLoader {
    public static final String DEFAULT_FILE = "compendium.toml";

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectConfigLoader.class);
    private static final String PACKS_TABLE = "packs";

    private ProjectConfigLoader() {}

    public static ProjectConfig load(Path file) throws IOException {
        Path absolute = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(absolute)) {
            throw new NoSuchFileException(absolute.toString(), null, "Configuration file not found");
        }
        TomlParseResult result = Toml.parse(Files.readString(absolute));
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(error -> error.toString())
                .collect(Collectors.joining("; "));
            throw new PackException(PackException.Kind.CONFIGURATION, "Invalid TOML: " + errors, absolute.toString());
        }

        Path baseDir = absolute.getParent();
        Map<String, PackDefinition> packs = new LinkedHashMap<>();
        try {
            TomlTable table = result.getTable(PACKS_TABLE);
            if (table != null) {
                for (String name : table.keySet()) {
                    TomlTable pack = table.getTable(List.of(name));
                    if (pack == null) {
                        throw configError("Pack '" + name + "' must be a table", absolute);
                    }
                    packs.put(name, readPack(name, pack, baseDir, absolute));
                }
            }
        } catch (TomlInvalidTypeException ex) {
            throw new PackException(PackException.Kind.CONFIGURATION, ex.getMessage(), absolute.toString(), ex);
        }
        LOGGER.debug("Loaded {} pack definitions from {}", packs.size(), absolute);
        return new ProjectConfig(absolute, packs);
    }

    private static PackDefinition readPack(String name, TomlTable table, Path baseDir, Path file) {
        Optional<DocumentType> type = Optional.ofNullable(table.getString("type"))
            .map(value -> DocumentType.fromName(value)
                .orElseThrow(() -> configError("Pack '" + name + "' has an unknown type '" + value + "'", file)));
        Optional<Collection> collection = Optional.ofNullable(table.getString("collection"))
            .map(value -> Collection.fromId(value)
                .orElseThrow(() -> configError("Pack '" + name + "' has an unknown collection '" + value + "'", file)));
        Long indent = table.getLong("jsonIndent");
        if (indent != null && (indent < 0 || indent > Integer.MAX_VALUE)) {
            throw configError("Pack '" + name + "' has an invalid jsonIndent " + indent, file);
        }

        return new PackDefinition(
            name,
            type,
            collection,
            requiredPath(name, table, "source", baseDir, file),
            requiredPath(name, table, "pack", baseDir, file),
            SerializationFormat.of(table.getBoolean("yaml", () -> false)),
            table.getBoolean("recursive", () -> false),
            table.getBoolean("folders", () -> false),
            table.getBoolean("clean", () -> false),
            indent == null ? ExtractOptions.DEFAULT_JSON_INDENT : indent.intValue(),
            readStrings(table.getArray("strip"))
        );
    }

    private static Path requiredPath(String name, TomlTable table, String key, Path baseDir, Path file) {
        String value = table.getString(key);
        if (value == null || value.isBlank()) {
            throw configError("Pack '" + name + "' is missing '" + key + "'", file);
        }
        return baseDir.resolve(value).normalize();
    }

    private static List<String> readStrings(TomlArray array) {
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }

    private static PackException configError(String message, Path file) {
        return new PackException(PackException.Kind.CONFIGURATION, message, file.toString());
    }
}
