package work.lcod.compendium.api;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Text format of source files. Also decides which extensions are picked up and which suffix is written.
 */
public enum SerializationFormat {
    JSON("json", Set.of("json")),
    YAML("yml", Set.of("yml", "yaml"));

    private final String extension;
    private final Set<String> recognizedExtensions;

    SerializationFormat(String extension, Set<String> recognizedExtensions) {
        this.extension = extension;
        this.recognizedExtensions = recognizedExtensions;
    }

    public static SerializationFormat of(boolean yaml) {
        return yaml ? YAML : JSON;
    }

    /**
     * Format of an existing file, judged by its extension. Anything that is not YAML is read as JSON.
     */
    public static SerializationFormat forFile(Path file) {
        return YAML.matches(file) ? YAML : JSON;
    }

    /**
     * Extension written for extracted files, without the dot.
     */
    public String extension() {
        return extension;
    }

    public boolean matches(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return recognizedExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
