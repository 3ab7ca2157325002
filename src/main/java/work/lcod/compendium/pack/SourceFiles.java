package work.lcod.compendium.pack;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import work.lcod.compendium.api.SerializationFormat;

/**
 * Locates the source files of a pack.
 */
public final class SourceFiles {
    private SourceFiles() {}

    /**
     * Regular files under {@code root} with an extension of {@code format}, sorted by path.
     *
     * @param recursive whether to descend into child directories
     */
    public static List<Path> find(Path root, SerializationFormat format, boolean recursive) throws IOException {
        List<Path> files = new ArrayList<>();
        try (var stream = Files.list(root)) {
            for (Path entry : stream.sorted().collect(Collectors.toList())) {
                if (Files.isDirectory(entry)) {
                    if (recursive) {
                        files.addAll(find(entry, format, true));
                    }
                    continue;
                }
                if (Files.isRegularFile(entry) && format.matches(entry)) {
                    files.add(entry);
                }
            }
        }
        return files;
    }
}
