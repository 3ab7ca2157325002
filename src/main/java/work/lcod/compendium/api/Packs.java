package work.lcod.compendium.api;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.compendium.pack.PackCompiler;
import work.lcod.compendium.pack.PackExtractor;
import work.lcod.compendium.pack.SourceFiles;
import work.lcod.compendium.store.JournalPackStore;

/**
 * Public entry point for compiling source files into compendium packs and extracting them again.
 */
public final class Packs {
    private static final Logger LOGGER = LoggerFactory.getLogger(Packs.class);

    private Packs() {}

    /**
     * Compiles the source files in {@code source} into the pack directory {@code destination}, replacing its
     * previous contents. An empty source directory empties the pack.
     */
    public static PackReport compilePack(Path source, Path destination, CompileOptions options) throws IOException {
        var started = Instant.now();
        List<Path> files = SourceFiles.find(source, options.format(), options.recursive());
        LOGGER.debug("Compiling {} source files from {} into {}", files.size(), source, destination);
        try (var store = JournalPackStore.open(destination)) {
            var outcome = new PackCompiler(options).compile(files, store);
            return PackReport.of(PackReport.Operation.COMPILE, source, destination, outcome, started);
        }
    }

    /**
     * Extracts every primary document of the pack {@code source} into its own file under {@code destination}.
     */
    public static PackReport extractPack(Path source, Path destination, ExtractOptions options) throws IOException {
        var started = Instant.now();
        if (options.documentType().isEmpty()) {
            throw new PackException(PackException.Kind.CONFIGURATION, "The documentType option was undefined.");
        }
        if (options.clean()) {
            deleteRecursively(destination);
        }
        Files.createDirectories(destination);
        try (var store = JournalPackStore.open(source, false)) {
            var outcome = new PackExtractor(options).extract(store, destination);
            return PackReport.of(PackReport.Operation.EXTRACT, source, destination, outcome, started);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        LOGGER.debug("Cleaning {}", root);
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
