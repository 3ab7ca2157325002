package work.lcod.compendium.pack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.compendium.support.PackTestSupport.seedPack;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.store.JournalPackStore;

class FolderIndexTest {
    @TempDir
    Path tempDir;

    @Test
    void resolvesPathsFromTheRootFolderDown() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of(
            "!folders!fa", "{\"_id\": \"fa\", \"name\": \"Bestiary\"}",
            "!folders!fb", "{\"_id\": \"fb\", \"name\": \"Undead\", \"folder\": \"fa\"}",
            "!folders!fx", "{\"_id\": \"fx\", \"folder\": \"missing\"}",
            "!actors!a1", "{\"_id\": \"a1\", \"name\": \"Not a folder\"}"
        ));

        try (var store = JournalPackStore.open(pack)) {
            var index = FolderIndex.build(store, Optional.empty());
            assertEquals(Optional.of("Bestiary_fa/Undead_fb"), index.pathOf("fb"));
            assertEquals(Optional.of("Undead_fb"), index.nameOf("fb"));
            assertEquals(Optional.of("!folders!fx"), index.pathOf("fx"));
            assertFalse(index.contains("a1"));
            assertFalse(index.contains(null));
            assertTrue(index.pathOf("missing").isEmpty());
        }
    }

    @Test
    void rejectsCyclicParents() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of(
            "!folders!fa", "{\"_id\": \"fa\", \"name\": \"A\", \"folder\": \"fb\"}",
            "!folders!fb", "{\"_id\": \"fb\", \"name\": \"B\", \"folder\": \"fa\"}"
        ));

        try (var store = JournalPackStore.open(pack)) {
            var ex = assertThrows(PackException.class, () -> FolderIndex.build(store, Optional.empty()));
            assertEquals(PackException.Kind.INTEGRITY, ex.kind());
            assertTrue(ex.getMessage().contains("cycle"));
        }
    }

    @Test
    void reportsMalformedKeysAsParseErrors() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of("folders!fa", "{\"_id\": \"fa\"}"));

        try (var store = JournalPackStore.open(pack)) {
            var ex = assertThrows(PackException.class, () -> FolderIndex.build(store, Optional.empty()));
            assertEquals(PackException.Kind.PARSE, ex.kind());
            assertEquals(Optional.of("folders!fa"), ex.source());
        }
    }

    @Test
    void emptyIndexKnowsNoFolders() {
        assertTrue(FolderIndex.empty().isEmpty());
        assertTrue(FolderIndex.empty().pathOf("fa").isEmpty());
    }
}
