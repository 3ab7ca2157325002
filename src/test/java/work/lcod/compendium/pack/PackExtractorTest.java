package work.lcod.compendium.pack;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.compendium.support.PackTestSupport.readJson;
import static work.lcod.compendium.support.PackTestSupport.seedPack;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.compendium.api.DocumentType;
import work.lcod.compendium.api.EntryAction;
import work.lcod.compendium.api.ExtractOptions;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.api.PackReport;
import work.lcod.compendium.store.JournalPackStore;

class PackExtractorTest {
    @TempDir
    Path tempDir;

    @Test
    void namesFilesAfterDocumentNameAndId() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of(
            "!actors!abc", "{\"_id\": \"abc\", \"name\": \"Hero\", \"items\": [{\"_id\": \"i1\", \"name\": \"Sword\"}]}",
            "!actors!n0", "{\"_id\": \"n0\"}",
            "!actors!x9", "{\"_id\": \"x9\", \"name\": \"Dire Wolf!\"}"
        ));

        var outcome = extract(pack, tempDir.resolve("out"), actorOptions().build());

        assertEquals(List.of("Hero_abc.json", "!actors!n0.json", "Dire_Wolf__x9.json"), outcome.written());
        var hero = readJson(tempDir.resolve("out/Hero_abc.json"));
        assertEquals("!actors!abc", hero.get("_key").asText());
        assertEquals("!actors.items!abc.i1", hero.get("items").get(0).get("_key").asText());
        assertEquals(0, hero.get("effects").size());
    }

    @Test
    void reassemblesEmbeddedDocumentsStoredUnderTheirOwnKeys() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of(
            "!scenes!s1", "{\"_id\": \"s1\", \"name\": \"Keep\", \"tokens\": [\"t1\"]}",
            "!scenes.tokens!s1.t1", "{\"_id\": \"t1\", \"delta\": \"d1\"}",
            "!scenes.tokens.delta!s1.t1.d1", "{\"_id\": \"d1\", \"items\": [{\"_id\": \"i1\"}]}"
        ));

        var outcome = extract(pack, tempDir.resolve("out"), ExtractOptions.builder().documentType(DocumentType.SCENE).build());

        assertEquals(List.of("Keep_s1.json"), outcome.written());
        var scene = readJson(tempDir.resolve("out/Keep_s1.json"));
        var token = scene.get("tokens").get(0);
        assertEquals("!scenes.tokens!s1.t1", token.get("_key").asText());
        var delta = token.get("delta");
        assertEquals("!scenes.tokens.delta!s1.t1.d1", delta.get("_key").asText());
        assertEquals("!scenes.tokens.delta.items!s1.t1.d1.i1", delta.get("items").get(0).get("_key").asText());
        assertEquals(0, scene.get("walls").size());
    }

    @Test
    void failsWhenAReferencedDocumentIsMissing() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of("!actors!abc", "{\"_id\": \"abc\", \"items\": [\"lost\"]}"));

        var ex = assertThrows(PackException.class, () -> extract(pack, tempDir.resolve("out"), actorOptions().build()));

        assertEquals(PackException.Kind.RESOLUTION, ex.kind());
        assertTrue(ex.getMessage().contains("!actors.items!abc.lost"));
    }

    @Test
    void skipsDiscardedEntries() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of(
            "!items!a", "{\"_id\": \"a\", \"name\": \"A\"}",
            "!items!b", "{\"_id\": \"b\", \"name\": \"B\"}"
        ));
        var options = ExtractOptions.builder()
            .documentType(DocumentType.ITEM)
            .transformEntry(entry -> "A".equals(entry.path("name").asText()) ? EntryAction.DISCARD : EntryAction.KEEP)
            .build();

        var outcome = extract(pack, tempDir.resolve("out"), options);

        assertEquals(1, outcome.discarded());
        assertEquals(List.of("B_b.json"), outcome.written());
        assertFalse(Files.exists(tempDir.resolve("out/A_a.json")));
    }

    @Test
    void nestsFilesInFolderDirectories() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of(
            "!folders!fa", "{\"_id\": \"fa\", \"name\": \"A\"}",
            "!folders!fb", "{\"_id\": \"fb\", \"name\": \"B\", \"folder\": \"fa\"}",
            "!folders!fc", "{\"_id\": \"fc\", \"name\": \"C\", \"folder\": \"fb\"}",
            "!actors!x1", "{\"_id\": \"x1\", \"name\": \"Goblin\", \"folder\": \"fc\"}"
        ));

        var outcome = extract(pack, tempDir.resolve("out"), actorOptions().folders(true).build());

        assertEquals(List.of(
            "A_fa/B_fb/C_fc/Goblin_x1.json",
            "A_fa/_Folder.json",
            "A_fa/B_fb/_Folder.json",
            "A_fa/B_fb/C_fc/_Folder.json"
        ), outcome.written());
        assertEquals("fc", readJson(tempDir.resolve("out/A_fa/B_fb/C_fc/_Folder.json")).get("_id").asText());
    }

    @Test
    void usesCustomNamesVerbatim() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of(
            "!folders!fa", "{\"_id\": \"fa\", \"name\": \"Monsters\"}",
            "!actors!x1", "{\"_id\": \"x1\", \"name\": \"Goblin\", \"folder\": \"fa\"}"
        ));
        var options = actorOptions()
            .folders(true)
            .transformFolderName((entry, folder) -> Optional.of(entry.get("name").asText().toLowerCase()))
            .transformName((entry, folder) -> entry.get("_id").asText().equals("x1")
                ? Optional.of(folder.orElse("") + "/" + "goblin.json")
                : Optional.empty())
            .build();

        var outcome = extract(pack, tempDir.resolve("out"), options);

        assertEquals(List.of("monsters/goblin.json", "monsters/_Folder.json"), outcome.written());
    }

    @Test
    void refusesNamesOutsideTheDestination() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of("!items!a", "{\"_id\": \"a\"}"));
        var options = ExtractOptions.builder()
            .documentType(DocumentType.ITEM)
            .transformName((entry, folder) -> Optional.of("../escape.json"))
            .build();

        var ex = assertThrows(PackException.class, () -> extract(pack, tempDir.resolve("out"), options));
        assertEquals(PackException.Kind.TRANSFORM, ex.kind());
        assertFalse(Files.exists(tempDir.resolve("escape.json")));
    }

    @Test
    void writesYamlAndCompactJson() throws Exception {
        Path pack = tempDir.resolve("pack");
        seedPack(pack, Map.of("!items!a", "{\"_id\": \"a\", \"name\": \"Rope\", \"weight\": 1.50}"));

        extract(pack, tempDir.resolve("yaml"), ExtractOptions.builder().documentType(DocumentType.ITEM).yaml(true).build());
        String yaml = Files.readString(tempDir.resolve("yaml/Rope_a.yml"), StandardCharsets.UTF_8);
        assertFalse(yaml.startsWith("---"));
        assertTrue(yaml.contains("name: Rope\n"), yaml);
        assertTrue(yaml.contains("_key: \"!items!a\"") || yaml.contains("_key: '!items!a'"), yaml);

        extract(pack, tempDir.resolve("json"), ExtractOptions.builder().documentType(DocumentType.ITEM).jsonIndent(0).build());
        String json = Files.readString(tempDir.resolve("json/Rope_a.json"), StandardCharsets.UTF_8);
        assertEquals("{\"_id\":\"a\",\"name\":\"Rope\",\"weight\":1.50,\"_key\":\"!items!a\",\"effects\":[]}\n", json);

        extract(pack, tempDir.resolve("pretty"), ExtractOptions.builder().documentType(DocumentType.ITEM).build());
        String pretty = Files.readString(tempDir.resolve("pretty/Rope_a.json"), StandardCharsets.UTF_8);
        assertTrue(pretty.startsWith("{\n  \"_id\": \"a\",\n"));
        assertTrue(pretty.endsWith("}\n"));
    }

    private static ExtractOptions.Builder actorOptions() {
        return ExtractOptions.builder().documentType(DocumentType.ACTOR);
    }

    private static PackReport.Outcome extract(Path pack, Path destination, ExtractOptions options) throws Exception {
        try (var store = JournalPackStore.open(pack, false)) {
            return new PackExtractor(options).extract(store, destination);
        }
    }
}
