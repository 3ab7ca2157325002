package work.lcod.compendium.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.compendium.support.PackTestSupport.readJson;
import static work.lcod.compendium.support.PackTestSupport.writeFile;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PacksTest {
    @TempDir
    Path tempDir;

    @Test
    void extractedFilesCompileBackToTheSamePack() throws Exception {
        Path src = tempDir.resolve("src");
        Path pack = tempDir.resolve("pack");
        Path out = tempDir.resolve("out");
        writeFile(src, "hero.json", """
            {"_key": "!actors!abc", "_id": "abc", "name": "Hero", "items": [{"_id": "i1", "name": "Sword"}]}
            """);

        var compiled = Packs.compilePack(src, pack, CompileOptions.defaults());
        assertEquals(PackReport.Operation.COMPILE, compiled.operation());
        assertEquals(List.of("!actors!abc"), compiled.written());

        var extracted = Packs.extractPack(pack, out, ExtractOptions.builder().documentType(DocumentType.ACTOR).build());
        assertEquals(List.of("Hero_abc.json"), extracted.written());
        var hero = readJson(out.resolve("Hero_abc.json"));
        assertEquals("Sword", hero.get("items").get(0).get("name").asText());

        var recompiled = Packs.compilePack(out, tempDir.resolve("pack2"), CompileOptions.defaults());
        assertEquals(List.of("!actors!abc"), recompiled.written());
        var again = Packs.extractPack(tempDir.resolve("pack2"), tempDir.resolve("out2"),
            ExtractOptions.builder().documentType(DocumentType.ACTOR).build());
        assertEquals(
            Files.readString(out.resolve("Hero_abc.json")),
            Files.readString(tempDir.resolve("out2").resolve(again.written().get(0)))
        );
    }

    @Test
    void yamlExtractionCompilesBackUnchanged() throws Exception {
        Path src = tempDir.resolve("src");
        writeFile(src, "rope.json", "{\"_key\": \"!items!r1\", \"_id\": \"r1\", \"name\": \"Rope\", \"flag\": \"true\"}");
        Packs.compilePack(src, tempDir.resolve("pack"), CompileOptions.defaults());
        Packs.extractPack(tempDir.resolve("pack"), tempDir.resolve("yaml"),
            ExtractOptions.builder().documentType(DocumentType.ITEM).yaml(true).build());

        var report = Packs.compilePack(tempDir.resolve("yaml"), tempDir.resolve("pack2"), CompileOptions.builder().yaml(true).build());

        assertEquals(List.of("!items!r1"), report.written());
        Packs.extractPack(tempDir.resolve("pack2"), tempDir.resolve("json"),
            ExtractOptions.builder().documentType(DocumentType.ITEM).build());
        var rope = readJson(tempDir.resolve("json/Rope_r1.json"));
        assertEquals("true", rope.get("flag").textValue());
        assertEquals("!items!r1", rope.get("_key").asText());
    }

    @Test
    void extractionRequiresADocumentType() throws Exception {
        Path pack = tempDir.resolve("pack");
        Files.createDirectories(tempDir.resolve("src"));
        Packs.compilePack(tempDir.resolve("src"), pack, CompileOptions.defaults());

        var ex = assertThrows(PackException.class,
            () -> Packs.extractPack(pack, tempDir.resolve("out"), ExtractOptions.builder().build()));
        assertEquals(PackException.Kind.CONFIGURATION, ex.kind());
        assertTrue(ex.getMessage().startsWith("The documentType option was undefined."));
    }

    @Test
    void extractionFromAMissingPackFails() {
        assertThrows(NoSuchFileException.class, () -> Packs.extractPack(
            tempDir.resolve("nope"),
            tempDir.resolve("out"),
            ExtractOptions.builder().documentType(DocumentType.ITEM).build()
        ));
        assertFalse(Files.exists(tempDir.resolve("nope")));
    }

    @Test
    void cleanRemovesStaleFilesFromTheDestination() throws Exception {
        Path src = tempDir.resolve("src");
        Path out = tempDir.resolve("out");
        writeFile(src, "rope.json", "{\"_key\": \"!items!r1\", \"_id\": \"r1\", \"name\": \"Rope\"}");
        writeFile(out, "stale/old.json", "{}");
        Packs.compilePack(src, tempDir.resolve("pack"), CompileOptions.defaults());

        var kept = ExtractOptions.builder().documentType(DocumentType.ITEM);
        Packs.extractPack(tempDir.resolve("pack"), out, kept.build());
        assertTrue(Files.exists(out.resolve("stale/old.json")));

        var report = Packs.extractPack(tempDir.resolve("pack"), out, kept.clean(true).build());
        assertFalse(Files.exists(out.resolve("stale")));
        assertTrue(Files.exists(out.resolve("Rope_r1.json")));
        assertEquals("extract", report.toSerializableMap().get("operation"));
    }

    @Test
    void stripTransformerDropsVolatileFields() throws Exception {
        Path src = tempDir.resolve("src");
        writeFile(src, "rope.json", "{\"_key\": \"!items!r1\", \"_id\": \"r1\", \"name\": \"Rope\", \"_stats\": {\"modified\": 1}}");
        Packs.compilePack(src, tempDir.resolve("pack"), CompileOptions.defaults());

        Packs.extractPack(tempDir.resolve("pack"), tempDir.resolve("out"), ExtractOptions.builder()
            .documentType(DocumentType.ITEM)
            .transformEntry(new StripFieldsTransformer(List.of("_stats")))
            .build());

        assertFalse(readJson(tempDir.resolve("out/Rope_r1.json")).has("_stats"));
    }
}
