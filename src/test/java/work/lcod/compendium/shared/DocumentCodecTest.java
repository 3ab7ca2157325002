package work.lcod.compendium.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.compendium.support.PackTestSupport.json;
import static work.lcod.compendium.support.PackTestSupport.writeFile;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.compendium.api.PackException;
import work.lcod.compendium.api.SerializationFormat;

class DocumentCodecTest {
    @TempDir
    Path tempDir;

    @Test
    void prettyPrintsJsonWithTheRequestedIndent() throws Exception {
        var document = json("{\"_id\": \"a\", \"tags\": [\"x\"], \"effects\": [], \"flags\": {}}");

        assertEquals(
            "{\n    \"_id\": \"a\",\n    \"tags\": [\n        \"x\"\n    ],\n    \"effects\": [],\n    \"flags\": {}\n}\n",
            DocumentCodec.serialize(document, SerializationFormat.JSON, 4)
        );
        assertEquals(
            "{\"_id\":\"a\",\"tags\":[\"x\"],\"effects\":[],\"flags\":{}}\n",
            DocumentCodec.serialize(document, SerializationFormat.JSON, 0)
        );
    }

    @Test
    void keepsDecimalsExactly() throws Exception {
        var document = json("{\"price\": 10.10, \"big\": 12345678901234567890.5}");
        assertEquals("{\"price\":10.10,\"big\":12345678901234567890.5}\n",
            DocumentCodec.serialize(document, SerializationFormat.JSON, 0));
    }

    @Test
    void readsByExtensionAndRejectsNonObjects() throws Exception {
        var yaml = DocumentCodec.read(writeFile(tempDir, "a.YAML", "_id: a\nname: Rope\n"));
        assertEquals("Rope", yaml.get("name").asText());

        var ex = assertThrows(PackException.class, () -> DocumentCodec.read(writeFile(tempDir, "list.json", "[1, 2]")));
        assertEquals(PackException.Kind.PARSE, ex.kind());
    }
}
