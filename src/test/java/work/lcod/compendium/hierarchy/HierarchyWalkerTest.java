package work.lcod.compendium.hierarchy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.compendium.support.PackTestSupport.json;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class HierarchyWalkerTest {
    @Test
    void visitsEmbeddedDocumentsInSchemaOrder() throws Exception {
        var scene = json("""
            {
              "_id": "s1",
              "walls": [{"_id": "w1"}],
              "tokens": [{"_id": "t1", "delta": {"_id": "d1", "items": [{"_id": "i1"}]}}]
            }
            """);
        List<String> visits = new ArrayList<>();
        HierarchyWalker.<Integer>walk(scene, Collection.SCENES, (node, collection, depth) -> {
            int level = depth == null ? 0 : depth;
            visits.add(level + ":" + collection.id() + ":" + node.get("_id").asText());
            return level + 1;
        }, null);

        assertEquals(List.of("0:scenes:s1", "1:tokens:t1", "2:delta:d1", "3:items:i1", "1:walls:w1"), visits);
    }

    @Test
    void skipsElementsThatAreNotDocuments() throws Exception {
        var actor = json("""
            {"_id": "a1", "items": ["i1", {"_id": "i2"}, 3], "effects": null}
            """);
        List<String> visits = new ArrayList<>();
        HierarchyWalker.<Void>walk(actor, Collection.ACTORS, (node, collection, ignored) -> {
            visits.add(collection.id() + ":" + node.get("_id").asText());
            return null;
        }, null);

        assertEquals(List.of("actors:a1", "items:i2"), visits);
    }

    @Test
    void readsFieldsAfterTheOwnerWasVisited() throws Exception {
        var actor = json("{\"_id\": \"a1\", \"items\": [\"i1\"]}");
        List<String> visits = new ArrayList<>();
        HierarchyWalker.<Void>walk(actor, Collection.ACTORS, (node, collection, ignored) -> {
            visits.add(collection.id() + ":" + node.get("_id").asText());
            if (collection == Collection.ACTORS) {
                node.putArray("items").addObject().put("_id", "resolved");
            }
            return null;
        }, null);

        assertEquals(List.of("actors:a1", "items:resolved"), visits);
    }

    @Test
    void normalizesMissingEmbeddedFields() {
        var token = json("{\"_id\": \"t1\"}");
        HierarchySchema.normalize(token, Collection.TOKENS);
        assertEquals(true, token.get("delta").isNull());

        var actor = json("{\"_id\": \"a1\", \"items\": [{\"_id\": \"i1\"}]}");
        HierarchySchema.normalize(actor, Collection.ACTORS);
        assertEquals(1, actor.get("items").size());
        assertEquals(0, actor.get("effects").size());
    }
}
