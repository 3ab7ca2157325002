package work.lcod.compendium.hierarchy;

import static work.lcod.compendium.hierarchy.EmbeddedField.many;
import static work.lcod.compendium.hierarchy.EmbeddedField.one;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static table of the embedded fields each collection declares. Collections not listed have none.
 */
public final class HierarchySchema {
    private static final Map<Collection, List<EmbeddedField>> FIELDS = buildFields();

    private HierarchySchema() {}

    public static List<EmbeddedField> fieldsOf(Collection collection) {
        return FIELDS.getOrDefault(collection, List.of());
    }

    public static Map<Collection, List<EmbeddedField>> table() {
        return Collections.unmodifiableMap(FIELDS);
    }

    /**
     * Fills absent embedded fields: an empty array for collection-valued fields, {@code null} for singular ones.
     */
    public static void normalize(ObjectNode node, Collection collection) {
        for (EmbeddedField field : fieldsOf(collection)) {
            var value = node.get(field.name());
            if (field.isCollectionValued()) {
                if (value == null || !value.isArray()) {
                    node.putArray(field.name());
                }
            } else if (value == null) {
                node.putNull(field.name());
            }
        }
    }

    private static Map<Collection, List<EmbeddedField>> buildFields() {
        var fields = new EnumMap<Collection, List<EmbeddedField>>(Collection.class);
        fields.put(Collection.ACTORS, List.of(many(Collection.ITEMS), many(Collection.EFFECTS)));
        fields.put(Collection.CARDS, List.of(many(Collection.CARDS)));
        fields.put(Collection.COMBATS, List.of(many(Collection.COMBATANTS)));
        fields.put(Collection.DELTA, List.of(many(Collection.ITEMS), many(Collection.EFFECTS)));
        fields.put(Collection.ITEMS, List.of(many(Collection.EFFECTS)));
        fields.put(Collection.JOURNAL, List.of(many(Collection.PAGES), many(Collection.CATEGORIES)));
        fields.put(Collection.PLAYLISTS, List.of(many(Collection.SOUNDS)));
        fields.put(Collection.REGIONS, List.of(many(Collection.BEHAVIORS)));
        fields.put(Collection.TABLES, List.of(many(Collection.RESULTS)));
        fields.put(Collection.TOKENS, List.of(one(Collection.DELTA)));
        fields.put(Collection.SCENES, List.of(
            many(Collection.DRAWINGS),
            many(Collection.TOKENS),
            many(Collection.LIGHTS),
            many(Collection.NOTES),
            many(Collection.REGIONS),
            many(Collection.SOUNDS),
            many(Collection.TEMPLATES),
            many(Collection.TILES),
            many(Collection.WALLS)
        ));
        return fields;
    }
}
