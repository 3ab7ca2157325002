package work.lcod.compendium.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;

/**
 * Pre-order traversal of a document and the embedded documents declared by {@link HierarchySchema}.
 */
public final class HierarchyWalker {
    private HierarchyWalker() {}

    /**
     * Visits {@code root}, then each embedded node. Embedded fields are read after the visitor has run on
     * their owner, so the visitor may replace them. Elements that are not objects are not descended into.
     */
    public static <C> void walk(ObjectNode root, Collection collection, HierarchyVisitor<C> visitor, C context)
        throws IOException {
        C childContext = visitor.visit(root, collection, context);
        for (EmbeddedField field : HierarchySchema.fieldsOf(collection)) {
            JsonNode value = root.get(field.name());
            if (value == null || value.isNull()) {
                continue;
            }
            if (field.isCollectionValued()) {
                if (!value.isArray()) {
                    continue;
                }
                var elements = new ArrayList<JsonNode>(value.size());
                value.elements().forEachRemaining(elements::add);
                for (JsonNode element : elements) {
                    if (element instanceof ObjectNode embedded) {
                        walk(embedded, field.collection(), visitor, childContext);
                    }
                }
            } else if (value instanceof ObjectNode embedded) {
                walk(embedded, field.collection(), visitor, childContext);
            }
        }
    }
}
