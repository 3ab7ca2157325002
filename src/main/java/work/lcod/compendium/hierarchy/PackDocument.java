package work.lcod.compendium.hierarchy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;
import work.lcod.compendium.api.PackException;

/**
 * A document node paired with its collection, checked against {@link HierarchySchema}.
 * Fields outside the schema are left as authored.
 */
public record PackDocument(Collection collection, ObjectNode node) {
    public static final String ID_FIELD = "_id";
    public static final String KEY_FIELD = "_key";
    public static final String NAME_FIELD = "name";
    public static final String FOLDER_FIELD = "folder";

    public PackDocument {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(node, "node");
    }

    /**
     * Wraps {@code node}, failing with a {@link PackException.Kind#PARSE} error when it has no usable
     * {@code _id} or an embedded field has the wrong shape.
     *
     * @param source file path or key reported with a failure
     */
    public static PackDocument of(Collection collection, JsonNode node, String source) {
        if (!(node instanceof ObjectNode object)) {
            throw new PackException(PackException.Kind.PARSE, "Expected a document object in '" + collection.id() + "'", source);
        }
        JsonNode id = object.get(ID_FIELD);
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new PackException(
                PackException.Kind.PARSE,
                "Document in '" + collection.id() + "' has no string '" + ID_FIELD + "'",
                source
            );
        }
        String idText = id.asText();
        if (idText.indexOf('!') >= 0 || idText.indexOf('.') >= 0) {
            throw new PackException(PackException.Kind.PARSE, "Document id '" + idText + "' may not contain '!' or '.'", source);
        }
        for (EmbeddedField field : HierarchySchema.fieldsOf(collection)) {
            JsonNode value = object.get(field.name());
            if (value == null || value.isNull()) {
                continue;
            }
            if (field.isCollectionValued() && !value.isArray()) {
                throw new PackException(
                    PackException.Kind.PARSE,
                    "Field '" + field.name() + "' of '" + collection.id() + "' " + idText + " must be an array",
                    source
                );
            }
            if (!field.isCollectionValued() && !value.isObject() && !value.isTextual()) {
                throw new PackException(
                    PackException.Kind.PARSE,
                    "Field '" + field.name() + "' of '" + collection.id() + "' " + idText + " must be a document or an id",
                    source
                );
            }
        }
        return new PackDocument(collection, object);
    }

    public String id() {
        return node.get(ID_FIELD).asText();
    }

    public Optional<String> name() {
        return text(NAME_FIELD);
    }

    /**
     * Id of the folder containing this document.
     */
    public Optional<String> folder() {
        return text(FOLDER_FIELD);
    }

    public Optional<String> key() {
        return text(KEY_FIELD);
    }

    private Optional<String> text(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
