package work.lcod.compendium.hierarchy;

import java.util.Objects;

/**
 * A field of a document that holds embedded documents of {@code collection}.
 */
public record EmbeddedField(Collection collection, Cardinality cardinality) {
    public EmbeddedField {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(cardinality, "cardinality");
    }

    public static EmbeddedField many(Collection collection) {
        return new EmbeddedField(collection, Cardinality.MANY);
    }

    public static EmbeddedField one(Collection collection) {
        return new EmbeddedField(collection, Cardinality.ONE);
    }

    /**
     * Embedded fields are named after the collection they hold.
     */
    public String name() {
        return collection.id();
    }

    public boolean isCollectionValued() {
        return cardinality == Cardinality.MANY;
    }

    public enum Cardinality {
        /** Ordered sequence of embedded documents. */
        MANY,
        /** At most one embedded document. */
        ONE
    }
}
