package work.lcod.compendium.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Puts and deletes applied together by {@link PackStore#write}. Nothing is visible in the store before that.
 */
public final class WriteBatch {
    private final List<Operation> operations = new ArrayList<>();

    public WriteBatch put(String key, JsonNode value) {
        Objects.requireNonNull(value, "value");
        operations.add(new Operation(Operation.Type.PUT, key, value));
        return this;
    }

    public WriteBatch delete(String key) {
        operations.add(new Operation(Operation.Type.DELETE, key, null));
        return this;
    }

    public List<Operation> operations() {
        return Collections.unmodifiableList(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public record Operation(Type type, String key, JsonNode value) {
        public Operation {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(key, "key");
        }

        public enum Type {
            PUT,
            DELETE
        }
    }
}
