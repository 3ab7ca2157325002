package work.lcod.compendium.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Summary of a finished compile or extract run (printed by the CLI, returned to embedding code).
 *
 * @param written keys packed by a compile, or files (relative to the destination) written by an extract
 * @param removed stale keys deleted by a compile
 * @param discarded entries skipped by the entry transform
 */
public record PackReport(
    Operation operation,
    Path source,
    Path destination,
    List<String> written,
    List<String> removed,
    int discarded,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public PackReport {
        written = List.copyOf(written);
        removed = List.copyOf(removed);
    }

    public static PackReport of(Operation operation, Path source, Path destination, Outcome outcome, Instant startedAt) {
        return new PackReport(
            operation,
            source,
            destination,
            outcome.written(),
            outcome.removed(),
            outcome.discarded(),
            startedAt,
            Instant.now()
        );
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("operation", operation.name().toLowerCase(Locale.ROOT));
        serializable.put("source", source.toString());
        serializable.put("destination", destination.toString());
        serializable.put("written", written);
        serializable.put("removed", removed);
        serializable.put("discarded", discarded);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Operation {
        COMPILE,
        EXTRACT
    }

    /**
     * What a compiler or extractor did, before timing and locations are attached.
     */
    public record Outcome(List<String> written, List<String> removed, int discarded) {
        public Outcome {
            written = List.copyOf(written);
            removed = List.copyOf(removed);
        }
    }
}
