package work.lcod.compendium.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.compendium.shared.DocumentCodec;

/**
 * {@link PackStore} kept in a directory as a JSON snapshot plus an append-only journal with one line per
 * committed batch. The whole pack is held in memory while open; compaction folds the journal into the snapshot.
 * <p>
 * Layout: {@code snapshot.json}, {@code journal.jsonl} and a {@code LOCK} file that is exclusively locked for
 * as long as the store is open.
 */
public final class JournalPackStore implements PackStore {
    static final String SNAPSHOT_FILE = "snapshot.json";
    static final String JOURNAL_FILE = "journal.jsonl";
    static final String LOCK_FILE = "LOCK";

    private static final Logger LOGGER = LoggerFactory.getLogger(JournalPackStore.class);
    private static final ObjectMapper JSON = DocumentCodec.json();

    private final Path directory;
    private final NavigableMap<String, JsonNode> entries = new TreeMap<>();
    private final FileChannel lockChannel;
    private final FileLock lock;
    private boolean closed;

    private JournalPackStore(Path directory, FileChannel lockChannel, FileLock lock) {
        this.directory = directory;
        this.lockChannel = lockChannel;
        this.lock = lock;
    }

    /**
     * Opens the pack in {@code directory}, creating an empty one if the directory does not exist.
     */
    public static JournalPackStore open(Path directory) throws IOException {
        return open(directory, true);
    }

    public static JournalPackStore open(Path directory, boolean createIfMissing) throws IOException {
        if (!Files.isDirectory(directory)) {
            if (!createIfMissing) {
                throw new NoSuchFileException(directory.toString(), null, "pack directory does not exist");
            }
            Files.createDirectories(directory);
        }
        FileChannel channel = FileChannel.open(
            directory.resolve(LOCK_FILE),
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE
        );
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException ex) {
            lock = null;
        } catch (IOException ex) {
            channel.close();
            throw ex;
        }
        if (lock == null) {
            channel.close();
            throw new IOException("Pack is already open elsewhere: " + directory);
        }
        var store = new JournalPackStore(directory, channel, lock);
        try {
            store.load();
        } catch (IOException | RuntimeException ex) {
            store.close();
            throw ex;
        }
        return store;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public Optional<JsonNode> get(String key) {
        ensureOpen();
        JsonNode value = entries.get(key);
        if (value == null) {
            return Optional.empty();
        }
        JsonNode copy = value.deepCopy();
        return Optional.of(copy);
    }

    @Override
    public Iterator<Map.Entry<String, JsonNode>> iterator(IterationOptions options) {
        ensureOpen();
        NavigableMap<String, JsonNode> view = options.reverse() ? entries.descendingMap() : entries;
        var snapshot = new ArrayList<Map.Entry<String, JsonNode>>();
        for (var entry : view.entrySet()) {
            if (options.isLimited() && snapshot.size() >= options.limit()) {
                break;
            }
            snapshot.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue()));
        }
        Iterator<Map.Entry<String, JsonNode>> source = snapshot.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public Map.Entry<String, JsonNode> next() {
                var entry = source.next();
                JsonNode copy = entry.getValue().deepCopy();
                return new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), copy);
            }
        };
    }

    @Override
    public List<String> keys() {
        ensureOpen();
        return List.copyOf(entries.keySet());
    }

    @Override
    public void write(WriteBatch batch) throws IOException {
        ensureOpen();
        if (batch.isEmpty()) {
            return;
        }
        byte[] line = (JSON.writeValueAsString(encode(batch.operations())) + "\n").getBytes(StandardCharsets.UTF_8);
        try (FileChannel channel = FileChannel.open(
            directory.resolve(JOURNAL_FILE),
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND
        )) {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        apply(batch.operations());
        LOGGER.debug("Committed batch of {} operations to {}", batch.size(), directory);
    }

    @Override
    public void compactRange(String first, String last) throws IOException {
        ensureOpen();
        if (first.compareTo(last) > 0) {
            throw new IllegalArgumentException("Compaction range is reversed: " + first + " > " + last);
        }
        int inRange = entries.subMap(first, true, last, true).size();
        fold();
        LOGGER.debug("Compacted {} entries between {} and {} in {}", inRange, first, last, directory);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            lock.release();
        } finally {
            lockChannel.close();
        }
    }

    private void load() throws IOException {
        Path snapshot = directory.resolve(SNAPSHOT_FILE);
        if (Files.isRegularFile(snapshot)) {
            JsonNode root = JSON.readTree(Files.readString(snapshot, StandardCharsets.UTF_8));
            if (!(root instanceof ObjectNode object)) {
                throw new IOException("Corrupt pack snapshot: " + snapshot);
            }
            object.fields().forEachRemaining(entry -> entries.put(entry.getKey(), entry.getValue()));
        }

        Path journal = directory.resolve(JOURNAL_FILE);
        if (!Files.isRegularFile(journal)) {
            return;
        }
        List<byte[]> lines = splitLines(Files.readAllBytes(journal));
        int lastLine = lines.size() - 1;
        while (lastLine >= 0 && isBlank(lines.get(lastLine))) {
            lastLine--;
        }
        boolean tornTail = false;
        for (int i = 0; i <= lastLine; i++) {
            byte[] line = lines.get(i);
            if (isBlank(line)) {
                continue;
            }
            List<WriteBatch.Operation> operations;
            try {
                operations = decode(decodeUtf8(line));
            } catch (IOException ex) {
                if (i != lastLine) {
                    throw new IOException("Corrupt journal entry at line " + (i + 1) + " of " + journal, ex);
                }
                // A batch that was cut off mid-write was never acknowledged to its writer.
                LOGGER.warn("Discarding incomplete batch at the end of {}: {}", journal, ex.getMessage());
                tornTail = true;
                break;
            }
            apply(operations);
        }
        if (tornTail) {
            fold();
        }
        LOGGER.debug("Opened pack {} with {} entries", directory, entries.size());
    }

    /**
     * Writes the current state as the snapshot and empties the journal. The snapshot is on disk before the
     * journal goes. Replaying a journal over a snapshot that already contains it yields the same state, so a
     * crash between the two steps is harmless.
     */
    private void fold() throws IOException {
        ObjectNode snapshot = JSON.createObjectNode();
        for (var entry : entries.entrySet()) {
            snapshot.set(entry.getKey(), entry.getValue());
        }
        Path target = directory.resolve(SNAPSHOT_FILE);
        Path temp = directory.resolve(SNAPSHOT_FILE + ".tmp");
        try (FileChannel channel = FileChannel.open(
            temp,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING
        )) {
            ByteBuffer buffer = ByteBuffer.wrap(JSON.writeValueAsBytes(snapshot));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.deleteIfExists(directory.resolve(JOURNAL_FILE));
    }

    private static List<byte[]> splitLines(byte[] contents) {
        List<byte[]> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < contents.length; i++) {
            if (contents[i] == '\n') {
                lines.add(Arrays.copyOfRange(contents, start, i));
                start = i + 1;
            }
        }
        if (start < contents.length) {
            lines.add(Arrays.copyOfRange(contents, start, contents.length));
        }
        return lines;
    }

    private static boolean isBlank(byte[] line) {
        for (byte b : line) {
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }

    /**
     * Strict UTF-8 decoding; a line cut inside a multi-byte character fails like any other unreadable line.
     */
    private static String decodeUtf8(byte[] line) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(line))
            .toString();
    }

    private void apply(List<WriteBatch.Operation> operations) {
        for (var operation : operations) {
            if (operation.type() == WriteBatch.Operation.Type.PUT) {
                JsonNode copy = operation.value().deepCopy();
                entries.put(operation.key(), copy);
            } else {
                entries.remove(operation.key());
            }
        }
    }

    private static ObjectNode encode(List<WriteBatch.Operation> operations) {
        ObjectNode line = JSON.createObjectNode();
        var ops = line.putArray("ops");
        for (var operation : operations) {
            ObjectNode op = ops.addObject();
            if (operation.type() == WriteBatch.Operation.Type.PUT) {
                op.put("put", operation.key());
                op.set("value", operation.value());
            } else {
                op.put("del", operation.key());
            }
        }
        return line;
    }

    private static List<WriteBatch.Operation> decode(String line) throws IOException {
        JsonNode root = JSON.readTree(line);
        JsonNode ops = root == null ? null : root.get("ops");
        if (ops == null || !ops.isArray()) {
            throw new IOException("journal entry has no 'ops' array");
        }
        var operations = new ArrayList<WriteBatch.Operation>(ops.size());
        for (JsonNode op : ops) {
            JsonNode put = op.get("put");
            JsonNode del = op.get("del");
            if (put != null && put.isTextual() && op.has("value")) {
                operations.add(new WriteBatch.Operation(WriteBatch.Operation.Type.PUT, put.asText(), op.get("value")));
            } else if (del != null && del.isTextual()) {
                operations.add(new WriteBatch.Operation(WriteBatch.Operation.Type.DELETE, del.asText(), null));
            } else {
                throw new IOException("unknown journal operation: " + op);
            }
        }
        return operations;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Pack store is closed: " + directory);
        }
    }
}
