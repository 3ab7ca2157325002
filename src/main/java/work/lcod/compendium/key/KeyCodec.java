package work.lcod.compendium.key;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Encodes and decodes composite keys of the form {@code !<collection.path>!<id.path>}.
 */
public final class KeyCodec {
    static final char SECTION_SEPARATOR = '!';
    static final char SEGMENT_SEPARATOR = '.';

    private KeyCodec() {}

    /**
     * Joins the non-blank parts with {@code .}.
     */
    public static String keyJoin(String... parts) {
        return Arrays.stream(parts)
            .filter(part -> part != null && !part.isEmpty())
            .collect(Collectors.joining(String.valueOf(SEGMENT_SEPARATOR)));
    }

    public static String composeKey(String collectionPath, String idPath) {
        return SECTION_SEPARATOR + collectionPath + SECTION_SEPARATOR + idPath;
    }

    public static String composeKey(List<String> collectionPath, List<String> idPath) {
        return composeKey(keyJoin(collectionPath.toArray(String[]::new)), keyJoin(idPath.toArray(String[]::new)));
    }

    public static CompositeKey decomposeKey(String key) {
        if (key == null || key.isEmpty() || key.charAt(0) != SECTION_SEPARATOR) {
            throw new IllegalArgumentException("Composite key must start with '!': " + key);
        }
        int second = key.indexOf(SECTION_SEPARATOR, 1);
        if (second < 0 || key.indexOf(SECTION_SEPARATOR, second + 1) >= 0) {
            throw new IllegalArgumentException("Composite key must have exactly two '!' sections: " + key);
        }
        List<String> collections = splitSegments(key.substring(1, second), key);
        List<String> ids = splitSegments(key.substring(second + 1), key);
        return new CompositeKey(collections, ids);
    }

    static boolean isValidSegment(String segment) {
        return segment != null
            && !segment.isBlank()
            && segment.indexOf(SECTION_SEPARATOR) < 0
            && segment.indexOf(SEGMENT_SEPARATOR) < 0;
    }

    private static List<String> splitSegments(String section, String key) {
        if (section.isEmpty()) {
            throw new IllegalArgumentException("Composite key has an empty section: " + key);
        }
        List<String> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= section.length(); i++) {
            if (i == section.length() || section.charAt(i) == SEGMENT_SEPARATOR) {
                segments.add(section.substring(start, i));
                start = i + 1;
            }
        }
        return segments;
    }
}
