package work.lcod.compendium.pack;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Turns document names into portable file name segments.
 */
public final class SafeFilenames {
    private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9\\u0300-\\u036F]");

    private SafeFilenames() {}

    /**
     * Decomposes accented characters and replaces everything except ASCII letters, digits and combining marks
     * with {@code _}.
     */
    public static String of(String name) {
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
        return UNSAFE.matcher(decomposed).replaceAll("_");
    }
}
