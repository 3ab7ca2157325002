package work.lcod.compendium.api;

import java.util.Optional;

/**
 * Fatal failure of a compile or extract run. I/O failures are reported as {@link java.io.IOException} instead.
 */
public final class PackException extends RuntimeException {
    private final Kind kind;
    private final String source;

    public PackException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public PackException(Kind kind, String message, String source) {
        this(kind, message, source, null);
    }

    public PackException(Kind kind, String message, String source, Throwable cause) {
        super(source == null ? message : message + " [" + source + "]", cause);
        this.kind = kind;
        this.source = source;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * File path or composite key the failure relates to, when known.
     */
    public Optional<String> source() {
        return Optional.ofNullable(source);
    }

    public enum Kind {
        /** Two nodes claimed the same composite key, or folder parents form a cycle. */
        INTEGRITY,
        /** A required option is missing or a configuration file is invalid. */
        CONFIGURATION,
        /** A source file or stored value is malformed. */
        PARSE,
        /** An embedded reference could not be found in the pack. */
        RESOLUTION,
        /** A caller-supplied transform failed. */
        TRANSFORM
    }
}
