package work.lcod.compendium.api;

/**
 * Outcome of an {@link EntryTransformer}.
 */
public enum EntryAction {
    KEEP,
    DISCARD
}
