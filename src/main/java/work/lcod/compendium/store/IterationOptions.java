package work.lcod.compendium.store;

/**
 * Direction and size of a key-ordered scan. A negative limit means no limit.
 */
public record IterationOptions(boolean reverse, int limit) {
    public static final int UNLIMITED = -1;

    public static IterationOptions forward() {
        return new IterationOptions(false, UNLIMITED);
    }

    public static IterationOptions backward() {
        return new IterationOptions(true, UNLIMITED);
    }

    public IterationOptions withLimit(int limit) {
        return new IterationOptions(reverse, limit);
    }

    public boolean isLimited() {
        return limit >= 0;
    }
}
