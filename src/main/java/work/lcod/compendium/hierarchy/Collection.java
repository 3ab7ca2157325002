package work.lcod.compendium.hierarchy;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Every collection a pack node may belong to, primary or embedded.
 */
public enum Collection {
    ACTORS("actors"),
    ADVENTURES("adventures"),
    CARDS("cards"),
    MESSAGES("messages"),
    COMBATS("combats"),
    FOG("fog"),
    FOLDERS("folders"),
    ITEMS("items"),
    JOURNAL("journal"),
    MACROS("macros"),
    PLAYLISTS("playlists"),
    TABLES("tables"),
    SCENES("scenes"),
    SETTINGS("settings"),
    USERS("users"),
    EFFECTS("effects"),
    COMBATANTS("combatants"),
    DELTA("delta"),
    PAGES("pages"),
    CATEGORIES("categories"),
    SOUNDS("sounds"),
    REGIONS("regions"),
    BEHAVIORS("behaviors"),
    RESULTS("results"),
    TOKENS("tokens"),
    DRAWINGS("drawings"),
    LIGHTS("lights"),
    NOTES("notes"),
    TEMPLATES("templates"),
    TILES("tiles"),
    WALLS("walls");

    private static final Map<String, Collection> BY_ID = Stream.of(values())
        .collect(Collectors.toUnmodifiableMap(Collection::id, Function.identity()));

    private final String id;

    Collection(String id) {
        this.id = id;
    }

    /**
     * Segment used for this collection inside composite keys.
     */
    public String id() {
        return id;
    }

    public static Optional<Collection> fromId(String id) {
        return Optional.ofNullable(id == null ? null : BY_ID.get(id));
    }
}
