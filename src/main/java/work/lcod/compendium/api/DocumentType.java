package work.lcod.compendium.api;

import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import work.lcod.compendium.hierarchy.Collection;

/**
 * Primary document types and the collection their packs store them in.
 */
public enum DocumentType {
    ACTOR("Actor", Collection.ACTORS),
    ADVENTURE("Adventure", Collection.ADVENTURES),
    CARDS("Cards", Collection.CARDS),
    CHAT_MESSAGE("ChatMessage", Collection.MESSAGES),
    COMBAT("Combat", Collection.COMBATS),
    FOG_EXPLORATION("FogExploration", Collection.FOG),
    FOLDER("Folder", Collection.FOLDERS),
    ITEM("Item", Collection.ITEMS),
    JOURNAL_ENTRY("JournalEntry", Collection.JOURNAL),
    MACRO("Macro", Collection.MACROS),
    PLAYLIST("Playlist", Collection.PLAYLISTS),
    ROLL_TABLE("RollTable", Collection.TABLES),
    SCENE("Scene", Collection.SCENES),
    SETTING("Setting", Collection.SETTINGS),
    USER("User", Collection.USERS);

    private final String typeName;
    private final Collection collection;

    DocumentType(String typeName, Collection collection) {
        this.typeName = typeName;
        this.collection = collection;
    }

    public String typeName() {
        return typeName;
    }

    public Collection collection() {
        return collection;
    }

    /**
     * Looks a type up by its name ({@code JournalEntry}), ignoring case when there is no exact match.
     */
    public static Optional<DocumentType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Stream.of(values())
            .filter(type -> type.typeName.equals(trimmed))
            .findFirst()
            .or(() -> Stream.of(values())
                .filter(type -> type.typeName.toLowerCase(Locale.ROOT).equals(trimmed.toLowerCase(Locale.ROOT)))
                .findFirst());
    }
}
