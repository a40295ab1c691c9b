package com.gamevault.game_library.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gamevault.game_library.library.LibraryCategory;

import java.util.Locale;

/**
 * Label recorded with every audit entry, derived from the from/to categories.
 */
public enum TransitionReason {
    ADDED,      // untracked -> any category
    MOVED,      // wishlist <-> collection
    STARTED,    // -> started
    COMPLETED,  // -> completed
    REMOVED;    // wishlist/collection -> untracked

    /**
     * Derives the reason for a transition. A null {@code to} means removal.
     */
    public static TransitionReason of(LibraryCategory from, LibraryCategory to) {
        if (to == null) {
            return REMOVED;
        }
        if (from == null) {
            return ADDED;
        }
        return switch (to) {
            case WISHLIST, COLLECTION -> MOVED;
            case STARTED -> STARTED;
            case COMPLETED -> COMPLETED;
        };
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransitionReason fromLabel(String label) {
        return TransitionReason.valueOf(label.toUpperCase(Locale.ROOT));
    }
}
