package com.gamevault.game_library.library;

import lombok.Value;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Current state of one (user, game) pair and the moves open to it.
 */
@Value
public class LibraryState {
    UUID userId;
    long gameId;
    LibraryEntry entry;
    Set<LibraryCategory> allowedTargets;
    boolean removable;

    public static LibraryState of(UUID userId, long gameId, Optional<LibraryEntry> entry) {
        return entry
            .map(e -> new LibraryState(userId, gameId, e,
                e.getCategory().nextCategories(), e.isRemovable()))
            .orElseGet(() -> new LibraryState(userId, gameId, null,
                LibraryCategory.entryCategories(), false));
    }

    public boolean isTracked() {
        return entry != null;
    }

    public LibraryCategory getCategory() {
        return entry != null ? entry.getCategory() : null;
    }
}
