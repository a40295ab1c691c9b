package com.gamevault.game_library.library;

import lombok.Value;

/**
 * Outcome of a transition or removal request.
 *
 * {@code entry} is the pair's entry after the request, null if the pair is untracked.
 * {@code fromCategory} is the category before the request, null if it was untracked.
 */
@Value
public class TransitionResult {

    public enum Outcome {
        APPLIED,
        UNCHANGED
    }

    LibraryEntry entry;
    LibraryCategory fromCategory;
    Outcome outcome;

    public static TransitionResult applied(LibraryEntry entry, LibraryCategory fromCategory) {
        return new TransitionResult(entry, fromCategory, Outcome.APPLIED);
    }

    public static TransitionResult unchanged(LibraryEntry entry) {
        return new TransitionResult(entry, entry != null ? entry.getCategory() : null, Outcome.UNCHANGED);
    }

    public boolean wasChanged() {
        return outcome == Outcome.APPLIED;
    }

    public LibraryCategory getToCategory() {
        return entry != null ? entry.getCategory() : null;
    }
}
