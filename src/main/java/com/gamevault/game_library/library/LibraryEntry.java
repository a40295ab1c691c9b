package com.gamevault.game_library.library;

import com.gamevault.game_library.library.exception.AlreadyAdvancedException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Current library membership of a (user, game) pair.
 *
 * Key principles:
 * - A pair has at most one entry (one category) at any time
 * - Entries are immutable; a transition builds a new entry from the previous one
 * - Play-state progression is forward-only and completion history is never cleared
 */
@Value
public class LibraryEntry {
    UUID userId;
    long gameId;
    LibraryCategory category;
    Integer priority;
    String notes;
    Instant startedAt;
    Instant completedAt;
    Instant addedAt;
    Instant updatedAt;

    /**
     * Builds the entry a pair will hold after moving into {@code target}.
     *
     * Rules:
     * - A STARTED or COMPLETED pair cannot move to a lower-ranked category
     * - COMPLETED from a non-started state sets started_at and completed_at together
     * - COMPLETED from STARTED keeps the original started_at
 * - Supplied started_at / completed_at may not be later than the transition time
     *
     * @param userId Owner of the entry
     * @param gameId Catalog game ID
     * @param previous Current entry, or null if the pair is untracked
     * @param target Category to move into (must differ from the previous category)
     * @param metadata Caller-supplied details for the target category
     * @param now Transition timestamp
     * @return New entry in the target category
     * @throws AlreadyAdvancedException if the move would regress a play state
     * @throws IllegalArgumentException if the metadata is invalid
     */
    public static LibraryEntry enter(UUID userId, long gameId, LibraryEntry previous,
                                     LibraryCategory target, EntryMetadata metadata, Instant now) {
        if (target == null) {
            throw new IllegalArgumentException("Target category is required");
        }
        LibraryCategory current = previous != null ? previous.getCategory() : null;
        if (current == target) {
            throw new IllegalArgumentException("Entry is already in " + target.getValue());
        }
        if (current != null && !current.canTransitionTo(target)) {
            throw new AlreadyAdvancedException(userId, gameId, current, target);
        }

        EntryMetadata details = metadata != null ? metadata : EntryMetadata.empty();
        return switch (target) {
            case WISHLIST -> {
                details.validate();
                yield new LibraryEntry(userId, gameId, target,
                    details.getPriority(), details.getNotes(), null, null, now, now);
            }
            case COLLECTION -> new LibraryEntry(userId, gameId, target,
                null, null, null, null, now, now);
            case STARTED -> new LibraryEntry(userId, gameId, target,
                null, null, notInFuture("started_at", details.getStartedAt(), now), null, now, now);
            case COMPLETED -> {
                notInFuture("started_at", details.getStartedAt(), now);
                Instant completedAt = notInFuture("completed_at", details.getCompletedAt(), now);
                Instant startedAt = previous != null && previous.getStartedAt() != null
                    ? previous.getStartedAt()
                    : orDefault(details.getStartedAt(), completedAt);
                if (completedAt.isBefore(startedAt)) {
                    throw new IllegalArgumentException(String.format(
                        "completed_at %s is before started_at %s", completedAt, startedAt));
                }
                yield new LibraryEntry(userId, gameId, target,
                    null, null, startedAt, completedAt, now, now);
            }
        };
    }

    /**
     * Checks whether this entry can be removed without a replacement.
     */
    public boolean isRemovable() {
        return category.canBeRemoved();
    }

    /**
     * Play timestamps record what already happened; a supplied one may not lie after {@code now}.
     * A missing value defaults to {@code now}.
     */
    private static Instant notInFuture(String field, Instant value, Instant now) {
        if (value != null && value.isAfter(now)) {
            throw new IllegalArgumentException(String.format("%s %s is in the future", field, value));
        }
        return orDefault(value, now);
    }

    private static Instant orDefault(Instant value, Instant fallback) {
        return value != null ? value : fallback;
    }
}
