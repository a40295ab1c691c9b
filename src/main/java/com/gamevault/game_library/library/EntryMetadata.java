package com.gamevault.game_library.library;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Caller-supplied, category-specific details for a transition.
 *
 * Only the fields relevant to the target category are kept:
 * priority and notes for WISHLIST, startedAt and completedAt for STARTED / COMPLETED.
 * Anything else is ignored when the entry is built.
 */
@Value
@Builder
public class EntryMetadata {

    public static final int MAX_NOTES_LENGTH = 1000;

    Integer priority;
    String notes;
    Instant startedAt;
    Instant completedAt;

    public static EntryMetadata empty() {
        return EntryMetadata.builder().build();
    }

    /**
     * Copy with timestamps cut to the microsecond precision the database stores.
     */
    public EntryMetadata withMicrosecondPrecision() {
        return new EntryMetadata(priority, notes, micros(startedAt), micros(completedAt));
    }

    void validate() {
        if (priority != null && priority < 1) {
            throw new IllegalArgumentException("Wishlist priority must be at least 1, got " + priority);
        }
        if (notes != null && notes.length() > MAX_NOTES_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Wishlist notes must be at most %d characters", MAX_NOTES_LENGTH));
        }
    }

    private static Instant micros(Instant value) {
        return value != null ? value.truncatedTo(ChronoUnit.MICROS) : null;
    }
}
