package com.gamevault.game_library.library;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Library category a (user, game) pair can occupy.
 *
 * Categories are mutually exclusive and carry an explicit rank:
 * WISHLIST and COLLECTION are sibling "intent/ownership" categories,
 * STARTED and COMPLETED are "play state" categories that can only move forward.
 *
 * An untracked pair has no category at all (represented as {@code null} / empty Optional).
 */
public enum LibraryCategory {
    /**
     * The user wants the game. Carries priority and notes.
     */
    WISHLIST(0),

    /**
     * The user owns the game.
     */
    COLLECTION(1),

    /**
     * The user has started playing. Carries started_at.
     */
    STARTED(2),

    /**
     * The user has finished the game. Carries started_at and completed_at.
     * Terminal category.
     */
    COMPLETED(3);

    private final int rank;

    LibraryCategory(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Play-state categories are forward-only: once reached, the pair never returns
     * to WISHLIST or COLLECTION.
     */
    public boolean isPlayState() {
        return this == STARTED || this == COMPLETED;
    }

    /**
     * Checks if moving from this category to the target is allowed.
     * Same category is always allowed (idempotent no-op).
     */
    public boolean canTransitionTo(LibraryCategory target) {
        if (target == null) {
            return canBeRemoved();
        }
        if (this == target) {
            return true;
        }
        return switch (this) {
            case WISHLIST, COLLECTION -> true;
            case STARTED -> target == COMPLETED;
            case COMPLETED -> false;
        };
    }

    /**
     * Only intent/ownership entries may be removed without a replacement.
     * Play history is kept.
     */
    public boolean canBeRemoved() {
        return !isPlayState();
    }

    /**
     * Categories reachable in one step from this category, excluding itself.
     */
    public Set<LibraryCategory> nextCategories() {
        Set<LibraryCategory> next = EnumSet.noneOf(LibraryCategory.class);
        for (LibraryCategory candidate : values()) {
            if (candidate != this && canTransitionTo(candidate)) {
                next.add(candidate);
            }
        }
        return next;
    }

    /**
     * Categories reachable from an untracked pair.
     */
    public static Set<LibraryCategory> entryCategories() {
        return EnumSet.allOf(LibraryCategory.class);
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the lowercase wire value (case-insensitive).
     *
     * @throws IllegalArgumentException if the value is not a known category
     */
    @JsonCreator
    public static LibraryCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Library category is required");
        }
        try {
            return LibraryCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown library category: " + value);
        }
    }
}
