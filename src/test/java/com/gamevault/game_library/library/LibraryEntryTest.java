package com.gamevault.game_library.library;

import com.gamevault.game_library.library.exception.AlreadyAdvancedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Building the entry a pair holds after a transition, without the database.
 */
class LibraryEntryTest {

    private static final long GAME_ID = 1942L;

    private UUID userId;
    private Instant now;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        now = Instant.parse("2024-05-01T12:00:00Z");
    }

    @Test
    @DisplayName("Wishlist entry keeps priority and notes")
    void testWishlistKeepsMetadata() {
        EntryMetadata metadata = EntryMetadata.builder().priority(2).notes("on sale in June").build();

        LibraryEntry entry = LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.WISHLIST, metadata, now);

        assertEquals(LibraryCategory.WISHLIST, entry.getCategory());
        assertEquals(2, entry.getPriority());
        assertEquals("on sale in June", entry.getNotes());
        assertNull(entry.getStartedAt());
        assertNull(entry.getCompletedAt());
        assertEquals(now, entry.getAddedAt());
    }

    @Test
    @DisplayName("Metadata for other categories is dropped")
    void testIrrelevantMetadataIgnored() {
        EntryMetadata metadata = EntryMetadata.builder()
                .priority(1)
                .notes("ignored")
                .completedAt(now)
                .build();

        LibraryEntry entry = LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.COLLECTION, metadata, now);

        assertNull(entry.getPriority());
        assertNull(entry.getNotes());
        assertNull(entry.getCompletedAt());
    }

    @Test
    @DisplayName("Completing an untracked game sets started_at and completed_at together")
    void testCompleteFromUntrackedIsCombinedWrite() {
        LibraryEntry entry = LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.COMPLETED, null, now);

        assertEquals(now, entry.getStartedAt());
        assertEquals(now, entry.getCompletedAt());
    }

    @Test
    @DisplayName("Completing a started game keeps the original started_at")
    void testCompleteFromStartedKeepsStartedAt() {
        Instant started = now.minus(Duration.ofDays(10));
        LibraryEntry startedEntry = LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.STARTED,
                EntryMetadata.builder().startedAt(started).build(), started);

        EntryMetadata ignoredStart = EntryMetadata.builder().startedAt(now.minus(Duration.ofDays(1))).build();
        LibraryEntry completed = LibraryEntry.enter(userId, GAME_ID, startedEntry, LibraryCategory.COMPLETED,
                ignoredStart, now);

        assertEquals(started, completed.getStartedAt());
        assertEquals(now, completed.getCompletedAt());
    }

    @Test
    @DisplayName("completed_at before started_at is rejected")
    void testCompletionBeforeStartRejected() {
        EntryMetadata metadata = EntryMetadata.builder()
                .startedAt(now)
                .completedAt(now.minus(Duration.ofHours(1)))
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.COMPLETED, metadata, now));
    }

    @Test
    @DisplayName("A started_at or completed_at later than the transition is rejected")
    void testFutureTimestampsRejected() {
        EntryMetadata futureStart = EntryMetadata.builder().startedAt(now.plus(Duration.ofDays(2))).build();

        assertThrows(IllegalArgumentException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.STARTED, futureStart, now));
        assertThrows(IllegalArgumentException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.COMPLETED, futureStart, now));

        EntryMetadata futureCompletion = EntryMetadata.builder()
                .startedAt(now.minus(Duration.ofDays(1)))
                .completedAt(now.plus(Duration.ofMinutes(1)))
                .build();
        assertThrows(IllegalArgumentException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.COMPLETED, futureCompletion, now));

        // a start exactly at the transition time is fine, and completing later needs no completed_at
        LibraryEntry started = LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.STARTED,
                EntryMetadata.builder().startedAt(now).build(), now);
        Instant later = now.plus(Duration.ofHours(3));
        LibraryEntry completed = LibraryEntry.enter(userId, GAME_ID, started, LibraryCategory.COMPLETED, null, later);
        assertEquals(now, completed.getStartedAt());
        assertEquals(later, completed.getCompletedAt());
    }

    @Test
    @DisplayName("Started game cannot move back to collection")
    void testRegressionRejected() {
        LibraryEntry started = LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.STARTED, null, now);

        AlreadyAdvancedException e = assertThrows(AlreadyAdvancedException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, started, LibraryCategory.COLLECTION, null, now));

        assertEquals(LibraryCategory.STARTED, e.getCurrentCategory());
        assertEquals(LibraryCategory.COLLECTION, e.getRequestedCategory());
        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Invalid wishlist metadata is rejected")
    void testInvalidWishlistMetadata() {
        EntryMetadata zeroPriority = EntryMetadata.builder().priority(0).build();
        EntryMetadata longNotes = EntryMetadata.builder()
                .notes("x".repeat(EntryMetadata.MAX_NOTES_LENGTH + 1))
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.WISHLIST, zeroPriority, now));
        assertThrows(IllegalArgumentException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.WISHLIST, longNotes, now));
    }

    @Test
    @DisplayName("Moving into the current category is not a transition")
    void testSameCategoryRejected() {
        LibraryEntry wishlist = LibraryEntry.enter(userId, GAME_ID, null, LibraryCategory.WISHLIST, null, now);

        assertThrows(IllegalArgumentException.class,
                () -> LibraryEntry.enter(userId, GAME_ID, wishlist, LibraryCategory.WISHLIST, null, now));
    }
}
