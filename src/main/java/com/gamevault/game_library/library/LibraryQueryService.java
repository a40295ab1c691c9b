package com.gamevault.game_library.library;

import com.gamevault.game_library.audit.AuditEntry;
import com.gamevault.game_library.audit.AuditLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the library. Never takes row locks.
 */
@Service
@RequiredArgsConstructor
public class LibraryQueryService {

    private final LibraryStore libraryStore;
    private final AuditLedger auditLedger;

    @Transactional(readOnly = true)
    public List<LibraryEntry> listByCategory(UUID userId, LibraryCategory category) {
        if (category == null) {
            throw new IllegalArgumentException("Category is required");
        }
        return libraryStore.findByCategory(userId, category);
    }

    /**
     * Transition history of one pair, oldest first.
     */
    @Transactional(readOnly = true)
    public List<AuditEntry> history(UUID userId, long gameId) {
        return auditLedger.history(userId, gameId);
    }

    @Transactional(readOnly = true)
    public LibraryState getState(UUID userId, long gameId) {
        return LibraryState.of(userId, gameId, libraryStore.find(userId, gameId));
    }

    /**
     * Entry counts per category; every category is present.
     */
    @Transactional(readOnly = true)
    public Map<LibraryCategory, Long> summarize(UUID userId) {
        return libraryStore.countByCategory(userId);
    }
}
