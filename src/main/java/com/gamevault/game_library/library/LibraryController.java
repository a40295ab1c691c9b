package com.gamevault.game_library.library;

import com.gamevault.game_library.library.dto.AuditEntryResponse;
import com.gamevault.game_library.library.dto.LibraryEntryResponse;
import com.gamevault.game_library.library.dto.LibraryStateResponse;
import com.gamevault.game_library.library.dto.LibrarySummaryResponse;
import com.gamevault.game_library.library.dto.RemovalResponse;
import com.gamevault.game_library.library.dto.TransitionRequest;
import com.gamevault.game_library.library.dto.TransitionResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for a user's game library.
 *
 * The caller is identified by the {@code X-User-Id} header. Moving a game is a
 * PUT of the target category: repeating it is safe and reports {@code changed=false}.
 */
@RestController
@RequestMapping("/api/library")
@RequiredArgsConstructor
public class LibraryController {

    static final String USER_ID_HEADER = "X-User-Id";

    private final LibraryTransitionService transitionService;
    private final LibraryQueryService queryService;

    @PutMapping("/games/{gameId}")
    public ResponseEntity<TransitionResponse> moveGame(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @PathVariable("gameId") long gameId,
            @Valid @RequestBody TransitionRequest request) {
        TransitionResult result = transitionService.transition(
            userId, gameId, request.getCategory(), request.toMetadata());
        return ResponseEntity.ok(TransitionResponse.from(result));
    }

    @DeleteMapping("/games/{gameId}")
    public ResponseEntity<RemovalResponse> removeGame(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @PathVariable("gameId") long gameId) {
        TransitionResult result = transitionService.remove(userId, gameId);
        return ResponseEntity.ok(RemovalResponse.from(gameId, result));
    }

    @GetMapping("/games/{gameId}")
    public ResponseEntity<LibraryStateResponse> getState(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @PathVariable("gameId") long gameId) {
        return ResponseEntity.ok(LibraryStateResponse.from(queryService.getState(userId, gameId)));
    }

    @GetMapping("/games/{gameId}/history")
    public ResponseEntity<List<AuditEntryResponse>> getHistory(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @PathVariable("gameId") long gameId) {
        List<AuditEntryResponse> history = queryService.history(userId, gameId).stream()
            .map(AuditEntryResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }

    /**
     * Lists one category. The category is given by its lowercase name, e.g. {@code ?category=wishlist}.
     */
    @GetMapping
    public ResponseEntity<List<LibraryEntryResponse>> listByCategory(
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestParam("category") String category) {
        List<LibraryEntryResponse> entries = queryService
            .listByCategory(userId, LibraryCategory.fromValue(category)).stream()
            .map(LibraryEntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/summary")
    public ResponseEntity<LibrarySummaryResponse> getSummary(
            @RequestHeader(USER_ID_HEADER) UUID userId) {
        return ResponseEntity.ok(LibrarySummaryResponse.from(queryService.summarize(userId)));
    }
}
