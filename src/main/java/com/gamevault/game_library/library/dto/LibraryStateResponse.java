package com.gamevault.game_library.library.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamevault.game_library.library.LibraryCategory;
import com.gamevault.game_library.library.LibraryState;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Current state of a game in a user's library and the categories it may move to next.
 */
@Value
@Builder
public class LibraryStateResponse {

    @JsonProperty("game_id")
    long gameId;

    @JsonProperty("tracked")
    boolean tracked;

    @JsonProperty("category")
    LibraryCategory category;

    @JsonProperty("entry")
    LibraryEntryResponse entry;

    @JsonProperty("allowed_transitions")
    Set<LibraryCategory> allowedTransitions;

    @JsonProperty("removable")
    boolean removable;

    public static LibraryStateResponse from(LibraryState state) {
        return LibraryStateResponse.builder()
            .gameId(state.getGameId())
            .tracked(state.isTracked())
            .category(state.getCategory())
            .entry(LibraryEntryResponse.from(state.getEntry()))
            .allowedTransitions(state.getAllowedTargets())
            .removable(state.isRemovable())
            .build();
    }
}
