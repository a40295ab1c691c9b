package com.gamevault.game_library.library.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamevault.game_library.library.LibraryCategory;
import com.gamevault.game_library.library.TransitionResult;
import lombok.Value;

/**
 * Response for a removal. {@code from_category} is null if the game was not in the library.
 */
@Value
public class RemovalResponse {

    @JsonProperty("game_id")
    long gameId;

    @JsonProperty("from_category")
    LibraryCategory fromCategory;

    @JsonProperty("changed")
    boolean changed;

    public static RemovalResponse from(long gameId, TransitionResult result) {
        return new RemovalResponse(gameId, result.getFromCategory(), result.wasChanged());
    }
}
