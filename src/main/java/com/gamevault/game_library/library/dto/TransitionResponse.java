package com.gamevault.game_library.library.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamevault.game_library.library.LibraryCategory;
import com.gamevault.game_library.library.TransitionResult;
import lombok.Builder;
import lombok.Value;

/**
 * Response for a transition request. {@code changed} is false for a no-op.
 */
@Value
@Builder
public class TransitionResponse {

    @JsonProperty("entry")
    LibraryEntryResponse entry;

    @JsonProperty("from_category")
    LibraryCategory fromCategory;

    @JsonProperty("changed")
    boolean changed;

    public static TransitionResponse from(TransitionResult result) {
        return TransitionResponse.builder()
            .entry(LibraryEntryResponse.from(result.getEntry()))
            .fromCategory(result.getFromCategory())
            .changed(result.wasChanged())
            .build();
    }
}
