package io.netwarden.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PauseResponse(
        PauseError error,
        String errorText
) {
    public static PauseResponse ok() {
        return new PauseResponse(PauseError.NONE, null);
    }

    public static PauseResponse rejected(PauseError error) {
        return new PauseResponse(error, null);
    }

    public static PauseResponse failed(String errorText) {
        return new PauseResponse(PauseError.UNEXPECTED_PAUSE_ERROR, errorText);
    }
}
