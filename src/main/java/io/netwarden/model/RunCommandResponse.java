package io.netwarden.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunCommandResponse(
        CommandResult data,
        boolean finalFrame
) {
    public static RunCommandResponse output(CommandResult chunk) {
        return new RunCommandResponse(chunk, false);
    }

    public static RunCommandResponse finished(CommandResult result) {
        return new RunCommandResponse(result, true);
    }
}
