package io.netwarden.model;

import java.nio.charset.StandardCharsets;

public record CommandResult(
        byte[] data,
        int errorCategory
) {
    public CommandResult {
        data = data == null ? new byte[0] : data;
    }

    public static CommandResult stdout(byte[] chunk) {
        return new CommandResult(chunk, 0);
    }

    public static CommandResult stderr(byte[] chunk) {
        return new CommandResult(chunk, ErrorCategory.USER.code());
    }

    public static CommandResult error(ErrorCategory category, String message) {
        return new CommandResult(message == null ? null : message.getBytes(StandardCharsets.UTF_8), category.code());
    }
}
