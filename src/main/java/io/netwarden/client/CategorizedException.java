package io.netwarden.client;

import io.netwarden.model.CommandResult;
import io.netwarden.model.ErrorCategory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class CategorizedException extends Exception {
    private final ErrorCategory category;

    public CategorizedException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public static CategorizedException fromResult(CommandResult result) {
        if (result == null || result.errorCategory() == ErrorCategory.OK.code()) {
            return null;
        }
        String message = new String(result.data(), StandardCharsets.UTF_8).strip();
        ErrorCategory category = ErrorCategory.fromCode(result.errorCategory());
        return new CategorizedException(category, message.isEmpty() ? category.name().toLowerCase(Locale.ROOT) + " error" : message);
    }
}
