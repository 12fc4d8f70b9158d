package io.netwarden.client;

import io.netwarden.model.CommandResult;
import io.netwarden.model.ErrorCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CategorizedExceptionTest {
    @Test
    void successfulResultsCarryNoError() {
        assertNull(CategorizedException.fromResult(null));
        assertNull(CategorizedException.fromResult(new CommandResult(null, 0)));
    }

    @Test
    void errorTakesCategoryAndTrimmedText() {
        CategorizedException error = CategorizedException.fromResult(CommandResult.error(ErrorCategory.USER, " exit status 2\n"));
        assertEquals(ErrorCategory.USER, error.category());
        assertEquals("exit status 2", error.getMessage());
    }

    @Test
    void emptyTextAndUnknownCodesFallBack() {
        assertEquals("no_daemon_logs error",
                CategorizedException.fromResult(new CommandResult(null, 3)).getMessage());
        assertEquals(ErrorCategory.UNKNOWN, CategorizedException.fromResult(new CommandResult(null, 42)).category());
    }
}
