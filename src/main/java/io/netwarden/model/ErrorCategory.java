package io.netwarden.model;

public enum ErrorCategory {
    OK(0),
    USER(1),
    CONFIG(2),
    NO_DAEMON_LOGS(3),
    UNKNOWN(4);

    private final int code;

    ErrorCategory(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ErrorCategory fromCode(int code) {
        for (ErrorCategory category : values()) {
            if (category.code == code) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
