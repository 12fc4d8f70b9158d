package io.netwarden.model;

public enum ResumeError {
    NONE,
    NOT_PAUSED,
    RE_ESTABLISHING,
    UNEXPECTED_RESUME_ERROR
}
