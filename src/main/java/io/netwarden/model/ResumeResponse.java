package io.netwarden.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResumeResponse(
        ResumeError error,
        String errorText
) {
    public static ResumeResponse ok() {
        return new ResumeResponse(ResumeError.NONE, null);
    }

    public static ResumeResponse rejected(ResumeError error) {
        return new ResumeResponse(error, null);
    }

    public static ResumeResponse failed(String errorText) {
        return new ResumeResponse(ResumeError.UNEXPECTED_RESUME_ERROR, errorText);
    }
}
