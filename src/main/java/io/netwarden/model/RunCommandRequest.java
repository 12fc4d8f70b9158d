package io.netwarden.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunCommandRequest(
        Command command,
        byte[] data,
        Boolean softCancel
) {
    public static RunCommandRequest command(List<String> osArgs, String cwd) {
        return new RunCommandRequest(new Command(osArgs, cwd), null, null);
    }

    public static RunCommandRequest data(byte[] chunk) {
        return new RunCommandRequest(null, chunk, null);
    }

    public static RunCommandRequest softCancelRequest() {
        return new RunCommandRequest(null, null, Boolean.TRUE);
    }

    public boolean wantsSoftCancel() {
        return Boolean.TRUE.equals(softCancel);
    }

    public record Command(
            List<String> osArgs,
            String cwd
    ) {
        public Command {
            osArgs = osArgs == null ? List.of() : List.copyOf(osArgs);
        }
    }
}
