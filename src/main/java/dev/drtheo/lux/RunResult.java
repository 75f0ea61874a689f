package dev.drtheo.lux;

import dev.drtheo.lux.util.Diagnostic;
import dev.drtheo.lux.util.ErrorKind;

import java.util.List;

public record RunResult(ErrorKind failure, List<Diagnostic> diagnostics) {

    public static RunResult success() {
        return new RunResult(null, List.of());
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public int exitCode() {
        if (failure == null)
            return 0;

        return failure.exitCode();
    }
}
