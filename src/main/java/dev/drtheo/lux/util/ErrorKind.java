package dev.drtheo.lux.util;

// declared in phase order
public enum ErrorKind {
    LEXICAL(65),
    SYNTAX(65),
    RESOLUTION(65),
    RUNTIME(70);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean isStatic() {
        return this != RUNTIME;
    }
}
