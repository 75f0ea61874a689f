package dev.drtheo.lux.util;

public record Diagnostic(ErrorKind kind, int line, String where, String message) {

    public String format() {
        if (kind.isStatic())
            return "[line " + line + "] Error" + where + ": " + message;

        return message + "\n[line " + line + "]";
    }

    @Override
    public String toString() {
        return this.format();
    }
}
