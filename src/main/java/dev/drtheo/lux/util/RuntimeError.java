package dev.drtheo.lux.util;

import dev.drtheo.lux.lexer.Token;

public class RuntimeError extends RuntimeException {

    public enum Kind {
        TYPE_MISMATCH,
        UNDEFINED_VARIABLE,
        ARITY_MISMATCH,
        NOT_CALLABLE,
        NOT_INSTANCE,
        UNDEFINED_PROPERTY,
        STACK_OVERFLOW
    }

    private final Token token;
    private final Kind kind;

    public RuntimeError(Token token, Kind kind, String message) {
        super(message);

        this.token = token;
        this.kind = kind;
    }

    public Token getToken() {
        return token;
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return token.line();
    }
}
