package dev.drtheo.lux.util;

import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ErrorReporter {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void error(ErrorKind kind, int line, String message) {
        this.report(kind, line, "", message);
    }

    public void error(ErrorKind kind, Token token, String message) {
        if (token.type() == TokenType.EOF) {
            this.report(kind, token.line(), " at end", message);
        } else {
            this.report(kind, token.line(), " at '" + token.lexeme() + "'", message);
        }
    }

    public void runtimeError(RuntimeError error) {
        this.report(ErrorKind.RUNTIME, error.getToken().line(), "", error.getMessage());
    }

    public void report(ErrorKind kind, int line, String where, String message) {
        diagnostics.add(new Diagnostic(kind, line, where, message));
    }

    public boolean hadError() {
        return !diagnostics.isEmpty();
    }

    // earliest phase that reported anything, null if none did
    public ErrorKind failure() {
        ErrorKind result = null;

        for (Diagnostic diagnostic : diagnostics) {
            if (result == null || diagnostic.kind().ordinal() < result.ordinal())
                result = diagnostic.kind();
        }

        return result;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
