package dev.drtheo.lux.util;

import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.lexer.TokenType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorReporterTest {

    @Test
    public void startsClean() {
        ErrorReporter reporter = new ErrorReporter();

        assertFalse(reporter.hadError());
        assertNull(reporter.failure());
        assertTrue(reporter.getDiagnostics().isEmpty());
    }

    @Test
    public void failureIsTheEarliestPhase() {
        ErrorReporter reporter = new ErrorReporter();

        reporter.error(ErrorKind.SYNTAX, 3, "late");
        reporter.error(ErrorKind.LEXICAL, 5, "early");

        assertTrue(reporter.hadError());
        assertEquals(ErrorKind.LEXICAL, reporter.failure());
        assertEquals(2, reporter.getDiagnostics().size());
    }

    @Test
    public void locatesTokens() {
        ErrorReporter reporter = new ErrorReporter();

        reporter.error(ErrorKind.SYNTAX, new Token(TokenType.IDENTIFIER, "x", null, 2, 0), "bad");
        reporter.error(ErrorKind.SYNTAX, new Token(TokenType.EOF, "", null, 4, 1), "worse");

        assertEquals("[line 2] Error at 'x': bad", reporter.getDiagnostics().get(0).format());
        assertEquals("[line 4] Error at end: worse", reporter.getDiagnostics().get(1).format());
    }

    @Test
    public void diagnosticsAreReadOnly() {
        ErrorReporter reporter = new ErrorReporter();
        reporter.error(ErrorKind.RESOLUTION, 1, "x");

        assertThrows(UnsupportedOperationException.class, () -> reporter.getDiagnostics().clear());
    }
}
