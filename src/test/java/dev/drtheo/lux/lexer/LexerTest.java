package dev.drtheo.lux.lexer;

import dev.drtheo.lux.util.Diagnostic;
import dev.drtheo.lux.util.ErrorKind;
import dev.drtheo.lux.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.drtheo.lux.lexer.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> scan(String source, ErrorReporter reporter) {
        return new Lexer(source, reporter).scanTokens();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    public void prefersLongestOperator() {
        ErrorReporter reporter = new ErrorReporter();
        List<Token> tokens = scan("! != = == < <= > >=", reporter);

        assertEquals(List.of(BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, EOF),
                types(tokens));
        assertFalse(reporter.hadError());
    }

    @Test
    public void distinguishesKeywordsFromIdentifiers() {
        List<Token> tokens = scan("var variable classy class _x1 nil", new ErrorReporter());

        assertEquals(List.of(VAR, IDENTIFIER, IDENTIFIER, CLASS, IDENTIFIER, NIL, EOF), types(tokens));
        assertEquals("classy", tokens.get(2).lexeme());
    }

    @Test
    public void scansNumberLiterals() {
        List<Token> tokens = scan("12 3.5 7.", new ErrorReporter());

        assertEquals(List.of(NUMBER, NUMBER, NUMBER, DOT, EOF), types(tokens));
        assertEquals(12.0, tokens.get(0).literal());
        assertEquals(3.5, tokens.get(1).literal());
        assertEquals(7.0, tokens.get(2).literal());
    }

    @Test
    public void leadingDotIsNotPartOfNumber() {
        List<Token> tokens = scan(".5", new ErrorReporter());

        assertEquals(List.of(DOT, NUMBER, EOF), types(tokens));
    }

    @Test
    public void scansStringsAcrossLines() {
        List<Token> tokens = scan("\"a\nb\" x", new ErrorReporter());

        assertEquals(STRING, tokens.get(0).type());
        assertEquals("a\nb", tokens.get(0).literal());
        assertEquals(2, tokens.get(1).line());
    }

    @Test
    public void skipsCommentsAndCountsLines() {
        List<Token> tokens = scan("// comment\nprint 1; // trailing\n\nx", new ErrorReporter());

        assertEquals(List.of(PRINT, NUMBER, SEMICOLON, IDENTIFIER, EOF), types(tokens));
        assertEquals(2, tokens.get(0).line());
        assertEquals(4, tokens.get(3).line());
    }

    @Test
    public void reportsEveryUnexpectedCharacter() {
        ErrorReporter reporter = new ErrorReporter();
        List<Token> tokens = scan("a @ b\n# c", reporter);

        assertEquals(List.of(IDENTIFIER, IDENTIFIER, IDENTIFIER, EOF), types(tokens));

        List<Diagnostic> diagnostics = reporter.getDiagnostics();
        assertEquals(2, diagnostics.size());
        assertEquals(1, diagnostics.get(0).line());
        assertEquals(2, diagnostics.get(1).line());
        assertEquals(ErrorKind.LEXICAL, diagnostics.get(0).kind());
        assertEquals("[line 1] Error: Unexpected character.", diagnostics.get(0).format());
    }

    @Test
    public void unterminatedStringResumesOnNextLine() {
        ErrorReporter reporter = new ErrorReporter();
        List<Token> tokens = scan("print \"oops;\nvar x = 1;", reporter);

        assertEquals(List.of(PRINT, VAR, IDENTIFIER, EQUAL, NUMBER, SEMICOLON, EOF), types(tokens));
        assertEquals(2, tokens.get(1).line());
        assertEquals("[line 1] Error: Unterminated string.", reporter.getDiagnostics().get(0).format());
    }

    @Test
    public void appendsExactlyOneEof() {
        List<Token> empty = scan("", new ErrorReporter());
        assertEquals(List.of(EOF), types(empty));

        List<Token> tokens = scan("a;", new ErrorReporter());
        assertEquals(1, tokens.stream().filter(token -> token.type() == EOF).count());
        assertEquals(2, tokens.get(tokens.size() - 1).offset());
    }

    @Test
    public void tokensCoverSourceExceptWhitespaceAndComments() {
        String source = "class A < B {\n  init(x) { this.x = x >= 1.5; } // note\n}\nprint \"s\" + nil;\n";
        List<Token> tokens = scan(source, new ErrorReporter());

        int position = 0;
        for (Token token : tokens) {
            String gap = source.substring(position, token.offset());
            String stripped = gap.replaceAll("//[^\n]*", "");
            assertTrue(stripped.isBlank(), "unexpected gap '" + gap + "' before " + token);

            assertEquals(token.lexeme(), source.substring(token.offset(), token.end()));
            position = token.end();
        }

        assertEquals(source.length(), position);
    }
}
