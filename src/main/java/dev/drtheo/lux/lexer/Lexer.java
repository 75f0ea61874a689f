package dev.drtheo.lux.lexer;

import dev.drtheo.lux.util.ErrorKind;
import dev.drtheo.lux.util.ErrorReporter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static dev.drtheo.lux.lexer.TokenType.*;

public class Lexer {

    private static final Map<String, TokenType> keywords = new HashMap<>();

    static {
        keywords.put("and", AND);
        keywords.put("class", CLASS);
        keywords.put("else", ELSE);
        keywords.put("false", FALSE);
        keywords.put("for", FOR);
        keywords.put("fun", FUN);
        keywords.put("if", IF);
        keywords.put("nil", NIL);
        keywords.put("or", OR);
        keywords.put("print", PRINT);
        keywords.put("return", RETURN);
        keywords.put("super", SUPER);
        keywords.put("this", THIS);
        keywords.put("true", TRUE);
        keywords.put("var", VAR);
        keywords.put("while", WHILE);
    }

    private final String source;
    private final ErrorReporter reporter;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;

    public Lexer(String source, ErrorReporter reporter) {
        this.source = source;
        this.reporter = reporter;
    }

    public List<Token> scanTokens() {
        while (!this.isAtEnd()) {
            this.start = this.current;
            this.scanToken();
        }

        tokens.add(new Token(EOF, "", null, line, source.length()));
        return tokens;
    }

    private void scanToken() {
        char c = this.advance();

        switch (c) {
            case '(' -> this.addToken(LEFT_PAREN);
            case ')' -> this.addToken(RIGHT_PAREN);
            case '{' -> this.addToken(LEFT_BRACE);
            case '}' -> this.addToken(RIGHT_BRACE);
            case ',' -> this.addToken(COMMA);
            case '.' -> this.addToken(DOT);
            case '-' -> this.addToken(MINUS);
            case '+' -> this.addToken(PLUS);
            case ';' -> this.addToken(SEMICOLON);
            case '*' -> this.addToken(STAR);

            case '!' -> this.addToken(this.match('=') ? BANG_EQUAL : BANG);
            case '=' -> this.addToken(this.match('=') ? EQUAL_EQUAL : EQUAL);
            case '<' -> this.addToken(this.match('=') ? LESS_EQUAL : LESS);
            case '>' -> this.addToken(this.match('=') ? GREATER_EQUAL : GREATER);

            case '/' -> {
                if (this.match('/')) {
                    // A comment goes until the end of the line.
                    while (this.peek() != '\n' && !this.isAtEnd())
                        this.advance();
                } else {
                    this.addToken(SLASH);
                }
            }

            case ' ', '\r', '\t' -> { }
            case '\n' -> line++;

            case '"' -> this.string();

            default -> {
                if (isDigit(c)) {
                    this.number();
                } else if (isAlpha(c)) {
                    this.identifier();
                } else {
                    reporter.error(ErrorKind.LEXICAL, line, "Unexpected character.");
                }
            }
        }
    }

    private void identifier() {
        while (isAlphaNumeric(this.peek()))
            this.advance();

        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, IDENTIFIER);

        this.addToken(type);
    }

    private void number() {
        while (isDigit(this.peek()))
            this.advance();

        // Look for a fractional part.
        if (this.peek() == '.' && isDigit(this.peekNext())) {
            // Consume the "."
            this.advance();

            while (isDigit(this.peek()))
                this.advance();
        }

        this.addToken(NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void string() {
        int startLine = line;

        while (this.peek() != '"' && !this.isAtEnd()) {
            if (this.peek() == '\n')
                line++;

            this.advance();
        }

        if (this.isAtEnd()) {
            reporter.error(ErrorKind.LEXICAL, startLine, "Unterminated string.");
            this.resumeAfterLine(startLine);
            return;
        }

        // The closing ".
        this.advance();

        // Trim the surrounding quotes.
        String value = source.substring(start + 1, current - 1);
        this.addToken(STRING, value);
    }

    // rewind to the end of the line the string opened on and scan on from there
    private void resumeAfterLine(int startLine) {
        int newline = source.indexOf('\n', start);

        if (newline < 0)
            return;

        this.current = newline;
        this.line = startLine;
    }

    private boolean match(char expected) {
        if (this.isAtEnd())
            return false;

        if (source.charAt(current) != expected)
            return false;

        current++;
        return true;
    }

    private char peek() {
        if (this.isAtEnd())
            return '\0';

        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length())
            return '\0';

        return source.charAt(current + 1);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        this.addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line, start));
    }
}
