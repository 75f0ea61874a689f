package dev.drtheo.lux.lexer;

/**
 * @param offset index of the first character of {@code lexeme} in the source
 */
public record Token(TokenType type, String lexeme, Object literal, int line, int offset) {

    public int end() {
        return offset + lexeme.length();
    }

    public String toString() {
        return type + " " + lexeme + " " + literal;
    }
}
