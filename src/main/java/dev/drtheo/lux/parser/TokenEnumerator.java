package dev.drtheo.lux.parser;

import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.lexer.TokenType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public class TokenEnumerator {

    private static final Set<TokenType> STATEMENT_STARTS = EnumSet.of(
            TokenType.CLASS, TokenType.FUN, TokenType.VAR, TokenType.FOR,
            TokenType.IF, TokenType.WHILE, TokenType.PRINT, TokenType.RETURN
    );

    private final List<Token> tokens;
    private int position;

    public TokenEnumerator(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF)
            throw new IllegalArgumentException("Token list must end with EOF");

        this.tokens = tokens;
    }

    public Token current() {
        return tokens.get(position);
    }

    public Token previous() {
        return tokens.get(position - 1);
    }

    public boolean isAtEnd() {
        return this.current().type() == TokenType.EOF;
    }

    public boolean at(TokenType type) {
        return this.current().type() == type && type != TokenType.EOF;
    }

    public Token next() {
        Token token = this.current();

        if (!this.isAtEnd())
            position++;

        return token;
    }

    public boolean skip(TokenType type) {
        if (!this.at(type))
            return false;

        position++;
        return true;
    }

    public boolean skipAny(Set<TokenType> types) {
        if (this.isAtEnd() || !types.contains(this.current().type()))
            return false;

        position++;
        return true;
    }

    // panic mode: stop after a ';' or before a keyword that starts a statement
    public void recover() {
        this.next();

        while (!this.isAtEnd()) {
            if (this.previous().type() == TokenType.SEMICOLON)
                return;

            if (STATEMENT_STARTS.contains(this.current().type()))
                return;

            position++;
        }
    }
}
