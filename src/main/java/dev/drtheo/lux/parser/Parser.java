package dev.drtheo.lux.parser;

import dev.drtheo.lux.ast.Expr;
import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.lexer.TokenType;
import dev.drtheo.lux.util.ErrorKind;
import dev.drtheo.lux.util.ErrorReporter;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static dev.drtheo.lux.lexer.TokenType.*;

public class Parser {

    public static final int MAX_ARGUMENTS = 255;
    public static final int MAX_NESTING = 256;

    private static final Set<TokenType> PRIMARY_STARTS = EnumSet.of(
            FALSE, TRUE, NIL, NUMBER, STRING, THIS, IDENTIFIER, SUPER, LEFT_PAREN
    );

    private final TokenEnumerator tokens;
    private final ErrorReporter reporter;

    // how deep the tree under construction is; bounds recursion in every later pass
    private int nesting;

    public Parser(List<Token> tokens, ErrorReporter reporter) {
        this.tokens = new TokenEnumerator(tokens);
        this.reporter = reporter;
    }

    // statements that failed to parse are left out, their errors are in the reporter
    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();

        while (!tokens.isAtEnd()) {
            this.declarationInto(statements);
        }

        return statements;
    }

    private void declarationInto(List<Stmt> statements) {
        Stmt statement = this.declaration();

        if (statement != null)
            statements.add(statement);
    }

    private Stmt declaration() {
        try {
            return switch (tokens.current().type()) {
                case CLASS -> this.classDeclaration();
                case FUN -> {
                    tokens.next();
                    yield this.function(FunctionKind.FUNCTION);
                }
                case VAR -> this.varDeclaration();
                default -> this.statement();
            };
        } catch (ParseError error) {
            tokens.recover();
            return null;
        }
    }

    private Stmt classDeclaration() {
        tokens.next();
        Token name = this.expect(IDENTIFIER, "Expect class name.");

        Expr.Variable superclass = null;
        if (tokens.skip(LESS))
            superclass = new Expr.Variable(this.expect(IDENTIFIER, "Expect superclass name."));

        this.expect(LEFT_BRACE, "Expect '{' before class body.");

        List<Stmt.Function> methods = new ArrayList<>();
        while (!tokens.at(RIGHT_BRACE) && !tokens.isAtEnd()) {
            methods.add(this.function(FunctionKind.METHOD));
        }

        this.expect(RIGHT_BRACE, "Expect '}' after class body.");
        return new Stmt.Class(name, superclass, methods);
    }

    private Stmt.Function function(FunctionKind kind) {
        this.enter(tokens.current());

        try {
            Token name = this.expect(IDENTIFIER, "Expect " + kind.label + " name.");
            this.expect(LEFT_PAREN, "Expect '(' after " + kind.label + " name.");

            List<Token> params = this.commaSeparated("parameters",
                    () -> this.expect(IDENTIFIER, "Expect parameter name."));

            this.expect(RIGHT_PAREN, "Expect ')' after parameters.");
            this.expect(LEFT_BRACE, "Expect '{' before " + kind.label + " body.");

            return new Stmt.Function(name, params, this.block());
        } finally {
            nesting--;
        }
    }

    private Stmt varDeclaration() {
        tokens.next();
        Token name = this.expect(IDENTIFIER, "Expect variable name.");

        Expr initializer = tokens.skip(EQUAL) ? this.expression() : null;

        this.expect(SEMICOLON, "Expect ';' after variable declaration.");
        return new Stmt.Var(name, initializer);
    }

    private Stmt statement() {
        this.enter(tokens.current());

        try {
            return switch (tokens.current().type()) {
                case FOR -> this.forStatement();
                case IF -> this.ifStatement();
                case PRINT -> this.printStatement();
                case RETURN -> this.returnStatement();
                case WHILE -> this.whileStatement();
                case LEFT_BRACE -> {
                    tokens.next();
                    yield new Stmt.Block(this.block());
                }
                default -> this.expressionStatement();
            };
        } finally {
            nesting--;
        }
    }

    private Stmt forStatement() {
        tokens.next();
        this.expect(LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer;
        if (tokens.skip(SEMICOLON)) {
            initializer = null;
        } else if (tokens.at(VAR)) {
            initializer = this.varDeclaration();
        } else {
            initializer = this.expressionStatement();
        }

        Expr condition = tokens.at(SEMICOLON) ? null : this.expression();
        this.expect(SEMICOLON, "Expect ';' after loop condition.");

        Expr increment = tokens.at(RIGHT_PAREN) ? null : this.expression();
        this.expect(RIGHT_PAREN, "Expect ')' after for clauses.");

        return desugarFor(initializer, condition, increment, this.statement());
    }

    // for (init; cond; incr) body  =>  { init; while (cond) { body; incr; } }
    private static Stmt desugarFor(Stmt initializer, Expr condition, Expr increment, Stmt body) {
        if (increment != null)
            body = new Stmt.Block(List.of(body, new Stmt.Expression(increment)));

        Stmt loop = new Stmt.While(condition != null ? condition : new Expr.Literal(true), body);

        if (initializer == null)
            return loop;

        return new Stmt.Block(List.of(initializer, loop));
    }

    private Stmt ifStatement() {
        tokens.next();
        this.expect(LEFT_PAREN, "Expect '(' after 'if'.");

        Expr condition = this.expression();
        this.expect(RIGHT_PAREN, "Expect ')' after if condition.");

        Stmt thenBranch = this.statement();
        Stmt elseBranch = tokens.skip(ELSE) ? this.statement() : null;

        return new Stmt.If(condition, thenBranch, elseBranch);
    }

    private Stmt printStatement() {
        tokens.next();
        Expr value = this.expression();

        this.expect(SEMICOLON, "Expect ';' after value.");
        return new Stmt.Print(value);
    }

    private Stmt returnStatement() {
        Token keyword = tokens.next();
        Expr value = tokens.at(SEMICOLON) ? null : this.expression();

        this.expect(SEMICOLON, "Expect ';' after return value.");
        return new Stmt.Return(keyword, value);
    }

    private Stmt whileStatement() {
        tokens.next();
        this.expect(LEFT_PAREN, "Expect '(' after 'while'.");

        Expr condition = this.expression();
        this.expect(RIGHT_PAREN, "Expect ')' after condition.");

        return new Stmt.While(condition, this.statement());
    }

    private Stmt expressionStatement() {
        Expr expr = this.expression();

        this.expect(SEMICOLON, "Expect ';' after expression.");
        return new Stmt.Expression(expr);
    }

    // the opening brace is already consumed
    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<>();

        while (!tokens.at(RIGHT_BRACE) && !tokens.isAtEnd()) {
            this.declarationInto(statements);
        }

        this.expect(RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Expr expression() {
        return this.assignment();
    }

    private Expr assignment() {
        this.enter(tokens.current());

        try {
            Expr target = this.binary(Precedence.LOGIC_OR);

            if (!tokens.skip(EQUAL))
                return target;

            Token equals = tokens.previous();
            Expr value = this.assignment();

            if (target instanceof Expr.Variable variable)
                return new Expr.Assign(variable.name(), value);

            if (target instanceof Expr.Get get)
                return new Expr.Set(get.object(), get.name(), value);

            // reported without panicking, the rest of the statement is fine
            this.error(equals, "Invalid assignment target.");
            return target;
        } finally {
            nesting--;
        }
    }

    private Expr binary(Precedence level) {
        if (level == null)
            return this.unary();

        Expr expr = this.binary(level.tighter());
        int links = 0;

        try {
            while (tokens.skipAny(level.operators)) {
                Token operator = tokens.previous();

                this.enter(operator);
                links++;

                Expr right = this.binary(level.tighter());
                expr = level.logical
                        ? new Expr.Logical(expr, operator, right)
                        : new Expr.Binary(expr, operator, right);
            }
        } finally {
            nesting -= links;
        }

        return expr;
    }

    private Expr unary() {
        if (!tokens.at(BANG) && !tokens.at(MINUS))
            return this.call();

        Token operator = tokens.next();
        this.enter(operator);

        try {
            return new Expr.Unary(operator, this.unary());
        } finally {
            nesting--;
        }
    }

    private Expr call() {
        Expr expr = this.primary();
        int links = 0;

        try {
            while (true) {
                if (tokens.skip(LEFT_PAREN)) {
                    this.enter(tokens.previous());
                    links++;

                    List<Expr> arguments = this.commaSeparated("arguments", this::expression);
                    expr = new Expr.Call(expr, this.expect(RIGHT_PAREN, "Expect ')' after arguments."), arguments);
                } else if (tokens.skip(DOT)) {
                    this.enter(tokens.previous());
                    links++;

                    expr = new Expr.Get(expr, this.expect(IDENTIFIER, "Expect property name after '.'."));
                } else {
                    return expr;
                }
            }
        } finally {
            nesting -= links;
        }
    }

    private Expr primary() {
        Token token = tokens.current();

        if (!PRIMARY_STARTS.contains(token.type()))
            throw this.error(token, "Expect expression.");

        tokens.next();

        return switch (token.type()) {
            case FALSE -> new Expr.Literal(false);
            case TRUE -> new Expr.Literal(true);
            case NIL -> new Expr.Literal(null);
            case NUMBER, STRING -> new Expr.Literal(token.literal());
            case THIS -> new Expr.This(token);
            case IDENTIFIER -> new Expr.Variable(token);
            case SUPER -> {
                this.expect(DOT, "Expect '.' after 'super'.");
                yield new Expr.Super(token, this.expect(IDENTIFIER, "Expect superclass method name."));
            }
            case LEFT_PAREN -> {
                Expr inner = this.expression();
                this.expect(RIGHT_PAREN, "Expect ')' after expression.");
                yield new Expr.Grouping(inner);
            }
            default -> throw new IllegalStateException("Unexpected primary " + token.type());
        };
    }

    // the list may be empty; the closing parenthesis is left for the caller
    private <T> List<T> commaSeparated(String what, Supplier<T> element) {
        List<T> items = new ArrayList<>();

        if (tokens.at(RIGHT_PAREN))
            return items;

        do {
            if (items.size() >= MAX_ARGUMENTS)
                this.error(tokens.current(), "Can't have more than " + MAX_ARGUMENTS + " " + what + ".");

            items.add(element.get());
        } while (tokens.skip(COMMA));

        return items;
    }

    private void enter(Token token) {
        if (nesting >= MAX_NESTING)
            throw this.error(token, "Too much nesting.");

        nesting++;
    }

    private Token expect(TokenType type, String message) {
        if (tokens.at(type))
            return tokens.next();

        throw this.error(tokens.current(), message);
    }

    private ParseError error(Token token, String message) {
        reporter.error(ErrorKind.SYNTAX, token, message);
        return new ParseError();
    }

    private static class ParseError extends RuntimeException { }

    private enum FunctionKind {
        FUNCTION("function"),
        METHOD("method");

        private final String label;

        FunctionKind(String label) {
            this.label = label;
        }
    }

    private enum Precedence {
        LOGIC_OR(true, TokenType.OR),
        LOGIC_AND(true, TokenType.AND),
        EQUALITY(false, TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL),
        COMPARISON(false, TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL),
        TERM(false, TokenType.MINUS, TokenType.PLUS),
        FACTOR(false, TokenType.SLASH, TokenType.STAR);

        private static final Precedence[] LOOSEST_FIRST = values();

        private final boolean logical;
        private final Set<TokenType> operators;

        Precedence(boolean logical, TokenType first, TokenType... rest) {
            this.logical = logical;
            this.operators = EnumSet.of(first, rest);
        }

        // null past the tightest binary level, where unary takes over
        private Precedence tighter() {
            int next = this.ordinal() + 1;
            return next < LOOSEST_FIRST.length ? LOOSEST_FIRST[next] : null;
        }
    }
}
