package dev.drtheo.lux.interpreter;

import dev.drtheo.lux.ast.Expr;
import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.lexer.Lexer;
import dev.drtheo.lux.parser.Parser;
import dev.drtheo.lux.util.Diagnostic;
import dev.drtheo.lux.util.ErrorKind;
import dev.drtheo.lux.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResolverTest {

    private static List<Stmt> parse(String source) {
        ErrorReporter reporter = new ErrorReporter();
        List<Stmt> statements = new Parser(new Lexer(source, reporter).scanTokens(), reporter).parse();

        assertFalse(reporter.hadError(), () -> reporter.getDiagnostics().toString());
        return statements;
    }

    private static List<Diagnostic> errors(String source) {
        ErrorReporter reporter = new ErrorReporter();
        new Resolver(reporter).resolve(parse(source));

        return reporter.getDiagnostics();
    }

    private static void assertSingleError(String source, String message) {
        List<Diagnostic> diagnostics = errors(source);

        assertEquals(1, diagnostics.size(), diagnostics::toString);
        assertEquals(ErrorKind.RESOLUTION, diagnostics.get(0).kind());
        assertEquals(message, diagnostics.get(0).message());
    }

    @Test
    public void shadowingChangesDistance() {
        List<Stmt> statements = parse("{ var a = 1; { var a = 2; print a; } print a; }");
        Resolution resolution = new Resolver(new ErrorReporter()).resolve(statements);

        Stmt.Block outer = (Stmt.Block) statements.get(0);
        Stmt.Block inner = (Stmt.Block) outer.statements().get(1);

        Expr innerRead = ((Stmt.Print) inner.statements().get(1)).expression();
        Expr outerRead = ((Stmt.Print) outer.statements().get(2)).expression();

        assertEquals(0, resolution.depth(innerRead));
        assertEquals(0, resolution.depth(outerRead));
    }

    @Test
    public void closureReferenceCountsEnclosingScopes() {
        List<Stmt> statements = parse("{ var a = 1; fun f() { { print a; } } }");
        Resolution resolution = new Resolver(new ErrorReporter()).resolve(statements);

        Stmt.Block block = (Stmt.Block) statements.get(0);
        Stmt.Function function = (Stmt.Function) block.statements().get(1);
        Stmt.Block body = (Stmt.Block) function.body().get(0);
        Expr read = ((Stmt.Print) body.statements().get(0)).expression();

        // inner block, parameter scope, then the declaring block
        assertEquals(2, resolution.depth(read));
    }

    @Test
    public void globalsAreLeftOutOfTheTable() {
        List<Stmt> statements = parse("var a = 1; print a;");
        Resolution resolution = new Resolver(new ErrorReporter()).resolve(statements);

        Expr read = ((Stmt.Print) statements.get(1)).expression();

        assertTrue(resolution.isGlobal(read));
        assertEquals(0, resolution.size());
    }

    @Test
    public void resolvingTwiceGivesTheSameTable() {
        List<Stmt> statements = parse(
                "fun outer() {\n" +
                "  var x = 1;\n" +
                "  fun inner() { x = x + 1; return x; }\n" +
                "  return inner;\n" +
                "}\n" +
                "class A { m() { return this; } }\n" +
                "class B < A { m() { return super.m(); } }\n");

        Resolution first = new Resolver(new ErrorReporter()).resolve(statements);
        Resolution second = new Resolver(new ErrorReporter()).resolve(statements);

        assertTrue(first.size() > 0);
        assertEquals(first, second);
    }

    @Test
    public void rejectsOwnInitializer() {
        assertSingleError("{ var a = a; }", "Can't read local variable in its own initializer.");
    }

    @Test
    public void allowsGlobalSelfReference() {
        assertTrue(errors("var a = a;").isEmpty());
    }

    @Test
    public void rejectsDuplicateLocal() {
        assertSingleError("{ var a = 1; var a = 2; }", "Already a variable with this name in this scope.");
    }

    @Test
    public void allowsGlobalRedeclaration() {
        assertTrue(errors("var a = 1; var a = 2;").isEmpty());
    }

    @Test
    public void rejectsTopLevelReturn() {
        assertSingleError("return 1;", "Can't return from top-level code.");
    }

    @Test
    public void rejectsValueReturnedFromInitializer() {
        assertSingleError("class A { init() { return 1; } }", "Can't return a value from an initializer.");
        assertTrue(errors("class A { init() { return; } }").isEmpty());
    }

    @Test
    public void rejectsThisOutsideClass() {
        assertSingleError("print this;", "Can't use 'this' outside of a class.");
        assertSingleError("fun f() { return this; }", "Can't use 'this' outside of a class.");
    }

    @Test
    public void rejectsSuperOutsideClass() {
        assertSingleError("super.m();", "Can't use 'super' outside of a class.");
    }

    @Test
    public void rejectsSuperWithoutSuperclass() {
        assertSingleError("class A { m() { super.m(); } }", "Can't use 'super' in a class with no superclass.");
    }

    @Test
    public void rejectsSelfInheritance() {
        assertSingleError("class A < A {}", "A class can't inherit from itself.");
    }

    @Test
    public void collectsAllErrors() {
        List<Diagnostic> diagnostics = errors("return 1;\nprint this;\n{ var b = b; }");

        assertEquals(3, diagnostics.size());
        assertEquals("[line 2] Error at 'this': Can't use 'this' outside of a class.", diagnostics.get(1).format());
    }
}
