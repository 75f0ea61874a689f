package dev.drtheo.lux.interpreter;

import dev.drtheo.lux.ast.Expr;
import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.util.ErrorKind;
import dev.drtheo.lux.util.ErrorReporter;

import java.util.List;

// Frames hold false while a name is declared but not yet defined, true after.
public class Resolver implements Expr.Visitor<Void>, Stmt.Visitor<Void> {

    private final ErrorReporter reporter;

    private Resolution resolution;

    // null at the top level, where names are globals and are not tracked
    private Environment scope;

    private FunctionType function = FunctionType.NONE;
    private ClassType clazz = ClassType.NONE;

    public Resolver(ErrorReporter reporter) {
        this.reporter = reporter;
    }

    public Resolution resolve(List<Stmt> statements) {
        this.resolution = new Resolution();
        this.scope = null;

        this.resolveAll(statements);
        return this.resolution;
    }

    @Override
    public Void visitBlockStmt(Stmt.Block stmt) {
        this.inScope(ScopeShape.block(scope), () -> this.resolveAll(stmt.statements()));
        return null;
    }

    @Override
    public Void visitClassStmt(Stmt.Class stmt) {
        this.declare(stmt.name(), true);

        Expr.Variable superclass = stmt.superclass();
        if (superclass != null) {
            if (superclass.name().lexeme().equals(stmt.name().lexeme()))
                this.error(superclass.name(), "A class can't inherit from itself.");

            this.resolve(superclass);
        }

        ClassType enclosingClass = clazz;
        clazz = superclass == null ? ClassType.CLASS : ClassType.SUBCLASS;

        Environment receiver = ScopeShape.receiver(ScopeShape.methodClosure(scope, stmt, true), true);
        this.inScope(receiver, () -> {
            for (Stmt.Function method : stmt.methods()) {
                this.resolveFunction(method, ScopeShape.isInitializer(method)
                        ? FunctionType.INITIALIZER : FunctionType.METHOD);
            }
        });

        clazz = enclosingClass;
        return null;
    }

    @Override
    public Void visitExpressionStmt(Stmt.Expression stmt) {
        this.resolve(stmt.expression());
        return null;
    }

    @Override
    public Void visitFunctionStmt(Stmt.Function stmt) {
        // defined before the body so the function can call itself
        this.declare(stmt.name(), true);
        this.resolveFunction(stmt, FunctionType.FUNCTION);
        return null;
    }

    @Override
    public Void visitIfStmt(Stmt.If stmt) {
        this.resolve(stmt.condition());
        this.resolve(stmt.thenBranch());

        if (stmt.elseBranch() != null)
            this.resolve(stmt.elseBranch());

        return null;
    }

    @Override
    public Void visitPrintStmt(Stmt.Print stmt) {
        this.resolve(stmt.expression());
        return null;
    }

    @Override
    public Void visitReturnStmt(Stmt.Return stmt) {
        if (function == FunctionType.NONE)
            this.error(stmt.keyword(), "Can't return from top-level code.");

        if (stmt.value() == null)
            return null;

        if (function == FunctionType.INITIALIZER)
            this.error(stmt.keyword(), "Can't return a value from an initializer.");

        this.resolve(stmt.value());
        return null;
    }

    @Override
    public Void visitVarStmt(Stmt.Var stmt) {
        this.declare(stmt.name(), false);

        if (stmt.initializer() != null)
            this.resolve(stmt.initializer());

        if (scope != null)
            scope.define(stmt.name().lexeme(), true);

        return null;
    }

    @Override
    public Void visitWhileStmt(Stmt.While stmt) {
        this.resolve(stmt.condition());
        this.resolve(stmt.body());
        return null;
    }

    @Override
    public Void visitAssignExpr(Expr.Assign expr) {
        this.resolve(expr.value());
        this.bind(expr, expr.name());
        return null;
    }

    @Override
    public Void visitBinaryExpr(Expr.Binary expr) {
        this.resolve(expr.left(), expr.right());
        return null;
    }

    @Override
    public Void visitCallExpr(Expr.Call expr) {
        this.resolve(expr.callee());

        for (Expr argument : expr.arguments()) {
            this.resolve(argument);
        }

        return null;
    }

    @Override
    public Void visitGetExpr(Expr.Get expr) {
        this.resolve(expr.object());
        return null;
    }

    @Override
    public Void visitGroupingExpr(Expr.Grouping expr) {
        this.resolve(expr.expression());
        return null;
    }

    @Override
    public Void visitLiteralExpr(Expr.Literal expr) {
        return null;
    }

    @Override
    public Void visitLogicalExpr(Expr.Logical expr) {
        this.resolve(expr.left(), expr.right());
        return null;
    }

    @Override
    public Void visitSetExpr(Expr.Set expr) {
        this.resolve(expr.value(), expr.object());
        return null;
    }

    @Override
    public Void visitSuperExpr(Expr.Super expr) {
        switch (clazz) {
            case NONE -> this.error(expr.keyword(), "Can't use 'super' outside of a class.");
            case CLASS -> this.error(expr.keyword(), "Can't use 'super' in a class with no superclass.");
            case SUBCLASS -> this.bind(expr, expr.keyword());
        }

        return null;
    }

    @Override
    public Void visitThisExpr(Expr.This expr) {
        if (clazz == ClassType.NONE) {
            this.error(expr.keyword(), "Can't use 'this' outside of a class.");
        } else {
            this.bind(expr, expr.keyword());
        }

        return null;
    }

    @Override
    public Void visitUnaryExpr(Expr.Unary expr) {
        this.resolve(expr.right());
        return null;
    }

    @Override
    public Void visitVariableExpr(Expr.Variable expr) {
        if (scope != null && scope.getLocal(expr.name().lexeme()) == Boolean.FALSE)
            this.error(expr.name(), "Can't read local variable in its own initializer.");

        this.bind(expr, expr.name());
        return null;
    }

    private void resolveFunction(Stmt.Function declaration, FunctionType type) {
        FunctionType enclosingFunction = function;
        function = type;

        Environment parameters = ScopeShape.call(scope, declaration,
                (frame, param, index) -> this.declareIn(frame, param, true));

        this.inScope(parameters, () -> this.resolveAll(declaration.body()));

        function = enclosingFunction;
    }

    private void resolveAll(List<Stmt> statements) {
        statements.forEach(this::resolve);
    }

    private void resolve(Stmt stmt) {
        stmt.accept(this);
    }

    private void resolve(Expr... exprs) {
        for (Expr expr : exprs) {
            expr.accept(this);
        }
    }

    private void inScope(Environment frame, Runnable body) {
        Environment enclosing = scope;
        scope = frame;

        body.run();
        scope = enclosing;
    }

    private void declare(Token name, boolean defined) {
        if (scope != null)
            this.declareIn(scope, name, defined);
    }

    private void declareIn(Environment frame, Token name, boolean defined) {
        if (frame.isDeclared(name.lexeme()))
            this.error(name, "Already a variable with this name in this scope.");

        frame.define(name.lexeme(), defined);
    }

    private void bind(Expr expr, Token name) {
        if (scope == null)
            return;

        int distance = scope.distanceTo(name.lexeme());

        if (distance >= 0)
            resolution.put(expr, distance);
    }

    private void error(Token token, String message) {
        reporter.error(ErrorKind.RESOLUTION, token, message);
    }

    private enum FunctionType {
        NONE,
        FUNCTION,
        INITIALIZER,
        METHOD
    }

    private enum ClassType {
        NONE,
        CLASS,
        SUBCLASS
    }
}
