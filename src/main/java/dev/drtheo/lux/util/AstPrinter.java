package dev.drtheo.lux.util;

import dev.drtheo.lux.ast.Expr;
import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.lexer.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {

    public String print(Expr expr) {
        return expr.accept(this);
    }

    public String print(Stmt stmt) {
        return stmt.accept(this);
    }

    @Override
    public String visitBlockStmt(Stmt.Block stmt) {
        return this.form("block", stmt.statements());
    }

    @Override
    public String visitClassStmt(Stmt.Class stmt) {
        if (stmt.superclass() == null)
            return this.form("class", stmt.name(), stmt.methods());

        return this.form("class", stmt.name(), "<", stmt.superclass(), stmt.methods());
    }

    @Override
    public String visitExpressionStmt(Stmt.Expression stmt) {
        return this.form(";", stmt.expression());
    }

    @Override
    public String visitFunctionStmt(Stmt.Function stmt) {
        String params = stmt.params().stream()
                .map(Token::lexeme)
                .collect(Collectors.joining(" ", "(", ")"));

        return this.form("fun " + stmt.name().lexeme() + params, stmt.body());
    }

    @Override
    public String visitIfStmt(Stmt.If stmt) {
        if (stmt.elseBranch() == null)
            return this.form("if", stmt.condition(), stmt.thenBranch());

        return this.form("if-else", stmt.condition(), stmt.thenBranch(), stmt.elseBranch());
    }

    @Override
    public String visitPrintStmt(Stmt.Print stmt) {
        return this.form("print", stmt.expression());
    }

    @Override
    public String visitReturnStmt(Stmt.Return stmt) {
        return this.form("return", this.optional(stmt.value()));
    }

    @Override
    public String visitVarStmt(Stmt.Var stmt) {
        if (stmt.initializer() == null)
            return this.form("var", stmt.name());

        return this.form("var", stmt.name(), "=", stmt.initializer());
    }

    @Override
    public String visitWhileStmt(Stmt.While stmt) {
        return this.form("while", stmt.condition(), stmt.body());
    }

    @Override
    public String visitAssignExpr(Expr.Assign expr) {
        return this.form("=", expr.name(), expr.value());
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return this.form(expr.operator().lexeme(), expr.left(), expr.right());
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        return this.form("call", expr.callee(), expr.arguments());
    }

    @Override
    public String visitGetExpr(Expr.Get expr) {
        return this.form(".", expr.object(), expr.name());
    }

    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
        return this.form("group", expr.expression());
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        Object value = expr.value();

        if (value instanceof String string)
            return '"' + string + '"';

        return value == null ? "nil" : value.toString();
    }

    @Override
    public String visitLogicalExpr(Expr.Logical expr) {
        return this.form(expr.operator().lexeme(), expr.left(), expr.right());
    }

    @Override
    public String visitSetExpr(Expr.Set expr) {
        return this.form("=", expr.object(), expr.name(), expr.value());
    }

    @Override
    public String visitSuperExpr(Expr.Super expr) {
        return this.form("super", expr.method());
    }

    @Override
    public String visitThisExpr(Expr.This expr) {
        return "this";
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        return this.form(expr.operator().lexeme(), expr.right());
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return expr.name().lexeme();
    }

    private List<Expr> optional(Expr expr) {
        return expr == null ? List.of() : List.of(expr);
    }

    // (head part...) with lists spliced in place
    private String form(String head, Object... parts) {
        List<String> rendered = new ArrayList<>();
        rendered.add(head);

        this.renderInto(rendered, Arrays.asList(parts));
        return "(" + String.join(" ", rendered) + ")";
    }

    private void renderInto(List<String> rendered, List<?> parts) {
        for (Object part : parts) {
            if (part instanceof List<?> list) {
                this.renderInto(rendered, list);
            } else if (part instanceof Expr expr) {
                rendered.add(expr.accept(this));
            } else if (part instanceof Stmt stmt) {
                rendered.add(stmt.accept(this));
            } else if (part instanceof Token token) {
                rendered.add(token.lexeme());
            } else {
                rendered.add(String.valueOf(part));
            }
        }
    }
}
