package dev.drtheo.lux.interpreter;

import dev.drtheo.lux.ast.Expr;
import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.lexer.TokenType;
import dev.drtheo.lux.runtime.LuxCallable;
import dev.drtheo.lux.runtime.LuxClass;
import dev.drtheo.lux.runtime.LuxFunction;
import dev.drtheo.lux.runtime.LuxInstance;
import dev.drtheo.lux.runtime.NativeFunction;
import dev.drtheo.lux.util.Completion;
import dev.drtheo.lux.util.RuntimeError;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static dev.drtheo.lux.util.Value.isEqual;
import static dev.drtheo.lux.util.Value.isTruthy;
import static dev.drtheo.lux.util.Value.stringify;

public class Interpreter implements Expr.Visitor<Object>, Stmt.Visitor<Completion> {

    private final Environment globals;
    // grows with every input of a session and is never pruned: a closure from
    // any earlier input may still run, and its nodes must keep their distances
    private final Resolution locals = new Resolution();
    private final PrintStream out;

    private Environment environment;

    public Interpreter(PrintStream out) {
        this(new Environment(), out);
    }

    public Interpreter(Environment globals, PrintStream out) {
        this.globals = globals;
        this.environment = globals;
        this.out = out;

        if (!globals.isDeclared("clock")) {
            globals.define("clock", new NativeFunction(0,
                    (interpreter, arguments) -> (double) System.currentTimeMillis() / 1000.0));
        }
    }

    // statements before a runtime error keep their effects
    public void interpret(List<Stmt> statements, Resolution resolution) {
        locals.putAll(resolution);
        environment = globals;

        for (Stmt statement : statements) {
            this.execute(statement);
        }
    }

    public Object interpret(Expr expression, Resolution resolution) {
        locals.putAll(resolution);
        environment = globals;

        return this.evaluate(expression);
    }

    private Object evaluate(Expr expr) {
        return expr.accept(this);
    }

    private Completion execute(Stmt stmt) {
        return stmt.accept(this);
    }

    public Completion executeBlock(List<Stmt> statements, Environment environment) {
        Environment previous = this.environment;

        try {
            this.environment = environment;

            for (Stmt statement : statements) {
                Completion completion = this.execute(statement);

                if (completion.isReturn())
                    return completion;
            }

            return Completion.NORMAL;
        } finally {
            this.environment = previous;
        }
    }

    @Override
    public Completion visitBlockStmt(Stmt.Block stmt) {
        return this.executeBlock(stmt.statements(), ScopeShape.block(environment));
    }

    @Override
    public Completion visitClassStmt(Stmt.Class stmt) {
        LuxClass superclass = null;

        if (stmt.superclass() != null) {
            if (!(this.evaluate(stmt.superclass()) instanceof LuxClass parent)) {
                throw new RuntimeError(stmt.superclass().name(), RuntimeError.Kind.TYPE_MISMATCH,
                        "Superclass must be a class.");
            }

            superclass = parent;
        }

        environment.define(stmt.name().lexeme(), null);
        Environment closure = ScopeShape.methodClosure(environment, stmt, superclass);

        Map<String, LuxFunction> methods = new HashMap<>();
        for (Stmt.Function method : stmt.methods()) {
            methods.put(method.name().lexeme(), new LuxFunction(method, closure, ScopeShape.isInitializer(method)));
        }

        environment.assign(stmt.name(), new LuxClass(stmt.name().lexeme(), superclass, methods));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitExpressionStmt(Stmt.Expression stmt) {
        this.evaluate(stmt.expression());
        return Completion.NORMAL;
    }

    @Override
    public Completion visitFunctionStmt(Stmt.Function stmt) {
        LuxFunction function = new LuxFunction(stmt, environment, false);
        environment.define(stmt.name().lexeme(), function);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitIfStmt(Stmt.If stmt) {
        if (isTruthy(this.evaluate(stmt.condition()))) {
            return this.execute(stmt.thenBranch());
        }

        if (stmt.elseBranch() != null) {
            return this.execute(stmt.elseBranch());
        }

        return Completion.NORMAL;
    }

    @Override
    public Completion visitPrintStmt(Stmt.Print stmt) {
        Object value = this.evaluate(stmt.expression());
        out.println(stringify(value));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturnStmt(Stmt.Return stmt) {
        Object value = null;
        if (stmt.value() != null)
            value = this.evaluate(stmt.value());

        return Completion.returning(value);
    }

    @Override
    public Completion visitVarStmt(Stmt.Var stmt) {
        Object value = null;
        if (stmt.initializer() != null) {
            value = this.evaluate(stmt.initializer());
        }

        environment.define(stmt.name().lexeme(), value);
        return Completion.NORMAL;
    }

    @Override
    public Completion visitWhileStmt(Stmt.While stmt) {
        while (isTruthy(this.evaluate(stmt.condition()))) {
            Completion completion = this.execute(stmt.body());

            if (completion.isReturn())
                return completion;
        }

        return Completion.NORMAL;
    }

    @Override
    public Object visitAssignExpr(Expr.Assign expr) {
        Object value = this.evaluate(expr.value());
        Integer distance = locals.depth(expr);

        if (distance != null) {
            environment.assignAt(distance, expr.name(), value);
        } else {
            globals.assign(expr.name(), value);
        }

        return value;
    }

    @Override
    public Object visitBinaryExpr(Expr.Binary expr) {
        Object left = this.evaluate(expr.left());
        Object right = this.evaluate(expr.right());

        Token operator = expr.operator();

        return switch (operator.type()) {
            case BANG_EQUAL -> !isEqual(left, right);
            case EQUAL_EQUAL -> isEqual(left, right);
            case GREATER -> {
                checkNumberOperands(operator, left, right);
                yield (double) left > (double) right;
            }
            case GREATER_EQUAL -> {
                checkNumberOperands(operator, left, right);
                yield (double) left >= (double) right;
            }
            case LESS -> {
                checkNumberOperands(operator, left, right);
                yield (double) left < (double) right;
            }
            case LESS_EQUAL -> {
                checkNumberOperands(operator, left, right);
                yield (double) left <= (double) right;
            }
            case MINUS -> {
                checkNumberOperands(operator, left, right);
                yield (double) left - (double) right;
            }
            case PLUS -> {
                if (left instanceof Double dbl1 && right instanceof Double dbl2)
                    yield dbl1 + dbl2;

                if (left instanceof String str1 && right instanceof String str2)
                    yield str1 + str2;

                throw new RuntimeError(operator, RuntimeError.Kind.TYPE_MISMATCH,
                        "Operands must be two numbers or two strings.");
            }
            case SLASH -> {
                checkNumberOperands(operator, left, right);
                yield (double) left / (double) right;
            }
            case STAR -> {
                checkNumberOperands(operator, left, right);
                yield (double) left * (double) right;
            }
            default -> throw new IllegalStateException("Unexpected binary operator " + operator.type());
        };
    }

    @Override
    public Object visitCallExpr(Expr.Call expr) {
        Object callee = this.evaluate(expr.callee());

        List<Object> arguments = new ArrayList<>();
        for (Expr argument : expr.arguments()) {
            arguments.add(this.evaluate(argument));
        }

        if (!(callee instanceof LuxCallable function)) {
            throw new RuntimeError(expr.paren(), RuntimeError.Kind.NOT_CALLABLE,
                    "Can only call functions and classes.");
        }

        if (arguments.size() != function.arity()) {
            throw new RuntimeError(expr.paren(), RuntimeError.Kind.ARITY_MISMATCH,
                    "Expected " + function.arity() + " arguments but got " + arguments.size() + ".");
        }

        try {
            return function.call(this, arguments);
        } catch (StackOverflowError e) {
            throw new RuntimeError(expr.paren(), RuntimeError.Kind.STACK_OVERFLOW, "Stack overflow.");
        }
    }

    @Override
    public Object visitGetExpr(Expr.Get expr) {
        Object object = this.evaluate(expr.object());
        if (object instanceof LuxInstance instance) {
            return instance.get(expr.name());
        }

        throw new RuntimeError(expr.name(), RuntimeError.Kind.NOT_INSTANCE,
                "Only instances have properties.");
    }

    @Override
    public Object visitGroupingExpr(Expr.Grouping expr) {
        return this.evaluate(expr.expression());
    }

    @Override
    public Object visitLiteralExpr(Expr.Literal expr) {
        return expr.value();
    }

    @Override
    public Object visitLogicalExpr(Expr.Logical expr) {
        Object left = this.evaluate(expr.left());

        if (expr.operator().type() == TokenType.OR) {
            if (isTruthy(left))
                return left;
        } else {
            if (!isTruthy(left))
                return left;
        }

        return this.evaluate(expr.right());
    }

    @Override
    public Object visitSetExpr(Expr.Set expr) {
        Object object = this.evaluate(expr.object());

        if (!(object instanceof LuxInstance instance)) {
            throw new RuntimeError(expr.name(), RuntimeError.Kind.NOT_INSTANCE,
                    "Only instances have fields.");
        }

        Object value = this.evaluate(expr.value());
        instance.set(expr.name(), value);
        return value;
    }

    @Override
    public Object visitSuperExpr(Expr.Super expr) {
        int distance = locals.depth(expr);

        LuxClass superclass = (LuxClass) environment.getAt(distance, ScopeShape.SUPER);
        LuxInstance object = (LuxInstance) environment.getAt(ScopeShape.thisDistance(distance), ScopeShape.THIS);

        LuxFunction method = superclass.findMethod(expr.method().lexeme());

        if (method == null) {
            throw new RuntimeError(expr.method(), RuntimeError.Kind.UNDEFINED_PROPERTY,
                    "Undefined property '" + expr.method().lexeme() + "'.");
        }

        return method.bind(object);
    }

    @Override
    public Object visitThisExpr(Expr.This expr) {
        return this.lookUpVariable(expr.keyword(), expr);
    }

    @Override
    public Object visitUnaryExpr(Expr.Unary expr) {
        Object right = this.evaluate(expr.right());

        return switch (expr.operator().type()) {
            case BANG -> !isTruthy(right);
            case MINUS -> {
                checkNumberOperand(expr.operator(), right);
                yield -(double) right;
            }
            default -> throw new IllegalStateException("Unexpected unary operator " + expr.operator().type());
        };
    }

    @Override
    public Object visitVariableExpr(Expr.Variable expr) {
        return this.lookUpVariable(expr.name(), expr);
    }

    private Object lookUpVariable(Token name, Expr expr) {
        Integer distance = locals.depth(expr);

        if (distance != null) {
            return environment.getAt(distance, name.lexeme());
        } else {
            return globals.get(name);
        }
    }

    private static void checkNumberOperand(Token operator, Object operand) {
        if (operand instanceof Double)
            return;

        throw new RuntimeError(operator, RuntimeError.Kind.TYPE_MISMATCH, "Operand must be a number.");
    }

    private static void checkNumberOperands(Token operator, Object left, Object right) {
        if (left instanceof Double && right instanceof Double)
            return;

        throw new RuntimeError(operator, RuntimeError.Kind.TYPE_MISMATCH, "Operands must be numbers.");
    }
}
