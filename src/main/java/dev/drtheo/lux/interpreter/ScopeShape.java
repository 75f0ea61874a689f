package dev.drtheo.lux.interpreter;

import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.lexer.Token;

import java.util.List;

// Every frame the language opens, in the order it opens them. The resolver
// fills frames with definedness flags and the interpreter with values, so a
// distance resolved against one chain is valid in the other.
public final class ScopeShape {

    public static final String THIS = "this";
    public static final String SUPER = "super";
    public static final String INITIALIZER = "init";

    private ScopeShape() { }

    public static Environment block(Environment enclosing) {
        return new Environment(enclosing);
    }

    // methods close over this: a frame holding super when the class has a superclass, else the enclosing frame
    public static Environment methodClosure(Environment enclosing, Stmt.Class stmt, Object superclass) {
        if (stmt.superclass() == null)
            return enclosing;

        Environment frame = new Environment(enclosing);
        frame.define(SUPER, superclass);
        return frame;
    }

    public static Environment receiver(Environment methodClosure, Object instance) {
        Environment frame = new Environment(methodClosure);
        frame.define(THIS, instance);
        return frame;
    }

    public static Object receiverOf(Environment boundClosure) {
        return boundClosure.getAt(0, THIS);
    }

    public static Environment call(Environment closure, Stmt.Function function, ParameterBinder binder) {
        Environment frame = new Environment(closure);
        List<Token> params = function.params();

        for (int i = 0; i < params.size(); i++) {
            binder.bind(frame, params.get(i), i);
        }

        return frame;
    }

    public static boolean isInitializer(Stmt.Function method) {
        return method.name().lexeme().equals(INITIALIZER);
    }

    // the receiver frame sits directly inside the frame holding super
    public static int thisDistance(int superDistance) {
        return superDistance - 1;
    }

    @FunctionalInterface
    public interface ParameterBinder {
        void bind(Environment frame, Token param, int index);
    }
}
