package dev.drtheo.lux.runtime;

import dev.drtheo.lux.interpreter.Interpreter;

import java.util.List;

public class NativeFunction implements LuxCallable {

    @FunctionalInterface
    public interface Body {
        Object call(Interpreter interpreter, List<Object> arguments);
    }

    private final int arity;
    private final Body body;

    public NativeFunction(int arity, Body body) {
        this.arity = arity;
        this.body = body;
    }

    @Override
    public int arity() {
        return arity;
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> arguments) {
        return body.call(interpreter, arguments);
    }

    @Override
    public String toString() {
        return "<native fn>";
    }
}
