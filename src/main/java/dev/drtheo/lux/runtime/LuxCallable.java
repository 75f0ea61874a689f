package dev.drtheo.lux.runtime;

import dev.drtheo.lux.interpreter.Interpreter;

import java.util.List;

public interface LuxCallable {
    int arity();

    Object call(Interpreter interpreter, List<Object> arguments);
}
