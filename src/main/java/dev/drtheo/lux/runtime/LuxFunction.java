package dev.drtheo.lux.runtime;

import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.interpreter.Environment;
import dev.drtheo.lux.interpreter.Interpreter;
import dev.drtheo.lux.interpreter.ScopeShape;
import dev.drtheo.lux.util.Completion;

import java.util.List;

public class LuxFunction implements LuxCallable {

    private final Stmt.Function declaration;
    private final Environment closure;

    private final boolean isInitializer;

    public LuxFunction(Stmt.Function declaration, Environment closure, boolean isInitializer) {
        this.declaration = declaration;
        this.closure = closure;

        this.isInitializer = isInitializer;
    }

    public LuxFunction bind(LuxInstance instance) {
        return new LuxFunction(declaration, ScopeShape.receiver(closure, instance), isInitializer);
    }

    @Override
    public int arity() {
        return declaration.params().size();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> arguments) {
        Environment frame = ScopeShape.call(closure, declaration,
                (params, param, index) -> params.define(param.lexeme(), arguments.get(index)));

        Completion completion = interpreter.executeBlock(declaration.body(), frame);

        // an initializer yields its receiver, even on a bare return
        if (isInitializer)
            return ScopeShape.receiverOf(closure);

        return completion.isReturn() ? completion.getValue() : null;
    }

    @Override
    public String toString() {
        return "<fn " + declaration.name().lexeme() + ">";
    }
}
