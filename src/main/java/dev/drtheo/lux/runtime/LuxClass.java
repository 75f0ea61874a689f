package dev.drtheo.lux.runtime;

import dev.drtheo.lux.interpreter.Interpreter;
import dev.drtheo.lux.interpreter.ScopeShape;

import java.util.List;
import java.util.Map;

public class LuxClass implements LuxCallable {

    private final String name;
    private final LuxClass superclass;
    private final Map<String, LuxFunction> methods;

    public LuxClass(String name, LuxClass superclass, Map<String, LuxFunction> methods) {
        this.name = name;
        this.superclass = superclass;
        this.methods = Map.copyOf(methods);
    }

    // nearest declaration on the ancestor chain, unbound
    public LuxFunction findMethod(String name) {
        for (LuxClass clazz = this; clazz != null; clazz = clazz.superclass) {
            LuxFunction method = clazz.methods.get(name);

            if (method != null)
                return method;
        }

        return null;
    }

    public String getName() {
        return name;
    }

    public LuxClass getSuperclass() {
        return superclass;
    }

    @Override
    public int arity() {
        LuxFunction initializer = this.findMethod(ScopeShape.INITIALIZER);

        if (initializer == null)
            return 0;

        return initializer.arity();
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> arguments) {
        LuxInstance instance = new LuxInstance(this);
        LuxFunction initializer = this.findMethod(ScopeShape.INITIALIZER);

        if (initializer != null) {
            initializer.bind(instance).call(interpreter, arguments);
        }

        return instance;
    }

    @Override
    public String toString() {
        return name;
    }
}
