package dev.drtheo.lux.runtime;

import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.util.RuntimeError;

import java.util.HashMap;
import java.util.Map;

public class LuxInstance {
    private final LuxClass clazz;
    private final Map<String, Object> fields = new HashMap<>();

    public LuxInstance(LuxClass clazz) {
        this.clazz = clazz;
    }

    // fields shadow methods
    public Object get(Token name) {
        if (fields.containsKey(name.lexeme()))
            return fields.get(name.lexeme());

        LuxFunction method = clazz.findMethod(name.lexeme());

        if (method != null)
            return method.bind(this);

        throw new RuntimeError(name, RuntimeError.Kind.UNDEFINED_PROPERTY,
                "Undefined property '" + name.lexeme() + "'.");
    }

    public void set(Token name, Object value) {
        fields.put(name.lexeme(), value);
    }

    public LuxClass getLuxClass() {
        return clazz;
    }

    @Override
    public String toString() {
        return clazz.getName() + " instance";
    }
}
