package dev.drtheo.lux.interpreter;

import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.util.RuntimeError;

import java.util.HashMap;
import java.util.Map;

public class Environment {

    private final Environment enclosing;
    private final Map<String, Object> values = new HashMap<>();

    public Environment() {
        this.enclosing = null;
    }

    public Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    public Object get(Token name) {
        if (values.containsKey(name.lexeme()))
            return values.get(name.lexeme());

        if (enclosing != null)
            return enclosing.get(name);

        throw undefined(name);
    }

    public void assign(Token name, Object value) {
        if (values.containsKey(name.lexeme())) {
            values.put(name.lexeme(), value);
            return;
        }

        if (enclosing != null) {
            enclosing.assign(name, value);
            return;
        }

        throw undefined(name);
    }

    public void define(String name, Object value) {
        values.put(name, value);
    }

    // this frame only
    public boolean isDeclared(String name) {
        return values.containsKey(name);
    }

    public Object getLocal(String name) {
        return values.get(name);
    }

    // -1 when no frame on the chain declares name
    public int distanceTo(String name) {
        int distance = 0;

        for (Environment environment = this; environment != null; environment = environment.enclosing) {
            if (environment.values.containsKey(name))
                return distance;

            distance++;
        }

        return -1;
    }

    public Environment ancestor(int distance) {
        Environment environment = this;
        for (int i = 0; i < distance; i++) {
            environment = environment.enclosing;
        }

        return environment;
    }

    public Object getAt(int distance, String name) {
        return this.ancestor(distance).values.get(name);
    }

    public void assignAt(int distance, Token name, Object value) {
        this.ancestor(distance).values.put(name.lexeme(), value);
    }

    public Environment getEnclosing() {
        return enclosing;
    }

    private static RuntimeError undefined(Token name) {
        return new RuntimeError(name, RuntimeError.Kind.UNDEFINED_VARIABLE,
                "Undefined variable '" + name.lexeme() + "'.");
    }

    @Override
    public String toString() {
        String result = values.toString();

        if (enclosing != null) {
            result += " -> " + enclosing;
        }

        return result;
    }
}
