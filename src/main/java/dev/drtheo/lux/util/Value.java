package dev.drtheo.lux.util;

public final class Value {

    private Value() { }

    public static boolean isTruthy(Object object) {
        if (object == null)
            return false;

        if (object instanceof Boolean bool)
            return bool;

        return true;
    }

    public static boolean isEqual(Object a, Object b) {
        if (a == null && b == null)
            return true;

        if (a == null || b == null)
            return false;

        if (a instanceof Double left && b instanceof Double right)
            return left.doubleValue() == right.doubleValue();

        if (a instanceof Boolean || a instanceof String)
            return a.equals(b);

        // callables, classes and instances
        return a == b;
    }

    public static String stringify(Object object) {
        if (object == null)
            return "nil";

        if (object instanceof Double) {
            String text = object.toString();

            if (text.endsWith(".0")) {
                text = text.substring(0, text.length() - 2);
            }

            return text;
        }

        return object.toString();
    }
}
