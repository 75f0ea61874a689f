package dev.drtheo.lux.util;

public final class Completion {

    public static final Completion NORMAL = new Completion(false, null);

    private final boolean returning;
    private final Object value;

    private Completion(boolean returning, Object value) {
        this.returning = returning;
        this.value = value;
    }

    public static Completion returning(Object value) {
        return new Completion(true, value);
    }

    public boolean isReturn() {
        return returning;
    }

    public Object getValue() {
        return value;
    }
}
