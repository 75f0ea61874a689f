package dev.drtheo.lux;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Interpreter settings, read from {@code lux.properties} on the classpath and
 * overridden by system properties of the same name.
 */
public record LuxConfig(String prompt, boolean printAst, boolean echoExpressions) {

    public static final String RESOURCE = "lux.properties";

    public static final String PROMPT = "lux.prompt";
    public static final String PRINT_AST = "lux.printAst";
    public static final String ECHO_EXPRESSIONS = "lux.echoExpressions";

    public static LuxConfig defaults() {
        return new LuxConfig("> ", false, true);
    }

    public static LuxConfig load() {
        Properties properties = new Properties();

        try (InputStream stream = LuxConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (stream != null)
                properties.load(stream);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }

        return from(properties, System.getProperties());
    }

    public static LuxConfig from(Properties properties, Properties overrides) {
        LuxConfig defaults = defaults();

        String prompt = lookup(PROMPT, properties, overrides, defaults.prompt());
        boolean printAst = Boolean.parseBoolean(
                lookup(PRINT_AST, properties, overrides, String.valueOf(defaults.printAst())));
        boolean echoExpressions = Boolean.parseBoolean(
                lookup(ECHO_EXPRESSIONS, properties, overrides, String.valueOf(defaults.echoExpressions())));

        return new LuxConfig(prompt, printAst, echoExpressions);
    }

    private static String lookup(String key, Properties properties, Properties overrides, String fallback) {
        String value = overrides.getProperty(key);

        if (value != null)
            return value;

        return properties.getProperty(key, fallback);
    }
}
