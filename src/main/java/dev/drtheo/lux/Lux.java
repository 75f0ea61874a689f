package dev.drtheo.lux;

import dev.drtheo.lux.ast.Stmt;
import dev.drtheo.lux.interpreter.Environment;
import dev.drtheo.lux.interpreter.Interpreter;
import dev.drtheo.lux.interpreter.Resolution;
import dev.drtheo.lux.interpreter.Resolver;
import dev.drtheo.lux.lexer.Lexer;
import dev.drtheo.lux.lexer.Token;
import dev.drtheo.lux.parser.Parser;
import dev.drtheo.lux.util.AstPrinter;
import dev.drtheo.lux.util.Diagnostic;
import dev.drtheo.lux.util.ErrorReporter;
import dev.drtheo.lux.util.RuntimeError;
import dev.drtheo.lux.util.Value;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

/**
 * Runs Lux source through the lexer, parser, resolver and interpreter. One
 * instance is one session: its global environment persists across calls to
 * {@link #run} and {@link #evaluate}.
 */
public class Lux {

    private final PrintStream out;
    private final PrintStream err;
    private final LuxConfig config;
    private final Interpreter interpreter;

    public Lux() {
        this(System.out, System.err, LuxConfig.load());
    }

    public Lux(PrintStream out, PrintStream err, LuxConfig config) {
        this(out, err, config, new Environment());
    }

    // globals may be shared with the caller, who can seed or inspect them
    public Lux(PrintStream out, PrintStream err, LuxConfig config, Environment globals) {
        this.out = out;
        this.err = err;
        this.config = config;
        this.interpreter = new Interpreter(globals, out);
    }

    public static void main(String[] args) throws IOException {
        if (args.length > 1) {
            System.out.println("Usage: lux [script]");
            System.exit(64);
            return;
        }

        Lux lux = new Lux();

        if (args.length == 1) {
            RunResult result = lux.runFile(args[0]);
            System.exit(result.exitCode());
        } else {
            lux.runPrompt();
        }
    }

    public RunResult runFile(String path) throws IOException {
        return this.run(Files.readString(Paths.get(path), StandardCharsets.UTF_8));
    }

    public void runPrompt() throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        while (true) {
            out.print(config.prompt());
            out.flush();

            String line = reader.readLine();
            if (line == null)
                break;

            this.evaluate(line);
        }
    }

    public RunResult run(String source) {
        return this.execute(source, false);
    }

    // a lone expression statement has its value printed
    public RunResult evaluate(String source) {
        return this.execute(source, config.echoExpressions());
    }

    private RunResult execute(String source, boolean echo) {
        ErrorReporter reporter = new ErrorReporter();

        List<Token> tokens = new Lexer(source, reporter).scanTokens();
        List<Stmt> statements = new Parser(tokens, reporter).parse();

        if (reporter.hadError())
            return this.fail(reporter);

        if (config.printAst()) {
            AstPrinter printer = new AstPrinter();

            for (Stmt statement : statements) {
                out.println(printer.print(statement));
            }
        }

        Resolution resolution = new Resolver(reporter).resolve(statements);

        if (reporter.hadError())
            return this.fail(reporter);

        try {
            if (echo && statements.size() == 1 && statements.get(0) instanceof Stmt.Expression expression) {
                Object value = interpreter.interpret(expression.expression(), resolution);
                out.println(Value.stringify(value));
            } else {
                interpreter.interpret(statements, resolution);
            }
        } catch (RuntimeError error) {
            reporter.runtimeError(error);
            return this.fail(reporter);
        }

        return RunResult.success();
    }

    private RunResult fail(ErrorReporter reporter) {
        for (Diagnostic diagnostic : reporter.getDiagnostics()) {
            err.println(diagnostic.format());
        }

        return new RunResult(reporter.failure(), reporter.getDiagnostics());
    }
}
