package org.kidoni.cas.shell.command;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.kidoni.cas.ast.Node;
import org.kidoni.cas.engine.SymbolicEngine;
import org.kidoni.cas.error.CasError;
import org.kidoni.cas.error.Result;
import org.kidoni.cas.op.Functions;
import org.kidoni.cas.op.Numerals;
import org.kidoni.cas.parser.Parser;
import org.kidoni.cas.shell.ShellProperties;
import org.kidoni.cas.shell.plot.ConsoleGrapher;
import org.kidoni.cas.shell.plot.PlotProperties;
import org.kidoni.cas.shell.plot.PlotRequest;
import org.kidoni.cas.shell.plot.PlotSettings;
import org.kidoni.cas.symbolic.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one line of shell input into the text to print. Each command works on a fresh
 * {@link SymbolicEngine}; only the variables bound with {@code let} survive between lines.
 */
@Component
public class CommandInterpreter {
    private static final Logger LOG = LoggerFactory.getLogger(CommandInterpreter.class);

    static final String HELP = String.join(System.lineSeparator(),
            "Commands:",
            "  parse <expr>       show the parsed tree",
            "  eval <expr>        evaluate using the bound variables",
            "  let <name> = <expr> bind a variable",
            "  vars               list bound variables",
            "  diff <expr>        differentiate",
            "  integrate <expr>   integrate",
            "  simplify <expr>    simplify",
            "  solve <expr>       solve <expr> = 0 (linear only)",
            "  factor <expr>      factor (x^2 + x and products only)",
            "  all <expr>         parse, differentiate and integrate",
            "  plot <expr> [xmin:v xmax:v ymin:v ymax:v width:n height:n]",
            "  help               show this text",
            "  quit | exit        leave the shell");

    private final ShellProperties shellProperties;
    private final PlotProperties plotProperties;
    private final Map<String, Double> bindings = new TreeMap<>();

    public CommandInterpreter(final ShellProperties shellProperties, final PlotProperties plotProperties) {
        this.shellProperties = shellProperties;
        this.plotProperties = plotProperties;
    }

    public boolean isExit(final String line) {
        String command = line.trim().toLowerCase(Locale.ROOT);
        return command.equals("quit") || command.equals("exit");
    }

    public Map<String, Double> bindings() {
        return Map.copyOf(bindings);
    }

    public String execute(final String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        int space = trimmed.indexOf(' ');
        String command = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        String arguments = space < 0 ? "" : trimmed.substring(space + 1).trim();
        LOG.debug("command '{}' with arguments '{}'", command, arguments);

        try {
            return switch (command) {
                case "help" -> HELP;
                case "vars" -> vars();
                case "let" -> let(arguments);
                case "parse" -> parse(arguments);
                case "eval" -> withExpression(arguments, this::eval);
                case "diff" -> withExpression(arguments, this::diff);
                case "integrate" -> withExpression(arguments, this::integrate);
                case "simplify" -> withExpression(arguments, this::simplify);
                case "solve" -> withExpression(arguments, this::solve);
                case "factor" -> withExpression(arguments, this::factor);
                case "all" -> withExpression(arguments, this::all);
                case "plot" -> plot(arguments);
                default -> "unknown command '" + command + "', type 'help' for the list of commands";
            };
        }
        catch (IllegalArgumentException e) {
            LOG.debug("rejected '{}'", trimmed, e);
            return "error: " + e.getMessage();
        }
    }

    private String withExpression(final String text, final Function<SymbolicEngine, String> action) {
        if (text.isEmpty()) {
            return "error: an expression is required";
        }
        SymbolicEngine engine = new SymbolicEngine();
        Result<Expr> loaded = engine.parseFromString(text);
        if (loaded instanceof Result.Err<Expr> err) {
            return describe(err.error());
        }
        return action.apply(engine);
    }

    private String parse(final String text) {
        if (text.isEmpty()) {
            return "error: an expression is required";
        }
        Result<Node> tree = Result.of(() -> new Parser(text).parse());
        return render(tree.map(Node::toDisplayString), ast -> "tree: " + ast);
    }

    private String currentText(final SymbolicEngine engine) {
        return engine.toDisplayString().orElseThrow();
    }

    private String eval(final SymbolicEngine engine) {
        return render(engine.evaluate(bindings).map(Numerals::format));
    }

    private String diff(final SymbolicEngine engine) {
        String variable = shellProperties.variable();
        return render(engine.differentiate(variable).map(Expr::simplify).map(Expr::toDisplayString),
                derivative -> "d/d" + variable + " = " + derivative);
    }

    private String integrate(final SymbolicEngine engine) {
        String variable = shellProperties.variable();
        return render(engine.integrate(variable).map(Expr::simplify).map(Expr::toDisplayString),
                integral -> "integral d" + variable + " = " + integral + " + C");
    }

    private String simplify(final SymbolicEngine engine) {
        return render(engine.simplify().map(Expr::toDisplayString));
    }

    private String solve(final SymbolicEngine engine) {
        String variable = shellProperties.variable();
        return render(engine.solve(variable).map(Expr::toDisplayString), root -> variable + " = " + root);
    }

    private String factor(final SymbolicEngine engine) {
        Result<String> factors = engine.factor().map(list -> list.stream()
                .map(Expr::toDisplayString)
                .collect(Collectors.joining(", ")));
        return render(factors, text -> "factors: " + text);
    }

    private String all(final SymbolicEngine engine) {
        return String.join(System.lineSeparator(),
                "expression: " + currentText(engine),
                diff(engine),
                integrate(engine));
    }

    private String let(final String arguments) {
        int equals = arguments.indexOf('=');
        if (equals < 0) {
            return "error: usage is let <name> = <expr>";
        }
        String name = arguments.substring(0, equals).trim();
        if (!name.matches("[A-Za-z_][A-Za-z0-9_]*") || Functions.isKnown(name)) {
            return "error: '" + name + "' cannot be used as a variable name";
        }
        Result<Double> value = SymbolicEngine.parse(arguments.substring(equals + 1).trim())
                .map(expr -> expr.evaluate(bindings));
        if (value instanceof Result.Ok<Double> ok) {
            bindings.put(name, ok.value());
            return name + " = " + Numerals.format(ok.value());
        }
        return describe(value.failure().orElseThrow());
    }

    private String vars() {
        if (bindings.isEmpty()) {
            return "no variables bound";
        }
        return bindings.entrySet().stream()
                .map(entry -> entry.getKey() + " = " + Numerals.format(entry.getValue()))
                .collect(Collectors.joining(System.lineSeparator()));
    }

    private String plot(final String arguments) {
        PlotRequest request = PlotRequest.parse(arguments, plotProperties.toSettings());
        if (request.expression().isEmpty()) {
            return "error: an expression is required";
        }
        Result<Expr> function = SymbolicEngine.parse(request.expression());
        if (function instanceof Result.Err<Expr> err) {
            return describe(err.error());
        }
        Expr expr = function.orElseThrow();
        ConsoleGrapher grapher = new ConsoleGrapher(request.settings(), shellProperties.variable(), bindings);
        grapher.addFunction(expr.toDisplayString(), expr, plotProperties.functionChar());
        if (!request.fixedYRange()) {
            grapher.autoFitY(plotProperties.samples(), plotProperties.padding());
        }
        List<String> lines = grapher.render();
        lines.add(window(grapher.settings()));
        return String.join(System.lineSeparator(), lines);
    }

    private static String window(final PlotSettings settings) {
        return "x: [" + Numerals.format(settings.xMin()) + ", " + Numerals.format(settings.xMax()) + "]"
                + "  y: [" + Numerals.format(settings.yMin()) + ", " + Numerals.format(settings.yMax()) + "]";
    }

    private static String render(final Result<String> result) {
        return render(result, Function.identity());
    }

    private static String render(final Result<String> result, final Function<String, String> onSuccess) {
        if (result instanceof Result.Ok<String> ok) {
            return onSuccess.apply(ok.value());
        }
        return describe(result.failure().orElseThrow());
    }

    static String describe(final CasError error) {
        if (error instanceof CasError.ParseError parseError) {
            return "error: " + parseError.message() + " at offset " + parseError.offset();
        }
        return "error: " + error.message();
    }
}
