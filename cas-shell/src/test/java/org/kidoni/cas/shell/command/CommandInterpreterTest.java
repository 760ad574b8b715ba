package org.kidoni.cas.shell.command;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kidoni.cas.shell.ShellProperties;
import org.kidoni.cas.shell.plot.PlotProperties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandInterpreterTest {
    private CommandInterpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = new CommandInterpreter(
                new ShellProperties("cas>", "x", false),
                new PlotProperties(-10, 10, -10, 10, 40, 12, true, true, '.', '+', '*', 100, 0.15));
    }

    private static List<String> lines(final String output) {
        return output.lines().toList();
    }

    @Test
    void blankLineProducesNothing() {
        assertEquals("", interpreter.execute("   "));
    }

    @Test
    void exitCommands() {
        assertTrue(interpreter.isExit("quit"));
        assertTrue(interpreter.isExit("  EXIT "));
        assertFalse(interpreter.isExit("quitter"));
    }

    @Test
    void helpListsEveryCommand() {
        String help = interpreter.execute("help");
        for (String command : List.of("parse", "eval", "let", "vars", "diff", "integrate", "simplify", "solve", "factor", "all", "plot", "quit")) {
            assertTrue(help.contains(command), command);
        }
    }

    @Test
    void parseShowsTree() {
        assertEquals("tree: (2 + (3 * 4))", interpreter.execute("parse 2 + 3 * 4"));
    }

    @Test
    void parseErrorReportsOffset() {
        assertEquals("error: unexpected end of input at offset 3", interpreter.execute("parse 2 +"));
    }

    @Test
    void missingExpression() {
        assertEquals("error: an expression is required", interpreter.execute("diff"));
        assertEquals("error: an expression is required", interpreter.execute("plot width:20"));
    }

    @Test
    void evalUsesBindings() {
        assertEquals("14", interpreter.execute("eval 2 + 3 * 4"));
        assertEquals("error: undefined variable: y", interpreter.execute("eval 2y"));
        assertEquals("y = 4", interpreter.execute("let y = 2 * 2"));
        assertEquals("8", interpreter.execute("eval 2y"));
        assertEquals("z = 12", interpreter.execute("let z = 3y"));
        assertEquals(Map.of("y", 4.0, "z", 12.0), interpreter.bindings());
    }

    @Test
    void letRejectsBadNames() {
        assertEquals("error: 'sin' cannot be used as a variable name", interpreter.execute("let sin = 1"));
        assertEquals("error: '2a' cannot be used as a variable name", interpreter.execute("let 2a = 1"));
        assertEquals("error: usage is let <name> = <expr>", interpreter.execute("let a"));
        assertTrue(interpreter.bindings().isEmpty());
    }

    @Test
    void varsListsBindingsInOrder() {
        assertEquals("no variables bound", interpreter.execute("vars"));
        interpreter.execute("let b = 2");
        interpreter.execute("let a = 0.5");
        assertEquals(List.of("a = 0.5", "b = 2"), lines(interpreter.execute("vars")));
    }

    @Test
    void calculus() {
        assertEquals("d/dx = 2x", interpreter.execute("diff x^2"));
        assertEquals("integral dx = -cos(x) + C", interpreter.execute("integrate sin(x)"));
        assertEquals("error: cannot integrate: tan(x)", interpreter.execute("integrate tan(x)"));
    }

    @Test
    void simplifySolveAndFactor() {
        assertEquals("x", interpreter.execute("simplify x + 0"));
        assertEquals("0", interpreter.execute("simplify 0 * (x + y)"));
        assertEquals("error: division by zero", interpreter.execute("simplify x / 0"));
        assertEquals("x = 1.5", interpreter.execute("solve 2*x - 3"));
        assertEquals("factors: x, (x + 1)", interpreter.execute("factor x^2 + x"));
    }

    @Test
    void allShowsEverySection() {
        assertEquals(List.of("expression: (x ^ 2)", "d/dx = 2x", "integral dx = ((x ^ 3) / 3) + C"),
                lines(interpreter.execute("all x^2")));
    }

    @Test
    void allKeepsGoingAfterAFailedSection() {
        List<String> output = lines(interpreter.execute("all x^x"));
        assertEquals(3, output.size());
        assertTrue(output.get(1).startsWith("error: cannot differentiate"), output.get(1));
        assertTrue(output.get(2).startsWith("error: cannot integrate"), output.get(2));
    }

    @Test
    void plotRendersWindowAndSummary() {
        List<String> output = lines(interpreter.execute("plot x xmin:-5 xmax:5 ymin:-5 ymax:5 width:20 height:10"));
        assertEquals(11, output.size());
        assertEquals("x: [-5, 5]  y: [-5, 5]", output.get(10));
        assertTrue(output.get(0).startsWith("*: x"));
    }

    @Test
    void plotFitsYRangeWhenNotGiven() {
        List<String> output = lines(interpreter.execute("plot x^2 xmin:0 xmax:10"));
        assertEquals("x: [0, 10]  y: [-15, 115]", output.get(output.size() - 1));
    }

    @Test
    void plotRejectsBadOptions() {
        assertEquals("error: option width needs a whole number but got 'wide'", interpreter.execute("plot x width:wide"));
        assertTrue(interpreter.execute("plot x xmin:20").startsWith("error: empty plot range"));
    }

    @Test
    void unknownCommand() {
        assertEquals("unknown command 'frobnicate', type 'help' for the list of commands", interpreter.execute("frobnicate x"));
    }
}
