package org.kidoni.cas.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.kidoni.cas.shell.command.CommandInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Read-eval-print loop over standard input. Ends on {@code quit}, {@code exit} or end of input.
 */
@Component
@ConditionalOnProperty(prefix = "cas.shell", name = "interactive", havingValue = "true", matchIfMissing = true)
public class InteractiveShell implements CommandLineRunner {
    private static final Logger LOG = LoggerFactory.getLogger(InteractiveShell.class);

    private final CommandInterpreter interpreter;
    private final ShellProperties properties;

    public InteractiveShell(final CommandInterpreter interpreter, final ShellProperties properties) {
        this.interpreter = interpreter;
        this.properties = properties;
    }

    @Override
    public void run(final String... args) {
        run(System.in, System.out);
    }

    void run(final InputStream input, final PrintStream output) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        output.println("Symbolic algebra shell, type 'help' for commands");
        try {
            String line;
            while (true) {
                output.print(properties.prompt() + " ");
                output.flush();
                line = reader.readLine();
                if (line == null || interpreter.isExit(line)) {
                    break;
                }
                String result = interpreter.execute(line);
                if (!result.isEmpty()) {
                    output.println(result);
                }
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("cannot read commands", e);
        }
        LOG.debug("shell finished");
        output.println();
    }
}
