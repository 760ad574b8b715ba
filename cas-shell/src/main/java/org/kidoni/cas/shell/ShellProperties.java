package org.kidoni.cas.shell;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param prompt      printed before each command, followed by a space
 * @param variable    the variable that diff, integrate, solve and plot work with
 * @param interactive whether to read commands from standard input on startup
 */
@ConfigurationProperties("cas.shell")
public record ShellProperties(
        @DefaultValue("cas>") String prompt,
        @DefaultValue("x") String variable,
        @DefaultValue("true") boolean interactive) {
}
