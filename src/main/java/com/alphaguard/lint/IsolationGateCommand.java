package com.alphaguard.lint;

import java.io.UncheckedIOException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Build-time isolation gate. Routes to subcommands: alpha-path, allowlist.
 *
 * <p>Exit codes: 0 when every check passes, 1 on any violation, 2 on a usage
 * error or an unreadable tree.
 */
@Command(
        name = "isolation-gate",
        mixinStandardHelpOptions = true,
        version = "alphaguard isolation gate 1.0",
        description = "Checks that alpha code never touches governance and that governance documents stay in bounds",
        subcommands = {
                AlphaPathCommand.class,
                AllowlistCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class IsolationGateCommand implements Runnable {

    public static final int EXIT_PASSED = 0;
    public static final int EXIT_VIOLATIONS = 1;
    public static final int EXIT_USAGE = 2;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // no subcommand given
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
    }

    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new IsolationGateCommand());
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            if (e instanceof UncheckedIOException) {
                cmd.getErr().println(cmd.getColorScheme().errorText(e.getMessage()));
                return EXIT_USAGE;
            }
            throw e;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}
